/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.knntune.tuning;

import io.nosqlbench.knntune.classify.SelectionStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for a {@link GridSearchTuner}.
 *
 * <pre>{@code
 * TunerConfig config = TunerConfig.builder()
 *     .threads(8)
 *     .shareMode(ShareMode.SHARED)
 *     .strategy(SelectionStrategy.HEAP)
 *     .build();
 * }</pre>
 */
public final class TunerConfig {

    private final int threads;
    private final ShareMode shareMode;
    private final SelectionStrategy strategy;
    private final Duration shutdownTimeout;

    private TunerConfig(Builder builder) {
        this.threads = builder.threads;
        this.shareMode = builder.shareMode;
        this.strategy = builder.strategy;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default configuration, one worker per available processor
     */
    public static TunerConfig defaults() {
        return builder().build();
    }

    public int getThreads() {
        return threads;
    }

    public ShareMode getShareMode() {
        return shareMode;
    }

    public SelectionStrategy getStrategy() {
        return strategy;
    }

    /**
     * @return how long an interrupted tuner waits for its workers to exit
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "TunerConfig{threads=" + threads + ", shareMode=" + shareMode + ", strategy=" + strategy + "}";
    }

    /**
     * Builder for {@link TunerConfig}.
     */
    public static final class Builder {
        private int threads = Runtime.getRuntime().availableProcessors();
        private ShareMode shareMode = ShareMode.SHARED;
        private SelectionStrategy strategy = SelectionStrategy.HEAP;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * @param threads the worker pool size, at least 1
         * @return this builder
         */
        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder shareMode(ShareMode shareMode) {
            this.shareMode = Objects.requireNonNull(shareMode, "shareMode");
            return this;
        }

        public Builder strategy(SelectionStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("Shutdown timeout must not be negative: " + shutdownTimeout);
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public TunerConfig build() {
            return new TunerConfig(this);
        }
    }
}
