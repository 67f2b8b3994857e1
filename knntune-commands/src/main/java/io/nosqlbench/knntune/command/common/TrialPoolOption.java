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

package io.nosqlbench.knntune.command.common;

import picocli.CommandLine;

/**
 * Sizes the worker pool that runs tuning trials. Without either option trials run one at a time.
 */
public class TrialPoolOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Run trials on all but one of the available cores"
    )
    private boolean parallel;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Run trials on exactly this many workers; overrides --parallel"
    )
    private Integer threads;

    /**
     * @return the number of trial workers
     * @throws IllegalArgumentException if {@code --threads} is below 1
     */
    public int getWorkers() {
        if (threads != null) {
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1, got " + threads);
            }
            return threads;
        }
        return parallel ? Math.max(1, cores() - 1) : 1;
    }

    /**
     * @return true if {@code --threads} asks for more workers than there are cores
     */
    public boolean isOversubscribed() {
        return threads != null && threads > cores();
    }

    private static int cores() {
        return Runtime.getRuntime().availableProcessors();
    }
}
