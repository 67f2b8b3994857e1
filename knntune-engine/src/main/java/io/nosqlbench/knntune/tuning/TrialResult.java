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
import io.nosqlbench.knntune.distance.Distance;

import java.util.Comparator;
import java.util.Objects;

/// The outcome of one trial: the quality reached by a neighbor count and metric, or the error
/// which stopped it.
///
/// @param k the neighbor count
/// @param distance the metric
/// @param strategy the neighbor selection strategy
/// @param quality the fraction of testing samples classified correctly, `NaN` when failed
/// @param elapsedMillis the time spent testing, in fractional milliseconds
/// @param failure the error, or null on success
public record TrialResult(int k, Distance distance, SelectionStrategy strategy, double quality,
                          double elapsedMillis, WorkerFailureException failure) {

    /// Best quality first, failures last, then by metric name and `k` so equal qualities keep a
    /// stable order.
    public static final Comparator<TrialResult> BY_QUALITY =
        Comparator.comparing(TrialResult::failed)
            .thenComparing(Comparator.comparingDouble(TrialResult::sortQuality).reversed())
            .thenComparing(TrialResult::metric)
            .thenComparingInt(TrialResult::k);

    public TrialResult {
        Objects.requireNonNull(distance, "distance");
        Objects.requireNonNull(strategy, "strategy");
    }

    public static TrialResult success(int k, Distance distance, SelectionStrategy strategy, double quality,
                                      double elapsedMillis) {
        return new TrialResult(k, distance, strategy, quality, elapsedMillis, null);
    }

    public static TrialResult failure(int k, Distance distance, SelectionStrategy strategy,
                                      WorkerFailureException failure) {
        return new TrialResult(k, distance, strategy, Double.NaN, 0.0d, Objects.requireNonNull(failure, "failure"));
    }

    /// @return the metric name
    public String metric() {
        return distance.name();
    }

    /// @return true if the trial raised an error
    public boolean failed() {
        return failure != null;
    }

    private double sortQuality() {
        return failed() ? -1.0d : quality;
    }

    @Override
    public String toString() {
        if (failed()) {
            return "TrialResult{k=" + k + ", metric=" + metric() + ", failed=" + failure.getMessage() + "}";
        }
        return String.format("TrialResult{k=%d, metric=%s, strategy=%s, quality=%.4f, elapsed=%.3fms}",
            k, metric(), strategy, quality, elapsedMillis);
    }
}
