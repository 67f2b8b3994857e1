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

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/// Running totals over every trial a [GridSearchTuner] has scheduled, across all of its runs.
///
/// Each submitted trial ends in exactly one [Outcome]. Scored trials also feed the best quality
/// seen and the total time spent testing.
public final class TuningStatistics {

    /// How a submitted trial ended.
    public enum Outcome {
        /// the trial classified its testing rows and produced a quality
        SCORED,
        /// the trial raised an error and was recorded as a failed result
        FAILED,
        /// the run was interrupted before the trial was collected
        CANCELLED
    }

    private final LongAdder submitted = new LongAdder();
    private final Map<Outcome, LongAdder> outcomes = new EnumMap<>(Outcome.class);
    private final DoubleAccumulator bestQuality = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);
    private final DoubleAdder testingMillis = new DoubleAdder();

    TuningStatistics() {
        for (Outcome outcome : Outcome.values()) {
            outcomes.put(outcome, new LongAdder());
        }
    }

    public long getSubmitted() {
        return submitted.sum();
    }

    /// @param outcome a trial outcome
    /// @return how many trials ended that way
    public long count(Outcome outcome) {
        return outcomes.get(outcome).sum();
    }

    /// @return true if any trial raised an error
    public boolean hasFailures() {
        return count(Outcome.FAILED) > 0;
    }

    /// @return true once every submitted trial has an outcome
    public boolean isSettled() {
        long ended = 0;
        for (LongAdder adder : outcomes.values()) {
            ended += adder.sum();
        }
        return ended == submitted.sum();
    }

    /// @return the highest quality any scored trial reached, empty before the first one
    public OptionalDouble getBestQuality() {
        double best = bestQuality.get();
        return best == Double.NEGATIVE_INFINITY ? OptionalDouble.empty() : OptionalDouble.of(best);
    }

    /// @return the summed testing time of all scored trials, in milliseconds
    public double getTestingMillis() {
        return testingMillis.sum();
    }

    void trialSubmitted() {
        submitted.increment();
    }

    void trialCollected(TrialResult result) {
        if (result.failed()) {
            outcomes.get(Outcome.FAILED).increment();
            return;
        }
        outcomes.get(Outcome.SCORED).increment();
        bestQuality.accumulate(result.quality());
        testingMillis.add(result.elapsedMillis());
    }

    void trialCancelled() {
        outcomes.get(Outcome.CANCELLED).increment();
    }

    @Override
    public String toString() {
        String best = getBestQuality().isPresent()
            ? String.format(Locale.ROOT, "%.4f", getBestQuality().getAsDouble()) : "none";
        return String.format(Locale.ROOT, "%d trials: %d scored, %d failed, %d cancelled, best quality %s, %.3fms testing",
            getSubmitted(), count(Outcome.SCORED), count(Outcome.FAILED), count(Outcome.CANCELLED), best,
            getTestingMillis());
    }
}
