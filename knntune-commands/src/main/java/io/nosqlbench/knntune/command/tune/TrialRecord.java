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

package io.nosqlbench.knntune.command.tune;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.nosqlbench.knntune.tuning.TrialResult;

/// The JSON form of one trial result.
///
/// @param k the neighbor count
/// @param metric the metric name
/// @param strategy the neighbor selection strategy
/// @param quality the fraction classified correctly, absent for failed trials
/// @param elapsedMillis the time spent testing, in fractional milliseconds
/// @param error the failure message, absent for successful trials
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrialRecord(
    @JsonProperty("k") int k,
    @JsonProperty("metric") String metric,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("quality") Double quality,
    @JsonProperty("elapsed_ms") double elapsedMillis,
    @JsonProperty("error") String error
) {

    /// @param result a trial result
    /// @return its JSON form
    public static TrialRecord of(TrialResult result) {
        return new TrialRecord(
            result.k(),
            result.metric(),
            result.strategy().name(),
            result.failed() ? null : result.quality(),
            result.elapsedMillis(),
            result.failed() ? result.failure().getMessage() : null
        );
    }
}
