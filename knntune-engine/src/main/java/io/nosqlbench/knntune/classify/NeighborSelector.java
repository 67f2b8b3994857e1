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

package io.nosqlbench.knntune.classify;

import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.RowIndices;
import io.nosqlbench.knntune.samples.Sample;
import io.nosqlbench.knntune.samples.SampleStore;

/// Finds the `k` training rows nearest to a query.
///
/// Implementations differ only in cost. For the same inputs they return the same neighbors in
/// the same order, nearest first, ordered as [NeighborIndex#compareTo] defines.
public interface NeighborSelector {

    /// @param k how many neighbors to keep, between 1 and `training.size()`
    /// @param distance the metric
    /// @param store the store holding the training rows
    /// @param training the candidate rows
    /// @param query the sample to measure from
    /// @return the `k` nearest rows, nearest first
    NeighborIndex[] select(int k, Distance distance, SampleStore store, RowIndices training, Sample query);
}
