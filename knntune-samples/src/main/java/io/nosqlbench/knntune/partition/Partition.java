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

package io.nosqlbench.knntune.partition;

import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.TestingKnownSample;
import io.nosqlbench.knntune.samples.TrainingKnownSample;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// One split of a store's rows into a training pool and a held-out testing set.
///
/// @param training the training row indices
/// @param testing the testing row indices
public record Partition(RowIndices training, RowIndices testing) {

    public Partition {
        Objects.requireNonNull(training, "training");
        Objects.requireNonNull(testing, "testing");
    }

    /// @param store the store the indices refer to
    /// @return training views over the store
    public List<TrainingKnownSample> trainingSamples(SampleStore store) {
        return training.stream().mapToObj(row -> new TrainingKnownSample(store, row)).collect(Collectors.toList());
    }

    /// @param store the store the indices refer to
    /// @return fresh testing views over the store, with no classification assigned
    public List<TestingKnownSample> testingSamples(SampleStore store) {
        return testing.stream().mapToObj(row -> new TestingKnownSample(store, row)).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Partition{training=" + training.size() + ", testing=" + testing.size() + "}";
    }
}
