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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// Splits the rows of a store into training and testing index lists in one linear pass.
public final class Partitioner {
    private static final Logger logger = LogManager.getLogger(Partitioner.class);

    private Partitioner() {
    }

    /// @param store the store to split
    /// @param rule decides which rows are tested
    /// @return a partition in which every row appears in exactly one list, in ascending order
    public static Partition partition(SampleStore store, PartitionRule rule) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(rule, "rule");
        int size = store.size();
        int[] training = new int[size];
        int[] testing = new int[size];
        int trainingCount = 0;
        int testingCount = 0;
        for (int row = 0; row < size; row++) {
            if (rule.isTesting(store, row)) {
                testing[testingCount++] = row;
            } else {
                training[trainingCount++] = row;
            }
        }
        Partition partition = new Partition(
            RowIndices.wrap(Arrays.copyOf(training, trainingCount)),
            RowIndices.wrap(Arrays.copyOf(testing, testingCount))
        );
        logger.debug("Partitioned {} rows with {}: {} training, {} testing", size, rule, trainingCount, testingCount);
        if (testingCount == 0) {
            logger.warn("Partition rule {} selected no testing rows out of {}", rule, size);
        }
        return partition;
    }
}
