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

import java.util.function.IntPredicate;

/// Decides, row by row, whether a sample is held out for testing.
///
/// A rule must be deterministic: the same store and row always give the same answer.
@FunctionalInterface
public interface PartitionRule {

    /// The default split, every fifth row tested
    int DEFAULT_NTH = 5;
    /// The default number of hash buckets
    int DEFAULT_BUCKETS = 60;

    /// @param store the store being partitioned
    /// @param row the row index
    /// @return true if the row belongs to the testing set
    boolean isTesting(SampleStore store, int row);

    /// Row `i` is a testing row when `i % n == 0`.
    /// @param n the modulus, at least 2
    /// @return an index-based rule
    static PartitionRule everyNth(int n) {
        if (n < 2) {
            throw new IllegalArgumentException("every-nth modulus must be at least 2: " + n);
        }
        return new PartitionRule() {
            @Override
            public boolean isTesting(SampleStore store, int row) {
                return row % n == 0;
            }

            @Override
            public String toString() {
                return "every-nth:" + n;
            }
        };
    }

    /// Hash the row's features and label into `buckets` buckets and test the buckets selected by
    /// `testingBucket`. Rows with equal content always land in the same bucket.
    /// @param buckets the number of buckets, at least 2
    /// @param testingBucket selects the testing buckets
    /// @return a content-based rule
    static PartitionRule hashed(int buckets, IntPredicate testingBucket) {
        if (buckets < 2) {
            throw new IllegalArgumentException("bucket count must be at least 2: " + buckets);
        }
        return new PartitionRule() {
            @Override
            public boolean isTesting(SampleStore store, int row) {
                return testingBucket.test(Math.floorMod(contentHash(store, row), buckets));
            }

            @Override
            public String toString() {
                return "hash:" + buckets;
            }
        };
    }

    /// As [#hashed(int, IntPredicate)], testing every bucket divisible by five.
    /// @param buckets the number of buckets
    /// @return a content-based rule
    static PartitionRule hashed(int buckets) {
        return hashed(buckets, bucket -> bucket % 5 == 0);
    }

    /// Test each row with probability `testingFraction`. The draw for a row depends only on the
    /// seed and the row index, so every caller with the same seed sees the same split.
    /// @param seed the shuffle seed
    /// @param testingFraction the expected testing fraction, in (0, 1)
    /// @return a seeded rule
    static PartitionRule shuffled(long seed, double testingFraction) {
        if (!(testingFraction > 0.0d && testingFraction < 1.0d)) {
            throw new IllegalArgumentException("testing fraction must be in (0, 1): " + testingFraction);
        }
        return new PartitionRule() {
            @Override
            public boolean isTesting(SampleStore store, int row) {
                long mixed = splitMix64(seed + row);
                double unit = (mixed >>> 11) * 0x1.0p-53;
                return unit < testingFraction;
            }

            @Override
            public String toString() {
                return "shuffled:" + seed;
            }
        };
    }

    /// @param store the store
    /// @param row the row index
    /// @return a hash of the row's feature values and label, stable across runs
    static int contentHash(SampleStore store, int row) {
        int h = 17;
        for (int i = 0; i < store.dimensions(); i++) {
            h = 31 * h + Double.hashCode(store.feature(row, i));
        }
        return 31 * h + store.label(row).hashCode();
    }

    private static long splitMix64(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
