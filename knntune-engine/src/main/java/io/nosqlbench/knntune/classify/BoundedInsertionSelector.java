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

import java.util.Arrays;
import java.util.Comparator;

/// Keeps a sorted buffer of `k` slots, initially filled with placeholders at infinite distance.
/// A candidate no nearer than the last slot is discarded; otherwise it is inserted at its
/// binary-searched position and the last slot falls off.
///
/// Placeholders sort after every real candidate, including one at a `NaN` distance, so the buffer
/// never hands a placeholder back while training rows remain.
public final class BoundedInsertionSelector implements NeighborSelector {

    private static final NeighborIndex PLACEHOLDER = new NeighborIndex(Integer.MAX_VALUE, Double.POSITIVE_INFINITY);

    private static final Comparator<NeighborIndex> SLOT_ORDER = (a, b) -> {
        if (a == PLACEHOLDER || b == PLACEHOLDER) {
            return Boolean.compare(a == PLACEHOLDER, b == PLACEHOLDER);
        }
        return a.compareTo(b);
    };

    @Override
    public NeighborIndex[] select(int k, Distance distance, SampleStore store, RowIndices training, Sample query) {
        int slots = Math.min(k, training.size());
        NeighborIndex[] buffer = new NeighborIndex[slots];
        Arrays.fill(buffer, PLACEHOLDER);
        if (slots == 0) {
            return buffer;
        }
        RowCursor cursor = new RowCursor(store);
        for (int i = 0; i < training.size(); i++) {
            int row = training.get(i);
            NeighborIndex candidate = new NeighborIndex(row, distance.distance(query, cursor.moveTo(row)));
            if (SLOT_ORDER.compare(candidate, buffer[slots - 1]) >= 0) {
                continue;
            }
            int position = Arrays.binarySearch(buffer, candidate, SLOT_ORDER);
            // rows are unique, so the candidate is never found
            int insertAt = -position - 1;
            System.arraycopy(buffer, insertAt, buffer, insertAt + 1, slots - insertAt - 1);
            buffer[insertAt] = candidate;
        }
        return buffer;
    }
}
