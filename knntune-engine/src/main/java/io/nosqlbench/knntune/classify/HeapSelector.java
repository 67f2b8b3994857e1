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

import java.util.Comparator;
import java.util.PriorityQueue;

/// Keeps the `k` nearest candidates in a bounded max-heap whose head is the farthest kept
/// neighbor.
public final class HeapSelector implements NeighborSelector {

    @Override
    public NeighborIndex[] select(int k, Distance distance, SampleStore store, RowIndices training, Sample query) {
        int topK = Math.min(k, training.size());
        if (topK <= 0) {
            return new NeighborIndex[0];
        }

        PriorityQueue<NeighborIndex> heap = new PriorityQueue<>(topK, Comparator.reverseOrder());
        RowCursor cursor = new RowCursor(store);
        for (int i = 0; i < training.size(); i++) {
            int row = training.get(i);
            NeighborIndex candidate = new NeighborIndex(row, distance.distance(query, cursor.moveTo(row)));

            if (heap.size() < topK) {
                heap.offer(candidate);
            } else if (candidate.compareTo(heap.peek()) < 0) {
                heap.poll();
                heap.offer(candidate);
            }
        }

        NeighborIndex[] result = new NeighborIndex[heap.size()];
        for (int i = result.length - 1; i >= 0; i--) {
            result[i] = heap.poll();
        }
        return result;
    }
}
