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

/// Measures every candidate, sorts them all and keeps the first `k`.
public final class FullSortSelector implements NeighborSelector {

    @Override
    public NeighborIndex[] select(int k, Distance distance, SampleStore store, RowIndices training, Sample query) {
        RowCursor cursor = new RowCursor(store);
        NeighborIndex[] all = new NeighborIndex[training.size()];
        for (int i = 0; i < all.length; i++) {
            int row = training.get(i);
            all[i] = new NeighborIndex(row, distance.distance(query, cursor.moveTo(row)));
        }
        Arrays.sort(all);
        return Arrays.copyOf(all, Math.min(k, all.length));
    }
}
