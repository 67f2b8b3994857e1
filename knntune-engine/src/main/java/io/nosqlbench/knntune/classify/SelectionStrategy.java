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

/// The available neighbor selection algorithms. All of them select the same neighbors.
public enum SelectionStrategy {
    /// sort every candidate, `O(n log n)`
    FULL_SORT(new FullSortSelector()),
    /// sorted buffer of `k` slots with binary insertion, `O(n log k)` comparisons
    BOUNDED_INSERTION(new BoundedInsertionSelector()),
    /// bounded max-heap, `O(n log k)`
    HEAP(new HeapSelector());

    private final NeighborSelector selector;

    SelectionStrategy(NeighborSelector selector) {
        this.selector = selector;
    }

    /// @return the stateless selector implementing this strategy
    public NeighborSelector selector() {
        return selector;
    }
}
