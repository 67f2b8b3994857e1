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

import io.nosqlbench.knntune.samples.Sample;
import io.nosqlbench.knntune.samples.SampleStore;

/// A movable view over one store row at a time, so a scan of the training pool reads features in
/// place without creating a view per row. Confined to the thread that owns it.
final class RowCursor implements Sample {

    private final SampleStore store;
    private int row;

    RowCursor(SampleStore store) {
        this.store = store;
    }

    RowCursor moveTo(int row) {
        this.row = row;
        return this;
    }

    @Override
    public int dimensions() {
        return store.dimensions();
    }

    @Override
    public double feature(int index) {
        return store.feature(row, index);
    }
}
