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

package io.nosqlbench.knntune.samples;

import java.util.Objects;

/// A labeled sample, viewed through a row of a [SampleStore]. The view holds only the row
/// index and the store reference; feature values are read from the store on demand.
public class KnownSample implements Sample {

    private final SampleStore store;
    private final int row;

    public KnownSample(SampleStore store, int row) {
        this.store = Objects.requireNonNull(store, "store");
        this.row = Objects.checkIndex(row, store.size());
    }

    /// @return the store this view reads from
    public SampleStore store() {
        return store;
    }

    /// @return the row index within the store
    public int row() {
        return row;
    }

    /// @return the label of this sample
    public String label() {
        return store.label(row);
    }

    @Override
    public int dimensions() {
        return store.dimensions();
    }

    @Override
    public double feature(int index) {
        return store.feature(row, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KnownSample that = (KnownSample) o;
        return row == that.row && store == that.store;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(store), row);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(row=" + row + ", features=" + SampleFormat.features(this)
            + ", label='" + label() + "')";
    }
}
