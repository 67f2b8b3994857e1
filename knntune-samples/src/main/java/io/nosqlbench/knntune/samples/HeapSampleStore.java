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

import java.util.List;
import java.util.Objects;

/// A [SampleStore] backed by a single on-heap `double[]` arena.
public final class HeapSampleStore implements SampleStore {

    private final SampleSchema schema;
    private final double[] slots;
    private final List<String> labels;
    private final int stride;
    private final int size;

    /// Wrap an arena of slots. The array is taken as-is and must not be modified afterward.
    /// @param schema the schema of the rows
    /// @param slots the row slots, `stride` values per row
    /// @param labels the label dictionary the label codes refer to
    HeapSampleStore(SampleSchema schema, double[] slots, List<String> labels) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.labels = List.copyOf(labels);
        this.stride = schema.dimensions() + 1;
        if (slots.length % stride != 0) {
            throw new IllegalArgumentException(
                "Slot count " + slots.length + " is not a multiple of the row stride " + stride);
        }
        this.size = slots.length / stride;
    }

    /// Build a store from rows of feature values and their labels. Mostly useful for tests and
    /// for callers which already hold decoded samples.
    /// @param schema the schema of the rows
    /// @param features one array of feature values per row
    /// @param rowLabels one label per row
    /// @return a heap store holding a copy of the given rows
    public static HeapSampleStore of(SampleSchema schema, double[][] features, String[] rowLabels) {
        if (features.length != rowLabels.length) {
            throw new IllegalArgumentException(
                "Got " + features.length + " feature rows but " + rowLabels.length + " labels");
        }
        SlotWriter writer = new SlotWriter(schema, features.length);
        for (int row = 0; row < features.length; row++) {
            writer.append(features[row], rowLabels[row]);
        }
        return writer.toHeapStore();
    }

    @Override
    public SampleSchema schema() {
        return schema;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public double feature(int row, int column) {
        Objects.checkIndex(row, size);
        Objects.checkIndex(column, stride - 1);
        return slots[row * stride + column];
    }

    @Override
    public int labelCode(int row) {
        Objects.checkIndex(row, size);
        return (int) slots[row * stride + stride - 1];
    }

    @Override
    public List<String> labels() {
        return labels;
    }

    @Override
    public SampleStore copy() {
        return new HeapSampleStore(schema, slots.clone(), labels);
    }

    @Override
    public String toString() {
        return "HeapSampleStore{rows=" + size + ", dimensions=" + (stride - 1) + ", labels=" + labels + "}";
    }
}
