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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Accumulates validated rows into the flat slot layout shared by all [SampleStore]
/// implementations, assigning label codes in first-seen order.
final class SlotWriter {

    private final SampleSchema schema;
    private final int stride;
    private final Map<String, Integer> labelCodes = new LinkedHashMap<>();
    private double[] slots;
    private int rows;

    SlotWriter(SampleSchema schema, int expectedRows) {
        this.schema = schema;
        this.stride = schema.dimensions() + 1;
        this.slots = new double[Math.max(1, expectedRows) * stride];
    }

    void append(double[] features, String label) {
        if (features.length != stride - 1) {
            throw new IllegalArgumentException(
                "Expected " + (stride - 1) + " features but got " + features.length);
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label must be non-empty");
        }
        int needed = (rows + 1) * stride;
        if (needed > slots.length) {
            slots = Arrays.copyOf(slots, Math.max(needed, slots.length * 2));
        }
        int base = rows * stride;
        System.arraycopy(features, 0, slots, base, features.length);
        Integer code = labelCodes.computeIfAbsent(label, l -> labelCodes.size());
        slots[base + stride - 1] = code;
        rows++;
    }

    int rows() {
        return rows;
    }

    HeapSampleStore toHeapStore() {
        return new HeapSampleStore(schema, Arrays.copyOf(slots, rows * stride), labels());
    }

    MappedSampleStore toMappedStore(Path directory) throws IOException {
        return MappedSampleStore.create(schema, Arrays.copyOf(slots, rows * stride), labels(), directory);
    }

    private List<String> labels() {
        return new ArrayList<>(labelCodes.keySet());
    }
}
