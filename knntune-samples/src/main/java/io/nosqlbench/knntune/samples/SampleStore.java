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

/**
 * A read-only block of labeled feature vectors, addressed by row index.
 *
 * <p>All rows live in one flat sequence of slots with a fixed stride of
 * {@code dimensions() + 1}. Row {@code i} occupies slots {@code [i*stride, i*stride + stride)};
 * the last slot of a row holds the row's label code, an index into {@link #labels()}.
 *
 * <p>A store is never mutated once it has been built, so any number of threads may read it
 * without synchronization. {@link KnownSample} and its subclasses are views which hold only a
 * row index and a reference to the store.
 */
public interface SampleStore {

    /**
     * @return the schema the rows were loaded with
     */
    SampleSchema schema();

    /**
     * @return the number of rows
     */
    int size();

    /**
     * @return the number of features in each row
     */
    default int dimensions() {
        return schema().dimensions();
    }

    /**
     * @return the number of slots occupied by each row
     */
    default int stride() {
        return dimensions() + 1;
    }

    /**
     * Read one feature value without allocating.
     *
     * @param row    the row index
     * @param column the feature position
     * @return the feature value
     */
    double feature(int row, int column);

    /**
     * @param row the row index
     * @return the position of the row's label in {@link #labels()}
     */
    int labelCode(int row);

    /**
     * @return the distinct labels, in the order they were first seen during load
     */
    List<String> labels();

    /**
     * @param row the row index
     * @return the label of the row
     */
    default String label(int row) {
        return labels().get(labelCode(row));
    }

    /**
     * @param row the row index
     * @return a copy of the row's feature values
     */
    default double[] features(int row) {
        double[] values = new double[dimensions()];
        for (int i = 0; i < values.length; i++) {
            values[i] = feature(row, i);
        }
        return values;
    }

    /**
     * @param row the row index
     * @return a flyweight view of the row
     */
    default KnownSample row(int row) {
        return new KnownSample(this, row);
    }

    /**
     * Make an independent on-heap copy of this store. The copy shares nothing with this store,
     * so it stays readable after this store has been released.
     *
     * @return a heap-backed copy
     */
    SampleStore copy();
}
