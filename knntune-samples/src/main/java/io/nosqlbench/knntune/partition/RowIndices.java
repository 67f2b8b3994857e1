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

import java.util.Arrays;
import java.util.stream.IntStream;

/// An immutable list of row indices into a sample store, safe to share between threads.
public final class RowIndices {

    private static final RowIndices EMPTY = new RowIndices(new int[0]);

    private final int[] rows;

    private RowIndices(int[] rows) {
        this.rows = rows;
    }

    /// @param rows the row indices, copied
    /// @return an index list in the given order
    public static RowIndices of(int... rows) {
        for (int row : rows) {
            if (row < 0) {
                throw new IllegalArgumentException("Row index must be non-negative: " + row);
            }
        }
        return rows.length == 0 ? EMPTY : new RowIndices(rows.clone());
    }

    /// @param count the number of rows
    /// @return the indices `0 .. count-1`
    public static RowIndices range(int count) {
        return new RowIndices(IntStream.range(0, count).toArray());
    }

    /// Takes ownership of the array without copying.
    static RowIndices wrap(int[] rows) {
        return rows.length == 0 ? EMPTY : new RowIndices(rows);
    }

    /// @return the number of indices
    public int size() {
        return rows.length;
    }

    /// @return true if there are no indices
    public boolean isEmpty() {
        return rows.length == 0;
    }

    /// @param position a position in this list
    /// @return the row index at that position
    public int get(int position) {
        return rows[position];
    }

    /// @return the indices in order
    public IntStream stream() {
        return Arrays.stream(rows);
    }

    /// @return a copy of the indices
    public int[] toArray() {
        return rows.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowIndices && Arrays.equals(rows, ((RowIndices) o).rows);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rows);
    }

    @Override
    public String toString() {
        if (rows.length <= 10) {
            return Arrays.toString(rows);
        }
        return "[" + rows[0] + ", " + rows[1] + ", ... " + rows[rows.length - 1] + "] (" + rows.length + " rows)";
    }
}
