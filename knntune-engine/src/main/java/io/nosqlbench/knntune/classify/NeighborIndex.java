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

/// A candidate neighbor: the row index of a training sample and its distance from the query.
///
/// Neighbors are ordered by distance and then by row index, so two neighbors at the same distance
/// still have a fixed order and every selection strategy picks the same set.
public final class NeighborIndex implements Comparable<NeighborIndex> {
    /// the row of the neighbor in the sample store
    private final int row;
    /// the distance of the neighbor
    private final double distance;

    public NeighborIndex(int row, double distance) {
        this.row = row;
        this.distance = distance;
    }

    /// @return the row of the neighbor in the sample store
    public int row() {
        return row;
    }

    /// @return the distance of the neighbor
    public double distance() {
        return distance;
    }

    @Override
    public int compareTo(NeighborIndex o) {
        int byDistance = Double.compare(distance, o.distance);
        return byDistance != 0 ? byDistance : Integer.compare(row, o.row);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NeighborIndex)) {
            return false;
        }
        NeighborIndex that = (NeighborIndex) o;
        return row == that.row && Double.compare(distance, that.distance) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * row + Double.hashCode(distance);
    }

    @Override
    public String toString() {
        return "(" + row + "," + String.format("%.3f", distance) + ")";
    }
}
