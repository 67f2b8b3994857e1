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

package io.nosqlbench.knntune.distance;

import io.nosqlbench.knntune.samples.Sample;

import java.util.Locale;
import java.util.Objects;

/// The generalized Minkowski distance `reduce(|a_i - b_i|^m)^(1/m)`.
///
/// With [Reduction#SUM], `m = 1` is the Manhattan distance and `m = 2` the Euclidean distance.
/// With [Reduction#MAX] and `m = 1` it is the Chebyshev distance.
public final class Minkowski implements Distance {

    /// How the per-feature terms are combined
    public enum Reduction {
        SUM,
        MAX
    }

    private final int m;
    private final Reduction reduction;

    /// @param m the exponent, at least 1
    /// @param reduction how the per-feature terms are combined
    public Minkowski(int m, Reduction reduction) {
        if (m < 1) {
            throw new IllegalArgumentException("Minkowski exponent must be at least 1: " + m);
        }
        this.m = m;
        this.reduction = Objects.requireNonNull(reduction, "reduction");
    }

    /// @return the exponent
    public int m() {
        return m;
    }

    /// @return how the per-feature terms are combined
    public Reduction reduction() {
        return reduction;
    }

    @Override
    public double distance(Sample a, Sample b) {
        Distance.requireSameDimensions(a, b);
        double reduced = 0.0d;
        for (int i = 0; i < a.dimensions(); i++) {
            double term = power(Math.abs(a.feature(i) - b.feature(i)));
            reduced = reduction == Reduction.SUM ? reduced + term : Math.max(reduced, term);
        }
        return root(reduced);
    }

    private double power(double value) {
        switch (m) {
            case 1:
                return value;
            case 2:
                return value * value;
            default:
                return Math.pow(value, m);
        }
    }

    private double root(double value) {
        switch (m) {
            case 1:
                return value;
            case 2:
                return Math.sqrt(value);
            default:
                return Math.pow(value, 1.0d / m);
        }
    }

    /// @return the name in the form accepted by [DistanceFunction#fromName], e.g. `minkowski:3:sum`
    @Override
    public String name() {
        return "minkowski:" + m + ":" + reduction.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Minkowski)) {
            return false;
        }
        Minkowski that = (Minkowski) o;
        return m == that.m && reduction == that.reduction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(m, reduction);
    }

    @Override
    public String toString() {
        return name();
    }
}
