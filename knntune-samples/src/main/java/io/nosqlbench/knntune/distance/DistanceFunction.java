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

/// The fixed family of distance functions used for k-NN tuning
public enum DistanceFunction implements Distance {

    /// The Euclidean (L2) distance function, Minkowski with m=2 and a sum
    EUCLIDEAN,
    /// The Manhattan (L1, cityblock) distance function, Minkowski with m=1 and a sum
    MANHATTAN,
    /// The Chebyshev (L-infinity) distance function, Minkowski with m=1 and a max
    CHEBYSHEV,
    /// The Sørensen distance function, the L1 difference over the L1 sum
    SORENSEN;

    /// compute the distance between two samples
    /// @param a the first sample
    /// @param b the second sample
    /// @return the distance between the two samples
    @Override
    public double distance(Sample a, Sample b) {
        Distance.requireSameDimensions(a, b);
        switch (this) {
            case EUCLIDEAN:
                return euclideanDistance(a, b);
            case MANHATTAN:
                return manhattanDistance(a, b);
            case CHEBYSHEV:
                return chebyshevDistance(a, b);
            case SORENSEN:
                return sorensenDistance(a, b);
            default:
                throw new IllegalArgumentException("Unknown distance function: " + this);
        }
    }

    /// Resolve a metric by name. Accepts the enum names in any case, the aliases `L2`, `L1`,
    /// `cityblock` and `LINF`, and the generalized form `minkowski:<m>[:sum|max]`.
    /// @param name the metric name
    /// @return the matching distance
    /// @throws IllegalArgumentException if the name matches no metric
    public static Distance fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Distance name cannot be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("MINKOWSKI")) {
            return parseMinkowski(name.trim());
        }
        switch (normalized) {
            case "L2":
            case "ED":
                return EUCLIDEAN;
            case "L1":
            case "MD":
            case "CITYBLOCK":
                return MANHATTAN;
            case "LINF":
            case "CD":
                return CHEBYSHEV;
            case "SD":
            case "SOERENSEN":
                return SORENSEN;
            default:
                try {
                    return valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown distance function: " + name, e);
                }
        }
    }

    private static Minkowski parseMinkowski(String spec) {
        String[] parts = spec.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException(
                "Invalid Minkowski distance: " + spec + ". Expected: minkowski:<m>[:sum|max]");
        }
        int m;
        try {
            m = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid Minkowski exponent in " + spec, e);
        }
        Minkowski.Reduction reduction = Minkowski.Reduction.SUM;
        if (parts.length == 3) {
            try {
                reduction = Minkowski.Reduction.valueOf(parts[2].trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid Minkowski reduction in " + spec, e);
            }
        }
        return new Minkowski(m, reduction);
    }

    private static double euclideanDistance(Sample a, Sample b) {
        double sum = 0.0;
        for (int i = 0; i < a.dimensions(); i++) {
            double diff = a.feature(i) - b.feature(i);
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static double manhattanDistance(Sample a, Sample b) {
        double sum = 0.0;
        for (int i = 0; i < a.dimensions(); i++) {
            sum += Math.abs(a.feature(i) - b.feature(i));
        }
        return sum;
    }

    private static double chebyshevDistance(Sample a, Sample b) {
        double max = 0.0;
        for (int i = 0; i < a.dimensions(); i++) {
            max = Math.max(max, Math.abs(a.feature(i) - b.feature(i)));
        }
        return max;
    }

    private static double sorensenDistance(Sample a, Sample b) {
        double difference = 0.0;
        double total = 0.0;
        for (int i = 0; i < a.dimensions(); i++) {
            double x = a.feature(i);
            double y = b.feature(i);
            difference += Math.abs(x - y);
            total += Math.abs(x) + Math.abs(y);
        }
        // both samples all-zero
        if (total == 0.0) {
            return 0.0;
        }
        return difference / total;
    }
}
