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

/// A dissimilarity measure between two samples of the same dimension.
///
/// Implementations are pure and stateless: symmetric, non-negative, and zero for two samples
/// with equal features. [DistanceFunction] covers the fixed metric family; [Minkowski] covers
/// the generalized form.
public interface Distance {

    /// compute the distance between two samples
    /// @param a the first sample
    /// @param b the second sample
    /// @return the distance between the two samples
    /// @throws IllegalArgumentException if the samples differ in dimension
    double distance(Sample a, Sample b);

    /// @return the metric name used in results and on the command line
    String name();

    /// @param a the first sample
    /// @param b the second sample
    /// @throws IllegalArgumentException if either is null or the dimensions differ
    static void requireSameDimensions(Sample a, Sample b) {
        if (a == null || b == null || a.dimensions() != b.dimensions()) {
            throw new IllegalArgumentException("Samples must be non-null and of the same dimension.");
        }
    }
}
