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

import java.util.Arrays;

/// An unlabeled sample submitted for classification. Unlike the store views, it owns its
/// feature values.
public final class UnknownSample implements Sample {

    private final double[] features;

    private UnknownSample(double[] features) {
        if (features.length == 0) {
            throw new IllegalArgumentException("A sample needs at least one feature");
        }
        for (int i = 0; i < features.length; i++) {
            if (!Double.isFinite(features[i])) {
                throw new IllegalArgumentException("Feature " + i + " is not a finite number: " + features[i]);
            }
        }
        this.features = features;
    }

    /// @param features the feature values, copied
    /// @return a new unknown sample
    /// @throws IllegalArgumentException if there are no features or any is NaN or infinite
    public static UnknownSample of(double... features) {
        return new UnknownSample(features.clone());
    }

    @Override
    public int dimensions() {
        return features.length;
    }

    @Override
    public double feature(int index) {
        return features[index];
    }

    @Override
    public double[] features() {
        return features.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnknownSample && Arrays.equals(features, ((UnknownSample) o).features);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(features);
    }

    @Override
    public String toString() {
        return "UnknownSample(features=" + Arrays.toString(features) + ")";
    }
}
