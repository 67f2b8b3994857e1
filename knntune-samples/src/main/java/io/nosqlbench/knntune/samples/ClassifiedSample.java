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
import java.util.Objects;

/// The features of an [UnknownSample] together with the label a classifier assigned to it.
public final class ClassifiedSample implements Sample {

    private final double[] features;
    private final String classification;

    public ClassifiedSample(UnknownSample unknown, String classification) {
        this.features = unknown.features();
        this.classification = Objects.requireNonNull(classification, "classification");
    }

    /// @return the assigned label
    public String classification() {
        return classification;
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
    public String toString() {
        return "ClassifiedSample(features=" + Arrays.toString(features) + ", classification='" + classification + "')";
    }
}
