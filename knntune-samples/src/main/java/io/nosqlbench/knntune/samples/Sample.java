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

/// A fixed-size numeric feature vector. Implementations are immutable.
public interface Sample {

    /// @return the number of features
    int dimensions();

    /// @param index the feature position
    /// @return the feature value at that position
    double feature(int index);

    /// @return a copy of all feature values
    default double[] features() {
        double[] values = new double[dimensions()];
        for (int i = 0; i < values.length; i++) {
            values[i] = feature(i);
        }
        return values;
    }
}
