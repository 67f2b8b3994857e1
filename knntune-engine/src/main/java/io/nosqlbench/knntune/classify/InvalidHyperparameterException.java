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

/// Thrown when `k` is not between 1 and the size of the training pool.
public class InvalidHyperparameterException extends RuntimeException {

    private final int k;
    private final int trainingSize;

    public InvalidHyperparameterException(int k, int trainingSize) {
        super(k < 1
            ? "k must be positive, got " + k
            : "k=" + k + " exceeds the training pool of " + trainingSize + " samples");
        this.k = k;
        this.trainingSize = trainingSize;
    }

    /// @return the rejected neighbor count
    public int getK() {
        return k;
    }

    /// @return the number of training samples available
    public int getTrainingSize() {
        return trainingSize;
    }

    /// @param k a neighbor count
    /// @param trainingSize the training pool size
    /// @throws InvalidHyperparameterException unless `1 <= k <= trainingSize`
    public static void check(int k, int trainingSize) {
        if (k < 1 || k > trainingSize) {
            throw new InvalidHyperparameterException(k, trainingSize);
        }
    }
}
