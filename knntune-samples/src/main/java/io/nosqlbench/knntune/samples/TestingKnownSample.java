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

import java.util.Optional;

/// A known sample held out for testing. A classifier records the label it assigned with
/// [#setClassification(String)]; each run overwrites the previous assignment.
public final class TestingKnownSample extends KnownSample {

    private volatile String classification;

    public TestingKnownSample(SampleStore store, int row) {
        super(store, row);
    }

    /// @return the label assigned by the last classification, if any
    public Optional<String> classification() {
        return Optional.ofNullable(classification);
    }

    /// @param classification the label assigned by a classifier
    public void setClassification(String classification) {
        this.classification = classification;
    }

    /// @return true if the assigned label equals the known label
    public boolean matches() {
        return label().equals(classification);
    }

    @Override
    public String toString() {
        return super.toString() + "{classification=" + classification + "}";
    }
}
