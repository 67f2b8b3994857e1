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

import java.util.List;
import java.util.Set;

/// The shape of a labeled record: the ordered feature field names, the label field name, and
/// the finite set of labels a record may carry.
///
/// An empty set of known labels accepts any non-empty label.
///
/// @param featureNames the ordered feature field names
/// @param labelName the name of the label field
/// @param knownLabels the accepted labels, or empty to accept any label
public record SampleSchema(List<String> featureNames, String labelName, Set<String> knownLabels) {

    /// The iris dataset layout, four measurements and a species
    public static final SampleSchema IRIS = new SampleSchema(
        List.of("sepal_length", "sepal_width", "petal_length", "petal_width"),
        "species",
        Set.of("Iris-setosa", "Iris-versicolor", "Iris-virginica")
    );

    public SampleSchema {
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("A schema needs at least one feature field");
        }
        if (labelName == null || labelName.isBlank()) {
            throw new IllegalArgumentException("A schema needs a label field name");
        }
        if (featureNames.contains(labelName)) {
            throw new IllegalArgumentException("Label field '" + labelName + "' is also listed as a feature");
        }
        featureNames = List.copyOf(featureNames);
        knownLabels = knownLabels == null ? Set.of() : Set.copyOf(knownLabels);
    }

    /// Create a schema which accepts any label value.
    /// @param labelName the name of the label field
    /// @param featureNames the ordered feature field names
    /// @return a schema without a known label set
    public static SampleSchema of(String labelName, String... featureNames) {
        return new SampleSchema(List.of(featureNames), labelName, Set.of());
    }

    /// @return a copy of this schema which accepts any label
    public SampleSchema withAnyLabel() {
        return new SampleSchema(featureNames, labelName, Set.of());
    }

    /// @return the number of features in each sample
    public int dimensions() {
        return featureNames.size();
    }

    /// @param label a candidate label
    /// @return true if the label is acceptable for this schema
    public boolean accepts(String label) {
        if (label == null || label.isBlank()) {
            return false;
        }
        return knownLabels.isEmpty() || knownLabels.contains(label);
    }
}
