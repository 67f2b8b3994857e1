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

package io.nosqlbench.knntune.command.common;

import io.nosqlbench.knntune.samples.SampleSchema;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared input options: the sample file and the shape of its records.
 * Without field options the records are read as the iris data set.
 */
public class SamplesInputOption {

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "Sample file: a JSON array of objects (.json) or comma separated lines",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--label-field"},
        description = "Name of the label field (default: species)"
    )
    private String labelField;

    @CommandLine.Option(
        names = {"--feature-fields"},
        description = "Ordered feature field names, comma separated (default: the iris measurements)",
        split = ","
    )
    private List<String> featureFields = new ArrayList<>();

    @CommandLine.Option(
        names = {"--any-label"},
        description = "Accept any non-empty label instead of the known iris species"
    )
    private boolean anyLabel = false;

    /**
     * Gets the input file path.
     */
    public Path getInputPath() {
        return inputPath;
    }

    /**
     * Builds the record schema from the field options.
     *
     * @return the iris schema, or a schema over the given fields which accepts any label
     */
    public SampleSchema getSchema() {
        boolean custom = labelField != null || !featureFields.isEmpty();
        if (!custom) {
            return anyLabel ? SampleSchema.IRIS.withAnyLabel() : SampleSchema.IRIS;
        }
        List<String> features = featureFields.isEmpty() ? SampleSchema.IRIS.featureNames() : featureFields;
        String label = labelField != null ? labelField : SampleSchema.IRIS.labelName();
        return new SampleSchema(features, label, Set.of());
    }

    /**
     * Validates that the input file exists.
     */
    public void validate() {
        if (!Files.isRegularFile(inputPath)) {
            throw new IllegalStateException("Input file does not exist: " + inputPath);
        }
    }

    /**
     * Reads the raw records of the input file.
     *
     * @return the records in file order
     * @throws IOException if the file cannot be read
     */
    public List<Map<String, Object>> readRecords() throws IOException {
        validate();
        return new SampleRecordReader(getSchema()).read(inputPath);
    }

    @Override
    public String toString() {
        return String.valueOf(inputPath);
    }
}
