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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.knntune.samples.SampleSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Reads raw sample records from a file, one field map per record, without validating them.
///
/// Files ending in `.json` hold a JSON array of objects. Any other file is read as comma
/// separated lines. A first line naming the label field is taken as the header; otherwise the
/// columns are the schema's feature fields followed by the label, as in the classic `iris.data`.
public final class SampleRecordReader {
    private static final Logger logger = LogManager.getLogger(SampleRecordReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SampleSchema schema;

    public SampleRecordReader(SampleSchema schema) {
        this.schema = schema;
    }

    /// @param path the input file
    /// @return the records in file order
    /// @throws IOException if the file cannot be read or is not valid JSON
    public List<Map<String, Object>> read(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<Map<String, Object>> records = name.endsWith(".json") ? readJson(path) : readDelimited(path);
        logger.debug("Read {} raw records from {}", records.size(), path);
        return records;
    }

    private List<Map<String, Object>> readJson(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), new TypeReference<List<Map<String, Object>>>() {
        });
    }

    private List<Map<String, Object>> readDelimited(Path path) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        List<String> columns = new ArrayList<>(schema.featureNames());
        columns.add(schema.labelName());
        boolean first = true;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split(",", -1);
                if (first) {
                    first = false;
                    if (Arrays.stream(cells).map(String::trim).anyMatch(schema.labelName()::equals)) {
                        columns = Arrays.stream(cells).map(String::trim).toList();
                        continue;
                    }
                }
                Map<String, Object> record = new LinkedHashMap<>();
                for (int i = 0; i < Math.min(cells.length, columns.size()); i++) {
                    record.put(columns.get(i), cells[i].trim());
                }
                records.add(record);
            }
        }
        return records;
    }
}
