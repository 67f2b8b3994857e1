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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link SampleStore} from an ordered sequence of field-labeled records.
 *
 * <p>Records arrive already decoded as maps from field name to value. Each record must provide
 * every feature field of the {@link SampleSchema} as a finite number and a label accepted by the
 * schema. Row numbers in {@link InvalidRecordException} are 1-based positions in the input.
 *
 * <pre>{@code
 * SampleStoreLoader loader = SampleStoreLoader.builder(SampleSchema.IRIS)
 *     .withPolicy(LoadPolicy.SKIP_INVALID)
 *     .withStoreMode(StoreMode.HEAP)
 *     .build();
 * LoadResult result = loader.load(records);
 * }</pre>
 */
public final class SampleStoreLoader {
    private static final Logger logger = LogManager.getLogger(SampleStoreLoader.class);

    private final SampleSchema schema;
    private final LoadPolicy policy;
    private final StoreMode storeMode;
    private final Path mappedDirectory;

    private SampleStoreLoader(Builder builder) {
        this.schema = builder.schema;
        this.policy = builder.policy;
        this.storeMode = builder.storeMode;
        this.mappedDirectory = builder.mappedDirectory;
    }

    /**
     * @param schema the record layout to load
     * @return a builder with {@link LoadPolicy#SKIP_INVALID} and {@link StoreMode#HEAP} defaults
     */
    public static Builder builder(SampleSchema schema) {
        return new Builder(schema);
    }

    /**
     * Load every valid record into a new store.
     *
     * @param records the decoded input records, in order
     * @return the store and the rejected records
     * @throws InvalidRecordException under {@link LoadPolicy#ABORT} for the first invalid record
     * @throws IllegalArgumentException if no valid record was found
     * @throws UncheckedIOException if a mapped store cannot be created
     */
    public LoadResult load(Iterable<? extends Map<String, ?>> records) {
        Objects.requireNonNull(records, "records");
        SlotWriter writer = new SlotWriter(schema, 256);
        List<InvalidRecordException> rejected = new ArrayList<>();
        double[] features = new double[schema.dimensions()];

        long rowNumber = 0;
        for (Map<String, ?> record : records) {
            rowNumber++;
            try {
                String label = parse(rowNumber, record, features);
                writer.append(features, label);
            } catch (InvalidRecordException e) {
                if (policy == LoadPolicy.ABORT) {
                    logger.error("Aborting load: {}", e.getMessage());
                    throw e;
                }
                logger.warn("Skipping record: {}", e.getMessage());
                rejected.add(e);
            }
        }

        if (writer.rows() == 0) {
            throw new IllegalArgumentException(
                "No valid records among " + rowNumber + " input records (" + rejected.size() + " rejected)");
        }

        SampleStore store = build(writer);
        logger.info("Loaded {} rows with {} labels into {} store, rejected {}",
            store.size(), store.labels().size(), storeMode, rejected.size());
        return new LoadResult(store, rejected);
    }

    private SampleStore build(SlotWriter writer) {
        switch (storeMode) {
            case MAPPED:
                try {
                    return writer.toMappedStore(mappedDirectory);
                } catch (IOException e) {
                    throw new UncheckedIOException("Unable to create mapped sample store in " + mappedDirectory, e);
                }
            case HEAP:
            default:
                return writer.toHeapStore();
        }
    }

    private String parse(long rowNumber, Map<String, ?> record, double[] into) {
        if (record == null) {
            throw new InvalidRecordException(rowNumber, "record is null");
        }
        List<String> names = schema.featureNames();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            Object raw = record.get(name);
            if (raw == null) {
                throw new InvalidRecordException(rowNumber, "missing field '" + name + "'");
            }
            into[i] = parseNumber(rowNumber, name, raw);
        }
        Object rawLabel = record.get(schema.labelName());
        if (rawLabel == null) {
            throw new InvalidRecordException(rowNumber, "missing field '" + schema.labelName() + "'");
        }
        String label = rawLabel.toString().trim();
        if (!schema.accepts(label)) {
            throw new InvalidRecordException(rowNumber,
                label.isEmpty() ? "empty label" : "unknown label '" + label + "'");
        }
        return label;
    }

    private double parseNumber(long rowNumber, String name, Object raw) {
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return requireFinite(rowNumber, name, raw, value);
        }
        String text = raw.toString().trim();
        try {
            return requireFinite(rowNumber, name, raw, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(rowNumber,
                "field '" + name + "' is not a number: '" + text + "'", e);
        }
    }

    private double requireFinite(long rowNumber, String name, Object raw, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidRecordException(rowNumber,
                "field '" + name + "' is not a finite number: '" + raw + "'");
        }
        return value;
    }

    /**
     * Builder for {@link SampleStoreLoader}.
     */
    public static final class Builder {
        private final SampleSchema schema;
        private LoadPolicy policy = LoadPolicy.SKIP_INVALID;
        private StoreMode storeMode = StoreMode.HEAP;
        private Path mappedDirectory = Path.of(System.getProperty("java.io.tmpdir"));

        Builder(SampleSchema schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
        }

        /**
         * @param policy what to do with invalid records
         * @return this builder
         */
        public Builder withPolicy(LoadPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * @param storeMode where the loaded store keeps its data
         * @return this builder
         */
        public Builder withStoreMode(StoreMode storeMode) {
            this.storeMode = Objects.requireNonNull(storeMode, "storeMode");
            return this;
        }

        /**
         * @param directory where {@link StoreMode#MAPPED} stores create their backing file
         * @return this builder
         */
        public Builder withMappedDirectory(Path directory) {
            this.mappedDirectory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        public SampleStoreLoader build() {
            return new SampleStoreLoader(this);
        }
    }
}
