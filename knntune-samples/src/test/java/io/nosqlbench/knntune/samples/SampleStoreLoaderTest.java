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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SampleStoreLoader")
class SampleStoreLoaderTest {

    private static Map<String, Object> iris(Object sl, Object sw, Object pl, Object pw, Object species) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("sepal_length", sl);
        record.put("sepal_width", sw);
        record.put("petal_length", pl);
        record.put("petal_width", pw);
        record.put("species", species);
        return record;
    }

    private static SampleStoreLoader skipping() {
        return SampleStoreLoader.builder(SampleSchema.IRIS).build();
    }

    @Nested
    @DisplayName("valid records")
    class ValidRecords {

        @Test
        @DisplayName("should accept numbers and numeric strings")
        void shouldAcceptNumbersAndStrings() {
            LoadResult result = skipping().load(List.of(
                iris(5.1, 3.5, 1.4, 0.2, "Iris-setosa"),
                iris("7.9", "3.2", "4.7", " 1.4 ", "Iris-versicolor")
            ));

            SampleStore store = result.store();
            assertThat(result.hasRejections()).isFalse();
            assertThat(store.size()).isEqualTo(2);
            assertThat(store.dimensions()).isEqualTo(4);
            assertThat(store.features(0)).containsExactly(5.1, 3.5, 1.4, 0.2);
            assertThat(store.features(1)).containsExactly(7.9, 3.2, 4.7, 1.4);
            assertThat(store.label(1)).isEqualTo("Iris-versicolor");
        }

        @Test
        @DisplayName("should assign label codes in first-seen order")
        void shouldAssignLabelCodesInFirstSeenOrder() {
            SampleStore store = skipping().load(List.of(
                iris(1, 1, 1, 1, "Iris-virginica"),
                iris(2, 2, 2, 2, "Iris-setosa"),
                iris(3, 3, 3, 3, "Iris-virginica")
            )).store();

            assertThat(store.labels()).containsExactly("Iris-virginica", "Iris-setosa");
            assertThat(store.labelCode(0)).isZero();
            assertThat(store.labelCode(1)).isEqualTo(1);
            assertThat(store.labelCode(2)).isZero();
        }

        @Test
        @DisplayName("should ignore extra fields")
        void shouldIgnoreExtraFields() {
            Map<String, Object> record = iris(5.1, 3.5, 1.4, 0.2, "Iris-setosa");
            record.put("comment", "from the field notebook");

            assertThat(skipping().load(List.of(record)).store().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should accept any label with an open schema")
        void shouldAcceptAnyLabelWithOpenSchema() {
            SampleStore store = SampleStoreLoader.builder(SampleSchema.IRIS.withAnyLabel()).build()
                .load(List.of(iris(1, 2, 3, 4, "Iris-unknown"))).store();

            assertThat(store.label(0)).isEqualTo("Iris-unknown");
        }
    }

    @Nested
    @DisplayName("invalid records")
    class InvalidRecords {

        @Test
        @DisplayName("should skip a non-numeric feature and report its row")
        void shouldSkipNonNumericFeature() {
            LoadResult result = skipping().load(List.of(
                iris("5.1", "3.5", "1.4", "0.2", "Iris-setosa"),
                iris("x", "3.0", "1.0", "0.1", "Iris-setosa")
            ));

            assertThat(result.store().size()).isEqualTo(1);
            assertThat(result.rejected()).hasSize(1);
            InvalidRecordException rejected = result.rejected().get(0);
            assertThat(rejected.getRowNumber()).isEqualTo(2);
            assertThat(rejected.getReason()).contains("sepal_length").contains("'x'");
            assertThat(rejected).hasMessageStartingWith("Row 2:")
                .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("should reject missing fields")
        void shouldRejectMissingField() {
            Map<String, Object> record = iris(5.1, 3.5, 1.4, 0.2, "Iris-setosa");
            record.remove("petal_width");
            LoadResult result = skipping().load(List.of(iris(1, 1, 1, 1, "Iris-setosa"), record));

            assertThat(result.rejected()).singleElement()
                .satisfies(e -> assertThat(e.getReason()).isEqualTo("missing field 'petal_width'"));
        }

        @Test
        @DisplayName("should reject unknown and empty labels")
        void shouldRejectBadLabels() {
            LoadResult result = skipping().load(List.of(
                iris(1, 1, 1, 1, "Iris-setosa"),
                iris(1, 1, 1, 1, "Iris-pseudacorus"),
                iris(1, 1, 1, 1, "  ")
            ));

            assertThat(result.rejected()).extracting(InvalidRecordException::getReason)
                .containsExactly("unknown label 'Iris-pseudacorus'", "empty label");
            assertThat(result.rejected()).extracting(InvalidRecordException::getRowNumber)
                .containsExactly(2L, 3L);
        }

        @Test
        @DisplayName("should reject non-finite values")
        void shouldRejectNonFiniteValues() {
            LoadResult result = skipping().load(List.of(
                iris(1, 1, 1, 1, "Iris-setosa"),
                iris(Double.NaN, 1, 1, 1, "Iris-setosa"),
                iris("Infinity", 1, 1, 1, "Iris-setosa")
            ));

            assertThat(result.rejected()).hasSize(2)
                .allSatisfy(e -> assertThat(e.getReason()).contains("not a finite number"));
        }

        @Test
        @DisplayName("should reject a null record")
        void shouldRejectNullRecord() {
            List<Map<String, Object>> records = new ArrayList<>();
            records.add(iris(1, 1, 1, 1, "Iris-setosa"));
            records.add(null);

            assertThat(skipping().load(records).rejected()).singleElement()
                .satisfies(e -> assertThat(e.getReason()).isEqualTo("record is null"));
        }

        @Test
        @DisplayName("should abort on the first invalid record")
        void shouldAbortOnFirstInvalidRecord() {
            SampleStoreLoader loader = SampleStoreLoader.builder(SampleSchema.IRIS)
                .withPolicy(LoadPolicy.ABORT)
                .build();

            assertThatThrownBy(() -> loader.load(List.of(
                iris(1, 1, 1, 1, "Iris-setosa"),
                iris(1, 1, 1, 1, "Iris-setosa"),
                iris(1, "wide", 1, 1, "Iris-setosa"),
                iris(1, 1, 1, 1, "nope")
            )))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageStartingWith("Row 3:")
                .hasMessageContaining("sepal_width");
        }

        @Test
        @DisplayName("should fail when no record is valid")
        void shouldFailWhenNothingIsValid() {
            assertThatThrownBy(() -> skipping().load(List.of(iris("a", 1, 1, 1, "Iris-setosa"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No valid records");
            assertThatThrownBy(() -> skipping().load(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("mapped stores")
    class Mapped {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should load into a mapped file and release it on close")
        void shouldLoadIntoMappedFile() {
            SampleStoreLoader loader = SampleStoreLoader.builder(SampleSchema.IRIS)
                .withStoreMode(StoreMode.MAPPED)
                .withMappedDirectory(tempDir)
                .build();

            SampleStore store = loader.load(List.of(
                iris(5.1, 3.5, 1.4, 0.2, "Iris-setosa"),
                iris(7.9, 3.2, 4.7, 1.4, "Iris-versicolor")
            )).store();

            assertThat(store).isInstanceOf(MappedSampleStore.class);
            MappedSampleStore mapped = (MappedSampleStore) store;
            assertThat(mapped.path()).startsWith(tempDir).exists();
            assertThat(mapped.features(1)).containsExactly(7.9, 3.2, 4.7, 1.4);
            assertThat(mapped.label(0)).isEqualTo("Iris-setosa");

            mapped.close();
            assertThat(Files.exists(mapped.path())).isFalse();
        }
    }
}
