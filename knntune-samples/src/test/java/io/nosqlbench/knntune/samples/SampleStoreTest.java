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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SampleStore")
class SampleStoreTest {

    private static final SampleSchema XY = SampleSchema.of("kind", "x", "y");

    private static HeapSampleStore threeRows() {
        return HeapSampleStore.of(XY,
            new double[][]{{1.0, 2.0}, {3.0, 4.0}, {5.0, 6.0}},
            new String[]{"a", "b", "a"});
    }

    @Nested
    @DisplayName("heap store")
    class Heap {

        @Test
        @DisplayName("should lay out rows with a stride of dimensions + 1")
        void shouldUseFixedStride() {
            HeapSampleStore store = threeRows();

            assertThat(store.size()).isEqualTo(3);
            assertThat(store.dimensions()).isEqualTo(2);
            assertThat(store.stride()).isEqualTo(3);
            assertThat(store.feature(2, 1)).isEqualTo(6.0);
            assertThat(store.labels()).containsExactly("a", "b");
            assertThat(store.label(1)).isEqualTo("b");
        }

        @Test
        @DisplayName("should reject out of range rows and columns")
        void shouldRejectOutOfRange() {
            HeapSampleStore store = threeRows();

            assertThatThrownBy(() -> store.feature(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> store.feature(0, 2)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> store.row(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("should reject mismatched labels and rows")
        void shouldRejectMismatchedInput() {
            assertThatThrownBy(() -> HeapSampleStore.of(XY, new double[][]{{1, 2}}, new String[]{"a", "b"}))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> HeapSampleStore.of(XY, new double[][]{{1, 2, 3}}, new String[]{"a"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 features");
        }

        @Test
        @DisplayName("should copy into an independent store with equal contents")
        void shouldCopy() {
            HeapSampleStore store = threeRows();
            SampleStore copy = store.copy();

            assertThat(copy).isNotSameAs(store);
            for (int row = 0; row < store.size(); row++) {
                assertThat(copy.features(row)).containsExactly(store.features(row));
                assertThat(copy.label(row)).isEqualTo(store.label(row));
            }
        }
    }

    @Nested
    @DisplayName("sample views")
    class Views {

        @Test
        @DisplayName("should read features through the store")
        void shouldReadThroughStore() {
            HeapSampleStore store = threeRows();
            KnownSample sample = store.row(1);

            assertThat(sample.dimensions()).isEqualTo(2);
            assertThat(sample.features()).containsExactly(3.0, 4.0);
            assertThat(sample.label()).isEqualTo("b");
            assertThat(sample.toString()).contains("row=1").contains("label='b'");
        }

        @Test
        @DisplayName("should compare views by store identity, row and role")
        void shouldCompareViews() {
            HeapSampleStore store = threeRows();

            assertThat(new TrainingKnownSample(store, 0)).isEqualTo(new TrainingKnownSample(store, 0));
            assertThat(new TrainingKnownSample(store, 0)).isNotEqualTo(new TestingKnownSample(store, 0));
            assertThat(new TrainingKnownSample(store, 0)).isNotEqualTo(new TrainingKnownSample(store.copy(), 0));
        }

        @Test
        @DisplayName("should track the assigned classification of a testing sample")
        void shouldTrackClassification() {
            TestingKnownSample sample = new TestingKnownSample(threeRows(), 2);

            assertThat(sample.classification()).isEmpty();
            assertThat(sample.matches()).isFalse();
            sample.setClassification("b");
            assertThat(sample.classification()).contains("b");
            assertThat(sample.matches()).isFalse();
            sample.setClassification("a");
            assertThat(sample.matches()).isTrue();
        }

        @Test
        @DisplayName("should reject unknown samples with NaN or infinite features")
        void shouldRejectNonFiniteUnknownSamples() {
            for (double bad : new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
                assertThatThrownBy(() -> UnknownSample.of(bad, 3.0, 4.0, 5.0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Feature 0 is not a finite number");
            }
            assertThatThrownBy(() -> UnknownSample.of()).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should keep the features of a classified sample")
        void shouldKeepClassifiedFeatures() {
            ClassifiedSample classified = new ClassifiedSample(UnknownSample.of(1.5, 2.5), "a");

            assertThat(classified.features()).containsExactly(1.5, 2.5);
            assertThat(classified.classification()).isEqualTo("a");
        }
    }

    @Nested
    @DisplayName("mapped store")
    class Mapped {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should share the same data with an attached mapping")
        void shouldShareWithAttachedMapping() throws IOException {
            SlotWriter writer = new SlotWriter(XY, 2);
            writer.append(new double[]{1.0, 2.0}, "a");
            writer.append(new double[]{3.0, 4.0}, "b");

            try (MappedSampleStore owner = writer.toMappedStore(tempDir);
                 MappedSampleStore attached = MappedSampleStore.attach(owner.path(), XY, owner.labels())) {
                assertThat(owner.isOwner()).isTrue();
                assertThat(attached.isOwner()).isFalse();
                assertThat(attached.size()).isEqualTo(2);
                assertThat(attached.features(1)).containsExactly(3.0, 4.0);
                assertThat(attached.label(1)).isEqualTo("b");
            }
        }

        @Test
        @DisplayName("should fail reads after release and delete the owned file")
        void shouldFailReadsAfterRelease() throws IOException {
            SlotWriter writer = new SlotWriter(XY, 1);
            writer.append(new double[]{1.0, 2.0}, "a");
            MappedSampleStore store = writer.toMappedStore(tempDir);
            SampleStore copy = store.copy();
            KnownSample view = store.row(0);

            store.close();
            store.close();

            assertThat(store.isReleased()).isTrue();
            assertThat(Files.exists(store.path())).isFalse();
            assertThatThrownBy(() -> view.feature(0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("released");
            assertThat(copy.features(0)).containsExactly(1.0, 2.0);
        }

        @Test
        @DisplayName("should keep the file when an attached mapping is closed")
        void shouldKeepFileWhenAttachedCloses() throws IOException {
            SlotWriter writer = new SlotWriter(XY, 1);
            writer.append(new double[]{1.0, 2.0}, "a");
            try (MappedSampleStore owner = writer.toMappedStore(tempDir)) {
                MappedSampleStore attached = MappedSampleStore.attach(owner.path(), XY, List.of("a"));
                attached.close();

                assertThat(owner.path()).exists();
                assertThat(owner.feature(0, 1)).isEqualTo(2.0);
            }
        }
    }
}
