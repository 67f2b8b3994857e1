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

package io.nosqlbench.knntune.distance;

import io.nosqlbench.knntune.samples.HeapSampleStore;
import io.nosqlbench.knntune.samples.Sample;
import io.nosqlbench.knntune.samples.SampleSchema;
import io.nosqlbench.knntune.samples.UnknownSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DistanceFunction")
class DistanceFunctionTest {

    private static final UnknownSample SETOSA = UnknownSample.of(5.1, 3.5, 1.4, 0.2);
    private static final UnknownSample VERSICOLOR = UnknownSample.of(7.9, 3.2, 4.7, 1.4);

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource({
        "CHEBYSHEV, 3.3",
        "EUCLIDEAN, 4.50111097",
        "MANHATTAN, 7.6",
        "SORENSEN, 0.2773722627"
    })
    @DisplayName("should match reference distances between two iris rows")
    void shouldMatchReferenceDistances(DistanceFunction function, double expected) {
        assertThat(function.distance(SETOSA, VERSICOLOR)).isCloseTo(expected, within(1e-8));
    }

    @ParameterizedTest
    @EnumSource(DistanceFunction.class)
    @DisplayName("should be symmetric, non-negative and zero on identical features")
    void shouldBehaveAsADistance(DistanceFunction function) {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            UnknownSample a = randomSample(random);
            UnknownSample b = randomSample(random);

            assertThat(function.distance(a, b)).isGreaterThanOrEqualTo(0.0)
                .isEqualTo(function.distance(b, a));
            assertThat(function.distance(a, UnknownSample.of(a.features()))).isZero();
        }
    }

    @Test
    @DisplayName("should treat store views and free samples alike")
    void shouldTreatViewsAndSamplesAlike() {
        HeapSampleStore store = HeapSampleStore.of(SampleSchema.IRIS,
            new double[][]{SETOSA.features(), VERSICOLOR.features()},
            new String[]{"Iris-setosa", "Iris-versicolor"});

        for (DistanceFunction function : DistanceFunction.values()) {
            assertThat(function.distance(store.row(0), store.row(1)))
                .isEqualTo(function.distance(SETOSA, VERSICOLOR));
        }
    }

    @Test
    @DisplayName("should define Sørensen as zero for two all-zero samples")
    void shouldHandleZeroSorensen() {
        UnknownSample zero = UnknownSample.of(0.0, 0.0, 0.0);

        assertThat(DistanceFunction.SORENSEN.distance(zero, zero)).isZero();
        assertThat(DistanceFunction.SORENSEN.distance(zero, UnknownSample.of(1.0, 0.0, 0.0))).isEqualTo(1.0);
    }

    @ParameterizedTest
    @EnumSource(DistanceFunction.class)
    @DisplayName("should reject samples of different dimensions")
    void shouldRejectMismatchedDimensions(DistanceFunction function) {
        assertThatThrownBy(() -> function.distance(SETOSA, UnknownSample.of(1.0, 2.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("same dimension");
        assertThatThrownBy(() -> function.distance(SETOSA, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Minkowski")
    class MinkowskiTest {

        @Test
        @DisplayName("should reduce to the named metrics")
        void shouldReduceToNamedMetrics() {
            Random random = new Random(7);
            Minkowski l1 = new Minkowski(1, Minkowski.Reduction.SUM);
            Minkowski l2 = new Minkowski(2, Minkowski.Reduction.SUM);
            Minkowski linf = new Minkowski(1, Minkowski.Reduction.MAX);
            for (int trial = 0; trial < 50; trial++) {
                Sample a = randomSample(random);
                Sample b = randomSample(random);

                assertThat(l1.distance(a, b)).isCloseTo(DistanceFunction.MANHATTAN.distance(a, b), within(1e-12));
                assertThat(l2.distance(a, b)).isCloseTo(DistanceFunction.EUCLIDEAN.distance(a, b), within(1e-12));
                assertThat(linf.distance(a, b)).isCloseTo(DistanceFunction.CHEBYSHEV.distance(a, b), within(1e-12));
            }
        }

        @Test
        @DisplayName("should compute higher exponents")
        void shouldComputeHigherExponents() {
            Minkowski cubic = new Minkowski(3, Minkowski.Reduction.SUM);

            assertThat(cubic.distance(UnknownSample.of(0.0, 0.0), UnknownSample.of(1.0, 2.0)))
                .isCloseTo(Math.cbrt(9.0), within(1e-12));
        }

        @Test
        @DisplayName("should reject an exponent below one")
        void shouldRejectSmallExponent() {
            assertThatThrownBy(() -> new Minkowski(0, Minkowski.Reduction.SUM))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
        }
    }

    @Nested
    @DisplayName("fromName")
    class FromName {

        @ParameterizedTest
        @CsvSource({
            "euclidean, EUCLIDEAN",
            "L2, EUCLIDEAN",
            "ed, EUCLIDEAN",
            "Manhattan, MANHATTAN",
            "cityblock, MANHATTAN",
            "L1, MANHATTAN",
            "chebyshev, CHEBYSHEV",
            "LINF, CHEBYSHEV",
            "sorensen, SORENSEN",
            "SD, SORENSEN"
        })
        @DisplayName("should resolve names and aliases")
        void shouldResolveAliases(String name, DistanceFunction expected) {
            assertThat(DistanceFunction.fromName(name)).isSameAs(expected);
        }

        @Test
        @DisplayName("should parse the generalized Minkowski form")
        void shouldParseMinkowski() {
            assertThat(DistanceFunction.fromName("minkowski:3"))
                .isEqualTo(new Minkowski(3, Minkowski.Reduction.SUM));
            assertThat(DistanceFunction.fromName("Minkowski:1:max"))
                .isEqualTo(new Minkowski(1, Minkowski.Reduction.MAX));
            assertThat(DistanceFunction.fromName("minkowski:4:sum").name()).isEqualTo("minkowski:4:sum");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "cosine", "minkowski", "minkowski:x", "minkowski:2:avg", "minkowski:0"})
        @DisplayName("should reject unknown names")
        void shouldRejectUnknownNames(String name) {
            assertThatThrownBy(() -> DistanceFunction.fromName(name))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static UnknownSample randomSample(Random random) {
        double[] values = new double[4];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble() * 10.0;
        }
        return UnknownSample.of(values);
    }
}
