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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KRangeOption")
class KRangeOptionTest {

    @Nested
    @DisplayName("KRange Record")
    class KRangeRecordTest {

        @Test
        @DisplayName("should drop duplicates and keep the given order")
        void shouldDeduplicate() {
            KRangeOption.KRange range = new KRangeOption.KRange(List.of(5, 1, 5, 3, 1));

            assertThat(range.values()).containsExactly(5, 1, 3);
            assertThat(range.size()).isEqualTo(3);
            assertThat(range.max()).isEqualTo(5);
        }

        @Test
        @DisplayName("should reject zero, negative and empty values")
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> new KRangeOption.KRange(List.of(1, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
            assertThatThrownBy(() -> new KRangeOption.KRange(List.of(-3)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new KRangeOption.KRange(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one");
        }
    }

    @Nested
    @DisplayName("KRangeConverter")
    class KRangeConverterTest {

        private final KRangeOption.KRangeConverter converter = new KRangeOption.KRangeConverter();

        @Test
        @DisplayName("should parse a single value")
        void shouldParseSingleValue() {
            assertThat(converter.convert("7").values()).containsExactly(7);
        }

        @Test
        @DisplayName("should parse an explicit list")
        void shouldParseList() {
            assertThat(converter.convert("1, 3,5").values()).containsExactly(1, 3, 5);
        }

        @Test
        @DisplayName("should parse an inclusive range with a step")
        void shouldParseInclusiveRangeWithStep() {
            KRangeOption.KRange range = converter.convert("1..39:2");

            assertThat(range.size()).isEqualTo(20);
            assertThat(range.values()).startsWith(1, 3, 5).endsWith(37, 39);
        }

        @Test
        @DisplayName("should parse inclusive and half-open ranges")
        void shouldParseRanges() {
            assertThat(converter.convert("2..4").values()).containsExactly(2, 3, 4);
            assertThat(converter.convert("[2,5)").values()).containsExactly(2, 3, 4);
            assertThat(converter.convert("[1,10):4").values()).containsExactly(1, 5, 9);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "abc", "5..2", "1..5:0", "0", "3:2", "[1,2", "1..x"})
        @DisplayName("should reject invalid specifications")
        void shouldRejectInvalidFormats(String value) {
            assertThatThrownBy(() -> converter.convert(value))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Picocli Integration")
    class PicocliIntegrationTest {

        @Test
        @DisplayName("should use the odd values up to 39 by default")
        void shouldUseDefault() {
            DummyCommand command = new DummyCommand();
            new CommandLine(command).parseArgs();

            assertThat(command.kRangeOption.getValues()).hasSize(20).allMatch(k -> k % 2 == 1);
            assertThat(command.kRangeOption.getKRange().max()).isEqualTo(39);
        }

        @Test
        @DisplayName("should parse --k and -k")
        void shouldParseOption() {
            DummyCommand command = new DummyCommand();
            new CommandLine(command).parseArgs("-k", "1,3,5");
            assertThat(command.kRangeOption.getValueSet()).containsExactlyInAnyOrder(1, 3, 5);

            DummyCommand longForm = new DummyCommand();
            new CommandLine(longForm).parseArgs("--k", "[4,6)");
            assertThat(longForm.kRangeOption.getValues()).containsExactly(4, 5);
        }

        @Test
        @DisplayName("should report a bad --k value as a parameter error")
        void shouldReportBadValue() {
            assertThatThrownBy(() -> new CommandLine(new DummyCommand()).parseArgs("--k", "0..3"))
                .isInstanceOf(CommandLine.ParameterException.class);
        }
    }

    private static final class DummyCommand implements Runnable {
        @CommandLine.Mixin
        final KRangeOption kRangeOption = new KRangeOption();

        @Override
        public void run() {
        }
    }
}
