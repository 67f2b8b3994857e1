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

import picocli.CommandLine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared option for the neighbor counts a grid search tries, using {@link KRange} with automatic
 * parsing. All supporting types are inner classes for self-contained encapsulation.
 */
public class KRangeOption {

    /**
     * Immutable, ordered list of distinct neighbor counts.
     *
     * @param values the neighbor counts, each at least 1
     */
    public record KRange(List<Integer> values) {

        /**
         * Compact constructor with validation.
         */
        public KRange {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("At least one k value is required");
            }
            for (int k : values) {
                if (k < 1) {
                    throw new IllegalArgumentException("k must be positive: " + k);
                }
            }
            values = List.copyOf(new LinkedHashSet<>(values));
        }

        /**
         * Gets the number of k values.
         */
        public int size() {
            return values.size();
        }

        /**
         * Gets the largest k value.
         */
        public int max() {
            return values.stream().mapToInt(Integer::intValue).max().orElseThrow();
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    /**
     * Picocli type converter for {@link KRange} specifications.
     * Supports formats: n, a,b,c, m..n, m..n:step, [m,n), [m,n):step
     */
    public static class KRangeConverter implements CommandLine.ITypeConverter<KRange> {

        @Override
        public KRange convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("k specification cannot be empty");
            }

            String trimmed = value.trim();
            try {
                // Format: a,b,c - explicit list, unless it is the [m,n) form
                if (trimmed.contains(",") && !trimmed.startsWith("[")) {
                    List<Integer> values = new ArrayList<>();
                    for (String part : trimmed.split(",")) {
                        values.add(Integer.parseInt(part.trim()));
                    }
                    return new KRange(values);
                }

                int step = 1;
                String bounds = trimmed;
                int stepAt = trimmed.lastIndexOf(':');
                if (stepAt >= 0) {
                    step = Integer.parseInt(trimmed.substring(stepAt + 1).trim());
                    bounds = trimmed.substring(0, stepAt).trim();
                    if (step < 1) {
                        throw new IllegalArgumentException("Invalid k step in " + value + ": must be positive");
                    }
                }

                int start;
                int end;
                // Format: [m,n) - half-open interval notation
                if (bounds.startsWith("[") && bounds.endsWith(")")) {
                    String[] parts = bounds.substring(1, bounds.length() - 1).split(",");
                    if (parts.length != 2) {
                        throw new IllegalArgumentException("Invalid k range format: " + value + ". Expected: [start,end)");
                    }
                    start = Integer.parseInt(parts[0].trim());
                    end = Integer.parseInt(parts[1].trim());
                }
                // Format: m..n - closed interval (inclusive)
                else if (bounds.contains("..")) {
                    String[] parts = bounds.split("\\.\\.");
                    if (parts.length != 2) {
                        throw new IllegalArgumentException("Invalid k range format: " + value + ". Expected: start..end");
                    }
                    start = Integer.parseInt(parts[0].trim());
                    end = Integer.parseInt(parts[1].trim()) + 1;
                }
                // Format: n - a single k
                else {
                    if (stepAt >= 0) {
                        throw new IllegalArgumentException("A step needs a range: " + value);
                    }
                    return new KRange(List.of(Integer.parseInt(bounds)));
                }

                if (end <= start) {
                    throw new IllegalArgumentException("Invalid k range " + value + ": end must be greater than start");
                }
                List<Integer> values = new ArrayList<>();
                for (int k = start; k < end; k += step) {
                    values.add(k);
                }
                return new KRange(values);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid k format: " + value + ". Could not parse numbers: " + e.getMessage()
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-k", "--k"},
        description = "Neighbor counts to try. Formats: 'n', 'a,b,c', 'm..n' (inclusive), '[m,n)', "
            + "with an optional ':step' on ranges (default: ${DEFAULT-VALUE})",
        converter = KRangeConverter.class,
        defaultValue = "1..39:2"
    )
    private KRange kRange;

    /**
     * Gets the parsed KRange record.
     */
    public KRange getKRange() {
        return kRange;
    }

    /**
     * Gets the k values in the order given.
     */
    public List<Integer> getValues() {
        return kRange.values();
    }

    /**
     * Gets the k values as a set, for membership checks.
     */
    public Set<Integer> getValueSet() {
        return Set.copyOf(kRange.values());
    }

    @Override
    public String toString() {
        return String.valueOf(kRange);
    }
}
