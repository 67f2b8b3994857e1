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

import io.nosqlbench.knntune.partition.PartitionRule;
import picocli.CommandLine;

import java.util.Locale;

/**
 * Shared option selecting how loaded samples are split into training and testing rows.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class PartitionOption {

    /**
     * Picocli type converter for partition rule specifications.
     * Supports formats: {@code every-nth:n}, {@code hash:buckets[:modulus]}, {@code shuffled:seed[:fraction]}
     */
    public static class PartitionRuleConverter implements CommandLine.ITypeConverter<PartitionRule> {

        @Override
        public PartitionRule convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Partition specification cannot be empty");
            }
            String[] parts = value.trim().split(":");
            String kind = parts[0].trim().toLowerCase(Locale.ROOT);
            try {
                switch (kind) {
                    case "every-nth":
                        requireParts(value, parts, 1, 2);
                        return PartitionRule.everyNth(parts.length > 1
                            ? Integer.parseInt(parts[1].trim()) : PartitionRule.DEFAULT_NTH);
                    case "hash":
                        requireParts(value, parts, 1, 3);
                        int buckets = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : PartitionRule.DEFAULT_BUCKETS;
                        if (parts.length > 2) {
                            int modulus = Integer.parseInt(parts[2].trim());
                            if (modulus < 2) {
                                throw new IllegalArgumentException("Hash testing modulus must be at least 2: " + value);
                            }
                            return PartitionRule.hashed(buckets, bucket -> bucket % modulus == 0);
                        }
                        return PartitionRule.hashed(buckets);
                    case "shuffled":
                        requireParts(value, parts, 2, 3);
                        long seed = Long.parseLong(parts[1].trim());
                        double fraction = parts.length > 2 ? Double.parseDouble(parts[2].trim()) : 0.2d;
                        return PartitionRule.shuffled(seed, fraction);
                    default:
                        throw new IllegalArgumentException(
                            "Unknown partition rule: " + value + ". Expected every-nth:n, hash:buckets or shuffled:seed");
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid partition format: " + value + ". Could not parse numbers: " + e.getMessage()
                );
            }
        }

        private static void requireParts(String value, String[] parts, int min, int max) {
            if (parts.length < min || parts.length > max) {
                throw new IllegalArgumentException("Invalid partition format: " + value);
            }
        }
    }

    @CommandLine.Option(
        names = {"--partition"},
        description = "How rows are held out for testing: 'every-nth:n', 'hash:buckets[:modulus]' or "
            + "'shuffled:seed[:fraction]' (default: ${DEFAULT-VALUE})",
        converter = PartitionRuleConverter.class,
        defaultValue = "every-nth:5"
    )
    private PartitionRule rule;

    /**
     * Gets the parsed partition rule.
     */
    public PartitionRule getRule() {
        return rule;
    }

    @Override
    public String toString() {
        return String.valueOf(rule);
    }
}
