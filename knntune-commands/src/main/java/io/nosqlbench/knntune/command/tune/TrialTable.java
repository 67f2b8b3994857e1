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

package io.nosqlbench.knntune.command.tune;

import io.nosqlbench.knntune.tuning.TrialResult;

import java.util.List;
import java.util.Locale;

/// Renders trial results as a fixed-width text table, best first.
final class TrialTable {

    private static final String ROW = "%4s  %-5s  %-22s  %-17s  %8s  %10s%n";

    private TrialTable() {
    }

    /// @param results the results, already sorted
    /// @param limit the maximum number of rows, or 0 for all
    /// @return the table text
    static String render(List<TrialResult> results, int limit) {
        StringBuilder table = new StringBuilder();
        table.append(String.format(Locale.ROOT, ROW, "rank", "k", "metric", "strategy", "quality", "elapsed_ms"));
        int rows = limit > 0 ? Math.min(limit, results.size()) : results.size();
        for (int i = 0; i < rows; i++) {
            TrialResult result = results.get(i);
            String quality = result.failed() ? "FAILED" : String.format(Locale.ROOT, "%.4f", result.quality());
            String elapsed = result.failed() ? "-" : String.format(Locale.ROOT, "%.3f", result.elapsedMillis());
            table.append(String.format(Locale.ROOT, ROW, i + 1, result.k(), result.metric(), result.strategy(), quality,
                elapsed));
        }
        if (rows < results.size()) {
            table.append(String.format(Locale.ROOT, "... %d more%n", results.size() - rows));
        }
        return table.toString();
    }
}
