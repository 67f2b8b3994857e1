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

package io.nosqlbench.knntune.command.classify;

import io.nosqlbench.knntune.classify.InvalidHyperparameterException;
import io.nosqlbench.knntune.classify.KnnClassifier;
import io.nosqlbench.knntune.classify.NeighborIndex;
import io.nosqlbench.knntune.classify.SelectionStrategy;
import io.nosqlbench.knntune.command.common.DistanceMetricOption;
import io.nosqlbench.knntune.command.common.SamplesInputOption;
import io.nosqlbench.knntune.command.common.StoreOption;
import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.RowIndices;
import io.nosqlbench.knntune.samples.InvalidRecordException;
import io.nosqlbench.knntune.samples.LoadResult;
import io.nosqlbench.knntune.samples.MappedSampleStore;
import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.SampleStoreLoader;
import io.nosqlbench.knntune.samples.UnknownSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Classifies unlabelled feature vectors against every loaded sample.
///
/// Each `--features` value is one query, given as comma separated numbers in schema order.
@CommandLine.Command(name = "classify",
    description = "Classify feature vectors with a chosen k and distance metric",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:some records were rejected", "2:error"})
public class CMD_classify implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_classify.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_WARNING = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SamplesInputOption inputOption = new SamplesInputOption();

    @CommandLine.Mixin
    private StoreOption storeOption = new StoreOption();

    @CommandLine.Option(names = {"-k", "--k"}, required = true, description = "Number of neighbors that vote")
    private int k;

    @CommandLine.Option(
        names = {"-m", "--metric"},
        description = "Distance metric (default: ${DEFAULT-VALUE})",
        converter = DistanceMetricOption.DistanceConverter.class,
        defaultValue = "EUCLIDEAN"
    )
    private Distance distance;

    @CommandLine.Option(
        names = {"--strategy"},
        description = "Neighbor selection: FULL_SORT, BOUNDED_INSERTION or HEAP (default: ${DEFAULT-VALUE})",
        defaultValue = "HEAP"
    )
    private SelectionStrategy strategy = SelectionStrategy.HEAP;

    @CommandLine.Option(
        names = {"-f", "--features"},
        required = true,
        description = "A query as comma separated feature values; repeat for several queries"
    )
    private List<String> queries = new ArrayList<>();

    @CommandLine.Option(names = {"--show-neighbors"}, description = "Also print the neighbors that voted")
    private boolean showNeighbors;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SampleStore store = null;
        try {
            inputOption.validate();
            LoadResult loaded = SampleStoreLoader.builder(inputOption.getSchema())
                .withPolicy(storeOption.getPolicy())
                .withStoreMode(storeOption.getStoreMode())
                .withMappedDirectory(storeOption.getMappedDirectory())
                .build()
                .load(inputOption.readRecords());
            store = loaded.store();
            for (InvalidRecordException rejected : loaded.rejected()) {
                err.println("Skipped " + rejected.getMessage());
            }

            RowIndices training = RowIndices.range(store.size());
            InvalidHyperparameterException.check(k, training.size());
            KnnClassifier classifier = new KnnClassifier(strategy);
            for (String query : queries) {
                UnknownSample unknown = parseQuery(query, store.dimensions());
                String label = classifier.classify(k, distance, training, store, unknown);
                out.printf(Locale.ROOT, "%s -> %s%n", query, label);
                if (showNeighbors) {
                    for (NeighborIndex neighbor : classifier.neighbors(k, distance, training, store, unknown)) {
                        out.printf(Locale.ROOT, "    row %d  %s  distance=%.4f%n",
                            neighbor.row(), store.label(neighbor.row()), neighbor.distance());
                    }
                }
            }
            out.flush();
            return loaded.hasRejections() ? EXIT_WARNING : EXIT_SUCCESS;
        } catch (InvalidRecordException e) {
            err.println("Error: invalid input record. " + e.getMessage());
            return EXIT_ERROR;
        } catch (InvalidHyperparameterException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("Rejected classification request", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("Error: I/O problem - " + e.getMessage());
            logger.error("I/O error while classifying", e);
            return EXIT_ERROR;
        } finally {
            if (store instanceof MappedSampleStore) {
                ((MappedSampleStore) store).close();
            }
        }
    }

    static UnknownSample parseQuery(String query, int dimensions) {
        String[] parts = query.split(",", -1);
        if (parts.length != dimensions) {
            throw new IllegalArgumentException(
                "Query '" + query + "' has " + parts.length + " values, expected " + dimensions);
        }
        double[] values = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Query '" + query + "' has a non-numeric value '" + parts[i] + "'", e);
            }
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Query '" + query + "' has a non-finite value '" + parts[i].trim() + "'");
            }
        }
        return UnknownSample.of(values);
    }
}
