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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.nosqlbench.knntune.classify.InvalidHyperparameterException;
import io.nosqlbench.knntune.classify.SelectionStrategy;
import io.nosqlbench.knntune.command.common.DistanceMetricOption;
import io.nosqlbench.knntune.command.common.KRangeOption;
import io.nosqlbench.knntune.command.common.PartitionOption;
import io.nosqlbench.knntune.command.common.SamplesInputOption;
import io.nosqlbench.knntune.command.common.StoreOption;
import io.nosqlbench.knntune.command.common.TrialPoolOption;
import io.nosqlbench.knntune.samples.InvalidRecordException;
import io.nosqlbench.knntune.samples.LoadResult;
import io.nosqlbench.knntune.samples.MappedSampleStore;
import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.SampleStoreLoader;
import io.nosqlbench.knntune.tuning.EmptyTestSetException;
import io.nosqlbench.knntune.tuning.GridSearchTuner;
import io.nosqlbench.knntune.tuning.TrainingData;
import io.nosqlbench.knntune.tuning.TrialResult;
import io.nosqlbench.knntune.tuning.TunerConfig;
import io.nosqlbench.knntune.tuning.TuningStatistics;
import io.nosqlbench.knntune.partition.Partitioner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Grid search over neighbor counts and distance metrics.
///
/// Loads the samples once, holds out testing rows with the partition rule, runs one trial per
/// `(k, metric)` pair on a worker pool and prints the results best first. Use `--json` to also
/// write every result to a file.
@CommandLine.Command(name = "tune",
    description = "Find the k and distance metric which classify held-out samples best",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:some records were rejected or some trials failed", "2:error"})
public class CMD_tune implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_tune.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_WARNING = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private SamplesInputOption inputOption = new SamplesInputOption();

    @CommandLine.Mixin
    private KRangeOption kRangeOption = new KRangeOption();

    @CommandLine.Mixin
    private DistanceMetricOption distanceMetricOption = new DistanceMetricOption();

    @CommandLine.Mixin
    private PartitionOption partitionOption = new PartitionOption();

    @CommandLine.Mixin
    private StoreOption storeOption = new StoreOption();

    @CommandLine.Mixin
    private TrialPoolOption poolOption = new TrialPoolOption();

    @CommandLine.Option(
        names = {"--strategy"},
        description = "Neighbor selection: FULL_SORT, BOUNDED_INSERTION or HEAP (default: ${DEFAULT-VALUE})",
        defaultValue = "HEAP"
    )
    private SelectionStrategy strategy = SelectionStrategy.HEAP;

    @CommandLine.Option(
        names = {"--top"},
        description = "Show only the best N results, 0 for all (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int top = 10;

    @CommandLine.Option(
        names = {"--json"},
        description = "Also write every result as JSON to this file"
    )
    private Path jsonOutput;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (top < 0) {
            err.println("Error: --top must not be negative");
            return EXIT_ERROR;
        }

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

            TrainingData data = new TrainingData(inputOption.getInputPath().getFileName().toString(), store,
                Partitioner.partition(store, partitionOption.getRule()));
            TunerConfig config = TunerConfig.builder()
                .threads(poolOption.getWorkers())
                .shareMode(storeOption.getShareMode())
                .strategy(strategy)
                .build();
            if (poolOption.isOversubscribed()) {
                logger.warn("Running {} trial workers on {} cores", config.getThreads(),
                    Runtime.getRuntime().availableProcessors());
            }
            GridSearchTuner tuner = new GridSearchTuner(config);

            List<TrialResult> results = new ArrayList<>(
                data.tune(tuner, kRangeOption.getValues(), distanceMetricOption.getDistances()));
            results.sort(TrialResult.BY_QUALITY);

            out.printf(Locale.ROOT, "Tuned %s: %d rows (%d training, %d testing), %d trials on %d threads%n",
                data.getName(), store.size(), data.getPartition().training().size(),
                data.getPartition().testing().size(), results.size(), config.getThreads());
            out.print(TrialTable.render(results, top));
            data.best().ifPresent(best -> out.printf(Locale.ROOT, "Best: k=%d metric=%s quality=%.4f%n",
                best.k(), best.metric(), best.quality()));
            out.flush();

            if (jsonOutput != null) {
                writeJson(results);
                out.println("Results written to " + jsonOutput);
            }

            TuningStatistics statistics = tuner.getStatistics();
            logger.info("Tuned {}: {}", data.getName(), statistics);
            if (statistics.hasFailures() || loaded.hasRejections()) {
                return EXIT_WARNING;
            }
            return EXIT_SUCCESS;
        } catch (InvalidRecordException e) {
            err.println("Error: invalid input record. " + e.getMessage());
            return EXIT_ERROR;
        } catch (InvalidHyperparameterException | EmptyTestSetException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("Rejected tuning request", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("Error: I/O problem - " + e.getMessage());
            logger.error("I/O error while tuning", e);
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: tuning was interrupted");
            return EXIT_ERROR;
        } finally {
            if (store instanceof MappedSampleStore) {
                ((MappedSampleStore) store).close();
            }
        }
    }

    private void writeJson(List<TrialResult> results) throws IOException {
        List<TrialRecord> records = new ArrayList<>(results.size());
        for (TrialResult result : results) {
            records.add(TrialRecord.of(result));
        }
        Path parent = jsonOutput.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .writeValue(jsonOutput.toFile(), records);
    }
}
