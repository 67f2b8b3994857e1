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

package io.nosqlbench.knntune.tuning;

import io.nosqlbench.knntune.classify.KnnClassifier;
import io.nosqlbench.knntune.classify.SelectionStrategy;
import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.Partition;
import io.nosqlbench.knntune.partition.PartitionRule;
import io.nosqlbench.knntune.partition.Partitioner;
import io.nosqlbench.knntune.samples.ClassifiedSample;
import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.UnknownSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A named data set ready for tuning: the store, its partition, when it was loaded and tuned, and
/// every trial result recorded against it.
public final class TrainingData {
    private static final Logger logger = LogManager.getLogger(TrainingData.class);

    private final String name;
    private final SampleStore store;
    private final Partition partition;
    private final Instant uploaded;
    private final List<TrialResult> history = Collections.synchronizedList(new ArrayList<>());
    private volatile Instant tested;

    public TrainingData(String name, SampleStore store, Partition partition) {
        this.name = Objects.requireNonNull(name, "name");
        this.store = Objects.requireNonNull(store, "store");
        this.partition = Objects.requireNonNull(partition, "partition");
        this.uploaded = Instant.now();
    }

    /// Partition a store and wrap it.
    /// @param name the data set name
    /// @param store the loaded samples
    /// @param rule decides which rows are held out for testing
    /// @return a new training data set
    public static TrainingData of(String name, SampleStore store, PartitionRule rule) {
        return new TrainingData(name, store, Partitioner.partition(store, rule));
    }

    public String getName() {
        return name;
    }

    public SampleStore getStore() {
        return store;
    }

    public Partition getPartition() {
        return partition;
    }

    /// @return when this data set was created
    public Instant getUploaded() {
        return uploaded;
    }

    /// @return when the last tuning run finished, if any
    public Optional<Instant> getTested() {
        return Optional.ofNullable(tested);
    }

    /// @return every recorded trial result, in the order recorded
    public List<TrialResult> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /// Run a grid search over this data set and record the results.
    /// @return the results of this run, in completion order
    /// @throws InterruptedException if interrupted while waiting for trials
    public List<TrialResult> tune(GridSearchTuner tuner, Collection<Integer> ks, Collection<? extends Distance> distances)
        throws InterruptedException {
        List<TrialResult> results = tuner.tune(ks, distances, store, partition);
        history.addAll(results);
        tested = Instant.now();
        best().ifPresent(best -> logger.info("Best for {} so far: {}", name, best));
        return results;
    }

    /// @return the highest-quality successful result recorded so far
    public Optional<TrialResult> best() {
        synchronized (history) {
            return history.stream().filter(r -> !r.failed()).min(TrialResult.BY_QUALITY);
        }
    }

    /// Classify a sample against the training rows.
    /// @return the sample with the label assigned by the classifier
    public ClassifiedSample classify(int k, Distance distance, SelectionStrategy strategy, UnknownSample unknown) {
        String label = new KnnClassifier(strategy).classify(k, distance, partition.training(), store, unknown);
        return new ClassifiedSample(unknown, label);
    }

    /// Classify a sample with the best hyperparameters recorded so far.
    /// @throws IllegalStateException if no successful trial has been recorded
    public ClassifiedSample classify(UnknownSample unknown) {
        TrialResult best = best().orElseThrow(
            () -> new IllegalStateException("Training data '" + name + "' has no successful trial to classify with"));
        return classify(best.k(), best.distance(), best.strategy(), unknown);
    }

    @Override
    public String toString() {
        return "TrainingData{name='" + name + "', rows=" + store.size() + ", " + partition
            + ", uploaded=" + uploaded + ", tested=" + tested + ", trials=" + history.size() + "}";
    }
}
