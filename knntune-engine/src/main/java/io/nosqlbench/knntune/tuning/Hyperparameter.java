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

import io.nosqlbench.knntune.classify.InvalidHyperparameterException;
import io.nosqlbench.knntune.classify.KnnClassifier;
import io.nosqlbench.knntune.classify.SelectionStrategy;
import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.Partition;
import io.nosqlbench.knntune.partition.RowIndices;
import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.TestingKnownSample;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One point of the tuning grid: a neighbor count and a metric, bound to the store and partition
 * they are evaluated on.
 *
 * <p>{@link #test()} classifies every testing row against the training rows and records the
 * fraction classified correctly. The result depends only on the inputs, so repeated runs give the
 * same quality.
 */
public final class Hyperparameter {

    private final int k;
    private final Distance distance;
    private final SelectionStrategy strategy;
    private final SampleStore store;
    private final Partition partition;

    private volatile double quality = Double.NaN;
    private volatile Duration elapsed = Duration.ZERO;

    /**
     * @throws InvalidHyperparameterException if {@code k} is not between 1 and the training size
     */
    public Hyperparameter(int k, Distance distance, SelectionStrategy strategy, SampleStore store,
                          Partition partition) {
        this.distance = Objects.requireNonNull(distance, "distance");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.store = Objects.requireNonNull(store, "store");
        this.partition = Objects.requireNonNull(partition, "partition");
        InvalidHyperparameterException.check(k, partition.training().size());
        this.k = k;
    }

    /**
     * @param other the store to read instead, with the same rows
     * @return an untested copy of this hyperparameter bound to {@code other}
     */
    public Hyperparameter withStore(SampleStore other) {
        return new Hyperparameter(k, distance, strategy, other, partition);
    }

    public int getK() {
        return k;
    }

    public Distance getDistance() {
        return distance;
    }

    public SelectionStrategy getStrategy() {
        return strategy;
    }

    public SampleStore getStore() {
        return store;
    }

    public Partition getPartition() {
        return partition;
    }

    /**
     * @return the quality of the last test, empty before the first
     */
    public OptionalDouble getQuality() {
        double q = quality;
        return Double.isNaN(q) ? OptionalDouble.empty() : OptionalDouble.of(q);
    }

    /**
     * @return how long the last test took
     */
    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * Classify every testing row of the partition.
     *
     * @return the fraction of testing rows whose classification equals their label
     * @throws EmptyTestSetException if the partition has no testing rows
     */
    public double test() {
        RowIndices testing = partition.testing();
        if (testing.isEmpty()) {
            throw new EmptyTestSetException("No testing samples to evaluate k=" + k + " metric=" + distance.name());
        }
        long start = System.nanoTime();
        KnnClassifier classifier = new KnnClassifier(strategy);
        int correct = 0;
        for (int i = 0; i < testing.size(); i++) {
            int row = testing.get(i);
            String assigned = classifier.classify(k, distance, partition.training(), store, store.row(row));
            if (assigned.equals(store.label(row))) {
                correct++;
            }
        }
        return record(correct, testing.size(), start);
    }

    /**
     * Classify the given testing samples, storing each assigned label on its sample.
     *
     * @param samples testing views, over this store or a store with the same rows
     * @return the fraction of samples whose classification equals their label
     * @throws EmptyTestSetException if {@code samples} is empty
     */
    public double test(List<TestingKnownSample> samples) {
        if (samples.isEmpty()) {
            throw new EmptyTestSetException("No testing samples to evaluate k=" + k + " metric=" + distance.name());
        }
        long start = System.nanoTime();
        KnnClassifier classifier = new KnnClassifier(strategy);
        int correct = 0;
        for (TestingKnownSample sample : samples) {
            sample.setClassification(classifier.classify(k, distance, partition.training(), store, sample));
            if (sample.matches()) {
                correct++;
            }
        }
        return record(correct, samples.size(), start);
    }

    private double record(int correct, int total, long startNanos) {
        elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        double q = (double) correct / total;
        quality = q;
        return q;
    }

    @Override
    public String toString() {
        return "Hyperparameter{k=" + k + ", metric=" + distance.name() + ", strategy=" + strategy
            + ", quality=" + (Double.isNaN(quality) ? "untested" : String.format("%.4f", quality)) + "}";
    }
}
