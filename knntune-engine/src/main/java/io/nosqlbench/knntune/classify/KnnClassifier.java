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

package io.nosqlbench.knntune.classify;

import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.RowIndices;
import io.nosqlbench.knntune.samples.Sample;
import io.nosqlbench.knntune.samples.SampleStore;
import io.nosqlbench.knntune.samples.UnknownSample;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A k-nearest-neighbor classifier over the training rows of a {@link SampleStore}.
 *
 * <p>The classifier finds the {@code k} nearest training rows with its {@link SelectionStrategy}
 * and returns the most frequent label among them. Labels are counted in neighbor order, nearest
 * first. When two labels have the same count, the label counted first wins, which is the label of
 * the nearer neighbor. This makes the result independent of the strategy.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class KnnClassifier {

    private final SelectionStrategy strategy;

    public KnnClassifier(SelectionStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * @return the strategy used to select neighbors
     */
    public SelectionStrategy getStrategy() {
        return strategy;
    }

    /**
     * Classify a query against the training rows.
     *
     * @param k        the number of neighbors which vote
     * @param distance the metric
     * @param training the training rows
     * @param store    the store holding the rows
     * @param query    the sample to classify
     * @return the winning label
     * @throws InvalidHyperparameterException if {@code k} is not between 1 and the training size
     * @throws IllegalArgumentException if the query dimension differs from the store's
     */
    public String classify(int k, Distance distance, RowIndices training, SampleStore store, Sample query) {
        return vote(store, neighbors(k, distance, training, store, query));
    }

    /**
     * @return the {@code k} nearest training rows, nearest first
     * @see #classify(int, Distance, RowIndices, SampleStore, Sample)
     */
    public NeighborIndex[] neighbors(int k, Distance distance, RowIndices training, SampleStore store, Sample query) {
        InvalidHyperparameterException.check(k, training.size());
        Objects.requireNonNull(distance, "distance");
        return strategy.selector().select(k, distance, store, training, query);
    }

    /**
     * Classify one set of raw feature values with the default heap strategy.
     *
     * @param store    the store holding the training rows
     * @param training the training rows
     * @param k        the number of neighbors which vote
     * @param distance the metric
     * @param features the feature values of the sample to classify
     * @return the winning label
     */
    public static String classifyOne(SampleStore store, RowIndices training, int k, Distance distance,
                                     double... features) {
        return new KnnClassifier(SelectionStrategy.HEAP)
            .classify(k, distance, training, store, UnknownSample.of(features));
    }

    static String vote(SampleStore store, NeighborIndex[] neighbors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NeighborIndex neighbor : neighbors) {
            counts.merge(store.label(neighbor.row()), 1, Integer::sum);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            // strictly greater keeps the first-seen label on ties
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner;
    }
}
