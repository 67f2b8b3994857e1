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

import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.partition.Partition;
import io.nosqlbench.knntune.samples.SampleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates every combination of neighbor count and metric concurrently and collects one
 * {@link TrialResult} per combination.
 *
 * <p>All hyperparameters are built before anything is scheduled, so an invalid {@code k} fails the
 * whole call without starting a worker. Trials run on a fixed pool of
 * {@link TunerConfig#getThreads()} workers created for each call. Every trial reads the same
 * store and partition, or a private heap copy of the store in {@link ShareMode#COPY}.
 *
 * <p>A trial which throws does not stop the others: its error becomes a failed result tagged with
 * the trial's {@code k} and metric. Results are returned in completion order; sort them with
 * {@link TrialResult#BY_QUALITY}.
 *
 * <p>If the calling thread is interrupted while waiting, outstanding trials are cancelled, the
 * pool is shut down and drained, the interrupt flag is restored and the
 * {@link InterruptedException} is rethrown.
 */
public final class GridSearchTuner {
    private static final Logger logger = LogManager.getLogger(GridSearchTuner.class);

    private final TunerConfig config;
    private final TuningStatistics statistics = new TuningStatistics();

    public GridSearchTuner(TunerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return counts over every trial this tuner has run
     */
    public TuningStatistics getStatistics() {
        return statistics;
    }

    /**
     * Run one trial for each pair of {@code ks} and {@code distances}.
     *
     * @param ks        the neighbor counts to try
     * @param distances the metrics to try
     * @param store     the samples, read concurrently by every trial
     * @param partition the training and testing rows of {@code store}
     * @return one result per pair, in completion order
     * @throws io.nosqlbench.knntune.classify.InvalidHyperparameterException if any {@code k} is out of range
     * @throws EmptyTestSetException if the partition has no testing rows
     * @throws InterruptedException if the calling thread is interrupted while waiting for results
     */
    public List<TrialResult> tune(Collection<Integer> ks, Collection<? extends Distance> distances,
                                  SampleStore store, Partition partition) throws InterruptedException {
        if (ks.isEmpty() || distances.isEmpty()) {
            throw new IllegalArgumentException("At least one k and one metric are required");
        }
        if (partition.testing().isEmpty()) {
            throw new EmptyTestSetException("Partition " + partition + " has no testing samples");
        }

        List<Hyperparameter> grid = new ArrayList<>(ks.size() * distances.size());
        for (Distance distance : distances) {
            for (int k : ks) {
                grid.add(new Hyperparameter(k, distance, config.getStrategy(), store, partition));
            }
        }
        logger.info("Tuning {} trials ({} k values x {} metrics) on {} threads, store {}",
            grid.size(), ks.size(), distances.size(), config.getThreads(), config.getShareMode());

        ExecutorService pool = Executors.newFixedThreadPool(config.getThreads(), new TrialThreadFactory());
        CompletionService<TrialResult> completions = new ExecutorCompletionService<>(pool);
        Map<Future<TrialResult>, Hyperparameter> inFlight = new LinkedHashMap<>();
        try {
            for (Hyperparameter hyperparameter : grid) {
                inFlight.put(completions.submit(() -> runTrial(hyperparameter)), hyperparameter);
                statistics.trialSubmitted();
            }

            List<TrialResult> results = new ArrayList<>(grid.size());
            while (!inFlight.isEmpty()) {
                Future<TrialResult> done = completions.take();
                Hyperparameter hyperparameter = inFlight.remove(done);
                results.add(collect(done, hyperparameter));
            }
            logger.info("Tuning finished: {}", statistics);
            return results;
        } catch (InterruptedException e) {
            logger.warn("Tuning interrupted, cancelling {} outstanding trials", inFlight.size());
            for (Future<TrialResult> future : inFlight.keySet()) {
                future.cancel(true);
                statistics.trialCancelled();
            }
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Trial workers did not exit within {}", config.getShutdownTimeout());
                }
            } catch (InterruptedException again) {
                e.addSuppressed(again);
            }
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private TrialResult runTrial(Hyperparameter hyperparameter) {
        Hyperparameter trial = config.getShareMode() == ShareMode.COPY
            ? hyperparameter.withStore(hyperparameter.getStore().copy())
            : hyperparameter;
        double quality = trial.test();
        double elapsedMillis = trial.getElapsed().toNanos() / 1e6;
        logger.debug("Trial k={} metric={} quality={} in {}ms",
            trial.getK(), trial.getDistance().name(), quality, elapsedMillis);
        return TrialResult.success(trial.getK(), trial.getDistance(), trial.getStrategy(), quality, elapsedMillis);
    }

    private TrialResult collect(Future<TrialResult> done, Hyperparameter hyperparameter) throws InterruptedException {
        try {
            TrialResult result = done.get();
            statistics.trialCollected(result);
            return result;
        } catch (ExecutionException e) {
            WorkerFailureException failure =
                new WorkerFailureException(hyperparameter.getK(), hyperparameter.getDistance().name(), e.getCause());
            logger.error(failure.getMessage(), e.getCause());
            TrialResult result = TrialResult.failure(hyperparameter.getK(), hyperparameter.getDistance(),
                hyperparameter.getStrategy(), failure);
            statistics.trialCollected(result);
            return result;
        }
    }

    private static final class TrialThreadFactory implements ThreadFactory {
        private static final AtomicInteger pools = new AtomicInteger();
        private final int pool = pools.incrementAndGet();
        private final AtomicInteger threads = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "knntune-trial-" + pool + "-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
