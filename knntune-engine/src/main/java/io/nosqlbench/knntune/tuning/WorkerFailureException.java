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

/// Wraps an error raised inside a trial worker, tagged with the hyperparameters of the trial.
public class WorkerFailureException extends RuntimeException {

    private final int k;
    private final String metric;

    /// @param k the neighbor count of the failed trial
    /// @param metric the metric name of the failed trial
    /// @param cause the error raised by the worker
    public WorkerFailureException(int k, String metric, Throwable cause) {
        super("Trial k=" + k + " metric=" + metric + " failed: " + describe(cause), cause);
        this.k = k;
        this.metric = metric;
    }

    /// @return the neighbor count of the failed trial
    public int getK() {
        return k;
    }

    /// @return the metric name of the failed trial
    public String getMetric() {
        return metric;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
