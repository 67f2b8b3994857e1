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

import io.nosqlbench.knntune.distance.Distance;
import io.nosqlbench.knntune.distance.DistanceFunction;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Shared distance metric option for grid searches over several metrics.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class DistanceMetricOption {

    /**
     * Picocli type converter resolving a metric name to a {@link Distance}.
     * Accepts the {@link DistanceFunction} names and aliases and {@code minkowski:<m>[:sum|max]}.
     */
    public static class DistanceConverter implements CommandLine.ITypeConverter<Distance> {

        @Override
        public Distance convert(String value) {
            return DistanceFunction.fromName(value);
        }
    }

    @CommandLine.Option(
        names = {"-m", "--metric"},
        description = {
            "Distance metrics to try, comma separated:",
            "  EUCLIDEAN (L2), MANHATTAN (L1, cityblock), CHEBYSHEV (LINF), SORENSEN",
            "  minkowski:<m>[:sum|max] for the generalized form",
            "Default: ${DEFAULT-VALUE}"
        },
        split = ",",
        converter = DistanceConverter.class,
        defaultValue = "EUCLIDEAN,MANHATTAN,CHEBYSHEV,SORENSEN"
    )
    private List<Distance> distances = new ArrayList<>();

    /**
     * Gets the selected metrics, without duplicates, in the order given.
     *
     * @return the distance metrics
     */
    public List<Distance> getDistances() {
        return List.copyOf(new LinkedHashSet<>(distances));
    }
}
