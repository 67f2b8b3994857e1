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

import io.nosqlbench.knntune.SyntheticSamples;
import io.nosqlbench.knntune.classify.SelectionStrategy;
import io.nosqlbench.knntune.distance.DistanceFunction;
import io.nosqlbench.knntune.partition.PartitionRule;
import io.nosqlbench.knntune.samples.ClassifiedSample;
import io.nosqlbench.knntune.samples.UnknownSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TrainingData")
class TrainingDataTest {

    @Test
    @DisplayName("should record tuning history and classify with the best result")
    void shouldRecordHistoryAndClassifyWithBest() throws InterruptedException {
        TrainingData data = TrainingData.of("clusters", SyntheticSamples.clusters(150, 17L), PartitionRule.everyNth(5));
        GridSearchTuner tuner = new GridSearchTuner(TunerConfig.builder().threads(2).build());

        assertThat(data.getTested()).isEmpty();
        assertThat(data.best()).isEmpty();

        List<TrialResult> results = data.tune(tuner, List.of(1, 3, 5), List.of(DistanceFunction.values()));

        assertThat(results).hasSize(12);
        assertThat(data.getHistory()).containsExactlyElementsOf(results);
        assertThat(data.getTested()).isPresent();
        assertThat(data.getTested().get()).isAfterOrEqualTo(data.getUploaded());

        TrialResult best = data.best().orElseThrow();
        assertThat(results).allSatisfy(r -> assertThat(r.quality()).isLessThanOrEqualTo(best.quality()));

        UnknownSample unknown = UnknownSample.of(5.0, 3.4, 1.5, 0.2);
        ClassifiedSample classified = data.classify(unknown);
        assertThat(classified.features()).containsExactly(unknown.features());
        assertThat(classified.classification())
            .isEqualTo(data.classify(best.k(), best.distance(), best.strategy(), unknown).classification());
    }

    @Test
    @DisplayName("should refuse best-result classification before tuning")
    void shouldRefuseClassifyBeforeTuning() {
        TrainingData data = TrainingData.of("clusters", SyntheticSamples.clusters(30, 1L), PartitionRule.everyNth(5));

        assertThatThrownBy(() -> data.classify(UnknownSample.of(1, 2, 3, 4)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("clusters");
        assertThat(data.classify(1, DistanceFunction.EUCLIDEAN, SelectionStrategy.HEAP, UnknownSample.of(5.0, 3.4, 1.5, 0.2))
            .classification()).isIn("setosa", "versicolor", "virginica");
    }
}
