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

package io.nosqlbench.hyperopt.optimizer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrialTest {

    @Test
    void ordersByMetricThenSequence() {
        Trial<Double, Double> late = new Trial<>(1.0, 2.0, 5);
        Trial<Double, Double> early = new Trial<>(3.0, 2.0, 1);
        Trial<Double, Double> best = new Trial<>(2.0, 0.5, 9);

        List<Trial<Double, Double>> trials = new ArrayList<>(List.of(late, early, best));
        trials.sort(Trial.byMetric());

        assertThat(trials).containsExactly(best, early, late);
    }

    @Test
    void rejectsNullFields() {
        assertThatThrownBy(() -> new Trial<Double, Double>(null, 1.0, 0)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Trial<Double, Double>(1.0, null, 0)).isInstanceOf(NullPointerException.class);
    }
}
