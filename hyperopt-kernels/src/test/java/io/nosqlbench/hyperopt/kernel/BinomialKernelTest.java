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

package io.nosqlbench.hyperopt.kernel;

import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BinomialKernelTest {

    private final BinomialKernel twentyHalf = new BinomialKernel(20, 0.5);

    @Test
    void pmf() {
        assertThat(twentyHalf.pmf(10)).isCloseTo(0.176_197, within(0.000_001));
        assertThat(twentyHalf.pmf(5)).isCloseTo(0.014_786, within(0.000_001));
        assertThat(twentyHalf.pmf(-1)).isEqualTo(0.0);
        assertThat(twentyHalf.pmf(21)).isEqualTo(0.0);
    }

    @Test
    void pmfMatchesReference() {
        BinomialKernel kernel = new BinomialKernel(137, 0.23);
        BinomialDistribution reference = new BinomialDistribution(137, 0.23);
        for (int k = 0; k <= 137; k += 7) {
            assertThat(kernel.density((long) k)).isCloseTo(reference.probability(k), within(1e-12));
        }
    }

    @Test
    void inverseCdf() {
        assertThat(twentyHalf.inverseCdf(0.588)).isEqualTo(10L);
        assertThat(twentyHalf.inverseCdf(0.0206)).isEqualTo(5L);
        assertThat(twentyHalf.inverseCdf(0.0)).isEqualTo(0L);
        assertThat(twentyHalf.inverseCdf(1.0)).isEqualTo(20L);
    }

    @Test
    void std() {
        assertThat(twentyHalf.std()).isCloseTo(2.23607, within(0.00001));
        assertThat(twentyHalf.mean()).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void fromLocationMatchesMoments() {
        BinomialKernel kernel = BinomialKernel.fromLocation(50, 5);
        assertThat(kernel.getTrials()).isEqualTo(100);
        assertThat(kernel.getSuccessRate()).isCloseTo(0.5, within(1e-12));
        assertThat(kernel.mean()).isCloseTo(50.0, within(1e-9));
        assertThat(kernel.std()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void fromLocationClampsSuccessRate() {
        // variance 4 exceeds the mean 3, moment matching is impossible
        BinomialKernel kernel = BinomialKernel.fromLocation(3, 2);
        assertThat(kernel.getSuccessRate()).isCloseTo(BinomialKernel.MIN_SUCCESS_RATE, within(1e-12));
        assertThat(kernel.getTrials()).isEqualTo(300);
        assertThat(kernel.mean()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void fromLocationAtZero() {
        BinomialKernel kernel = BinomialKernel.fromLocation(0, 1);
        assertThat(kernel.getTrials()).isEqualTo(1);
        assertThat(kernel.density(0L) > kernel.density(1L)).isTrue();
    }

    @Test
    void fromLocationKeepsMeanWhenTrialsAreCapped() {
        BinomialKernel kernel = BinomialKernel.fromLocation(50_000, 1_000);
        assertThat(kernel.getTrials()).isEqualTo(BinomialKernel.MAX_TRIALS);
        assertThat(kernel.mean()).isCloseTo(50_000.0, within(1.0));
        assertThat(kernel.density(50_000L)).isGreaterThan(0.0);

        UniformRandomProvider rng = RandomGenerators.create(17L);
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < 200; i++) {
            stats.addValue(kernel.sample(rng));
        }
        assertThat(stats.getMean()).isCloseTo(50_000.0, within(100.0));
    }

    @Test
    void fromLocationRejectsLocationsBeyondTheTrialCap() {
        assertThat(BinomialKernel.fromLocation(BinomialKernel.MAX_LOCATION, 1).mean())
            .isCloseTo(BinomialKernel.MAX_LOCATION, within(1.0));
        assertThatThrownBy(() -> BinomialKernel.fromLocation(BinomialKernel.MAX_LOCATION + 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromLocationRejectsInvalidInput() {
        assertThatThrownBy(() -> BinomialKernel.fromLocation(5, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BinomialKernel.fromLocation(-1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BinomialKernel(0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BinomialKernel(10, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void samplingMoments() {
        BinomialKernel kernel = BinomialKernel.fromLocation(40, 4);
        UniformRandomProvider rng = RandomGenerators.create(9L);
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < 50_000; i++) {
            long sample = kernel.sample(rng);
            assertThat(sample >= 0 && sample <= kernel.getTrials()).isTrue();
            stats.addValue(sample);
        }
        assertThat(stats.getMean()).isCloseTo(kernel.mean(), within(0.1));
        assertThat(stats.getStandardDeviation()).isCloseTo(kernel.std(), within(0.1));
    }
}
