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

package io.nosqlbench.hyperopt.config;

import io.nosqlbench.hyperopt.kernel.KernelType;
import io.nosqlbench.hyperopt.optimizer.Optimizer;
import io.nosqlbench.hyperopt.optimizer.OptimizerOptions;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimizerConfigTest {

    private static final String FULL = """
        {
          "min": -5.0,
          "max": 5.0,
          "kernel": "epanechnikov",
          "prior": {"kernel": "gaussian", "location": 1.0, "bandwidth": 2.0},
          "cutoff": 0.2,
          "n_candidates": 40,
          "bandwidth_multiplier": 0.75,
          "seed": 1234
        }
        """;

    @Test
    void parsesFullDocument() {
        OptimizerConfig config = OptimizerConfig.fromJson(FULL);

        assertThat(config.getMin()).isEqualTo(-5.0);
        assertThat(config.getMax()).isEqualTo(5.0);
        assertThat(config.getKernelType()).isEqualTo(KernelType.EPANECHNIKOV);
        assertThat(config.getPrior().getLocation()).isEqualTo(1.0);
        assertThat(config.getSeed()).isEqualTo(1234L);

        OptimizerOptions options = config.toOptions();
        assertThat(options.cutoff()).isEqualTo(0.2);
        assertThat(options.candidates()).isEqualTo(40);
        assertThat(options.bandwidthMultiplier()).isEqualTo(0.75);
    }

    @Test
    void buildsContinuousOptimizer() {
        OptimizerConfig config = OptimizerConfig.fromJson(new StringReader(FULL));
        Optimizer<Double, Double> optimizer = config.buildContinuous();
        UniformRandomProvider rng = config.createRandom();

        assertThat(optimizer.getMin()).isEqualTo(-5.0);
        assertThat(optimizer.getMax()).isEqualTo(5.0);
        assertThat(optimizer.getOptions().candidates()).isEqualTo(40);
        for (int i = 0; i < 20; i++) {
            double parameter = optimizer.newTrial(rng);
            assertThat(parameter).isBetween(-5.0, 5.0);
            optimizer.feedBack(parameter, parameter * parameter);
        }
    }

    @Test
    void seededSourcesRepeat() {
        OptimizerConfig config = OptimizerConfig.fromJson(FULL);
        Optimizer<Double, Double> first = config.buildContinuous();
        Optimizer<Double, Double> second = config.buildContinuous();

        assertThat(first.newTrial(config.createRandom())).isEqualTo(second.newTrial(config.createRandom()));
    }

    @Test
    void minimalDocumentUsesDefaults() {
        OptimizerConfig config = OptimizerConfig.fromJson("{\"min\": 0, \"max\": 1}");

        assertThat(config.getKernelType()).isEqualTo(KernelType.GAUSSIAN);
        assertThat(config.getPrior()).isNull();
        OptimizerOptions options = config.toOptions();
        assertThat(options.cutoff()).isEqualTo(OptimizerOptions.DEFAULT_CUTOFF);
        assertThat(options.candidates()).isEqualTo(OptimizerOptions.DEFAULT_CANDIDATES);

        Optimizer<Double, Double> optimizer = config.buildContinuous();
        assertThat(optimizer.newTrial(config.createRandom())).isBetween(0.0, 1.0);
    }

    @Test
    void buildsDiscreteOptimizerWithBinomialKernels() {
        OptimizerConfig config = OptimizerConfig.fromJson("""
            {
              "min": 0,
              "max": 40,
              "kernel": "binomial",
              "prior": {"kernel": "binomial", "location": 20, "bandwidth": 4},
              "seed": 7
            }
            """);
        Optimizer<Long, Long> optimizer = config.buildDiscrete();
        UniformRandomProvider rng = config.createRandom();

        for (int i = 0; i < 30; i++) {
            long parameter = optimizer.newTrial(rng);
            assertThat(parameter).isBetween(0L, 40L);
            optimizer.feedBack(parameter, Math.abs(parameter - 12L));
        }
        assertThat(optimizer.trialCount()).isEqualTo(30);
    }

    @Test
    void binomialKernelNeedsIntegerParameters() {
        OptimizerConfig config = OptimizerConfig.fromJson("{\"min\": 0, \"max\": 10, \"kernel\": \"binomial\"}");
        assertThatThrownBy(config::buildContinuous).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"min\": 0, \"max\": 2000000, \"kernel\": \"binomial\"}",
        "{\"min\": -1, \"max\": 10, \"kernel\": \"binomial\"}"
    })
    void binomialKernelNeedsRangeItCanCenterOn(String json) {
        OptimizerConfig config = OptimizerConfig.fromJson(json);
        assertThatThrownBy(config::buildDiscrete).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"max\": 1}",
        "{\"min\": 2, \"max\": 1}",
        "{\"min\": 0, \"max\": 1, \"kernel\": \"triangle\"}",
        "{\"min\": 0, \"max\": 1, \"cutoff\": 1.5}",
        "{\"min\": 0, \"max\": 1, \"n_candidates\": 0}",
        "{\"min\": 0, \"max\": 1, \"bandwidth_multiplier\": -1}",
        "{\"min\": 0, \"max\": 1, \"prior\": {\"kernel\": \"gaussian\", \"location\": 0.5}}",
        "{\"min\": 0, \"max\": 1, \"prior\": {\"kernel\": \"gaussian\", \"location\": 0.5, \"bandwidth\": 0}}"
    })
    void rejectsInvalidDocuments(String json) {
        assertThatThrownBy(() -> OptimizerConfig.fromJson(json).buildContinuous())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not json", "{\"min\": \"low\"}"})
    void rejectsMalformedJson(String json) {
        assertThatThrownBy(() -> OptimizerConfig.fromJson(json))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void savesAndLoadsFile(@TempDir Path dir) throws IOException {
        OptimizerConfig config = new OptimizerConfig();
        config.setMin(1.0);
        config.setMax(9.0);
        config.setKernel("uniform");
        config.setPrior(new OptimizerConfig.PriorConfig("epanechnikov", 4.0, 1.5));
        config.setCutoff(0.3);
        config.setSeed(99L);

        Path file = dir.resolve("optimizer.json");
        config.saveToFile(file);
        OptimizerConfig loaded = OptimizerConfig.loadFromFile(file);

        assertThat(loaded.getMin()).isEqualTo(1.0);
        assertThat(loaded.getMax()).isEqualTo(9.0);
        assertThat(loaded.getKernelType()).isEqualTo(KernelType.UNIFORM);
        assertThat(loaded.getPrior().getKernel()).isEqualTo("epanechnikov");
        assertThat(loaded.getPrior().getBandwidth()).isEqualTo(1.5);
        assertThat(loaded.getCutoff()).isEqualTo(0.3);
        assertThat(loaded.getCandidates()).isNull();
        assertThat(loaded.getSeed()).isEqualTo(99L);
        assertThat(loaded.toJson()).contains("\"cutoff\": 0.3");
    }
}
