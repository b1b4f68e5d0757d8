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

import io.nosqlbench.hyperopt.kernel.KernelType;
import io.nosqlbench.hyperopt.kernel.UniformKernel;
import io.nosqlbench.hyperopt.numeric.Arithmetic;
import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for candidate proposal and acquisition scoring.
 *
 * <p>Measures how proposal cost grows with the number of fed-back trials,
 * since both estimators are rebuilt on every call.
 *
 * <p>Run with:
 * <pre>
 * mvn -pl hyperopt-optimizer test-compile exec:java \
 *     -Dexec.mainClass="io.nosqlbench.hyperopt.optimizer.NewTrialJmhBenchmark" \
 *     -Dexec.classpathScope=test
 * </pre>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(value = 1)
public class NewTrialJmhBenchmark {

    @Param({"10", "100", "1000"})
    private int trials;

    @Param({"GAUSSIAN", "EPANECHNIKOV", "UNIFORM"})
    private String kernel;

    private Optimizer<Double, Double> optimizer;
    private UniformRandomProvider rng;

    @Setup(Level.Trial)
    public void setup() {
        Arithmetic<Double> doubles = Arithmetic.ofDouble();
        optimizer = new Optimizer<>(doubles, -10.0, 10.0,
            UniformKernel.withBounds(doubles, -10.0, 10.0),
            KernelType.valueOf(kernel).family(doubles));
        rng = RandomGenerators.create(17L);
        while (optimizer.trialCount() < trials) {
            double x = rng.nextDouble() * 20.0 - 10.0;
            optimizer.feedBack(x, Math.sin(x) + 0.1 * x * x);
        }
    }

    @Benchmark
    public double newTrial() {
        return optimizer.newTrial(rng);
    }

    @Benchmark
    public double acquisition() {
        return optimizer.acquisition(rng.nextDouble() * 20.0 - 10.0);
    }

    /**
     * Run the benchmarks.
     */
    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
            .include(NewTrialJmhBenchmark.class.getSimpleName())
            .forks(1)
            .build();

        new Runner(opt).run();
    }
}
