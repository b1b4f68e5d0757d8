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

import io.nosqlbench.hyperopt.numeric.Arithmetic;
import io.nosqlbench.hyperopt.numeric.Point;
import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProductKernelTest {

    private static final Arithmetic<Long> LONGS = Arithmetic.ofLong();
    private static final Arithmetic<Double> DOUBLES = Arithmetic.ofDouble();

    @Test
    void samplesEachCoordinateFromItsKernel() {
        ProductKernel<Long> kernel = ProductKernel.of(
            UniformKernel.withBounds(LONGS, 1L, 1L),
            UniformKernel.withBounds(LONGS, 2L, 2L));
        UniformRandomProvider rng = RandomGenerators.create(5L);
        for (int i = 0; i < 50; i++) {
            assertThat(kernel.sample(rng)).isEqualTo(Point.of(1L, 2L));
        }
        assertThat(kernel.dimensions()).isEqualTo(2);
    }

    @Test
    void densityIsTheProductOfCoordinateDensities() {
        ProductKernel<Double> kernel = ProductKernel.of(
            UniformKernel.withBounds(DOUBLES, 0.0, 2.0),
            GaussianKernel.standard());
        double expected = 0.5 * GaussianKernel.standard().density(1.0);
        assertThat(kernel.density(Point.of(1.0, 1.0))).isCloseTo(expected, within(1e-12));
        assertThat(kernel.density(Point.of(3.0, 0.0))).isEqualTo(0.0);
    }

    @Test
    void samplesStayInsideTheBox() {
        ProductKernel<Double> kernel = ProductKernel.of(
            UniformKernel.withBounds(DOUBLES, 0.0, 1.0),
            UniformKernel.withBounds(DOUBLES, -5.0, 5.0));
        UniformRandomProvider rng = RandomGenerators.create(6L);
        for (int i = 0; i < 1000; i++) {
            Point<Double> sample = kernel.sample(rng);
            assertThat(sample.get(0)).isBetween(0.0, 1.0);
            assertThat(sample.get(1)).isBetween(-5.0, 5.0);
        }
    }

    @Test
    void familyBuildsOneKernelPerCoordinate() {
        KernelFamily<Point<Double>> family = ProductKernel.family(
            GaussianKernel.family(DOUBLES), UniformKernel.family(DOUBLES));
        Kernel<Point<Double>> kernel = family.create(Point.of(0.0, 3.0), Point.of(1.0, 2.0));

        assertThat(kernel).isInstanceOf(ProductKernel.class);
        List<Kernel<Double>> parts = ((ProductKernel<Double>) kernel).getKernels();
        assertThat(parts.get(0)).isInstanceOf(GaussianKernel.class);
        assertThat(parts.get(1)).isInstanceOf(UniformKernel.class);
        assertThat(((UniformKernel<Double>) parts.get(1)).getLocation()).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void rejectsMismatchedDimensions() {
        KernelFamily<Point<Double>> family = ProductKernel.family(
            GaussianKernel.family(DOUBLES), GaussianKernel.family(DOUBLES));
        assertThatThrownBy(() -> family.create(Point.of(0.0), Point.of(1.0, 1.0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> family.create(Point.of(0.0, 0.0), Point.of(1.0, 1.0, 1.0))).isInstanceOf(IllegalArgumentException.class);

        ProductKernel<Double> kernel = ProductKernel.of(GaussianKernel.standard(), GaussianKernel.standard());
        assertThatThrownBy(() -> kernel.density(Point.of(0.0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProductKernel<Double>(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
