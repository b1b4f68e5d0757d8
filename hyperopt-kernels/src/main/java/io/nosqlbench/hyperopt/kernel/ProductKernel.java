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

import io.nosqlbench.hyperopt.numeric.Point;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Multivariate kernel over [Point]s: one independent kernel per coordinate.
///
/// # Density
///
/// The density is the product of the coordinate densities, so it is zero as
/// soon as any coordinate falls outside its kernel's support. Coordinates are
/// treated as independent; correlation between parameters is only captured
/// through where the components are placed, which is at good (or bad)
/// combinations of coordinates rather than at every combination of good
/// coordinates.
///
/// # Sampling
///
/// Each coordinate is drawn from its own kernel, in coordinate order.
///
/// ```java
/// // a prior over the box [0, 1] x [-5, 5]
/// ProductKernel<Double> prior = ProductKernel.of(
///     UniformKernel.withBounds(doubles, 0.0, 1.0),
///     UniformKernel.withBounds(doubles, -5.0, 5.0));
///
/// // components with a Gaussian in each coordinate
/// KernelFamily<Point<Double>> family = ProductKernel.family(
///     GaussianKernel.family(doubles), GaussianKernel.family(doubles));
/// ```
///
/// @param <P> the coordinate type
public final class ProductKernel<P extends Comparable<? super P>> implements Kernel<Point<P>> {

    private final List<Kernel<P>> kernels;

    /// Constructs a product of coordinate kernels.
    ///
    /// @param kernels one kernel per coordinate, at least one
    /// @throws IllegalArgumentException if no kernel is given
    public ProductKernel(List<? extends Kernel<P>> kernels) {
        if (kernels.isEmpty()) {
            throw new IllegalArgumentException("A product kernel needs at least one coordinate kernel");
        }
        this.kernels = List.copyOf(kernels);
    }

    /// @param kernels one kernel per coordinate
    /// @param <P> the coordinate type
    /// @return the product kernel
    @SafeVarargs
    public static <P extends Comparable<? super P>> ProductKernel<P> of(Kernel<P>... kernels) {
        return new ProductKernel<>(Arrays.asList(kernels));
    }

    /// Returns a family building one kernel per coordinate from the matching
    /// coordinates of the location and bandwidth.
    ///
    /// @param families one family per coordinate
    /// @param <P> the coordinate type
    /// @return the product family
    public static <P extends Comparable<? super P>> KernelFamily<Point<P>> family(List<? extends KernelFamily<P>> families) {
        List<KernelFamily<P>> perCoordinate = List.copyOf(families);
        if (perCoordinate.isEmpty()) {
            throw new IllegalArgumentException("A product family needs at least one coordinate family");
        }
        return (location, bandwidth) -> {
            requireDimensions(location, perCoordinate.size());
            requireDimensions(bandwidth, perCoordinate.size());
            List<Kernel<P>> kernels = new ArrayList<>(perCoordinate.size());
            for (int i = 0; i < perCoordinate.size(); i++) {
                kernels.add(perCoordinate.get(i).create(location.get(i), bandwidth.get(i)));
            }
            return new ProductKernel<>(kernels);
        };
    }

    /// @param families one family per coordinate
    /// @param <P> the coordinate type
    /// @return the product family
    @SafeVarargs
    public static <P extends Comparable<? super P>> KernelFamily<Point<P>> family(KernelFamily<P>... families) {
        return family(Arrays.asList(families));
    }

    private static void requireDimensions(Point<?> point, int dimensions) {
        if (point.dimensions() != dimensions) {
            throw new IllegalArgumentException("Expected a point of " + dimensions + " dimensions, got: " + point);
        }
    }

    @Override
    public double density(Point<P> at) {
        requireDimensions(at, kernels.size());
        double product = 1.0;
        for (int i = 0; i < kernels.size() && product != 0.0; i++) {
            product *= kernels.get(i).density(at.get(i));
        }
        return product;
    }

    @Override
    public Point<P> sample(UniformRandomProvider rng) {
        List<P> coordinates = new ArrayList<>(kernels.size());
        for (Kernel<P> kernel : kernels) {
            coordinates.add(kernel.sample(rng));
        }
        return Point.of(coordinates);
    }

    public int dimensions() {
        return kernels.size();
    }

    /// @return the coordinate kernels, unmodifiable
    public List<Kernel<P>> getKernels() {
        return kernels;
    }

    @Override
    public String toString() {
        return "ProductKernel" + kernels;
    }
}
