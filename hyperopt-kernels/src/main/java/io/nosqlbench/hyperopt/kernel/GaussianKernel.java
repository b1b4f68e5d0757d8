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
import org.apache.commons.rng.UniformRandomProvider;

/// Gaussian kernel with the bandwidth as its standard deviation.
///
/// Density follows the normal formula `φ(z) / bandwidth` with
/// `z = (x - location) / bandwidth`. Samples are produced with the
/// Box–Muller transform from two independent uniform draws.
///
/// @param <P> the parameter type
public final class GaussianKernel<P extends Comparable<? super P>> extends AffineKernel<P> {

    private static final double FRAC_1_SQRT_TAU = 1.0 / Math.sqrt(2.0 * Math.PI);
    private static final double TAU = 2.0 * Math.PI;

    /// Constructs a Gaussian kernel.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param location the mean
    /// @param bandwidth the standard deviation
    /// @throws IllegalArgumentException if bandwidth is not strictly positive
    public GaussianKernel(Arithmetic<P> arithmetic, P location, P bandwidth) {
        super(arithmetic, arithmetic.toDouble(location), arithmetic.toDouble(bandwidth));
    }

    /// Returns a family producing Gaussian kernels.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param <P> the parameter type
    /// @return the Gaussian kernel family
    public static <P extends Comparable<? super P>> KernelFamily<P> family(Arithmetic<P> arithmetic) {
        return (location, bandwidth) -> new GaussianKernel<>(arithmetic, location, bandwidth);
    }

    /// Creates the zero-centered standard normal kernel for continuous parameters.
    ///
    /// @return N(0, 1)
    public static GaussianKernel<Double> standard() {
        return new GaussianKernel<>(Arithmetic.ofDouble(), 0.0, 1.0);
    }

    @Override
    double standardDensity(double z) {
        return FRAC_1_SQRT_TAU * Math.exp(-0.5 * z * z);
    }

    @Override
    double standardSample(UniformRandomProvider rng) {
        // u1 in (0, 1] keeps the logarithm finite
        double u1 = 1.0 - rng.nextDouble();
        double u2 = rng.nextDouble();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(TAU * u2);
    }
}
