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

/// Standardized Epanechnikov (parabolic) kernel over location ± √5·bandwidth.
///
/// The √5 stretch gives the kernel a standard deviation equal to its bandwidth,
/// so it can be swapped with [GaussianKernel] or [UniformKernel] without
/// re-tuning the bandwidth multiplier.
///
/// Sampling draws three iid uniforms, keeps the two smallest, picks one of those
/// two at random, flips its sign at random and scales by √5·bandwidth.
///
/// @param <P> the parameter type
public final class EpanechnikovKernel<P extends Comparable<? super P>> extends AffineKernel<P> {

    private static final double SQRT_5 = Math.sqrt(5.0);
    private static final double NORMALIZATION = 0.75 / SQRT_5;

    /// Constructs an Epanechnikov kernel.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param location the kernel center
    /// @param bandwidth the standard deviation
    /// @throws IllegalArgumentException if bandwidth is not strictly positive
    public EpanechnikovKernel(Arithmetic<P> arithmetic, P location, P bandwidth) {
        super(arithmetic, arithmetic.toDouble(location), arithmetic.toDouble(bandwidth));
    }

    /// Returns a family producing Epanechnikov kernels.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param <P> the parameter type
    /// @return the Epanechnikov kernel family
    public static <P extends Comparable<? super P>> KernelFamily<P> family(Arithmetic<P> arithmetic) {
        return (location, bandwidth) -> new EpanechnikovKernel<>(arithmetic, location, bandwidth);
    }

    @Override
    double standardDensity(double z) {
        double normalized = z / SQRT_5;
        if (normalized < -1.0 || normalized > 1.0) {
            return 0.0;
        }
        return NORMALIZATION * (1.0 - normalized * normalized);
    }

    @Override
    double standardSample(UniformRandomProvider rng) {
        double[] smallest = minTwo(rng.nextDouble(), rng.nextDouble(), rng.nextDouble());
        double magnitude = rng.nextBoolean() ? smallest[0] : smallest[1];
        double normalized = rng.nextBoolean() ? magnitude : -magnitude;
        return normalized * SQRT_5;
    }

    /// Returns the two smallest of three values; the first element is not
    /// necessarily the smaller of the two.
    static double[] minTwo(double x1, double x2, double x3) {
        if (x1 > x2) {
            double swap = x1;
            x1 = x2;
            x2 = swap;
        }
        return new double[]{x1, Math.min(x2, x3)};
    }
}
