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

/// Base for kernels that are a standard shape shifted by a location and
/// stretched by a bandwidth.
///
/// Subclasses describe the unit shape only. This class applies the affine
/// transform `x = location + bandwidth · z` and the matching `1 / bandwidth`
/// density scaling, converting through the parameter [Arithmetic].
///
/// @param <P> the parameter type
abstract class AffineKernel<P extends Comparable<? super P>> implements Kernel<P> {

    private final Arithmetic<P> arithmetic;
    private final double location;
    private final double bandwidth;

    AffineKernel(Arithmetic<P> arithmetic, double location, double bandwidth) {
        if (!(bandwidth > 0.0) || !Double.isFinite(bandwidth)) {
            throw new IllegalArgumentException("Bandwidth must be strictly positive and finite, got: " + bandwidth);
        }
        if (!Double.isFinite(location)) {
            throw new IllegalArgumentException("Location must be finite, got: " + location);
        }
        this.arithmetic = arithmetic;
        this.location = location;
        this.bandwidth = bandwidth;
    }

    /// Density of the unit shape at a standardized point.
    abstract double standardDensity(double z);

    /// Sample of the unit shape.
    abstract double standardSample(UniformRandomProvider rng);

    @Override
    public double density(P at) {
        double z = (arithmetic.toDouble(at) - location) / bandwidth;
        return standardDensity(z) / bandwidth;
    }

    @Override
    public P sample(UniformRandomProvider rng) {
        return arithmetic.fromDouble(location + bandwidth * standardSample(rng));
    }

    public double getLocation() {
        return location;
    }

    public double getBandwidth() {
        return bandwidth;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[location=" + location + ", bandwidth=" + bandwidth + "]";
    }
}
