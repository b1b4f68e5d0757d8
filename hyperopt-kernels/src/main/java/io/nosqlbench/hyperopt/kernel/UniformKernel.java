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

/**
 * Uniform ("boxcar") kernel over location ± √3·bandwidth.
 *
 * <h2>Properties</h2>
 *
 * <ul>
 *   <li><b>Support</b>: [location - √3·bandwidth, location + √3·bandwidth]</li>
 *   <li><b>Standard Deviation</b>: bandwidth</li>
 *   <li><b>PDF</b>: 1 / (2√3·bandwidth) inside the support, 0 otherwise</li>
 * </ul>
 *
 * <h2>Sampling</h2>
 *
 * <p>One uniform draw u ∈ [0, 1) mapped linearly onto the support.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * // A prior that covers the whole search range
 * UniformKernel<Double> prior = UniformKernel.withBounds(Arithmetic.ofDouble(), -10.0, 10.0);
 *
 * // A family for trial components
 * KernelFamily<Double> family = UniformKernel.family(Arithmetic.ofDouble());
 * }</pre>
 *
 * @param <P> the parameter type
 */
public final class UniformKernel<P extends Comparable<? super P>> extends AffineKernel<P> {

    static final double SQRT_3 = Math.sqrt(3.0);
    private static final double DOUBLE_SQRT_3 = 2.0 * SQRT_3;

    /**
     * Constructs a uniform kernel.
     *
     * @param arithmetic the parameter arithmetic
     * @param location the center of the box
     * @param bandwidth the standard deviation of the box
     * @throws IllegalArgumentException if bandwidth is not strictly positive
     */
    public UniformKernel(Arithmetic<P> arithmetic, P location, P bandwidth) {
        this(arithmetic, arithmetic.toDouble(location), arithmetic.toDouble(bandwidth));
    }

    private UniformKernel(Arithmetic<P> arithmetic, double location, double bandwidth) {
        super(arithmetic, location, bandwidth);
    }

    /**
     * Creates a uniform kernel over [min, max].
     *
     * <p>For continuous parameters the box spans exactly [min, max]. For integral
     * parameters it spans [min - 0.5, max + 0.5), so that after rounding every
     * integer in [min, max] is drawn with the same probability; a single
     * integer ({@code min == max}) is allowed.
     *
     * @param arithmetic the parameter arithmetic
     * @param min the lowest value
     * @param max the highest value
     * @param <P> the parameter type
     * @return a kernel uniform over [min, max]
     * @throws IllegalArgumentException if the range is empty
     */
    public static <P extends Comparable<? super P>> UniformKernel<P> withBounds(Arithmetic<P> arithmetic, P min, P max) {
        int order = min.compareTo(max);
        if (order > 0 || (order == 0 && !arithmetic.isIntegral())) {
            throw new IllegalArgumentException("Lower bound must be less than upper: " + min + " >= " + max);
        }
        double halfStep = arithmetic.isIntegral() ? 0.5 : 0.0;
        double lower = arithmetic.toDouble(min) - halfStep;
        double upper = arithmetic.toDouble(max) + halfStep;
        return new UniformKernel<>(arithmetic, (lower + upper) / 2.0, (upper - lower) / DOUBLE_SQRT_3);
    }

    /**
     * Returns a family producing uniform kernels.
     *
     * @param arithmetic the parameter arithmetic
     * @param <P> the parameter type
     * @return the uniform kernel family
     */
    public static <P extends Comparable<? super P>> KernelFamily<P> family(Arithmetic<P> arithmetic) {
        return (location, bandwidth) -> new UniformKernel<>(arithmetic, location, bandwidth);
    }

    /**
     * @return the lower edge of the support
     */
    public double getLower() {
        return getLocation() - SQRT_3 * getBandwidth();
    }

    /**
     * @return the upper edge of the support
     */
    public double getUpper() {
        return getLocation() + SQRT_3 * getBandwidth();
    }

    @Override
    double standardDensity(double z) {
        if (z < -SQRT_3 || z > SQRT_3) {
            return 0.0;
        }
        return 1.0 / DOUBLE_SQRT_3;
    }

    @Override
    double standardSample(UniformRandomProvider rng) {
        return rng.nextDouble() * DOUBLE_SQRT_3 - SQRT_3;
    }
}
