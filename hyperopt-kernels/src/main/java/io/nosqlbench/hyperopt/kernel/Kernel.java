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

import org.apache.commons.rng.UniformRandomProvider;

/// A located, scaled kernel that can be evaluated and sampled.
///
/// # Overview
///
/// Kernels are the building blocks of a
/// [io.nosqlbench.hyperopt.kde.KernelDensityEstimator]. Each kernel is bound to
/// a location and a bandwidth at construction time, so evaluation only needs
/// the point and sampling only needs the random source.
///
/// ```text
///   density(at)  : P ──► double      (0.0 outside the support)
///   sample(rng)  : rng ──► P         (uses nextDouble / nextBoolean only)
/// ```
///
/// # Implementations
///
/// | Kernel | Support | Sampling |
/// |--------|---------|----------|
/// | [UniformKernel] | location ± √3·bandwidth | one uniform draw |
/// | [GaussianKernel] | unbounded | Box–Muller |
/// | [EpanechnikovKernel] | location ± √5·bandwidth | median-of-three |
/// | [BinomialKernel] | 0..n | inverse CDF search |
/// | [ProductKernel] | product of its coordinate kernels | one draw per coordinate |
///
/// @param <P> the parameter type
/// @see KernelFamily
public interface Kernel<P> {

    /// Evaluates the kernel density at a point.
    ///
    /// @param at the point to evaluate
    /// @return the density, exactly 0.0 outside the kernel's support
    double density(P at);

    /// Draws one value distributed according to this kernel.
    ///
    /// @param rng the random source
    /// @return a sampled value
    P sample(UniformRandomProvider rng);
}
