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

/// Factory for kernels of one type, located and scaled on demand.
///
/// Families are how the optimizer turns a (location, bandwidth) pair derived
/// from neighboring trials into a concrete [Kernel].
///
/// @param <P> the parameter type
@FunctionalInterface
public interface KernelFamily<P> {

    /// Builds a kernel centered at `location` with the given bandwidth.
    ///
    /// @param location the kernel center
    /// @param bandwidth the kernel spread, must be strictly positive
    /// @return a new kernel
    /// @throws IllegalArgumentException if the bandwidth is not strictly positive
    Kernel<P> create(P location, P bandwidth);
}
