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

package io.nosqlbench.hyperopt.kde;

import io.nosqlbench.hyperopt.kernel.Kernel;
import io.nosqlbench.hyperopt.kernel.KernelFamily;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/// One (kernel, location, bandwidth) member of a kernel density estimator.
///
/// The kernel is built from its family once, at construction, so the
/// family's bandwidth validation applies to every component.
///
/// @param <P> the parameter type
public final class Component<P> implements Kernel<P> {

    private final P location;
    private final P bandwidth;
    private final Kernel<P> kernel;

    /// Creates a component.
    ///
    /// @param family the kernel family
    /// @param location the kernel center
    /// @param bandwidth the kernel spread
    /// @throws IllegalArgumentException if the family rejects the bandwidth
    public Component(KernelFamily<P> family, P location, P bandwidth) {
        this.location = Objects.requireNonNull(location, "location");
        this.bandwidth = Objects.requireNonNull(bandwidth, "bandwidth");
        this.kernel = family.create(location, bandwidth);
    }

    public P getLocation() {
        return location;
    }

    public P getBandwidth() {
        return bandwidth;
    }

    public Kernel<P> getKernel() {
        return kernel;
    }

    @Override
    public double density(P at) {
        return kernel.density(at);
    }

    @Override
    public P sample(UniformRandomProvider rng) {
        return kernel.sample(rng);
    }

    @Override
    public String toString() {
        return "Component[location=" + location + ", bandwidth=" + bandwidth + ", kernel=" + kernel + "]";
    }
}
