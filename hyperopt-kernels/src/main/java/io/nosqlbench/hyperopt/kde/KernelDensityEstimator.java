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
import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;

/// Kernel density estimator: an unweighted mixture of kernels.
///
/// # Overview
///
/// The estimator does not own its components. It wraps a restartable
/// [Iterable] that is typically a lazy view over a trial ledger, so the
/// estimator always reflects the ledger's current contents and the component
/// count is never known in advance.
///
/// ```text
///   density(x) = (1/k) · Σ component_i.density(x)      0.0 when k = 0
///
///   sample(rng):
///     held = none
///     for i, component in components:
///        if uniform integer in [0, i] == 0: held = component   ◄── reservoir
///     return held?.sample(rng)                          empty when k = 0
/// ```
///
/// Reservoir sampling picks every one of the k components with probability
/// 1/k in a single pass.
///
/// @param <P> the parameter type
public final class KernelDensityEstimator<P> {

    private final Iterable<? extends Kernel<P>> components;

    private KernelDensityEstimator(Iterable<? extends Kernel<P>> components) {
        this.components = Objects.requireNonNull(components, "components");
    }

    /// Creates an estimator over the given components.
    ///
    /// @param components a restartable sequence of components
    /// @param <P> the parameter type
    /// @return the estimator
    public static <P> KernelDensityEstimator<P> of(Iterable<? extends Kernel<P>> components) {
        return new KernelDensityEstimator<>(components);
    }

    /// @param <P> the parameter type
    /// @return an estimator without components
    public static <P> KernelDensityEstimator<P> empty() {
        return new KernelDensityEstimator<>(Collections.emptyList());
    }

    /// Mean density of all components at a point.
    ///
    /// @param at the point
    /// @return the mixture density, 0.0 if there are no components
    public double density(P at) {
        int count = 0;
        double sum = 0.0;
        for (Kernel<P> component : components) {
            count++;
            sum += component.density(at);
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /// Picks one component uniformly at random with reservoir sampling.
    ///
    /// @param rng the random source
    /// @return the selected component, or empty if there are none
    public Optional<Kernel<P>> select(UniformRandomProvider rng) {
        Kernel<P> held = null;
        int index = 0;
        for (Kernel<P> component : components) {
            if (RandomGenerators.nextIntInclusive(rng, 0, index) == 0) {
                held = component;
            }
            index++;
        }
        return Optional.ofNullable(held);
    }

    /// Samples a point: selects a component, then samples from it.
    ///
    /// An empty estimator is a normal state (no trials in that class yet) and
    /// yields [Optional#empty()] rather than an error.
    ///
    /// @param rng the random source
    /// @return a sampled point, or empty if there are no components
    public Optional<P> sample(UniformRandomProvider rng) {
        return select(rng).map(component -> component.sample(rng));
    }

    /// @return true if the estimator currently has no components
    public boolean isEmpty() {
        return !components.iterator().hasNext();
    }

    /// Counts the components by traversing them.
    ///
    /// @return the current number of components
    public int size() {
        int count = 0;
        for (Kernel<P> ignored : components) {
            count++;
        }
        return count;
    }
}
