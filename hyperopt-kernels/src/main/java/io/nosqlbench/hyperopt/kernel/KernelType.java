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

import java.util.Locale;

/// Named kernel types, used to select a [KernelFamily] from configuration.
///
/// | Name | Kernel | Parameters |
/// |------|--------|------------|
/// | `uniform` | [UniformKernel] | any |
/// | `gaussian` | [GaussianKernel] | any |
/// | `epanechnikov` | [EpanechnikovKernel] | any |
/// | `binomial` | [BinomialKernel] | integer only |
public enum KernelType {
    UNIFORM("uniform"),
    GAUSSIAN("gaussian"),
    EPANECHNIKOV("epanechnikov"),
    BINOMIAL("binomial");

    private final String name;

    KernelType(String name) {
        this.name = name;
    }

    /// @return the configuration name of this kernel type
    public String getName() {
        return name;
    }

    /// Resolves a kernel type by its configuration name, ignoring case.
    ///
    /// @param name the configuration name
    /// @return the kernel type
    /// @throws IllegalArgumentException if no kernel type has this name
    public static KernelType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (KernelType type : values()) {
                if (type.name.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown kernel type: " + name);
    }

    /// Returns the kernel family of this type for the given arithmetic.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param <P> the parameter type
    /// @return the kernel family
    /// @throws IllegalArgumentException if this is [#BINOMIAL] and the parameters are not integers
    @SuppressWarnings("unchecked")
    public <P extends Comparable<? super P>> KernelFamily<P> family(Arithmetic<P> arithmetic) {
        switch (this) {
            case UNIFORM:
                return UniformKernel.family(arithmetic);
            case GAUSSIAN:
                return GaussianKernel.family(arithmetic);
            case EPANECHNIKOV:
                return EpanechnikovKernel.family(arithmetic);
            case BINOMIAL:
                if (arithmetic != Arithmetic.ofLong()) {
                    throw new IllegalArgumentException("The binomial kernel requires integer parameters, got " + arithmetic);
                }
                return (KernelFamily<P>) (KernelFamily<?>) BinomialKernel.family();
            default:
                throw new IllegalStateException("Unhandled kernel type: " + this);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
