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

package io.nosqlbench.hyperopt.optimizer;

/// Tuning options of an [Optimizer].
///
/// # Overview
///
/// - **cutoff**: fraction of trials classed as "good", in (0, 1)
/// - **candidates**: number of candidate draws scored per proposal
/// - **bandwidth multiplier**: scale applied to every adaptive bandwidth
///
/// All values are validated when set; invalid values are rejected with
/// [IllegalArgumentException] rather than clamped.
///
/// # Usage
///
/// ```java
/// // Defaults: cutoff 0.1, 25 candidates, multiplier 1.0
/// OptimizerOptions defaults = OptimizerOptions.defaults();
///
/// OptimizerOptions options = OptimizerOptions.builder()
///     .cutoff(0.25)
///     .candidates(50)
///     .bandwidthMultiplier(0.8)
///     .build();
/// ```
///
/// @see Optimizer
public final class OptimizerOptions {

    public static final double DEFAULT_CUTOFF = 0.1;
    public static final int DEFAULT_CANDIDATES = 25;
    public static final double DEFAULT_BANDWIDTH_MULTIPLIER = 1.0;

    private final double cutoff;
    private final int candidates;
    private final double bandwidthMultiplier;

    private OptimizerOptions(Builder builder) {
        this.cutoff = builder.cutoff;
        this.candidates = builder.candidates;
        this.bandwidthMultiplier = builder.bandwidthMultiplier;
    }

    /// Returns the ratio of "good" trials.
    ///
    /// @return the cutoff, in (0, 1)
    public double cutoff() {
        return cutoff;
    }

    /// Returns how many candidates are drawn per proposal.
    ///
    /// @return the candidate budget
    public int candidates() {
        return candidates;
    }

    /// Returns the scale applied to adaptive bandwidths.
    ///
    /// @return the bandwidth multiplier
    public double bandwidthMultiplier() {
        return bandwidthMultiplier;
    }

    /// @return the default options
    public static OptimizerOptions defaults() {
        return new Builder().build();
    }

    /// @return a new builder
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these options' values.
    ///
    /// @return a builder pre-populated with current values
    public Builder toBuilder() {
        return new Builder()
            .cutoff(this.cutoff)
            .candidates(this.candidates)
            .bandwidthMultiplier(this.bandwidthMultiplier);
    }

    @Override
    public String toString() {
        return "OptimizerOptions{" +
            "cutoff=" + cutoff +
            ", candidates=" + candidates +
            ", bandwidthMultiplier=" + bandwidthMultiplier +
            '}';
    }

    /// Builder for OptimizerOptions.
    public static final class Builder {
        private double cutoff = DEFAULT_CUTOFF;
        private int candidates = DEFAULT_CANDIDATES;
        private double bandwidthMultiplier = DEFAULT_BANDWIDTH_MULTIPLIER;

        Builder() {
        }

        /// Sets the ratio of "good" trials.
        ///
        /// @param cutoff a value in the open interval (0, 1)
        /// @return this builder
        /// @throws IllegalArgumentException if cutoff is outside (0, 1)
        public Builder cutoff(double cutoff) {
            if (!(cutoff > 0.0 && cutoff < 1.0)) {
                throw new IllegalArgumentException("Cutoff must be in (0, 1), got: " + cutoff);
            }
            this.cutoff = cutoff;
            return this;
        }

        /// Sets the number of candidates drawn per proposal.
        ///
        /// @param candidates at least 1
        /// @return this builder
        /// @throws IllegalArgumentException if candidates < 1
        public Builder candidates(int candidates) {
            if (candidates < 1) {
                throw new IllegalArgumentException("Candidate count must be >= 1, got: " + candidates);
            }
            this.candidates = candidates;
            return this;
        }

        /// Sets the bandwidth multiplier.
        ///
        /// @param multiplier a positive, finite factor
        /// @return this builder
        /// @throws IllegalArgumentException if the multiplier is not positive and finite
        public Builder bandwidthMultiplier(double multiplier) {
            if (!(multiplier > 0.0) || !Double.isFinite(multiplier)) {
                throw new IllegalArgumentException("Bandwidth multiplier must be positive and finite, got: " + multiplier);
            }
            this.bandwidthMultiplier = multiplier;
            return this;
        }

        /// Builds the OptimizerOptions.
        ///
        /// @return the configured options
        public OptimizerOptions build() {
            return new OptimizerOptions(this);
        }
    }
}
