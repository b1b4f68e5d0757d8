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

package io.nosqlbench.hyperopt.random;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random sources for the optimizer.
 *
 * <p>The optimizer consumes randomness only through {@link UniformRandomProvider}:
 * <ul>
 *   <li>{@code nextDouble()} - uniform real in [0, 1)</li>
 *   <li>{@code nextBoolean()} - fair coin</li>
 *   <li>{@link #nextIntInclusive(UniformRandomProvider, int, int)} - uniform integer in an inclusive range</li>
 * </ul>
 *
 * <p>Independent optimization runs should each be given their own provider.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ - 256-bit state, fast with excellent statistical properties.
         * Recommended for general use.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++ - 128-bit state, for when memory footprint is a concern.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 - 64-bit state, minimal footprint.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister - long period, mostly for reproducing legacy runs.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the recommended algorithm.
     *
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates an unseeded generator with the recommended algorithm.
     *
     * @return a uniform random provider seeded from system entropy
     */
    public static UniformRandomProvider create() {
        return Algorithm.XO_SHI_RO_256_PP.getSource().create();
    }

    /**
     * Draws a uniform integer from the inclusive range [lower, upper].
     *
     * @param rng the random source
     * @param lower the lowest value that may be returned
     * @param upper the highest value that may be returned
     * @return a uniform integer in [lower, upper]
     * @throws IllegalArgumentException if upper &lt; lower
     */
    public static int nextIntInclusive(UniformRandomProvider rng, int lower, int upper) {
        if (upper < lower) {
            throw new IllegalArgumentException("Empty range: [" + lower + ", " + upper + "]");
        }
        return lower + rng.nextInt(Math.addExact(Math.subtractExact(upper, lower), 1));
    }
}
