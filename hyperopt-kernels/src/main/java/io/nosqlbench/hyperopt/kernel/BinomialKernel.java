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

import org.apache.commons.math3.special.Gamma;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * Discrete kernel based on the binomial distribution B(n, p).
 *
 * <h2>Purpose</h2>
 *
 * <p>Models integer parameters. The density is the probability mass function,
 * which is already expressed per unit step and therefore comparable with the
 * continuous kernels used as priors.
 *
 * <h2>Location and bandwidth</h2>
 *
 * <p>{@link #fromLocation(long, long)} inverts a (location μ, bandwidth σ) pair into
 * distribution parameters by matching the first two moments:
 * <pre>
 *   n·p = μ,  n·p·(1 - p) = σ²   ⟹   p = 1 - σ²/μ,  n = μ/p
 * </pre>
 *
 * <p>Moment matching is impossible when σ² ≥ μ, and large μ would make n
 * explode, so both parameters are clamped:
 * <ul>
 *   <li>p is clamped into [{@value #MIN_SUCCESS_RATE}, 1 - 1e-9]</li>
 *   <li>if μ/p exceeds {@value #MAX_TRIALS}, p is raised to μ / {@value #MAX_TRIALS}</li>
 *   <li>n is rounded and clamped into [1, {@value #MAX_TRIALS}]</li>
 * </ul>
 * The mean n·p stays at μ (up to rounding of n) whichever clamp applies; only
 * the spread ends up narrower than σ. Locations above {@value #MAX_LOCATION}
 * cannot keep that mean and are rejected.
 * The probability mass is evaluated in log space, so no binomial coefficient
 * ever overflows.
 *
 * <h2>Sampling</h2>
 *
 * <p>Inverse CDF search: accumulate the pmf from 0 upwards until it reaches a
 * uniform draw.
 */
public final class BinomialKernel implements Kernel<Long> {

    /** Lower clamp for the success rate. */
    public static final double MIN_SUCCESS_RATE = 0.01;

    /** Upper clamp for the success rate. */
    public static final double MAX_SUCCESS_RATE = 1.0 - 1e-9;

    /** Upper clamp for the number of trials. */
    public static final int MAX_TRIALS = 1 << 20;

    /** Largest location whose mean survives the clamps. */
    public static final long MAX_LOCATION = 1_048_575L;

    private final int n;
    private final double p;
    private final double logP;
    private final double logQ;
    private final double logNFactorial;

    /**
     * Constructs a binomial kernel from its distribution parameters.
     *
     * @param n number of independent experiments, at least 1
     * @param p success rate in (0, 1)
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public BinomialKernel(int n, double p) {
        if (n < 1 || n > MAX_TRIALS) {
            throw new IllegalArgumentException("Number of trials must be in [1, " + MAX_TRIALS + "], got: " + n);
        }
        if (!(p > 0.0 && p < 1.0)) {
            throw new IllegalArgumentException("Success rate must be in (0, 1), got: " + p);
        }
        this.n = n;
        this.p = p;
        this.logP = Math.log(p);
        this.logQ = Math.log1p(-p);
        this.logNFactorial = Gamma.logGamma(n + 1.0);
    }

    /**
     * Builds a binomial kernel whose mean and standard deviation approximate
     * the given location and bandwidth.
     *
     * @param location the mean, in [0, {@value #MAX_LOCATION}]
     * @param bandwidth the standard deviation, must be strictly positive
     * @return a binomial kernel
     * @throws IllegalArgumentException if location is out of range or bandwidth is not positive
     */
    public static BinomialKernel fromLocation(long location, long bandwidth) {
        if (bandwidth <= 0) {
            throw new IllegalArgumentException("Bandwidth must be strictly positive, got: " + bandwidth);
        }
        if (location < 0 || location > MAX_LOCATION) {
            throw new IllegalArgumentException("Binomial kernel requires a location in [0, " + MAX_LOCATION
                + "], got: " + location);
        }
        double mean = location;
        double variance = (double) bandwidth * (double) bandwidth;
        double p = location > 0 ? 1.0 - variance / mean : MIN_SUCCESS_RATE;
        p = Math.max(MIN_SUCCESS_RATE, Math.min(MAX_SUCCESS_RATE, p));
        p = Math.max(p, mean / MAX_TRIALS);
        long trials = Math.round(mean / p);
        int n = (int) Math.max(1L, Math.min(MAX_TRIALS, trials));
        return new BinomialKernel(n, p);
    }

    /**
     * Returns a family producing binomial kernels via {@link #fromLocation(long, long)}.
     *
     * @return the binomial kernel family
     */
    public static KernelFamily<Long> family() {
        return BinomialKernel::fromLocation;
    }

    /**
     * Probability mass at a point.
     *
     * @param at the point
     * @return P(X = at), 0.0 outside [0, n]
     */
    public double pmf(long at) {
        if (at < 0 || at > n) {
            return 0.0;
        }
        int k = (int) at;
        double logCoefficient = logNFactorial - Gamma.logGamma(k + 1.0) - Gamma.logGamma(n - k + 1.0);
        return Math.exp(logCoefficient + k * logP + (n - k) * logQ);
    }

    /**
     * @return the standard deviation √(n·p·(1 - p))
     */
    public double std() {
        return Math.sqrt(n * p * (1.0 - p));
    }

    /**
     * @return the mean n·p
     */
    public double mean() {
        return n * p;
    }

    /**
     * Smallest k with CDF(k) ≥ the given probability.
     *
     * @param cdf the target cumulative probability
     * @return the quantile, at most n
     */
    long inverseCdf(double cdf) {
        double accumulated = 0.0;
        double logPmf = n * logQ;
        for (int k = 0; k < n; k++) {
            accumulated += Math.exp(logPmf);
            if (accumulated >= cdf) {
                return k;
            }
            // pmf(k + 1) = pmf(k) · (n - k) / (k + 1) · p / q
            logPmf += Math.log(n - k) - Math.log(k + 1.0) + logP - logQ;
        }
        // rounding can leave the accumulated mass just short of 1.0
        return n;
    }

    @Override
    public double density(Long at) {
        return pmf(at);
    }

    @Override
    public Long sample(UniformRandomProvider rng) {
        return inverseCdf(rng.nextDouble());
    }

    public int getTrials() {
        return n;
    }

    public double getSuccessRate() {
        return p;
    }

    @Override
    public String toString() {
        return "BinomialKernel[n=" + n + ", p=" + p + "]";
    }
}
