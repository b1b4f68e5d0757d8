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

import io.nosqlbench.hyperopt.kde.AdaptiveComponents;
import io.nosqlbench.hyperopt.kde.KernelDensityEstimator;
import io.nosqlbench.hyperopt.kernel.Kernel;
import io.nosqlbench.hyperopt.kernel.KernelFamily;
import io.nosqlbench.hyperopt.numeric.Arithmetic;
import io.nosqlbench.hyperopt.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Sequential black-box optimizer based on tree-structured Parzen estimators.
///
/// # Overview
///
/// The optimizer alternates between two phases, driven by the caller:
///
/// ```text
///   ┌──────────────┐  parameter   ┌──────────────┐
///   │  newTrial()  │ ───────────► │  objective   │   (caller)
///   └──────▲───────┘              └──────┬───────┘
///          │                             │ metric
///          │                      ┌──────▼───────┐
///          └───────────────────── │  feedBack()  │
///                                 └──────────────┘
/// ```
///
/// Fed-back trials are split by metric into a **good** ledger (the best
/// `cutoff` fraction) and a **bad** ledger (the rest). To propose a trial, a
/// kernel density estimator is built over each ledger, with one component per
/// trial and a bandwidth derived from its neighbors:
///
/// - `l(x)`: good density, smoothed with the prior
/// - `g(x)`: bad density, smoothed with the prior
///
/// Candidates are drawn from the prior or from the good estimator, clamped into
/// the range, stripped of already tried values, and the one with the highest
/// `l(x) / g(x)` is returned.
///
/// # Invariants
///
/// After every [#feedBack(Comparable, Comparable)]:
/// - the worst good metric is ≤ the best bad metric
/// - the good ledger holds exactly `round(cutoff × total)` trials
/// - no parameter appears twice across both ledgers
///
/// A violation raises [LedgerInvariantException].
///
/// # Threading
///
/// Not thread-safe. Use one optimizer and one random source per run.
///
/// @param <P> the parameter type
/// @param <M> the metric type, lower is better
public class Optimizer<P extends Comparable<? super P>, M extends Comparable<? super M>> {

    private static final Logger logger = LogManager.getLogger(Optimizer.class);

    private final Arithmetic<P> arithmetic;
    private final P min;
    private final P max;
    private final Kernel<P> prior;
    private final OptimizerOptions options;
    private final AdaptiveComponents<P> components;

    private final TrialLedger<P, M> good = new TrialLedger<>();
    private final TrialLedger<P, M> bad = new TrialLedger<>();
    private long nextSequence;

    /// Constructs an optimizer with default options.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param min the lowest parameter value to propose
    /// @param max the highest parameter value to propose
    /// @param prior the prior belief about where good parameters lie
    /// @param family the kernel family for trial components
    /// @throws IllegalArgumentException if min is not less than max
    public Optimizer(Arithmetic<P> arithmetic, P min, P max, Kernel<P> prior, KernelFamily<P> family) {
        this(arithmetic, min, max, prior, family, OptimizerOptions.defaults());
    }

    /// Constructs an optimizer.
    ///
    /// @param arithmetic the parameter arithmetic
    /// @param min the lowest parameter value to propose
    /// @param max the highest parameter value to propose
    /// @param prior the prior belief about where good parameters lie
    /// @param family the kernel family for trial components
    /// @param options the tuning options
    /// @throws IllegalArgumentException if min is not less than max
    public Optimizer(Arithmetic<P> arithmetic, P min, P max, Kernel<P> prior, KernelFamily<P> family,
                     OptimizerOptions options) {
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic");
        this.min = Objects.requireNonNull(min, "min");
        this.max = Objects.requireNonNull(max, "max");
        this.prior = Objects.requireNonNull(prior, "prior");
        this.options = Objects.requireNonNull(options, "options");
        this.components = new AdaptiveComponents<>(arithmetic, Objects.requireNonNull(family, "family"),
            min, max, options.bandwidthMultiplier());
        logger.debug("Optimizer created over [{}, {}] with {}", min, max, options);
    }

    /// Records the outcome of a trial and rebalances the good and bad ledgers.
    ///
    /// Any parameter may be fed back, not only those proposed by
    /// [#newTrial(UniformRandomProvider)]. Feeding back a parameter that was
    /// already tried is a no-op.
    ///
    /// @param parameter the parameter that was evaluated
    /// @param metric the observed metric, lower is better
    /// @throws LedgerInvariantException if the ledgers end up inconsistent
    public void feedBack(P parameter, M metric) {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(metric, "metric");
        if (isTried(parameter)) {
            logger.debug("Ignoring repeated trial of parameter {}", parameter);
            return;
        }

        Trial<P, M> trial = new Trial<>(parameter, metric, nextSequence++);
        int expectedGood = expectedGoodCount(good.size() + bad.size() + 1);

        // an empty good ledger defers to the bad ledger so the separation still holds
        boolean intoGood = good.worst()
            .map(worst -> metric.compareTo(worst.metric()) <= 0)
            .orElseGet(() -> bad.best().map(best -> metric.compareTo(best.metric()) <= 0).orElse(true));
        requireInserted(intoGood ? good : bad, trial);

        rebalance(expectedGood);
        checkInvariants(expectedGood);
        logger.debug("Fed back {} into {} ledger; good={}, bad={}",
            trial, intoGood ? "good" : "bad", good.size(), bad.size());
    }

    private int expectedGoodCount(int total) {
        return (int) Math.round(options.cutoff() * total);
    }

    private void rebalance(int expectedGood) {
        while (good.size() > expectedGood) {
            Trial<P, M> moved = good.popWorst().orElseThrow();
            requireInserted(bad, moved);
            logger.trace("Demoted {} to bad ledger", moved);
        }
        while (good.size() < expectedGood && !bad.isEmpty()) {
            Trial<P, M> moved = bad.popBest().orElseThrow();
            requireInserted(good, moved);
            logger.trace("Promoted {} to good ledger", moved);
        }
    }

    private void requireInserted(TrialLedger<P, M> ledger, Trial<P, M> trial) {
        if (!ledger.insert(trial)) {
            throw new LedgerInvariantException("Parameter " + trial.parameter() + " is already present in a ledger");
        }
    }

    private void checkInvariants(int expectedGood) {
        good.checkConsistency();
        bad.checkConsistency();
        if (good.size() != expectedGood) {
            throw new LedgerInvariantException("Good ledger holds " + good.size() + " trials, expected " + expectedGood);
        }
        Optional<Trial<P, M>> worstGood = good.worst();
        Optional<Trial<P, M>> bestBad = bad.best();
        if (worstGood.isPresent() && bestBad.isPresent()
            && worstGood.get().metric().compareTo(bestBad.get().metric()) > 0) {
            throw new LedgerInvariantException("Worst good trial " + worstGood.get()
                + " is worse than best bad trial " + bestBad.get());
        }
    }

    /// Proposes the next parameter to evaluate.
    ///
    /// Draws up to the configured number of candidates, each from the prior
    /// with probability `1 / (good + 1)` (always while fewer than two good
    /// trials exist) and otherwise from the good estimator. Candidates are
    /// clamped into the range; tried values are discarded. The survivor with
    /// the highest acquisition score wins, the earliest one on ties.
    ///
    /// The ledgers are not modified.
    ///
    /// @param rng the random source
    /// @return an untried parameter within [min, max]
    /// @throws CandidatesExhaustedException if no drawn candidate was untried
    public P newTrial(UniformRandomProvider rng) {
        int goodCount = good.size();
        int badCount = bad.size();
        KernelDensityEstimator<P> goodKde = components.estimator(good.parameters());
        KernelDensityEstimator<P> badKde = components.estimator(bad.parameters());

        P bestCandidate = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        int survivors = 0;
        for (int draw = 0; draw < options.candidates(); draw++) {
            P candidate = arithmetic.clamp(drawCandidate(rng, goodCount, goodKde), min, max);
            if (isTried(candidate)) {
                continue;
            }
            survivors++;
            double score = acquisition(candidate, goodKde, badKde, goodCount, badCount);
            if (bestCandidate == null || score > bestScore) {
                bestCandidate = candidate;
                bestScore = score;
            }
        }

        if (bestCandidate == null) {
            throw new CandidatesExhaustedException(options.candidates(), trialCount());
        }
        logger.debug("Proposing {} with score {} ({} of {} candidates untried)",
            bestCandidate, bestScore, survivors, options.candidates());
        return bestCandidate;
    }

    private P drawCandidate(UniformRandomProvider rng, int goodCount, KernelDensityEstimator<P> goodKde) {
        if (goodCount < 2 || RandomGenerators.nextIntInclusive(rng, 0, goodCount) == 0) {
            return prior.sample(rng);
        }
        return goodKde.sample(rng).orElseGet(() -> prior.sample(rng));
    }

    /// Computes the acquisition score `l(x) / g(x)` at a point.
    ///
    /// @param candidate the point to score
    /// @return the score; positive infinity where only the good density is non-zero
    public double acquisition(P candidate) {
        return acquisition(candidate,
            components.estimator(good.parameters()),
            components.estimator(bad.parameters()),
            good.size(), bad.size());
    }

    private double acquisition(P candidate, KernelDensityEstimator<P> goodKde, KernelDensityEstimator<P> badKde,
                               int goodCount, int badCount) {
        double priorDensity = prior.density(candidate);
        double l = (priorDensity + goodKde.density(candidate) * goodCount) / (goodCount + 1);
        double g = (priorDensity + badKde.density(candidate) * badCount) / (badCount + 1);
        if (g == 0.0) {
            return l > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return l / g;
    }

    /// Runs the propose, evaluate and feed-back loop.
    ///
    /// Stops early, without failing, once candidates are exhausted.
    ///
    /// @param objective the function to minimize
    /// @param iterations the maximum number of evaluations
    /// @param rng the random source
    /// @return the best trial seen, or empty if nothing was evaluated
    public Optional<Trial<P, M>> minimize(Function<? super P, ? extends M> objective, int iterations,
                                          UniformRandomProvider rng) {
        for (int iteration = 0; iteration < iterations; iteration++) {
            P parameter;
            try {
                parameter = newTrial(rng);
            } catch (CandidatesExhaustedException e) {
                logger.warn("Stopping after {} of {} iterations: {}", iteration, iterations, e.getMessage());
                break;
            }
            feedBack(parameter, objective.apply(parameter));
        }
        Optional<Trial<P, M>> best = bestTrial();
        logger.debug("Best trial after {} trials: {}", trialCount(), best.orElse(null));
        return best;
    }

    /// @return the best trial fed back so far, or empty if none
    public Optional<Trial<P, M>> bestTrial() {
        return good.best().or(bad::best);
    }

    /// @param parameter a parameter value
    /// @return true if this parameter has been fed back
    public boolean isTried(P parameter) {
        return good.contains(parameter) || bad.contains(parameter);
    }

    public int goodCount() {
        return good.size();
    }

    public int badCount() {
        return bad.size();
    }

    public int trialCount() {
        return good.size() + bad.size();
    }

    /// Read-only view of the good trials, best first.
    ///
    /// @return the good trials
    public Iterable<Trial<P, M>> goodTrials() {
        return good.trials();
    }

    /// Read-only view of the bad trials, best first.
    ///
    /// @return the bad trials
    public Iterable<Trial<P, M>> badTrials() {
        return bad.trials();
    }

    public P getMin() {
        return min;
    }

    public P getMax() {
        return max;
    }

    public OptimizerOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "Optimizer[range=[" + min + ", " + max + "], good=" + good.size() + ", bad=" + bad.size()
            + ", options=" + options + "]";
    }
}
