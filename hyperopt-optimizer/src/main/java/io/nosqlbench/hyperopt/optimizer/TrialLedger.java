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

import java.util.Collections;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Duplicate-free collection of trials kept in two synchronized orderings.
 *
 * <h2>Orderings</h2>
 *
 * <pre>
 *   byMetric     TreeSet    best() / worst() / popBest() / popWorst()     O(log n)
 *   byParameter  TreeMap    contains(parameter), ascending parameters()   O(log n)
 * </pre>
 *
 * <p>Both orderings always hold the same trials. They are only ever mutated
 * together inside {@link #insert(Trial)} and {@link #pop(Trial)}, and neither is
 * exposed for modification. A parameter value appears at most once.
 *
 * <p>The ledger is not thread-safe; it is owned by a single {@link Optimizer}.
 *
 * @param <P> the parameter type
 * @param <M> the metric type
 */
public final class TrialLedger<P extends Comparable<? super P>, M extends Comparable<? super M>> {

    private final TreeSet<Trial<P, M>> byMetric = new TreeSet<>(Trial.byMetric());
    private final TreeMap<P, Trial<P, M>> byParameter = new TreeMap<>();

    /**
     * Inserts a trial unless its parameter is already present.
     *
     * @param trial the trial to insert
     * @return true if inserted, false if the parameter already exists
     */
    public boolean insert(Trial<P, M> trial) {
        if (byParameter.containsKey(trial.parameter())) {
            return false;
        }
        if (!byMetric.add(trial)) {
            throw new LedgerInvariantException("Trial " + trial + " already present in metric ordering but not in parameter ordering");
        }
        byParameter.put(trial.parameter(), trial);
        return true;
    }

    /**
     * @return the trial with the lowest metric, or empty
     */
    public Optional<Trial<P, M>> best() {
        return byMetric.isEmpty() ? Optional.empty() : Optional.of(byMetric.first());
    }

    /**
     * @return the trial with the highest metric, or empty
     */
    public Optional<Trial<P, M>> worst() {
        return byMetric.isEmpty() ? Optional.empty() : Optional.of(byMetric.last());
    }

    /**
     * Removes and returns the trial with the lowest metric.
     *
     * @return the removed trial, or empty
     */
    public Optional<Trial<P, M>> popBest() {
        return best().map(this::pop);
    }

    /**
     * Removes and returns the trial with the highest metric.
     *
     * @return the removed trial, or empty
     */
    public Optional<Trial<P, M>> popWorst() {
        return worst().map(this::pop);
    }

    private Trial<P, M> pop(Trial<P, M> trial) {
        boolean removedByMetric = byMetric.remove(trial);
        Trial<P, M> removedByParameter = byParameter.remove(trial.parameter());
        if (!removedByMetric || removedByParameter != trial) {
            throw new LedgerInvariantException("Ledger orderings diverged while removing " + trial);
        }
        return trial;
    }

    /**
     * @param parameter the parameter value
     * @return true if a trial with this parameter is present
     */
    public boolean contains(P parameter) {
        return byParameter.containsKey(parameter);
    }

    /**
     * Ascending view of the parameter values.
     *
     * <p>The view is live and restartable: each traversal reflects the
     * current contents of the ledger. It cannot be modified.
     *
     * @return the parameters in ascending order
     */
    public Iterable<P> parameters() {
        return Collections.unmodifiableSet(byParameter.keySet());
    }

    /**
     * Unmodifiable view of the trials ordered from best to worst.
     *
     * @return the trials by metric
     */
    public Iterable<Trial<P, M>> trials() {
        return Collections.unmodifiableSortedSet(byMetric);
    }

    public int size() {
        return byMetric.size();
    }

    public boolean isEmpty() {
        return byMetric.isEmpty();
    }

    /**
     * Verifies that both orderings hold the same trials.
     *
     * @throws LedgerInvariantException if the orderings diverged
     */
    void checkConsistency() {
        if (byMetric.size() != byParameter.size()) {
            throw new LedgerInvariantException("Ledger orderings diverged: " + byMetric.size()
                + " trials by metric, " + byParameter.size() + " by parameter");
        }
    }

    @Override
    public String toString() {
        return "TrialLedger[size=" + size() + ", best=" + best().orElse(null) + ", worst=" + worst().orElse(null) + "]";
    }
}
