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

/// Thrown when no untried candidate survived filtering within the candidate budget.
///
/// This is an expected condition: the parameter range may be exhausted of untried
/// values, or the optimizer may have converged onto a small region. Callers can
/// widen the range, retry with a larger budget, or stop the search.
public class CandidatesExhaustedException extends RuntimeException {

    private final int candidateBudget;
    private final int trialCount;

    public CandidatesExhaustedException(int candidateBudget, int trialCount) {
        super(String.format("No untried candidate among %d draws after %d trials", candidateBudget, trialCount));
        this.candidateBudget = candidateBudget;
        this.trialCount = trialCount;
    }

    public int getCandidateBudget() {
        return candidateBudget;
    }

    public int getTrialCount() {
        return trialCount;
    }
}
