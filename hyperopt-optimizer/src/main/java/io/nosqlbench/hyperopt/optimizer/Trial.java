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

import java.util.Comparator;
import java.util.Objects;

/// One observation: a parameter value and the metric it produced.
///
/// Trials are ordered by metric, lower is better. Trials with equal metrics
/// are ordered by their feed-back sequence number, so the earlier trial ranks
/// better. The sequence number is assigned by the [Optimizer] and travels with
/// the trial when it moves between the good and bad ledgers.
///
/// @param parameter the parameter value
/// @param metric the observed metric, lower is better
/// @param sequence the feed-back sequence number
/// @param <P> the parameter type
/// @param <M> the metric type
public record Trial<P, M extends Comparable<? super M>>(P parameter, M metric, long sequence) {

    public Trial {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(metric, "metric");
    }

    /// Orders trials by metric, then by sequence number.
    ///
    /// @param <P> the parameter type
    /// @param <M> the metric type
    /// @return the metric ordering
    public static <P, M extends Comparable<? super M>> Comparator<Trial<P, M>> byMetric() {
        return Comparator.<Trial<P, M>, M>comparing(Trial::metric).thenComparingLong(Trial::sequence);
    }
}
