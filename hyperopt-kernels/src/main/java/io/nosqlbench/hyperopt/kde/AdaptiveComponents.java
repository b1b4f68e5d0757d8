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

import io.nosqlbench.hyperopt.kernel.KernelFamily;
import io.nosqlbench.hyperopt.numeric.Arithmetic;

import java.util.Optional;

/**
 * Derives a component for every point of an ascending sequence, with a
 * bandwidth taken from the distances to its neighbors.
 *
 * <h2>Bandwidth rule</h2>
 *
 * <table>
 *   <caption>Bandwidth per window shape</caption>
 *   <tr><th>Window</th><th>Bandwidth</th></tr>
 *   <tr><td>Full(l, x, r)</td><td>max(r - x, x - l)</td></tr>
 *   <tr><td>LeftMiddle(l, x)</td><td>max(x - l, rangeMax - x)</td></tr>
 *   <tr><td>MiddleRight(x, r)</td><td>max(r - x, x - rangeMin)</td></tr>
 *   <tr><td>Middle(x)</td><td>max(rangeMax - x, x - rangeMin)</td></tr>
 * </table>
 *
 * <p>A missing neighbor is replaced by the distance to the range bound on that
 * side. The result is scaled by the bandwidth multiplier. The entering and
 * leaving windows ({@link Triple.Right}, {@link Triple.Left}) have no center and
 * produce no component, so a sequence of n points yields exactly n components.
 *
 * <p>For {@link io.nosqlbench.hyperopt.numeric.Point} parameters the rule is
 * applied per coordinate. Neighbors in the lexicographic order may share a
 * coordinate, so a coordinate whose neighbor distance is not positive uses the
 * {@code Middle(x)} distance for that coordinate instead.
 *
 * <p>Scaling goes through {@link Arithmetic#scaleSpread(Comparable, double)}, so
 * integer bandwidths stay at least one step wide for any positive multiplier.
 * A bandwidth that still ends up non-positive fails fast with
 * {@link IllegalArgumentException}.
 *
 * @param <P> the parameter type
 */
public final class AdaptiveComponents<P extends Comparable<? super P>> {

    private final Arithmetic<P> arithmetic;
    private final KernelFamily<P> family;
    private final P rangeMin;
    private final P rangeMax;
    private final double bandwidthMultiplier;

    /**
     * Constructs the component derivation.
     *
     * @param arithmetic the parameter arithmetic
     * @param family the kernel family of the derived components
     * @param rangeMin the lower bound of the parameter range
     * @param rangeMax the upper bound of the parameter range
     * @param bandwidthMultiplier the positive bandwidth scale factor
     * @throws IllegalArgumentException if the range is empty or the multiplier is not positive
     */
    public AdaptiveComponents(Arithmetic<P> arithmetic, KernelFamily<P> family, P rangeMin, P rangeMax,
                              double bandwidthMultiplier) {
        if (!arithmetic.isPositive(arithmetic.subtract(rangeMax, rangeMin))) {
            throw new IllegalArgumentException("Range minimum must be less than maximum: " + rangeMin + " >= " + rangeMax);
        }
        if (!(bandwidthMultiplier > 0.0) || !Double.isFinite(bandwidthMultiplier)) {
            throw new IllegalArgumentException("Bandwidth multiplier must be positive and finite, got: " + bandwidthMultiplier);
        }
        this.arithmetic = arithmetic;
        this.family = family;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.bandwidthMultiplier = bandwidthMultiplier;
    }

    /**
     * Builds the component centered in the given window.
     *
     * @param triple the window
     * @return the component, or empty for a window without a center
     * @throws IllegalArgumentException if the resulting bandwidth is not strictly positive
     */
    public Optional<Component<P>> component(Triple<P> triple) {
        P center;
        P bandwidth;
        if (triple instanceof Triple.Full<P> full) {
            center = full.middle();
            bandwidth = arithmetic.max(
                arithmetic.subtract(full.right(), center),
                arithmetic.subtract(center, full.left()));
        } else if (triple instanceof Triple.LeftMiddle<P> leftMiddle) {
            center = leftMiddle.middle();
            bandwidth = arithmetic.max(
                arithmetic.subtract(center, leftMiddle.left()),
                arithmetic.subtract(rangeMax, center));
        } else if (triple instanceof Triple.MiddleRight<P> middleRight) {
            center = middleRight.middle();
            bandwidth = arithmetic.max(
                arithmetic.subtract(middleRight.right(), center),
                arithmetic.subtract(center, rangeMin));
        } else if (triple instanceof Triple.Middle<P> middle) {
            center = middle.middle();
            bandwidth = rangeSpread(center);
        } else {
            return Optional.empty();
        }

        bandwidth = arithmetic.positiveOr(bandwidth, rangeSpread(center));
        P scaled = bandwidthMultiplier == 1.0 ? bandwidth : arithmetic.scaleSpread(bandwidth, bandwidthMultiplier);
        if (!arithmetic.isPositive(scaled)) {
            throw new IllegalArgumentException("Degenerate bandwidth " + scaled + " for component at " + center
                + " in range [" + rangeMin + ", " + rangeMax + "]");
        }
        return Optional.of(new Component<>(family, center, scaled));
    }

    private P rangeSpread(P center) {
        return arithmetic.max(
            arithmetic.subtract(rangeMax, center),
            arithmetic.subtract(center, rangeMin));
    }

    /**
     * Lazily derives one component per point of an ascending sequence.
     *
     * <p>The returned iterable is restartable and reflects the current contents
     * of {@code ascending} on every traversal.
     *
     * @param ascending the points in ascending order
     * @return the components, in the order of their centers
     */
    public Iterable<Component<P>> components(Iterable<P> ascending) {
        Triples<P> triples = Triples.of(ascending);
        return () -> triples.stream()
            .map(this::component)
            .flatMap(Optional::stream)
            .iterator();
    }

    /**
     * Builds a kernel density estimator over the components of an ascending sequence.
     *
     * @param ascending the points in ascending order
     * @return a lazy estimator
     */
    public KernelDensityEstimator<P> estimator(Iterable<P> ascending) {
        return KernelDensityEstimator.of(components(ascending));
    }

    public P getRangeMin() {
        return rangeMin;
    }

    public P getRangeMax() {
        return rangeMax;
    }

    public double getBandwidthMultiplier() {
        return bandwidthMultiplier;
    }
}
