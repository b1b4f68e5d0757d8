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

package io.nosqlbench.hyperopt.numeric;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/// Element-wise arithmetic over [Point]s of a fixed dimension.
///
/// Every operation applies the coordinate arithmetic to each coordinate in
/// turn. `max`, `min` and therefore `clamp` are element-wise too, so clamping
/// a point into a box clamps every coordinate into its own interval. A point
/// is positive only when all of its coordinates are.
///
/// A point has no single real value, so [#toDouble(Point)] is unsupported;
/// [#fromDouble(double)] fills every coordinate with the converted value.
///
/// @param <P> the coordinate type
final class PointArithmetic<P extends Comparable<? super P>> implements Arithmetic<Point<P>> {

    private final Arithmetic<P> element;
    private final int dimensions;

    PointArithmetic(Arithmetic<P> element, int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Points need at least one dimension, got: " + dimensions);
        }
        this.element = element;
        this.dimensions = dimensions;
    }

    private Point<P> combine(Point<P> left, Point<P> right, BinaryOperator<P> op) {
        requireDimensions(left);
        requireDimensions(right);
        List<P> result = new ArrayList<>(dimensions);
        for (int i = 0; i < dimensions; i++) {
            result.add(op.apply(left.get(i), right.get(i)));
        }
        return Point.of(result);
    }

    private void requireDimensions(Point<P> point) {
        if (point.dimensions() != dimensions) {
            throw new IllegalArgumentException("Expected a point of " + dimensions + " dimensions, got: " + point);
        }
    }

    @Override
    public Point<P> zero() {
        return Point.filled(element.zero(), dimensions);
    }

    @Override
    public Point<P> add(Point<P> left, Point<P> right) {
        return combine(left, right, element::add);
    }

    @Override
    public Point<P> subtract(Point<P> left, Point<P> right) {
        return combine(left, right, element::subtract);
    }

    @Override
    public Point<P> multiply(Point<P> left, Point<P> right) {
        return combine(left, right, element::multiply);
    }

    @Override
    public Point<P> divide(Point<P> left, Point<P> right) {
        return combine(left, right, element::divide);
    }

    @Override
    public double toDouble(Point<P> value) {
        throw new UnsupportedOperationException("A point of " + dimensions + " dimensions has no single real value");
    }

    @Override
    public Point<P> fromDouble(double value) {
        return Point.filled(element.fromDouble(value), dimensions);
    }

    @Override
    public Point<P> scale(Point<P> value, double factor) {
        return Point.of(map(value, v -> element.scale(v, factor)));
    }

    @Override
    public Point<P> scaleSpread(Point<P> spread, double factor) {
        return Point.of(map(spread, v -> element.scaleSpread(v, factor)));
    }

    private List<P> map(Point<P> value, UnaryOperator<P> op) {
        requireDimensions(value);
        List<P> result = new ArrayList<>(dimensions);
        for (P coordinate : value.coordinates()) {
            result.add(op.apply(coordinate));
        }
        return result;
    }

    @Override
    public boolean isIntegral() {
        return element.isIntegral();
    }

    @Override
    public boolean isPositive(Point<P> value) {
        requireDimensions(value);
        for (P coordinate : value.coordinates()) {
            if (!element.isPositive(coordinate)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Point<P> positiveOr(Point<P> value, Point<P> fallback) {
        return combine(value, fallback, element::positiveOr);
    }

    @Override
    public Point<P> max(Point<P> left, Point<P> right) {
        return combine(left, right, element::max);
    }

    @Override
    public Point<P> min(Point<P> left, Point<P> right) {
        return combine(left, right, element::min);
    }

    @Override
    public String toString() {
        return "PointArithmetic[" + element + " x " + dimensions + "]";
    }
}
