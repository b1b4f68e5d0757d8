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

/// Arithmetic over an ordered parameter type.
///
/// # Overview
///
/// Kernels, components and the optimizer are generic in the parameter type `P`.
/// Rather than requiring `P` to carry its own operators, every generic site is
/// handed an Arithmetic strategy that knows how to combine and convert values:
///
/// ```text
///   P ──► toDouble ──► density math in double ──► fromDouble ──► P
///                                                   │
///                                     ArithmeticException if the
///                                     value is not representable
/// ```
///
/// Two strategies are provided:
///
/// | Strategy | Parameter type | Use |
/// |----------|----------------|-----|
/// | [DoubleArithmetic] | `Double` | continuous parameters |
/// | [LongArithmetic] | `Long` | discrete (integer) parameters |
/// | [PointArithmetic] | [Point] | several parameters searched together |
///
/// Conversions never truncate silently. A value that cannot be represented
/// in the target type raises [ArithmeticException] at the conversion site.
///
/// @param <P> the parameter type
public interface Arithmetic<P extends Comparable<? super P>> {

    /// Returns the arithmetic for continuous `Double` parameters.
    ///
    /// @return the shared double arithmetic
    static Arithmetic<Double> ofDouble() {
        return DoubleArithmetic.INSTANCE;
    }

    /// Returns the arithmetic for discrete `Long` parameters.
    ///
    /// @return the shared long arithmetic
    static Arithmetic<Long> ofLong() {
        return LongArithmetic.INSTANCE;
    }

    /// Returns the element-wise arithmetic for points of a fixed dimension.
    ///
    /// @param element the arithmetic of every coordinate
    /// @param dimensions the number of coordinates, at least 1
    /// @param <P> the coordinate type
    /// @return the point arithmetic
    /// @throws IllegalArgumentException if dimensions is less than 1
    static <P extends Comparable<? super P>> Arithmetic<Point<P>> ofPoints(Arithmetic<P> element, int dimensions) {
        return new PointArithmetic<>(element, dimensions);
    }

    /// @return the additive identity
    P zero();

    P add(P left, P right);

    P subtract(P left, P right);

    P multiply(P left, P right);

    /// Divides two values.
    ///
    /// @param left the dividend
    /// @param right the divisor
    /// @return the quotient
    /// @throws ArithmeticException if the divisor is zero
    P divide(P left, P right);

    /// Converts a value to the density domain.
    ///
    /// @param value the value to convert
    /// @return the value as a double
    double toDouble(P value);

    /// Converts a double back into the parameter type.
    ///
    /// @param value the value to convert
    /// @return the converted value
    /// @throws ArithmeticException if the value is not finite or out of range
    P fromDouble(double value);

    /// Multiplies a value by a real factor, converting back with [#fromDouble(double)].
    ///
    /// @param value the value to scale
    /// @param factor the real factor
    /// @return the scaled value
    default P scale(P value, double factor) {
        return fromDouble(toDouble(value) * factor);
    }

    /// Scales a spread, such as a kernel bandwidth, by a real factor.
    ///
    /// Unlike [#scale(Comparable, double)], a positive spread never collapses
    /// below the resolution of the type.
    ///
    /// @param spread the spread to scale
    /// @param factor a positive factor
    /// @return the scaled spread
    default P scaleSpread(P spread, double factor) {
        return scale(spread, factor);
    }

    /// @return true for types that only hold whole numbers
    default boolean isIntegral() {
        return false;
    }

    /// @return true if the value is strictly greater than [#zero()]
    default boolean isPositive(P value) {
        return value.compareTo(zero()) > 0;
    }

    /// Returns the value if it is positive, otherwise the fallback.
    ///
    /// @param value the preferred value
    /// @param fallback the replacement for a non-positive value
    /// @return value or fallback
    default P positiveOr(P value, P fallback) {
        return isPositive(value) ? value : fallback;
    }

    default P max(P left, P right) {
        return left.compareTo(right) >= 0 ? left : right;
    }

    default P min(P left, P right) {
        return left.compareTo(right) <= 0 ? left : right;
    }

    /// Clamps a value into the closed interval [lower, upper].
    ///
    /// @param value the value to clamp
    /// @param lower the lower bound
    /// @param upper the upper bound
    /// @return the clamped value
    default P clamp(P value, P lower, P upper) {
        return min(max(value, lower), upper);
    }
}
