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

/// Arithmetic for discrete integer parameters.
///
/// All operations are overflow-checked. Real values are rounded half-up to the
/// nearest integer on the way back from the density domain; values outside
/// the `long` range, NaN and infinities are rejected. Spreads are the exception:
/// [#scaleSpread(Long, double)] rounds up.
final class LongArithmetic implements Arithmetic<Long> {

    static final LongArithmetic INSTANCE = new LongArithmetic();

    // 2^63 is exactly representable; anything at or above it overflows a long
    private static final double LONG_RANGE_LIMIT = 0x1p63;

    private LongArithmetic() {
    }

    @Override
    public Long zero() {
        return 0L;
    }

    @Override
    public Long add(Long left, Long right) {
        return Math.addExact(left, right);
    }

    @Override
    public Long subtract(Long left, Long right) {
        return Math.subtractExact(left, right);
    }

    @Override
    public Long multiply(Long left, Long right) {
        return Math.multiplyExact(left, right);
    }

    @Override
    public Long divide(Long left, Long right) {
        if (right == 0L) {
            throw new ArithmeticException("Division by zero: " + left + " / " + right);
        }
        return left / right;
    }

    @Override
    public double toDouble(Long value) {
        return value.doubleValue();
    }

    @Override
    public Long fromDouble(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Value is not a finite number: " + value);
        }
        double rounded = Math.floor(value + 0.5);
        if (rounded >= LONG_RANGE_LIMIT || rounded < -LONG_RANGE_LIMIT) {
            throw new ArithmeticException("Value " + value + " is outside the long range");
        }
        return (long) rounded;
    }

    /// Rounds up, so a positive spread is at least one step wide.
    @Override
    public Long scaleSpread(Long spread, double factor) {
        return fromDouble(Math.ceil(toDouble(spread) * factor));
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public String toString() {
        return "LongArithmetic";
    }
}
