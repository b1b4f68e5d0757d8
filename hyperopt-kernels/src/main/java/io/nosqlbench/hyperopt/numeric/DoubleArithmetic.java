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

/// Arithmetic for continuous parameters.
final class DoubleArithmetic implements Arithmetic<Double> {

    static final DoubleArithmetic INSTANCE = new DoubleArithmetic();

    private DoubleArithmetic() {
    }

    @Override
    public Double zero() {
        return 0.0;
    }

    @Override
    public Double add(Double left, Double right) {
        return left + right;
    }

    @Override
    public Double subtract(Double left, Double right) {
        return left - right;
    }

    @Override
    public Double multiply(Double left, Double right) {
        return left * right;
    }

    @Override
    public Double divide(Double left, Double right) {
        if (right == 0.0) {
            throw new ArithmeticException("Division by zero: " + left + " / " + right);
        }
        return left / right;
    }

    @Override
    public double toDouble(Double value) {
        return value;
    }

    @Override
    public Double fromDouble(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Value is not a finite double: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "DoubleArithmetic";
    }
}
