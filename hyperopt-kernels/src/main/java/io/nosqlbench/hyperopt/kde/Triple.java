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

/// A window of up to three consecutive elements of an ascending sequence.
///
/// # Overview
///
/// [Triples] slides a three-slot window over a sequence, including the partial
/// windows at both ends. Each window is tagged by which slots are occupied:
///
/// ```text
///   sequence  1 2 3
///
///   Right(1)              . . 1      window entering
///   MiddleRight(1, 2)     . 1 2      first element centered, no left neighbor
///   Full(1, 2, 3)         1 2 3      interior element
///   LeftMiddle(2, 3)      2 3 .      last element centered, no right neighbor
///   Left(3)               3 . .      window leaving
/// ```
///
/// A single-element sequence produces `Right(x)`, `Middle(x)`, `Left(x)`.
/// Only the variants with a center ([Middle], [MiddleRight], [Full],
/// [LeftMiddle]) describe an element together with its neighbors; there is
/// exactly one of those per element.
///
/// @param <T> the element type
public sealed interface Triple<T>
    permits Triple.Right, Triple.MiddleRight, Triple.Full, Triple.LeftMiddle, Triple.Left, Triple.Middle {

    /// Only the right slot is occupied: the window is entering the sequence.
    record Right<T>(T right) implements Triple<T> {
    }

    /// Center with a right neighbor only: the first element of a longer sequence.
    record MiddleRight<T>(T middle, T right) implements Triple<T> {
    }

    /// Center with both neighbors: an interior element.
    record Full<T>(T left, T middle, T right) implements Triple<T> {
    }

    /// Center with a left neighbor only: the last element of a longer sequence.
    record LeftMiddle<T>(T left, T middle) implements Triple<T> {
    }

    /// Only the left slot is occupied: the window is leaving the sequence.
    record Left<T>(T left) implements Triple<T> {
    }

    /// Center without neighbors: the only element of a one-element sequence.
    record Middle<T>(T middle) implements Triple<T> {
    }
}
