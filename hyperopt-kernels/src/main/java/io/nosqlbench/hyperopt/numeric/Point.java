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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// An immutable tuple of parameter values, searched together by one optimizer.
///
/// Points order lexicographically, coordinate by coordinate. That ordering
/// only serves the trial ledger and the adjacency windows; arithmetic on
/// points, including `max` and `min`, is element-wise (see [PointArithmetic]).
///
/// ```java
/// Point<Double> p = Point.of(1.5, -2.0);
/// double y = p.get(1); // -2.0
/// ```
///
/// @param <P> the coordinate type
public final class Point<P extends Comparable<? super P>> implements Comparable<Point<P>> {

    private final List<P> coordinates;

    private Point(List<P> coordinates) {
        this.coordinates = coordinates;
    }

    /// Creates a point from its coordinates.
    ///
    /// @param coordinates at least one non-null coordinate
    /// @param <P> the coordinate type
    /// @return the point
    /// @throws IllegalArgumentException if no coordinate is given
    @SafeVarargs
    public static <P extends Comparable<? super P>> Point<P> of(P... coordinates) {
        return of(Arrays.asList(coordinates));
    }

    /// Creates a point from a list of coordinates.
    ///
    /// @param coordinates at least one non-null coordinate
    /// @param <P> the coordinate type
    /// @return the point
    /// @throws IllegalArgumentException if the list is empty
    public static <P extends Comparable<? super P>> Point<P> of(List<? extends P> coordinates) {
        if (coordinates.isEmpty()) {
            throw new IllegalArgumentException("A point needs at least one coordinate");
        }
        return new Point<>(List.copyOf(coordinates));
    }

    /// Creates a point with the same value in every coordinate.
    ///
    /// @param value the coordinate value
    /// @param dimensions the number of coordinates
    /// @param <P> the coordinate type
    /// @return the point
    public static <P extends Comparable<? super P>> Point<P> filled(P value, int dimensions) {
        List<P> coordinates = new ArrayList<>(dimensions);
        for (int i = 0; i < dimensions; i++) {
            coordinates.add(value);
        }
        return of(coordinates);
    }

    public P get(int index) {
        return coordinates.get(index);
    }

    public int dimensions() {
        return coordinates.size();
    }

    /// @return the coordinates, unmodifiable
    public List<P> coordinates() {
        return coordinates;
    }

    @Override
    public int compareTo(Point<P> other) {
        if (other.dimensions() != dimensions()) {
            throw new IllegalArgumentException("Cannot compare points of " + dimensions() + " and "
                + other.dimensions() + " dimensions");
        }
        for (int i = 0; i < coordinates.size(); i++) {
            int cmp = coordinates.get(i).compareTo(other.coordinates.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        return coordinates.equals(((Point<?>) o).coordinates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coordinates);
    }

    @Override
    public String toString() {
        return coordinates.toString();
    }
}
