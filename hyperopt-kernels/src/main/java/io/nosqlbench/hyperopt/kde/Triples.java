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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Adjacency windowing over an ascending sequence.
///
/// Triples is a lazy view: every call to [#iterator()] restarts the underlying
/// iterable, so the same instance can be traversed any number of times while
/// the source reflects its current contents. A sequence of `n` elements yields
/// `n + 2` windows, or none when it is empty. See [Triple] for the window shapes.
///
/// @param <T> the element type, elements must be non-null
public final class Triples<T> implements Iterable<Triple<T>> {

    private final Iterable<? extends T> source;

    private Triples(Iterable<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /// Creates a windowed view over the given sequence.
    ///
    /// @param source the ascending sequence
    /// @param <T> the element type
    /// @return the windowed view
    public static <T> Triples<T> of(Iterable<? extends T> source) {
        return new Triples<>(source);
    }

    @Override
    public Iterator<Triple<T>> iterator() {
        return new WindowIterator<>(source.iterator());
    }

    /// @return a sequential stream over the windows
    public Stream<Triple<T>> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    private static final class WindowIterator<T> implements Iterator<Triple<T>> {

        private final Iterator<? extends T> inner;
        private T left;
        private T middle;
        private T right;
        private Triple<T> pending;

        WindowIterator(Iterator<? extends T> inner) {
            this.inner = inner;
            this.pending = advance();
        }

        @Override
        public boolean hasNext() {
            return pending != null;
        }

        @Override
        public Triple<T> next() {
            if (pending == null) {
                throw new NoSuchElementException();
            }
            Triple<T> current = pending;
            pending = advance();
            return current;
        }

        private Triple<T> advance() {
            left = middle;
            middle = right;
            right = inner.hasNext() ? Objects.requireNonNull(inner.next(), "sequence element") : null;

            if (left == null && middle == null && right == null) {
                return null;
            }
            if (left == null && middle == null) {
                return new Triple.Right<>(right);
            }
            if (left == null) {
                return right == null ? new Triple.Middle<>(middle) : new Triple.MiddleRight<>(middle, right);
            }
            if (middle == null) {
                // a gap between two occupied slots cannot be produced by shifting
                if (right != null) {
                    throw new IllegalStateException("Window slots out of order: " + left + ", _, " + right);
                }
                return new Triple.Left<>(left);
            }
            return right == null ? new Triple.LeftMiddle<>(left, middle) : new Triple.Full<>(left, middle, right);
        }
    }
}
