/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.reverseiterable;

import io.vavr.Tuple;
import io.vavr.Tuple2;

import java.util.NoSuchElementException;

/**
 * Walks the order chain of a {@link ReverseIterableSet}.
 * <p>
 * A cursor is either active, holding a reference to the node it will produce
 * next, or exhausted, holding {@code null}. Once exhausted, a cursor never
 * becomes active again.
 * <p>
 * The walk is shared by all cursors. Subclasses only decide what a node is
 * turned into: {@link Values} produces the element, {@link Entries} produces
 * the element paired with itself.
 * <p>
 * A cursor does not detect modifications of its set. The set unlinks a node
 * when it removes it, and unlinks all nodes when it is cleared, so a cursor
 * that currently refers to a removed node produces that node's element and
 * then ends.
 *
 * @param <T> the element type of the set
 * @param <R> the type of the values produced by this cursor
 */
abstract class LinkedCursor<T, R> implements ReverseIterableIterator<R> {

    private final ReverseIterableSet<T> set;
    /**
     * The node this cursor was started at, or {@code null} if the cursor
     * starts at one of the ends of the set.
     */
    private final ReverseIterableSet.Node<T> anchor;
    private ReverseIterableSet.Node<T> current;
    private boolean forward;

    LinkedCursor(ReverseIterableSet<T> set, ReverseIterableSet.Node<T> anchor, boolean anchored) {
        this.set = set;
        this.anchor = anchor;
        this.forward = true;
        this.current = anchored ? anchor : set.first;
    }

    /**
     * Turns a node into the value produced by this cursor.
     *
     * @param node a node of the set
     * @return the value for the node
     */
    abstract R extract(ReverseIterableSet.Node<T> node);

    @Override
    public boolean hasNext() {
        return current != null;
    }

    @Override
    public R next() {
        if (current == null) {
            throw new NoSuchElementException("next() on exhausted " + stringPrefix());
        }
        final ReverseIterableSet.Node<T> node = current;
        current = forward ? node.next : node.prev;
        return extract(node);
    }

    @Override
    public ReverseIterableIterator<R> reverseIterator() {
        if (current != null) {
            forward = !forward;
            if (anchor != null) {
                current = anchor;
            } else {
                current = forward ? set.first : set.last;
            }
        }
        return this;
    }

    @Override
    public String stringPrefix() {
        return "ReverseIterableIterator";
    }

    /**
     * Produces the elements of the set.
     *
     * @param <T> the element type
     */
    static final class Values<T> extends LinkedCursor<T, T> {

        Values(ReverseIterableSet<T> set) {
            super(set, null, false);
        }

        Values(ReverseIterableSet<T> set, ReverseIterableSet.Node<T> anchor) {
            super(set, anchor, true);
        }

        @Override
        T extract(ReverseIterableSet.Node<T> node) {
            return node.value;
        }
    }

    /**
     * Produces {@code (element, element)} pairs.
     *
     * @param <T> the element type
     */
    static final class Entries<T> extends LinkedCursor<T, Tuple2<T, T>> {

        Entries(ReverseIterableSet<T> set) {
            super(set, null, false);
        }

        @Override
        Tuple2<T, T> extract(ReverseIterableSet.Node<T> node) {
            return Tuple.of(node.value, node.value);
        }
    }
}
