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

import io.vavr.Tuple2;
import io.vavr.control.Option;

import java.util.HashMap;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Implements a mutable set that iterates in insertion order and in reverse
 * insertion order.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which elements were inserted, or in the
 *     opposite order</li>
 *     <li>can start an iteration at any element of the set</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add, addFirst: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>contains: O(1)</li>
 *     <li>clear: O(N)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 *     <li>head(), last(): O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The elements are stored in a doubly linked chain of nodes, which records
 * the insertion order. A hash map from element to node provides the
 * membership test, and lets us find the node of an element without walking
 * the chain. The node of an element is used for removing the element and for
 * starting an iteration at the element.
 * <p>
 * Adding an element that is already contained does not change the set. In
 * particular, {@link #add} does not move the element to the end and
 * {@link #addFirst} does not move it to the front.
 * <p>
 * Iterators are not fail-fast. If the set is structurally modified while an
 * iterator is in use, the iterator keeps following the links it finds. An
 * iterator that is about to produce an element that has been removed, or
 * that was contained when the set was cleared, produces that element and
 * then ends.
 *
 * @param <T> the element type
 */
public class ReverseIterableSet<T> implements Iterable<T> {

    private static final String STRING_PREFIX = "ReverseIterableSet";

    /**
     * Maps each element to its node in the chain.
     */
    private final HashMap<T, Node<T>> index = new HashMap<>();
    /**
     * The first node in insertion order, or {@code null} if the set is empty.
     */
    Node<T> first;
    /**
     * The last node in insertion order, or {@code null} if the set is empty.
     */
    Node<T> last;

    /**
     * Creates an empty set.
     */
    public ReverseIterableSet() {
    }

    /**
     * Creates a set with the given elements, in the order of iteration.
     * Duplicates are only added once, at the position of their first
     * occurrence.
     *
     * @param elements the elements
     * @throws NullPointerException if {@code elements} is null
     */
    public ReverseIterableSet(Iterable<? extends T> elements) {
        addAll(elements);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link ReverseIterableSet}.
     *
     * @param <T> Component type of the ReverseIterableSet.
     * @return A ReverseIterableSet Collector.
     */
    public static <T> Collector<T, ReverseIterableSet<T>, ReverseIterableSet<T>> collector() {
        return Collector.<T, ReverseIterableSet<T>>of(ReverseIterableSet::new, ReverseIterableSet::add,
                (left, right) -> left.addAll(right),
                Collector.Characteristics.IDENTITY_FINISH);
    }

    public static <T> ReverseIterableSet<T> empty() {
        return new ReverseIterableSet<>();
    }

    /**
     * Creates a ReverseIterableSet of the given elements.
     *
     * @param elements Set elements
     * @param <T>      The value type
     * @return A new ReverseIterableSet containing the given entries
     * @throws NullPointerException if {@code elements} is null
     */
    @SafeVarargs
    public static <T> ReverseIterableSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        final ReverseIterableSet<T> set = new ReverseIterableSet<>();
        for (T element : elements) {
            set.add(element);
        }
        return set;
    }

    /**
     * Creates a ReverseIterableSet of the given elements.
     *
     * @param elements Set elements
     * @param <T>      The value type
     * @return A new ReverseIterableSet containing the given entries
     * @throws NullPointerException if {@code elements} is null
     */
    public static <T> ReverseIterableSet<T> ofAll(Iterable<? extends T> elements) {
        return new ReverseIterableSet<>(elements);
    }

    /**
     * Creates a ReverseIterableSet that contains the elements of the given {@link java.util.stream.Stream}.
     *
     * @param javaStream A {@link java.util.stream.Stream}
     * @param <T>        Component type of the Stream.
     * @return A ReverseIterableSet containing the given elements in the same order.
     * @throws NullPointerException if {@code javaStream} is null
     */
    public static <T> ReverseIterableSet<T> ofAll(Stream<? extends T> javaStream) {
        Objects.requireNonNull(javaStream, "javaStream is null");
        final ReverseIterableSet<T> set = new ReverseIterableSet<>();
        javaStream.forEachOrdered(set::add);
        return set;
    }

    // -- membership

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public boolean contains(T element) {
        return index.containsKey(element);
    }

    Node<T> lookup(T element) {
        return index.get(element);
    }

    // -- order chain

    /**
     * Adds the given element at the end of this set, doing nothing if it is
     * already contained.
     *
     * @param element The element to be added.
     * @return this set
     */
    public ReverseIterableSet<T> add(T element) {
        if (index.containsKey(element)) {
            return this;
        }
        final Node<T> node = new Node<>(element);
        index.put(element, node);
        if (last == null) {
            first = node;
        } else {
            node.prev = last;
            last.next = node;
        }
        last = node;
        return this;
    }

    /**
     * Adds the given element at the start of this set, doing nothing if it is
     * already contained.
     * <p>
     * An element that is already contained keeps its position, it is not
     * moved to the start.
     *
     * @param element The element to be added.
     * @return this set
     */
    public ReverseIterableSet<T> addFirst(T element) {
        if (index.containsKey(element)) {
            return this;
        }
        final Node<T> node = new Node<>(element);
        index.put(element, node);
        if (first == null) {
            last = node;
        } else {
            node.next = first;
            first.prev = node;
        }
        first = node;
        return this;
    }

    /**
     * Adds all of the given elements at the end of this set, skipping the
     * ones that are already contained.
     *
     * @param elements The elements to be added.
     * @return this set
     * @throws NullPointerException if {@code elements} is null
     */
    public ReverseIterableSet<T> addAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        for (T element : elements) {
            add(element);
        }
        return this;
    }

    /**
     * Removes the given element from this set.
     *
     * @param element The element to be removed.
     * @return {@code true} if the element was contained, {@code false} otherwise
     */
    public boolean remove(T element) {
        final Node<T> node = index.remove(element);
        if (node == null) {
            return false;
        }
        unlink(node);
        return true;
    }

    private void unlink(Node<T> node) {
        final Node<T> prev = node.prev;
        final Node<T> next = node.next;
        if (prev == null && next == null) {
            // sole node
            first = null;
            last = null;
        } else if (prev == null) {
            next.prev = null;
            first = next;
        } else if (next == null) {
            prev.next = null;
            last = prev;
        } else {
            prev.next = next;
            next.prev = prev;
        }
        node.prev = null;
        node.next = null;
    }

    /**
     * Removes all elements from this set.
     */
    public void clear() {
        for (Node<T> node = first; node != null; ) {
            final Node<T> next = node.next;
            node.prev = null;
            node.next = null;
            node = next;
        }
        index.clear();
        first = null;
        last = null;
    }

    // -- endpoints

    /**
     * Returns the first element of this set.
     *
     * @return the first element
     * @throws NoSuchElementException if this set is empty
     */
    public T head() {
        if (first == null) {
            throw new NoSuchElementException("head of empty " + stringPrefix());
        }
        return first.value;
    }

    public Option<T> headOption() {
        return first == null ? Option.none() : Option.some(first.value);
    }

    /**
     * Returns the last element of this set.
     *
     * @return the last element
     * @throws NoSuchElementException if this set is empty
     */
    public T last() {
        if (last == null) {
            throw new NoSuchElementException("last of empty " + stringPrefix());
        }
        return last.value;
    }

    public Option<T> lastOption() {
        return last == null ? Option.none() : Option.some(last.value);
    }

    // -- iteration

    /**
     * Returns an iterator over the elements of this set in insertion order.
     * Same as {@link #values()}.
     *
     * @return a new iterator
     */
    @Override
    public ReverseIterableIterator<T> iterator() {
        return values();
    }

    /**
     * Returns an iterator over the elements of this set in insertion order.
     *
     * @return a new iterator
     */
    public ReverseIterableIterator<T> values() {
        return new LinkedCursor.Values<>(this);
    }

    /**
     * Returns an iterator over {@code (element, element)} pairs in insertion
     * order.
     *
     * @return a new iterator
     */
    public ReverseIterableIterator<Tuple2<T, T>> entries() {
        return new LinkedCursor.Entries<>(this);
    }

    /**
     * Returns an iterator over the elements of this set in insertion order,
     * starting with the given element.
     * <p>
     * Reversing the returned iterator makes it continue from {@code element}
     * towards the start of the set.
     *
     * @param element the element to start from
     * @return a new iterator, which has no elements if {@code element} is not
     * contained in this set
     */
    public ReverseIterableIterator<T> iteratorFor(T element) {
        return new LinkedCursor.Values<>(this, lookup(element));
    }

    /**
     * Returns an iterator over the elements of this set in reverse insertion
     * order.
     *
     * @return a new iterator
     */
    public ReverseIterableIterator<T> reverseIterator() {
        return values().reverseIterator();
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(values(), size(),
                Spliterator.SIZED | Spliterator.DISTINCT | Spliterator.ORDERED);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Performs the given action for each element of this set, in insertion
     * order.
     *
     * @param action the action, receives each element twice and this set
     * @throws NullPointerException if {@code action} is null
     */
    public void forEachForward(ElementConsumer<T> action) {
        Objects.requireNonNull(action, "action is null");
        entries().forEach(entry -> action.accept(entry._2, entry._1, this));
    }

    /**
     * Performs the given action for each element of this set, in insertion
     * order, passing {@code context} along with every element.
     *
     * @param action  the action
     * @param context the context, may be null
     * @param <C>     the context type
     * @throws NullPointerException if {@code action} is null
     */
    public <C> void forEachForward(ContextualElementConsumer<C, T> action, C context) {
        Objects.requireNonNull(action, "action is null");
        entries().forEach(entry -> action.accept(context, entry._2, entry._1, this));
    }

    /**
     * Performs the given action for each element of this set, in reverse
     * insertion order.
     *
     * @param action the action, receives each element twice and this set
     * @throws NullPointerException if {@code action} is null
     */
    public void forEachBackward(ElementConsumer<T> action) {
        Objects.requireNonNull(action, "action is null");
        entries().reverseIterator().forEach(entry -> action.accept(entry._2, entry._1, this));
    }

    /**
     * Performs the given action for each element of this set, in reverse
     * insertion order, passing {@code context} along with every element.
     *
     * @param action  the action
     * @param context the context, may be null
     * @param <C>     the context type
     * @throws NullPointerException if {@code action} is null
     */
    public <C> void forEachBackward(ContextualElementConsumer<C, T> action, C context) {
        Objects.requireNonNull(action, "action is null");
        entries().reverseIterator().forEach(entry -> action.accept(context, entry._2, entry._1, this));
    }

    // -- object methods

    /**
     * Returns the name of this collection type.
     *
     * @return {@code "ReverseIterableSet"}
     */
    public String stringPrefix() {
        return STRING_PREFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof ReverseIterableSet)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        final ReverseIterableSet<T> that = (ReverseIterableSet<T>) o;
        if (that.size() != size()) {
            return false;
        }
        for (T element : that) {
            if (!contains(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (T element : this) {
            h += Objects.hashCode(element);
        }
        return h;
    }

    @Override
    public String toString() {
        return values().mkString(stringPrefix() + "(", ", ", ")");
    }

    /**
     * Receives the elements of a {@link ReverseIterableSet}, one at a time.
     *
     * @param <T> the element type
     */
    @FunctionalInterface
    public interface ElementConsumer<T> {
        /**
         * Performs this operation on an element.
         *
         * @param value the element
         * @param key   the element again, sets use their elements as keys
         * @param set   the set that is being traversed
         */
        void accept(T value, T key, ReverseIterableSet<T> set);
    }

    /**
     * Receives the elements of a {@link ReverseIterableSet} together with a
     * context object supplied by the caller.
     *
     * @param <C> the context type
     * @param <T> the element type
     */
    @FunctionalInterface
    public interface ContextualElementConsumer<C, T> {
        void accept(C context, T value, T key, ReverseIterableSet<T> set);
    }

    /**
     * A node of the order chain.
     */
    static final class Node<T> {
        final T value;
        Node<T> next;
        Node<T> prev;

        Node(T value) {
            this.value = value;
        }
    }
}
