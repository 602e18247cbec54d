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

import io.vavr.collection.Iterator;

/**
 * An {@link Iterator} over a {@link ReverseIterableSet} that can turn around.
 * <p>
 * A reverse-iterable iterator walks the elements of its set lazily, one
 * element per call of {@link #next()}. {@link #hasNext()} returns
 * {@code false} once the walk has fallen off either end of the set, and
 * from then on it always returns {@code false}.
 * <p>
 * Instances are single-use: a consumer that needs to traverse the set twice
 * must ask the set for a fresh iterator.
 *
 * @param <T> the type of the elements produced by this iterator
 */
public interface ReverseIterableIterator<T> extends Iterator<T> {

    /**
     * Turns this iterator around.
     * <p>
     * The iterator continues from its anchor in the opposite direction. The
     * anchor is the element the iterator was started at with
     * {@link ReverseIterableSet#iteratorFor(Object)}, or, for an iterator
     * over the whole set, the end of the set it now walks away from.
     * <p>
     * If this iterator is exhausted, it stays exhausted.
     *
     * @return this iterator
     */
    ReverseIterableIterator<T> reverseIterator();
}
