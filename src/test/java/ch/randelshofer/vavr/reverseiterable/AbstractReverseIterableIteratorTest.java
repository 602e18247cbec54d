/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Checks the iterator contract that all iterators of a
 * {@link ReverseIterableSet} share.
 */
public abstract class AbstractReverseIterableIteratorTest {

    /**
     * Returns a new forward iterator over the whole set.
     */
    protected abstract ReverseIterableIterator<?> iterator(ReverseIterableSet<String> set);

    /**
     * Returns the value the iterator under test produces for the given element.
     */
    protected abstract Object expected(String element);

    private List<Object> expected(String... elements) {
        final List<Object> list = new ArrayList<>();
        for (String element : elements) {
            list.add(expected(element));
        }
        return list;
    }

    private static List<Object> drain(ReverseIterableIterator<?> it) {
        final List<Object> list = new ArrayList<>();
        while (it.hasNext()) {
            list.add(it.next());
        }
        return list;
    }

    // -- forward

    @Test
    public void shouldIterateInInsertionOrder() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        assertThat(drain(iterator(set))).isEqualTo(expected("a", "b", "c"));
    }

    @Test
    public void shouldIterateElementsAddedAtTheStart() {
        final ReverseIterableSet<String> set = ReverseIterableSet.<String>empty()
                .add("c").addFirst("b").addFirst("a").add("d");
        assertThat(drain(iterator(set))).isEqualTo(expected("a", "b", "c", "d"));
    }

    @Test
    public void shouldHaveNoElementsWhenSetIsEmpty() {
        final ReverseIterableIterator<?> it = iterator(ReverseIterableSet.empty());
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    public void shouldSeeElementsAddedBeforeTheFirstStep() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b");
        final ReverseIterableIterator<?> it = iterator(set);
        set.add("c");
        assertThat(drain(it)).isEqualTo(expected("a", "b", "c"));
    }

    // -- reverse

    @Test
    public void shouldIterateInReverseInsertionOrderWhenReversed() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        assertThat(drain(iterator(set).reverseIterator())).isEqualTo(expected("c", "b", "a"));
    }

    @Test
    public void shouldMirrorForwardIterationWhenReversed() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("q", "w", "e", "r", "t", "y");
        final List<Object> forward = drain(iterator(set));
        final List<Object> backward = drain(iterator(set).reverseIterator());
        Collections.reverse(forward);
        assertThat(backward).isEqualTo(forward);
    }

    @Test
    public void shouldReturnSameIteratorWhenReversed() {
        final ReverseIterableIterator<?> it = iterator(ReverseIterableSet.of("a"));
        final Object reversed = it.reverseIterator();
        assertThat(reversed).isSameAs(it);
    }

    @Test
    public void shouldIterateForwardAgainWhenReversedTwice() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        assertThat(drain(iterator(set).reverseIterator().reverseIterator())).isEqualTo(expected("a", "b", "c"));
    }

    @Test
    public void shouldRestartFromTheEndWhenReversedAfterSomeSteps() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set);
        assertThat(it.next()).isEqualTo(expected("a"));
        assertThat(drain(it.reverseIterator())).isEqualTo(expected("c", "b", "a"));
    }

    @Test
    public void shouldIterateSingleElementInBothDirections() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a");
        assertThat(drain(iterator(set))).isEqualTo(expected("a"));
        assertThat(drain(iterator(set).reverseIterator())).isEqualTo(expected("a"));
    }

    // -- exhaustion

    @Test
    public void shouldStayExhaustedOnceExhausted() {
        final ReverseIterableIterator<?> it = iterator(ReverseIterableSet.of("a", "b"));
        drain(it);
        for (int i = 0; i < 3; i++) {
            assertThat(it.hasNext()).isFalse();
            assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    public void shouldStayExhaustedWhenReversedAfterExhaustion() {
        final ReverseIterableIterator<?> it = iterator(ReverseIterableSet.of("a", "b"));
        drain(it);
        assertThat(it.reverseIterator().hasNext()).isFalse();
    }

    @Test
    public void shouldStayExhaustedWhenElementsAreAddedAfterExhaustion() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a");
        final ReverseIterableIterator<?> it = iterator(set);
        drain(it);
        set.add("b");
        assertThat(it.hasNext()).isFalse();
    }

    // -- modification while iterating

    @Test
    public void shouldProduceRemovedElementAndEndWhenPendingElementIsRemoved() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set);
        assertThat(it.next()).isEqualTo(expected("a"));
        set.remove("b");
        assertThat(drain(it)).isEqualTo(expected("b"));
    }

    @Test
    public void shouldSkipRemovedElementThatIsNotPending() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set);
        assertThat(it.next()).isEqualTo(expected("a"));
        set.remove("c");
        assertThat(drain(it)).isEqualTo(expected("b"));
    }

    @Test
    public void shouldEndAfterPendingElementWhenSetIsCleared() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set);
        set.clear();
        assertThat(drain(it)).isEqualTo(expected("a"));
        assertThat(set.size()).isEqualTo(0);
    }

    @Test
    public void shouldEndAfterPendingElementWhenSetIsClearedMidway() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set);
        assertThat(it.next()).isEqualTo(expected("a"));
        set.clear();
        assertThat(drain(it)).isEqualTo(expected("b"));
    }

    @Test
    public void shouldEndAfterPendingElementWhenSetIsClearedWhileReversed() {
        final ReverseIterableSet<String> set = ReverseIterableSet.of("a", "b", "c");
        final ReverseIterableIterator<?> it = iterator(set).reverseIterator();
        set.clear();
        assertThat(drain(it)).isEqualTo(expected("c"));
    }

    // -- toString

    @Test
    public void shouldUseStringPrefix() {
        assertThat(iterator(ReverseIterableSet.of("a")).stringPrefix()).isEqualTo("ReverseIterableIterator");
    }
}
