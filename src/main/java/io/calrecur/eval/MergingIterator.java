package io.calrecur.eval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Lazily merges ascending iterators into one ascending iterator. Only one element per source is
 * buffered. Equal elements come out in source order.
 *
 * @param <T> the element type
 */
public final class MergingIterator<T> implements Iterator<T> {
  private final PriorityQueue<Head<T>> heads;

  private MergingIterator(
      List<? extends Iterator<? extends T>> sources, Comparator<? super T> order) {
    this.heads =
        new PriorityQueue<>(
            Math.max(1, sources.size()),
            (a, b) -> {
              int c = order.compare(a.value, b.value);
              return c != 0 ? c : Integer.compare(a.source, b.source);
            });
    for (int i = 0; i < sources.size(); i++) {
      advance(new Head<>(i, sources.get(i)));
    }
  }

  /**
   * Merges the given ascending sources.
   *
   * @param sources the sources, each ascending under {@code order}
   * @param order the ordering
   * @param <T> the element type
   * @return a merged iterator
   */
  public static <T> Iterator<T> merge(
      List<? extends Iterator<? extends T>> sources, Comparator<? super T> order) {
    return new MergingIterator<>(new ArrayList<>(sources), order);
  }

  @Override
  public boolean hasNext() {
    return !heads.isEmpty();
  }

  @Override
  public T next() {
    Head<T> head = heads.poll();
    if (head == null) {
      throw new NoSuchElementException();
    }
    T value = head.value;
    advance(head);
    return value;
  }

  private void advance(Head<T> head) {
    if (head.it.hasNext()) {
      head.value = head.it.next();
      heads.add(head);
    }
  }

  private static final class Head<T> {
    final int source;
    final Iterator<? extends T> it;
    T value;

    Head(int source, Iterator<? extends T> it) {
      this.source = source;
      this.it = it;
    }
  }
}
