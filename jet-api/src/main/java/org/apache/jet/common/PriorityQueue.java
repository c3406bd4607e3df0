/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.jet.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;

import com.google.common.base.Preconditions;

/**
 * A binary min-heap ordered by an explicit {@link Comparator}.
 * <p/>
 * Unlike {@link java.util.PriorityQueue}, this queue allows the caller to mutate the item at
 * the front of the queue and restore the heap with {@link #adjustFirstItem()}, which costs a
 * single down-heap instead of a dequeue followed by an enqueue. The merge code relies on this
 * when it advances the segment that produced the smallest record.
 * <p/>
 * This class is not thread safe.
 *
 * @param <T> the type of the items in the queue
 */
@Public
@Evolving
public class PriorityQueue<T> {

  private static final String EMPTY_MESSAGE = "The priority queue is empty.";

  private final List<T> heap;
  private final Comparator<? super T> comparator;

  public PriorityQueue(Comparator<? super T> comparator) {
    Preconditions.checkNotNull(comparator, "comparator");
    this.heap = new ArrayList<T>();
    this.comparator = comparator;
  }

  /**
   * Creates a queue holding the items of the specified collection. The heap is built in
   * linear time.
   */
  public PriorityQueue(Collection<? extends T> items, Comparator<? super T> comparator) {
    Preconditions.checkNotNull(items, "items");
    Preconditions.checkNotNull(comparator, "comparator");
    this.heap = new ArrayList<T>(items);
    this.comparator = comparator;
    for (int index = (heap.size() - 1) >> 1; index >= 0; --index) {
      downHeap(index);
    }
  }

  public int size() {
    return heap.size();
  }

  public boolean isEmpty() {
    return heap.isEmpty();
  }

  public Comparator<? super T> getComparator() {
    return comparator;
  }

  public void enqueue(T item) {
    heap.add(item);
    upHeap(heap.size() - 1);
  }

  /**
   * Returns the smallest item without removing it.
   * @throws IllegalStateException if the queue is empty
   */
  public T peek() {
    Preconditions.checkState(!heap.isEmpty(), EMPTY_MESSAGE);
    return heap.get(0);
  }

  /**
   * Removes and returns the smallest item.
   * @throws IllegalStateException if the queue is empty
   */
  public T dequeue() {
    Preconditions.checkState(!heap.isEmpty(), EMPTY_MESSAGE);
    T result = heap.get(0);
    removeAt(0);
    return result;
  }

  /**
   * Restores the heap after the item at the front of the queue was changed in a way that
   * affects its ordering. Only the front item may have changed.
   * @throws IllegalStateException if the queue is empty
   */
  public void adjustFirstItem() {
    Preconditions.checkState(!heap.isEmpty(), EMPTY_MESSAGE);
    downHeap(0);
  }

  /**
   * Removes the first occurrence of the item, compared by equality.
   * @return <code>true</code> if the item was found
   */
  public boolean remove(T item) {
    int index = heap.indexOf(item);
    if (index < 0) {
      return false;
    }
    removeAt(index);
    return true;
  }

  public boolean contains(T item) {
    return heap.contains(item);
  }

  public void clear() {
    heap.clear();
  }

  private void removeAt(int index) {
    int last = heap.size() - 1;
    if (index == last) {
      heap.remove(last);
    } else {
      heap.set(index, heap.remove(last));
      // The moved item may belong above or below its new position.
      downHeap(index);
      upHeap(index);
    }
  }

  private void upHeap(int index) {
    T item = heap.get(index);
    while (index > 0) {
      int parent = (index - 1) >> 1;
      T parentItem = heap.get(parent);
      if (comparator.compare(item, parentItem) >= 0) {
        break;
      }
      heap.set(index, parentItem);
      index = parent;
    }
    heap.set(index, item);
  }

  private void downHeap(int index) {
    int size = heap.size();
    T item = heap.get(index);
    while (true) {
      int child = (index << 1) + 1;
      if (child >= size) {
        break;
      }
      int right = child + 1;
      if (right < size && comparator.compare(heap.get(right), heap.get(child)) < 0) {
        child = right;
      }
      T childItem = heap.get(child);
      if (comparator.compare(childItem, item) >= 0) {
        break;
      }
      heap.set(index, childItem);
      index = child;
    }
    heap.set(index, item);
  }
}
