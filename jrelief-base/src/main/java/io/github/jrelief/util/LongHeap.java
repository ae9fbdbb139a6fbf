/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jrelief.util;

import io.github.jrelief.annotations.VisibleForTesting;

import java.util.Arrays;

/**
 * A min heap of longs; a primitive priority queue whose least element can always be found in
 * constant time.  Push and pop take log(size).
 * <p>
 * A bounded heap never grows past its maximum size: once full, a push replaces the top
 * (least) element if the new value is greater, and is rejected otherwise.  A growable heap
 * extends its storage instead.
 */
public final class LongHeap {
    // storage is 1-based; heap[0] is unused
    private long[] heap;
    private int size;
    private final int maxSize;

    private LongHeap(int initialSize, int maxSize) {
        if (initialSize < 1 || initialSize >= Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("initialSize must be > 0 and < " + (Integer.MAX_VALUE - 8) + "; got: " + initialSize);
        }
        this.heap = new long[initialSize + 1];
        this.maxSize = maxSize;
    }

    /**
     * @param maxSize the maximum number of elements retained
     */
    public static LongHeap bounded(int maxSize) {
        return new LongHeap(maxSize, maxSize);
    }

    /**
     * @param initialSize the initial capacity; the heap grows as needed
     */
    public static LongHeap growable(int initialSize) {
        return new LongHeap(initialSize, Integer.MAX_VALUE);
    }

    /**
     * @return true if the value was added.  A full bounded heap rejects values that are
     * not greater than its current top.
     */
    public boolean push(long value) {
        if (size >= maxSize) {
            if (value < heap[1]) {
                return false;
            }
            heap[1] = value;
            downHeap(1);
            return true;
        }
        size++;
        if (size == heap.length) {
            heap = Arrays.copyOf(heap, Math.min(Integer.MAX_VALUE - 8, (size * 3 + 1) / 2 + 1));
        }
        heap[size] = value;
        upHeap(size);
        return true;
    }

    /**
     * Returns the least element.  No checking is done; an empty heap returns 0.
     */
    public long top() {
        return heap[1];
    }

    /**
     * Removes and returns the least element.
     *
     * @throws IllegalStateException if the heap is empty
     */
    public long pop() {
        if (size == 0) {
            throw new IllegalStateException("The heap is empty");
        }
        long result = heap[1];
        heap[1] = heap[size];
        size--;
        downHeap(1);
        return result;
    }

    public int size() {
        return size;
    }

    public boolean isBounded() {
        return maxSize != Integer.MAX_VALUE;
    }

    public void clear() {
        size = 0;
    }

    @VisibleForTesting
    long[] heapArray() {
        return heap;
    }

    private void upHeap(int origPos) {
        int i = origPos;
        long value = heap[i];
        int j = i >>> 1;
        while (j > 0 && value < heap[j]) {
            heap[i] = heap[j];
            i = j;
            j = j >>> 1;
        }
        heap[i] = value;
    }

    private void downHeap(int i) {
        long value = heap[i];
        int j = smallerChild(i << 1);
        while (j <= size && heap[j] < value) {
            heap[i] = heap[j];
            i = j;
            j = smallerChild(i << 1);
        }
        heap[i] = value;
    }

    private int smallerChild(int left) {
        int right = left + 1;
        return right <= size && heap[right] < heap[left] ? right : left;
    }
}
