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

package io.github.jrelief.neighbors;

import io.github.jrelief.util.LongHeap;

/**
 * NeighborQueue uses a {@link LongHeap} to store instance ids with their distance to a query,
 * packed together as a sortable long that orders primarily by distance and secondarily by id.
 * <p>
 * Two flavors exist:
 * <ul>
 *   <li>{@link #nearestFirst(int)} is unbounded, and pops neighbors in ascending distance.</li>
 *   <li>{@link #keepNearest(int)} retains only the k nearest neighbors pushed into it.  Its top is the
 *   farthest retained neighbor, which is what gets evicted, so it pops in descending distance.</li>
 * </ul>
 * Among equal distances the smaller instance id always counts as nearer, which makes every ranking
 * deterministic.
 */
public class NeighborQueue {
    public enum Order {
        /** Nearest neighbor at the top of the heap */
        NEAREST_ON_TOP {
            @Override
            long apply(long v) {
                return v;
            }
        },
        /** Farthest neighbor at the top of the heap */
        FARTHEST_ON_TOP {
            @Override
            long apply(long v) {
                // Not just `-v`: Long.MIN_VALUE has no positive counterpart.
                return -1 - v;
            }
        };

        abstract long apply(long v);
    }

    private final LongHeap heap;
    private final Order order;

    public NeighborQueue(LongHeap heap, Order order) {
        this.heap = heap;
        this.order = order;
    }

    /**
     * @return an unbounded queue popping neighbors nearest first
     */
    public static NeighborQueue nearestFirst(int initialSize) {
        return new NeighborQueue(LongHeap.growable(Math.max(1, initialSize)), Order.NEAREST_ON_TOP);
    }

    /**
     * @return a queue retaining the k nearest neighbors, popping them farthest first
     */
    public static NeighborQueue keepNearest(int k) {
        return new NeighborQueue(LongHeap.bounded(k), Order.FARTHEST_ON_TOP);
    }

    public int size() {
        return heap.size();
    }

    /**
     * Adds a neighbor.  A full bounded queue replaces its farthest neighbor if the new one is nearer.
     *
     * @return true if the neighbor was added
     */
    public boolean push(int node, float distance) {
        return heap.push(encode(node, distance));
    }

    /**
     * The most significant 32 bits hold the distance as a sortable int; the least significant
     * 32 bits hold the (non-negative) node id, so equal distances order by id.
     */
    private long encode(int node, float distance) {
        return order.apply((((long) floatToSortableInt(distance)) << 32) | (0xFFFFFFFFL & node));
    }

    private float decodeDistance(long heapValue) {
        return sortableIntToFloat((int) (order.apply(heapValue) >> 32));
    }

    private int decodeNode(long heapValue) {
        return (int) order.apply(heapValue);
    }

    /** Removes the top element and returns its node id. */
    public int pop() {
        return decodeNode(heap.pop());
    }

    public int topNode() {
        return decodeNode(heap.top());
    }

    public float topDistance() {
        return decodeDistance(heap.top());
    }

    public void clear() {
        heap.clear();
    }

    @Override
    public String toString() {
        return "Neighbors[" + heap.size() + "]";
    }

    // IEEE 754 bits reordered so that signed int comparison matches Float.compare
    static int floatToSortableInt(float value) {
        int bits = Float.floatToIntBits(value);
        return bits ^ (bits >> 31) & 0x7fffffff;
    }

    static float sortableIntToFloat(int encoded) {
        return Float.intBitsToFloat(encoded ^ (encoded >> 31) & 0x7fffffff);
    }
}
