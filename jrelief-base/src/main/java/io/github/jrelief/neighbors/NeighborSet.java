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

/**
 * The neighbors of one query instance, sorted by ascending aggregate distance (ties by ascending id),
 * each tagged with its class so that hits and misses can be told apart.
 * <p>
 * A NeighborSet lives for one instance's weight update and is then discarded.
 */
public final class NeighborSet {
    private final int query;
    private final int queryClass;
    private final int[] nodes;
    private final double[] distances;
    private final int[] classes;
    private int size;

    NeighborSet(int query, int queryClass, int capacity) {
        this.query = query;
        this.queryClass = queryClass;
        this.nodes = new int[capacity];
        this.distances = new double[capacity];
        this.classes = new int[capacity];
    }

    void addInOrder(int node, double distance, int classIndex) {
        assert size == 0 || distances[size - 1] <= distance || (float) distances[size - 1] == (float) distance
                : String.format("Distance %s added out of order after %s", distance, distances[size - 1]);
        nodes[size] = node;
        distances[size] = distance;
        classes[size] = classIndex;
        size++;
    }

    public int query() {
        return query;
    }

    public int queryClass() {
        return queryClass;
    }

    public int size() {
        return size;
    }

    public int node(int i) {
        return nodes[i];
    }

    public double distance(int i) {
        return distances[i];
    }

    public int classOf(int i) {
        return classes[i];
    }

    /**
     * @return true if the ith neighbor shares the query's class
     */
    public boolean isHit(int i) {
        return classes[i] == queryClass;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("NeighborSet(query=").append(query).append(", [");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(nodes[i]).append(isHit(i) ? "H" : "M").append('@').append(String.format("%.4f", distances[i]));
        }
        return sb.append("])").toString();
    }
}
