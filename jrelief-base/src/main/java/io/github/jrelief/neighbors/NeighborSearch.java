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

import io.github.jrelief.InvalidNeighborCountException;
import io.github.jrelief.data.ClassLabels;
import io.github.jrelief.distance.DistanceModel;

/**
 * Exhaustive neighbor search over one dataset under an optionally feature-weighted L1-style metric.
 * <p>
 * Every search scores the query against all other instances, so results are exact.  Three retrieval
 * modes are offered: the k nearest overall, the k nearest within each class, and the full ranking of
 * every other instance.  All of them order by ascending distance with ties broken by ascending instance
 * id, so identical inputs always produce identical neighbor sets.
 * <p>
 * Ordering compares distances at float precision: neighbors whose distances differ only below float
 * precision count as tied and come in id order.  {@link NeighborSet#distance} still reports the exact
 * double distance.
 * <p>
 * A NeighborSearch holds no mutable state and may be shared by concurrent workers.
 */
public final class NeighborSearch {
    private final DistanceModel model;
    private final ClassLabels labels;

    public NeighborSearch(DistanceModel model, ClassLabels labels) {
        if (model.size() != labels.size()) {
            throw new IllegalArgumentException(String.format("Dataset has %d instances but %d labels", model.size(), labels.size()));
        }
        this.model = model;
        this.labels = labels;
    }

    public DistanceModel model() {
        return model;
    }

    public ClassLabels labels() {
        return labels;
    }

    public int size() {
        return model.size();
    }

    /**
     * @param weights per-feature multipliers, or null for uniform weights
     * @return the distance from the query to every instance, including 0 to itself
     */
    public double[] distancesFrom(int query, double[] weights) {
        var distances = new double[model.size()];
        for (int j = 0; j < distances.length; j++) {
            distances[j] = j == query ? 0.0 : model.distance(query, j, weights);
        }
        return distances;
    }

    /**
     * @return the k instances nearest to the query, regardless of class
     * @throws InvalidNeighborCountException unless 1 &le; k &lt; N
     */
    public NeighborSet kNearest(int query, int k, double[] weights) {
        checkNeighborCount(k, model.size());
        var distances = distancesFrom(query, weights);
        var queue = NeighborQueue.keepNearest(k);
        for (int j = 0; j < distances.length; j++) {
            if (j != query) {
                queue.push(j, (float) distances[j]);
            }
        }
        return drainFarthestFirst(query, queue, distances);
    }

    /**
     * Finds up to k nearest neighbors in each class: the nearest hits from the query's own class and
     * the nearest misses from every other class.  Classes with fewer than k candidates contribute
     * all of them.
     *
     * @return the union, sorted by distance
     * @throws InvalidNeighborCountException unless 1 &le; k &lt; N
     */
    public NeighborSet kNearestPerClass(int query, int k, double[] weights) {
        checkNeighborCount(k, model.size());
        var distances = distancesFrom(query, weights);
        int queryClass = labels.classOf(query);

        var queues = new NeighborQueue[labels.numClasses()];
        for (int c = 0; c < queues.length; c++) {
            int candidates = labels.count(c) - (c == queryClass ? 1 : 0);
            if (candidates > 0) {
                queues[c] = NeighborQueue.keepNearest(Math.min(k, candidates));
            }
        }
        for (int j = 0; j < distances.length; j++) {
            if (j != query) {
                queues[labels.classOf(j)].push(j, (float) distances[j]);
            }
        }

        int total = 0;
        for (var queue : queues) {
            total += queue == null ? 0 : queue.size();
        }
        var merged = NeighborQueue.nearestFirst(total);
        for (var queue : queues) {
            while (queue != null && queue.size() > 0) {
                int node = queue.pop();
                merged.push(node, (float) distances[node]);
            }
        }
        return drainNearestFirst(query, merged, distances);
    }

    /**
     * @return every other instance, ranked by ascending distance to the query
     */
    public NeighborSet ranked(int query, double[] weights) {
        var distances = distancesFrom(query, weights);
        var queue = NeighborQueue.nearestFirst(distances.length - 1);
        for (int j = 0; j < distances.length; j++) {
            if (j != query) {
                queue.push(j, (float) distances[j]);
            }
        }
        return drainNearestFirst(query, queue, distances);
    }

    public static void checkNeighborCount(int k, int instances) {
        if (k < 1 || k >= instances) {
            throw new InvalidNeighborCountException(k, instances);
        }
    }

    private NeighborSet drainNearestFirst(int query, NeighborQueue queue, double[] distances) {
        var set = new NeighborSet(query, labels.classOf(query), queue.size());
        while (queue.size() > 0) {
            int node = queue.pop();
            set.addInOrder(node, distances[node], labels.classOf(node));
        }
        return set;
    }

    private NeighborSet drainFarthestFirst(int query, NeighborQueue queue, double[] distances) {
        var nodes = new int[queue.size()];
        for (int i = nodes.length - 1; i >= 0; i--) {
            nodes[i] = queue.pop();
        }
        var set = new NeighborSet(query, labels.classOf(query), nodes.length);
        for (int node : nodes) {
            set.addInOrder(node, distances[node], labels.classOf(node));
        }
        return set;
    }
}
