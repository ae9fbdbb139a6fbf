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

package io.github.jrelief.weighting;

import io.github.jrelief.neighbors.NeighborSearch;

/**
 * Classic ReliefF update: the mean difference to the k nearest misses of each other class (weighted by
 * class prior) minus the mean difference to the k nearest hits.
 */
public class KNearestPolicy implements WeightUpdatePolicy {
    private final NeighborSearch search;
    private final int k;

    public KNearestPolicy(NeighborSearch search, int k) {
        NeighborSearch.checkNeighborCount(k, search.size());
        this.search = search;
        this.k = k;
    }

    @Override
    public void delta(int query, double[] delta) {
        var neighbors = search.kNearestPerClass(query, k, null);
        var means = new ClassDiffMeans(search.model(), search.labels());
        for (int i = 0; i < neighbors.size(); i++) {
            means.add(query, neighbors.node(i), neighbors.classOf(i), 1.0);
        }
        means.addMargin(neighbors.queryClass(), 1.0, delta);
    }
}
