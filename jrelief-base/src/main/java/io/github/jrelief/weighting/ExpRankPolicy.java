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

import io.github.jrelief.annotations.VisibleForTesting;
import io.github.jrelief.neighbors.NeighborSearch;

import static io.github.jrelief.util.MathUtil.square;

/**
 * Rank-decayed update: every other instance contributes, weighted by {@code exp(-(rank / sigma)^2)}.
 * Ranks start at 1 and are counted separately among the hits and among the misses of each class,
 * so the nearest hit and the nearest miss of every class carry the same weight.
 * <p>
 * Small sigma approaches {@link KNearestPolicy} with a hard cutoff; large sigma approaches {@link DiffPolicy}.
 */
public class ExpRankPolicy implements WeightUpdatePolicy {
    private final NeighborSearch search;
    private final double[] kernel;

    public ExpRankPolicy(NeighborSearch search, double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be positive and finite, got " + sigma);
        }
        this.search = search;
        // kernel[r - 1] is the weight of rank r; no class can hold more than N - 1 neighbors
        this.kernel = new double[Math.max(1, search.size() - 1)];
        for (int r = 1; r <= kernel.length; r++) {
            kernel[r - 1] = Math.exp(-square(r / sigma));
        }
    }

    @VisibleForTesting
    double rankWeight(int rank) {
        return kernel[rank - 1];
    }

    @Override
    public void delta(int query, double[] delta) {
        var neighbors = search.ranked(query, null);
        var means = new ClassDiffMeans(search.model(), search.labels());
        var ranks = new int[search.labels().numClasses()];
        for (int i = 0; i < neighbors.size(); i++) {
            int c = neighbors.classOf(i);
            means.add(query, neighbors.node(i), c, kernel[ranks[c]++]);
        }
        means.addMargin(neighbors.queryClass(), 1.0, delta);
    }
}
