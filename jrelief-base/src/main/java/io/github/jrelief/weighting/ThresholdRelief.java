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

import io.github.jrelief.data.ClassLabels;
import io.github.jrelief.data.Dataset;
import io.github.jrelief.distance.DistanceModel;
import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.neighbors.NeighborSearch;
import io.github.jrelief.neighbors.NeighborSet;
import io.github.jrelief.util.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ForkJoinPool;

/**
 * Base class for the Relief variants that pick neighbors by a distance threshold instead of a fixed count
 * (SURF, SURF*, MultiSURF).
 * <p>
 * For each instance, the neighbors strictly closer than the instance's threshold are "near"; their hit and
 * miss means form a margin exactly as in ReliefF.  Variants that also use far neighbors (strictly beyond the
 * threshold) subtract the far margin, since instances that are far apart yet share a class indicate a
 * relevant feature just as near misses do.
 */
public abstract class ThresholdRelief implements FeatureWeighting {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdRelief.class);

    /**
     * Computes the distance threshold of one query from its full neighbor ranking.
     */
    @FunctionalInterface
    protected interface Threshold {
        double of(NeighborSet ranked);
    }

    protected final FeatureType featureType;
    protected final ForkJoinPool pool;

    protected ThresholdRelief(FeatureType featureType, ForkJoinPool pool) {
        this.featureType = FeatureType.requireValid(featureType);
        this.pool = pool;
    }

    /**
     * Called once per run, before any instance is processed.
     */
    protected abstract Threshold prepare(NeighborSearch search);

    protected boolean useFarNeighbors() {
        return false;
    }

    public FeatureType getFeatureType() {
        return featureType;
    }

    @Override
    public double[] computeWeights(double[][] data, int[] target) {
        var dataset = Dataset.of(data);
        return computeWeights(dataset, ClassLabels.of(target, dataset.size()));
    }

    public double[] computeWeights(Dataset dataset, ClassLabels labels) {
        var search = new NeighborSearch(new DistanceModel(dataset, featureType), labels);
        var threshold = prepare(search);
        boolean far = useFarNeighbors();
        logger.debug("{} over {}: featureType={}, far neighbors={}", getClass().getSimpleName(), dataset, featureType.tag(), far);

        WeightUpdatePolicy policy = (query, delta) -> {
            var ranked = search.ranked(query, null);
            double t = threshold.of(ranked);
            var near = new ClassDiffMeans(search.model(), labels);
            var beyond = far ? new ClassDiffMeans(search.model(), labels) : null;
            for (int i = 0; i < ranked.size(); i++) {
                double d = ranked.distance(i);
                if (d < t) {
                    near.add(query, ranked.node(i), ranked.classOf(i), 1.0);
                } else if (beyond != null && d > t) {
                    beyond.add(query, ranked.node(i), ranked.classOf(i), 1.0);
                }
            }
            near.addMargin(ranked.queryClass(), 1.0, delta);
            if (beyond != null) {
                beyond.addMargin(ranked.queryClass(), -1.0, delta);
            }
        };

        int n = dataset.size();
        var weights = InstanceFold.sum(pool, InstanceFold.allInstances(n), dataset.dimension(), policy);
        MathUtil.scale(weights, 1.0 / n);
        return weights;
    }

    /**
     * @return the mean distance over all ordered pairs of distinct instances
     */
    static double meanPairwiseDistance(ForkJoinPool pool, NeighborSearch search) {
        int n = search.size();
        // each instance's distance sum is its one-feature "delta"
        var total = InstanceFold.sum(pool, InstanceFold.allInstances(n), 1, (query, delta) -> {
            double sum = 0;
            for (double d : search.distancesFrom(query, null)) {
                sum += d;
            }
            delta[0] = sum;
        });
        return total[0] / ((double) n * (n - 1));
    }
}
