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

import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.neighbors.NeighborSearch;
import io.github.jrelief.util.PhysicalCoreExecutor;

import java.util.concurrent.ForkJoinPool;

/**
 * SURF: every instance closer than the mean pairwise distance of the dataset is a neighbor.
 * <p>
 * Casey S. Greene, Nadia M. Penrod, Jeff Kiralis, and Jason H. Moore.
 * Spatially uniform ReliefF (SURF) for computationally-efficient filtering of gene-gene interactions.
 * BioData Mining, 2(1):5, 2009.
 */
public class Surf extends ThresholdRelief {
    public Surf(FeatureType featureType) {
        this(featureType, PhysicalCoreExecutor.pool());
    }

    public Surf(FeatureType featureType, ForkJoinPool pool) {
        super(featureType, pool);
    }

    @Override
    protected Threshold prepare(NeighborSearch search) {
        double mean = meanPairwiseDistance(pool, search);
        return ranked -> mean;
    }
}
