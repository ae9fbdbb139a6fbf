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
import io.github.jrelief.util.PhysicalCoreExecutor;

import java.util.concurrent.ForkJoinPool;

/**
 * SURF*: {@link Surf} plus the instances farther than the mean pairwise distance, whose hit/miss
 * contributions count with the opposite sign.
 * <p>
 * Casey S. Greene, Daniel S. Himmelstein, Jeff Kiralis, and Jason H. Moore.
 * The informative extremes: Using both nearest and farthest individuals can improve Relief algorithms
 * in the domain of human genetics.  EvoBIO 2010, pages 182-193.
 */
public class SurfStar extends Surf {
    public SurfStar(FeatureType featureType) {
        this(featureType, PhysicalCoreExecutor.pool());
    }

    public SurfStar(FeatureType featureType, ForkJoinPool pool) {
        super(featureType, pool);
    }

    @Override
    protected boolean useFarNeighbors() {
        return true;
    }
}
