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
 * MultiSURF: each instance gets its own threshold, the mean of its distances to all other instances
 * minus half their standard deviation.  Only the near neighbors are used.
 * <p>
 * Ryan Urbanowicz, Randal Olson, Peter Schmitt, Melissa Meeker, and Jason Moore.
 * Benchmarking Relief-based feature selection methods for bioinformatics data mining.
 * Journal of Biomedical Informatics, 85, 2018.
 */
public class MultiSurf extends ThresholdRelief {
    public MultiSurf(FeatureType featureType) {
        this(featureType, PhysicalCoreExecutor.pool());
    }

    public MultiSurf(FeatureType featureType, ForkJoinPool pool) {
        super(featureType, pool);
    }

    @Override
    protected Threshold prepare(NeighborSearch search) {
        return ranked -> {
            int n = ranked.size();
            double sum = 0;
            for (int i = 0; i < n; i++) {
                sum += ranked.distance(i);
            }
            double mean = sum / n;
            double squares = 0;
            for (int i = 0; i < n; i++) {
                double d = ranked.distance(i) - mean;
                squares += d * d;
            }
            return mean - Math.sqrt(squares / n) / 2;
        };
    }
}
