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
import io.github.jrelief.distance.DistanceModel;

/**
 * Weighted per-class means of the per-feature differences between a query and its neighbors.
 * <p>
 * The margin is the prior-weighted mean over the miss classes minus the mean over the hits.  Each mean
 * lies in [0, 1] and the miss class weights sum to at most 1, so every margin component lies in [-1, 1].
 * A class that received no neighbors (or only zero weights) contributes nothing.
 */
final class ClassDiffMeans {
    private final DistanceModel model;
    private final ClassLabels labels;
    private final double[][] sums;
    private final double[] weightSums;
    private final double[] scratch;

    ClassDiffMeans(DistanceModel model, ClassLabels labels) {
        this.model = model;
        this.labels = labels;
        this.sums = new double[labels.numClasses()][model.dimension()];
        this.weightSums = new double[labels.numClasses()];
        this.scratch = new double[model.dimension()];
    }

    void add(int query, int neighbor, int neighborClass, double weight) {
        if (weight == 0) {
            return;
        }
        model.diffs(query, neighbor, scratch);
        var sum = sums[neighborClass];
        for (int j = 0; j < scratch.length; j++) {
            sum[j] += weight * scratch[j];
        }
        weightSums[neighborClass] += weight;
    }

    /**
     * Adds {@code sign * (missMeans - hitMean)} into {@code out}.
     */
    void addMargin(int queryClass, double sign, double[] out) {
        for (int c = 0; c < sums.length; c++) {
            if (weightSums[c] == 0) {
                continue;
            }
            double scale = c == queryClass
                           ? -1.0 / weightSums[c]
                           : labels.missWeight(queryClass, c) / weightSums[c];
            scale *= sign;
            var sum = sums[c];
            for (int j = 0; j < out.length; j++) {
                out[j] += scale * sum[j];
            }
        }
    }
}
