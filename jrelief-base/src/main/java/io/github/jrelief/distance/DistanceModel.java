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

package io.github.jrelief.distance;

import io.github.jrelief.data.Dataset;

/**
 * Computes per-feature differences and aggregate distances between instances of one dataset.
 * <p>
 * The aggregate distance is the sum of the per-feature differences, optionally multiplied
 * element-wise by a feature weight vector.  A null weight vector means uniform weights.
 * <p>
 * Instances are read-only, so a DistanceModel may be shared across threads.
 */
public final class DistanceModel {
    private final Dataset dataset;
    private final FeatureType featureType;
    private final double[] halfRanges;

    public DistanceModel(Dataset dataset, FeatureType featureType) {
        this.dataset = dataset;
        this.featureType = FeatureType.requireValid(featureType);
        this.halfRanges = new double[dataset.dimension()];
        for (int j = 0; j < halfRanges.length; j++) {
            halfRanges[j] = dataset.halfRange(j);
        }
    }

    public Dataset dataset() {
        return dataset;
    }

    public FeatureType featureType() {
        return featureType;
    }

    public int size() {
        return dataset.size();
    }

    public int dimension() {
        return halfRanges.length;
    }

    /**
     * @return the difference between instances a and b on one feature, in [0, 1]
     */
    public double diff(int a, int b, int feature) {
        return featureType.diff(dataset.value(a, feature), dataset.value(b, feature), halfRanges[feature]);
    }

    /**
     * Writes the M per-feature differences between instances a and b into {@code out}.
     *
     * @return out
     */
    public double[] diffs(int a, int b, double[] out) {
        for (int j = 0; j < halfRanges.length; j++) {
            out[j] = diff(a, b, j);
        }
        return out;
    }

    /**
     * @param weights per-feature multipliers, or null for uniform weights
     * @return the (weighted) sum of per-feature differences between instances a and b
     */
    public double distance(int a, int b, double[] weights) {
        double sum = 0;
        if (weights == null) {
            for (int j = 0; j < halfRanges.length; j++) {
                sum += diff(a, b, j);
            }
        } else {
            for (int j = 0; j < halfRanges.length; j++) {
                sum += weights[j] * diff(a, b, j);
            }
        }
        return sum;
    }
}
