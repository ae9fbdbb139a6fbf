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

package io.github.jrelief.selection;

import io.github.jrelief.InvalidDatasetException;
import io.github.jrelief.weighting.FeatureWeighting;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Ranks features with a {@link FeatureWeighting} and keeps the best ones.
 * <p>
 * {@link #fit} computes the weights and an ordinal rank per feature (1 = highest weight; equal weights
 * rank by column index).  {@link #transform} then keeps the columns ranked within
 * {@code nFeaturesToSelect}, in their original order.
 */
public class FeatureSelector {
    private final FeatureWeighting weighting;
    private final int nFeaturesToSelect;

    private double[] weights;
    private int[] rank;

    public FeatureSelector(FeatureWeighting weighting, int nFeaturesToSelect) {
        if (nFeaturesToSelect < 1) {
            throw new IllegalArgumentException("nFeaturesToSelect must be positive, got " + nFeaturesToSelect);
        }
        this.weighting = weighting;
        this.nFeaturesToSelect = nFeaturesToSelect;
    }

    /**
     * @return this, for chaining into {@link #transform}
     */
    public FeatureSelector fit(double[][] data, int[] target) {
        var w = weighting.computeWeights(data, target);
        var order = IntStream.range(0, w.length)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(j -> -w[j]).thenComparingInt(j -> j))
                .mapToInt(Integer::intValue)
                .toArray();
        var r = new int[w.length];
        for (int position = 0; position < order.length; position++) {
            r[order[position]] = position + 1;
        }
        this.weights = w;
        this.rank = r;
        return this;
    }

    /**
     * @return the columns of {@code data} ranked within {@code nFeaturesToSelect}, in their original order
     * @throws IllegalStateException if {@link #fit} has not been called
     * @throws InvalidDatasetException if a row does not have the number of features seen by fit
     */
    public double[][] transform(double[][] data) {
        checkFitted();
        var selected = IntStream.range(0, rank.length).filter(j -> rank[j] <= nFeaturesToSelect).toArray();
        var result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null || data[i].length != rank.length) {
                throw new InvalidDatasetException(String.format("Row %d does not have the %d features seen by fit", i, rank.length));
            }
            var row = new double[selected.length];
            for (int s = 0; s < selected.length; s++) {
                row[s] = data[i][selected[s]];
            }
            result[i] = row;
        }
        return result;
    }

    public double[][] fitTransform(double[][] data, int[] target) {
        return fit(data, target).transform(data);
    }

    public double[] getWeights() {
        checkFitted();
        return weights.clone();
    }

    /**
     * @return the 1-based rank of each feature
     */
    public int[] getRank() {
        checkFitted();
        return rank.clone();
    }

    public int getNFeaturesToSelect() {
        return nFeaturesToSelect;
    }

    private void checkFitted() {
        if (rank == null) {
            throw new IllegalStateException("FeatureSelector has not been fitted");
        }
    }

    @Override
    public String toString() {
        return String.format("FeatureSelector(%s, n=%d, rank=%s)", weighting.getClass().getSimpleName(), nFeaturesToSelect,
                             rank == null ? "unfitted" : Arrays.toString(rank));
    }
}
