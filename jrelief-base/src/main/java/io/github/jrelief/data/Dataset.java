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

package io.github.jrelief.data;

import io.github.jrelief.InvalidDatasetException;

import java.util.Arrays;

/**
 * An immutable, row-major matrix of instances by features.
 * <p>
 * Rows are copied on construction, so later changes to the caller's arrays are not observed.
 * The observed minimum and maximum of each feature are computed once; continuous differences are
 * scaled by the feature's range.
 */
public final class Dataset {
    private final double[][] rows;
    private final int dimension;
    private final double[] min;
    private final double[] max;

    private Dataset(double[][] rows, int dimension, double[] min, double[] max) {
        this.rows = rows;
        this.dimension = dimension;
        this.min = min;
        this.max = max;
    }

    /**
     * Validates and copies a sample matrix.
     *
     * @param data N rows of M features each, N &ge; 2 and M &ge; 1
     * @throws InvalidDatasetException if the matrix is null, too small, ragged, or holds a non-finite value
     */
    public static Dataset of(double[][] data) {
        if (data == null) {
            throw new InvalidDatasetException("Sample matrix must not be null");
        }
        if (data.length < 2) {
            throw new InvalidDatasetException("At least 2 instances are required, got " + data.length);
        }
        if (data[0] == null || data[0].length < 1) {
            throw new InvalidDatasetException("At least 1 feature is required");
        }

        int dimension = data[0].length;
        var rows = new double[data.length][];
        var min = new double[dimension];
        var max = new double[dimension];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);

        for (int i = 0; i < data.length; i++) {
            var row = data[i];
            if (row == null || row.length != dimension) {
                throw new InvalidDatasetException(String.format("Row %d has %s features, expected %d",
                                                                i, row == null ? "no" : String.valueOf(row.length), dimension));
            }
            for (int j = 0; j < dimension; j++) {
                double v = row[j];
                if (!Double.isFinite(v)) {
                    throw new InvalidDatasetException(String.format("Non-finite value %s at row %d, feature %d", v, i, j));
                }
                min[j] = Math.min(min[j], v);
                max[j] = Math.max(max[j], v);
            }
            rows[i] = row.clone();
        }
        return new Dataset(rows, dimension, min, max);
    }

    /** Return the number of instances */
    public int size() {
        return rows.length;
    }

    /** Return the number of features */
    public int dimension() {
        return dimension;
    }

    public double value(int instance, int feature) {
        return rows[instance][feature];
    }

    /**
     * @return a copy of the given instance's feature values
     */
    public double[] row(int instance) {
        return rows[instance].clone();
    }

    /**
     * Half of the observed max - min of the feature, which stays finite for any finite values.
     *
     * @return the half range, or 0.5 if every instance has the same value
     */
    public double halfRange(int feature) {
        double r = max[feature] / 2 - min[feature] / 2;
        return r > 0 ? r : 0.5;
    }

    @Override
    public String toString() {
        return String.format("Dataset(%d x %d)", rows.length, dimension);
    }
}
