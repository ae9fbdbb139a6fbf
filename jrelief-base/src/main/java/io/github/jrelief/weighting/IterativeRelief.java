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
import io.github.jrelief.data.ClassLabels;
import io.github.jrelief.data.Dataset;
import io.github.jrelief.distance.DistanceModel;
import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.neighbors.NeighborSearch;
import io.github.jrelief.util.MathUtil;
import io.github.jrelief.util.PhysicalCoreExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * Implements Iterative RELIEF (I-RELIEF) [1]: the weights estimated by one pass over the data become
 * the feature weights of the distance metric used by the next pass.
 * <p>
 * The state is the current weight vector, starting uniform with unit L2 norm.  One transition
 * ({@link #step}) does the following for every instance n:
 * <ul>
 *   <li>ranks all other instances under the current weighted metric;</li>
 *   <li>assigns each one the kernel weight {@code exp(-d / kernelWidth)};</li>
 *   <li>computes the kernel-weighted mean difference to the misses and to the hits, and discounts
 *   their difference by the probability that n is not an outlier (the kernel mass on hits).</li>
 * </ul>
 * The averaged margins, with negative components clipped to zero, are normalized to unit L2 norm to
 * give the next state.  The run stops when successive states are closer than the tolerance, or after
 * {@code maxIterations} transitions.
 * <p>
 * [1]
 * Yijun Sun and Jian Li
 * Iterative RELIEF for Feature Weighting, ICML 2006
 */
public class IterativeRelief implements FeatureWeighting {
    private static final Logger logger = LoggerFactory.getLogger(IterativeRelief.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final double DEFAULT_KERNEL_WIDTH = 1.0;

    private final FeatureType featureType;
    private final ForkJoinPool pool;

    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    private double tolerance = DEFAULT_TOLERANCE;
    private double kernelWidth = DEFAULT_KERNEL_WIDTH;

    /**
     * @throws io.github.jrelief.InvalidFeatureTypeException if featureType is null
     */
    public IterativeRelief(FeatureType featureType) {
        this(featureType, PhysicalCoreExecutor.pool());
    }

    public IterativeRelief(FeatureType featureType, ForkJoinPool pool) {
        this.featureType = FeatureType.requireValid(featureType);
        this.pool = pool;
    }

    /**
     * Sets the maximum number of passes over the data.
     */
    public IterativeRelief setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
        return this;
    }

    /**
     * Sets the tolerance of the stopping criterion: the L2 distance between the weight vectors of two
     * consecutive iterations.  Zero disables early stopping.
     */
    public IterativeRelief setTolerance(double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must be non-negative, got " + tolerance);
        }
        this.tolerance = tolerance;
        return this;
    }

    /**
     * Sets the width of the exponential kernel that turns weighted distances into neighbor influence.
     * Smaller widths concentrate the influence on the nearest instances.
     */
    public IterativeRelief setKernelWidth(double kernelWidth) {
        if (!(kernelWidth > 0) || Double.isInfinite(kernelWidth)) {
            throw new IllegalArgumentException("kernelWidth must be positive and finite, got " + kernelWidth);
        }
        this.kernelWidth = kernelWidth;
        return this;
    }

    public FeatureType getFeatureType() {
        return featureType;
    }

    @Override
    public double[] computeWeights(double[][] data, int[] target) {
        return run(data, target).weights;
    }

    public IterativeReliefResult run(double[][] data, int[] target) {
        var dataset = Dataset.of(data);
        return run(dataset, ClassLabels.of(target, dataset.size()));
    }

    public IterativeReliefResult run(Dataset dataset, ClassLabels labels) {
        var search = new NeighborSearch(new DistanceModel(dataset, featureType), labels);
        int dimension = dataset.dimension();

        var weights = new double[dimension];
        Arrays.fill(weights, 1.0 / Math.sqrt(dimension));
        List<double[]> history = new ArrayList<>();

        logger.debug("I-RELIEF over {}: featureType={}, maxIterations={}, tolerance={}, kernelWidth={}",
                     dataset, featureType.tag(), maxIterations, tolerance, kernelWidth);

        int iteration = 0;
        double change = Double.POSITIVE_INFINITY;
        boolean converged = false;
        while (iteration < maxIterations) {
            iteration++;
            var next = step(search, weights);
            change = MathUtil.l2Distance(next, weights);
            history.add(next.clone());
            weights = next;
            logger.debug("Iteration {}: change={}", iteration, change);

            if (MathUtil.l2Norm(weights) == 0) {
                logger.warn("No feature separates misses from hits after iteration {}; all weights are zero", iteration);
                converged = true;
                break;
            }
            if (change < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            logger.warn("I-RELIEF did not converge within {} iterations (last change {})", maxIterations, change);
        }
        return new IterativeReliefResult(weights, iteration, converged, change, history);
    }

    /**
     * One transition of the refinement loop: the normalized, clipped mean margin under {@code weights}.
     *
     * @return the next weight vector; all zeros if no feature has a positive mean margin
     */
    @VisibleForTesting
    double[] step(NeighborSearch search, double[] weights) {
        var margins = InstanceFold.sum(pool, InstanceFold.allInstances(search.size()), weights.length,
                                       new MarginPolicy(search, weights, kernelWidth));
        for (int j = 0; j < margins.length; j++) {
            margins[j] = Math.max(0.0, margins[j] / search.size());
        }
        double norm = MathUtil.l2Norm(margins);
        if (norm > 0) {
            MathUtil.scale(margins, 1.0 / norm);
        }
        return margins;
    }

    /**
     * The outlier-discounted, kernel-weighted miss-minus-hit margin of one instance.
     */
    static final class MarginPolicy implements WeightUpdatePolicy {
        private final NeighborSearch search;
        private final double[] weights;
        private final double kernelWidth;

        MarginPolicy(NeighborSearch search, double[] weights, double kernelWidth) {
            this.search = search;
            this.weights = weights;
            this.kernelWidth = kernelWidth;
        }

        @Override
        public void delta(int query, double[] delta) {
            var neighbors = search.ranked(query, weights);
            var model = search.model();
            int m = delta.length;
            var hitSum = new double[m];
            var missSum = new double[m];
            var diffs = new double[m];
            double hitMass = 0;
            double missMass = 0;

            // shifting by the nearest distance leaves every ratio unchanged and keeps exp() from underflowing
            double nearest = neighbors.size() > 0 ? neighbors.distance(0) : 0;
            for (int i = 0; i < neighbors.size(); i++) {
                double f = Math.exp(-(neighbors.distance(i) - nearest) / kernelWidth);
                if (f == 0) {
                    continue;
                }
                model.diffs(query, neighbors.node(i), diffs);
                var sum = neighbors.isHit(i) ? hitSum : missSum;
                for (int j = 0; j < m; j++) {
                    sum[j] += f * diffs[j];
                }
                if (neighbors.isHit(i)) {
                    hitMass += f;
                } else {
                    missMass += f;
                }
            }

            if (missMass == 0) {
                // no misses in reach: a margin cannot be measured for this instance
                return;
            }
            double inlier = hitMass / (hitMass + missMass);
            for (int j = 0; j < m; j++) {
                double hitMean = hitMass > 0 ? hitSum[j] / hitMass : 0.0;
                delta[j] = inlier * (missSum[j] / missMass - hitMean);
            }
        }
    }
}
