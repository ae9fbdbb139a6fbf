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

import io.github.jrelief.InvalidNeighborCountException;
import io.github.jrelief.data.ClassLabels;
import io.github.jrelief.data.Dataset;
import io.github.jrelief.distance.DistanceModel;
import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.neighbors.NeighborSearch;
import io.github.jrelief.util.MathUtil;
import io.github.jrelief.util.PhysicalCoreExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ForkJoinPool;

/**
 * ReliefF feature weighting.
 * <p>
 * For every processed instance, finds its neighbors under the unweighted metric, splits them into hits
 * (same class) and misses (other classes), and turns them into a per-feature delta with the
 * {@link WeightUpdatePolicy} selected by the {@link UpdateMode}.  The deltas are summed and divided by
 * the number of processed instances, so each weight lies in [-1, 1]: positive for features whose values
 * differ more between classes than within them.
 * <p>
 * A ReliefF instance can be reused; every call to {@link #computeWeights} returns a fresh vector and
 * shares no mutable state with other calls.
 */
public class ReliefF implements FeatureWeighting {
    private static final Logger logger = LoggerFactory.getLogger(ReliefF.class);

    public static final int DEFAULT_K = 10;
    public static final double DEFAULT_SIGMA = 10.0;
    public static final long DEFAULT_SEED = 0x5EED;

    private final UpdateMode mode;
    private final FeatureType featureType;
    private final ForkJoinPool pool;

    // 0 means "not set": use DEFAULT_K, capped to fit small datasets
    private int k = 0;
    private double sigma = DEFAULT_SIGMA;
    // 0 means every instance, in order
    private int sampleSize = 0;
    private long seed = DEFAULT_SEED;

    /**
     * @throws io.github.jrelief.InvalidFeatureTypeException if featureType is null
     * @throws io.github.jrelief.InvalidModeException if mode is null
     */
    public ReliefF(UpdateMode mode, FeatureType featureType) {
        this(mode, featureType, PhysicalCoreExecutor.pool());
    }

    /**
     * @param pool ForkJoinPool used to process instances in parallel
     */
    public ReliefF(UpdateMode mode, FeatureType featureType, ForkJoinPool pool) {
        this.featureType = FeatureType.requireValid(featureType);
        this.mode = UpdateMode.requireValid(mode);
        this.pool = pool;
    }

    /**
     * Sets the number of nearest hits, and of nearest misses per class, used by {@link UpdateMode#K_NEAREST}.
     * Must also be smaller than the number of instances, which is checked when weights are computed.
     * Other modes ignore it.
     *
     * @throws InvalidNeighborCountException if k &lt; 1
     */
    public ReliefF setK(int k) {
        if (k < 1) {
            throw new InvalidNeighborCountException(k, -1);
        }
        this.k = k;
        return this;
    }

    /**
     * Sets the rank decay constant used by {@link UpdateMode#EXP_RANK}.  Defaults to {@value #DEFAULT_SIGMA}.
     */
    public ReliefF setSigma(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be positive and finite, got " + sigma);
        }
        this.sigma = sigma;
        return this;
    }

    /**
     * Processes {@code sampleSize} instances drawn uniformly with replacement instead of every instance.
     * Use zero to process every instance exactly once.
     */
    public ReliefF setSampleSize(int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be non-negative, got " + sampleSize);
        }
        this.sampleSize = sampleSize;
        return this;
    }

    /**
     * Seeds the instance sampler.  Only meaningful with a non-zero sample size.
     */
    public ReliefF setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public UpdateMode getMode() {
        return mode;
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
        int n = dataset.size();
        var search = new NeighborSearch(new DistanceModel(dataset, featureType), labels);
        // k only applies to K_NEAREST and is not checked for the other modes
        int resolvedK = mode == UpdateMode.K_NEAREST ? resolveK(n) : 0;
        WeightUpdatePolicy policy = switch (mode) {
            case K_NEAREST -> new KNearestPolicy(search, resolvedK);
            case DIFF -> new DiffPolicy(search);
            case EXP_RANK -> new ExpRankPolicy(search, sigma);
        };
        String parameters = switch (mode) {
            case K_NEAREST -> "k=" + resolvedK;
            case DIFF -> "every neighbor";
            case EXP_RANK -> "sigma=" + sigma;
        };

        var instances = sampleSize == 0 ? InstanceFold.allInstances(n) : sample(n);
        logger.debug("ReliefF over {} with {} classes: mode={} ({}), featureType={}, processing {} instances",
                     dataset, labels.numClasses(), mode.tag(), parameters, featureType.tag(), instances.length);

        var weights = InstanceFold.sum(pool, instances, dataset.dimension(), policy);
        MathUtil.scale(weights, 1.0 / instances.length);
        return weights;
    }

    private int resolveK(int n) {
        if (k == 0) {
            return Math.min(DEFAULT_K, n - 1);
        }
        NeighborSearch.checkNeighborCount(k, n);
        return k;
    }

    private int[] sample(int n) {
        var random = new Random(seed);
        var instances = new int[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            instances[i] = random.nextInt(n);
        }
        return instances;
    }
}
