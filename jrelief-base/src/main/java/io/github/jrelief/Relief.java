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

package io.github.jrelief;

import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.weighting.IterativeRelief;
import io.github.jrelief.weighting.ReliefF;
import io.github.jrelief.weighting.UpdateMode;

/**
 * Entry points that take the configuration as string tags.
 * <p>
 * Tags are parsed before the data is looked at, so a bad feature type or mode is reported even when the
 * sample matrix is empty or null.  Parsing order is feature type, then mode, then neighbor count.
 */
public final class Relief {
    public static final String DEFAULT_MODE = UpdateMode.K_NEAREST.tag();

    private Relief() {
    }

    /**
     * ReliefF with the default mode ({@code "k_nearest"}) and neighbor count.
     */
    public static double[] relieff(double[][] data, int[] target, String fType) {
        return relieff(data, target, DEFAULT_MODE, fType, null);
    }

    /**
     * @param mode {@code "k_nearest"}, {@code "diff"} or {@code "exp_rank"}
     * @param fType {@code "continuous"} or {@code "discrete"}
     * @param k neighbor count for {@code "k_nearest"}, ignored by the other modes; null selects
     *          {@value ReliefF#DEFAULT_K}, capped to N - 1
     * @return one weight per feature
     * @throws InvalidFeatureTypeException if fType is not recognized
     * @throws InvalidModeException if mode is not recognized
     * @throws InvalidNeighborCountException in {@code "k_nearest"} mode, if k is not positive or not smaller
     *         than the number of instances
     * @throws InvalidDatasetException if the data or target do not have a usable shape
     */
    public static double[] relieff(double[][] data, int[] target, String mode, String fType, Integer k) {
        var featureType = FeatureType.fromTag(fType);
        var updateMode = UpdateMode.fromTag(mode);
        var relieff = new ReliefF(updateMode, featureType);
        if (k != null && updateMode == UpdateMode.K_NEAREST) {
            relieff.setK(k);
        }
        return relieff.computeWeights(data, target);
    }

    /**
     * Iterative RELIEF with the default iteration cap.
     */
    public static double[] iterativeRelief(double[][] data, int[] target, String fType) {
        return iterativeRelief(data, target, fType, null);
    }

    /**
     * @param fType {@code "continuous"} or {@code "discrete"}
     * @param iterations maximum number of passes; null selects {@value IterativeRelief#DEFAULT_MAX_ITERATIONS}
     * @return one weight per feature, with unit L2 norm unless every weight is zero
     * @throws InvalidFeatureTypeException if fType is not recognized
     */
    public static double[] iterativeRelief(double[][] data, int[] target, String fType, Integer iterations) {
        var featureType = FeatureType.fromTag(fType);
        var iterative = new IterativeRelief(featureType);
        if (iterations != null) {
            iterative.setMaxIterations(iterations);
        }
        return iterative.computeWeights(data, target);
    }
}
