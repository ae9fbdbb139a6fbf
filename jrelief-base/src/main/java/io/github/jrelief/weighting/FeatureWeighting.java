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

/**
 * An algorithm that scores each feature of a labeled dataset by relevance; higher is more discriminative.
 */
public interface FeatureWeighting {
    /**
     * @param data N instances by M features
     * @param target one class label per instance
     * @return M feature weights
     */
    double[] computeWeights(double[][] data, int[] target);
}
