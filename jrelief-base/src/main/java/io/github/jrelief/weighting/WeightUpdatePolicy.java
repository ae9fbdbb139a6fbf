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
 * Converts the neighbors of one instance into that instance's contribution to the weight vector.
 * <p>
 * Implementations must be safe to call concurrently for different instances: the engines evaluate
 * instances in parallel and fold the deltas afterwards.
 */
@FunctionalInterface
public interface WeightUpdatePolicy {
    /**
     * @param query the instance being processed
     * @param delta receives the instance's M-feature contribution; arrives zeroed
     */
    void delta(int query, double[] delta);
}
