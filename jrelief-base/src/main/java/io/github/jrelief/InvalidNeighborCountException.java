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

/**
 * Thrown when the neighbor count k is missing, not positive, or not smaller than the number of instances.
 */
public class InvalidNeighborCountException extends ReliefException {

    private final int k;
    private final int instances;

    /**
     * @param k the requested neighbor count
     * @param instances the number of instances in the dataset, or -1 if not yet known
     */
    public InvalidNeighborCountException(int k, int instances) {
        super(instances < 0
              ? "Neighbor count must be at least 1, got " + k
              : "Neighbor count must be in [1, " + (instances - 1) + "], got " + k);
        this.k = k;
        this.instances = instances;
    }

    public InvalidNeighborCountException(String message) {
        super(message);
        this.k = 0;
        this.instances = -1;
    }

    public int getK() {
        return k;
    }

    public int getInstances() {
        return instances;
    }
}
