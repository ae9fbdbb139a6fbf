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
import org.agrona.collections.Int2IntHashMap;

import java.util.Arrays;

/**
 * Maps arbitrary integer class labels onto dense class indexes 0..C-1, ordered by ascending label,
 * and keeps per-class counts and priors.
 * <p>
 * The hit/miss split of every Relief variant is expressed in terms of class indexes:
 * a neighbor is a hit when its class index equals the query's.
 */
public final class ClassLabels {
    private final int[] classOf;
    private final int[] labels;
    private final int[] counts;

    private ClassLabels(int[] classOf, int[] labels, int[] counts) {
        this.classOf = classOf;
        this.labels = labels;
        this.counts = counts;
    }

    /**
     * @param target one label per instance
     * @param instances the number of rows the target must align with
     * @throws InvalidDatasetException if the target is null or its length differs from {@code instances}
     */
    public static ClassLabels of(int[] target, int instances) {
        if (target == null) {
            throw new InvalidDatasetException("Target vector must not be null");
        }
        if (target.length != instances) {
            throw new InvalidDatasetException(String.format("Target has %d labels but the sample matrix has %d rows",
                                                            target.length, instances));
        }

        int[] labels = Arrays.stream(target).distinct().sorted().toArray();
        var indexOf = new Int2IntHashMap(-1);
        for (int c = 0; c < labels.length; c++) {
            indexOf.put(labels[c], c);
        }

        var classOf = new int[target.length];
        var counts = new int[labels.length];
        for (int i = 0; i < target.length; i++) {
            int c = indexOf.get(target[i]);
            classOf[i] = c;
            counts[c]++;
        }
        return new ClassLabels(classOf, labels, counts);
    }

    public int size() {
        return classOf.length;
    }

    public int numClasses() {
        return labels.length;
    }

    /**
     * @return the dense class index of the instance
     */
    public int classOf(int instance) {
        return classOf[instance];
    }

    /**
     * @return the original label for a class index
     */
    public int label(int classIndex) {
        return labels[classIndex];
    }

    public int count(int classIndex) {
        return counts[classIndex];
    }

    public double prior(int classIndex) {
        return (double) counts[classIndex] / classOf.length;
    }

    /**
     * Weight given to misses from {@code otherClass} when the query belongs to {@code queryClass}:
     * the prior of the other class, renormalized over all classes except the query's.
     * The weights over all other classes sum to 1.
     */
    public double missWeight(int queryClass, int otherClass) {
        double rest = 1.0 - prior(queryClass);
        return rest > 0 ? prior(otherClass) / rest : 0.0;
    }
}
