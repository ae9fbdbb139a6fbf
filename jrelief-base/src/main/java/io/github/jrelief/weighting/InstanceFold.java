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

import io.github.jrelief.util.MathUtil;

import java.util.Arrays;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import static java.lang.Math.min;

/**
 * Sums per-instance weight deltas.
 * <p>
 * Deltas are computed in parallel, one batch at a time, and then added into the running total in
 * instance order, so the result is bit-identical regardless of pool size or scheduling.
 */
final class InstanceFold {
    static final int BATCH_SIZE = 1024;

    private InstanceFold() {
    }

    /**
     * @param instances the instances to process, in fold order; may repeat
     * @return the element-wise sum of every instance's delta
     */
    static double[] sum(ForkJoinPool pool, int[] instances, int dimension, WeightUpdatePolicy policy) {
        var total = new double[dimension];
        var deltas = new double[min(BATCH_SIZE, instances.length)][dimension];

        for (int batch = 0; batch < instances.length; batch += BATCH_SIZE) {
            var lower = batch;
            var upper = min(instances.length, batch + BATCH_SIZE);
            pool.submit(() -> {
                IntStream.range(lower, upper).parallel().forEach(i -> {
                    var delta = deltas[i - lower];
                    Arrays.fill(delta, 0.0);
                    policy.delta(instances[i], delta);
                });
            }).join();

            for (int i = lower; i < upper; i++) {
                MathUtil.addInPlace(total, deltas[i - lower]);
            }
        }
        return total;
    }

    static int[] allInstances(int n) {
        return IntStream.range(0, n).toArray();
    }
}
