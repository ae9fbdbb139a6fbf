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

import java.util.Random;

import static org.junit.Assert.assertTrue;

public class TestUtil {
    /** min .. max inclusive on both ends */
    public static int nextInt(Random random, int min, int max) {
        return min + random.nextInt(1 + max - min);
    }

    /**
     * @return n x m values uniform in [0, 1)
     */
    public static double[][] randomContinuous(Random random, int n, int m) {
        var data = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                data[i][j] = random.nextDouble();
            }
        }
        return data;
    }

    /**
     * @return n x m values drawn uniformly from 0 .. levels - 1
     */
    public static double[][] randomDiscrete(Random random, int n, int m, int levels) {
        var data = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                data[i][j] = random.nextInt(levels);
            }
        }
        return data;
    }

    /**
     * @return 1 where feature a is greater than feature b, else 0
     */
    public static int[] greaterThan(double[][] data, int a, int b) {
        var target = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            target[i] = data[i][a] > data[i][b] ? 1 : 0;
        }
        return target;
    }

    /**
     * @return two distinct feature indexes a &lt; b out of m
     */
    public static int[] randomPair(Random random, int m) {
        int a = random.nextInt(m - 1);
        int b = nextInt(random, a + 1, m - 1);
        return new int[] {a, b};
    }

    /**
     * Asserts that features a and b each weigh at least as much as every other feature.
     */
    public static void assertDominant(double[] weights, int a, int b) {
        for (int j = 0; j < weights.length; j++) {
            if (j == a || j == b) {
                continue;
            }
            assertTrue(String.format("weights[%d]=%s < weights[%d]=%s", a, weights[a], j, weights[j]), weights[a] >= weights[j]);
            assertTrue(String.format("weights[%d]=%s < weights[%d]=%s", b, weights[b], j, weights[j]), weights[b] >= weights[j]);
        }
    }

    public static double[][] identicalRows(int n, double[] row) {
        var data = new double[n][];
        for (int i = 0; i < n; i++) {
            data[i] = row.clone();
        }
        return data;
    }
}
