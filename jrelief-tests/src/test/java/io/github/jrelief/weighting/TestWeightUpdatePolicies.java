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
import io.github.jrelief.ReliefTestCase;
import io.github.jrelief.data.ClassLabels;
import io.github.jrelief.data.Dataset;
import io.github.jrelief.distance.DistanceModel;
import io.github.jrelief.distance.FeatureType;
import io.github.jrelief.neighbors.NeighborSearch;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestWeightUpdatePolicies extends ReliefTestCase {
    // four points on a line, range 3; the left pair is class 0 and the right pair class 1
    private static NeighborSearch lineSearch() {
        var dataset = Dataset.of(new double[][] {{0}, {1}, {2}, {3}});
        return new NeighborSearch(new DistanceModel(dataset, FeatureType.CONTINUOUS), ClassLabels.of(new int[] {0, 0, 1, 1}, 4));
    }

    private static double delta(WeightUpdatePolicy policy, int query) {
        var delta = new double[1];
        policy.delta(query, delta);
        return delta[0];
    }

    @Test
    public void testKNearest() {
        var policy = new KNearestPolicy(lineSearch(), 1);
        // nearest hit is 1/3 away; nearest miss 2/3
        assertEquals(1.0 / 3, delta(policy, 0), 1e-12);
        assertEquals(0.0, delta(policy, 1), 1e-12);
        assertEquals(0.0, delta(policy, 2), 1e-12);
        assertEquals(1.0 / 3, delta(policy, 3), 1e-12);
    }

    @Test
    public void testKNearestAveragesOverK() {
        var policy = new KNearestPolicy(lineSearch(), 2);
        // one hit available (1/3), both misses averaged: (2/3 + 1) / 2
        assertEquals(5.0 / 6 - 1.0 / 3, delta(policy, 0), 1e-12);
    }

    @Test
    public void testKNearestRejectsInvalidK() {
        assertThrows(InvalidNeighborCountException.class, () -> new KNearestPolicy(lineSearch(), 0));
        assertThrows(InvalidNeighborCountException.class, () -> new KNearestPolicy(lineSearch(), 4));
    }

    @Test
    public void testDiff() {
        var policy = new DiffPolicy(lineSearch());
        assertEquals(5.0 / 6 - 1.0 / 3, delta(policy, 0), 1e-12);
        assertEquals(1.0 / 2 - 1.0 / 3, delta(policy, 1), 1e-12);
        assertEquals(1.0 / 2 - 1.0 / 3, delta(policy, 2), 1e-12);
        assertEquals(5.0 / 6 - 1.0 / 3, delta(policy, 3), 1e-12);
    }

    @Test
    public void testExpRankInterpolatesBetweenNearestAndDiff() {
        var search = lineSearch();
        var sharp = new ExpRankPolicy(search, 0.25);
        var flat = new ExpRankPolicy(search, 1e6);
        var nearest = new KNearestPolicy(search, 1);
        var diff = new DiffPolicy(search);
        for (int query = 0; query < 4; query++) {
            assertEquals(delta(nearest, query), delta(sharp, query), 1e-6);
            assertEquals(delta(diff, query), delta(flat, query), 1e-9);
        }
    }

    @Test
    public void testExpRankKernel() {
        var policy = new ExpRankPolicy(lineSearch(), 2.0);
        assertEquals(Math.exp(-0.25), policy.rankWeight(1), 1e-12);
        assertEquals(Math.exp(-1), policy.rankWeight(2), 1e-12);
        assertTrue(policy.rankWeight(3) < policy.rankWeight(2));
        assertThrows(IllegalArgumentException.class, () -> new ExpRankPolicy(lineSearch(), 0));
        assertThrows(IllegalArgumentException.class, () -> new ExpRankPolicy(lineSearch(), Double.NaN));
    }

    @Test
    public void testMissesAreWeightedByClassPrior() {
        // query 0 (class 0) has one hit at 0, a class-1 miss at 1 and two class-2 misses at 1 and 0
        var dataset = Dataset.of(new double[][] {{0}, {0}, {1}, {1}, {0}});
        var labels = ClassLabels.of(new int[] {0, 0, 1, 2, 2}, 5);
        var policy = new DiffPolicy(new NeighborSearch(new DistanceModel(dataset, FeatureType.DISCRETE), labels));
        // class 1 carries 1/3 of the miss weight with mean diff 1; class 2 carries 2/3 with mean diff 1/2
        assertEquals(1.0 / 3 * 1 + 2.0 / 3 * 0.5 - 0, delta(policy, 0), 1e-12);
    }
}
