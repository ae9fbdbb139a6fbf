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

package io.github.jrelief.distance;

import io.github.jrelief.InvalidFeatureTypeException;
import io.github.jrelief.ReliefTestCase;
import io.github.jrelief.TestUtil;
import io.github.jrelief.data.Dataset;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestDistanceModel extends ReliefTestCase {
    private static final Dataset SMALL = Dataset.of(new double[][] {
            {0, 0, 1},
            {2, 0, 1},
            {1, 10, 3},
    });

    @Test
    public void testContinuousDiffIsRangeScaled() {
        var model = new DistanceModel(SMALL, FeatureType.CONTINUOUS);
        var diffs = model.diffs(0, 2, new double[3]);
        assertArrayEquals(new double[] {0.5, 1.0, 1.0}, diffs, 1e-12);
        assertEquals(2.5, model.distance(0, 2, null), 1e-12);
        assertEquals(1.0, model.distance(0, 1, null), 1e-12);
    }

    @Test
    public void testContinuousDiffAtExtremeValues() {
        // max - min of the first feature is not representable as a double
        var dataset = Dataset.of(new double[][] {{1e308, 0}, {-1e308, 1}, {0, 0.5}, {5, 0.2}});
        assertEquals(1e308, dataset.halfRange(0), 0.0);
        var model = new DistanceModel(dataset, FeatureType.CONTINUOUS);
        assertEquals(1.0, model.diff(0, 1, 0), 0.0);
        assertEquals(0.5, model.diff(0, 2, 0), 1e-12);
        assertEquals(0.5, model.diff(1, 2, 0), 1e-12);
        for (int a = 0; a < 4; a++) {
            for (int b = 0; b < 4; b++) {
                double d = model.distance(a, b, null);
                assertTrue(d >= 0 && d <= 2);
            }
        }
        assertEquals(1.0, FeatureType.CONTINUOUS.diff(Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE), 0.0);
    }

    @Test
    public void testDiscreteDiffIsIndicator() {
        var model = new DistanceModel(SMALL, FeatureType.DISCRETE);
        assertArrayEquals(new double[] {1, 0, 0}, model.diffs(0, 1, new double[3]), 0.0);
        assertArrayEquals(new double[] {1, 1, 1}, model.diffs(1, 2, new double[3]), 0.0);
        assertEquals(0.0, model.distance(0, 0, null), 0.0);
    }

    @Test
    public void testWeightedDistance() {
        var model = new DistanceModel(SMALL, FeatureType.DISCRETE);
        assertEquals(0.25, model.distance(0, 2, new double[] {0.25, 0, 0}), 1e-12);
        assertEquals(3.0, model.distance(0, 2, new double[] {1, 1, 1}), 1e-12);
    }

    @Test
    public void testDiffsStayInUnitInterval() {
        var random = random();
        var dataset = Dataset.of(TestUtil.randomContinuous(random, 50, 4));
        var model = new DistanceModel(dataset, FeatureType.CONTINUOUS);
        var out = new double[4];
        for (int trial = 0; trial < 200; trial++) {
            model.diffs(random.nextInt(50), random.nextInt(50), out);
            for (double d : out) {
                assertTrue(d >= 0 && d <= 1);
            }
        }
    }

    @Test
    public void testSymmetry() {
        var random = random();
        var dataset = Dataset.of(TestUtil.randomDiscrete(random, 30, 5, 3));
        var model = new DistanceModel(dataset, FeatureType.DISCRETE);
        for (int trial = 0; trial < 100; trial++) {
            int a = random.nextInt(30);
            int b = random.nextInt(30);
            assertEquals(model.distance(a, b, null), model.distance(b, a, null), 0.0);
        }
    }

    @Test
    public void testFeatureTypeTags() {
        assertSame(FeatureType.CONTINUOUS, FeatureType.fromTag("continuous"));
        assertSame(FeatureType.DISCRETE, FeatureType.fromTag("discrete"));
        var e = assertThrows(InvalidFeatureTypeException.class, () -> FeatureType.fromTag("something_else"));
        assertEquals("something_else", e.getTag());
        assertThrows(InvalidFeatureTypeException.class, () -> FeatureType.fromTag(null));
        assertThrows(InvalidFeatureTypeException.class, () -> FeatureType.fromTag("Continuous"));
        assertThrows(InvalidFeatureTypeException.class, () -> new DistanceModel(SMALL, null));
    }
}
