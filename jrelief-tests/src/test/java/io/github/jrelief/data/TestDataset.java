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
import io.github.jrelief.ReliefTestCase;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestDataset extends ReliefTestCase {
    @Test
    public void testShapeAndRanges() {
        var dataset = Dataset.of(new double[][] {{1, 5, 2}, {3, 5, -2}, {2, 5, 0}});
        assertEquals(3, dataset.size());
        assertEquals(3, dataset.dimension());
        assertEquals(1.0, dataset.halfRange(0), 0.0);
        // a constant feature has a degenerate range, reported as a half range of 0.5
        assertEquals(0.5, dataset.halfRange(1), 0.0);
        assertEquals(2.0, dataset.halfRange(2), 0.0);
        assertEquals(-2.0, dataset.value(1, 2), 0.0);
    }

    @Test
    public void testRowsAreCopied() {
        var data = new double[][] {{1, 2}, {3, 4}};
        var dataset = Dataset.of(data);
        data[0][0] = 100;
        assertEquals(1.0, dataset.value(0, 0), 0.0);
        dataset.row(1)[1] = 100;
        assertEquals(4.0, dataset.value(1, 1), 0.0);
    }

    @Test
    public void testInvalidShapes() {
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(null));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{1, 2}}));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{}, {}}));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{1, 2}, {3}}));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{1, 2}, null}));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{1, Double.NaN}, {3, 4}}));
        assertThrows(InvalidDatasetException.class, () -> Dataset.of(new double[][] {{1, 2}, {Double.POSITIVE_INFINITY, 4}}));
    }

    @Test
    public void testClassLabels() {
        var labels = ClassLabels.of(new int[] {7, -1, 7, 3, 7, 3}, 6);
        assertEquals(3, labels.numClasses());
        // classes are ordered by ascending label
        assertEquals(-1, labels.label(0));
        assertEquals(3, labels.label(1));
        assertEquals(7, labels.label(2));
        assertEquals(2, labels.classOf(0));
        assertEquals(0, labels.classOf(1));
        assertEquals(3, labels.count(2));
        assertEquals(0.5, labels.prior(2), 1e-12);
        assertEquals(labels.classOf(0), labels.classOf(2));
        assertNotEquals(labels.classOf(0), labels.classOf(3));

        // miss weights over the other classes sum to 1
        double total = labels.missWeight(2, 0) + labels.missWeight(2, 1);
        assertEquals(1.0, total, 1e-12);
        assertEquals(2.0 / 3, labels.missWeight(2, 1), 1e-12);
    }

    @Test
    public void testSingleClassHasNoMissWeight() {
        var labels = ClassLabels.of(new int[] {1, 1, 1}, 3);
        assertEquals(1, labels.numClasses());
        assertEquals(0.0, labels.missWeight(0, 0), 0.0);
    }

    @Test
    public void testMisalignedTarget() {
        assertThrows(InvalidDatasetException.class, () -> ClassLabels.of(null, 3));
        assertThrows(InvalidDatasetException.class, () -> ClassLabels.of(new int[] {0, 1}, 3));
    }
}
