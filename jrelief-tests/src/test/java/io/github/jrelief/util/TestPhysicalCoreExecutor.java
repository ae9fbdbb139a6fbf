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

package io.github.jrelief.util;

import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jrelief.ReliefTestCase;
import org.junit.Test;

import static org.junit.Assert.*;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestPhysicalCoreExecutor extends ReliefTestCase {
    @Test
    public void testPoolIsSizedToCoreCount() {
        int cores = PhysicalCoreExecutor.getPhysicalCoreCount();
        assertTrue(cores >= 1);
        assertEquals(cores, PhysicalCoreExecutor.pool().getParallelism());
        assertSame(PhysicalCoreExecutor.pool(), PhysicalCoreExecutor.pool());
    }
}
