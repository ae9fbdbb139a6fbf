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

import java.io.Closeable;
import java.util.concurrent.ForkJoinPool;

/**
 * A fork join pool sized to the number of physical cores on the machine (avoiding hyper-thread count).
 * <p>
 * Per-instance neighbor searches are independent and read-only, so the weighting engines fan them
 * out over this pool by default.  The core count is read from the {@code jrelief.physical_core_count}
 * system property; knowing the real value is left to the operator (half the available processors is
 * the default, and is often correct).
 */
public class PhysicalCoreExecutor implements Closeable {
    private static final int physicalCoreCount = Integer.getInteger("jrelief.physical_core_count", Math.max(1, Runtime.getRuntime().availableProcessors() / 2));

    public static final PhysicalCoreExecutor instance = new PhysicalCoreExecutor(physicalCoreCount);

    public static ForkJoinPool pool() {
        return instance.pool;
    }

    private final ForkJoinPool pool;

    private PhysicalCoreExecutor(int cores) {
        assert cores > 0 && cores <= Runtime.getRuntime().availableProcessors() : "Invalid core count: " + cores;
        this.pool = new ForkJoinPool(cores);
    }

    public static int getPhysicalCoreCount() {
        return physicalCoreCount;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
