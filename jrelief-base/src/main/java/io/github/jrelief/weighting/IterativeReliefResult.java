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

import java.util.List;

public class IterativeReliefResult {
    /**
     * The weight vector of the last iteration.
     */
    public final double[] weights;

    /**
     * The number of iterations performed.
     */
    public final int iterations;

    /**
     * True if the run stopped because the change fell below the tolerance (or no feature carried
     * any weight), false if it hit the iteration cap.
     */
    public final boolean converged;

    /**
     * The L2 distance between the last two weight vectors.
     */
    public final double lastChange;

    /**
     * The weight vector after each iteration, in order; the last entry equals {@link #weights}.
     */
    public final List<double[]> history;

    public IterativeReliefResult(double[] weights, int iterations, boolean converged, double lastChange, List<double[]> history) {
        this.weights = weights;
        this.iterations = iterations;
        this.converged = converged;
        this.lastChange = lastChange;
        this.history = history;
    }
}
