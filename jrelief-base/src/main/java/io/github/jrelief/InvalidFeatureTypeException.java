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
 * Thrown when a feature type tag is not one of {@code "continuous"} or {@code "discrete"}.
 */
public class InvalidFeatureTypeException extends ReliefException {

    private final String tag;

    /**
     * @param tag the rejected tag, possibly null
     */
    public InvalidFeatureTypeException(String tag) {
        super("Invalid feature type: " + tag + " (expected \"continuous\" or \"discrete\")");
        this.tag = tag;
    }

    /**
     * @return the rejected tag
     */
    public String getTag() {
        return tag;
    }
}
