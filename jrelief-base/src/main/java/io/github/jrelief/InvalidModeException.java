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
 * Thrown when a ReliefF update mode tag is not one of
 * {@code "k_nearest"}, {@code "diff"} or {@code "exp_rank"}.
 */
public class InvalidModeException extends ReliefException {

    private final String tag;

    /**
     * @param tag the rejected tag, possibly null
     */
    public InvalidModeException(String tag) {
        super("Invalid mode: " + tag + " (expected \"k_nearest\", \"diff\" or \"exp_rank\")");
        this.tag = tag;
    }

    /**
     * @return the rejected tag
     */
    public String getTag() {
        return tag;
    }
}
