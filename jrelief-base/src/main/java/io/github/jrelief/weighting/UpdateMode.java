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

import io.github.jrelief.InvalidModeException;

/**
 * Selects how {@link ReliefF} turns an instance's neighbors into a weight delta.
 */
public enum UpdateMode {
    /** Average over the k nearest hits and the k nearest misses of each other class */
    K_NEAREST("k_nearest"),
    /** Average over every other instance, with no decay by rank */
    DIFF("diff"),
    /** Every other instance, weighted by exp(-(rank / sigma)^2) so nearer neighbors dominate */
    EXP_RANK("exp_rank");

    private final String tag;

    UpdateMode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Parses {@code "k_nearest"}, {@code "diff"} or {@code "exp_rank"}.
     *
     * @throws InvalidModeException for any other value, including null
     */
    public static UpdateMode fromTag(String tag) {
        for (var mode : values()) {
            if (mode.tag.equals(tag)) {
                return mode;
            }
        }
        throw new InvalidModeException(tag);
    }

    /**
     * @throws InvalidModeException if the mode is null
     */
    public static UpdateMode requireValid(UpdateMode mode) {
        if (mode == null) {
            throw new InvalidModeException(null);
        }
        return mode;
    }
}
