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

/**
 * How feature values are compared.  One type applies to every column of a dataset.
 */
public enum FeatureType {
    /** Absolute difference scaled by the feature's observed range, in [0, 1] */
    CONTINUOUS("continuous") {
        @Override
        public double diff(double a, double b, double halfRange) {
            // halved operands cannot overflow for finite inputs
            return Math.min(1.0, Math.abs(a / 2 - b / 2) / halfRange);
        }
    },
    /** 0 when the two values are equal, 1 otherwise */
    DISCRETE("discrete") {
        @Override
        public double diff(double a, double b, double halfRange) {
            return a == b ? 0.0 : 1.0;
        }
    };

    private final String tag;

    FeatureType(String tag) {
        this.tag = tag;
    }

    /**
     * @param halfRange half of the feature's observed range, as given by {@link io.github.jrelief.data.Dataset#halfRange}
     * @return the difference between two values of one feature, in [0, 1]
     */
    public abstract double diff(double a, double b, double halfRange);

    public String tag() {
        return tag;
    }

    /**
     * Parses {@code "continuous"} or {@code "discrete"}.
     *
     * @throws InvalidFeatureTypeException for any other value, including null
     */
    public static FeatureType fromTag(String tag) {
        for (var type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new InvalidFeatureTypeException(tag);
    }

    /**
     * @throws InvalidFeatureTypeException if the type is null
     */
    public static FeatureType requireValid(FeatureType type) {
        if (type == null) {
            throw new InvalidFeatureTypeException(null);
        }
        return type;
    }
}
