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
 * Thrown when the sample matrix or the target vector do not have a usable shape:
 * fewer than two instances, no features, ragged rows, non-finite values, or a target
 * whose length differs from the number of rows.
 */
public class InvalidDatasetException extends ReliefException {

    public InvalidDatasetException(String message) {
        super(message);
    }
}
