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
 * Base exception for feature weighting errors.
 * <p>
 * Every failure raised by the weighting engines is a caller-input error: it is deterministic for
 * identical inputs and is never retried or recovered internally.  Catch this type to handle all of them.
 */
public class ReliefException extends RuntimeException {

    /**
     * @param message error message
     */
    public ReliefException(String message) {
        super(message);
    }

    /**
     * @param message error message
     * @param cause underlying cause
     */
    public ReliefException(String message, Throwable cause) {
        super(message, cause);
    }
}
