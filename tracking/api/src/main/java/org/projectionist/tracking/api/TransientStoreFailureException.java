/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectionist.tracking.api;

/**
 * Thrown when the backing store could not complete an operation, for example because of a network problem, a timeout
 * or an aborted transaction. Nothing has been committed when this exception is thrown, so the same event can be
 * applied again later.
 */
public class TransientStoreFailureException extends RuntimeException {

    public TransientStoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientStoreFailureException(String message) {
        super(message);
    }
}
