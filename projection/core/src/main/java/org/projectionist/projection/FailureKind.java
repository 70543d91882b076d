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

package org.projectionist.projection;

import org.projectionist.tracking.api.TransientStoreFailureException;

/**
 * Classifies why a handler failed.
 */
public enum FailureKind {
    TRANSIENT_STORE_FAILURE,
    MALFORMED_EVENT,
    UNEXPECTED;

    static FailureKind classify(Throwable throwable) {
        if (throwable instanceof TransientStoreFailureException) {
            return TRANSIENT_STORE_FAILURE;
        } else if (throwable instanceof MalformedEventException
                || throwable instanceof ClassCastException
                || throwable instanceof IllegalArgumentException
                || throwable instanceof NullPointerException) {
            return MALFORMED_EVENT;
        }
        return UNEXPECTED;
    }
}
