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

package org.projectionist.readmodel.api;

/**
 * The outcome of a {@link ReadModelMaterializer} operation.
 */
public enum MaterializationResult {
    /**
     * The tracking record and the document change were committed
     */
    APPLIED,
    /**
     * The consumer had already committed this position. Nothing was changed. This is the expected outcome when an
     * event is redelivered.
     */
    ALREADY_APPLIED
}
