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

import org.jspecify.annotations.NullMarked;
import org.projectionist.readmodel.api.MaterializationResult;

/**
 * Projects one event type into a read model, or reacts to it with a side effect. Implementations call a
 * {@link org.projectionist.readmodel.api.ReadModelMaterializer} with their own consumer name and return its result.
 *
 * @param <T> The type of event handled
 */
@NullMarked
@FunctionalInterface
public interface ProjectionHandler<T> {

    MaterializationResult handle(T event, long position);
}
