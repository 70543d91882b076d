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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A read model document as returned by a {@link ReadModelReader}.
 *
 * @param identityKey   The name of the identity field
 * @param identityValue The identity of the document
 * @param fields        All fields of the document, including the identity field. Nested documents are represented as maps.
 *                      The document holds an unmodifiable deep copy, so neither the supplied map nor the maps and lists
 *                      returned by {@link #get(String)} share state with it.
 * @param updatedAt     The time of the last mutation
 */
@NullMarked
public record ReadModelDocument(String identityKey, String identityValue, Map<String, Object> fields, Instant updatedAt) {

    public ReadModelDocument {
        requireNonNull(identityKey, "identityKey cannot be null");
        requireNonNull(identityValue, "identityValue cannot be null");
        requireNonNull(fields, "fields cannot be null");
        requireNonNull(updatedAt, "updatedAt cannot be null");
        fields = unmodifiableCopy(fields);
    }

    /**
     * Get the value of a field. {@code path} may be a dotted path into nested documents.
     *
     * @return The value or {@code null} if there's no such field
     */
    public @Nullable Object get(String path) {
        return FieldPaths.get(fields, path);
    }

    /**
     * @return {@code true} if the document has a (possibly {@code null}) value at {@code path}
     */
    public boolean has(String path) {
        return FieldPaths.contains(fields, path);
    }

    private static Map<String, Object> unmodifiableCopy(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), unmodifiableCopyOf(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static @Nullable Object unmodifiableCopyOf(@Nullable Object value) {
        if (value instanceof Map) {
            return unmodifiableCopy((Map<?, ?>) value);
        } else if (value instanceof List) {
            List<@Nullable Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(unmodifiableCopyOf(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
