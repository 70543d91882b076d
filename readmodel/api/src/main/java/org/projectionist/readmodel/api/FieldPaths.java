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

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Utilities for dotted field paths, such as {@code "workflowStatuses.summarize"}, with the same semantics as
 * MongoDB's {@code $set}: intermediate documents are created when missing.
 */
@NullMarked
public final class FieldPaths {

    private FieldPaths() {
    }

    /**
     * Set {@code value} at {@code path} in {@code document}, creating intermediate maps as needed.
     *
     * @throws IllegalArgumentException If the path is empty or traverses a value that is not a map
     */
    @SuppressWarnings("unchecked")
    public static void set(Map<String, Object> document, String path, @Nullable Object value) {
        String[] segments = segments(path);
        Map<String, Object> current = document;
        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i];
            Object next = current.get(segment);
            if (next == null) {
                Map<String, Object> created = new LinkedHashMap<>();
                current.put(segment, created);
                current = created;
            } else if (next instanceof Map) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) next);
                current.put(segment, copy);
                current = copy;
            } else {
                throw new IllegalArgumentException("Cannot set " + path + " since " + segment + " is not a document");
            }
        }
        current.put(segments[segments.length - 1], value);
    }

    /**
     * @return The value at {@code path} or {@code null} if it's missing
     */
    public static @Nullable Object get(Map<String, ?> document, String path) {
        Object current = document;
        for (String segment : segments(path)) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }

    /**
     * @return {@code true} if {@code path} exists in {@code document}, even if its value is {@code null}
     */
    public static boolean contains(Map<String, ?> document, String path) {
        String[] segments = segments(path);
        Object current = document;
        for (String segment : segments) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(segment)) {
                return false;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return true;
    }

    private static String[] segments(String path) {
        requireNonNull(path, "path cannot be null");
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Invalid field path: '" + path + "'");
            }
        }
        return segments;
    }
}
