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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

class FieldPathsTest {

    @Test
    void set_creates_intermediate_documents() {
        // Given
        Map<String, Object> document = new LinkedHashMap<>();

        // When
        FieldPaths.set(document, "workflowStatuses.summarize", "DONE");

        // Then
        assertThat(document).isEqualTo(Map.of("workflowStatuses", Map.of("summarize", "DONE")));
    }

    @Test
    void set_does_not_mutate_nested_maps_shared_with_a_previous_version_of_the_document() {
        // Given
        Map<String, Object> nested = new HashMap<>(Map.of("summarize", "RUNNING"));
        Map<String, Object> previous = new LinkedHashMap<>(Map.of("workflowStatuses", nested));
        Map<String, Object> next = new LinkedHashMap<>(previous);

        // When
        FieldPaths.set(next, "workflowStatuses.summarize", "DONE");

        // Then
        assertAll(
                () -> assertThat(nested).containsEntry("summarize", "RUNNING"),
                () -> assertThat(FieldPaths.get(next, "workflowStatuses.summarize")).isEqualTo("DONE")
        );
    }

    @Test
    void get_and_contains_distinguish_missing_from_null_values() {
        // Given
        Map<String, Object> document = new LinkedHashMap<>();
        FieldPaths.set(document, "a.b", null);

        // Then
        assertAll(
                () -> assertThat(FieldPaths.get(document, "a.b")).isNull(),
                () -> assertThat(FieldPaths.contains(document, "a.b")).isTrue(),
                () -> assertThat(FieldPaths.contains(document, "a.c")).isFalse(),
                () -> assertThat(FieldPaths.get(document, "x.y.z")).isNull()
        );
    }

    @Test
    void set_rejects_paths_through_non_document_values() {
        // Given
        Map<String, Object> document = new LinkedHashMap<>(Map.of("title", "A"));

        // Then
        assertThatThrownBy(() -> FieldPaths.set(document, "title.sub", "B"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot set title.sub since title is not a document");
    }

    @Test
    void empty_path_segments_are_rejected() {
        assertThatThrownBy(() -> FieldPaths.get(Map.of(), "a..b"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid field path: 'a..b'");
    }
}
