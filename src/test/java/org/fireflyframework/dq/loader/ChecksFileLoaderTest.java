/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.dq.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChecksFileLoader}.
 */
class ChecksFileLoaderTest {

    private static final String JSON_CHECKS = """
            [
              {
                "criticality": "error",
                "check": {
                  "function": "is_not_null",
                  "arguments": {"col_names": ["vendor_id", "fare"]}
                }
              },
              {
                "name": "fare_range",
                "criticality": "warn",
                "check": {
                  "function": "is_in_range",
                  "arguments": {"col_name": "fare", "min_limit": 0, "max_limit": 500}
                }
              }
            ]
            """;

    private static final String YAML_CHECKS = """
            - criticality: error
              check:
                function: is_not_null
                arguments:
                  col_names:
                    - vendor_id
                    - fare
            - name: fare_range
              criticality: warn
              check:
                function: is_in_range
                arguments:
                  col_name: fare
                  min_limit: 0
                  max_limit: 500
            """;

    @TempDir
    Path tempDir;

    private final ChecksFileLoader loader = new ChecksFileLoader();

    @Test
    void read_withJsonFile_shouldKeepNestedStructures() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("checks.json"), JSON_CHECKS);

        // When
        List<Map<String, Object>> checks = loader.read(file);

        // Then
        assertThat(checks).hasSize(2);
        assertThat(checks.get(0)).containsEntry("criticality", "error");
        assertThat(checks.get(0).get("check")).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> check = (Map<String, Object>) checks.get(1).get("check");
        assertThat(check).containsEntry("function", "is_in_range");
        assertThat(check.get("arguments")).isEqualTo(Map.of("col_name", "fare", "min_limit", 0, "max_limit", 500));
    }

    @Test
    void read_withYamlFile_shouldMatchJsonContent() throws IOException {
        // Given
        Path json = Files.writeString(tempDir.resolve("checks.json"), JSON_CHECKS);
        Path yaml = Files.writeString(tempDir.resolve("checks.yml"), YAML_CHECKS);
        Path yamlLong = Files.writeString(tempDir.resolve("checks.YAML"), YAML_CHECKS);

        // When & Then
        assertThat(loader.read(yaml)).isEqualTo(loader.read(json));
        assertThat(loader.read(yamlLong)).isEqualTo(loader.read(json));
    }

    @Test
    void read_withMissingFile_shouldThrowChecksFileMissingException() {
        Path missing = tempDir.resolve("missing.yml");

        assertThatThrownBy(() -> loader.read(missing))
                .isInstanceOf(ChecksFileMissingException.class)
                .hasMessage("Checks file " + missing + " missing");
    }

    @Test
    void read_withoutPath_shouldThrowIllegalArgumentException() {
        assertThatThrownBy(() -> loader.read(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("filename must be provided");
        assertThatThrownBy(() -> loader.read(Path.of("")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_withMalformedFile_shouldThrowUncheckedIOException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "[{\"check\": ");

        assertThatThrownBy(() -> loader.read(file))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read checks file");
    }

    @Test
    void read_withLegacyStringMaps_shouldDecodeOnlyWhenEnabled() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("legacy.json"), """
                [{"criticality": "warn", "check": "{'function': 'is_not_null', 'arguments': {'col_name': 'a'}}"}]
                """);

        // When
        List<Map<String, Object>> raw = loader.read(file);
        List<Map<String, Object>> decoded = new ChecksFileLoader(true).read(file);

        // Then
        assertThat(raw.get(0).get("check")).isInstanceOf(String.class);
        assertThat(decoded.get(0))
                .containsEntry("criticality", "warn")
                .containsEntry("check", Map.of("function", "is_not_null", "arguments", Map.of("col_name", "a")));
    }

    @Test
    void load_shouldEmitChecks() throws IOException {
        Path file = Files.writeString(tempDir.resolve("checks.yaml"), YAML_CHECKS);

        StepVerifier.create(loader.load(file))
                .assertNext(checks -> assertThat(checks).hasSize(2))
                .verifyComplete();
    }

    @Test
    void load_withMissingFile_shouldEmitError() {
        StepVerifier.create(loader.load(tempDir.resolve("missing.json")))
                .expectError(ChecksFileMissingException.class)
                .verify();
    }
}
