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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads rule metadata from JSON or YAML files on the local file system.
 *
 * <p>Files ending in {@code .yml} or {@code .yaml} are read as YAML, all others
 * as JSON. The loaded entries follow the metadata schema and can be passed to
 * {@link org.fireflyframework.dq.engine.DqEngine#applyChecksByMetadata}.</p>
 *
 * <p>Older rule files stored nested maps as strings such as
 * {@code "{'function': 'is_not_null'}"}. Those are decoded only when
 * {@code legacyStringMaps} is enabled.</p>
 */
@Slf4j
public class ChecksFileLoader {

    private static final TypeReference<List<Map<String, Object>>> CHECKS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final boolean legacyStringMaps;

    public ChecksFileLoader() {
        this(false);
    }

    public ChecksFileLoader(boolean legacyStringMaps) {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.legacyStringMaps = legacyStringMaps;
    }

    /**
     * Loads checks without blocking the caller; the file is read on the
     * bounded elastic scheduler.
     *
     * @param path the rules file
     * @return a {@link Mono} emitting the rule metadata entries
     */
    public Mono<List<Map<String, Object>>> load(Path path) {
        return Mono.fromCallable(() -> read(path))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Reads checks from a file.
     *
     * @param path the rules file
     * @return the rule metadata entries
     * @throws IllegalArgumentException    if no path is given
     * @throws ChecksFileMissingException  if the file does not exist
     * @throws UncheckedIOException        if the file cannot be read or parsed
     */
    public List<Map<String, Object>> read(Path path) {
        if (path == null || path.toString().isBlank()) {
            throw new IllegalArgumentException("filename must be provided");
        }

        if (!Files.exists(path)) {
            throw new ChecksFileMissingException("Checks file " + path + " missing");
        }

        log.info("Loading quality rules (checks) from {}", path);
        try {
            List<Map<String, Object>> checks = mapperFor(path).readValue(path.toFile(), CHECKS_TYPE);
            if (checks == null) {
                return List.of();
            }
            return legacyStringMaps ? decodeLegacyStringMaps(checks) : checks;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checks file " + path, e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? yamlMapper : jsonMapper;
    }

    private List<Map<String, Object>> decodeLegacyStringMaps(List<Map<String, Object>> checks)
            throws JsonProcessingException {
        List<Map<String, Object>> decoded = new ArrayList<>(checks.size());
        for (Map<String, Object> check : checks) {
            Map<String, Object> entry = new LinkedHashMap<>();
            for (Map.Entry<String, Object> field : check.entrySet()) {
                Object value = field.getValue();
                if (value instanceof String text && text.startsWith("{") && text.endsWith("}")) {
                    value = jsonMapper.readValue(text.replace('\'', '"'), MAP_TYPE);
                }
                entry.put(field.getKey(), value);
            }
            decoded.add(entry);
        }
        return decoded;
    }
}
