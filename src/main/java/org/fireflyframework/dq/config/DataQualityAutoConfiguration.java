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

package org.fireflyframework.dq.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.engine.DqEngine;
import org.fireflyframework.dq.function.CheckFunctionRegistry;
import org.fireflyframework.dq.loader.ChecksFileLoader;
import org.fireflyframework.dq.metadata.ChecksBuilder;
import org.fireflyframework.dq.metadata.ChecksValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the data quality engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link CheckFunctionRegistry} with the built-in check functions</li>
 *   <li>{@link ChecksValidator} and {@link ChecksBuilder} for rule metadata</li>
 *   <li>{@link DqEngine} writing to the configured diagnostic columns</li>
 *   <li>{@link ChecksFileLoader} for JSON and YAML rule files</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.data.quality.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DataQualityProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.quality",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DataQualityAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DqColumns dqColumns(DataQualityProperties properties) {
        return properties.toColumns();
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckFunctionRegistry checkFunctionRegistry() {
        CheckFunctionRegistry registry = new CheckFunctionRegistry();
        log.info("Configuring check function registry with {} built-in functions",
                registry.getBuiltInNames().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ChecksValidator checksValidator(CheckFunctionRegistry registry) {
        return new ChecksValidator(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChecksBuilder checksBuilder(CheckFunctionRegistry registry, ChecksValidator validator) {
        return new ChecksBuilder(registry, validator);
    }

    /**
     * Creates the data quality engine bean.
     *
     * <p>An {@link ApplicationEventPublisher} is injected when available to enable
     * event publishing each time checks are applied.</p>
     *
     * @param columns        the diagnostic column names
     * @param validator      the metadata validator
     * @param builder        the metadata builder
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured data quality engine
     */
    @Bean
    @ConditionalOnMissingBean
    public DqEngine dqEngine(DqColumns columns,
                             ChecksValidator validator,
                             ChecksBuilder builder,
                             @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring Data Quality Engine with diagnostic columns '{}' and '{}'",
                columns.errors(), columns.warnings());
        return new DqEngine(columns, validator, builder, eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChecksFileLoader checksFileLoader(DataQualityProperties properties) {
        return new ChecksFileLoader(properties.isLegacyStringMaps());
    }
}
