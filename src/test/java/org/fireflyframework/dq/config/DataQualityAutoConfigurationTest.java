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

import org.fireflyframework.dq.engine.DqEngine;
import org.fireflyframework.dq.function.CheckFunctionRegistry;
import org.fireflyframework.dq.loader.ChecksFileLoader;
import org.fireflyframework.dq.metadata.ChecksBuilder;
import org.fireflyframework.dq.metadata.ChecksValidator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DataQualityAutoConfiguration}.
 */
class DataQualityAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DataQualityAutoConfiguration.class));

    @Test
    void autoConfiguration_byDefault_shouldRegisterAllBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DqColumns.class);
            assertThat(context).hasSingleBean(CheckFunctionRegistry.class);
            assertThat(context).hasSingleBean(ChecksValidator.class);
            assertThat(context).hasSingleBean(ChecksBuilder.class);
            assertThat(context).hasSingleBean(DqEngine.class);
            assertThat(context).hasSingleBean(ChecksFileLoader.class);
            assertThat(context.getBean(DqEngine.class).getColumns()).isEqualTo(DqColumns.defaults());
        });
    }

    @Test
    void autoConfiguration_withCustomColumns_shouldConfigureEngine() {
        contextRunner
                .withPropertyValues(
                        "firefly.data.quality.errors-column=dq_errors",
                        "firefly.data.quality.warnings-column=dq_warnings")
                .run(context -> assertThat(context.getBean(DqEngine.class).getColumns())
                        .isEqualTo(new DqColumns("dq_errors", "dq_warnings")));
    }

    @Test
    void autoConfiguration_withSameColumnNames_shouldFailToStart() {
        contextRunner
                .withPropertyValues(
                        "firefly.data.quality.errors-column=dq",
                        "firefly.data.quality.warnings-column=dq")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void autoConfiguration_whenDisabled_shouldNotRegisterBeans() {
        contextRunner
                .withPropertyValues("firefly.data.quality.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(DqEngine.class);
                    assertThat(context).doesNotHaveBean(CheckFunctionRegistry.class);
                    assertThat(context).doesNotHaveBean(ChecksFileLoader.class);
                });
    }

    @Test
    void autoConfiguration_withUserEngine_shouldBackOff() {
        DqEngine userEngine = new DqEngine();

        contextRunner
                .withBean(DqEngine.class, () -> userEngine)
                .run(context -> {
                    assertThat(context).hasSingleBean(DqEngine.class);
                    assertThat(context.getBean(DqEngine.class)).isSameAs(userEngine);
                });
    }
}
