/*
 * Copyright (c) 2025, The SqlShift Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.dataops.sqlshift.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dataops.sqlshift.common.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricDefinitionTest {

  @Test
  void testBuilder() {
    MetricDefinition metric =
        MetricDefinition.builder("revenue", "  SUM(amount * quantity) ")
            .dependencies(List.of("analytics.orders"))
            .description("Total revenue from orders")
            .build();

    assertThat(metric.getName()).isEqualTo("revenue");
    assertThat(metric.getExpression()).isEqualTo("SUM(amount * quantity)");
    assertThat(metric.getDependencies()).containsExactly("analytics.orders");
    assertThat(metric.getDescription()).isEqualTo("Total revenue from orders");
  }

  @Test
  void testRejectsBlankFields() {
    assertThatThrownBy(() -> MetricDefinition.builder(" ", "COUNT(*)"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Metric name");
    assertThatThrownBy(() -> MetricDefinition.builder("dau", ""))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("dau");
  }

  @Test
  void testNullDependenciesAreIgnored() {
    MetricDefinition metric =
        MetricDefinition.builder("dau", "COUNT(*)").dependencies(null).build();

    assertThat(metric.getDependencies()).isEmpty();
  }
}
