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
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TranspileConfigTest {

  @Test
  void testDefaults() {
    TranspileConfig config = TranspileConfig.defaults();

    assertThat(config.getDialect()).isEqualTo(Dialect.TRINO);
    assertThat(config.isStrict()).isFalse();
    assertThat(config.getRetryCount()).isEqualTo(1);
    assertThat(config.getRetryBackoff()).isEqualTo(Duration.ZERO);
    assertThat(config.isTemplateRenderingEnabled()).isTrue();
    assertThat(config.isMacroExpansionEnabled()).isTrue();
    assertThat(config.isTableSubstitutionEnabled()).isTrue();
    assertThat(config.getBlockingWarningKinds()).containsExactly(WarningKind.DANGEROUS_STATEMENT);
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 6, 100})
  void testRetryCountOutOfRange(int retryCount) {
    assertThatThrownBy(() -> TranspileConfig.builder().retryCount(retryCount))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("between 0 and 5");
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 3, 5})
  void testRetryCountInRange(int retryCount) {
    assertThat(TranspileConfig.builder().retryCount(retryCount).build().getRetryCount())
        .isEqualTo(retryCount);
  }

  @Test
  void testNegativeBackoffIsRejected() {
    assertThatThrownBy(() -> TranspileConfig.builder().retryBackoff(Duration.ofMillis(-1)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void testFromProperties() {
    Map<String, String> properties = new HashMap<>();
    properties.put(TranspileConfig.DIALECT, "BigQuery");
    properties.put(TranspileConfig.STRICT, "true");
    properties.put(TranspileConfig.RETRY_COUNT, "3");
    properties.put(TranspileConfig.RETRY_BACKOFF_MS, "250");
    properties.put(TranspileConfig.TEMPLATE_RENDERING_ENABLED, "false");
    properties.put(TranspileConfig.MACRO_EXPANSION_ENABLED, "false");
    properties.put(TranspileConfig.TABLE_SUBSTITUTION_ENABLED, "false");
    properties.put(TranspileConfig.BLOCKING_WARNING_KINDS, "missing-limit, UNBOUNDED_SELECT");

    TranspileConfig config = TranspileConfig.fromProperties(properties);

    assertThat(config.getDialect()).isEqualTo(Dialect.BIGQUERY);
    assertThat(config.isStrict()).isTrue();
    assertThat(config.getRetryCount()).isEqualTo(3);
    assertThat(config.getRetryBackoff()).isEqualTo(Duration.ofMillis(250));
    assertThat(config.isTemplateRenderingEnabled()).isFalse();
    assertThat(config.isMacroExpansionEnabled()).isFalse();
    assertThat(config.isTableSubstitutionEnabled()).isFalse();
    assertThat(config.getBlockingWarningKinds())
        .containsExactlyInAnyOrder(WarningKind.MISSING_LIMIT, WarningKind.UNBOUNDED_SELECT);
  }

  @Test
  void testFromPropertiesWithEmptyMapUsesDefaults() {
    TranspileConfig config = TranspileConfig.fromProperties(Map.of());

    assertThat(config.getDialect()).isEqualTo(Dialect.TRINO);
    assertThat(config.getRetryCount()).isEqualTo(TranspileConfig.RETRY_COUNT_DEFAULT);
    assertThat(config.getBlockingWarningKinds()).containsExactly(WarningKind.DANGEROUS_STATEMENT);
  }

  @Test
  void testFromPropertiesWithEmptyBlockingKinds() {
    TranspileConfig config =
        TranspileConfig.fromProperties(Map.of(TranspileConfig.BLOCKING_WARNING_KINDS, ""));

    assertThat(config.getBlockingWarningKinds()).isEmpty();
  }

  @Test
  void testFromPropertiesWithInvalidValues() {
    assertThatThrownBy(
            () -> TranspileConfig.fromProperties(Map.of(TranspileConfig.DIALECT, "postgres")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("postgres");
    assertThatThrownBy(
            () -> TranspileConfig.fromProperties(Map.of(TranspileConfig.RETRY_COUNT, "9")))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(
            () ->
                TranspileConfig.fromProperties(
                    Map.of(TranspileConfig.BLOCKING_WARNING_KINDS, "SLOW_QUERY")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("SLOW_QUERY");
  }

  @Test
  void testBlockingWarningKindsAreImmutable() {
    EnumSet<WarningKind> kinds = EnumSet.of(WarningKind.MISSING_LIMIT);
    TranspileConfig config = TranspileConfig.builder().blockingWarningKinds(kinds).build();
    kinds.add(WarningKind.DUPLICATE_CTE);

    assertThat(config.getBlockingWarningKinds()).containsExactly(WarningKind.MISSING_LIMIT);
    assertThatThrownBy(() -> config.getBlockingWarningKinds().add(WarningKind.DUPLICATE_CTE))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testToBuilderCopiesSettings() {
    TranspileConfig original =
        TranspileConfig.builder().dialect(Dialect.BIGQUERY).strict(true).retryCount(4).build();

    TranspileConfig copy = original.toBuilder().retryCount(0).build();

    assertThat(copy.getDialect()).isEqualTo(Dialect.BIGQUERY);
    assertThat(copy.isStrict()).isTrue();
    assertThat(copy.getRetryCount()).isZero();
  }
}
