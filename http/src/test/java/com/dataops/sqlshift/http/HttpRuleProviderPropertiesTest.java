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
package com.dataops.sqlshift.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.Dialect;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpRuleProviderPropertiesTest {

  @Test
  void testDefaults() {
    HttpRuleProviderProperties properties =
        new HttpRuleProviderProperties(
            Map.of(HttpRuleProviderProperties.BASE_URL, "https://rules.example.com"));

    assertThat(properties.getBaseUrl()).isEqualTo("https://rules.example.com");
    assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.getToken()).isNull();
    assertThat(properties.getDialect()).isEqualTo(Dialect.TRINO);
  }

  @Test
  void testExplicitValues() {
    HttpRuleProviderProperties properties =
        new HttpRuleProviderProperties(
            Map.of(
                HttpRuleProviderProperties.BASE_URL, "http://localhost:9000/",
                HttpRuleProviderProperties.CONNECT_TIMEOUT_MS, "250",
                HttpRuleProviderProperties.READ_TIMEOUT_MS, "2000",
                HttpRuleProviderProperties.TOKEN, "abc",
                HttpRuleProviderProperties.DIALECT, "BigQuery"));

    assertThat(properties.getBaseUrl()).isEqualTo("http://localhost:9000");
    assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofMillis(250));
    assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofMillis(2000));
    assertThat(properties.getToken()).isEqualTo("abc");
    assertThat(properties.getDialect()).isEqualTo(Dialect.BIGQUERY);
    assertThat(properties.toString()).contains("token=****").doesNotContain("abc");
  }

  @Test
  void testInvalidProperties() {
    assertThatThrownBy(() -> new HttpRuleProviderProperties(Map.of()))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Property rules.http.base-url is required");
    assertThatThrownBy(
            () ->
                new HttpRuleProviderProperties(
                    Map.of(HttpRuleProviderProperties.BASE_URL, "ftp://rules.example.com")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("must be an http or https URL");
    assertThatThrownBy(
            () ->
                new HttpRuleProviderProperties(
                    Map.of(
                        HttpRuleProviderProperties.BASE_URL, "https://rules.example.com",
                        HttpRuleProviderProperties.READ_TIMEOUT_MS, "0")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Property rules.http.read-timeout-ms must be positive but was 0");
    assertThatThrownBy(
            () ->
                new HttpRuleProviderProperties(
                    Map.of(
                        HttpRuleProviderProperties.BASE_URL, "https://rules.example.com",
                        HttpRuleProviderProperties.DIALECT, "postgres")))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("Unsupported dialect postgres");
  }
}
