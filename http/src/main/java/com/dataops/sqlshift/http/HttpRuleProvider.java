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

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.RuleSet;
import com.dataops.sqlshift.model.SubstitutionRule;
import com.dataops.sqlshift.provider.RuleProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches rules and metric definitions from the rule service over HTTP.
 *
 * <p>Rules come from {@code GET /api/v1/transpile/rules?version=latest&toDialect={dialect}} and
 * metrics from {@code GET /api/v1/transpile/metrics/{name}/definition}. A 404 on a metric means the
 * metric does not exist; any other non-2xx status, I/O failure or malformed body is a RULE_FETCH
 * failure. Wrap this provider in a {@link com.dataops.sqlshift.provider.CachingRuleProvider} to
 * avoid a round-trip per transpile.
 */
public class HttpRuleProvider implements RuleProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpRuleProvider.class);
  static final String RULES_PATH = "/api/v1/transpile/rules";
  static final String METRICS_PATH = "/api/v1/transpile/metrics/";
  private static final int NOT_FOUND = 404;

  private final HttpRuleProviderProperties properties;
  private final HttpClient client;
  private final ObjectMapper objectMapper;

  public HttpRuleProvider(HttpRuleProviderProperties properties) {
    this(
        properties,
        HttpClient.newBuilder().connectTimeout(properties.getConnectTimeout()).build(),
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  @VisibleForTesting
  HttpRuleProvider(
      HttpRuleProviderProperties properties, HttpClient client, ObjectMapper objectMapper) {
    this.properties = ValidationException.checkNotNull(properties, "Properties cannot be null");
    this.client = client;
    this.objectMapper = objectMapper;
  }

  @Override
  public RuleSet fetchRules() {
    String path =
        RULES_PATH + "?version=latest&toDialect=" + encode(properties.getDialect().getTag());
    HttpResponse<String> response = get(path);
    if (!isSuccess(response.statusCode())) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH,
          "Rule service returned HTTP %s for %s",
          response.statusCode(),
          path);
    }
    RuleSetPayload payload = parse(response.body(), RuleSetPayload.class, "rules");
    List<SubstitutionRule> rules = new ArrayList<>();
    if (payload.getRules() != null) {
      for (RulePayload rule : payload.getRules()) {
        rules.add(toRule(rule));
      }
    }
    LOGGER.debug("Fetched {} rules at version {}", rules.size(), payload.getVersion());
    return new RuleSet(rules, payload.getVersion());
  }

  @Override
  public MetricDefinition fetchMetric(String name) {
    ValidationException.checkNotBlank(name, "Metric name cannot be blank");
    String path = METRICS_PATH + encode(name) + "/definition";
    HttpResponse<String> response = get(path);
    if (response.statusCode() == NOT_FOUND) {
      throw new TranspileException(
          ErrorKind.METRIC_NOT_FOUND, "Metric '" + name + "' not found", name, null);
    }
    if (!isSuccess(response.statusCode())) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH,
          "Rule service returned HTTP %s for metric %s",
          response.statusCode(),
          name);
    }
    MetricPayload payload = parse(response.body(), MetricPayload.class, "metric " + name);
    try {
      return MetricDefinition.builder(
              payload.getName() == null ? name : payload.getName(), payload.getExpression())
          .dependencies(payload.getDependencies())
          .description(payload.getDescription())
          .build();
    } catch (ValidationException ex) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Malformed definition of metric %s: %s", name, ex.getMessage());
    }
  }

  private HttpResponse<String> get(String path) {
    HttpRequest.Builder request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.getBaseUrl() + path))
            .timeout(properties.getReadTimeout())
            .header("Accept", "application/json")
            .GET();
    if (properties.getToken() != null) {
      request.header("Authorization", "Bearer " + properties.getToken());
    }
    try {
      return client.send(request.build(), BodyHandlers.ofString());
    } catch (IOException ex) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Failed to reach rule service at %s", properties.getBaseUrl());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Interrupted while calling rule service for %s", path);
    }
  }

  private <T> T parse(String body, Class<T> type, String what) {
    try {
      T value = objectMapper.readValue(body, type);
      if (value == null) {
        throw new TranspileException(ErrorKind.RULE_FETCH, "Empty response body for %s", what);
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Malformed response for %s: %s", what, ex.getOriginalMessage());
    }
  }

  private static SubstitutionRule toRule(RulePayload payload) {
    try {
      SubstitutionRule.Builder builder =
          SubstitutionRule.builder(payload.getSource(), payload.getTarget())
              .id(payload.getId())
              .description(payload.getDescription());
      if (payload.getPriority() != null) {
        builder.priority(payload.getPriority());
      }
      if (payload.getEnabled() != null) {
        builder.enabled(payload.getEnabled());
      }
      return builder.build();
    } catch (ValidationException ex) {
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Malformed rule %s: %s", payload.getId(), ex.getMessage());
    }
  }

  private static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
