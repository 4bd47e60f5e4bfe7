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

import com.dataops.sqlshift.common.PropertyUtil;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.Dialect;
import java.time.Duration;
import java.util.Map;

/** Connection settings of {@link HttpRuleProvider}, read from a property map. */
public class HttpRuleProviderProperties {
  /** The key for the base URL of the rule service. Required. */
  public static final String BASE_URL = "rules.http.base-url";

  /** The key for the connect timeout in milliseconds. */
  public static final String CONNECT_TIMEOUT_MS = "rules.http.connect-timeout-ms";

  /** The default connect timeout (5 seconds). */
  public static final long CONNECT_TIMEOUT_MS_DEFAULT = 5_000L;

  /** The key for the request timeout in milliseconds. */
  public static final String READ_TIMEOUT_MS = "rules.http.read-timeout-ms";

  /** The default request timeout (30 seconds). */
  public static final long READ_TIMEOUT_MS_DEFAULT = 30_000L;

  /** The key for the bearer token sent with every request. Optional. */
  public static final String TOKEN = "rules.http.token";

  /** The key for the dialect whose rules are requested. */
  public static final String DIALECT = "rules.http.dialect";

  private final String baseUrl;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final String token;
  private final Dialect dialect;

  /**
   * Reads the settings from a property map.
   *
   * @param properties The properties.
   * @throws ValidationException if the base URL is missing or a value is malformed.
   */
  public HttpRuleProviderProperties(Map<String, String> properties) {
    ValidationException.checkNotNull(properties, "Properties cannot be null");
    String url =
        ValidationException.checkNotBlank(
            PropertyUtil.propertyAsString(properties, BASE_URL, null),
            "Property %s is required",
            BASE_URL);
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    ValidationException.check(
        baseUrl.startsWith("http://") || baseUrl.startsWith("https://"),
        "Property %s must be an http or https URL but was %s",
        BASE_URL,
        url);
    this.connectTimeout =
        positiveMillis(properties, CONNECT_TIMEOUT_MS, CONNECT_TIMEOUT_MS_DEFAULT);
    this.readTimeout = positiveMillis(properties, READ_TIMEOUT_MS, READ_TIMEOUT_MS_DEFAULT);
    String tokenValue = PropertyUtil.propertyAsString(properties, TOKEN, null);
    this.token = tokenValue == null || tokenValue.isEmpty() ? null : tokenValue;
    String dialectName = PropertyUtil.propertyAsString(properties, DIALECT, null);
    this.dialect = dialectName == null ? Dialect.TRINO : Dialect.fromName(dialectName);
  }

  private static Duration positiveMillis(
      Map<String, String> properties, String key, long defaultValue) {
    long millis = PropertyUtil.propertyAsLong(properties, key, defaultValue);
    ValidationException.check(millis > 0, "Property %s must be positive but was %s", key, millis);
    return Duration.ofMillis(millis);
  }

  /**
   * Gets the base URL without a trailing slash.
   *
   * @return The base URL.
   */
  public String getBaseUrl() {
    return baseUrl;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  /**
   * Gets the bearer token.
   *
   * @return The token, or null if requests are unauthenticated.
   */
  public String getToken() {
    return token;
  }

  public Dialect getDialect() {
    return dialect;
  }

  @Override
  public String toString() {
    return "HttpRuleProviderProperties{"
        + "baseUrl='"
        + baseUrl
        + '\''
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + ", token="
        + (token == null ? "none" : "****")
        + ", dialect="
        + dialect
        + '}';
  }
}
