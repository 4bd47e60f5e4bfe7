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

import com.dataops.sqlshift.common.PropertyUtil;
import com.dataops.sqlshift.common.ValidationException;
import com.google.common.base.Splitter;
import com.google.common.collect.Sets;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-invocation settings of the transpile pipeline. Instances are immutable; use {@link
 * #builder()} or {@link #fromProperties(Map)}.
 */
public class TranspileConfig {
  /** The key for the target dialect. */
  public static final String DIALECT = "transpile.dialect";

  /** The default target dialect. */
  public static final Dialect DIALECT_DEFAULT = Dialect.TRINO;

  /** The key for strict mode. */
  public static final String STRICT = "transpile.strict";

  /** The default for strict mode. */
  public static final boolean STRICT_DEFAULT = false;

  /** The key for the number of retries of a failed rule or metric fetch. */
  public static final String RETRY_COUNT = "transpile.retry-count";

  /** The default retry count. */
  public static final int RETRY_COUNT_DEFAULT = 1;

  /** The maximum retry count. */
  public static final int RETRY_COUNT_MAX = 5;

  /** The key for the base backoff between fetch attempts, in milliseconds. */
  public static final String RETRY_BACKOFF_MS = "transpile.retry-backoff-ms";

  /** The default retry backoff. */
  public static final long RETRY_BACKOFF_MS_DEFAULT = 0L;

  /** The key for enabling/disabling template rendering. */
  public static final String TEMPLATE_RENDERING_ENABLED = "transpile.template-rendering.enabled";

  /** The key for enabling/disabling METRIC() expansion. */
  public static final String MACRO_EXPANSION_ENABLED = "transpile.macro-expansion.enabled";

  /** The key for enabling/disabling table substitution. */
  public static final String TABLE_SUBSTITUTION_ENABLED = "transpile.table-substitution.enabled";

  /** The key for the comma-separated warning kinds that fail a strict transpile. */
  public static final String BLOCKING_WARNING_KINDS = "transpile.blocking-warning-kinds";

  private static final Splitter KIND_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final Dialect dialect;
  private final boolean strict;
  private final int retryCount;
  private final Duration retryBackoff;
  private final boolean templateRenderingEnabled;
  private final boolean macroExpansionEnabled;
  private final boolean tableSubstitutionEnabled;
  private final Set<WarningKind> blockingWarningKinds;

  private TranspileConfig(Builder builder) {
    this.dialect = builder.dialect;
    this.strict = builder.strict;
    this.retryCount = builder.retryCount;
    this.retryBackoff = builder.retryBackoff;
    this.templateRenderingEnabled = builder.templateRenderingEnabled;
    this.macroExpansionEnabled = builder.macroExpansionEnabled;
    this.tableSubstitutionEnabled = builder.tableSubstitutionEnabled;
    this.blockingWarningKinds =
        Collections.unmodifiableSet(
            builder.blockingWarningKinds.isEmpty()
                ? EnumSet.noneOf(WarningKind.class)
                : EnumSet.copyOf(builder.blockingWarningKinds));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration with every setting at its default.
   *
   * @return The default configuration.
   */
  public static TranspileConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a configuration from a property map. Absent keys take their defaults.
   *
   * @param properties The properties.
   * @return A new TranspileConfig instance.
   * @throws ValidationException if any value is malformed or out of range.
   */
  public static TranspileConfig fromProperties(Map<String, String> properties) {
    ValidationException.checkNotNull(properties, "Properties cannot be null");
    Builder builder =
        builder()
            .strict(PropertyUtil.propertyAsBoolean(properties, STRICT, STRICT_DEFAULT))
            .retryCount(PropertyUtil.propertyAsInt(properties, RETRY_COUNT, RETRY_COUNT_DEFAULT))
            .retryBackoff(
                Duration.ofMillis(
                    PropertyUtil.propertyAsLong(
                        properties, RETRY_BACKOFF_MS, RETRY_BACKOFF_MS_DEFAULT)))
            .templateRenderingEnabled(
                PropertyUtil.propertyAsBoolean(properties, TEMPLATE_RENDERING_ENABLED, true))
            .macroExpansionEnabled(
                PropertyUtil.propertyAsBoolean(properties, MACRO_EXPANSION_ENABLED, true))
            .tableSubstitutionEnabled(
                PropertyUtil.propertyAsBoolean(properties, TABLE_SUBSTITUTION_ENABLED, true));

    String dialectName = PropertyUtil.propertyAsString(properties, DIALECT, null);
    if (dialectName != null) {
      builder.dialect(Dialect.fromName(dialectName));
    }

    String kinds = PropertyUtil.propertyAsString(properties, BLOCKING_WARNING_KINDS, null);
    if (kinds != null) {
      Set<WarningKind> parsed = EnumSet.noneOf(WarningKind.class);
      for (String kind : KIND_SPLITTER.split(kinds)) {
        parsed.add(parseWarningKind(kind));
      }
      builder.blockingWarningKinds(parsed);
    }
    return builder.build();
  }

  private static WarningKind parseWarningKind(String value) {
    try {
      return WarningKind.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException(
          "Property %s contains unknown warning kind %s", BLOCKING_WARNING_KINDS, value);
    }
  }

  public Dialect getDialect() {
    return dialect;
  }

  /**
   * Whether degradable failures and blocking warnings fail the transpile.
   *
   * @return true for strict mode, false for graceful mode.
   */
  public boolean isStrict() {
    return strict;
  }

  /**
   * Gets the number of retries after a failed rule or metric fetch. A fetch is attempted at most
   * {@code retryCount + 1} times.
   *
   * @return The retry count.
   */
  public int getRetryCount() {
    return retryCount;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public boolean isTemplateRenderingEnabled() {
    return templateRenderingEnabled;
  }

  public boolean isMacroExpansionEnabled() {
    return macroExpansionEnabled;
  }

  public boolean isTableSubstitutionEnabled() {
    return tableSubstitutionEnabled;
  }

  public Set<WarningKind> getBlockingWarningKinds() {
    return blockingWarningKinds;
  }

  /**
   * Creates a builder initialized with the settings of this configuration.
   *
   * @return A new Builder instance.
   */
  public Builder toBuilder() {
    return builder()
        .dialect(dialect)
        .strict(strict)
        .retryCount(retryCount)
        .retryBackoff(retryBackoff)
        .templateRenderingEnabled(templateRenderingEnabled)
        .macroExpansionEnabled(macroExpansionEnabled)
        .tableSubstitutionEnabled(tableSubstitutionEnabled)
        .blockingWarningKinds(blockingWarningKinds);
  }

  @Override
  public String toString() {
    return "TranspileConfig{"
        + "dialect="
        + dialect
        + ", strict="
        + strict
        + ", retryCount="
        + retryCount
        + ", retryBackoff="
        + retryBackoff
        + ", templateRenderingEnabled="
        + templateRenderingEnabled
        + ", macroExpansionEnabled="
        + macroExpansionEnabled
        + ", tableSubstitutionEnabled="
        + tableSubstitutionEnabled
        + ", blockingWarningKinds="
        + blockingWarningKinds
        + '}';
  }

  /** Builder for {@link TranspileConfig}. */
  public static class Builder {
    private Dialect dialect = DIALECT_DEFAULT;
    private boolean strict = STRICT_DEFAULT;
    private int retryCount = RETRY_COUNT_DEFAULT;
    private Duration retryBackoff = Duration.ofMillis(RETRY_BACKOFF_MS_DEFAULT);
    private boolean templateRenderingEnabled = true;
    private boolean macroExpansionEnabled = true;
    private boolean tableSubstitutionEnabled = true;
    private Set<WarningKind> blockingWarningKinds = EnumSet.of(WarningKind.DANGEROUS_STATEMENT);

    private Builder() {}

    public Builder dialect(Dialect dialect) {
      this.dialect = ValidationException.checkNotNull(dialect, "Dialect cannot be null");
      return this;
    }

    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    /**
     * Sets the number of retries after a failed fetch.
     *
     * @param retryCount A value between 0 and {@value TranspileConfig#RETRY_COUNT_MAX}.
     * @return This Builder instance.
     * @throws ValidationException if the value is out of range.
     */
    public Builder retryCount(int retryCount) {
      ValidationException.check(
          retryCount >= 0 && retryCount <= RETRY_COUNT_MAX,
          "Retry count must be between 0 and %s but was %s",
          RETRY_COUNT_MAX,
          retryCount);
      this.retryCount = retryCount;
      return this;
    }

    public Builder retryBackoff(Duration retryBackoff) {
      ValidationException.checkNotNull(retryBackoff, "Retry backoff cannot be null");
      ValidationException.check(!retryBackoff.isNegative(), "Retry backoff cannot be negative");
      this.retryBackoff = retryBackoff;
      return this;
    }

    public Builder templateRenderingEnabled(boolean templateRenderingEnabled) {
      this.templateRenderingEnabled = templateRenderingEnabled;
      return this;
    }

    public Builder macroExpansionEnabled(boolean macroExpansionEnabled) {
      this.macroExpansionEnabled = macroExpansionEnabled;
      return this;
    }

    public Builder tableSubstitutionEnabled(boolean tableSubstitutionEnabled) {
      this.tableSubstitutionEnabled = tableSubstitutionEnabled;
      return this;
    }

    public Builder blockingWarningKinds(Set<WarningKind> blockingWarningKinds) {
      ValidationException.checkNotNull(
          blockingWarningKinds, "Blocking warning kinds cannot be null");
      this.blockingWarningKinds = Sets.newHashSet(blockingWarningKinds);
      return this;
    }

    public TranspileConfig build() {
      return new TranspileConfig(this);
    }
  }
}
