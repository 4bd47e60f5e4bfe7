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

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The outcome of one transpile invocation. A successful result carries the final SQL; a failed
 * result carries a {@link TranspileError} and no SQL. Warnings collected before a failure are kept.
 */
public class TranspileResult {
  private final String originalSql;
  private final String finalSql;
  private final boolean success;
  private final List<SubstitutionRule> appliedRules;
  private final List<String> expandedMetrics;
  private final List<Warning> warnings;
  private final TranspileError error;
  private final String rulesVersion;
  private final Dialect dialect;
  private final Instant transpiledAt;
  private final Duration duration;

  private TranspileResult(Builder builder) {
    this.originalSql = builder.originalSql;
    this.success = builder.error == null;
    this.finalSql = success ? builder.finalSql : null;
    this.appliedRules = ImmutableList.copyOf(builder.appliedRules);
    this.expandedMetrics = ImmutableList.copyOf(builder.expandedMetrics);
    this.warnings = builder.warnings.build();
    this.error = builder.error;
    this.rulesVersion = builder.rulesVersion;
    this.dialect = builder.dialect;
    this.transpiledAt = builder.transpiledAt;
    this.duration = builder.duration;
  }

  public static Builder builder(String originalSql, Dialect dialect) {
    return new Builder(originalSql, dialect);
  }

  public String getOriginalSql() {
    return originalSql;
  }

  /**
   * Gets the SQL to hand to the query engine.
   *
   * @return The final SQL, or null if the transpile failed.
   */
  public String getFinalSql() {
    return finalSql;
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * Gets the rules that rewrote at least one table reference, in the order they were first
   * applied.
   *
   * @return An immutable list of rules.
   */
  public List<SubstitutionRule> getAppliedRules() {
    return appliedRules;
  }

  public List<String> getAppliedRuleIds() {
    return appliedRules.stream().map(SubstitutionRule::getId).collect(Collectors.toList());
  }

  public List<String> getExpandedMetrics() {
    return expandedMetrics;
  }

  public List<Warning> getWarnings() {
    return warnings;
  }

  public boolean hasWarning(WarningKind kind) {
    return warnings.stream().anyMatch(w -> w.getKind() == kind);
  }

  public TranspileError getError() {
    return error;
  }

  public String getRulesVersion() {
    return rulesVersion;
  }

  public Dialect getDialect() {
    return dialect;
  }

  public Instant getTranspiledAt() {
    return transpiledAt;
  }

  public Duration getDuration() {
    return duration;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TranspileResult that = (TranspileResult) o;
    return success == that.success
        && Objects.equals(originalSql, that.originalSql)
        && Objects.equals(finalSql, that.finalSql)
        && appliedRules.equals(that.appliedRules)
        && expandedMetrics.equals(that.expandedMetrics)
        && warnings.equals(that.warnings)
        && Objects.equals(error, that.error)
        && Objects.equals(rulesVersion, that.rulesVersion)
        && dialect == that.dialect;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        originalSql,
        finalSql,
        success,
        appliedRules,
        expandedMetrics,
        warnings,
        error,
        rulesVersion,
        dialect);
  }

  @Override
  public String toString() {
    return "TranspileResult{"
        + "success="
        + success
        + ", dialect="
        + dialect
        + ", appliedRules="
        + getAppliedRuleIds()
        + ", expandedMetrics="
        + expandedMetrics
        + ", warnings="
        + warnings
        + (error == null ? "" : ", error=" + error)
        + '}';
  }

  /** Builder for {@link TranspileResult}. */
  public static class Builder {
    private final String originalSql;
    private final Dialect dialect;
    private String finalSql;
    private List<SubstitutionRule> appliedRules = ImmutableList.of();
    private List<String> expandedMetrics = ImmutableList.of();
    private final ImmutableList.Builder<Warning> warnings = ImmutableList.builder();
    private TranspileError error;
    private String rulesVersion;
    private Instant transpiledAt;
    private Duration duration = Duration.ZERO;

    private Builder(String originalSql, Dialect dialect) {
      this.originalSql = originalSql;
      this.dialect = dialect;
    }

    public Builder finalSql(String finalSql) {
      this.finalSql = finalSql;
      return this;
    }

    public Builder appliedRules(List<SubstitutionRule> appliedRules) {
      this.appliedRules = appliedRules;
      return this;
    }

    public Builder expandedMetrics(List<String> expandedMetrics) {
      this.expandedMetrics = expandedMetrics;
      return this;
    }

    public Builder warning(Warning warning) {
      this.warnings.add(warning);
      return this;
    }

    public Builder warnings(List<Warning> warnings) {
      this.warnings.addAll(warnings);
      return this;
    }

    public Builder error(TranspileError error) {
      this.error = error;
      return this;
    }

    public Builder rulesVersion(String rulesVersion) {
      this.rulesVersion = rulesVersion;
      return this;
    }

    public Builder transpiledAt(Instant transpiledAt) {
      this.transpiledAt = transpiledAt;
      return this;
    }

    public Builder duration(Duration duration) {
      this.duration = duration;
      return this;
    }

    public TranspileResult build() {
      return new TranspileResult(this);
    }
  }
}
