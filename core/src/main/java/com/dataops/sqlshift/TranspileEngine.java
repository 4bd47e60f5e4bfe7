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
package com.dataops.sqlshift;

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.macro.MacroExpander;
import com.dataops.sqlshift.macro.MacroExpansion;
import com.dataops.sqlshift.macro.MacroMatch;
import com.dataops.sqlshift.model.Dialect;
import com.dataops.sqlshift.model.RuleSet;
import com.dataops.sqlshift.model.SourceLocation;
import com.dataops.sqlshift.model.SubstitutionRule;
import com.dataops.sqlshift.model.TranspileConfig;
import com.dataops.sqlshift.model.TranspileError;
import com.dataops.sqlshift.model.TranspileResult;
import com.dataops.sqlshift.model.TranspileStage;
import com.dataops.sqlshift.model.Warning;
import com.dataops.sqlshift.model.WarningKind;
import com.dataops.sqlshift.provider.RuleProvider;
import com.dataops.sqlshift.sql.ParsedSql;
import com.dataops.sqlshift.sql.SqlParser;
import com.dataops.sqlshift.sql.SubstitutionResult;
import com.dataops.sqlshift.sql.TableSubstitutionPass;
import com.dataops.sqlshift.sql.WarningDetector;
import com.dataops.sqlshift.template.TemplateContext;
import com.dataops.sqlshift.template.TemplateRenderer;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw or templated SQL into SQL for a target engine. A transpile runs four stages in order:
 * template rendering, METRIC() expansion, table substitution and the warning scan. Every stage
 * failure is reported in the returned {@link TranspileResult}; callers never see an exception for
 * it.
 *
 * <p>Rule and metric fetches are the only retried operations. Once retries are exhausted a strict
 * transpile fails, while a graceful one records a warning and continues without the missing data.
 * Instances hold no per-call state and can be shared between threads.
 */
public class TranspileEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(TranspileEngine.class);
  private final RuleProvider ruleProvider;
  private final TemplateRenderer templateRenderer;
  private final MacroExpander macroExpander;
  private final SqlParser sqlParser;
  private final TableSubstitutionPass substitutionPass;
  private final WarningDetector warningDetector;
  private final Clock clock;

  /**
   * Constructs an engine over the given rule provider, using the system clock.
   *
   * @param ruleProvider The source of substitution rules and metric definitions.
   */
  public TranspileEngine(RuleProvider ruleProvider) {
    this(builderFor(ruleProvider));
  }

  private TranspileEngine(Builder builder) {
    this.ruleProvider = builder.ruleProvider;
    this.clock = builder.clock;
    this.templateRenderer = new TemplateRenderer(clock);
    this.macroExpander = new MacroExpander();
    this.sqlParser = new SqlParser();
    this.substitutionPass = new TableSubstitutionPass(sqlParser);
    this.warningDetector = new WarningDetector();
  }

  /**
   * Creates a new Builder for TranspileEngine.
   *
   * @param ruleProvider The source of substitution rules and metric definitions.
   * @return A new Builder instance.
   */
  public static Builder builderFor(RuleProvider ruleProvider) {
    return new Builder(ruleProvider);
  }

  public TranspileResult transpile(String sql, TranspileConfig config) {
    return transpile(sql, config, TemplateContext.empty());
  }

  /**
   * Transpiles SQL.
   *
   * @param sql The raw or templated SQL.
   * @param config The settings of this invocation.
   * @param context The placeholder values; null means no variables or references.
   * @return The result. It carries the final SQL on success and the error on failure.
   * @throws ValidationException if {@code sql} or {@code config} is null.
   */
  public TranspileResult transpile(String sql, TranspileConfig config, TemplateContext context) {
    ValidationException.checkNotNull(sql, "SQL cannot be null");
    ValidationException.checkNotNull(config, "Transpile config cannot be null");
    TemplateContext templateContext = context == null ? TemplateContext.empty() : context;

    Stopwatch stopwatch = Stopwatch.createStarted();
    TranspileResult.Builder result =
        TranspileResult.builder(sql, config.getDialect()).transpiledAt(clock.instant());
    if (sql.isBlank()) {
      return result.finalSql(sql).duration(stopwatch.elapsed()).build();
    }

    List<Warning> warnings = new ArrayList<>();
    TranspileStage stage = TranspileStage.RENDERING;
    try {
      String current = sql;
      if (config.isTemplateRenderingEnabled()) {
        current = templateRenderer.render(current, templateContext);
      }

      stage = TranspileStage.EXPANDING;
      if (config.isMacroExpansionEnabled()) {
        current = expandMacros(current, config, result, warnings);
      }

      stage = TranspileStage.SUBSTITUTING;
      ParsedSql parsed = sqlParser.parse(current, config.getDialect());
      if (config.isTableSubstitutionEnabled()) {
        List<SubstitutionRule> rules = ImmutableList.of();
        RuleSet ruleSet = fetchRules(config, warnings);
        if (ruleSet != null) {
          rules = ruleSet.getRules();
          result.rulesVersion(ruleSet.getVersion());
        }
        SubstitutionResult substitution = substitutionPass.substitute(parsed, rules);
        current = substitution.getSql();
        result.appliedRules(substitution.getAppliedRules());
      }

      stage = TranspileStage.WARNING_SCAN;
      warnings.addAll(warningDetector.detect(parsed.getStatements()));
      if (config.isStrict()) {
        checkBlockingWarnings(warnings, config);
      }

      stage = TranspileStage.DONE;
      result.finalSql(current);
    } catch (TranspileException ex) {
      LOGGER.warn("Transpile failed during {} with {}: {}", stage, ex.getKind(), ex.getMessage());
      result.error(TranspileError.from(ex, stage));
    } catch (RuntimeException ex) {
      LOGGER.error("Unexpected error during {}", stage, ex);
      result.error(
          new TranspileError(
              ErrorKind.INTERNAL, "Unexpected error: " + ex, ex.getClass().getName(), stage));
    }

    TranspileResult transpileResult =
        result.warnings(warnings).duration(stopwatch.elapsed()).build();
    LOGGER.info(
        "Transpiled SQL for {} in {} ms: success={}, appliedRules={}, warnings={}",
        config.getDialect(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS),
        transpileResult.isSuccess(),
        transpileResult.getAppliedRuleIds(),
        transpileResult.getWarnings().size());
    return transpileResult;
  }

  /**
   * Checks SQL for syntax errors in the given dialect. Placeholders and METRIC() calls are not
   * processed.
   *
   * @param sql The SQL text.
   * @param dialect The dialect to parse with.
   * @return The parser diagnostics; empty if the SQL is valid.
   */
  public List<String> validate(String sql, Dialect dialect) {
    ValidationException.checkNotNull(sql, "SQL cannot be null");
    ValidationException.checkNotNull(dialect, "Dialect cannot be null");
    return sqlParser.validate(sql, dialect);
  }

  private String expandMacros(
      String sql, TranspileConfig config, TranspileResult.Builder result, List<Warning> warnings) {
    MacroExpansion expansion;
    try {
      expansion =
          macroExpander.expand(
              sql,
              name ->
                  fetchWithRetry(() -> ruleProvider.fetchMetric(name), config, "metric " + name));
    } catch (TranspileException ex) {
      if (config.isStrict() || !ex.getKind().isRecoverable()) {
        throw ex;
      }
      List<MacroMatch> matches = macroExpander.findMacros(sql);
      SourceLocation location = matches.isEmpty() ? null : matches.get(0).getLocation();
      LOGGER.warn("Leaving METRIC() unexpanded: {}", ex.getMessage());
      warnings.add(new Warning(WarningKind.MACRO_EXPANSION_ISSUE, ex.getMessage(), location));
      return sql;
    }
    result.expandedMetrics(expansion.getExpandedMetrics());
    return expansion.getSql();
  }

  private RuleSet fetchRules(TranspileConfig config, List<Warning> warnings) {
    try {
      return fetchWithRetry(
          () ->
              ValidationException.checkNotNull(
                  ruleProvider.fetchRules(), "Rule provider returned no rule set"),
          config,
          "substitution rules");
    } catch (TranspileException ex) {
      if (config.isStrict() || ex.getKind() != ErrorKind.RULE_FETCH) {
        throw ex;
      }
      LOGGER.warn("Substituting without rules: {}", ex.getMessage());
      warnings.add(
          new Warning(
              WarningKind.RULE_FETCH_DEGRADED,
              "Substitution rules unavailable, no table references were rewritten: "
                  + ex.getMessage()));
      return null;
    }
  }

  /**
   * Runs a fetch, retrying failures of kind RULE_FETCH up to the configured retry count. Any other
   * runtime exception thrown by the fetch counts as a RULE_FETCH failure.
   */
  private <T> T fetchWithRetry(Supplier<T> fetch, TranspileConfig config, String what) {
    int attempts = config.getRetryCount() + 1;
    TranspileException lastFailure = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return fetch.get();
      } catch (TranspileException ex) {
        if (ex.getKind() != ErrorKind.RULE_FETCH) {
          throw ex;
        }
        lastFailure = ex;
      } catch (RuntimeException ex) {
        lastFailure =
            new TranspileException(
                ErrorKind.RULE_FETCH, ex, "Failed to fetch %s: %s", what, ex.getMessage());
      }
      if (attempt < attempts) {
        LOGGER.warn(
            "Attempt {} of {} to fetch {} failed, retrying: {}",
            attempt,
            attempts,
            what,
            lastFailure.getMessage());
        backoff(config.getRetryBackoff(), attempt, what);
      }
    }
    throw new TranspileException(
        ErrorKind.RULE_FETCH,
        String.format(
            "Failed to fetch %s after %d attempts: %s", what, attempts, lastFailure.getMessage()),
        lastFailure.getDetail(),
        lastFailure);
  }

  private static void backoff(Duration retryBackoff, int attempt, String what) {
    if (retryBackoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(retryBackoff.multipliedBy(attempt).toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TranspileException(
          ErrorKind.RULE_FETCH, ex, "Interrupted while waiting to retry fetch of %s", what);
    }
  }

  private static void checkBlockingWarnings(List<Warning> warnings, TranspileConfig config) {
    for (Warning warning : warnings) {
      if (config.getBlockingWarningKinds().contains(warning.getKind())) {
        throw new TranspileException(
            ErrorKind.BLOCKING_WARNING,
            "Blocking warning in strict mode: " + warning,
            warning.getKind().name(),
            null);
      }
    }
  }

  /** Builder class for constructing TranspileEngine instances. */
  public static class Builder {
    private final RuleProvider ruleProvider;
    private Clock clock = Clock.systemDefaultZone();

    private Builder(RuleProvider ruleProvider) {
      this.ruleProvider =
          ValidationException.checkNotNull(ruleProvider, "Rule provider cannot be null.");
    }

    /**
     * Sets the clock used for the transpile timestamp and for date placeholders when the template
     * context has no execution date.
     *
     * @param clock The clock.
     * @return This Builder instance.
     */
    public Builder clock(Clock clock) {
      this.clock = ValidationException.checkNotNull(clock, "Clock cannot be null.");
      return this;
    }

    public TranspileEngine build() {
      return new TranspileEngine(this);
    }
  }
}
