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
package com.dataops.sqlshift.provider;

import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.RuleSet;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A read-mostly cache in front of another {@link RuleProvider}. The rule snapshot is refreshed in
 * the background once it is older than the TTL; readers keep getting the previous snapshot until
 * the refresh completes, and a failed refresh keeps it. Metric definitions expire after the same
 * TTL and are dropped whenever a refreshed rule set reports a different version.
 */
public class CachingRuleProvider implements RuleProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(CachingRuleProvider.class);
  private static final String RULES_KEY = "rules";

  /** The default TTL of cached rules and metrics (5 minutes in seconds). */
  public static final long TTL_SECONDS_DEFAULT = 300L;

  /** The default maximum number of cached metric definitions. */
  public static final long MAX_METRICS_DEFAULT = 1_000L;

  private final RuleProvider delegate;
  private final LoadingCache<String, RuleSet> rulesCache;
  private final LoadingCache<String, MetricDefinition> metricsCache;
  private final AtomicReference<String> version = new AtomicReference<>();

  public CachingRuleProvider(RuleProvider delegate) {
    this(delegate, TTL_SECONDS_DEFAULT, MAX_METRICS_DEFAULT);
  }

  /**
   * Constructs a new CachingRuleProvider.
   *
   * @param delegate The provider to cache.
   * @param ttlSeconds The age in seconds after which entries are refreshed. Must be positive.
   * @param maxMetrics The maximum number of cached metric definitions. Must be positive.
   */
  public CachingRuleProvider(RuleProvider delegate, long ttlSeconds, long maxMetrics) {
    this(delegate, ttlSeconds, maxMetrics, Ticker.systemTicker(), ForkJoinPool.commonPool());
  }

  CachingRuleProvider(
      RuleProvider delegate, long ttlSeconds, long maxMetrics, Ticker ticker, Executor executor) {
    this.delegate = ValidationException.checkNotNull(delegate, "Delegate provider cannot be null");
    ValidationException.check(ttlSeconds > 0, "ttlSeconds is equal or less than 0");
    ValidationException.check(maxMetrics > 0, "maxMetrics is equal or less than 0");
    Duration ttl = Duration.ofSeconds(ttlSeconds);

    this.rulesCache =
        Caffeine.newBuilder()
            .refreshAfterWrite(ttl)
            .ticker(ticker)
            .executor(executor)
            .build(key -> loadRules());
    this.metricsCache =
        Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxMetrics)
            .ticker(ticker)
            .executor(executor)
            .removalListener(
                (name, definition, cause) ->
                    LOGGER.debug("Evicted metric {} from cache ({})", name, cause))
            .build(delegate::fetchMetric);
  }

  private RuleSet loadRules() {
    RuleSet ruleSet = delegate.fetchRules();
    String previous = version.getAndSet(ruleSet.getVersion());
    if (previous != null && !Objects.equals(previous, ruleSet.getVersion())) {
      LOGGER.info(
          "Rules version changed from {} to {}, invalidating cached metrics",
          previous,
          ruleSet.getVersion());
      metricsCache.invalidateAll();
    } else {
      LOGGER.debug(
          "Loaded {} rules at version {}", ruleSet.getRules().size(), ruleSet.getVersion());
    }
    return ruleSet;
  }

  @Override
  public RuleSet fetchRules() {
    return rulesCache.get(RULES_KEY);
  }

  @Override
  public MetricDefinition fetchMetric(String name) {
    ValidationException.checkNotNull(name, "Metric name cannot be null");
    return metricsCache.get(name);
  }

  /**
   * Gets the version of the most recently loaded rule set.
   *
   * @return The version, or null if no rules were loaded yet or the provider is unversioned.
   */
  public String currentVersion() {
    return version.get();
  }

  /** Drops every cached rule set and metric definition. */
  public void invalidateAll() {
    rulesCache.invalidateAll();
    metricsCache.invalidateAll();
  }
}
