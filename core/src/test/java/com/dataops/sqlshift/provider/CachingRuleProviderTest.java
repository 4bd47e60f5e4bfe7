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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.RuleSet;
import com.dataops.sqlshift.model.SubstitutionRule;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CachingRuleProviderTest {
  private static final long TTL_SECONDS = 60;

  @Mock private RuleProvider mockDelegate;

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;
  private CachingRuleProvider provider;

  @BeforeEach
  void setUp() {
    provider = new CachingRuleProvider(mockDelegate, TTL_SECONDS, 100, ticker, Runnable::run);
  }

  private static RuleSet rules(String version, String source) {
    return new RuleSet(List.of(SubstitutionRule.builder(source, "wh.t").build()), version);
  }

  private void advance(long seconds) {
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
  }

  @Test
  void testConstructorWithInvalidParameters() {
    assertThatThrownBy(() -> new CachingRuleProvider(mockDelegate, 0, 10))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("ttlSeconds");
    assertThatThrownBy(() -> new CachingRuleProvider(mockDelegate, 10, 0))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("maxMetrics");
    assertThatThrownBy(() -> new CachingRuleProvider(null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testRulesAreServedFromCache() {
    RuleSet ruleSet = rules("v1", "raw.a");
    when(mockDelegate.fetchRules()).thenReturn(ruleSet);

    assertThat(provider.fetchRules()).isSameAs(ruleSet);
    advance(TTL_SECONDS - 1);
    assertThat(provider.fetchRules()).isSameAs(ruleSet);

    verify(mockDelegate, times(1)).fetchRules();
    assertThat(provider.currentVersion()).isEqualTo("v1");
  }

  @Test
  void testRulesAreRefreshedAfterTtl() {
    RuleSet first = rules("v1", "raw.a");
    RuleSet second = rules("v1", "raw.b");
    when(mockDelegate.fetchRules()).thenReturn(first, second);

    provider.fetchRules();
    advance(TTL_SECONDS + 1);
    provider.fetchRules();

    assertThat(provider.fetchRules()).isSameAs(second);
    verify(mockDelegate, times(2)).fetchRules();
  }

  @Test
  void testFailedRefreshKeepsPreviousSnapshot() {
    RuleSet first = rules("v1", "raw.a");
    when(mockDelegate.fetchRules())
        .thenReturn(first)
        .thenThrow(new TranspileException(ErrorKind.RULE_FETCH, "service down"));

    provider.fetchRules();
    advance(TTL_SECONDS + 1);

    assertThat(provider.fetchRules()).isSameAs(first);
    assertThat(provider.fetchRules()).isSameAs(first);
    assertThat(provider.currentVersion()).isEqualTo("v1");
  }

  @Test
  void testInitialFailurePropagates() {
    when(mockDelegate.fetchRules())
        .thenThrow(new TranspileException(ErrorKind.RULE_FETCH, "service down"));

    assertThatThrownBy(() -> provider.fetchRules())
        .isInstanceOf(TranspileException.class)
        .hasMessage("service down");
  }

  @Test
  void testMetricsAreCachedPerName() {
    MetricDefinition revenue = MetricDefinition.builder("revenue", "SUM(amount)").build();
    when(mockDelegate.fetchMetric("revenue")).thenReturn(revenue);

    assertThat(provider.fetchMetric("revenue")).isSameAs(revenue);
    assertThat(provider.fetchMetric("revenue")).isSameAs(revenue);
    verify(mockDelegate, times(1)).fetchMetric("revenue");

    advance(TTL_SECONDS + 1);
    assertThat(provider.fetchMetric("revenue")).isSameAs(revenue);
    verify(mockDelegate, times(2)).fetchMetric("revenue");
  }

  @Test
  void testMetricNotFoundIsNotCached() {
    MetricDefinition dau = MetricDefinition.builder("dau", "COUNT(*)").build();
    when(mockDelegate.fetchMetric("dau"))
        .thenThrow(new TranspileException(ErrorKind.METRIC_NOT_FOUND, "Metric 'dau' not found"))
        .thenReturn(dau);

    assertThatThrownBy(() -> provider.fetchMetric("dau")).isInstanceOf(TranspileException.class);
    assertThat(provider.fetchMetric("dau")).isSameAs(dau);
  }

  @Test
  void testNewRulesVersionInvalidatesMetrics() {
    when(mockDelegate.fetchRules()).thenReturn(rules("v1", "raw.a"), rules("v2", "raw.a"));
    MetricDefinition oldRevenue = MetricDefinition.builder("revenue", "SUM(amount)").build();
    MetricDefinition newRevenue = MetricDefinition.builder("revenue", "SUM(net_amount)").build();
    when(mockDelegate.fetchMetric("revenue")).thenReturn(oldRevenue, newRevenue);

    provider.fetchRules();
    advance(TTL_SECONDS - 10);
    assertThat(provider.fetchMetric("revenue")).isSameAs(oldRevenue);

    // Rules are due for refresh while the cached metric is still fresh.
    advance(15);
    provider.fetchRules();

    assertThat(provider.currentVersion()).isEqualTo("v2");
    assertThat(provider.fetchMetric("revenue")).isSameAs(newRevenue);
  }

  @Test
  void testSameVersionKeepsMetrics() {
    when(mockDelegate.fetchRules()).thenReturn(rules("v1", "raw.a"), rules("v1", "raw.b"));
    MetricDefinition revenue = MetricDefinition.builder("revenue", "SUM(amount)").build();
    when(mockDelegate.fetchMetric("revenue")).thenReturn(revenue);

    provider.fetchRules();
    advance(TTL_SECONDS - 10);
    provider.fetchMetric("revenue");
    advance(15);
    provider.fetchRules();
    provider.fetchMetric("revenue");

    verify(mockDelegate, times(2)).fetchRules();
    verify(mockDelegate, times(1)).fetchMetric("revenue");
  }

  @Test
  void testInvalidateAll() {
    when(mockDelegate.fetchRules()).thenReturn(rules("v1", "raw.a"));

    provider.fetchRules();
    provider.invalidateAll();
    provider.fetchRules();

    verify(mockDelegate, times(2)).fetchRules();
  }
}
