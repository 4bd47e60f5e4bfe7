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

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.RuleSet;
import com.dataops.sqlshift.model.SubstitutionRule;
import org.junit.jupiter.api.Test;

class InMemoryRuleProviderTest {

  @Test
  void testFetchRulesKeepsInsertionOrder() {
    SubstitutionRule disabled =
        SubstitutionRule.builder("legacy.orders", "wh.orders").enabled(false).build();
    InMemoryRuleProvider provider =
        InMemoryRuleProvider.builder()
            .addRule("raw.events", "wh.events_v2")
            .addRule(disabled)
            .addRule("analytics.users", "analytics.users_v2")
            .version("v7")
            .build();

    RuleSet ruleSet = provider.fetchRules();

    assertThat(ruleSet.getVersion()).isEqualTo("v7");
    assertThat(ruleSet.getRules())
        .extracting(SubstitutionRule::getId)
        .containsExactly("raw.events", "legacy.orders", "analytics.users");
    assertThat(ruleSet.getRules().get(1)).isSameAs(disabled);
  }

  @Test
  void testFetchMetric() {
    InMemoryRuleProvider provider =
        InMemoryRuleProvider.builder().addMetric("revenue", "SUM(amount)").build();

    assertThat(provider.fetchMetric("revenue").getExpression()).isEqualTo("SUM(amount)");
  }

  @Test
  void testFetchMetricIsCaseSensitive() {
    InMemoryRuleProvider provider =
        InMemoryRuleProvider.builder()
            .addMetric("revenue", "SUM(amount)")
            .addMetric("dau", "COUNT(DISTINCT user_id)")
            .build();

    assertThatThrownBy(() -> provider.fetchMetric("Revenue"))
        .isInstanceOf(TranspileException.class)
        .hasMessageContaining("Revenue")
        .hasMessageContaining("revenue, dau")
        .satisfies(
            ex -> {
              TranspileException transpileException = (TranspileException) ex;
              assertThat(transpileException.getKind()).isEqualTo(ErrorKind.METRIC_NOT_FOUND);
              assertThat(transpileException.getDetail()).isEqualTo("Revenue");
            });
  }

  @Test
  void testDuplicateMetricIsRejected() {
    InMemoryRuleProvider.Builder builder =
        InMemoryRuleProvider.builder().addMetric("revenue", "SUM(amount)");

    assertThatThrownBy(() -> builder.addMetric("revenue", "SUM(price)"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Duplicate metric revenue");
  }

  @Test
  void testEmptyProvider() {
    InMemoryRuleProvider provider = InMemoryRuleProvider.builder().build();

    assertThat(provider.fetchRules().getRules()).isEmpty();
    assertThat(provider.fetchRules().getVersion()).isNull();
    assertThatThrownBy(() -> provider.fetchMetric("x")).hasMessageContaining("none");
  }
}
