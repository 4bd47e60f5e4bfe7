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
package com.dataops.sqlshift.macro;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.SourceLocation;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MacroExpanderTest {
  private static final MetricDefinition REVENUE =
      MetricDefinition.builder("revenue", "SUM(amount * quantity)").build();

  @Mock private MetricLookup mockLookup;

  private final MacroExpander expander = new MacroExpander();

  @Test
  void testExpandReplacesOnlyTheCall() {
    when(mockLookup.lookup("revenue")).thenReturn(REVENUE);
    String sql = "SELECT region, METRIC(revenue) AS total FROM sales GROUP BY region";

    MacroExpansion expansion = expander.expand(sql, mockLookup);

    assertThat(expansion.getSql())
        .isEqualTo("SELECT region, SUM(amount * quantity) AS total FROM sales GROUP BY region");
    assertThat(expansion.getExpandedMetrics()).containsExactly("revenue");
  }

  @Test
  void testExpressionIsInsertedVerbatim() {
    when(mockLookup.lookup("net"))
        .thenReturn(MetricDefinition.builder("net", "SUM(gross) - SUM(refund)").build());

    MacroExpansion expansion = expander.expand("SELECT METRIC(net) / 2 AS half FROM t", mockLookup);

    assertThat(expansion.getSql()).isEqualTo("SELECT SUM(gross) - SUM(refund) / 2 AS half FROM t");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "METRIC(revenue)", "metric( revenue )", "Metric('revenue')", "METRIC (\"revenue\")"
      })
  void testCallForms(String call) {
    when(mockLookup.lookup("revenue")).thenReturn(REVENUE);

    MacroExpansion expansion = expander.expand("SELECT " + call + " FROM t", mockLookup);

    assertThat(expansion.getSql()).isEqualTo("SELECT SUM(amount * quantity) FROM t");
  }

  @Test
  void testSqlWithoutMacroIsUnchanged() {
    String sql = "SELECT my_metric(x), metrics FROM t";

    MacroExpansion expansion = expander.expand(sql, mockLookup);

    assertThat(expansion.getSql()).isSameAs(sql);
    assertThat(expansion.getExpandedMetrics()).isEmpty();
    verify(mockLookup, never()).lookup(anyString());
  }

  @Test
  void testSecondMacroExceedsLimitBeforeLookup() {
    String sql = "SELECT METRIC(revenue), METRIC(dau) FROM t";

    assertThatThrownBy(() -> expander.expand(sql, mockLookup))
        .isInstanceOf(TranspileException.class)
        .hasMessageContaining("at most 1")
        .extracting(ex -> ((TranspileException) ex).getKind())
        .isEqualTo(ErrorKind.MACRO_LIMIT_EXCEEDED);
    verify(mockLookup, never()).lookup(anyString());
  }

  @Test
  void testUnknownMetric() {
    when(mockLookup.lookup("churn")).thenReturn(null);

    assertThatThrownBy(() -> expander.expand("SELECT METRIC(churn) FROM t", mockLookup))
        .isInstanceOf(TranspileException.class)
        .hasMessageContaining("churn")
        .satisfies(
            ex -> {
              TranspileException transpileException = (TranspileException) ex;
              assertThat(transpileException.getKind()).isEqualTo(ErrorKind.METRIC_NOT_FOUND);
              assertThat(transpileException.getDetail()).isEqualTo("churn");
            });
  }

  @Test
  void testLookupFailurePropagates() {
    TranspileException failure = new TranspileException(ErrorKind.RULE_FETCH, "down");
    when(mockLookup.lookup("revenue")).thenThrow(failure);

    assertThatThrownBy(() -> expander.expand("SELECT METRIC(revenue)", mockLookup))
        .isSameAs(failure);
  }

  @Test
  void testFindMacrosReportsLocations() {
    String sql = "SELECT\n  METRIC(revenue),\n  metric('dau')\nFROM t";

    List<MacroMatch> matches = expander.findMacros(sql);

    assertThat(matches).extracting(MacroMatch::getMetricName).containsExactly("revenue", "dau");
    assertThat(matches.get(0).getLocation()).isEqualTo(new SourceLocation(2, 3));
    assertThat(matches.get(1).getLocation()).isEqualTo(new SourceLocation(3, 3));
    assertThat(matches.get(1).getText()).isEqualTo("metric('dau')");
    assertThat(sql.substring(matches.get(0).getStart(), matches.get(0).getEnd()))
        .isEqualTo("METRIC(revenue)");
  }

  @Test
  void testMacroInsideStringLiteralIsStillExpanded() {
    when(mockLookup.lookup("revenue")).thenReturn(REVENUE);

    MacroExpansion expansion = expander.expand("SELECT 'METRIC(revenue)'", mockLookup);

    assertThat(expansion.getSql()).isEqualTo("SELECT 'SUM(amount * quantity)'");
  }
}
