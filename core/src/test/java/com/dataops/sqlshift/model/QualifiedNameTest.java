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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dataops.sqlshift.common.ValidationException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class QualifiedNameTest {

  @Test
  void testParse() {
    assertThat(QualifiedName.parse("hive.raw.events").getParts())
        .containsExactly("hive", "raw", "events");
    assertThat(QualifiedName.parse("\"My Schema\".events").getParts())
        .containsExactly("My Schema", "events");
    assertThat(QualifiedName.parse("`my-project.ds.t`").getParts())
        .containsExactly("my-project", "ds", "t");
  }

  @Test
  void testParseRejectsMalformedNames() {
    assertThatThrownBy(() -> QualifiedName.parse(" "))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> QualifiedName.parse("raw..events"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> QualifiedName.parse("\"raw.events"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Unclosed quote");
  }

  @Test
  void testFromRawPartsSkipsMissingQualifiers() {
    QualifiedName name = QualifiedName.fromRawParts(Arrays.asList(null, "\"Raw\"", "events"));

    assertThat(name.getParts()).containsExactly("Raw", "events");
    assertThat(name.size()).isEqualTo(2);
  }

  @Test
  void testEndsWithIgnoresCase() {
    QualifiedName name = QualifiedName.parse("hive.RAW.events");

    assertThat(name.endsWith(QualifiedName.parse("raw.events"))).isTrue();
    assertThat(name.endsWith(QualifiedName.parse("EVENTS"))).isTrue();
    assertThat(name.endsWith(QualifiedName.parse("other.events"))).isFalse();
    assertThat(QualifiedName.parse("events").endsWith(name)).isFalse();
  }

  @Test
  void testEqualsAndHashCode() {
    QualifiedName lower = QualifiedName.parse("raw.events");
    QualifiedName upper = QualifiedName.parse("RAW.EVENTS");

    assertThat(lower).isEqualTo(upper).hasSameHashCodeAs(upper);
    assertThat(lower).isNotEqualTo(QualifiedName.parse("events"));
  }

  @Test
  void testRender() {
    QualifiedName name = QualifiedName.parse("`my-project`.ds.events");

    assertThat(name.render(Dialect.BIGQUERY)).isEqualTo("`my-project`.ds.events");
    assertThat(name.render(Dialect.TRINO)).isEqualTo("\"my-project\".ds.events");
    assertThat(name).hasToString("my-project.ds.events");
  }
}
