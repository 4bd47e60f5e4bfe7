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

/** The closed set of advisories the engine reports. */
public enum WarningKind {
  /** An unqualified wildcard projection without any row limit. */
  UNBOUNDED_SELECT,
  /** A top-level SELECT without a row-limiting clause. */
  MISSING_LIMIT,
  /** DROP, TRUNCATE, or DELETE/UPDATE without a WHERE clause. */
  DANGEROUS_STATEMENT,
  /** The same CTE name declared twice in one WITH clause. */
  DUPLICATE_CTE,
  /** A METRIC() call was left unexpanded in graceful mode. */
  MACRO_EXPANSION_ISSUE,
  /** Substitution rules could not be fetched and no rules were applied. */
  RULE_FETCH_DEGRADED
}
