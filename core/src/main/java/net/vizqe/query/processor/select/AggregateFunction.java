// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.query.processor.select;

/**
 * Aggregations a projected field may apply.
 */
public enum AggregateFunction {
  /** Sum of the numeric values in the group. */
  SUM("sum"),
  /** Number of rows in the group carrying the column. */
  COUNT("count"),
  /** Integer average of the numeric values in the group. */
  AVG("avg"),
  /** Number of distinct flows in the group. */
  FLOW_COUNT("flow_count");

  private final String label;

  AggregateFunction(final String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** @return True if partial results from different batches can be added. */
  public boolean isAdditive() {
    return this == SUM || this == COUNT;
  }

  /**
   * @param label A lower case function name.
   * @return The function or null if not known.
   */
  public static AggregateFunction fromLabel(final String label) {
    for (final AggregateFunction function : values()) {
      if (function.label.equals(label)) {
        return function;
      }
    }
    return null;
  }
}
