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
 * Classification of a flow series projection by which families of fields
 * it selects: time, flow tuple and statistics.
 */
public enum FlowSeriesQueryType {
  TIME,
  FLOW_TUPLE,
  STATS,
  FLOW_TUPLE_STATS,
  TIME_FLOW_TUPLE,
  TIME_STATS,
  TIME_FLOW_TUPLE_STATS;

  /**
   * @param time Whether T or T= is selected.
   * @param tuple Whether a flow tuple field is selected.
   * @param stats Whether a statistics field is selected.
   * @return The type, null if nothing of interest was selected.
   */
  public static FlowSeriesQueryType classify(final boolean time,
                                             final boolean tuple,
                                             final boolean stats) {
    if (time) {
      if (tuple && stats) {
        return TIME_FLOW_TUPLE_STATS;
      } else if (tuple) {
        return TIME_FLOW_TUPLE;
      } else if (stats) {
        return TIME_STATS;
      }
      return TIME;
    }
    if (tuple && stats) {
      return FLOW_TUPLE_STATS;
    } else if (tuple) {
      return FLOW_TUPLE;
    } else if (stats) {
      return STATS;
    }
    return null;
  }
}
