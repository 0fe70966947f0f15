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
package net.vizqe.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Constants shared by the query engine and its collaborators.
 */
public final class Const {

  /** UTF-8 for everything that crosses the wire. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

  /** Number of bits of a row timestamp that fall inside one storage row.
   * The smallest time window a table can address is 1 &lt;&lt; this value
   * microseconds. */
  public static final int ROW_TIME_IN_BITS = 23;

  /** Microseconds in a second. */
  public static final long MICROS_PER_SECOND = 1000000L;

  // Query term keys ---------------------------------------------------------

  public static final String QUERY_TABLE = "table";
  public static final String QUERY_START_TIME = "start_time";
  public static final String QUERY_END_TIME = "end_time";
  public static final String QUERY_FLOW_DIR = "dir";
  public static final String QUERY_WHERE = "where";
  public static final String QUERY_SELECT = "select_fields";
  public static final String QUERY_SORT_FIELDS = "sort_fields";
  public static final String QUERY_SORT_OP = "sort";
  public static final String QUERY_LIMIT = "limit";
  public static final String QUERY_FILTER = "filter";

  // Keys within WHERE and filter match objects.
  public static final String WHERE_MATCH_NAME = "name";
  public static final String WHERE_MATCH_VALUE = "value";
  public static final String WHERE_MATCH_VALUE2 = "value2";
  public static final String WHERE_MATCH_OP = "op";

  // Well known columns ------------------------------------------------------

  /** The generator module column of log and object tables. */
  public static final String MODULE = "Module";

  /** The object identifier column of object tables. */
  public static final String OBJECT_ID = "ObjectId";

  /** The raw row timestamp pseudo column. */
  public static final String SELECT_TIME = "T";

  /** Prefix of the time-series bucket pseudo column, e.g. "T=60". */
  public static final String SELECT_TIME_SERIES = "T=";

  public static final String SELECT_FLOW_COUNT = "flow_count";
  public static final String SELECT_PACKETS = "packets";
  public static final String SELECT_BYTES = "bytes";
  public static final String SELECT_SUM_PACKETS = "sum(packets)";
  public static final String SELECT_SUM_BYTES = "sum(bytes)";
  public static final String SELECT_AVG_PACKETS = "avg(packets)";
  public static final String SELECT_AVG_BYTES = "avg(bytes)";

  /** Flow direction codes for the "dir" term. */
  public static final int FLOW_DIR_EGRESS = 0;
  public static final int FLOW_DIR_INGRESS = 1;

  private Const() { }
}
