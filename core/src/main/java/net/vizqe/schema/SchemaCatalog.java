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
package net.vizqe.schema;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.vizqe.common.Const;

/**
 * The fixed set of tables the engine can query. Standard tables have their
 * own schema; object tables are created per object type and all share one
 * schema. Built once at startup and never modified.
 */
public class SchemaCatalog implements SchemaProvider {

  /** The log collector table holding every generator's messages. */
  public static final String MESSAGE_TABLE = "MessageTable";

  /** One row per flow with its aggregate counters. */
  public static final String FLOW_RECORD_TABLE = "FlowRecordTable";

  /** Periodic flow samples. */
  public static final String FLOW_SERIES_TABLE = "FlowSeriesTable";

  /** Object identifiers per object table, keyed by the object table name. */
  public static final String OBJECT_VALUE_TABLE = "ObjectValueTable";

  /** The object tables registered at startup. */
  public static final ImmutableList<String> OBJECT_TABLES = ImmutableList.of(
      "ObjectVNTable",
      "ObjectVMTable",
      "ObjectVRouter",
      "ObjectBgpRouter",
      "ObjectXmppConnection",
      "ObjectCollectorInfo",
      "ObjectGeneratorInfo",
      "ObjectConfigNode",
      "ObjectQueryEngineInfo");

  private final ImmutableMap<String, TableSchema> tables;
  private final ImmutableMap<String, TableSchema> object_tables;

  /**
   * Ctor using the default row time bits.
   */
  public SchemaCatalog() {
    this(Const.ROW_TIME_IN_BITS);
  }

  /**
   * Default ctor.
   * @param row_time_bits The row time bits of every table.
   */
  public SchemaCatalog(final int row_time_bits) {
    final ImmutableMap.Builder<String, TableSchema> builder = 
        ImmutableMap.builder();
    builder.put(MESSAGE_TABLE, TableSchema.newBuilder()
        .setName(MESSAGE_TABLE)
        .setRowTimeBits(row_time_bits)
        .addColumn("MessageTS", Column.LONG, false)
        .addColumn("Source", Column.STRING, true)
        .addColumn(Const.MODULE, Column.STRING, true)
        .addColumn("Category", Column.STRING, true)
        .addColumn("Level", Column.INT, true)
        .addColumn("Type", Column.INT, true)
        .addColumn("Messagetype", Column.STRING, true)
        .addColumn("SequenceNum", Column.INT, false)
        .addColumn("Context", Column.STRING, false)
        .addColumn("Xmlmessage", Column.STRING, false)
        .build());

    builder.put(FLOW_RECORD_TABLE, flowTable(FLOW_RECORD_TABLE, row_time_bits)
        .addColumn("setup_time", Column.LONG, false)
        .addColumn("teardown_time", Column.LONG, false)
        .build());

    builder.put(FLOW_SERIES_TABLE, flowTable(FLOW_SERIES_TABLE, row_time_bits)
        .addColumn(Const.SELECT_TIME, Column.LONG, false)
        .addColumn(Const.SELECT_TIME_SERIES, Column.LONG, false)
        .addColumn(Const.SELECT_SUM_PACKETS, Column.LONG, false)
        .addColumn(Const.SELECT_SUM_BYTES, Column.LONG, false)
        .addColumn(Const.SELECT_AVG_PACKETS, Column.LONG, false)
        .addColumn(Const.SELECT_AVG_BYTES, Column.LONG, false)
        .addColumn(Const.SELECT_FLOW_COUNT, Column.LONG, false)
        .build());

    builder.put(OBJECT_VALUE_TABLE, TableSchema.newBuilder()
        .setName(OBJECT_VALUE_TABLE)
        .setRowTimeBits(row_time_bits)
        .addColumn(Const.OBJECT_ID, Column.STRING, true)
        .addColumn("MessageTS", Column.LONG, false)
        .addColumn("Source", Column.STRING, true)
        .addColumn(Const.MODULE, Column.STRING, true)
        .build());
    tables = builder.build();

    final TableSchema object_schema = TableSchema.newBuilder()
        .setName("ObjectTable")
        .setRowTimeBits(row_time_bits)
        .addColumn(Const.OBJECT_ID, Column.STRING, true)
        .addColumn("MessageTS", Column.LONG, false)
        .addColumn("Source", Column.STRING, true)
        .addColumn(Const.MODULE, Column.STRING, true)
        .addColumn("Messagetype", Column.STRING, false)
        .addColumn("ObjectLog", Column.STRING, false)
        .addColumn("SystemLog", Column.STRING, false)
        .build();
    final ImmutableMap.Builder<String, TableSchema> objects = 
        ImmutableMap.builder();
    for (final String table : OBJECT_TABLES) {
      objects.put(table, object_schema.rename(table));
    }
    object_tables = objects.build();
  }

  @Override
  public TableSchema lookupTable(final String name) {
    return tables.get(name);
  }

  @Override
  public TableSchema lookupObjectTable(final String name) {
    return object_tables.get(name);
  }

  /** @return The standard table names. */
  public Set<String> tableNames() {
    return tables.keySet();
  }

  /** @return The object tables by name. */
  public Map<String, TableSchema> objectTables() {
    return object_tables;
  }

  /**
   * @param table A resolved table name.
   * @return True if the table holds flow rows.
   */
  public static boolean isFlowTable(final String table) {
    return FLOW_RECORD_TABLE.equals(table) || FLOW_SERIES_TABLE.equals(table);
  }

  /** Columns shared by both flow tables. */
  private static TableSchema.Builder flowTable(final String name,
                                               final int row_time_bits) {
    return TableSchema.newBuilder()
        .setName(name)
        .setRowTimeBits(row_time_bits)
        .addColumn("UuidKey", Column.UUID, false)
        .addColumn("vrouter", Column.STRING, true)
        .addColumn("sourcevn", Column.STRING, true)
        .addColumn("sourceip", Column.IPADDR, true)
        .addColumn("destvn", Column.STRING, true)
        .addColumn("destip", Column.IPADDR, true)
        .addColumn("protocol", Column.INT, true)
        .addColumn("sport", Column.INT, true)
        .addColumn("dport", Column.INT, true)
        .addColumn("direction_ing", Column.INT, false)
        .addColumn("short_flow", Column.INT, false)
        .addColumn(Const.SELECT_PACKETS, Column.LONG, false)
        .addColumn(Const.SELECT_BYTES, Column.LONG, false);
  }
}
