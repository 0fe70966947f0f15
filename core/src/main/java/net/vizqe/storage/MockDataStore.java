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
package net.vizqe.storage;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.vizqe.common.Const;
import net.vizqe.data.FlowStats;
import net.vizqe.data.FlowTuple;
import net.vizqe.data.RecordShape;
import net.vizqe.data.RowValue;
import net.vizqe.data.StorageRow;
import net.vizqe.schema.SchemaCatalog;

/**
 * A simple store holding rows in memory. Flow rows are kept with the full
 * STATS_TUPLE payload and cut down to the shape a scan asks for; every
 * other row is kept with a PLAIN payload. It's meant for testing pipelines.
 */
public class MockDataStore implements DataStore {
  private static final Logger LOG = LoggerFactory.getLogger(MockDataStore.class);

  /** The super inefficient and thread unsafe in-memory db. */
  private final Map<String, List<StorageRow>> database;

  private long analytics_start_time = -1;

  public MockDataStore() {
    database = Maps.newHashMap();
  }

  /** @param analytics_start_time In microseconds, negative if unknown. */
  public void setAnalyticsStartTime(final long analytics_start_time) {
    this.analytics_start_time = analytics_start_time;
  }

  @Override
  public long analyticsStartTime() {
    return analytics_start_time;
  }

  /**
   * Stores a row as is.
   * @param table The table.
   * @param key The key within the table, null for none.
   * @param row The row.
   */
  public synchronized void addRow(final String table,
                                  final String key,
                                  final StorageRow row) {
    List<StorageRow> rows = database.get(storageKey(table, key));
    if (rows == null) {
      rows = Lists.newArrayList();
      database.put(storageKey(table, key), rows);
    }
    rows.add(row);
  }

  /**
   * Stores a log message.
   * @return The message UUID.
   */
  public UUID addMessage(final long timestamp,
                         final String source,
                         final String module,
                         final String messagetype,
                         final long level) {
    final UUID uuid = UUID.randomUUID();
    addRow(SchemaCatalog.MESSAGE_TABLE, null, StorageRow.newBuilder()
        .setTimestamp(timestamp)
        .addColumn("MessageTS", RowValue.ofTimestamp(timestamp))
        .addColumn("Source", RowValue.ofString(source))
        .addColumn(Const.MODULE, RowValue.ofString(module))
        .addColumn("Messagetype", RowValue.ofString(messagetype))
        .addColumn("Level", RowValue.ofLong(level))
        .addInfo(RowValue.ofUuid(uuid))
        .build());
    return uuid;
  }

  /**
   * Stores one flow sample in the given flow table.
   * @param table FlowSeriesTable or FlowRecordTable.
   * @param timestamp The sample time.
   * @param uuid The flow.
   * @param stats The counters.
   * @param tuple The flow tuple and direction.
   */
  public void addFlow(final String table,
                      final long timestamp,
                      final UUID uuid,
                      final FlowStats stats,
                      final FlowTuple tuple) {
    addRow(table, null, StorageRow.newBuilder()
        .setTimestamp(timestamp)
        .addColumn("vrouter", RowValue.ofString(tuple.vrouter()))
        .addColumn("sourcevn", RowValue.ofString(tuple.sourceVn()))
        .addColumn("destvn", RowValue.ofString(tuple.destVn()))
        .addColumn("sourceip", RowValue.ofString(tuple.sourceIp()))
        .addColumn("destip", RowValue.ofString(tuple.destIp()))
        .addColumn("protocol", RowValue.ofLong(tuple.protocol()))
        .addColumn("sport", RowValue.ofLong(tuple.sourcePort()))
        .addColumn("dport", RowValue.ofLong(tuple.destPort()))
        .addColumn("direction_ing", RowValue.ofLong(tuple.direction()))
        .addInfo(RowValue.ofUnsigned(stats.bytes()))
        .addInfo(RowValue.ofUnsigned(stats.packets()))
        .addInfo(RowValue.ofLong(stats.isShortFlow() ? 1 : 0))
        .addInfo(RowValue.ofUuid(uuid))
        .addInfo(RowValue.ofString(tuple.vrouter()))
        .addInfo(RowValue.ofString(tuple.sourceVn()))
        .addInfo(RowValue.ofString(tuple.destVn()))
        .addInfo(RowValue.ofString(tuple.sourceIp()))
        .addInfo(RowValue.ofString(tuple.destIp()))
        .addInfo(RowValue.ofLong(tuple.protocol()))
        .addInfo(RowValue.ofLong(tuple.sourcePort()))
        .addInfo(RowValue.ofLong(tuple.destPort()))
        .addInfo(RowValue.ofLong(tuple.direction()))
        .build());
  }

  /**
   * Stores an object log in its object table and records the object id in
   * the object value table.
   */
  public void addObjectLog(final String table,
                           final long timestamp,
                           final String object_id,
                           final String source,
                           final String module) {
    final UUID uuid = UUID.randomUUID();
    addRow(table, null, StorageRow.newBuilder()
        .setTimestamp(timestamp)
        .addColumn(Const.OBJECT_ID, RowValue.ofString(object_id))
        .addColumn("MessageTS", RowValue.ofTimestamp(timestamp))
        .addColumn("Source", RowValue.ofString(source))
        .addColumn(Const.MODULE, RowValue.ofString(module))
        .addInfo(RowValue.ofUuid(uuid))
        .build());
    addRow(SchemaCatalog.OBJECT_VALUE_TABLE, table, StorageRow.newBuilder()
        .setTimestamp(timestamp)
        .addColumn(Const.OBJECT_ID, RowValue.ofString(object_id))
        .addColumn("MessageTS", RowValue.ofTimestamp(timestamp))
        .addColumn("Source", RowValue.ofString(source))
        .addColumn(Const.MODULE, RowValue.ofString(module))
        .addInfo(RowValue.ofUuid(uuid))
        .build());
  }

  @Override
  public synchronized Scanner scan(final ScanRequest request) {
    final List<StorageRow> stored = database.get(
        storageKey(request.table(), request.key()));
    final List<StorageRow> rows = Lists.newArrayList();
    if (stored != null) {
      for (final StorageRow row : stored) {
        if (!request.window().contains(row.timestamp())) {
          continue;
        }
        if (request.filter() != null 
            && !request.filter().matches(row.columns())) {
          continue;
        }
        rows.add(reshape(row, request.shape()));
      }
    }
    Collections.sort(rows, new Comparator<StorageRow>() {
      @Override
      public int compare(final StorageRow a, final StorageRow b) {
        return Long.compare(a.timestamp(), b.timestamp());
      }
    });
    if (LOG.isDebugEnabled()) {
      LOG.debug("Scan " + request + " matched " + rows.size() + " rows");
    }
    return new ListScanner(rows);
  }

  /**
   * Cuts a full flow payload down to the requested shape. Payloads shorter
   * than the shape are returned as stored.
   */
  private static StorageRow reshape(final StorageRow row, 
                                    final RecordShape shape) {
    final List<RowValue> info = row.info();
    if (info.size() < RecordShape.STATS_TUPLE.width() 
        || shape == RecordShape.STATS_TUPLE) {
      return row;
    }
    final List<RowValue> payload = shape == RecordShape.PLAIN 
        ? ImmutableList.of(info.get(3)) 
        : info.subList(0, RecordShape.STATS.width());
    return StorageRow.newBuilder()
        .setTimestamp(row.timestamp())
        .addColumns(row.columns())
        .addInfo(payload)
        .build();
  }

  private static String storageKey(final String table, final String key) {
    return key == null ? table : table + "/" + key;
  }

  /** Iterates over a snapshot of rows. */
  private static class ListScanner extends Scanner {
    private final Iterator<StorageRow> iterator;

    ListScanner(final List<StorageRow> rows) {
      iterator = rows.iterator();
    }

    @Override
    public boolean hasNext() {
      return iterator.hasNext();
    }

    @Override
    public StorageRow next() {
      if (!iterator.hasNext()) {
        throw new NoSuchElementException();
      }
      return iterator.next();
    }
  }
}
