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
package net.vizqe.query;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.google.common.collect.Maps;

import net.vizqe.common.Const;
import net.vizqe.data.Extraction;
import net.vizqe.data.FlowStats;
import net.vizqe.data.FlowTuple;
import net.vizqe.data.RecordShape;
import net.vizqe.data.RowValue;
import net.vizqe.data.StorageRow;
import net.vizqe.data.ValueType;
import net.vizqe.exceptions.QueryAssertionException;

/**
 * Typed accessors over the positional payload of a storage row, and the
 * decoding of a whole row into named fields.
 */
public final class RecordReader {

  public static final String UUID_KEY = "UuidKey";
  public static final String SHORT_FLOW = "short_flow";
  public static final String DIRECTION = "direction_ing";

  private RecordReader() { }

  /**
   * Decodes a storage row into its named fields: the indexed columns plus
   * the payload values of the shape.
   * @param shape The shape the payload was requested in.
   * @param row The row.
   * @return The fields by name.
   * @throws QueryAssertionException if the payload does not match the shape.
   */
  public static Map<String, RowValue> read(final RecordShape shape,
                                           final StorageRow row) {
    final Map<String, RowValue> fields = Maps.newHashMap(row.columns());
    final List<RowValue> info = row.info();
    switch (shape) {
    case PLAIN:
      fields.put(UUID_KEY, RowValue.ofUuid(check(uuid(info, 0))));
      break;
    case STATS:
    case STATS_TUPLE:
      final FlowStats stats = check(stats(info));
      fields.put(Const.SELECT_BYTES, RowValue.ofUnsigned(stats.bytes()));
      fields.put(Const.SELECT_PACKETS, RowValue.ofUnsigned(stats.packets()));
      fields.put(SHORT_FLOW, RowValue.ofLong(stats.isShortFlow() ? 1 : 0));
      fields.put(UUID_KEY, RowValue.ofUuid(check(uuid(info, 3))));
      if (shape == RecordShape.STATS_TUPLE) {
        final FlowTuple tuple = check(tuple(info));
        fields.put("vrouter", RowValue.ofString(tuple.vrouter()));
        fields.put("sourcevn", RowValue.ofString(tuple.sourceVn()));
        fields.put("destvn", RowValue.ofString(tuple.destVn()));
        fields.put("sourceip", RowValue.ofString(tuple.sourceIp()));
        fields.put("destip", RowValue.ofString(tuple.destIp()));
        fields.put("protocol", RowValue.ofLong(tuple.protocol()));
        fields.put("sport", RowValue.ofLong(tuple.sourcePort()));
        fields.put("dport", RowValue.ofLong(tuple.destPort()));
        fields.put(DIRECTION, RowValue.ofLong(tuple.direction()));
      }
      break;
    default:
      throw new IllegalStateException("Unhandled shape: " + shape);
    }
    return fields;
  }

  /**
   * @param info The payload.
   * @param position Where the UUID sits for the shape.
   * @return The flow or message UUID.
   */
  public static Extraction<UUID> uuid(final List<RowValue> info,
                                      final int position) {
    final RowValue value = at(info, position);
    if (value == null || value.type() != ValueType.UUID) {
      return Extraction.mismatch(position, ValueType.UUID, value);
    }
    return Extraction.of(value.uuidValue());
  }

  /**
   * @param info A STATS or STATS_TUPLE payload.
   * @return Bytes, packets and the short flow flag.
   */
  public static Extraction<FlowStats> stats(final List<RowValue> info) {
    final Extraction<Long> bytes = number(info, 0, ValueType.UINT64);
    if (!bytes.isValid()) {
      return Extraction.failed(bytes);
    }
    final Extraction<Long> packets = number(info, 1, ValueType.UINT64);
    if (!packets.isValid()) {
      return Extraction.failed(packets);
    }
    final Extraction<Long> short_flow = number(info, 2, ValueType.INT64);
    if (!short_flow.isValid()) {
      return Extraction.failed(short_flow);
    }
    return Extraction.of(new FlowStats(bytes.value(), packets.value(), 
        short_flow.value() == 1));
  }

  /**
   * @param info A STATS_TUPLE payload.
   * @return The flow tuple and direction.
   */
  public static Extraction<FlowTuple> tuple(final List<RowValue> info) {
    final String[] strings = new String[5];
    for (int i = 0; i < strings.length; i++) {
      final RowValue value = at(info, 4 + i);
      if (value == null || value.type() != ValueType.STRING) {
        return Extraction.mismatch(4 + i, ValueType.STRING, value);
      }
      strings[i] = value.asString();
    }
    final long[] numbers = new long[4];
    for (int i = 0; i < numbers.length; i++) {
      final Extraction<Long> number = number(info, 9 + i, ValueType.INT64);
      if (!number.isValid()) {
        return Extraction.failed(number);
      }
      numbers[i] = number.value();
    }
    return Extraction.of(new FlowTuple(strings[0], strings[1], strings[2], 
        strings[3], strings[4], numbers[0], numbers[1], numbers[2], 
        numbers[3]));
  }

  private static Extraction<Long> number(final List<RowValue> info,
                                         final int position,
                                         final ValueType type) {
    final RowValue value = at(info, position);
    if (value == null || value.type() != type) {
      return Extraction.mismatch(position, type, value);
    }
    return Extraction.of(value.longValue());
  }

  private static RowValue at(final List<RowValue> info, final int position) {
    return position < info.size() ? info.get(position) : null;
  }

  private static <T> T check(final Extraction<T> extraction) {
    if (!extraction.isValid()) {
      throw new QueryAssertionException(extraction.error());
    }
    return extraction.value();
  }
}
