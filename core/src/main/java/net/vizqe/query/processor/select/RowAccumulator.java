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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.vizqe.common.Const;
import net.vizqe.data.ResultBuffer;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.data.ValueType;

/**
 * Collects the rows that passed the WHERE stage and turns them into result
 * rows. Plain projections emit one row per input; aggregating projections
 * group on the non-aggregated values, time bucket included, in order of
 * first appearance.
 * <p>
 * Not thread safe.
 */
public class RowAccumulator {

  private final ProjectionSpec projection;
  private final String name;
  private final long origin;
  private final List<ResultRow> rows;
  private final Map<List<RowValue>, Aggregate[]> groups;

  RowAccumulator(final ProjectionSpec projection,
                 final String name,
                 final long origin) {
    this.projection = projection;
    this.name = name;
    this.origin = origin;
    rows = Lists.newArrayList();
    groups = Maps.newLinkedHashMap();
  }

  /**
   * @param timestamp The row timestamp in microseconds.
   * @param row The decoded row fields.
   */
  public void add(final long timestamp, final Map<String, RowValue> row) {
    final List<ProjectionField> fields = projection.fields();
    if (!projection.isAggregate()) {
      final RowValue[] values = new RowValue[fields.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = plainValue(fields.get(i), timestamp, row);
      }
      rows.add(ResultRow.of(values));
      return;
    }

    final List<RowValue> key = Lists.newArrayListWithCapacity(fields.size());
    for (final ProjectionField field : fields) {
      if (!field.isAggregate()) {
        key.add(plainValue(field, timestamp, row));
      }
    }
    Aggregate[] aggregates = groups.get(key);
    if (aggregates == null) {
      aggregates = new Aggregate[fields.size()];
      for (int i = 0; i < aggregates.length; i++) {
        if (fields.get(i).isAggregate()) {
          aggregates[i] = new Aggregate(fields.get(i).function());
        }
      }
      groups.put(key, aggregates);
    }
    for (int i = 0; i < aggregates.length; i++) {
      if (aggregates[i] != null) {
        aggregates[i].add(row.get(fields.get(i).source()));
      }
    }
  }

  /** @return The projected rows as a buffer. */
  public ResultBuffer build() {
    if (!projection.isAggregate()) {
      return new ResultBuffer(name, projection.columns(), rows);
    }
    final List<ResultRow> results = Lists.newArrayListWithCapacity(
        groups.size());
    for (final Map.Entry<List<RowValue>, Aggregate[]> entry : 
        groups.entrySet()) {
      final Aggregate[] aggregates = entry.getValue();
      final RowValue[] values = new RowValue[aggregates.length];
      int key_index = 0;
      for (int i = 0; i < values.length; i++) {
        values[i] = aggregates[i] == null ? entry.getKey().get(key_index++) 
            : aggregates[i].value();
      }
      results.add(ResultRow.of(values));
    }
    return new ResultBuffer(name, projection.columns(), results);
  }

  private RowValue plainValue(final ProjectionField field,
                              final long timestamp,
                              final Map<String, RowValue> row) {
    if (field.isTime()) {
      return RowValue.ofTimestamp(timestamp);
    }
    if (field.isTimeSeries()) {
      final long granularity = field.granularity();
      return RowValue.ofTimestamp(origin 
          + Math.floorDiv(timestamp - origin, granularity) * granularity);
    }
    return row.get(field.source());
  }

  /** Running state of one aggregated column in one group. */
  private static class Aggregate {
    private final AggregateFunction function;
    private long sum;
    private long count;
    private boolean unsigned;
    private Set<UUID> flows;

    Aggregate(final AggregateFunction function) {
      this.function = function;
    }

    void add(final RowValue value) {
      if (value == null) {
        return;
      }
      switch (function) {
      case FLOW_COUNT:
        if (flows == null) {
          flows = Sets.newHashSet();
        }
        flows.add(value.type() == ValueType.UUID ? value.uuidValue() 
            : UUID.nameUUIDFromBytes(value.asString().getBytes(Const.UTF8_CHARSET)));
        break;
      case COUNT:
        count++;
        break;
      default:
        if (count == 0) {
          unsigned = value.type() == ValueType.UINT64;
        }
        sum += value.longValue();
        count++;
      }
    }

    RowValue value() {
      switch (function) {
      case FLOW_COUNT:
        return RowValue.ofUnsigned(flows == null ? 0 : flows.size());
      case COUNT:
        return RowValue.ofUnsigned(count);
      case AVG:
        if (count == 0) {
          return null;
        }
        return RowValue.ofLong(unsigned ? Long.divideUnsigned(sum, count) 
            : sum / count);
      default:
        return unsigned ? RowValue.ofUnsigned(sum) : RowValue.ofLong(sum);
      }
    }
  }
}
