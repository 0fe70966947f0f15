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
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.vizqe.common.Const;
import net.vizqe.data.RecordShape;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.data.ValueType;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.schema.Column;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.TableSchema;
import net.vizqe.utils.JSON;

/**
 * The SELECT clause of a query: the ordered output columns, their
 * aggregations and the time-series granularity. Also decides which flow
 * record shape the scan has to deliver and whether batches can be merged
 * by addition.
 */
public final class ProjectionSpec {

  /** Flow tuple fields, as named in the flow tables. */
  public static final Set<String> FLOW_TUPLE_FIELDS = ImmutableSet.of(
      "vrouter", "sourcevn", "sourceip", "destvn", "destip", "protocol", 
      "sport", "dport");

  private final String table;
  private final ImmutableList<ProjectionField> fields;
  private final ImmutableList<String> columns;
  private final boolean object_id_query;
  private final boolean aggregate;
  private final boolean timeseries;
  private final boolean has_average;
  private final boolean has_flow_count;
  private final long granularity;
  private final FlowSeriesQueryType flow_series_type;
  private final RecordShape shape;

  private ProjectionSpec(final String table,
                         final List<ProjectionField> fields,
                         final boolean object_table) {
    this.table = table;
    this.fields = ImmutableList.copyOf(fields);
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    boolean aggregate = false;
    boolean timeseries = false;
    boolean has_average = false;
    boolean has_flow_count = false;
    boolean tuple = false;
    boolean stats = false;
    long granularity = 0;
    for (final ProjectionField field : fields) {
      names.add(field.name());
      if (field.isAggregate()) {
        aggregate = true;
        has_average |= field.function() == AggregateFunction.AVG;
        has_flow_count |= field.function() == AggregateFunction.FLOW_COUNT;
      }
      if (field.isTime() || field.isTimeSeries()) {
        timeseries = true;
        granularity = Math.max(granularity, field.granularity());
      }
      if (FLOW_TUPLE_FIELDS.contains(field.source())) {
        tuple = true;
      } else if (isStatsField(field)) {
        stats = true;
      }
    }
    this.columns = names.build();
    this.aggregate = aggregate;
    this.timeseries = timeseries;
    this.has_average = has_average;
    this.has_flow_count = has_flow_count;
    this.granularity = granularity;
    object_id_query = object_table && fields.size() == 1 
        && Const.OBJECT_ID.equals(fields.get(0).name());

    if (SchemaCatalog.FLOW_SERIES_TABLE.equals(table)) {
      flow_series_type = FlowSeriesQueryType.classify(timeseries, tuple, 
          stats);
    } else {
      flow_series_type = null;
    }
    if (!SchemaCatalog.isFlowTable(table)) {
      shape = RecordShape.PLAIN;
    } else if (tuple) {
      shape = RecordShape.STATS_TUPLE;
    } else if (stats) {
      shape = RecordShape.STATS;
    } else {
      shape = RecordShape.PLAIN;
    }
  }

  /**
   * Parses and validates a select clause.
   * @param select The JSON array of field strings.
   * @param table The table the fields must belong to.
   * @param object_table Whether the table came from the object registry.
   * @return The projection.
   * @throws QueryParseException if the clause is missing or malformed.
   * @throws InvalidQueryArgumentException if a field is unknown or the
   * clause is empty.
   */
  public static ProjectionSpec parse(final String select,
                                     final TableSchema table,
                                     final boolean object_table) {
    if (Strings.isNullOrEmpty(select)) {
      throw new QueryParseException("Missing " + Const.QUERY_SELECT);
    }
    final JsonNode root;
    try {
      root = JSON.parseToNode(select);
    } catch (IllegalArgumentException e) {
      throw new QueryParseException("Failed to parse select clause: " 
          + select, e);
    }
    if (!root.isArray()) {
      throw new QueryParseException("Select clause must be an array: " 
          + select);
    }
    if (root.size() < 1) {
      throw new InvalidQueryArgumentException("Select clause is empty");
    }
    final List<ProjectionField> fields = Lists.newArrayListWithCapacity(
        root.size());
    int time_fields = 0;
    for (final JsonNode node : root) {
      if (!node.isTextual()) {
        throw new QueryParseException("Select field must be a string: " 
            + node);
      }
      final ProjectionField field = ProjectionField.parse(node.asText(), 
          table);
      if (field.isTime() || field.isTimeSeries()) {
        if (++time_fields > 1) {
          throw new InvalidQueryArgumentException(
              "Only one of T and T= may be selected");
        }
      }
      fields.add(field);
    }
    return new ProjectionSpec(table.name(), fields, object_table);
  }

  public String table() {
    return table;
  }

  public List<ProjectionField> fields() {
    return fields;
  }

  /** @return The output column names in select order. */
  public List<String> columns() {
    return columns;
  }

  /** @return True if the only field selected from an object table is its id. */
  public boolean isObjectIdQuery() {
    return object_id_query;
  }

  public boolean isAggregate() {
    return aggregate;
  }

  /** @return True if T or T= is selected. */
  public boolean provideTimeseries() {
    return timeseries;
  }

  /** @return The time-series bucket width in microseconds, 0 if none. */
  public long granularity() {
    return granularity;
  }

  public boolean hasAverage() {
    return has_average;
  }

  public boolean hasFlowCount() {
    return has_flow_count;
  }

  /** @return The flow series classification, null for other tables. */
  public FlowSeriesQueryType flowSeriesQueryType() {
    return flow_series_type;
  }

  /** @return The payload layout the scan must deliver. */
  public RecordShape recordShape() {
    return shape;
  }

  /**
   * @return True if rows with the same group key from different batches 
   * have to be combined, i.e. aggregates without time-series output.
   */
  public boolean needsCombine() {
    return aggregate && !timeseries;
  }

  /**
   * @param name An output column name.
   * @return True if the column is projected.
   */
  public boolean isPresent(final String name) {
    return columns.contains(name);
  }

  /**
   * @param name An output column name.
   * @param schema The table the projection was parsed against.
   * @return The datatype of the projected column, null if not projected.
   */
  public String outputDatatype(final String name, final TableSchema schema) {
    for (final ProjectionField field : fields) {
      if (!field.name().equals(name)) {
        continue;
      }
      if (field.isAggregate() || field.isTime() || field.isTimeSeries()) {
        return Column.LONG;
      }
      return schema.datatype(field.source());
    }
    return null;
  }

  /**
   * @param name The buffer name.
   * @param origin The start of the query range, used to align buckets.
   * @return A new accumulator for this projection.
   */
  public RowAccumulator newAccumulator(final String name, final long origin) {
    return new RowAccumulator(this, name, origin);
  }

  /**
   * Combines two rows with the same group key by adding their additive
   * aggregates. Other columns keep the value of the first row.
   * @param first The earlier row.
   * @param second The later row.
   * @return The combined row.
   */
  public ResultRow combine(final ResultRow first, final ResultRow second) {
    final RowValue[] values = new RowValue[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      final ProjectionField field = fields.get(i);
      final RowValue a = first.get(i);
      final RowValue b = second.get(i);
      if (field.isAggregate() && field.function().isAdditive()) {
        if (a == null) {
          values[i] = b;
        } else if (b == null) {
          values[i] = a;
        } else if (a.type() == ValueType.UINT64) {
          values[i] = RowValue.ofUnsigned(a.longValue() + b.longValue());
        } else {
          values[i] = RowValue.ofLong(a.longValue() + b.longValue());
        }
      } else {
        values[i] = a == null ? b : a;
      }
    }
    return ResultRow.of(values);
  }

  /**
   * @return The positions of the non-aggregated columns that form the group
   * key.
   */
  public List<Integer> groupKeyIndexes() {
    final List<Integer> indexes = Lists.newArrayList();
    for (int i = 0; i < fields.size(); i++) {
      if (!fields.get(i).isAggregate()) {
        indexes.add(i);
      }
    }
    return indexes;
  }

  private static boolean isStatsField(final ProjectionField field) {
    if (field.isAggregate()) {
      return true;
    }
    final String source = field.source();
    return Const.SELECT_PACKETS.equals(source) 
        || Const.SELECT_BYTES.equals(source);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("table=")
        .append(table)
        .append(", fields=")
        .append(fields)
        .append(", shape=")
        .append(shape)
        .toString();
  }
}
