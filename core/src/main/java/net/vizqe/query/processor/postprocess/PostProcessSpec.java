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
package net.vizqe.query.processor.postprocess;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.vizqe.common.Const;
import net.vizqe.data.ResultBuffer;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.query.filter.PredicateSet;
import net.vizqe.query.processor.select.ProjectionField;
import net.vizqe.query.processor.select.ProjectionSpec;
import net.vizqe.schema.Column;
import net.vizqe.schema.TableSchema;
import net.vizqe.utils.JSON;

/**
 * Result filter, sort and limit applied to the projected rows of a batch
 * and again when batches are merged.
 */
public final class PostProcessSpec {
  private static final Logger LOG = 
      LoggerFactory.getLogger(PostProcessSpec.class);

  /** Fields that may always be sorted on, projected or not. */
  public static final Set<String> FIXED_SORT_FIELDS = ImmutableSet.of(
      Const.SELECT_PACKETS, Const.SELECT_BYTES, Const.SELECT_SUM_PACKETS, 
      Const.SELECT_SUM_BYTES, Const.SELECT_AVG_PACKETS, 
      Const.SELECT_AVG_BYTES);

  private final List<SortField> sort_fields;
  private final SortOrder order;
  private final int limit;
  private final PredicateSet filter;

  private PostProcessSpec(final List<SortField> sort_fields,
                          final SortOrder order,
                          final int limit,
                          final PredicateSet filter) {
    this.sort_fields = ImmutableList.copyOf(sort_fields);
    this.order = order;
    this.limit = limit;
    this.filter = filter;
  }

  /**
   * Parses the sort, limit and filter terms of a query.
   * @param terms The query terms.
   * @param schema The table results come from.
   * @param projection The parsed projection.
   * @return The post processing options.
   * @throws QueryParseException if a term is malformed.
   * @throws InvalidQueryArgumentException if a sort field or code is invalid.
   */
  public static PostProcessSpec parse(final Map<String, String> terms,
                                      final TableSchema schema,
                                      final ProjectionSpec projection) {
    final List<SortField> sort_fields = Lists.newArrayList();
    final String fields = terms.get(Const.QUERY_SORT_FIELDS);
    if (!Strings.isNullOrEmpty(fields)) {
      final JsonNode root;
      try {
        root = JSON.parseToNode(fields);
      } catch (IllegalArgumentException e) {
        throw new QueryParseException("Failed to parse sort fields: " 
            + fields, e);
      }
      if (!root.isArray()) {
        throw new QueryParseException("Sort fields must be an array: " 
            + fields);
      }
      for (final JsonNode node : root) {
        if (!node.isTextual()) {
          throw new QueryParseException("Sort field must be a string: " 
              + node);
        }
        sort_fields.add(sortField(node.asText(), schema, projection));
      }
    }

    SortOrder order = SortOrder.ASCENDING;
    final String sort = terms.get(Const.QUERY_SORT_OP);
    if (!Strings.isNullOrEmpty(sort)) {
      order = SortOrder.fromCode(parseInt(Const.QUERY_SORT_OP, sort));
    }

    int limit = 0;
    final String limit_term = terms.get(Const.QUERY_LIMIT);
    if (!Strings.isNullOrEmpty(limit_term)) {
      limit = parseInt(Const.QUERY_LIMIT, limit_term);
      if (limit < 0) {
        throw new InvalidQueryArgumentException("Limit cannot be negative: " 
            + limit);
      }
    }

    final PredicateSet filter = PredicateSet.parseFilter(
        terms.get(Const.QUERY_FILTER));
    return new PostProcessSpec(sort_fields, order, limit, filter);
  }

  /** @return True if results are ordered. */
  public boolean isSorted() {
    return !sort_fields.isEmpty();
  }

  public List<SortField> sortFields() {
    return sort_fields;
  }

  public SortOrder order() {
    return order;
  }

  /** @return The maximum number of rows, 0 for no limit. */
  public int limit() {
    return limit;
  }

  public PredicateSet filter() {
    return filter;
  }

  /**
   * @param columns The column names of the rows to compare.
   * @return A comparator over the sort fields.
   */
  public RowComparator comparator(final List<String> columns) {
    return new RowComparator(sort_fields, order, columns);
  }

  /**
   * Filters, sorts and truncates a buffer.
   * @param buffer The projected rows.
   * @param combine_pending True if the rows hold partial aggregates that 
   * will be combined with other batches later. The filter and limit only 
   * apply to combined values so both are skipped.
   * @return A new buffer.
   */
  public ResultBuffer process(final ResultBuffer buffer, 
                              final boolean combine_pending) {
    final List<ResultRow> rows = Lists.newArrayListWithCapacity(
        buffer.size());
    if (combine_pending || filter.groups().isEmpty()) {
      rows.addAll(buffer.rows());
    } else {
      for (final ResultRow row : buffer.rows()) {
        if (filter.matches(asMap(buffer.columns(), row))) {
          rows.add(row);
        }
      }
    }
    if (isSorted()) {
      // stable
      Collections.sort(rows, comparator(buffer.columns()));
    }
    final List<ResultRow> limited = !combine_pending && limit > 0 
        && rows.size() > limit ? rows.subList(0, limit) : rows;
    return new ResultBuffer(buffer.name(), buffer.columns(), limited);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("sortFields=")
        .append(sort_fields)
        .append(", order=")
        .append(order)
        .append(", limit=")
        .append(limit)
        .append(", filter=")
        .append(filter)
        .toString();
  }

  private static SortField sortField(final String name,
                                     final TableSchema schema,
                                     final ProjectionSpec projection) {
    String column = name;
    if (!projection.isPresent(name)) {
      if (!FIXED_SORT_FIELDS.contains(name)) {
        throw new InvalidQueryArgumentException("Sort field " + name 
            + " is not selected");
      }
      column = projectedCounterpart(name, projection);
      if (column == null) {
        // rows lack the column so the sort leaves them in order
        if (LOG.isDebugEnabled()) {
          LOG.debug("Sort field " + name + " has no projected column in " 
              + projection.table());
        }
        column = name;
      } else if (LOG.isDebugEnabled()) {
        LOG.debug("Sorting on " + column + " for sort field " + name);
      }
    }
    String datatype = schema.datatype(column);
    if (datatype == null) {
      datatype = projection.outputDatatype(column, schema);
    }
    if (datatype == null && FIXED_SORT_FIELDS.contains(name)) {
      datatype = Column.LONG;
    }
    if (datatype == null) {
      throw new InvalidQueryArgumentException("Sort field " + name 
          + " has no datatype in table " + schema.name());
    }
    return new SortField(column, datatype);
  }

  /**
   * @return The projected column computed from the same counter as the 
   * fixed sort field, e.g. {@code sum(bytes)} for {@code bytes}. Null if 
   * nothing projected reads that counter.
   */
  private static String projectedCounterpart(final String name,
                                             final ProjectionSpec projection) {
    final String counter = name.contains(Const.SELECT_BYTES) 
        ? Const.SELECT_BYTES : Const.SELECT_PACKETS;
    for (final ProjectionField field : projection.fields()) {
      if (counter.equals(field.source())) {
        return field.name();
      }
    }
    return null;
  }

  private static int parseInt(final String term, final String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new QueryParseException("Invalid " + term + ": " + value, e);
    }
  }

  private static Map<String, RowValue> asMap(final List<String> columns,
                                             final ResultRow row) {
    final Map<String, RowValue> map = Maps.newHashMapWithExpectedSize(
        columns.size());
    for (int i = 0; i < columns.size() && i < row.size(); i++) {
      if (row.get(i) != null) {
        map.put(columns.get(i), row.get(i));
      }
    }
    return map;
  }
}
