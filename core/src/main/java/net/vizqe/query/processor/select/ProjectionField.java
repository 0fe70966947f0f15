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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Objects;
import com.google.common.primitives.Longs;

import net.vizqe.common.Const;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.schema.Column;
import net.vizqe.schema.TableSchema;
import net.vizqe.utils.DateTime;

/**
 * One output column of a projection.
 */
public final class ProjectionField {

  private static final Pattern AGGREGATE = 
      Pattern.compile("^(sum|count|avg)\\((.+)\\)$");

  private final String name;
  private final String source;
  private final AggregateFunction function;
  private final long granularity;

  ProjectionField(final String name,
                  final String source,
                  final AggregateFunction function,
                  final long granularity) {
    this.name = name;
    this.source = source;
    this.function = function;
    this.granularity = granularity;
  }

  /** @return The output column name. */
  public String name() {
    return name;
  }

  /** @return The row field the value is read from, null for time fields. */
  public String source() {
    return source;
  }

  /** @return The aggregation, null for plain fields. */
  public AggregateFunction function() {
    return function;
  }

  /** @return The time-series bucket width in microseconds, 0 if none. */
  public long granularity() {
    return granularity;
  }

  public boolean isAggregate() {
    return function != null;
  }

  /** @return True for the raw row timestamp. */
  public boolean isTime() {
    return Const.SELECT_TIME.equals(name);
  }

  /** @return True for the bucketed timestamp. */
  public boolean isTimeSeries() {
    return Const.SELECT_TIME_SERIES.equals(name);
  }

  /**
   * Parses and validates one select entry.
   * @param raw The entry, e.g. "Source", "T=60" or "sum(bytes)".
   * @param table The table to validate against.
   * @return The field.
   * @throws InvalidQueryArgumentException if the field is unknown.
   */
  static ProjectionField parse(final String raw, final TableSchema table) {
    final String entry = raw.trim();
    if (entry.equals(Const.SELECT_TIME)) {
      requireColumn(table, Const.SELECT_TIME);
      return new ProjectionField(Const.SELECT_TIME, null, null, 0);
    }
    if (entry.startsWith(Const.SELECT_TIME_SERIES)) {
      requireColumn(table, Const.SELECT_TIME_SERIES);
      final Long seconds = Longs.tryParse(
          entry.substring(Const.SELECT_TIME_SERIES.length()).trim());
      if (seconds == null || seconds <= 0) {
        throw new InvalidQueryArgumentException(
            "Invalid time series granularity: " + entry);
      }
      return new ProjectionField(Const.SELECT_TIME_SERIES, null, null, 
          DateTime.secondsToMicros(seconds));
    }
    if (entry.equals(Const.SELECT_FLOW_COUNT)) {
      requireColumn(table, Const.SELECT_FLOW_COUNT);
      return new ProjectionField(Const.SELECT_FLOW_COUNT, "UuidKey", 
          AggregateFunction.FLOW_COUNT, 0);
    }
    final Matcher matcher = AGGREGATE.matcher(entry);
    if (matcher.matches()) {
      final AggregateFunction function = 
          AggregateFunction.fromLabel(matcher.group(1));
      final String source = matcher.group(2).trim();
      final Column column = requireColumn(table, source);
      if (function != AggregateFunction.COUNT && !column.isNumeric()) {
        throw new InvalidQueryArgumentException("Cannot apply " 
            + function.label() + " to non-numeric field " + source);
      }
      return new ProjectionField(function.label() + "(" + source + ")", 
          source, function, 0);
    }
    requireColumn(table, entry);
    return new ProjectionField(entry, entry, null, 0);
  }

  private static Column requireColumn(final TableSchema table, 
                                      final String name) {
    final Column column = table.column(name);
    if (column == null) {
      throw new InvalidQueryArgumentException("Unknown select field " + name 
          + " in table " + table.name());
    }
    return column;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ProjectionField other = (ProjectionField) o;
    return Objects.equal(name, other.name)
        && Objects.equal(source, other.source)
        && function == other.function
        && granularity == other.granularity;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, source, function, granularity);
  }

  @Override
  public String toString() {
    return granularity > 0 ? name + granularity / Const.MICROS_PER_SECOND 
        : name;
  }
}
