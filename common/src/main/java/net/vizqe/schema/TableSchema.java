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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * The ordered column list of a table along with the smallest time window
 * the table can address.
 */
public final class TableSchema {

  private final String name;
  private final ImmutableList<Column> columns;
  private final int row_time_bits;

  private TableSchema(final Builder builder) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(builder.name), 
        "Table name cannot be null or empty.");
    Preconditions.checkArgument(builder.row_time_bits >= 0 
        && builder.row_time_bits < 63, "Invalid row time bits: " 
        + builder.row_time_bits);
    name = builder.name;
    columns = builder.columns.build();
    row_time_bits = builder.row_time_bits;
  }

  public String name() {
    return name;
  }

  public List<Column> columns() {
    return columns;
  }

  /**
   * @param column A column name.
   * @return The column or null if the table has no such column.
   */
  public Column column(final String column) {
    for (final Column c : columns) {
      if (c.name().equals(column)) {
        return c;
      }
    }
    return null;
  }

  /**
   * @param column A column name.
   * @return The datatype of the column or null if it doesn't exist.
   */
  public String datatype(final String column) {
    final Column c = column(column);
    return c == null ? null : c.datatype();
  }

  /** @return The minimum time granularity in microseconds. */
  public long minGranularity() {
    return 1L << row_time_bits;
  }

  /**
   * Copies the columns of this schema under another table name.
   * @param name The new table name.
   * @return A schema with the same columns and granularity.
   */
  public TableSchema rename(final String name) {
    return newBuilder()
        .setName(name)
        .setRowTimeBits(row_time_bits)
        .addColumns(columns)
        .build();
  }

  @Override
  public String toString() {
    return name + columns;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private final ImmutableList.Builder<Column> columns = 
        ImmutableList.builder();
    private int row_time_bits;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setRowTimeBits(final int row_time_bits) {
      this.row_time_bits = row_time_bits;
      return this;
    }

    public Builder addColumn(final String name, final String datatype,
                             final boolean indexed) {
      columns.add(new Column(name, datatype, indexed));
      return this;
    }

    public Builder addColumns(final List<Column> columns) {
      this.columns.addAll(columns);
      return this;
    }

    public TableSchema build() {
      return new TableSchema(this);
    }
  }
}
