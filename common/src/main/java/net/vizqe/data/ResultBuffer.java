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
package net.vizqe.data;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A named, ordered set of result rows along with the column names shared by
 * every row. Buffers are immutable so they can be handed between threads
 * without copying.
 */
public final class ResultBuffer {

  private final String name;
  private final ImmutableList<String> columns;
  private final ImmutableList<ResultRow> rows;

  public ResultBuffer(final String name,
                      final List<String> columns,
                      final List<ResultRow> rows) {
    Preconditions.checkNotNull(name, "Name cannot be null.");
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
  }

  /**
   * @param name The name of the buffer.
   * @return An empty buffer without columns.
   */
  public static ResultBuffer empty(final String name) {
    return new ResultBuffer(name, ImmutableList.<String>of(),
        ImmutableList.<ResultRow>of());
  }

  /** @return The buffer name, the table the rows came from. */
  public String name() {
    return name;
  }

  public List<String> columns() {
    return columns;
  }

  public List<ResultRow> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * @param column A column name.
   * @return The index of the column or -1 if it isn't part of the buffer.
   */
  public int columnIndex(final String column) {
    return columns.indexOf(column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(name)
        .append(", columns=")
        .append(columns)
        .append(", rows=")
        .append(rows.size())
        .append("}")
        .toString();
  }
}
