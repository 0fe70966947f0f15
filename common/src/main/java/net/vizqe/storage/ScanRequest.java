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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.vizqe.common.Const;
import net.vizqe.data.BatchWindow;
import net.vizqe.data.RecordShape;
import net.vizqe.query.filter.RowFilter;

/**
 * What one batch asks the storage collaborator for.
 */
public final class ScanRequest {

  private final String table;
  private final String key;
  private final BatchWindow window;
  private final RowFilter filter;
  private final RecordShape shape;
  private final int direction;

  private ScanRequest(final Builder builder) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(builder.table), 
        "Table cannot be null or empty.");
    Preconditions.checkNotNull(builder.window, "Window cannot be null.");
    Preconditions.checkNotNull(builder.shape, "Shape cannot be null.");
    table = builder.table;
    key = builder.key;
    window = builder.window;
    filter = builder.filter;
    shape = builder.shape;
    direction = builder.direction;
  }

  /** @return The storage table to read. */
  public String table() {
    return table;
  }

  /** @return An optional partition key within the table, e.g. the object
   * table name for object value reads. May be null. */
  public String key() {
    return key;
  }

  public BatchWindow window() {
    return window;
  }

  /** @return The WHERE filter of the query, may be null for match all. */
  public RowFilter filter() {
    return filter;
  }

  /** @return The payload layout the rows must be returned in. */
  public RecordShape shape() {
    return shape;
  }

  /** @return The flow direction code for flow tables. */
  public int direction() {
    return direction;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{table=")
        .append(table)
        .append(", key=")
        .append(key)
        .append(", window=")
        .append(window)
        .append(", shape=")
        .append(shape)
        .append(", direction=")
        .append(direction)
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String table;
    private String key;
    private BatchWindow window;
    private RowFilter filter;
    private RecordShape shape = RecordShape.PLAIN;
    private int direction = Const.FLOW_DIR_INGRESS;

    public Builder setTable(final String table) {
      this.table = table;
      return this;
    }

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setWindow(final BatchWindow window) {
      this.window = window;
      return this;
    }

    public Builder setFilter(final RowFilter filter) {
      this.filter = filter;
      return this;
    }

    public Builder setShape(final RecordShape shape) {
      this.shape = shape;
      return this;
    }

    public Builder setDirection(final int direction) {
      this.direction = direction;
      return this;
    }

    public ScanRequest build() {
      return new ScanRequest(this);
    }
  }
}
