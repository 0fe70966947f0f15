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
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A raw row returned by a storage scan: the row timestamp, the values of the
 * indexed columns the row was found under and a positional payload laid out
 * according to the {@link RecordShape} requested in the scan.
 */
public final class StorageRow {

  private final long timestamp;
  private final ImmutableMap<String, RowValue> columns;
  private final ImmutableList<RowValue> info;

  private StorageRow(final Builder builder) {
    timestamp = builder.timestamp;
    columns = builder.columns.build();
    info = builder.info.build();
  }

  /** @return The row timestamp in microseconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The named column values. */
  public Map<String, RowValue> columns() {
    return columns;
  }

  /** @return The positional payload. */
  public List<RowValue> info() {
    return info;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{timestamp=")
        .append(timestamp)
        .append(", columns=")
        .append(columns)
        .append(", info=")
        .append(info)
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private long timestamp;
    private final ImmutableMap.Builder<String, RowValue> columns = 
        ImmutableMap.builder();
    private final ImmutableList.Builder<RowValue> info = 
        ImmutableList.builder();

    public Builder setTimestamp(final long timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder addColumn(final String name, final RowValue value) {
      columns.put(name, value);
      return this;
    }

    public Builder addColumns(final Map<String, RowValue> values) {
      columns.putAll(values);
      return this;
    }

    public Builder addInfo(final RowValue value) {
      info.add(value);
      return this;
    }

    public Builder addInfo(final List<RowValue> values) {
      info.addAll(values);
      return this;
    }

    public StorageRow build() {
      return new StorageRow(this);
    }
  }
}
