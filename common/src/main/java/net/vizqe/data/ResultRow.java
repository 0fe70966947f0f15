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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * One output row. The names of the values are the columns of the
 * {@link ResultBuffer} holding the row.
 */
public final class ResultRow {

  /** Unmodifiable, may hold nulls for absent values. */
  private final List<RowValue> values;

  public ResultRow(final List<RowValue> values) {
    this.values = Collections.unmodifiableList(Lists.newArrayList(values));
  }

  public static ResultRow of(final RowValue... values) {
    return new ResultRow(Arrays.asList(values));
  }

  /**
   * @param index A column index.
   * @return The value at the index, may be null if the column had no value
   * for this row.
   */
  public RowValue get(final int index) {
    return values.get(index);
  }

  public int size() {
    return values.size();
  }

  public List<RowValue> values() {
    return values;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return values.equals(((ResultRow) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
