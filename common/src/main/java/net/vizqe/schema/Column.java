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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A column of a table schema.
 */
public final class Column {

  public static final String STRING = "string";
  public static final String INT = "int";
  public static final String LONG = "long";
  public static final String IPADDR = "ipaddr";
  public static final String UUID = "uuid";

  private final String name;
  private final String datatype;
  private final boolean indexed;

  public Column(final String name, final String datatype,
                final boolean indexed) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), 
        "Column name cannot be null or empty.");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(datatype), 
        "Column datatype cannot be null or empty.");
    this.name = name;
    this.datatype = datatype;
    this.indexed = indexed;
  }

  public String name() {
    return name;
  }

  public String datatype() {
    return datatype;
  }

  /** @return Whether or not the column may be used in a WHERE clause. */
  public boolean indexed() {
    return indexed;
  }

  /** @return Whether or not values of this column compare numerically. */
  public boolean isNumeric() {
    return INT.equals(datatype) || LONG.equals(datatype);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Column other = (Column) o;
    return name.equals(other.name) &&
           datatype.equals(other.datatype) &&
           indexed == other.indexed;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, datatype, indexed);
  }

  @Override
  public String toString() {
    return name + "(" + datatype + (indexed ? ", indexed)" : ")");
  }
}
