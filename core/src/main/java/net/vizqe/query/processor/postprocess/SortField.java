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

import com.google.common.base.Objects;

/**
 * A result column to sort on and the datatype that decides how its values
 * compare.
 */
public final class SortField {

  private final String name;
  private final String datatype;

  public SortField(final String name, final String datatype) {
    this.name = name;
    this.datatype = datatype;
  }

  public String name() {
    return name;
  }

  public String datatype() {
    return datatype;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SortField other = (SortField) o;
    return Objects.equal(name, other.name) 
        && Objects.equal(datatype, other.datatype);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, datatype);
  }

  @Override
  public String toString() {
    return name + ":" + datatype;
  }
}
