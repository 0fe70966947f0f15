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
package net.vizqe.query.filter;

import java.util.Map;

import net.vizqe.data.RowValue;

/**
 * A compiled match condition over the named values of a row. Storage
 * implementations may use it to narrow a scan; the engine applies it again
 * regardless.
 */
public interface RowFilter {

  /**
   * @param row The named values of the row. Absent columns are missing keys.
   * @return True if the row satisfies the filter.
   */
  public boolean matches(final Map<String, RowValue> row);

}
