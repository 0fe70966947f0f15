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

import net.vizqe.exceptions.InvalidQueryArgumentException;

/**
 * Sort direction with its wire code.
 */
public enum SortOrder {
  ASCENDING(1),
  DESCENDING(2);

  private final int code;

  SortOrder(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * @param code A wire code.
   * @return The order.
   * @throws InvalidQueryArgumentException if the code is unknown.
   */
  public static SortOrder fromCode(final int code) {
    for (final SortOrder order : values()) {
      if (order.code == code) {
        return order;
      }
    }
    throw new InvalidQueryArgumentException("Unknown sort order: " + code);
  }
}
