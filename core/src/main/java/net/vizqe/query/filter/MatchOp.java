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

import net.vizqe.exceptions.InvalidQueryArgumentException;

/**
 * The match operators a predicate may use, with their wire codes.
 */
public enum MatchOp {
  EQUAL(1),
  NOT_EQUAL(2),
  IN_RANGE(3),
  NOT_IN_RANGE(4),
  LEQ(5),
  GEQ(6),
  PREFIX(7),
  REGEX_MATCH(8);

  private final int code;

  MatchOp(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** @return True if the operator needs a second value. */
  public boolean isRange() {
    return this == IN_RANGE || this == NOT_IN_RANGE;
  }

  /**
   * @param code A wire code.
   * @return The operator.
   * @throws InvalidQueryArgumentException if the code is unknown.
   */
  public static MatchOp fromCode(final int code) {
    for (final MatchOp op : values()) {
      if (op.code == code) {
        return op;
      }
    }
    throw new InvalidQueryArgumentException("Unknown match operator: " + code);
  }
}
