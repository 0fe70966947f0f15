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
package net.vizqe.exceptions;

import net.vizqe.query.QueryStatus;

/**
 * Thrown when a well formed query references something the schema does not
 * allow: an unknown table or column, a WHERE on a column that isn't indexed,
 * an invalid sort target or operator.
 */
public class InvalidQueryArgumentException extends QueryExecutionException {
  private static final long serialVersionUID = -5069383920364409437L;

  public InvalidQueryArgumentException(final String msg) {
    super(msg, QueryStatus.EINVAL);
  }

  public InvalidQueryArgumentException(final String msg,
                                       final Throwable cause) {
    super(msg, QueryStatus.EINVAL, cause);
  }
}
