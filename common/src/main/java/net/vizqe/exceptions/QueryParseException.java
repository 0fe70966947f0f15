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
 * Thrown when a query term is missing or a clause is not well formed JSON of
 * the expected shape.
 */
public class QueryParseException extends QueryExecutionException {
  private static final long serialVersionUID = 2262937458062813441L;

  public QueryParseException(final String msg) {
    super(msg, QueryStatus.EBADMSG);
  }

  public QueryParseException(final String msg, final Throwable cause) {
    super(msg, QueryStatus.EBADMSG, cause);
  }
}
