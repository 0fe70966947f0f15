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
 * Thrown when an internal invariant is broken, e.g. a storage row whose
 * payload does not match the record shape the query asked for. Aborts the
 * current query only.
 */
public class QueryAssertionException extends QueryExecutionException {
  private static final long serialVersionUID = 8913265508251990876L;

  public QueryAssertionException(final String msg) {
    super(msg, QueryStatus.ENOTRECOVERABLE);
  }
}
