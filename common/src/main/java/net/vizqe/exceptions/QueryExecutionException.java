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

/**
 * Base exception for query failures. Carries the status code that is
 * reported to the caller along with an empty result.
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -4718026524393468732L;

  /** The status code to return. */
  private final int status_code;

  /**
   * Default ctor.
   * @param msg A message describing the failure.
   * @param status_code The non-zero status code.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    super(msg);
    this.status_code = status_code;
  }

  /**
   * Ctor with a cause.
   * @param msg A message describing the failure.
   * @param status_code The non-zero status code.
   * @param cause The original exception.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Throwable cause) {
    super(msg, cause);
    this.status_code = status_code;
  }

  /** @return The status code for this failure. */
  public int getStatusCode() {
    return status_code;
  }
}
