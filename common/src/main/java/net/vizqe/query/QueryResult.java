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
package net.vizqe.query;

import com.google.common.base.Preconditions;

import net.vizqe.data.ResultBuffer;

/**
 * A status code and the rows that go with it. The buffer is always empty
 * when the status is not {@link QueryStatus#SUCCESS}.
 */
public final class QueryResult {

  private final int status;
  private final ResultBuffer buffer;

  private QueryResult(final int status, final ResultBuffer buffer) {
    this.status = status;
    this.buffer = buffer;
  }

  public static QueryResult success(final ResultBuffer buffer) {
    Preconditions.checkNotNull(buffer, "Buffer cannot be null.");
    return new QueryResult(QueryStatus.SUCCESS, buffer);
  }

  /**
   * @param status A non-zero status.
   * @param name The name for the empty buffer.
   * @return A failed result with an empty buffer.
   */
  public static QueryResult failure(final int status, final String name) {
    Preconditions.checkArgument(status != QueryStatus.SUCCESS, 
        "Failures need a non-zero status.");
    return new QueryResult(status, 
        ResultBuffer.empty(name == null ? "" : name));
  }

  public int status() {
    return status;
  }

  public boolean isSuccess() {
    return status == QueryStatus.SUCCESS;
  }

  public ResultBuffer buffer() {
    return buffer;
  }

  @Override
  public String toString() {
    return "{status=" + QueryStatus.toString(status) + ", buffer=" 
        + buffer + "}";
  }
}
