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

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * A query as received from the transport: an identifier, the raw term map
 * and the maximum number of batches the caller is willing to run.
 */
public final class QueryParams {

  private final String query_id;
  private final ImmutableMap<String, String> terms;
  private final int max_chunks;

  /**
   * Default ctor.
   * @param query_id A non-null identifier used for logging.
   * @param terms The non-null term map.
   * @param max_chunks The maximum number of batches, at least 1.
   */
  public QueryParams(final String query_id,
                     final Map<String, String> terms,
                     final int max_chunks) {
    Preconditions.checkNotNull(query_id, "Query ID cannot be null.");
    Preconditions.checkNotNull(terms, "Terms cannot be null.");
    Preconditions.checkArgument(max_chunks > 0, 
        "Max chunks must be at least 1: %s", max_chunks);
    this.query_id = query_id;
    this.terms = ImmutableMap.copyOf(terms);
    this.max_chunks = max_chunks;
  }

  public String queryId() {
    return query_id;
  }

  public Map<String, String> terms() {
    return terms;
  }

  public int maxChunks() {
    return max_chunks;
  }

  @Override
  public String toString() {
    return "{qid=" + query_id + ", maxChunks=" + max_chunks 
        + ", terms=" + terms + "}";
  }
}
