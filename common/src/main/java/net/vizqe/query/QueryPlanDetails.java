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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.vizqe.data.BatchWindow;

/**
 * What preparing a query tells the caller about its fan out.
 */
public final class QueryPlanDetails {

  private final int status;
  private final boolean needs_merge;
  private final ImmutableList<BatchWindow> windows;

  public QueryPlanDetails(final int status,
                          final boolean needs_merge,
                          final List<BatchWindow> windows) {
    this.status = status;
    this.needs_merge = needs_merge;
    this.windows = ImmutableList.copyOf(windows);
  }

  /** @return The parse status, 0 on success. */
  public int status() {
    return status;
  }

  /** @return Whether batch results must go through the merger. */
  public boolean needsMerge() {
    return needs_merge;
  }

  /** @return The batch windows in batch order. Empty on failure. */
  public List<BatchWindow> windows() {
    return windows;
  }

  @Override
  public String toString() {
    return "{status=" + QueryStatus.toString(status) + ", needsMerge=" 
        + needs_merge + ", windows=" + windows + "}";
  }
}
