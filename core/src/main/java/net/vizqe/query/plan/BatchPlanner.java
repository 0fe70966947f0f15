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
package net.vizqe.query.plan;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.vizqe.data.BatchWindow;

/**
 * Splits a query range into contiguous, non-overlapping batch windows. 
 * All windows have the same length except the last which may be shorter.
 * The length is never below the table's row time quantum and is a multiple
 * of the time-series granularity when one is requested.
 */
public class BatchPlanner {

  private final long from;
  private final long end;
  private final long time_slice;

  private BatchPlanner(final Builder builder) {
    Preconditions.checkArgument(builder.from <= builder.end, 
        "From cannot be greater than end: %s > %s", builder.from, builder.end);
    Preconditions.checkArgument(builder.total_batches > 0, 
        "Total batches must be at least 1: %s", builder.total_batches);
    from = builder.from;
    end = builder.end;
    if (builder.parallelizable) {
      time_slice = computeTimeSlice(end - from, builder.total_batches, 
          builder.min_granularity, builder.granularity);
    } else {
      time_slice = end - from;
    }
  }

  /**
   * @param range The length of the query range in microseconds.
   * @param total_batches The number of batches, at least 1.
   * @param min_granularity The row time quantum of the table.
   * @param granularity The time-series bucket width, 0 if none.
   * @return The length of every window but the last.
   */
  public static long computeTimeSlice(final long range,
                                      final int total_batches,
                                      final long min_granularity,
                                      final long granularity) {
    long slice = range / total_batches;
    if (range % total_batches != 0) {
      slice++;
    }
    if (slice < min_granularity) {
      slice = min_granularity;
    }
    if (granularity > 0) {
      if (granularity >= slice) {
        slice = granularity;
      } else if (slice % granularity != 0) {
        slice = (slice / granularity + 1) * granularity;
      }
    }
    return slice;
  }

  public long from() {
    return from;
  }

  public long end() {
    return end;
  }

  /** @return The length of every window but the last. */
  public long timeSlice() {
    return time_slice;
  }

  /**
   * @param batch The batch index, from 0.
   * @return The window of the batch, null if the batch has nothing to do.
   */
  public BatchWindow window(final int batch) {
    Preconditions.checkArgument(batch >= 0, "Batch cannot be negative");
    if (time_slice <= 0) {
      return null;
    }
    final long batch_from = from + batch * time_slice;
    if (batch_from >= end) {
      return null;
    }
    return new BatchWindow(batch_from, Math.min(batch_from + time_slice, end));
  }

  /** @return Every non-empty window in batch order. */
  public List<BatchWindow> windows() {
    final ImmutableList.Builder<BatchWindow> windows = ImmutableList.builder();
    if (time_slice <= 0) {
      return windows.build();
    }
    for (long start = from; start < end; start += time_slice) {
      windows.add(new BatchWindow(start, Math.min(start + time_slice, end)));
    }
    return windows.build();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("from=")
        .append(from)
        .append(", end=")
        .append(end)
        .append(", timeSlice=")
        .append(time_slice)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private long from;
    private long end;
    private int total_batches = 1;
    private long min_granularity;
    private long granularity;
    private boolean parallelizable = true;

    public Builder setFrom(final long from) {
      this.from = from;
      return this;
    }

    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }

    public Builder setTotalBatches(final int total_batches) {
      this.total_batches = total_batches;
      return this;
    }

    public Builder setMinGranularity(final long min_granularity) {
      this.min_granularity = min_granularity;
      return this;
    }

    /** @param granularity The time-series bucket width, 0 if none. */
    public Builder setGranularity(final long granularity) {
      this.granularity = granularity;
      return this;
    }

    public Builder setParallelizable(final boolean parallelizable) {
      this.parallelizable = parallelizable;
      return this;
    }

    public BatchPlanner build() {
      return new BatchPlanner(this);
    }
  }
}
