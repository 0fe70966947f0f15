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
package net.vizqe.data;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A half open time interval [from, end) in microseconds handled by one
 * batch of a query.
 */
public final class BatchWindow {

  private final long from;
  private final long end;

  public BatchWindow(final long from, final long end) {
    Preconditions.checkArgument(from <= end, 
        "Window start %s cannot be after the end %s", from, end);
    this.from = from;
    this.end = end;
  }

  public long from() {
    return from;
  }

  public long end() {
    return end;
  }

  public long length() {
    return end - from;
  }

  /**
   * @param timestamp A timestamp in microseconds.
   * @return True if the timestamp is in [from, end).
   */
  public boolean contains(final long timestamp) {
    return timestamp >= from && timestamp < end;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final BatchWindow other = (BatchWindow) o;
    return from == other.from && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(from, end);
  }

  @Override
  public String toString() {
    return "[" + from + ", " + end + ")";
  }
}
