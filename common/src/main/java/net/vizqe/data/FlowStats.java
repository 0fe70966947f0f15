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

/**
 * Traffic counters of a flow sample.
 */
public final class FlowStats {

  private final long bytes;
  private final long packets;
  private final boolean short_flow;

  public FlowStats(final long bytes, final long packets,
                   final boolean short_flow) {
    this.bytes = bytes;
    this.packets = packets;
    this.short_flow = short_flow;
  }

  public long bytes() {
    return bytes;
  }

  public long packets() {
    return packets;
  }

  public boolean isShortFlow() {
    return short_flow;
  }

  @Override
  public String toString() {
    return "Bytes: " + bytes + " Pkts: " + packets + " Short-Flow: " 
        + short_flow;
  }
}
