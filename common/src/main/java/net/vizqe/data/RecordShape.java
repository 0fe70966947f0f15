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
 * The layout of the positional payload of a {@link StorageRow}. The shape is
 * chosen from the projection of the query, not inferred from the payload.
 * <ul>
 * <li>{@link #PLAIN}: [uuid]</li>
 * <li>{@link #STATS}: [bytes, packets, short_flow, uuid]</li>
 * <li>{@link #STATS_TUPLE}: [bytes, packets, short_flow, uuid, vrouter,
 * sourcevn, destvn, sourceip, destip, protocol, sport, dport, direction]</li>
 * </ul>
 */
public enum RecordShape {
  PLAIN(1),
  STATS(4),
  STATS_TUPLE(13);

  private final int width;

  private RecordShape(final int width) {
    this.width = width;
  }

  /** @return The number of payload values of this shape. */
  public int width() {
    return width;
  }
}
