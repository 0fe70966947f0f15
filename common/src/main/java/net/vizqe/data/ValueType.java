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
 * The tag of a {@link RowValue}.
 */
public enum ValueType {
  STRING,
  /** Signed 64 bit integer. */
  INT64,
  /** Unsigned 64 bit integer held in a long. */
  UINT64,
  /** Microseconds since the Unix epoch. */
  TIMESTAMP,
  UUID
}
