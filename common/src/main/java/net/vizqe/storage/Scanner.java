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
package net.vizqe.storage;

import java.io.Closeable;

import net.vizqe.data.StorageRow;

/**
 * The rows of one {@link ScanRequest}, in timestamp order. A scanner is
 * walked once by a single batch and closed when the batch is done with it;
 * implementations may fetch lazily from storage as the batch advances.
 */
public abstract class Scanner implements Closeable {

  /**
   * @return True if another row is available.
   * @throws StorageException if the store failed fetching more rows.
   */
  public abstract boolean hasNext();

  /**
   * @return The next row.
   * @throws java.util.NoSuchElementException if there are no more rows.
   * @throws StorageException if the store failed fetching the row.
   */
  public abstract StorageRow next();

  /**
   * Releases whatever the scan holds in the store. A no-op by default.
   */
  @Override
  public void close() {
    // nothing held
  }
}
