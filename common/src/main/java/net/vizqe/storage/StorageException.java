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

/**
 * Thrown by {@link DataStore} implementations when reading fails. Store
 * specific errors should be wrapped as the cause. The query engine reports
 * it as an I/O failure of the batch, which the caller may retry.
 */
public class StorageException extends RuntimeException {
  private static final long serialVersionUID = 1746164949299572609L;

  /**
   * @param msg What failed.
   */
  public StorageException(final String msg) {
    super(msg);
  }

  /**
   * @param msg What failed.
   * @param cause The store's own exception.
   */
  public StorageException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
