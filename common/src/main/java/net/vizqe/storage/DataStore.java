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
 * The storage collaborator of the query engine. Connection setup and any
 * retries around it happen before the engine is handed the store; once the
 * engine has it, the store is assumed ready and every failure is reported
 * as a {@link StorageException}.
 */
public interface DataStore {

  /**
   * Starts a scan of one time window.
   * @param request A non-null request.
   * @return A scanner over the matching rows. The caller closes it.
   * @throws StorageException if the scan could not be started.
   */
  public Scanner scan(final ScanRequest request);

  /**
   * @return The time analytics data collection started, in microseconds, or
   * a negative value if the store does not know.
   * @throws StorageException if the lookup failed.
   */
  public long analyticsStartTime();

}
