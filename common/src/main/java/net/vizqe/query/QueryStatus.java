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

/**
 * Status codes returned alongside query results. Zero is success, anything
 * else is a POSIX style error number.
 */
public final class QueryStatus {

  public static final int SUCCESS = 0;

  /** The storage collaborator failed. */
  public static final int EIO = 5;

  /** A referenced table, field, operator or sort target is not valid. */
  public static final int EINVAL = 22;

  /** A clause could not be parsed or a required term was missing. */
  public static final int EBADMSG = 74;

  /** An internal invariant broke while processing the query. */
  public static final int ENOTRECOVERABLE = 131;

  private QueryStatus() { }

  /**
   * @param status A status code.
   * @return A short name for logging.
   */
  public static String toString(final int status) {
    switch (status) {
    case SUCCESS:
      return "SUCCESS";
    case EIO:
      return "EIO";
    case EINVAL:
      return "EINVAL";
    case EBADMSG:
      return "EBADMSG";
    case ENOTRECOVERABLE:
      return "ENOTRECOVERABLE";
    default:
      return "UNKNOWN(" + status + ")";
    }
  }
}
