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

import com.google.common.base.Preconditions;

/**
 * The result of pulling a typed value out of a positional payload: either
 * the value or a description of where the payload did not match the
 * expected record shape.
 *
 * @param <T> The type of the extracted value.
 */
public final class Extraction<T> {

  private final T value;
  private final String error;

  private Extraction(final T value, final String error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Extraction<T> of(final T value) {
    Preconditions.checkNotNull(value);
    return new Extraction<T>(value, null);
  }

  /**
   * @param position The payload index that failed.
   * @param expected The type expected at that index.
   * @param actual The value found, null if the payload was too short.
   * @return A failed extraction.
   */
  public static <T> Extraction<T> mismatch(final int position,
                                           final ValueType expected,
                                           final RowValue actual) {
    return new Extraction<T>(null, "Schema mismatch at index " + position 
        + ": expected " + expected + " but found " 
        + (actual == null ? "nothing" : actual.type()));
  }

  /**
   * Carries the error of another failed extraction over to a new type.
   * @param failed A failed extraction.
   * @return A failed extraction with the same error.
   */
  public static <T> Extraction<T> failed(final Extraction<?> failed) {
    Preconditions.checkArgument(!failed.isValid());
    return new Extraction<T>(null, failed.error);
  }

  public boolean isValid() {
    return error == null;
  }

  /**
   * @return The value.
   * @throws IllegalStateException if the extraction failed.
   */
  public T value() {
    if (error != null) {
      throw new IllegalStateException(error);
    }
    return value;
  }

  /** @return The error description or null if the extraction succeeded. */
  public String error() {
    return error;
  }
}
