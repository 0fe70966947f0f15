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
package net.vizqe.schema;

/**
 * Looks up table schemas. Implementations are read only once the engine has
 * started.
 */
public interface SchemaProvider {

  /**
   * @param name A table name.
   * @return The schema of the standard table or null if there isn't one.
   */
  public TableSchema lookupTable(final String name);

  /**
   * @param name A table name.
   * @return The schema of the object table or null if there isn't one.
   */
  public TableSchema lookupObjectTable(final String name);

}
