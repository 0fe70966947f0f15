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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestTableSchema {

  @Test
  public void lookup() throws Exception {
    final TableSchema schema = TableSchema.newBuilder()
        .setName("ObjectVNTable")
        .setRowTimeBits(23)
        .addColumn("ObjectId", Column.STRING, true)
        .addColumn("MessageTS", Column.LONG, false)
        .build();
    assertEquals(2, schema.columns().size());
    assertTrue(schema.column("ObjectId").indexed());
    assertFalse(schema.column("MessageTS").indexed());
    assertTrue(schema.column("MessageTS").isNumeric());
    assertEquals(Column.STRING, schema.datatype("ObjectId"));
    assertNull(schema.column("Source"));
    assertNull(schema.datatype("Source"));
    assertEquals(8388608L, schema.minGranularity());

    final TableSchema renamed = schema.rename("ObjectVMTable");
    assertEquals("ObjectVMTable", renamed.name());
    assertEquals(schema.columns(), renamed.columns());
    assertEquals(schema.minGranularity(), renamed.minGranularity());
  }
}
