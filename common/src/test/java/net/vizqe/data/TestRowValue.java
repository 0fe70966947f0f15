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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.UUID;

import org.junit.Test;

public class TestRowValue {

  @Test
  public void strings() throws Exception {
    final RowValue value = RowValue.ofString("a1s1");
    assertEquals(ValueType.STRING, value.type());
    assertFalse(value.isNumeric());
    assertEquals("a1s1", value.asString());
    try {
      value.longValue();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    try {
      RowValue.ofString(null);
      fail("Expected NullPointerException");
    } catch (NullPointerException e) { }
  }

  @Test
  public void numbers() throws Exception {
    assertEquals(-42, RowValue.ofLong(-42).longValue());
    assertEquals("-42", RowValue.ofLong(-42).asString());
    assertTrue(RowValue.ofTimestamp(1000000).isNumeric());
    assertEquals("1000000", RowValue.ofTimestamp(1000000).asString());

    final RowValue unsigned = RowValue.ofUnsigned(-1);
    assertTrue(unsigned.isNumeric());
    assertEquals("18446744073709551615", unsigned.asString());
  }

  @Test
  public void uuids() throws Exception {
    final UUID uuid = UUID.randomUUID();
    final RowValue value = RowValue.ofUuid(uuid);
    assertEquals(uuid, value.uuidValue());
    assertEquals(uuid.toString(), value.asString());
    try {
      RowValue.ofLong(1).uuidValue();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }

  @Test
  public void equality() throws Exception {
    assertEquals(RowValue.ofLong(1), RowValue.ofLong(1));
    assertEquals(RowValue.ofLong(1).hashCode(), RowValue.ofLong(1).hashCode());
    assertNotEquals(RowValue.ofLong(1), RowValue.ofUnsigned(1));
    assertNotEquals(RowValue.ofString("1"), RowValue.ofLong(1));
  }
}
