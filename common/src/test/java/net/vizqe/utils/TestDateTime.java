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
package net.vizqe.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestDateTime {

  @Test
  public void parseDuration() throws Exception {
    assertEquals(250, DateTime.parseDuration("250ms"));
    assertEquals(60000, DateTime.parseDuration("60s"));
    assertEquals(600000, DateTime.parseDuration("10m"));
    assertEquals(3 * 3600000L, DateTime.parseDuration("3h"));
    assertEquals(30 * 86400000L, DateTime.parseDuration("30d"));
    assertEquals(2 * 7 * 86400000L, DateTime.parseDuration("2w"));
    assertEquals(30 * 86400000L, DateTime.parseDuration("1n"));
    assertEquals(365 * 86400000L, DateTime.parseDuration("1y"));
    assertEquals(3600000L, DateTime.parseDuration("1H"));
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationNull() throws Exception {
    DateTime.parseDuration(null);
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationEmpty() throws Exception {
    DateTime.parseDuration("");
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationNoNumber() throws Exception {
    DateTime.parseDuration("d");
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationZero() throws Exception {
    DateTime.parseDuration("0s");
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationBadSuffix() throws Exception {
    DateTime.parseDuration("10x");
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseDurationNoSuffix() throws Exception {
    DateTime.parseDuration("10");
  }

  @Test
  public void currentTimeMicros() throws Exception {
    final long before = System.currentTimeMillis() * 1000;
    final long now = DateTime.currentTimeMicros();
    assertTrue(now >= before);
    assertTrue(now < before + 60000000L);
  }

  @Test
  public void secondsToMicros() throws Exception {
    assertEquals(60000000L, DateTime.secondsToMicros(60));
    assertEquals(0, DateTime.secondsToMicros(0));
  }
}
