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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.vizqe.data.Extraction;
import net.vizqe.data.FlowStats;
import net.vizqe.data.FlowTuple;
import net.vizqe.data.RecordShape;
import net.vizqe.data.RowValue;
import net.vizqe.data.StorageRow;
import net.vizqe.exceptions.QueryAssertionException;

public class TestRecordReader {
  private static final UUID FLOW = UUID.randomUUID();

  private static List<RowValue> statsTuple() {
    return ImmutableList.of(
        RowValue.ofUnsigned(1500), 
        RowValue.ofUnsigned(3), 
        RowValue.ofLong(1), 
        RowValue.ofUuid(FLOW),
        RowValue.ofString("vr1"),
        RowValue.ofString("vn1"),
        RowValue.ofString("vn2"),
        RowValue.ofString("10.1.1.1"),
        RowValue.ofString("10.2.2.2"),
        RowValue.ofLong(6),
        RowValue.ofLong(32768),
        RowValue.ofLong(80),
        RowValue.ofLong(1));
  }

  @Test
  public void stats() throws Exception {
    final Extraction<FlowStats> stats = RecordReader.stats(statsTuple());
    assertTrue(stats.isValid());
    assertEquals(1500, stats.value().bytes());
    assertEquals(3, stats.value().packets());
    assertTrue(stats.value().isShortFlow());
    assertEquals(FLOW, RecordReader.uuid(statsTuple(), 3).value());
  }

  @Test
  public void tuple() throws Exception {
    final Extraction<FlowTuple> tuple = RecordReader.tuple(statsTuple());
    assertTrue(tuple.isValid());
    assertEquals("vr1", tuple.value().vrouter());
    assertEquals("vn1", tuple.value().sourceVn());
    assertEquals("vn2", tuple.value().destVn());
    assertEquals("10.1.1.1", tuple.value().sourceIp());
    assertEquals("10.2.2.2", tuple.value().destIp());
    assertEquals(6, tuple.value().protocol());
    assertEquals(32768, tuple.value().sourcePort());
    assertEquals(80, tuple.value().destPort());
    assertEquals(1, tuple.value().direction());
  }

  @Test
  public void mismatches() throws Exception {
    // signed where unsigned is expected
    Extraction<FlowStats> stats = RecordReader.stats(ImmutableList.of(
        RowValue.ofLong(1), RowValue.ofUnsigned(1), RowValue.ofLong(0), 
        RowValue.ofUuid(FLOW)));
    assertFalse(stats.isValid());
    assertTrue(stats.error().contains("index 0"));

    // too short
    stats = RecordReader.stats(ImmutableList.of(RowValue.ofUnsigned(1)));
    assertFalse(stats.isValid());
    assertTrue(stats.error().contains("index 1"));

    assertFalse(RecordReader.uuid(ImmutableList.<RowValue>of(), 0).isValid());
    assertFalse(RecordReader.tuple(statsTuple().subList(0, 4)).isValid());
  }

  @Test
  public void readStatsTuple() throws Exception {
    final StorageRow row = StorageRow.newBuilder()
        .setTimestamp(42)
        .addColumn("vrouter", RowValue.ofString("vr1"))
        .addInfo(statsTuple())
        .build();
    final Map<String, RowValue> fields = RecordReader.read(
        RecordShape.STATS_TUPLE, row);
    assertEquals(RowValue.ofUnsigned(1500), fields.get("bytes"));
    assertEquals(RowValue.ofUnsigned(3), fields.get("packets"));
    assertEquals(RowValue.ofLong(1), fields.get("short_flow"));
    assertEquals(RowValue.ofUuid(FLOW), fields.get("UuidKey"));
    assertEquals(RowValue.ofString("10.2.2.2"), fields.get("destip"));
    assertEquals(RowValue.ofLong(80), fields.get("dport"));
    assertEquals(RowValue.ofLong(1), fields.get("direction_ing"));
  }

  @Test
  public void readPlain() throws Exception {
    final StorageRow row = StorageRow.newBuilder()
        .setTimestamp(42)
        .addColumn("Source", RowValue.ofString("a1s1"))
        .addInfo(RowValue.ofUuid(FLOW))
        .build();
    final Map<String, RowValue> fields = RecordReader.read(RecordShape.PLAIN, 
        row);
    assertEquals(2, fields.size());
    assertEquals(RowValue.ofString("a1s1"), fields.get("Source"));
  }

  @Test
  public void readMismatchIsAnAssertion() throws Exception {
    final StorageRow row = StorageRow.newBuilder()
        .setTimestamp(42)
        .addInfo(RowValue.ofUuid(FLOW))
        .build();
    try {
      RecordReader.read(RecordShape.STATS, row);
      fail("Expected QueryAssertionException");
    } catch (QueryAssertionException e) {
      assertEquals(QueryStatus.ENOTRECOVERABLE, e.getStatusCode());
    }
  }
}
