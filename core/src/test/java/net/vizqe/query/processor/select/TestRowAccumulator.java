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
package net.vizqe.query.processor.select;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Map;
import java.util.UUID;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.vizqe.data.ResultBuffer;
import net.vizqe.data.RowValue;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.TableSchema;

public class TestRowAccumulator {
  private static final long MINUTE = 60000000L;

  private TableSchema messages;
  private TableSchema series;

  @Before
  public void before() throws Exception {
    final SchemaCatalog catalog = new SchemaCatalog();
    messages = catalog.lookupTable(SchemaCatalog.MESSAGE_TABLE);
    series = catalog.lookupTable(SchemaCatalog.FLOW_SERIES_TABLE);
  }

  private static Map<String, RowValue> flow(final String vn, 
                                            final long bytes,
                                            final UUID uuid) {
    return ImmutableMap.of(
        "sourcevn", RowValue.ofString(vn),
        "bytes", RowValue.ofUnsigned(bytes),
        "UuidKey", RowValue.ofUuid(uuid));
  }

  @Test
  public void plainRows() throws Exception {
    final RowAccumulator accumulator = ProjectionSpec.parse(
        "[\"Source\", \"Category\"]", messages, false)
        .newAccumulator("MessageTable", 0);
    accumulator.add(10, ImmutableMap.of("Source", RowValue.ofString("a1s1")));
    accumulator.add(20, ImmutableMap.of("Source", RowValue.ofString("b1s1"), 
        "Category", RowValue.ofString("boot")));
    final ResultBuffer buffer = accumulator.build();
    assertEquals("MessageTable", buffer.name());
    assertEquals(2, buffer.size());
    assertEquals(RowValue.ofString("a1s1"), buffer.rows().get(0).get(0));
    assertNull(buffer.rows().get(0).get(1));
    assertEquals(RowValue.ofString("boot"), buffer.rows().get(1).get(1));
  }

  @Test
  public void groupByKeyInFirstSeenOrder() throws Exception {
    final RowAccumulator accumulator = ProjectionSpec.parse(
        "[\"sourcevn\", \"sum(bytes)\", \"count(bytes)\", \"avg(bytes)\"]", 
        series, false).newAccumulator("FlowSeriesTable", 0);
    accumulator.add(1, flow("vn2", 10, UUID.randomUUID()));
    accumulator.add(2, flow("vn1", 100, UUID.randomUUID()));
    accumulator.add(3, flow("vn2", 30, UUID.randomUUID()));
    final ResultBuffer buffer = accumulator.build();
    assertEquals(2, buffer.size());
    assertEquals(RowValue.ofString("vn2"), buffer.rows().get(0).get(0));
    assertEquals(RowValue.ofUnsigned(40), buffer.rows().get(0).get(1));
    assertEquals(RowValue.ofUnsigned(2), buffer.rows().get(0).get(2));
    assertEquals(RowValue.ofLong(20), buffer.rows().get(0).get(3));
    assertEquals(RowValue.ofString("vn1"), buffer.rows().get(1).get(0));
    assertEquals(RowValue.ofUnsigned(100), buffer.rows().get(1).get(1));
  }

  @Test
  public void timeBuckets() throws Exception {
    final long origin = 1000000L;
    final RowAccumulator accumulator = ProjectionSpec.parse(
        "[\"T=60\", \"sum(bytes)\"]", series, false)
        .newAccumulator("FlowSeriesTable", origin);
    final UUID uuid = UUID.randomUUID();
    accumulator.add(origin, flow("vn1", 1, uuid));
    accumulator.add(origin + MINUTE - 1, flow("vn1", 2, uuid));
    accumulator.add(origin + MINUTE, flow("vn1", 4, uuid));
    accumulator.add(origin + 3 * MINUTE + 5, flow("vn1", 8, uuid));
    final ResultBuffer buffer = accumulator.build();
    assertEquals(3, buffer.size());
    assertEquals(RowValue.ofTimestamp(origin), buffer.rows().get(0).get(0));
    assertEquals(RowValue.ofUnsigned(3), buffer.rows().get(0).get(1));
    assertEquals(RowValue.ofTimestamp(origin + MINUTE), 
        buffer.rows().get(1).get(0));
    assertEquals(RowValue.ofTimestamp(origin + 3 * MINUTE), 
        buffer.rows().get(2).get(0));
    assertEquals(RowValue.ofUnsigned(8), buffer.rows().get(2).get(1));
  }

  @Test
  public void flowCountIsDistinct() throws Exception {
    final RowAccumulator accumulator = ProjectionSpec.parse(
        "[\"flow_count\"]", series, false)
        .newAccumulator("FlowSeriesTable", 0);
    final UUID first = UUID.randomUUID();
    accumulator.add(1, flow("vn1", 1, first));
    accumulator.add(2, flow("vn1", 1, first));
    accumulator.add(3, flow("vn2", 1, UUID.randomUUID()));
    final ResultBuffer buffer = accumulator.build();
    assertEquals(1, buffer.size());
    assertEquals(RowValue.ofUnsigned(2), buffer.rows().get(0).get(0));
  }

  @Test
  public void rawTimestamp() throws Exception {
    final RowAccumulator accumulator = ProjectionSpec.parse(
        "[\"T\", \"sourcevn\"]", series, false)
        .newAccumulator("FlowSeriesTable", 0);
    accumulator.add(42, flow("vn1", 1, UUID.randomUUID()));
    assertEquals(RowValue.ofTimestamp(42), 
        accumulator.build().rows().get(0).get(0));
  }
}
