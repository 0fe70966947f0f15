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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.vizqe.data.RecordShape;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.query.QueryStatus;
import net.vizqe.schema.Column;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.TableSchema;

public class TestProjectionSpec {

  private SchemaCatalog catalog;
  private TableSchema messages;
  private TableSchema series;
  private TableSchema records;

  @Before
  public void before() throws Exception {
    catalog = new SchemaCatalog();
    messages = catalog.lookupTable(SchemaCatalog.MESSAGE_TABLE);
    series = catalog.lookupTable(SchemaCatalog.FLOW_SERIES_TABLE);
    records = catalog.lookupTable(SchemaCatalog.FLOW_RECORD_TABLE);
  }

  @Test
  public void plainFields() throws Exception {
    final ProjectionSpec spec = ProjectionSpec.parse(
        "[\"MessageTS\", \"Source\"]", messages, false);
    assertEquals(ImmutableList.of("MessageTS", "Source"), spec.columns());
    assertFalse(spec.isAggregate());
    assertFalse(spec.provideTimeseries());
    assertFalse(spec.isObjectIdQuery());
    assertEquals(0, spec.granularity());
    assertNull(spec.flowSeriesQueryType());
    assertEquals(RecordShape.PLAIN, spec.recordShape());
    assertTrue(spec.isPresent("Source"));
    assertFalse(spec.isPresent("Module"));
    assertEquals(Column.STRING, spec.outputDatatype("Source", messages));
    assertNull(spec.outputDatatype("Module", messages));
  }

  @Test
  public void missingOrMalformed() throws Exception {
    final String[] bad = new String[] { null, "", "nope", "{}", "[1]", 
        "\"Source\"" };
    for (final String select : bad) {
      try {
        ProjectionSpec.parse(select, messages, false);
        fail("Expected QueryParseException for " + select);
      } catch (QueryParseException e) {
        assertEquals(QueryStatus.EBADMSG, e.getStatusCode());
      }
    }
  }

  @Test
  public void invalidFields() throws Exception {
    assertInvalid("[]", messages);
    assertInvalid("[\"NoSuchField\"]", messages);
    assertInvalid("[\"T\"]", messages);
    assertInvalid("[\"sum(Source)\"]", messages);
    assertInvalid("[\"sum(nope)\"]", messages);
    assertInvalid("[\"flow_count\"]", messages);
    assertInvalid("[\"T=0\"]", series);
    assertInvalid("[\"T=abc\"]", series);
    assertInvalid("[\"T\", \"T=60\"]", series);
  }

  private static void assertInvalid(final String select, 
                                    final TableSchema table) {
    try {
      ProjectionSpec.parse(select, table, false);
      fail("Expected InvalidQueryArgumentException for " + select);
    } catch (InvalidQueryArgumentException e) {
      assertEquals(QueryStatus.EINVAL, e.getStatusCode());
    }
  }

  @Test
  public void timeSeries() throws Exception {
    final ProjectionSpec spec = ProjectionSpec.parse(
        "[\"T=60\", \"sum(bytes)\"]", series, false);
    assertEquals(ImmutableList.of("T=", "sum(bytes)"), spec.columns());
    assertTrue(spec.provideTimeseries());
    assertTrue(spec.isAggregate());
    assertFalse(spec.needsCombine());
    assertEquals(60000000L, spec.granularity());
    assertEquals(FlowSeriesQueryType.TIME_STATS, spec.flowSeriesQueryType());
    assertEquals(RecordShape.STATS, spec.recordShape());
    assertEquals(Column.LONG, spec.outputDatatype("T=", series));
  }

  @Test
  public void flowSeriesClassification() throws Exception {
    assertEquals(FlowSeriesQueryType.TIME, ProjectionSpec.parse(
        "[\"T\"]", series, false).flowSeriesQueryType());
    assertEquals(FlowSeriesQueryType.FLOW_TUPLE, ProjectionSpec.parse(
        "[\"sourcevn\", \"destvn\"]", series, false).flowSeriesQueryType());
    assertEquals(FlowSeriesQueryType.STATS, ProjectionSpec.parse(
        "[\"sum(bytes)\"]", series, false).flowSeriesQueryType());
    assertEquals(FlowSeriesQueryType.FLOW_TUPLE_STATS, ProjectionSpec.parse(
        "[\"sourcevn\", \"sum(packets)\"]", series, false)
        .flowSeriesQueryType());
    assertEquals(FlowSeriesQueryType.TIME_FLOW_TUPLE_STATS, 
        ProjectionSpec.parse("[\"T\", \"sourcevn\", \"bytes\"]", series, 
            false).flowSeriesQueryType());
  }

  @Test
  public void recordShapes() throws Exception {
    assertEquals(RecordShape.PLAIN, ProjectionSpec.parse(
        "[\"T\"]", series, false).recordShape());
    assertEquals(RecordShape.STATS, ProjectionSpec.parse(
        "[\"flow_count\"]", series, false).recordShape());
    assertEquals(RecordShape.STATS_TUPLE, ProjectionSpec.parse(
        "[\"sourceip\", \"bytes\"]", series, false).recordShape());
    assertEquals(RecordShape.STATS_TUPLE, ProjectionSpec.parse(
        "[\"vrouter\"]", records, false).recordShape());
  }

  @Test
  public void aggregatesWithoutTime() throws Exception {
    final ProjectionSpec spec = ProjectionSpec.parse(
        "[\"Source\", \"count(Level)\", \"avg(Level)\"]", messages, false);
    assertTrue(spec.needsCombine());
    assertTrue(spec.hasAverage());
    assertFalse(spec.hasFlowCount());
    assertEquals(ImmutableList.of(0), spec.groupKeyIndexes());
    assertEquals(Column.LONG, spec.outputDatatype("count(Level)", messages));
  }

  @Test
  public void objectIdQuery() throws Exception {
    final TableSchema vn = catalog.lookupObjectTable("ObjectVNTable");
    assertTrue(ProjectionSpec.parse("[\"ObjectId\"]", vn, true)
        .isObjectIdQuery());
    assertFalse(ProjectionSpec.parse("[\"ObjectId\", \"Source\"]", vn, true)
        .isObjectIdQuery());
    assertFalse(ProjectionSpec.parse("[\"ObjectId\"]", vn, false)
        .isObjectIdQuery());
  }

  @Test
  public void combine() throws Exception {
    final ProjectionSpec spec = ProjectionSpec.parse(
        "[\"sourcevn\", \"sum(bytes)\", \"count(bytes)\"]", series, false);
    final ResultRow combined = spec.combine(
        ResultRow.of(RowValue.ofString("vn1"), RowValue.ofUnsigned(100), 
            RowValue.ofUnsigned(2)),
        ResultRow.of(RowValue.ofString("vn1"), RowValue.ofUnsigned(50), 
            RowValue.ofUnsigned(1)));
    assertEquals(RowValue.ofString("vn1"), combined.get(0));
    assertEquals(RowValue.ofUnsigned(150), combined.get(1));
    assertEquals(RowValue.ofUnsigned(3), combined.get(2));
  }
}
