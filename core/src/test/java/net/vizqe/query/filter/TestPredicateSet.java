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
package net.vizqe.query.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.vizqe.data.RowValue;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.query.QueryStatus;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.TableSchema;

public class TestPredicateSet {

  private TableSchema messages;
  private TableSchema series;

  @Before
  public void before() throws Exception {
    final SchemaCatalog catalog = new SchemaCatalog();
    messages = catalog.lookupTable(SchemaCatalog.MESSAGE_TABLE);
    series = catalog.lookupTable(SchemaCatalog.FLOW_SERIES_TABLE);
  }

  private static Map<String, RowValue> message(final String source, 
                                               final String module) {
    return ImmutableMap.of(
        "Source", RowValue.ofString(source),
        "Module", RowValue.ofString(module));
  }

  @Test
  public void emptyMatchesAll() throws Exception {
    PredicateSet set = PredicateSet.parse(null, null, messages, null);
    assertTrue(set.isMatchAll());
    assertTrue(set.groups().isEmpty());
    assertTrue(set.matches(message("a1s1", "Collector")));

    set = PredicateSet.parse("", null, messages, null);
    assertTrue(set.isMatchAll());
    set = PredicateSet.parse("[]", null, messages, null);
    assertTrue(set.isMatchAll());
  }

  @Test
  public void orOfAnds() throws Exception {
    final PredicateSet set = PredicateSet.parse(
        "[[{\"name\":\"Source\",\"value\":\"a1s1\",\"op\":1},"
        + "{\"name\":\"Module\",\"value\":\"Collector\",\"op\":1}],"
        + "[{\"name\":\"Source\",\"value\":\"b\",\"op\":7}]]", 
        null, messages, null);
    assertFalse(set.isMatchAll());
    assertEquals(2, set.groups().size());
    assertTrue(set.matches(message("a1s1", "Collector")));
    assertFalse(set.matches(message("a1s1", "OpServer")));
    assertTrue(set.matches(message("b2s2", "OpServer")));
    assertFalse(set.matches(message("c3s3", "Collector")));
  }

  @Test
  public void nonIndexedField() throws Exception {
    try {
      PredicateSet.parse(
          "[[{\"name\":\"Xmlmessage\",\"value\":\"x\",\"op\":1}]]", 
          null, messages, null);
      fail("Expected InvalidQueryArgumentException");
    } catch (InvalidQueryArgumentException e) {
      assertEquals(QueryStatus.EINVAL, e.getStatusCode());
    }
  }

  @Test
  public void unknownField() throws Exception {
    try {
      PredicateSet.parse(
          "[[{\"name\":\"NoSuchField\",\"value\":\"x\",\"op\":1}]]", 
          null, messages, null);
      fail("Expected InvalidQueryArgumentException");
    } catch (InvalidQueryArgumentException e) {
      assertEquals(QueryStatus.EINVAL, e.getStatusCode());
    }
  }

  @Test
  public void malformed() throws Exception {
    final String[] bad = new String[] {
        "not json",
        "{\"name\":\"Source\",\"value\":\"a1s1\",\"op\":1}",
        "[{\"name\":\"Source\",\"value\":\"a1s1\",\"op\":1}]",
        "[[]]",
        "[[{\"name\":\"Source\",\"op\":1}]]"
    };
    for (final String where : bad) {
      try {
        PredicateSet.parse(where, null, messages, null);
        fail("Expected QueryParseException for " + where);
      } catch (QueryParseException e) {
        assertEquals(QueryStatus.EBADMSG, e.getStatusCode());
      }
    }
  }

  @Test
  public void ownLogsFilterIntoEveryGroup() throws Exception {
    final PredicateSet set = PredicateSet.parse(
        "[[{\"name\":\"Source\",\"value\":\"a1s1\",\"op\":1}],"
        + "[{\"name\":\"Source\",\"value\":\"b1s1\",\"op\":1}]]", 
        null, messages, "QueryEngine");
    assertFalse(set.isMatchAll());
    for (final List<Predicate> group : set.groups()) {
      final Predicate last = group.get(group.size() - 1);
      assertEquals("Module", last.name());
      assertEquals(MatchOp.NOT_EQUAL, last.op());
      assertEquals("QueryEngine", last.value());
      assertTrue(last.ignoreColumnAbsence());
    }
    assertTrue(set.matches(message("a1s1", "Collector")));
    assertFalse(set.matches(message("a1s1", "QueryEngine")));
    // rows without a module pass
    assertTrue(set.matches(ImmutableMap.of("Source", 
        RowValue.ofString("b1s1"))));
  }

  @Test
  public void ownLogsFilterOnMatchAll() throws Exception {
    final PredicateSet set = PredicateSet.parse(null, null, messages, 
        "QueryEngine");
    assertTrue(set.isMatchAll());
    assertEquals(1, set.groups().size());
    assertEquals(1, set.groups().get(0).size());
    assertFalse(set.matches(message("a1s1", "QueryEngine")));
    assertTrue(set.matches(message("a1s1", "Collector")));
  }

  @Test
  public void direction() throws Exception {
    assertEquals(1, PredicateSet.parse(null, null, series, null).direction());
    assertEquals(0, PredicateSet.parse(null, "0", series, null).direction());
    assertEquals(1, PredicateSet.parse(null, " 1 ", series, null).direction());
    try {
      PredicateSet.parse(null, "ingress", series, null);
      fail("Expected QueryParseException");
    } catch (QueryParseException e) { }
    try {
      PredicateSet.parse(null, "2", series, null);
      fail("Expected InvalidQueryArgumentException");
    } catch (InvalidQueryArgumentException e) { }
  }

  @Test
  public void parseFilterSkipsSchema() throws Exception {
    assertSame(PredicateSet.MATCH_ALL, PredicateSet.parseFilter(null));
    final PredicateSet filter = PredicateSet.parseFilter(
        "[{\"name\":\"sum(bytes)\",\"value\":\"100\",\"op\":6}]");
    assertTrue(filter.matches(ImmutableMap.of("sum(bytes)", 
        RowValue.ofUnsigned(150))));
    assertFalse(filter.matches(ImmutableMap.of("sum(bytes)", 
        RowValue.ofUnsigned(50))));
    assertFalse(filter.matches(ImmutableMap.<String, RowValue>of()));
  }

  @Test
  public void parseFilterAndsEveryTerm() throws Exception {
    assertSame(PredicateSet.MATCH_ALL, PredicateSet.parseFilter("[]"));
    final PredicateSet filter = PredicateSet.parseFilter(
        "[{\"name\":\"Level\",\"value\":\"6\",\"op\":5},"
        + "{\"name\":\"Source\",\"value\":\"a1\",\"op\":7}]");
    assertEquals(1, filter.groups().size());
    assertEquals(2, filter.groups().get(0).size());
    assertTrue(filter.matches(ImmutableMap.of(
        "Level", RowValue.ofLong(6), "Source", RowValue.ofString("a1s1"))));
    assertFalse(filter.matches(ImmutableMap.of(
        "Level", RowValue.ofLong(7), "Source", RowValue.ofString("a1s1"))));
    assertFalse(filter.matches(ImmutableMap.of(
        "Level", RowValue.ofLong(3), "Source", RowValue.ofString("b2s2"))));
  }

  @Test
  public void parseFilterMalformed() throws Exception {
    final String[] bad = new String[] {
        "{\"name\":\"Level\",\"value\":\"6\",\"op\":5}",
        "[[{\"name\":\"Level\",\"value\":\"6\",\"op\":5}]]",
        "[\"Level\"]",
        "[{\"name\":\"Level\""
    };
    for (final String filter : bad) {
      try {
        PredicateSet.parseFilter(filter);
        fail("Expected QueryParseException for " + filter);
      } catch (QueryParseException e) {
        assertEquals(QueryStatus.EBADMSG, e.getStatusCode());
      }
    }
  }
}
