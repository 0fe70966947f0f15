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

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.vizqe.common.Const;
import net.vizqe.data.RowValue;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.schema.Column;
import net.vizqe.schema.TableSchema;
import net.vizqe.utils.JSON;

/**
 * The WHERE clause of a query: a disjunction of groups, each group a
 * conjunction of predicates. A set without groups matches every row.
 * Also carries the requested flow direction.
 */
public final class PredicateSet implements RowFilter {
  private static final Logger LOG = LoggerFactory.getLogger(PredicateSet.class);

  /** Shared instance that matches everything in the ingress direction. */
  public static final PredicateSet MATCH_ALL = new PredicateSet(
      ImmutableList.<List<Predicate>>of(), true, Const.FLOW_DIR_INGRESS);

  private final List<List<Predicate>> groups;
  private final boolean match_all;
  private final int direction;

  private PredicateSet(final List<List<Predicate>> groups,
                       final boolean match_all,
                       final int direction) {
    this.groups = groups;
    this.match_all = match_all;
    this.direction = direction;
  }

  /** @return The OR-ed groups of AND-ed predicates. */
  public List<List<Predicate>> groups() {
    return groups;
  }

  /** @return True if the caller supplied no predicates at all. */
  public boolean isMatchAll() {
    return match_all;
  }

  /** @return The requested flow direction, 1 for ingress, 0 for egress. */
  public int direction() {
    return direction;
  }

  @Override
  public boolean matches(final Map<String, RowValue> row) {
    if (groups.isEmpty()) {
      return true;
    }
    for (final List<Predicate> group : groups) {
      boolean all = true;
      for (final Predicate predicate : group) {
        if (!predicate.matches(row)) {
          all = false;
          break;
        }
      }
      if (all) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("groups=")
        .append(groups)
        .append(", direction=")
        .append(direction)
        .toString();
  }

  /**
   * Parses and validates a WHERE clause against a table.
   * @param where The JSON array of arrays of match objects. May be null or
   * empty to match every row.
   * @param dir The flow direction term, may be null for ingress.
   * @param table The non-null table schema the fields must belong to.
   * @param excluded_module When not null, rows whose Module equals this value
   * are dropped. Rows without a Module pass.
   * @return The predicate set.
   * @throws QueryParseException if the clause is not well formed.
   * @throws InvalidQueryArgumentException if a field is unknown or not
   * indexed, or an operator or regex is invalid.
   */
  public static PredicateSet parse(final String where,
                                   final String dir,
                                   final TableSchema table,
                                   final String excluded_module) {
    final int direction = parseDirection(dir);
    final List<List<Predicate>> groups = parseGroups(where, table);
    final boolean match_all = groups.isEmpty();

    if (excluded_module != null) {
      final Predicate own_logs = Predicate.newBuilder()
          .setName(Const.MODULE)
          .setOp(MatchOp.NOT_EQUAL)
          .setValue(excluded_module)
          .setIgnoreColumnAbsence(true)
          .build();
      if (groups.isEmpty()) {
        groups.add(Lists.newArrayList(own_logs));
      } else {
        for (final List<Predicate> group : groups) {
          group.add(own_logs);
        }
      }
    }

    final ImmutableList.Builder<List<Predicate>> immutable = 
        ImmutableList.builder();
    for (final List<Predicate> group : groups) {
      immutable.add(ImmutableList.copyOf(group));
    }
    final PredicateSet set = new PredicateSet(immutable.build(), match_all, 
        direction);
    if (LOG.isTraceEnabled()) {
      LOG.trace("Parsed where clause for " + table.name() + ": " + set);
    }
    return set;
  }

  /**
   * Parses a result filter: a flat JSON array of match objects that must
   * all hold for a row to be kept. Fields are not checked against a schema
   * since they may name aggregates such as {@code sum(bytes)}.
   * @param filter The JSON array of match objects, may be null.
   * @return The filter, matching everything if the array was empty.
   * @throws QueryParseException if the filter is not well formed.
   * @throws InvalidQueryArgumentException if an operator or regex is invalid.
   */
  public static PredicateSet parseFilter(final String filter) {
    final JsonNode root = parseArray(filter);
    if (root == null || root.size() < 1) {
      return MATCH_ALL;
    }
    final ImmutableList.Builder<Predicate> group = ImmutableList.builder();
    for (final JsonNode term : root) {
      if (!term.isObject()) {
        throw new QueryParseException("Filter entry must be an object: " 
            + term);
      }
      group.add(Predicate.fromJson(term));
    }
    final List<List<Predicate>> groups = ImmutableList.<List<Predicate>>of(
        group.build());
    return new PredicateSet(groups, false, Const.FLOW_DIR_INGRESS);
  }

  /**
   * @param clause The JSON clause, may be null or empty.
   * @param table The schema to validate fields against, null to skip.
   * @return A mutable list of mutable groups.
   */
  private static List<List<Predicate>> parseGroups(final String clause,
                                                   final TableSchema table) {
    final List<List<Predicate>> groups = Lists.newArrayList();
    final JsonNode root = parseArray(clause);
    if (root == null) {
      return groups;
    }
    for (final JsonNode group_node : root) {
      if (!group_node.isArray()) {
        throw new QueryParseException("Clause group must be an array: " 
            + group_node);
      }
      if (group_node.size() < 1) {
        throw new QueryParseException("Clause group cannot be empty: " 
            + clause);
      }
      final List<Predicate> group = Lists.newArrayList();
      for (final JsonNode term : group_node) {
        final Predicate predicate = Predicate.fromJson(term);
        if (table != null) {
          validate(predicate, table);
        }
        group.add(predicate);
      }
      groups.add(group);
    }
    return groups;
  }

  /** @return The parsed array or null if the clause was blank. */
  private static JsonNode parseArray(final String clause) {
    if (Strings.isNullOrEmpty(clause) || clause.trim().isEmpty()) {
      return null;
    }
    final JsonNode root;
    try {
      root = JSON.parseToNode(clause);
    } catch (IllegalArgumentException e) {
      throw new QueryParseException("Failed to parse clause: " + clause, e);
    }
    if (!root.isArray()) {
      throw new QueryParseException("Clause must be an array: " + clause);
    }
    return root;
  }

  private static void validate(final Predicate predicate, 
                               final TableSchema table) {
    final Column column = table.column(predicate.name());
    if (column == null) {
      throw new InvalidQueryArgumentException("Unknown field " 
          + predicate.name() + " in table " + table.name());
    }
    if (!column.indexed()) {
      throw new InvalidQueryArgumentException("Field " + predicate.name() 
          + " is not indexed in table " + table.name());
    }
  }

  private static int parseDirection(final String dir) {
    if (Strings.isNullOrEmpty(dir)) {
      return Const.FLOW_DIR_INGRESS;
    }
    final int direction;
    try {
      direction = Integer.parseInt(dir.trim());
    } catch (NumberFormatException e) {
      throw new QueryParseException("Invalid direction: " + dir, e);
    }
    if (direction != Const.FLOW_DIR_INGRESS 
        && direction != Const.FLOW_DIR_EGRESS) {
      throw new InvalidQueryArgumentException("Unknown direction: " + dir);
    }
    return direction;
  }
}
