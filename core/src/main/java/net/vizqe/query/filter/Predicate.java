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

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.primitives.Longs;

import net.vizqe.common.Const;
import net.vizqe.data.RowValue;
import net.vizqe.data.ValueType;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryParseException;

/**
 * A single match condition on one named field. Values are kept as strings
 * and compared against the string form of the row value, except for the
 * ordering operators which compare numerically when both sides are numbers.
 */
public final class Predicate implements RowFilter {

  private final String name;
  private final MatchOp op;
  private final String value;
  private final String value2;
  private final boolean ignore_col_absence;
  private final Pattern pattern;

  private Predicate(final Builder builder) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(builder.name),
        "Name cannot be null or empty.");
    Preconditions.checkNotNull(builder.op, "Op cannot be null.");
    Preconditions.checkNotNull(builder.value, "Value cannot be null.");
    name = builder.name;
    op = builder.op;
    value = builder.value;
    value2 = builder.value2;
    ignore_col_absence = builder.ignore_col_absence;
    if (op.isRange() && value2 == null) {
      throw new QueryParseException("Range match on " + name 
          + " requires " + Const.WHERE_MATCH_VALUE2);
    }
    if (op == MatchOp.REGEX_MATCH) {
      try {
        pattern = Pattern.compile(value);
      } catch (PatternSyntaxException e) {
        throw new InvalidQueryArgumentException(
            "Invalid regular expression for " + name + ": " + value, e);
      }
    } else {
      pattern = null;
    }
  }

  public String name() {
    return name;
  }

  public MatchOp op() {
    return op;
  }

  public String value() {
    return value;
  }

  /** @return The upper bound of a range match, null otherwise. */
  public String value2() {
    return value2;
  }

  public boolean ignoreColumnAbsence() {
    return ignore_col_absence;
  }

  @Override
  public boolean matches(final Map<String, RowValue> row) {
    final RowValue field = row.get(name);
    if (field == null) {
      return ignore_col_absence;
    }
    final String actual = field.asString();
    switch (op) {
    case EQUAL:
      return actual.equals(value);
    case NOT_EQUAL:
      return !actual.equals(value);
    case IN_RANGE:
      return inRange(field);
    case NOT_IN_RANGE:
      return !inRange(field);
    case LEQ:
      return compare(field, value) <= 0;
    case GEQ:
      return compare(field, value) >= 0;
    case PREFIX:
      return actual.startsWith(value);
    case REGEX_MATCH:
      return pattern.matcher(actual).find();
    default:
      throw new IllegalStateException("Unhandled operator: " + op);
    }
  }

  private boolean inRange(final RowValue field) {
    return compare(field, value) >= 0 && compare(field, value2) <= 0;
  }

  /**
   * Compares a row value to a literal, numerically if the value is numeric
   * and the literal parses, otherwise on the string forms.
   */
  static int compare(final RowValue field, final String literal) {
    if (field.isNumeric()) {
      final Long number = Longs.tryParse(literal.trim());
      if (number != null) {
        if (field.type() == ValueType.UINT64 && number >= 0) {
          return Long.compareUnsigned(field.longValue(), number);
        }
        return Long.compare(field.longValue(), number);
      }
    }
    return field.asString().compareTo(literal);
  }

  /**
   * Parses a match object of the form 
   * <code>{"name": ..., "value": ..., "op": ..., "value2": ...}</code>.
   * @param node The JSON object.
   * @return The predicate.
   * @throws QueryParseException if the object is malformed.
   * @throws InvalidQueryArgumentException if the operator or regex is bad.
   */
  public static Predicate fromJson(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new QueryParseException("Match term must be an object: " + node);
    }
    final JsonNode name = node.get(Const.WHERE_MATCH_NAME);
    final JsonNode value = node.get(Const.WHERE_MATCH_VALUE);
    final JsonNode op = node.get(Const.WHERE_MATCH_OP);
    if (name == null || !name.isTextual()) {
      throw new QueryParseException("Match term is missing a string " 
          + Const.WHERE_MATCH_NAME + ": " + node);
    }
    if (value == null || !value.isValueNode() || value.isNull()) {
      throw new QueryParseException("Match term is missing a " 
          + Const.WHERE_MATCH_VALUE + ": " + node);
    }
    if (op == null || !op.isIntegralNumber() || !op.canConvertToInt()) {
      throw new QueryParseException("Match term is missing an integer " 
          + Const.WHERE_MATCH_OP + ": " + node);
    }
    final Builder builder = newBuilder()
        .setName(name.asText())
        .setOp(MatchOp.fromCode(op.asInt()))
        .setValue(valueString(value));
    final JsonNode value2 = node.get(Const.WHERE_MATCH_VALUE2);
    if (value2 != null && !value2.isNull()) {
      if (!value2.isValueNode()) {
        throw new QueryParseException("Invalid " 
            + Const.WHERE_MATCH_VALUE2 + ": " + node);
      }
      builder.setValue2(valueString(value2));
    }
    return builder.build();
  }

  /**
   * Numbers are written out in plain decimal so that {@code 100}, 
   * {@code 100.0} and {@code 1e2} all compare as the same value.
   */
  private static String valueString(final JsonNode value) {
    if (value.isIntegralNumber()) {
      return value.bigIntegerValue().toString();
    }
    if (value.isNumber()) {
      return value.decimalValue().stripTrailingZeros().toPlainString();
    }
    return value.asText();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Predicate other = (Predicate) o;
    return Objects.equal(name, other.name)
        && op == other.op
        && Objects.equal(value, other.value)
        && Objects.equal(value2, other.value2)
        && ignore_col_absence == other.ignore_col_absence;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, op, value, value2, ignore_col_absence);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(name)
        .append(", op=")
        .append(op)
        .append(", value=")
        .append(value)
        .append(value2 == null ? "" : ", value2=" + value2)
        .append(ignore_col_absence ? ", ignoreAbsence" : "")
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private MatchOp op;
    private String value;
    private String value2;
    private boolean ignore_col_absence;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setOp(final MatchOp op) {
      this.op = op;
      return this;
    }

    public Builder setValue(final String value) {
      this.value = value;
      return this;
    }

    public Builder setValue2(final String value2) {
      this.value2 = value2;
      return this;
    }

    /**
     * @param ignore_col_absence Whether a row lacking the field passes.
     * @return The builder.
     */
    public Builder setIgnoreColumnAbsence(final boolean ignore_col_absence) {
      this.ignore_col_absence = ignore_col_absence;
      return this;
    }

    public Predicate build() {
      return new Predicate(this);
    }
  }
}
