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
package net.vizqe.query.processor.postprocess;

import java.net.InetAddress;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.net.InetAddresses;

import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.data.ValueType;
import net.vizqe.schema.Column;

/**
 * Orders result rows on a composite key of sort fields. Earlier fields take
 * precedence. Rows lacking a sort value order before rows that have one,
 * whatever the direction.
 */
public class RowComparator implements Comparator<ResultRow> {

  /** Numeric when both values are numbers, lexical otherwise. */
  static final Ordering<RowValue> NUMERIC = new Ordering<RowValue>() {
    @Override
    public int compare(final RowValue a, final RowValue b) {
      if (a.isNumeric() && b.isNumeric()) {
        if (a.type() == ValueType.UINT64 && b.type() == ValueType.UINT64) {
          return Long.compareUnsigned(a.longValue(), b.longValue());
        }
        return Long.compare(a.longValue(), b.longValue());
      }
      return a.asString().compareTo(b.asString());
    }
  };

  /** By the unsigned 32 bit address value, lexical for anything else. */
  static final Ordering<RowValue> IPADDR = new Ordering<RowValue>() {
    @Override
    public int compare(final RowValue a, final RowValue b) {
      final String first = a.asString();
      final String second = b.asString();
      if (InetAddresses.isInetAddress(first) 
          && InetAddresses.isInetAddress(second)) {
        return ComparisonChain.start()
            .compare(addressValue(first), addressValue(second))
            .result();
      }
      return first.compareTo(second);
    }
  };

  static final Ordering<RowValue> LEXICAL = new Ordering<RowValue>() {
    @Override
    public int compare(final RowValue a, final RowValue b) {
      return a.asString().compareTo(b.asString());
    }
  };

  private final int[] indexes;
  private final List<Ordering<RowValue>> orderings;

  /**
   * Default ctor.
   * @param fields The sort fields in precedence order.
   * @param order The direction applied to every field.
   * @param columns The column names of the rows to compare.
   */
  public RowComparator(final List<SortField> fields,
                       final SortOrder order,
                       final List<String> columns) {
    indexes = new int[fields.size()];
    orderings = Lists.newArrayListWithCapacity(fields.size());
    for (int i = 0; i < fields.size(); i++) {
      final SortField field = fields.get(i);
      indexes[i] = columns.indexOf(field.name());
      Ordering<RowValue> ordering = forDatatype(field.datatype());
      if (order == SortOrder.DESCENDING) {
        ordering = ordering.reverse();
      }
      orderings.add(ordering.nullsFirst());
    }
  }

  @Override
  public int compare(final ResultRow a, final ResultRow b) {
    ComparisonChain chain = ComparisonChain.start();
    for (int i = 0; i < indexes.length; i++) {
      chain = chain.compare(value(a, indexes[i]), value(b, indexes[i]), 
          orderings.get(i));
    }
    return chain.result();
  }

  private static RowValue value(final ResultRow row, final int index) {
    return index < 0 || index >= row.size() ? null : row.get(index);
  }

  /**
   * @param datatype A schema datatype.
   * @return The ordering for values of that type.
   */
  static Ordering<RowValue> forDatatype(final String datatype) {
    if (Column.INT.equals(datatype) || Column.LONG.equals(datatype)) {
      return NUMERIC;
    } else if (Column.IPADDR.equals(datatype)) {
      return IPADDR;
    }
    return LEXICAL;
  }

  private static long addressValue(final String address) {
    final InetAddress inet = InetAddresses.forString(address);
    return Integer.toUnsignedLong(InetAddresses.coerceToInteger(inet));
  }
}
