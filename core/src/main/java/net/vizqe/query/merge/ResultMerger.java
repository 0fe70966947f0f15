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
package net.vizqe.query.merge;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.vizqe.data.ResultBuffer;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.query.processor.postprocess.PostProcessSpec;
import net.vizqe.query.processor.select.ProjectionSpec;

/**
 * Merges the buffers of several batches into one. Unsorted results are
 * concatenated in batch order; sorted results are merged with a k-way merge
 * that keeps batch order for ties. Emission stops at the limit.
 * <p>
 * Aggregates without time-series output are first combined by group key
 * across batches, then sorted and limited.
 */
public class ResultMerger {

  private final ProjectionSpec projection;
  private final PostProcessSpec post_process;

  public ResultMerger(final ProjectionSpec projection,
                      final PostProcessSpec post_process) {
    this.projection = projection;
    this.post_process = post_process;
  }

  /**
   * Folds one more batch into the running result. Combined aggregates are
   * neither filtered nor limited since later batches may still add to them.
   * @param accumulated The result of the earlier batches.
   * @param incoming The next batch.
   * @return The merged buffer.
   */
  public ResultBuffer mergePartial(final ResultBuffer accumulated,
                                   final ResultBuffer incoming) {
    return merge(ImmutableList.of(accumulated, incoming), true);
  }

  /**
   * @param buffers The successful batch buffers in batch order.
   * @return The merged buffer.
   */
  public ResultBuffer mergeFinal(final List<ResultBuffer> buffers) {
    return merge(buffers, false);
  }

  private ResultBuffer merge(final List<ResultBuffer> buffers, 
                             final boolean combine_pending) {
    final String name = buffers.isEmpty() ? projection.table() 
        : buffers.get(0).name();
    final List<String> columns = projection.columns();
    final int limit = post_process.limit();

    if (projection.needsCombine()) {
      final ResultBuffer combined = new ResultBuffer(name, columns, 
          combine(buffers));
      return post_process.process(combined, combine_pending);
    }

    final List<ResultRow> rows = Lists.newArrayList();
    if (!post_process.isSorted()) {
      for (final ResultBuffer buffer : buffers) {
        for (final ResultRow row : buffer.rows()) {
          if (limit > 0 && rows.size() >= limit) {
            return new ResultBuffer(name, columns, rows);
          }
          rows.add(row);
        }
      }
      return new ResultBuffer(name, columns, rows);
    }

    final Comparator<ResultRow> comparator = 
        post_process.comparator(columns);
    final PriorityQueue<Cursor> queue = new PriorityQueue<Cursor>(
        Math.max(1, buffers.size()), new Comparator<Cursor>() {
          @Override
          public int compare(final Cursor a, final Cursor b) {
            return ComparisonChain.start()
                .compare(a.current(), b.current(), comparator)
                .compare(a.batch, b.batch)
                .result();
          }
        });
    for (int i = 0; i < buffers.size(); i++) {
      if (!buffers.get(i).isEmpty()) {
        queue.add(new Cursor(i, buffers.get(i).rows()));
      }
    }
    while (!queue.isEmpty()) {
      if (limit > 0 && rows.size() >= limit) {
        break;
      }
      final Cursor cursor = queue.poll();
      rows.add(cursor.current());
      if (cursor.advance()) {
        queue.add(cursor);
      }
    }
    return new ResultBuffer(name, columns, rows);
  }

  /** Combines rows with equal group keys in order of first appearance. */
  private List<ResultRow> combine(final List<ResultBuffer> buffers) {
    final List<Integer> key_indexes = projection.groupKeyIndexes();
    final Map<List<RowValue>, ResultRow> groups = Maps.newLinkedHashMap();
    for (final ResultBuffer buffer : buffers) {
      for (final ResultRow row : buffer.rows()) {
        final List<RowValue> key = Lists.newArrayListWithCapacity(
            key_indexes.size());
        for (final int index : key_indexes) {
          key.add(row.get(index));
        }
        final ResultRow existing = groups.get(key);
        groups.put(key, existing == null ? row 
            : projection.combine(existing, row));
      }
    }
    return Lists.newArrayList(groups.values());
  }

  /** Read position in one batch's sorted rows. */
  private static class Cursor {
    private final int batch;
    private final List<ResultRow> rows;
    private int position;

    Cursor(final int batch, final List<ResultRow> rows) {
      this.batch = batch;
      this.rows = rows;
    }

    ResultRow current() {
      return rows.get(position);
    }

    boolean advance() {
      return ++position < rows.size();
    }
  }
}
