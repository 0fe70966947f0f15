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

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.vizqe.common.Const;
import net.vizqe.data.BatchWindow;
import net.vizqe.data.ResultBuffer;
import net.vizqe.data.ResultRow;
import net.vizqe.data.RowValue;
import net.vizqe.data.StorageRow;
import net.vizqe.exceptions.InvalidQueryArgumentException;
import net.vizqe.exceptions.QueryAssertionException;
import net.vizqe.exceptions.QueryExecutionException;
import net.vizqe.exceptions.QueryParseException;
import net.vizqe.query.filter.PredicateSet;
import net.vizqe.query.merge.ResultMerger;
import net.vizqe.query.plan.BatchPlanner;
import net.vizqe.query.processor.postprocess.PostProcessSpec;
import net.vizqe.query.processor.select.FlowSeriesQueryType;
import net.vizqe.query.processor.select.ProjectionSpec;
import net.vizqe.query.processor.select.RowAccumulator;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.SchemaProvider;
import net.vizqe.schema.TableSchema;
import net.vizqe.storage.DataStore;
import net.vizqe.storage.ScanRequest;
import net.vizqe.storage.Scanner;
import net.vizqe.storage.StorageException;

/**
 * One batch of one analytics query. Construction parses and validates the
 * query terms in order: table, time range, WHERE, SELECT, object id
 * redirection, then post processing, and plans the batch window. The first
 * failing stage sets the status and every later stage is skipped; once set
 * the status never changes.
 * <p>
 * An instance is used by a single thread and discarded after use.
 */
public class AnalyticsQuery {
  private static final Logger LOG = LoggerFactory.getLogger(
      AnalyticsQuery.class);

  private final String query_id;
  private final Map<String, String> terms;
  private final int batch;
  private final int total_batches;
  private final DataStore data_store;
  private final SchemaProvider schemas;
  private final String module_id;
  private final boolean filter_own_logs;
  private final long analytics_start_time;
  private final long current_time;

  /** Sticky status, set by the first failing stage. */
  private int status = QueryStatus.SUCCESS;

  private String requested_table;
  private String table;
  private String table_key;
  private TableSchema schema;
  private boolean object_table;
  private long requested_from;
  private long requested_end;
  private long from;
  private long end;
  private PredicateSet where;
  private ProjectionSpec select;
  private PostProcessSpec post_process;
  private boolean parallelizable;
  private boolean merge_needed;
  private BatchPlanner planner;
  private BatchWindow window;

  protected AnalyticsQuery(final Builder builder) {
    Preconditions.checkNotNull(builder.params, "Params cannot be null.");
    Preconditions.checkNotNull(builder.schemas, "Schemas cannot be null.");
    Preconditions.checkArgument(builder.batch >= 0, 
        "Batch cannot be negative: %s", builder.batch);
    query_id = builder.params.queryId();
    terms = builder.params.terms();
    total_batches = builder.params.maxChunks();
    batch = builder.batch;
    data_store = builder.data_store;
    schemas = builder.schemas;
    module_id = builder.module_id;
    filter_own_logs = builder.filter_own_logs;
    analytics_start_time = builder.analytics_start_time;
    current_time = builder.current_time;

    try {
      parse();
    } catch (QueryExecutionException e) {
      setStatus(e);
    }
  }

  private void parse() {
    parseTable();
    parseTimeRange();

    where = PredicateSet.parse(terms.get(Const.QUERY_WHERE), 
        terms.get(Const.QUERY_FLOW_DIR), schema, 
        filter_own_logs && SchemaCatalog.MESSAGE_TABLE.equals(table) 
          ? module_id : null);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + query_id + "] where: " + where);
    }

    select = ProjectionSpec.parse(terms.get(Const.QUERY_SELECT), schema, 
        object_table);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + query_id + "] select: " + select);
    }

    if (select.isObjectIdQuery()) {
      table_key = table;
      table = SchemaCatalog.OBJECT_VALUE_TABLE;
      schema = schemas.lookupTable(table);
      if (schema == null) {
        throw new QueryAssertionException("No schema for " + table);
      }
      object_table = false;
      if (LOG.isDebugEnabled()) {
        LOG.debug("[" + query_id + "] object id query on " + table_key 
            + " redirected to " + table);
      }
    } else if (object_table && where.isMatchAll()) {
      throw new InvalidQueryArgumentException(
          "A where clause is required for object table " + table);
    }

    post_process = PostProcessSpec.parse(terms, schema, select);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + query_id + "] post process: " + post_process);
    }

    parallelizable = canParallelize();
    merge_needed = post_process.isSorted() || post_process.limit() > 0;
    if (parallelizable) {
      final FlowSeriesQueryType type = select.flowSeriesQueryType();
      if (SchemaCatalog.FLOW_RECORD_TABLE.equals(table) 
          || type == FlowSeriesQueryType.STATS 
          || type == FlowSeriesQueryType.FLOW_TUPLE_STATS 
          || select.needsCombine()) {
        merge_needed = true;
      }
    }

    planner = BatchPlanner.newBuilder()
        .setFrom(from)
        .setEnd(end)
        .setTotalBatches(total_batches)
        .setMinGranularity(schema.minGranularity())
        .setGranularity(select.granularity())
        .setParallelizable(parallelizable)
        .build();
    window = planner.window(batch);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + query_id + "] batch " + batch + " of " + total_batches 
          + " planned as " + planner + " window " + window);
    }
  }

  private void parseTable() {
    final String raw = terms.get(Const.QUERY_TABLE);
    if (Strings.isNullOrEmpty(raw)) {
      throw new QueryParseException("Missing " + Const.QUERY_TABLE);
    }
    String name = raw.trim();
    if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
      name = name.substring(1, name.length() - 1);
    }
    requested_table = name;
    table = name;
    schema = schemas.lookupTable(name);
    if (schema == null) {
      schema = schemas.lookupObjectTable(name);
      object_table = schema != null;
    }
    if (schema == null) {
      throw new InvalidQueryArgumentException("Unknown table: " + name);
    }
  }

  private void parseTimeRange() {
    requested_from = parseTime(Const.QUERY_START_TIME);
    requested_end = parseTime(Const.QUERY_END_TIME);
    from = requested_from;
    end = requested_end;
    if (from < analytics_start_time) {
      from = analytics_start_time;
    }
    if (end > current_time) {
      end = current_time;
    }
    if (from > end) {
      from = end - 1;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("[" + query_id + "] requested [" + requested_from + ", " 
          + requested_end + ") running [" + from + ", " + end + ")");
    }
  }

  private long parseTime(final String key) {
    final String value = terms.get(key);
    if (Strings.isNullOrEmpty(value)) {
      throw new QueryParseException("Missing " + key);
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new QueryParseException("Invalid " + key + ": " + value, e);
    }
  }

  private boolean canParallelize() {
    if (SchemaCatalog.OBJECT_VALUE_TABLE.equals(table)) {
      return false;
    }
    if (SchemaCatalog.FLOW_SERIES_TABLE.equals(table) 
        && !select.provideTimeseries() && select.hasFlowCount()) {
      return false;
    }
    if (select.needsCombine() && select.hasAverage()) {
      return false;
    }
    return true;
  }

  /**
   * Runs the pipeline for this batch: scan, decode, filter, project and
   * post process.
   * @return The batch result, empty with the status on failure.
   */
  public QueryResult process() {
    if (status != QueryStatus.SUCCESS) {
      return QueryResult.failure(status, resultName());
    }
    if (window == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("[" + query_id + "] batch " + batch + " has no window");
      }
      return QueryResult.success(emptyBuffer());
    }
    final long start = System.currentTimeMillis();
    try {
      final RowAccumulator accumulator = select.newAccumulator(
          requested_table, from);
      final int scanned = scan(accumulator);
      final ResultBuffer projected = accumulator.build();
      final ResultBuffer result = post_process.process(projected, 
          combinesAcrossBatches());
      if (LOG.isDebugEnabled()) {
        LOG.debug("[" + query_id + "] batch " + batch + " scanned " 
            + scanned + " rows, returning " + result.size() + " in " 
            + (System.currentTimeMillis() - start) + " ms");
      }
      return QueryResult.success(result);
    } catch (StorageException e) {
      status = QueryStatus.EIO;
      LOG.error("[" + query_id + "] batch " + batch 
          + " failed reading from storage", e);
    } catch (QueryExecutionException e) {
      setStatus(e);
    }
    return QueryResult.failure(status, resultName());
  }

  private int scan(final RowAccumulator accumulator) {
    final ScanRequest request = ScanRequest.newBuilder()
        .setTable(table)
        .setKey(table_key)
        .setWindow(window)
        .setFilter(where)
        .setShape(select.recordShape())
        .setDirection(where.direction())
        .build();
    final boolean flows = SchemaCatalog.isFlowTable(table);
    int scanned = 0;
    try (final Scanner scanner = data_store.scan(request)) {
      while (scanner.hasNext()) {
        final StorageRow row = scanner.next();
        scanned++;
        if (!window.contains(row.timestamp())) {
          if (LOG.isTraceEnabled()) {
            LOG.trace("[" + query_id + "] dropping row outside " + window 
                + ": " + row);
          }
          continue;
        }
        final Map<String, RowValue> fields = RecordReader.read(
            request.shape(), row);
        if (!where.matches(fields)) {
          continue;
        }
        if (flows && !directionMatches(fields)) {
          continue;
        }
        accumulator.add(row.timestamp(), fields);
      }
    }
    return scanned;
  }

  private boolean directionMatches(final Map<String, RowValue> fields) {
    final RowValue direction = fields.get(RecordReader.DIRECTION);
    return direction == null || !direction.isNumeric() 
        || direction.longValue() == where.direction();
  }

  /**
   * Combined aggregates are only exact if every batch keeps all of its
   * groups until the merge, so filtering and limiting wait for it.
   */
  private boolean combinesAcrossBatches() {
    return !(parallelizable && select.needsCombine());
  }

  /**
   * Folds one batch result into the accumulated result.
   * @param accumulated The merge of earlier batches.
   * @param incoming The next batch.
   * @return The merged result, or the status if parsing failed.
   */
  public QueryResult mergePartial(final ResultBuffer accumulated,
                                  final ResultBuffer incoming) {
    if (status != QueryStatus.SUCCESS) {
      return QueryResult.failure(status, resultName());
    }
    return QueryResult.success(new ResultMerger(select, post_process)
        .mergePartial(accumulated, incoming));
  }

  /**
   * Merges every batch result into the final one.
   * @param buffers The successful batch results in batch order.
   * @return The merged result, or the status if parsing failed.
   */
  public QueryResult mergeFinal(final List<ResultBuffer> buffers) {
    if (status != QueryStatus.SUCCESS) {
      return QueryResult.failure(status, resultName());
    }
    return QueryResult.success(new ResultMerger(select, post_process)
        .mergeFinal(buffers));
  }

  /** @return The parse status and the windows of every batch. */
  public QueryPlanDetails planDetails() {
    if (status != QueryStatus.SUCCESS) {
      return new QueryPlanDetails(status, false, 
          ImmutableList.<BatchWindow>of());
    }
    return new QueryPlanDetails(status, merge_needed, planner.windows());
  }

  public int status() {
    return status;
  }

  /** @return True if this batch has a window to scan. */
  public boolean isProcessingNeeded() {
    return status == QueryStatus.SUCCESS && window != null;
  }

  public boolean isMergeNeeded() {
    return merge_needed;
  }

  public boolean isParallelizable() {
    return parallelizable;
  }

  /** @return The table read from storage, after any redirection. */
  public String table() {
    return table;
  }

  /** @return The storage key for redirected object id queries, or null. */
  public String tableKey() {
    return table_key;
  }

  /** @return The start of the query range after clamping. */
  public long from() {
    return from;
  }

  /** @return The end of the query range after clamping. */
  public long end() {
    return end;
  }

  /** @return This batch's window or null if there is nothing to scan. */
  public BatchWindow window() {
    return window;
  }

  public PredicateSet where() {
    return where;
  }

  public ProjectionSpec select() {
    return select;
  }

  public PostProcessSpec postProcess() {
    return post_process;
  }

  private void setStatus(final QueryExecutionException e) {
    if (status != QueryStatus.SUCCESS) {
      return;
    }
    status = e.getStatusCode();
    if (e instanceof QueryAssertionException) {
      LOG.error("[" + query_id + "] batch " + batch + " failed with " 
          + QueryStatus.toString(status), e);
    } else {
      LOG.debug("[" + query_id + "] batch " + batch + " failed with " 
          + QueryStatus.toString(status) + ": " + e.getMessage());
    }
  }

  private String resultName() {
    return requested_table == null ? "" : requested_table;
  }

  private ResultBuffer emptyBuffer() {
    return new ResultBuffer(requested_table, select.columns(), 
        ImmutableList.<ResultRow>of());
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("id=")
        .append(query_id)
        .append(", table=")
        .append(table)
        .append(", batch=")
        .append(batch)
        .append(", window=")
        .append(window)
        .append(", status=")
        .append(status)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private QueryParams params;
    private int batch;
    private DataStore data_store;
    private SchemaProvider schemas;
    private String module_id = "QueryEngine";
    private boolean filter_own_logs = true;
    private long analytics_start_time;
    private long current_time = Long.MAX_VALUE;

    public Builder setParams(final QueryParams params) {
      this.params = params;
      return this;
    }

    public Builder setBatch(final int batch) {
      this.batch = batch;
      return this;
    }

    public Builder setDataStore(final DataStore data_store) {
      this.data_store = data_store;
      return this;
    }

    public Builder setSchemas(final SchemaProvider schemas) {
      this.schemas = schemas;
      return this;
    }

    public Builder setModuleId(final String module_id) {
      this.module_id = module_id;
      return this;
    }

    public Builder setFilterOwnLogs(final boolean filter_own_logs) {
      this.filter_own_logs = filter_own_logs;
      return this;
    }

    /** @param analytics_start_time In microseconds. */
    public Builder setAnalyticsStartTime(final long analytics_start_time) {
      this.analytics_start_time = analytics_start_time;
      return this;
    }

    /** @param current_time "Now" in microseconds. */
    public Builder setCurrentTime(final long current_time) {
      this.current_time = current_time;
      return this;
    }

    public AnalyticsQuery build() {
      return new AnalyticsQuery(this);
    }
  }
}
