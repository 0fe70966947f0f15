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
package net.vizqe.query.execution;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.vizqe.data.ResultBuffer;
import net.vizqe.query.AnalyticsQuery;
import net.vizqe.query.QueryParams;
import net.vizqe.query.QueryPlanDetails;
import net.vizqe.query.QueryResult;
import net.vizqe.query.QueryStatus;
import net.vizqe.schema.SchemaCatalog;
import net.vizqe.schema.SchemaProvider;
import net.vizqe.storage.DataStore;
import net.vizqe.storage.StorageException;
import net.vizqe.utils.Config;
import net.vizqe.utils.DateTime;

/**
 * The process wide entry point of the query engine. Owns the storage
 * handle, the schemas, the configuration and the worker pool, and hands
 * out one {@link AnalyticsQuery} per batch.
 * <p>
 * The synchronous methods may be called from any thread. {@link #run} fans
 * every batch out to the worker pool and merges the results once all of
 * them are in.
 */
public class QueryEngine implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

  private final DataStore data_store;
  private final SchemaProvider schemas;
  private final Config config;
  private final String module_id;
  private final boolean filter_own_logs;
  private final long analytics_start_time;
  private final ListeningExecutorService pool;

  /**
   * Ctor using the built in schemas.
   * @param data_store The non-null storage collaborator.
   * @param config The non-null configuration.
   */
  public QueryEngine(final DataStore data_store, final Config config) {
    this(data_store, new SchemaCatalog(
        config.getInt(Config.ROW_TIME_BITS_KEY)), config);
  }

  /**
   * Default ctor.
   * @param data_store The non-null storage collaborator.
   * @param schemas The non-null schema provider.
   * @param config The non-null configuration.
   */
  public QueryEngine(final DataStore data_store,
                     final SchemaProvider schemas,
                     final Config config) {
    Preconditions.checkNotNull(data_store, "Data store cannot be null.");
    Preconditions.checkNotNull(schemas, "Schemas cannot be null.");
    Preconditions.checkNotNull(config, "Config cannot be null.");
    this.data_store = data_store;
    this.schemas = schemas;
    this.config = config;
    module_id = config.getString(Config.MODULE_ID_KEY);
    filter_own_logs = config.getBoolean(Config.FILTER_OWN_LOGS_KEY);
    analytics_start_time = loadAnalyticsStartTime();
    pool = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(
        config.getInt(Config.WORKER_THREADS_KEY), 
        new ThreadFactoryBuilder()
          .setNameFormat("vizqe-query-%d")
          .setDaemon(true)
          .build()));
    LOG.info("Query engine " + module_id + " started with analytics start " 
        + "time " + analytics_start_time);
    if (LOG.isDebugEnabled()) {
      LOG.debug(config.dumpConfiguration());
    }
  }

  private long loadAnalyticsStartTime() {
    final long lookback = 
        config.getDuration(Config.START_TIME_LOOKBACK_KEY) * 1000;
    try {
      final long start = data_store.analyticsStartTime();
      if (start >= 0) {
        return start;
      }
    } catch (StorageException e) {
      LOG.warn("Failed to read the analytics start time, falling back to " 
          + "the last " + config.getString(Config.START_TIME_LOOKBACK_KEY), e);
    }
    return DateTime.currentTimeMicros() - lookback;
  }

  /**
   * @param query_id An identifier for logging.
   * @param terms The raw query terms.
   * @return Query parameters using the configured batch fan out.
   */
  public QueryParams newQueryParams(final String query_id,
                                    final Map<String, String> terms) {
    return new QueryParams(query_id, terms, 
        config.getInt(Config.MAX_BATCHES_KEY));
  }

  /**
   * Validates a query and computes its batch windows without reading
   * storage.
   * @param params The query.
   * @return The status, whether batches need merging and the windows.
   */
  public QueryPlanDetails prepare(final QueryParams params) {
    LOG.info("[" + params.queryId() + "] preparing " + params);
    return newQuery(params, 0).planDetails();
  }

  /**
   * Runs one batch of a query.
   * @param params The query.
   * @param batch The batch index, from 0.
   * @return The batch result.
   */
  public QueryResult execute(final QueryParams params, final int batch) {
    return newQuery(params, batch).process();
  }

  /**
   * @param params The query.
   * @param accumulated The merge of earlier batches.
   * @param incoming The next batch.
   * @return The merged result.
   */
  public QueryResult mergePartial(final QueryParams params,
                                  final ResultBuffer accumulated,
                                  final ResultBuffer incoming) {
    return newQuery(params, 0).mergePartial(accumulated, incoming);
  }

  /**
   * @param params The query.
   * @param buffers The successful batch results in batch order.
   * @return The merged result.
   */
  public QueryResult mergeFinal(final QueryParams params,
                                final List<ResultBuffer> buffers) {
    return newQuery(params, 0).mergeFinal(buffers);
  }

  /**
   * Prepares the query, runs every batch on the worker pool and merges the
   * results in batch order. If any batch fails, the failure of the lowest
   * failing batch is returned and nothing is merged.
   * @param params The query.
   * @return A deferred resolving to the final result.
   */
  public Deferred<QueryResult> run(final QueryParams params) {
    // every batch has to see the same end of range
    final long now = DateTime.currentTimeMicros();
    final AnalyticsQuery query = newQuery(params, 0, now);
    final QueryPlanDetails details = query.planDetails();
    if (details.status() != QueryStatus.SUCCESS) {
      return Deferred.fromResult(query.process());
    }
    final int batches = Math.max(1, details.windows().size());
    final long start = System.currentTimeMillis();
    final ArrayList<Deferred<QueryResult>> deferreds = 
        Lists.newArrayListWithCapacity(batches);
    for (int i = 0; i < batches; i++) {
      final int batch = i;
      final Deferred<QueryResult> deferred = new Deferred<QueryResult>();
      deferreds.add(deferred);
      pool.execute(new Runnable() {
        @Override
        public void run() {
          try {
            deferred.callback(newQuery(params, batch, now).process());
          } catch (Exception e) {
            LOG.error("[" + params.queryId() + "] batch " + batch 
                + " threw", e);
            deferred.callback(e);
          } catch (Throwable t) {
            // Deferred only treats exceptions as errors
            LOG.error("[" + params.queryId() + "] batch " + batch 
                + " threw", t);
            deferred.callback(new RuntimeException("Batch " + batch 
                + " of query " + params.queryId() + " failed", t));
          }
        }
      });
    }

    /** Merges once every batch is in. */
    class MergeCB implements Callback<QueryResult, ArrayList<QueryResult>> {
      @Override
      public QueryResult call(final ArrayList<QueryResult> results) {
        final List<ResultBuffer> buffers = 
            Lists.newArrayListWithCapacity(results.size());
        for (int i = 0; i < results.size(); i++) {
          final QueryResult result = results.get(i);
          if (!result.isSuccess()) {
            LOG.warn("[" + params.queryId() + "] batch " + i + " failed with " 
                + QueryStatus.toString(result.status()));
            return result;
          }
          buffers.add(result.buffer());
        }
        final QueryResult merged = query.mergeFinal(buffers);
        LOG.info("[" + params.queryId() + "] completed " + results.size() 
            + " batches with " + merged.buffer().size() + " rows in " 
            + (System.currentTimeMillis() - start) + " ms");
        return merged;
      }
    }
    return Deferred.groupInOrder(deferreds).addCallback(new MergeCB());
  }

  /** @return The start of analytics data in microseconds. */
  public long analyticsStartTime() {
    return analytics_start_time;
  }

  public Config getConfig() {
    return config;
  }

  public SchemaProvider schemas() {
    return schemas;
  }

  /**
   * Stops the worker pool after the running batches complete.
   */
  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
        LOG.warn("Worker pool did not stop within 10 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted waiting for the worker pool to stop", e);
    }
  }

  /**
   * @param params The query.
   * @param batch The batch index.
   * @return A new per batch query bound to this engine.
   */
  protected AnalyticsQuery newQuery(final QueryParams params, 
                                    final int batch) {
    return newQuery(params, batch, DateTime.currentTimeMicros());
  }

  /**
   * @param params The query.
   * @param batch The batch index.
   * @param now The current time in microseconds.
   * @return A new per batch query bound to this engine.
   */
  protected AnalyticsQuery newQuery(final QueryParams params, 
                                    final int batch,
                                    final long now) {
    return AnalyticsQuery.newBuilder()
        .setParams(params)
        .setBatch(batch)
        .setDataStore(data_store)
        .setSchemas(schemas)
        .setModuleId(module_id)
        .setFilterOwnLogs(filter_own_logs)
        .setAnalyticsStartTime(analytics_start_time)
        .setCurrentTime(now)
        .build();
  }
}
