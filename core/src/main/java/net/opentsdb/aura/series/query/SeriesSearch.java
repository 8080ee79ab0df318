/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.aura.series.query;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import net.opentsdb.aura.series.core.SeriesIDSet;
import net.opentsdb.aura.series.core.SeriesSearchException;
import net.opentsdb.aura.series.core.TimeRange;
import net.opentsdb.aura.series.filter.Predicate;
import net.opentsdb.aura.series.index.SeriesIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Resolves the filter of one query against the index of its metric.
 * <p>
 * After {@link #search()} either {@link #getResultSet()} or
 * {@link #getException()} is set, never both. When the query has no filter
 * both stay null and the index is not touched: every series of the metric
 * matches. Calling {@link #search()} again re-runs the lookups and overwrites
 * the previous outcome.
 * <p>
 * Not thread safe. Use one instance per query execution.
 */
public class SeriesSearch {

  private static final Logger logger = LoggerFactory.getLogger(SeriesSearch.class);

  private final int metricId;
  private final SeriesIndex index;
  private final Predicate predicate;
  private final TimeRange timeRange;
  private final SearchConfig config;

  private SeriesIDSet resultSet;
  private SeriesSearchException exception;

  protected SeriesSearch(final Builder builder) {
    this.metricId = builder.metricId;
    this.index = Preconditions.checkNotNull(builder.index, "Index cannot be null.");
    this.timeRange = Preconditions.checkNotNull(builder.timeRange, "Time range cannot be null.");
    this.predicate = builder.predicate;
    this.config = builder.config == null ? new SearchConfig() : builder.config;
  }

  public void search() {
    resultSet = null;
    exception = null;
    if (predicate == null) {
      return;
    }

    final Stopwatch stopwatch = Stopwatch.createStarted();
    final PredicateEvaluator evaluator =
        new PredicateEvaluator(metricId, index, timeRange, config.maxPredicateDepth);
    try {
      resultSet = evaluator.evaluate(predicate);
      if (logger.isDebugEnabled()) {
        logger.debug("Resolved {} series over {} segments for metric {} filter {} in {}",
            resultSet.cardinality(), resultSet.size(), Integer.toUnsignedString(metricId),
            predicate, stopwatch);
      }
    } catch (SeriesSearchException e) {
      exception = e;
      logger.warn("Series search failed for metric {} filter {} in {}",
          Integer.toUnsignedString(metricId), predicate, timeRange, e);
    }

    final long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    if (config.slowSearchThresholdMs > 0 && elapsed > config.slowSearchThresholdMs) {
      logger.warn("Slow series search for metric {}: {} ms for filter {}",
          Integer.toUnsignedString(metricId), elapsed, predicate);
    }
  }

  /** @return the identifiers of the last run, or null if it had no filter, failed or never ran. */
  public SeriesIDSet getResultSet() {
    return resultSet;
  }

  /** @return the failure of the last run, or null. */
  public SeriesSearchException getException() {
    return exception;
  }

  public boolean hasFilter() {
    return predicate != null;
  }

  public int getMetricId() {
    return metricId;
  }

  public Predicate getPredicate() {
    return predicate;
  }

  public TimeRange getTimeRange() {
    return timeRange;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{metricId=")
        .append(Integer.toUnsignedString(metricId))
        .append(", filter=")
        .append(predicate)
        .append(", timeRange=")
        .append(timeRange)
        .append("}")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private int metricId;
    private SeriesIndex index;
    private Predicate predicate;
    private TimeRange timeRange;
    private SearchConfig config;

    public Builder setMetricId(final int metricId) {
      this.metricId = metricId;
      return this;
    }

    public Builder setIndex(final SeriesIndex index) {
      this.index = index;
      return this;
    }

    /** @param predicate the filter, or null when the query has none. */
    public Builder setPredicate(final Predicate predicate) {
      this.predicate = predicate;
      return this;
    }

    public Builder setTimeRange(final TimeRange timeRange) {
      this.timeRange = timeRange;
      return this;
    }

    public Builder setConfig(final SearchConfig config) {
      this.config = config;
      return this;
    }

    public SeriesSearch build() {
      return new SeriesSearch(this);
    }
  }
}
