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

package net.opentsdb.aura.series.index;

import net.opentsdb.aura.series.core.SeriesIDSet;
import net.opentsdb.aura.series.core.TimeRange;
import net.opentsdb.aura.series.filter.TagPredicate;

/**
 * Lookup surface of the per-metric inverted index. Implementations must be safe
 * for concurrent reads if searches run on several threads.
 * <p>
 * Metric ids are unsigned 32 bit values carried in an {@code int}.
 */
public interface SeriesIndex {

  /**
   * Resolves a single leaf predicate.
   *
   * @param metricId the metric to search.
   * @param predicate an equals, like, regex or in predicate.
   * @param range bounds the segments to consult.
   * @return the matching identifiers per segment version, never null.
   * @throws SeriesLookupException if the index cannot answer.
   */
  SeriesIDSet findSeriesIDsByExpr(int metricId, TagPredicate predicate, TimeRange range)
      throws SeriesLookupException;

  /**
   * Resolves every series carrying any value for the tag key. Used as the
   * universe a negation is taken against.
   *
   * @param metricId the metric to search.
   * @param tagKey the tag key.
   * @param range bounds the segments to consult.
   * @return the identifiers per segment version, never null.
   * @throws SeriesLookupException if the index cannot answer.
   */
  SeriesIDSet getSeriesIDsForTag(int metricId, String tagKey, TimeRange range)
      throws SeriesLookupException;
}
