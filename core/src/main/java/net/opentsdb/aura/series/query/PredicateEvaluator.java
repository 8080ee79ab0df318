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
import net.opentsdb.aura.series.core.SeriesIDSet;
import net.opentsdb.aura.series.core.SeriesSearchException;
import net.opentsdb.aura.series.core.TimeRange;
import net.opentsdb.aura.series.filter.BinaryPredicate;
import net.opentsdb.aura.series.filter.EqualsPredicate;
import net.opentsdb.aura.series.filter.InPredicate;
import net.opentsdb.aura.series.filter.LikePredicate;
import net.opentsdb.aura.series.filter.NotPredicate;
import net.opentsdb.aura.series.filter.Predicate;
import net.opentsdb.aura.series.filter.PredicateVisitor;
import net.opentsdb.aura.series.filter.RegexPredicate;
import net.opentsdb.aura.series.filter.TagPredicate;
import net.opentsdb.aura.series.index.SeriesIndex;
import net.opentsdb.aura.series.index.SeriesLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a filter tree to series identifiers, depth first and left to right.
 * Leaves go straight to the index. A negation is the tag universe of its leaf
 * minus the leaf's matches. The first failure aborts the walk: once the left
 * side of a binary node fails its right side is never looked up.
 * <p>
 * Keeps the current depth, so an instance must not be shared between threads.
 */
public class PredicateEvaluator implements PredicateVisitor<SeriesIDSet, SeriesSearchException> {

  private static final Logger logger = LoggerFactory.getLogger(PredicateEvaluator.class);

  private final int metricId;
  private final SeriesIndex index;
  private final TimeRange timeRange;
  private final int maxDepth;
  private int depth;

  public PredicateEvaluator(final int metricId,
                            final SeriesIndex index,
                            final TimeRange timeRange,
                            final int maxDepth) {
    Preconditions.checkArgument(maxDepth > 0, "Max depth must be positive: " + maxDepth);
    this.metricId = metricId;
    this.index = Preconditions.checkNotNull(index, "Index cannot be null.");
    this.timeRange = Preconditions.checkNotNull(timeRange, "Time range cannot be null.");
    this.maxDepth = maxDepth;
  }

  /**
   * @param predicate the (sub) tree to resolve.
   * @return the matching identifiers.
   * @throws SeriesLookupException if the index failed on any node visited.
   * @throws UnsupportedPredicateException if the tree has a shape that cannot be
   * resolved.
   */
  public SeriesIDSet evaluate(final Predicate predicate) throws SeriesSearchException {
    if (depth >= maxDepth) {
      throw new UnsupportedPredicateException(
          "Filter nests deeper than " + maxDepth + " levels", predicate);
    }
    depth++;
    try {
      return predicate.accept(this);
    } finally {
      depth--;
    }
  }

  @Override
  public SeriesIDSet visit(final EqualsPredicate predicate) throws SeriesSearchException {
    return lookup(predicate);
  }

  @Override
  public SeriesIDSet visit(final LikePredicate predicate) throws SeriesSearchException {
    return lookup(predicate);
  }

  @Override
  public SeriesIDSet visit(final RegexPredicate predicate) throws SeriesSearchException {
    return lookup(predicate);
  }

  @Override
  public SeriesIDSet visit(final InPredicate predicate) throws SeriesSearchException {
    return lookup(predicate);
  }

  @Override
  public SeriesIDSet visit(final NotPredicate predicate) throws SeriesSearchException {
    if (!(predicate.getInner() instanceof TagPredicate)) {
      throw new UnsupportedPredicateException(
          "Only a single tag predicate can be negated", predicate);
    }
    final TagPredicate inner = (TagPredicate) predicate.getInner();
    final SeriesIDSet matched = evaluate(inner);

    if (logger.isDebugEnabled()) {
      logger.debug("Fetching series of tag {} for metric {} in {}",
          inner.getTagKey(), Integer.toUnsignedString(metricId), timeRange);
    }
    final SeriesIDSet universe = index.getSeriesIDsForTag(metricId, inner.getTagKey(), timeRange);
    if (universe == null) {
      throw new SeriesLookupException("Index returned no series for tag " + inner.getTagKey());
    }
    return universe.andNot(matched);
  }

  @Override
  public SeriesIDSet visit(final BinaryPredicate predicate) throws SeriesSearchException {
    final SeriesIDSet left = evaluate(predicate.getLeft());
    final SeriesIDSet right = evaluate(predicate.getRight());
    return predicate.getOperator().combine(left, right);
  }

  private SeriesIDSet lookup(final TagPredicate predicate) throws SeriesLookupException {
    if (logger.isDebugEnabled()) {
      logger.debug("Resolving {} for metric {} in {}",
          predicate, Integer.toUnsignedString(metricId), timeRange);
    }
    final SeriesIDSet result = index.findSeriesIDsByExpr(metricId, predicate, timeRange);
    if (result == null) {
      throw new SeriesLookupException("Index returned no series for " + predicate);
    }
    // the index keeps ownership of what it returned
    return result.copy();
  }
}
