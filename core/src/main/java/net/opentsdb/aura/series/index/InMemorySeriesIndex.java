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

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import net.opentsdb.aura.series.core.SeriesIDSet;
import net.opentsdb.aura.series.core.TimeRange;
import net.opentsdb.aura.series.filter.BinaryPredicate;
import net.opentsdb.aura.series.filter.EqualsPredicate;
import net.opentsdb.aura.series.filter.InPredicate;
import net.opentsdb.aura.series.filter.LikePredicate;
import net.opentsdb.aura.series.filter.NotPredicate;
import net.opentsdb.aura.series.filter.PredicateVisitor;
import net.opentsdb.aura.series.filter.RegexPredicate;
import net.opentsdb.aura.series.filter.TagPredicate;
import org.roaringbitmap.FastAggregation;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * A heap resident inverted index. Each metric owns a set of segments keyed by
 * version, each covering a time range and holding a
 * {@code tag key -> tag value -> bitmap} map of the series written into it.
 * <p>
 * Lookups only consult segments overlapping the requested range and emit one
 * bitmap per such segment, possibly empty. Reads and writes are guarded by a
 * read/write lock so searches may run concurrently with ingest.
 */
public class InMemorySeriesIndex implements SeriesIndex {

  private static final Logger logger = LoggerFactory.getLogger(InMemorySeriesIndex.class);

  private final Map<Integer, TreeMap<Long, Segment>> metrics = Maps.newHashMap();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /**
   * Registers a segment for the metric. Registering the same version again
   * with the same range is a no-op.
   *
   * @param metricId the metric.
   * @param version the segment version.
   * @param range the time range the segment covers.
   * @throws IllegalArgumentException if the version exists with another range.
   */
  public void addSegment(final int metricId, final long version, final TimeRange range) {
    Preconditions.checkNotNull(range, "Segment range cannot be null.");
    lock.writeLock().lock();
    try {
      segment(metricId, version, range);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Indexes a series under every one of its tag pairs in the given segment,
   * creating the segment if needed.
   *
   * @param metricId the metric.
   * @param version the segment version.
   * @param range the time range the segment covers.
   * @param tags the tag pairs of the series.
   * @param seriesId the series identifier.
   */
  public void addSeries(final int metricId,
                        final long version,
                        final TimeRange range,
                        final Map<String, String> tags,
                        final int seriesId) {
    Preconditions.checkNotNull(range, "Segment range cannot be null.");
    Preconditions.checkNotNull(tags, "Tags cannot be null.");
    lock.writeLock().lock();
    try {
      final Segment segment = segment(metricId, version, range);
      for (Map.Entry<String, String> tag : tags.entrySet()) {
        final Map<String, RoaringBitmap> valueMap =
            segment.indexMap.computeIfAbsent(tag.getKey(), k -> Maps.newHashMap());
        final RoaringBitmap rr = valueMap.get(tag.getValue());
        if (rr == null) {
          valueMap.put(tag.getValue(), RoaringBitmap.bitmapOf(seriesId));
        } else {
          rr.add(seriesId);
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public SeriesIDSet findSeriesIDsByExpr(final int metricId,
                                         final TagPredicate predicate,
                                         final TimeRange range) throws SeriesLookupException {
    Preconditions.checkNotNull(predicate, "Predicate cannot be null.");
    Preconditions.checkNotNull(range, "Time range cannot be null.");
    lock.readLock().lock();
    try {
      final LeafResolver resolver = new LeafResolver();
      final SeriesIDSet result = new SeriesIDSet();
      for (Segment segment : segments(metricId).values()) {
        if (!range.overlaps(segment.range)) {
          continue;
        }
        final Map<String, RoaringBitmap> valueMap = segment.indexMap.get(predicate.getTagKey());
        if (valueMap == null) {
          result.add(segment.version, new RoaringBitmap());
          continue;
        }
        resolver.valueMap = valueMap;
        result.add(segment.version, predicate.accept(resolver));
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public SeriesIDSet getSeriesIDsForTag(final int metricId,
                                        final String tagKey,
                                        final TimeRange range) throws SeriesLookupException {
    Preconditions.checkNotNull(tagKey, "Tag key cannot be null.");
    Preconditions.checkNotNull(range, "Time range cannot be null.");
    lock.readLock().lock();
    try {
      final SeriesIDSet result = new SeriesIDSet();
      for (Segment segment : segments(metricId).values()) {
        if (!range.overlaps(segment.range)) {
          continue;
        }
        final Map<String, RoaringBitmap> valueMap = segment.indexMap.get(tagKey);
        if (valueMap == null || valueMap.isEmpty()) {
          result.add(segment.version, new RoaringBitmap());
        } else {
          result.add(segment.version, FastAggregation.or(valueMap.values().iterator()));
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  private TreeMap<Long, Segment> segments(final int metricId) throws SeriesLookupException {
    final TreeMap<Long, Segment> segments = metrics.get(metricId);
    if (segments == null) {
      throw new SeriesLookupException("No index found for metric "
          + Integer.toUnsignedString(metricId));
    }
    return segments;
  }

  private Segment segment(final int metricId, final long version, final TimeRange range) {
    final TreeMap<Long, Segment> segments = metrics.computeIfAbsent(metricId, k -> new TreeMap<>());
    Segment segment = segments.get(version);
    if (segment == null) {
      segment = new Segment(version, range);
      segments.put(version, segment);
      if (logger.isDebugEnabled()) {
        logger.debug("Created segment {} covering {} for metric {}",
            version, range, Integer.toUnsignedString(metricId));
      }
    } else if (!segment.range.equals(range)) {
      throw new IllegalArgumentException("Segment " + version + " of metric "
          + Integer.toUnsignedString(metricId) + " already covers " + segment.range
          + ", cannot remap it to " + range);
    }
    return segment;
  }

  private static class Segment {
    private final long version;
    private final TimeRange range;
    private final Map<String, Map<String, RoaringBitmap>> indexMap = Maps.newHashMap();

    private Segment(final long version, final TimeRange range) {
      this.version = version;
      this.range = range;
    }
  }

  /**
   * Resolves a leaf against the value map of one segment. Patterns are compiled
   * once per lookup and reused across segments.
   */
  private static class LeafResolver implements PredicateVisitor<RoaringBitmap, SeriesLookupException> {
    private Map<String, RoaringBitmap> valueMap;
    private Pattern pattern;

    @Override
    public RoaringBitmap visit(final EqualsPredicate predicate) {
      final RoaringBitmap rr = valueMap.get(predicate.getValue());
      return rr == null ? new RoaringBitmap() : rr.clone();
    }

    @Override
    public RoaringBitmap visit(final LikePredicate predicate) {
      if (pattern == null) {
        pattern = LikePatterns.compile(predicate.getPattern());
      }
      final RoaringBitmap filterRR = new RoaringBitmap();
      for (Map.Entry<String, RoaringBitmap> entry : valueMap.entrySet()) {
        if (pattern.matcher(entry.getKey()).matches()) {
          filterRR.or(entry.getValue());
        }
      }
      return filterRR;
    }

    @Override
    public RoaringBitmap visit(final RegexPredicate predicate) {
      if (pattern == null) {
        pattern = Pattern.compile(predicate.getPattern());
      }
      final RoaringBitmap filterRR = new RoaringBitmap();
      for (Map.Entry<String, RoaringBitmap> entry : valueMap.entrySet()) {
        if (pattern.matcher(entry.getKey()).find()) {
          filterRR.or(entry.getValue());
        }
      }
      return filterRR;
    }

    @Override
    public RoaringBitmap visit(final InPredicate predicate) {
      final RoaringBitmap filterRR = new RoaringBitmap();
      for (String value : predicate.getValues()) {
        final RoaringBitmap valueRR = valueMap.get(value);
        if (null != valueRR) {
          filterRR.or(valueRR);
        }
      }
      return filterRR;
    }

    @Override
    public RoaringBitmap visit(final NotPredicate predicate) throws SeriesLookupException {
      throw new SeriesLookupException("Index cannot resolve negation " + predicate);
    }

    @Override
    public RoaringBitmap visit(final BinaryPredicate predicate) throws SeriesLookupException {
      throw new SeriesLookupException("Index cannot resolve composite predicate " + predicate);
    }
  }
}
