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

import com.google.common.collect.ImmutableMap;
import net.opentsdb.aura.series.core.SeriesIDSet;
import net.opentsdb.aura.series.core.TimeRange;
import net.opentsdb.aura.series.filter.EqualsPredicate;
import net.opentsdb.aura.series.filter.InPredicate;
import net.opentsdb.aura.series.filter.LikePredicate;
import net.opentsdb.aura.series.filter.RegexPredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemorySeriesIndexTest {

  private static final int METRIC = 1;
  private static final TimeRange SEGMENT_1 = TimeRange.of(0, 7_200_000);
  private static final TimeRange SEGMENT_2 = TimeRange.of(7_200_000, 14_400_000);

  private InMemorySeriesIndex index;

  @BeforeEach
  public void before() {
    index = new InMemorySeriesIndex();
    index.addSeries(METRIC, 1L, SEGMENT_1, ImmutableMap.of("ip", "1.1.1.1", "path", "/data"), 1);
    index.addSeries(METRIC, 1L, SEGMENT_1, ImmutableMap.of("ip", "1.1.2.1", "path", "/home"), 2);
    index.addSeries(METRIC, 1L, SEGMENT_1, ImmutableMap.of("ip", "1.1.3.3", "path", "/data"), 3);
    index.addSeries(METRIC, 1L, SEGMENT_1, ImmutableMap.of("path", "/tmp"), 4);
    index.addSeries(METRIC, 2L, SEGMENT_2, ImmutableMap.of("ip", "1.1.1.1"), 1);
    index.addSeries(METRIC, 2L, SEGMENT_2, ImmutableMap.of("ip", "2.2.2.2"), 5);
  }

  @Test
  public void testEquals() throws Exception {
    SeriesIDSet result = index.findSeriesIDsByExpr(METRIC,
        EqualsPredicate.newBuilder().forTag("ip").withValue("1.1.1.1").build(), TimeRange.all());
    SeriesIDSet expected = SeriesIDSet.of(1L, 1);
    expected.add(2L, RoaringBitmap.bitmapOf(1));
    assertEquals(expected, result);
  }

  @Test
  public void testEqualsNoMatchStillEmitsSegments() throws Exception {
    SeriesIDSet result = index.findSeriesIDsByExpr(METRIC,
        EqualsPredicate.newBuilder().forTag("ip").withValue("9.9.9.9").build(), TimeRange.all());
    assertEquals(2, result.size());
    assertTrue(result.isEmpty());

    result = index.findSeriesIDsByExpr(METRIC,
        EqualsPredicate.newBuilder().forTag("nope").withValue("x").build(), TimeRange.all());
    assertEquals(2, result.size());
    assertTrue(result.isEmpty());
  }

  @Test
  public void testLike() throws Exception {
    SeriesIDSet result = index.findSeriesIDsByExpr(METRIC,
        LikePredicate.newBuilder().forTag("ip").withPattern("1.1.*.1").build(), SEGMENT_1);
    assertEquals(SeriesIDSet.of(1L, 1, 2), result);

    // dots are literal
    result = index.findSeriesIDsByExpr(METRIC,
        LikePredicate.newBuilder().forTag("ip").withPattern("1?1*").build(), SEGMENT_1);
    assertTrue(result.isEmpty());

    result = index.findSeriesIDsByExpr(METRIC,
        LikePredicate.newBuilder().forTag("path").withPattern("/data").build(), SEGMENT_1);
    assertEquals(SeriesIDSet.of(1L, 1, 3), result);
  }

  @Test
  public void testRegex() throws Exception {
    SeriesIDSet result = index.findSeriesIDsByExpr(METRIC,
        RegexPredicate.newBuilder().forTag("ip").withPattern("^1\\.1\\.[12]").build(), TimeRange.all());
    SeriesIDSet expected = SeriesIDSet.of(1L, 1, 2);
    expected.add(2L, RoaringBitmap.bitmapOf(1));
    assertEquals(expected, result);
  }

  @Test
  public void testIn() throws Exception {
    SeriesIDSet result = index.findSeriesIDsByExpr(METRIC,
        InPredicate.newBuilder().forTag("ip").withValues("1.1.1.1", "1.1.3.3", "2.2.2.2").build(),
        TimeRange.all());
    SeriesIDSet expected = SeriesIDSet.of(1L, 1, 3);
    expected.add(2L, RoaringBitmap.bitmapOf(1, 5));
    assertEquals(expected, result);
  }

  @Test
  public void testTagUniverse() throws Exception {
    SeriesIDSet expected = SeriesIDSet.of(1L, 1, 2, 3);
    expected.add(2L, RoaringBitmap.bitmapOf(1, 5));
    assertEquals(expected, index.getSeriesIDsForTag(METRIC, "ip", TimeRange.all()));

    expected = SeriesIDSet.of(1L, 1, 2, 3, 4);
    expected.add(2L, new RoaringBitmap());
    assertEquals(expected, index.getSeriesIDsForTag(METRIC, "path", TimeRange.all()));
  }

  @Test
  public void testTimeRangePrunesSegments() throws Exception {
    SeriesIDSet result = index.getSeriesIDsForTag(METRIC, "ip", TimeRange.of(8_000_000, 9_000_000));
    assertEquals(SeriesIDSet.of(2L, 1, 5), result);

    result = index.getSeriesIDsForTag(METRIC, "ip", TimeRange.of(20_000_000, 30_000_000));
    assertEquals(new SeriesIDSet(), result);
  }

  @Test
  public void testUnknownMetric() {
    assertThrows(SeriesLookupException.class,
        () -> index.getSeriesIDsForTag(-1, "ip", TimeRange.all()));
    SeriesLookupException e = assertThrows(SeriesLookupException.class,
        () -> index.findSeriesIDsByExpr(-1,
            EqualsPredicate.newBuilder().forTag("ip").withValue("1.1.1.1").build(), TimeRange.all()));
    assertTrue(e.getMessage().contains("4294967295"));
  }

  @Test
  public void testSegmentRangeConflict() {
    index.addSegment(METRIC, 1L, SEGMENT_1);
    assertThrows(IllegalArgumentException.class, () -> index.addSegment(METRIC, 1L, SEGMENT_2));
  }

  @Test
  public void testEmptySegment() throws Exception {
    index.addSegment(METRIC, 3L, TimeRange.of(14_400_000, 21_600_000));
    SeriesIDSet result = index.getSeriesIDsForTag(METRIC, "ip", TimeRange.of(15_000_000, 16_000_000));
    assertEquals(1, result.size());
    assertTrue(result.isEmpty());
  }
}
