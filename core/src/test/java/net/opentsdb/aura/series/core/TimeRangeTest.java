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

package net.opentsdb.aura.series.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeRangeTest {

  @Test
  public void testHalfOpen() {
    TimeRange range = TimeRange.of(1000, 2000);
    assertTrue(range.contains(1000));
    assertTrue(range.contains(1999));
    assertFalse(range.contains(2000));
    assertFalse(range.contains(999));
  }

  @Test
  public void testOverlaps() {
    TimeRange range = TimeRange.of(1000, 2000);
    assertTrue(range.overlaps(1500, 2500));
    assertTrue(range.overlaps(0, 1001));
    assertTrue(range.overlaps(TimeRange.all()));
    assertFalse(range.overlaps(2000, 3000));
    assertFalse(range.overlaps(0, 1000));
  }

  @Test
  public void testInverted() {
    assertThrows(IllegalArgumentException.class, () -> TimeRange.of(2000, 1000));
  }

  @Test
  public void testEquality() {
    assertEquals(TimeRange.of(1, 2), TimeRange.of(1, 2));
    assertEquals(TimeRange.of(1, 2).hashCode(), TimeRange.of(1, 2).hashCode());
    assertEquals("[1, 2)", TimeRange.of(1, 2).toString());
  }
}
