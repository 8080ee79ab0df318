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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * A half-open interval {@code [start, end)} in epoch milliseconds bounding the
 * storage segments a lookup should consider.
 */
public final class TimeRange {

  private final long start;
  private final long end;

  @JsonCreator
  public TimeRange(@JsonProperty("start") final long start,
                   @JsonProperty("end") final long end) {
    Preconditions.checkArgument(start <= end,
        "Start %s must not be after end %s", start, end);
    this.start = start;
    this.end = end;
  }

  public static TimeRange of(final long start, final long end) {
    return new TimeRange(start, end);
  }

  /** @return a range covering every representable timestamp. */
  public static TimeRange all() {
    return new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public boolean contains(final long timestamp) {
    return timestamp >= start && timestamp < end;
  }

  /**
   * @param otherStart inclusive start of the other interval.
   * @param otherEnd exclusive end of the other interval.
   * @return true if the two half-open intervals share at least one instant.
   */
  public boolean overlaps(final long otherStart, final long otherEnd) {
    return otherStart < end && start < otherEnd;
  }

  public boolean overlaps(final TimeRange other) {
    return overlaps(other.start, other.end);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(start) + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
