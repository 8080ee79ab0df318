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

import com.google.common.base.Preconditions;
import org.roaringbitmap.ImmutableBitmapDataProvider;
import org.roaringbitmap.RoaringBitmap;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * Series identifiers partitioned by the storage segment (version) they were
 * recorded under. Each version maps to exactly one, never null, bitmap.
 * <p>
 * {@link #and(SeriesIDSet)}, {@link #or(SeriesIDSet)} and
 * {@link #andNot(SeriesIDSet)} never touch their operands and always hand back
 * a set built from fresh bitmaps, so results can be shared between branches of
 * a filter tree. {@link #add(long, RoaringBitmap)} is the only mutator and is
 * meant for whoever assembles a set, typically an index.
 * <p>
 * Not thread safe while being assembled; safe to read from many threads once
 * published.
 */
public class SeriesIDSet {

  private final TreeMap<Long, RoaringBitmap> versions;

  public SeriesIDSet() {
    versions = new TreeMap<>();
  }

  /**
   * @param version the segment version.
   * @param ids series identifiers recorded under it.
   * @return a new set holding a single version.
   */
  public static SeriesIDSet of(final long version, final int... ids) {
    final SeriesIDSet set = new SeriesIDSet();
    set.versions.put(version, RoaringBitmap.bitmapOf(ids));
    return set;
  }

  /**
   * Merges the bitmap into this set. An existing bitmap for the version is
   * replaced by its union with the given one. The argument is copied and never
   * retained.
   *
   * @param version the segment version.
   * @param bitmap a non-null bitmap of series identifiers.
   */
  public void add(final long version, final RoaringBitmap bitmap) {
    Preconditions.checkNotNull(bitmap, "Bitmap for version " + version + " cannot be null.");
    final RoaringBitmap existing = versions.get(version);
    if (existing == null) {
      versions.put(version, bitmap.clone());
    } else {
      versions.put(version, RoaringBitmap.or(existing, bitmap));
    }
  }

  /**
   * Intersection. Only versions present on both sides survive.
   *
   * @param other the right hand operand.
   * @return a new set.
   */
  public SeriesIDSet and(final SeriesIDSet other) {
    final SeriesIDSet result = new SeriesIDSet();
    for (Map.Entry<Long, RoaringBitmap> entry : versions.entrySet()) {
      final RoaringBitmap right = other.versions.get(entry.getKey());
      if (right != null) {
        result.versions.put(entry.getKey(), RoaringBitmap.and(entry.getValue(), right));
      }
    }
    return result;
  }

  /**
   * Union over the versions of both sides. A version known to one side only
   * carries that side's bitmap through unchanged.
   *
   * @param other the right hand operand.
   * @return a new set.
   */
  public SeriesIDSet or(final SeriesIDSet other) {
    final SeriesIDSet result = new SeriesIDSet();
    for (Map.Entry<Long, RoaringBitmap> entry : versions.entrySet()) {
      final RoaringBitmap right = other.versions.get(entry.getKey());
      result.versions.put(entry.getKey(), right == null
          ? entry.getValue().clone()
          : RoaringBitmap.or(entry.getValue(), right));
    }
    for (Map.Entry<Long, RoaringBitmap> entry : other.versions.entrySet()) {
      if (!versions.containsKey(entry.getKey())) {
        result.versions.put(entry.getKey(), entry.getValue().clone());
      }
    }
    return result;
  }

  /**
   * Asymmetric difference. The result keeps exactly the versions of this set;
   * identifiers are removed only where {@code other} has the same version.
   *
   * @param other the identifiers to subtract.
   * @return a new set.
   */
  public SeriesIDSet andNot(final SeriesIDSet other) {
    final SeriesIDSet result = new SeriesIDSet();
    for (Map.Entry<Long, RoaringBitmap> entry : versions.entrySet()) {
      final RoaringBitmap right = other.versions.get(entry.getKey());
      result.versions.put(entry.getKey(), right == null
          ? entry.getValue().clone()
          : RoaringBitmap.andNot(entry.getValue(), right));
    }
    return result;
  }

  /** @return true if no version holds a single identifier. */
  public boolean isEmpty() {
    for (RoaringBitmap bitmap : versions.values()) {
      if (!bitmap.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** @return the versions in ascending order. */
  public NavigableSet<Long> versions() {
    return Collections.unmodifiableNavigableSet(versions.navigableKeySet());
  }

  public boolean contains(final long version) {
    return versions.containsKey(version);
  }

  /**
   * @param version the segment version.
   * @return a copy of the bitmap, or null if the version is absent.
   */
  public ImmutableBitmapDataProvider getBitmap(final long version) {
    final RoaringBitmap bitmap = versions.get(version);
    return bitmap == null ? null : bitmap.clone();
  }

  /** @return a deep copy sharing no bitmap with this set. */
  public SeriesIDSet copy() {
    final SeriesIDSet copy = new SeriesIDSet();
    for (Map.Entry<Long, RoaringBitmap> entry : versions.entrySet()) {
      copy.versions.put(entry.getKey(), entry.getValue().clone());
    }
    return copy;
  }

  /** @return the number of versions, empty or not. */
  public int size() {
    return versions.size();
  }

  /** @return the number of identifiers summed over all versions. */
  public long cardinality() {
    long cardinality = 0;
    for (RoaringBitmap bitmap : versions.values()) {
      cardinality += bitmap.getLongCardinality();
    }
    return cardinality;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesIDSet)) {
      return false;
    }
    return versions.equals(((SeriesIDSet) o).versions);
  }

  @Override
  public int hashCode() {
    return versions.hashCode();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder().append("{");
    boolean first = true;
    for (Map.Entry<Long, RoaringBitmap> entry : versions.entrySet()) {
      if (!first) {
        buf.append(", ");
      }
      first = false;
      buf.append(entry.getKey())
          .append("=")
          .append(entry.getValue());
    }
    return buf.append("}").toString();
  }
}
