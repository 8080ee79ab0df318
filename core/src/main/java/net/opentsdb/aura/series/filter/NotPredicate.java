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

package net.opentsdb.aura.series.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Negation of a predicate. Only a negated {@link TagPredicate} can be
 * resolved, since the complement is taken against every series carrying the
 * inner predicate's tag key. Composite inner predicates are representable so
 * that they can be rejected with a proper error at search time.
 */
public class NotPredicate implements Predicate {

  public static final String TYPE = "not";

  private final Predicate inner;

  @JsonCreator
  protected NotPredicate(@JsonProperty("inner") final Predicate inner) {
    this.inner = Preconditions.checkNotNull(inner, "Inner predicate cannot be null.");
  }

  public static NotPredicate not(final Predicate inner) {
    return new NotPredicate(inner);
  }

  public Predicate getInner() {
    return inner;
  }

  @Override
  public <T, E extends Exception> T accept(final PredicateVisitor<T, E> visitor) throws E {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return inner.equals(((NotPredicate) o).inner);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, inner);
  }

  @Override
  public String toString() {
    return "not(" + inner + ")";
  }
}
