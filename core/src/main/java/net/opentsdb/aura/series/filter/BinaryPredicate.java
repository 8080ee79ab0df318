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
import net.opentsdb.aura.series.core.SeriesIDSet;

import java.util.Objects;

/** Conjunction or disjunction of two sub trees. */
public class BinaryPredicate implements Predicate {

  public static final String TYPE = "binary";

  private final Operator operator;
  private final Predicate left;
  private final Predicate right;

  @JsonCreator
  protected BinaryPredicate(@JsonProperty("operator") final Operator operator,
                            @JsonProperty("left") final Predicate left,
                            @JsonProperty("right") final Predicate right) {
    this.operator = Preconditions.checkNotNull(operator, "Operator cannot be null.");
    this.left = Preconditions.checkNotNull(left, "Left predicate cannot be null.");
    this.right = Preconditions.checkNotNull(right, "Right predicate cannot be null.");
  }

  public static BinaryPredicate and(final Predicate left, final Predicate right) {
    return new BinaryPredicate(Operator.AND, left, right);
  }

  public static BinaryPredicate or(final Predicate left, final Predicate right) {
    return new BinaryPredicate(Operator.OR, left, right);
  }

  public Operator getOperator() {
    return operator;
  }

  public Predicate getLeft() {
    return left;
  }

  public Predicate getRight() {
    return right;
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
    final BinaryPredicate other = (BinaryPredicate) o;
    return operator == other.operator
        && left.equals(other.left)
        && right.equals(other.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, operator, left, right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.name().toLowerCase() + " " + right + ")";
  }

  public enum Operator {
    AND {
      @Override
      public SeriesIDSet combine(final SeriesIDSet left, final SeriesIDSet right) {
        return left.and(right);
      }
    },
    OR {
      @Override
      public SeriesIDSet combine(final SeriesIDSet left, final SeriesIDSet right) {
        return left.or(right);
      }
    };

    public abstract SeriesIDSet combine(SeriesIDSet left, SeriesIDSet right);
  }
}
