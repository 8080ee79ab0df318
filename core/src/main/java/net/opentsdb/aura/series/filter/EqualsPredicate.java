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

/** Matches series whose tag value equals the literal exactly. */
public class EqualsPredicate extends TagPredicate {

  public static final String TYPE = "equals";

  private final String value;

  @JsonCreator
  protected EqualsPredicate(@JsonProperty("tagKey") final String tagKey,
                            @JsonProperty("value") final String value) {
    super(tagKey);
    this.value = Preconditions.checkNotNull(value, "Value cannot be null.");
  }

  public String getValue() {
    return value;
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
    final EqualsPredicate other = (EqualsPredicate) o;
    return tagKey.equals(other.tagKey) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, tagKey, value);
  }

  @Override
  public String toString() {
    return tagKey + "='" + value + "'";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder extends TagPredicate.Builder<Builder, EqualsPredicate> {
    private String value;

    public Builder withValue(final String value) {
      this.value = value;
      return this;
    }

    @Override
    public EqualsPredicate build() {
      return new EqualsPredicate(tag, value);
    }
  }
}
