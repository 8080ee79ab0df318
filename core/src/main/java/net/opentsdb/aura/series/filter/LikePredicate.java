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
 * Wildcard match over a tag's values. A {@code *} stands for any run of
 * characters, everything else is literal and the whole value has to match.
 */
public class LikePredicate extends TagPredicate {

  public static final String TYPE = "like";

  public static final char WILDCARD = '*';

  private final String pattern;

  @JsonCreator
  protected LikePredicate(@JsonProperty("tagKey") final String tagKey,
                          @JsonProperty("pattern") final String pattern) {
    super(tagKey);
    this.pattern = Preconditions.checkNotNull(pattern, "Pattern cannot be null.");
  }

  public String getPattern() {
    return pattern;
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
    final LikePredicate other = (LikePredicate) o;
    return tagKey.equals(other.tagKey) && pattern.equals(other.pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, tagKey, pattern);
  }

  @Override
  public String toString() {
    return tagKey + " like '" + pattern + "'";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder extends TagPredicate.Builder<Builder, LikePredicate> {
    private String pattern;

    public Builder withPattern(final String pattern) {
      this.pattern = pattern;
      return this;
    }

    @Override
    public LikePredicate build() {
      return new LikePredicate(tag, pattern);
    }
  }
}
