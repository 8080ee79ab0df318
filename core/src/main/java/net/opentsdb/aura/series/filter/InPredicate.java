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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Matches series whose tag value is any of the listed literals. */
public class InPredicate extends TagPredicate {

  public static final String TYPE = "in";

  private final ImmutableSet<String> values;

  @JsonCreator
  protected InPredicate(@JsonProperty("tagKey") final String tagKey,
                        @JsonProperty("values") final Collection<String> values) {
    super(tagKey);
    Preconditions.checkArgument(values != null && !values.isEmpty(),
        "At least one value is required for tag " + tagKey);
    for (String value : values) {
      Preconditions.checkArgument(value != null, "Values cannot contain null for tag " + tagKey);
    }
    this.values = ImmutableSet.copyOf(values);
  }

  /** @return the values in the order they were first given. */
  public Set<String> getValues() {
    return values;
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
    final InPredicate other = (InPredicate) o;
    return tagKey.equals(other.tagKey) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, tagKey, values);
  }

  @Override
  public String toString() {
    return tagKey + " in ('" + Joiner.on("','").join(values) + "')";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder extends TagPredicate.Builder<Builder, InPredicate> {
    private final List<String> values = Lists.newArrayList();

    public Builder withValues(final String... values) {
      this.values.clear();
      return addValues(values);
    }

    public Builder addValues(final String... values) {
      for (String value : values) {
        this.values.add(value);
      }
      return this;
    }

    @Override
    public InPredicate build() {
      return new InPredicate(tag, values);
    }
  }
}
