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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A leaf predicate: a condition over the values of a single tag key. Only
 * leaves can be resolved by the index directly.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TagPredicate implements Predicate {

  protected final String tagKey;

  protected TagPredicate(final String tagKey) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(tagKey) && !tagKey.trim().isEmpty(),
        "Tag key cannot be null or empty.");
    this.tagKey = tagKey;
  }

  public String getTagKey() {
    return tagKey;
  }

  public abstract static class Builder<B extends Builder, P extends TagPredicate> {
    protected String tag;

    public B forTag(final String tag) {
      this.tag = tag;
      return (B) this;
    }

    public abstract P build();
  }
}
