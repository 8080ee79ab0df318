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

package net.opentsdb.aura.series.query;

import net.opentsdb.aura.series.core.SeriesSearchException;
import net.opentsdb.aura.series.filter.Predicate;

/**
 * The filter tree holds a node, or a shape, the evaluator cannot resolve. Raised
 * before the index is consulted for the offending subtree.
 */
public class UnsupportedPredicateException extends SeriesSearchException {
  private static final long serialVersionUID = -6632188213795046772L;

  private final transient Predicate predicate;

  public UnsupportedPredicateException(final String message, final Predicate predicate) {
    super(message + ": " + predicate);
    this.predicate = predicate;
  }

  /** @return the offending node. */
  public Predicate getPredicate() {
    return predicate;
  }
}
