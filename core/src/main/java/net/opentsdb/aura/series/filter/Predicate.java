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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a filter tree over the tags of a metric's series. The set of node
 * kinds is closed: every consumer walks the tree through a
 * {@link PredicateVisitor}, so a new kind must be handled everywhere before the
 * code compiles again.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = Predicate.FIELD_TYPE)
@JsonSubTypes({
    @JsonSubTypes.Type(value = EqualsPredicate.class, name = EqualsPredicate.TYPE),
    @JsonSubTypes.Type(value = LikePredicate.class, name = LikePredicate.TYPE),
    @JsonSubTypes.Type(value = RegexPredicate.class, name = RegexPredicate.TYPE),
    @JsonSubTypes.Type(value = InPredicate.class, name = InPredicate.TYPE),
    @JsonSubTypes.Type(value = NotPredicate.class, name = NotPredicate.TYPE),
    @JsonSubTypes.Type(value = BinaryPredicate.class, name = BinaryPredicate.TYPE)
})
public interface Predicate {

  String FIELD_TYPE = "type";

  <T, E extends Exception> T accept(PredicateVisitor<T, E> visitor) throws E;
}
