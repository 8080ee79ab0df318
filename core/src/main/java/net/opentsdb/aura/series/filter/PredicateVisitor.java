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

/**
 * One method per predicate kind.
 *
 * @param <T> the value produced for a node.
 * @param <E> the checked exception a visit may raise.
 */
public interface PredicateVisitor<T, E extends Exception> {

  T visit(EqualsPredicate predicate) throws E;

  T visit(LikePredicate predicate) throws E;

  T visit(RegexPredicate predicate) throws E;

  T visit(InPredicate predicate) throws E;

  T visit(NotPredicate predicate) throws E;

  T visit(BinaryPredicate predicate) throws E;
}
