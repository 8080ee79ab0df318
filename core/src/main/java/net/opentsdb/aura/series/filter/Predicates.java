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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** JSON interchange form of predicate trees. */
public final class Predicates {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private Predicates() {
  }

  public static String toJson(final Predicate predicate) {
    try {
      return OBJECT_MAPPER.writeValueAsString(predicate);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize predicate " + predicate, e);
    }
  }

  /**
   * @param json a tree as written by {@link #toJson(Predicate)}.
   * @return the predicate tree.
   * @throws IllegalArgumentException if the JSON is malformed or describes an
   * invalid tree.
   */
  public static Predicate fromJson(final String json) {
    try {
      return OBJECT_MAPPER.readValue(json, Predicate.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to parse predicate: " + json, e);
    }
  }
}
