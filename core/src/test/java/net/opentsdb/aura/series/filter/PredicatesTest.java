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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PredicatesTest {

  @Test
  public void testBuilders() {
    EqualsPredicate equals = EqualsPredicate.newBuilder().forTag("ip").withValue("1.1.1.1").build();
    assertEquals("ip", equals.getTagKey());
    assertEquals("1.1.1.1", equals.getValue());
    assertEquals("ip='1.1.1.1'", equals.toString());

    LikePredicate like = LikePredicate.newBuilder().forTag("ip").withPattern("1.1.*.1").build();
    assertEquals("1.1.*.1", like.getPattern());

    RegexPredicate regex = RegexPredicate.newBuilder().forTag("ip").withPattern("1.1.*.1").build();
    assertEquals("ip=~'1.1.*.1'", regex.toString());

    InPredicate in = InPredicate.newBuilder()
        .forTag("ip")
        .withValues("1.1.1.1", "1.1.3.3")
        .addValues("1.1.1.1")
        .build();
    assertEquals(2, in.getValues().size());
    assertEquals("ip in ('1.1.1.1','1.1.3.3')", in.toString());
  }

  @Test
  public void testInvalidLeaves() {
    assertThrows(IllegalArgumentException.class,
        () -> EqualsPredicate.newBuilder().withValue("v").build());
    assertThrows(IllegalArgumentException.class,
        () -> EqualsPredicate.newBuilder().forTag(" ").withValue("v").build());
    assertThrows(NullPointerException.class,
        () -> EqualsPredicate.newBuilder().forTag("ip").build());
    assertThrows(IllegalArgumentException.class,
        () -> InPredicate.newBuilder().forTag("ip").build());
    assertThrows(IllegalArgumentException.class,
        () -> RegexPredicate.newBuilder().forTag("ip").withPattern("web[").build());
  }

  @Test
  public void testStructuralEquality() {
    Predicate a = BinaryPredicate.and(
        NotPredicate.not(InPredicate.newBuilder().forTag("ip").withValues("a", "b").build()),
        EqualsPredicate.newBuilder().forTag("region").withValue("sh").build());
    Predicate b = BinaryPredicate.and(
        NotPredicate.not(InPredicate.newBuilder().forTag("ip").withValues("a", "b").build()),
        EqualsPredicate.newBuilder().forTag("region").withValue("sh").build());
    Predicate c = BinaryPredicate.or(
        NotPredicate.not(InPredicate.newBuilder().forTag("ip").withValues("a", "b").build()),
        EqualsPredicate.newBuilder().forTag("region").withValue("sh").build());

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertNotEquals(
        LikePredicate.newBuilder().forTag("ip").withPattern("1*").build(),
        RegexPredicate.newBuilder().forTag("ip").withPattern("1*").build());
    assertEquals("(not(ip in ('a','b')) and region='sh')", a.toString());
  }

  @Test
  public void testJson() {
    Predicate tree = BinaryPredicate.and(
        BinaryPredicate.and(
            NotPredicate.not(InPredicate.newBuilder().forTag("ip").withValues("a", "b").build()),
            EqualsPredicate.newBuilder().forTag("region").withValue("sh").build()),
        BinaryPredicate.or(
            LikePredicate.newBuilder().forTag("path").withPattern("/data*").build(),
            RegexPredicate.newBuilder().forTag("path").withPattern("^/home").build()));

    String json = Predicates.toJson(tree);
    assertTrue(json.contains("\"type\":\"binary\""));
    assertTrue(json.contains("\"type\":\"not\""));
    assertEquals(tree, Predicates.fromJson(json));
  }

  @Test
  public void testJsonFromHand() {
    Predicate predicate = Predicates.fromJson(
        "{\"type\":\"not\",\"inner\":{\"type\":\"equals\",\"tagKey\":\"ip\",\"value\":\"1.1.1.1\"}}");
    assertEquals(
        NotPredicate.not(EqualsPredicate.newBuilder().forTag("ip").withValue("1.1.1.1").build()),
        predicate);
  }

  @Test
  public void testJsonInvalid() {
    assertThrows(IllegalArgumentException.class, () -> Predicates.fromJson("{\"tagKey\":\"ip\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> Predicates.fromJson("{\"type\":\"in\",\"tagKey\":\"ip\",\"values\":[]}"));
    assertThrows(IllegalArgumentException.class, () -> Predicates.fromJson("not json"));
  }
}
