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

package net.opentsdb.aura.series.index;

import net.opentsdb.aura.series.filter.LikePredicate;

import java.util.regex.Pattern;

/** Translates wildcard patterns into anchored regular expressions. */
final class LikePatterns {

  private LikePatterns() {
  }

  static Pattern compile(final String like) {
    final StringBuilder regex = new StringBuilder();
    int start = 0;
    for (int i = 0; i < like.length(); i++) {
      if (like.charAt(i) == LikePredicate.WILDCARD) {
        if (i > start) {
          regex.append(Pattern.quote(like.substring(start, i)));
        }
        regex.append(".*");
        start = i + 1;
      }
    }
    if (start < like.length()) {
      regex.append(Pattern.quote(like.substring(start)));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
