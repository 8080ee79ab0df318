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

package net.opentsdb.aura.series.core;

/**
 * Root of the failures a series search can report. Any instance raised while
 * evaluating a filter voids the whole result of that search.
 */
public class SeriesSearchException extends Exception {
  private static final long serialVersionUID = -3190529018377406021L;

  public SeriesSearchException(final String message) {
    super(message);
  }

  public SeriesSearchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
