/*
 * Copyright 2025 The Drupe Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.drupe.grammar;

/**
 * A successful rule application: the value built by the rule's semantic actions, and the position
 * of the first token after the match.
 */
public final class Match<T> {
  public final T value;
  public final int end;

  public Match(T value, int end) {
    this.value = value;
    this.end = end;
  }

  @Override
  public String toString() {
    return value + "@" + end;
  }
}
