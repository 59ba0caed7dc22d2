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

package org.drupe.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;

/**
 * Allocates the hygienic names introduced by lowering. Every generated name starts with {@link
 * #RESERVED_PREFIX}, which user identifiers may not use, so generated names never collide with
 * user names. Numbering is per compile: two compiles of the same source produce the same names.
 */
public final class NameAllocator {
  public static final String RESERVED_PREFIX = "_drupe";

  private static final CharMatcher HINT_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_'));

  private int next;

  /** Returns a new name of the form {@code _drupe_<hint>_<n>}. */
  public String freshName(String hint) {
    checkArgument(!hint.isEmpty() && HINT_CHARS.matchesAllOf(hint), "bad hint: %s", hint);
    return RESERVED_PREFIX + "_" + hint + "_" + next++;
  }

  /** The number of names allocated so far. */
  public int allocated() {
    return next;
  }

  /** True if a user identifier would clash with generated names. */
  public static boolean isReserved(String identifier) {
    return identifier.startsWith(RESERVED_PREFIX);
  }
}
