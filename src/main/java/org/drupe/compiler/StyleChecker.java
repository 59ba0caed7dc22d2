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

import com.google.common.collect.ImmutableList;
import org.drupe.syntax.Token;
import org.drupe.syntax.TokenKind;

/** Style warnings that are visible in the token stream. */
final class StyleChecker {
  private StyleChecker() {}

  static ImmutableList<Diagnostic> check(ImmutableList<Token> tokens) {
    ImmutableList.Builder<Diagnostic> warnings = ImmutableList.builder();
    for (Token t : tokens) {
      if (t.kind == TokenKind.OP && t.text.equals(";")) {
        warnings.add(Diagnostic.warning("semicolon statement separator", t.line, t.column));
      }
    }
    return warnings.build();
  }
}
