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

package org.drupe.syntax;

/** An immutable token, with the position of its first character in the original source. */
public final class Token {
  public final TokenKind kind;
  public final String text;

  /** 1-based line number. */
  public final int line;

  /** 0-based offset of the token's first character within its line. */
  public final int column;

  public Token(TokenKind kind, String text, int line, int column) {
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public boolean is(TokenKind kind, String text) {
    return this.kind == kind && this.text.equals(text);
  }

  /** A short description for error messages. */
  public String describe() {
    switch (kind) {
      case NEWLINE:
        return "end of line";
      case INDENT:
        return "indent";
      case DEDENT:
        return "dedent";
      case EOF:
        return "end of input";
      default:
        return "'" + text + "'";
    }
  }

  @Override
  public String toString() {
    return String.format("%s%s@%s:%s", kind, text.isEmpty() ? "" : "(" + text + ")", line, column);
  }
}
