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

/**
 * No grammar rule matched the token stream. The position is that of the deepest (furthest
 * advanced) failure, which is usually the start of the part of the program that could not be
 * parsed.
 */
public class ParseError extends CompileError {

  public ParseError(String msg, int lineNum, int charPositionInLine) {
    super(msg, lineNum, charPositionInLine);
  }

  @Override
  public String kind() {
    return "ParseError";
  }
}
