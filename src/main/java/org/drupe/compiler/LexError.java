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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Malformed indentation, brackets, strings or line continuations. Always fatal: a compile that
 * throws a LexError produces no output.
 */
public class LexError extends CompileError {

  public LexError(String msg, int lineNum, int charPositionInLine) {
    super(msg, lineNum, charPositionInLine);
  }

  @FormatMethod
  public static LexError at(int lineNum, int charPositionInLine, String fmt, Object... fmtArgs) {
    return new LexError(String.format(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  @Override
  public String kind() {
    return "LexError";
  }

  /**
   * A LexError caused by inconsistent indentation. Reported with the same kind name that the host
   * language uses for the equivalent problem.
   */
  public static class IndentationError extends LexError {
    public IndentationError(String msg, int lineNum, int charPositionInLine) {
      super(msg, lineNum, charPositionInLine);
    }

    @Override
    public String kind() {
      return "IndentationError";
    }
  }
}
