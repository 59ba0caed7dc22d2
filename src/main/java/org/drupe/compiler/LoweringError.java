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
import org.drupe.syntax.Node;

/**
 * A construct parsed successfully but cannot be lowered, e.g. a destructuring target with two
 * starred names or a construct that the selected target profile has no equivalent for.
 */
public class LoweringError extends CompileError {

  public LoweringError(String msg, int lineNum, int charPositionInLine) {
    super(msg, lineNum, charPositionInLine);
  }

  /** Returns a new LoweringError pointing at the given node. */
  @FormatMethod
  public static LoweringError at(Node node, String fmt, Object... fmtArgs) {
    return new LoweringError(String.format(fmt, fmtArgs), node.line, node.column);
  }

  @Override
  public String kind() {
    return "LoweringError";
  }
}
