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
 * All Drupe language errors detected at compile time throw a CompileError; the subclass identifies
 * which stage of the pipeline rejected the program.
 */
public abstract class CompileError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  protected CompileError(String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** A short name for the kind of error, e.g. "ParseError". */
  public abstract String kind();

  /** Converts this error to the Diagnostic reported by {@link Compiler#compile}. */
  public Diagnostic toDiagnostic() {
    return Diagnostic.error(kind() + ": " + msg, lineNum, charPositionInLine);
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}
