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
 * One message reported by a compile. Lines are 1-based; columns are 0-based offsets within the
 * line.
 */
public record Diagnostic(Severity severity, String message, int line, int column) {

  public enum Severity {
    WARNING,
    ERROR
  }

  public static Diagnostic error(String message, int line, int column) {
    return new Diagnostic(Severity.ERROR, message, line, column);
  }

  public static Diagnostic warning(String message, int line, int column) {
    return new Diagnostic(Severity.WARNING, message, line, column);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /** Returns a copy of this diagnostic with severity ERROR (used for strict compiles). */
  Diagnostic promoted() {
    return isError() ? this : new Diagnostic(Severity.ERROR, message, line, column);
  }

  @Override
  public String toString() {
    return String.format("%s: %s (%s:%s)", severity, message, line, column);
  }
}
