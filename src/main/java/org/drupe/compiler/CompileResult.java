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

/**
 * The outcome of one compile.
 *
 * @param outputText the generated program; empty if the source could not be parsed
 * @param usedShimNames the shims included in the header, in header order
 * @param fingerprint the cache key of the source and options, as lowercase hex
 * @param diagnostics errors and warnings, ordered by source position
 * @param valid false if any diagnostic is an error; the output is then best-effort at most
 * @param positionMap element {@code i} is the source line of output line {@code i + 1}, or 0 for
 *     lines that have no source counterpart
 */
public record CompileResult(
    String outputText,
    ImmutableList<String> usedShimNames,
    String fingerprint,
    ImmutableList<Diagnostic> diagnostics,
    boolean valid,
    ImmutableList<Integer> positionMap) {

  static CompileResult failed(String fingerprint, ImmutableList<Diagnostic> diagnostics) {
    return new CompileResult(
        "", ImmutableList.of(), fingerprint, diagnostics, false, ImmutableList.of());
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics.stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics.stream()
        .filter(d -> !d.isError())
        .collect(ImmutableList.toImmutableList());
  }

  /** The source line that produced the given 1-based output line, or 0 if none did. */
  public int sourceLine(int outputLine) {
    return (outputLine >= 1 && outputLine <= positionMap.size())
        ? positionMap.get(outputLine - 1)
        : 0;
  }
}
