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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.drupe.grammar.ParseState;
import org.drupe.syntax.Normalizer;
import org.drupe.syntax.Stmt;
import org.drupe.syntax.SurfaceGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles Drupe source to Python source for a target profile.
 *
 * <p>Each call is independent: it creates its own parse state and lowering context, so {@link
 * #compile} may be called concurrently from any number of threads. The output depends only on the
 * source and the options.
 */
public final class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  /** The compiler version; part of every fingerprint. */
  public static final String VERSION = "1.0.0";

  private static final Comparator<Diagnostic> BY_POSITION =
      Comparator.comparingInt(Diagnostic::line).thenComparingInt(Diagnostic::column);

  private Compiler() {}

  /**
   * Compiles {@code source}. Problems are reported as diagnostics rather than thrown: a lex or
   * parse error produces no output, while lowering errors leave best-effort output with {@code
   * valid() == false}.
   */
  public static CompileResult compile(String source, CompileOptions options) {
    String fingerprint = Fingerprints.fingerprint(source, options);
    List<Diagnostic> diagnostics = new ArrayList<>();
    ImmutableList<Stmt> module;
    try {
      Normalizer.Result lexed = Normalizer.normalize(source);
      diagnostics.addAll(lexed.warnings);
      diagnostics.addAll(StyleChecker.check(lexed.tokens));
      ParseState state = new ParseState(lexed.tokens);
      try {
        module = SurfaceGrammar.parseFile(state);
      } catch (StackOverflowError e) {
        throw state.nestingError();
      }
      logger.trace(
          "Parsed {} tokens ({} memo hits, {} misses)",
          lexed.tokens.size(),
          state.memoHits(),
          state.memoMisses());
    } catch (LexError | ParseError e) {
      diagnostics.add(e.toDiagnostic());
      logger.debug("Compile failed: {}", e.getMessage());
      return CompileResult.failed(fingerprint, sorted(diagnostics));
    }
    LoweringContext ctx = new LoweringContext(options.profile);
    try {
      new StatementLowerer(ctx).lowerModule(module);
    } catch (LexError | ParseError e) {
      // From an expression embedded in a format string.
      diagnostics.add(e.toDiagnostic());
      logger.debug("Compile failed: {}", e.getMessage());
      return CompileResult.failed(fingerprint, sorted(diagnostics));
    }
    diagnostics.addAll(ctx.diagnostics());
    if (options.strict && diagnostics.stream().anyMatch(d -> !d.isError())) {
      List<Diagnostic> promoted = new ArrayList<>();
      diagnostics.forEach(d -> promoted.add(d.promoted()));
      logger.debug("Strict compile failed with {} diagnostics", promoted.size());
      return CompileResult.failed(fingerprint, sorted(promoted));
    }
    Assembler.Output output = Assembler.assemble(ctx, options, fingerprint);
    boolean valid = diagnostics.stream().noneMatch(Diagnostic::isError);
    logger.debug(
        "Compiled {} statements for target {}: {} output lines, shims {}, {} diagnostics",
        module.size(),
        options.profile,
        output.positionMap().size(),
        output.shimNames(),
        diagnostics.size());
    return new CompileResult(
        output.text(),
        output.shimNames(),
        fingerprint,
        sorted(diagnostics),
        valid,
        output.positionMap());
  }

  private static ImmutableList<Diagnostic> sorted(List<Diagnostic> diagnostics) {
    return ImmutableList.sortedCopyOf(BY_POSITION, diagnostics);
  }
}
