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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Joins the header (the hash line, the banner, {@code __future__} imports and the shims the body
 * refers to) with the lowered body, and builds the output-to-source position map.
 */
final class Assembler {

  /** The {@code __future__} features that make Python 2 behave like Python 3. */
  private static final ImmutableList<String> COMPATIBILITY_FEATURES =
      ImmutableList.of("absolute_import", "division", "print_function", "unicode_literals");

  static final String LINE_MAP_PREFIX = "# drupe-line-map: ";

  record Output(String text, ImmutableList<String> shimNames, ImmutableList<Integer> positionMap) {}

  private final List<String> lines = new ArrayList<>();
  private final List<Integer> sources = new ArrayList<>();

  private Assembler() {}

  private void header(String line) {
    lines.add(line);
    sources.add(0);
  }

  static Output assemble(LoweringContext ctx, CompileOptions options, String fingerprint) {
    return new Assembler().run(ctx, options, fingerprint);
  }

  private Output run(LoweringContext ctx, CompileOptions options, String fingerprint) {
    boolean minify = options.minifyHeader;
    header(ctx.profile.supportsPython2() ? "#!/usr/bin/env python" : "#!/usr/bin/env python3");
    header("# -*- coding: utf-8 -*-");
    header("# __drupe_hash__ = 0x" + fingerprint.substring(0, Fingerprints.PREFIX_LENGTH));
    if (!minify) {
      header(
          String.format(
              "# Compiled with Drupe %s for target '%s'", Compiler.VERSION, ctx.profile.id));
    }
    Set<String> features = new LinkedHashSet<>();
    if (!ctx.isNative(ConstructKind.FUTURE_IMPORTS)) {
      features.addAll(COMPATIBILITY_FEATURES);
    }
    features.addAll(ctx.futureFeatures());
    if (!features.isEmpty()) {
      header("from __future__ import " + Joiner.on(", ").join(features));
    }
    ImmutableList<Shim> shims = Shims.closure(ctx.usedShims());
    if (!shims.isEmpty()) {
      if (!minify) {
        header("");
        header("# Drupe header:");
      }
      for (Shim shim : shims) {
        shim.lines(minify).forEach(this::header);
        if (!minify) {
          header("");
        }
      }
    }
    ImmutableList<Emitter.Line> body = ctx.out.lines();
    if (!minify) {
      if (shims.isEmpty()) {
        header("");
      }
      header("# Compiled Drupe:");
      header("");
    }
    List<String> lineMap = new ArrayList<>();
    for (Emitter.Line line : body) {
      String text = line.text();
      if (options.lineNumbering && line.statementEnd() && line.code()) {
        text += "  # line " + line.sourceLine();
      }
      lines.add(text);
      sources.add(line.sourceLine());
      lineMap.add(lines.size() + "=" + line.sourceLine());
    }
    if (options.lineNumbering) {
      header(LINE_MAP_PREFIX + Joiner.on(',').join(lineMap));
    }
    ImmutableList<String> shimNames =
        shims.stream().map(s -> s.name).collect(ImmutableList.toImmutableList());
    return new Output(
        Joiner.on('\n').join(lines) + "\n", shimNames, ImmutableList.copyOf(sources));
  }
}
