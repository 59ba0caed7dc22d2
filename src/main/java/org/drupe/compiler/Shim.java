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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;

/**
 * A header fragment: a self-contained piece of host-language code that defines one stable,
 * namespaced name used by lowered code.
 *
 * <p>Sources are written with four-space indentation units and no trailing newline.
 */
public final class Shim {
  private static final String INDENT_UNIT = "    ";

  public final String name;

  /** The other shims this one refers to, which must precede it in the header. */
  public final ImmutableList<String> dependencies;

  private final String source;

  Shim(String name, ImmutableList<String> dependencies, String source) {
    this.name = name;
    this.dependencies = dependencies;
    this.source = CharMatcher.is('\n').trimTrailingFrom(source);
  }

  /** Returns the lines of this shim, optionally using single-space indentation units. */
  public ImmutableList<String> lines(boolean minify) {
    return Splitter.on('\n')
        .splitToStream(source)
        .map(line -> minify ? minifyIndentation(line) : line)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return lines(false).stream().collect(Collectors.joining("\n"));
  }

  private static String minifyIndentation(String line) {
    int units = 0;
    while (line.startsWith(INDENT_UNIT, units * INDENT_UNIT.length())) {
      units++;
    }
    return " ".repeat(units) + line.substring(units * INDENT_UNIT.length());
  }
}
