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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the body of the output program one physical line at a time, remembering which source
 * line each one came from.
 */
final class Emitter {
  static final String INDENT = "    ";

  /**
   * One physical output line. {@code statementEnd} is true for the last physical line of a
   * logical line; line-number comments may only be appended there.
   */
  record Line(String text, int sourceLine, boolean statementEnd, boolean code) {}

  private final List<Line> lines = new ArrayList<>();
  private int depth;

  /** Source lines following the line breaks in string literals lowered since the last line. */
  private final List<Integer> breakLines = new ArrayList<>();

  /**
   * Emits a logical line at the current indentation. The text may span several physical lines
   * (e.g. a triple-quoted string); only the first is indented.
   */
  void line(int sourceLine, String text) {
    add(sourceLine, text, true);
  }

  /**
   * Records the source line that follows a line break inside a lowered string literal. The
   * continuation lines of the next emitted line are attributed to these, in order.
   */
  void lineBreak(int sourceLine) {
    breakLines.add(sourceLine);
  }

  /** Emits a comment line, which does not count as a statement when checking for empty blocks. */
  void comment(int sourceLine, String text) {
    add(sourceLine, "# " + text, false);
  }

  private void add(int sourceLine, String text, boolean code) {
    List<String> parts = Splitter.on('\n').splitToList(text);
    String prefix = Strings.repeat(INDENT, depth);
    int physical = sourceLine;
    for (int i = 0; i < parts.size(); i++) {
      String part = (i == 0) ? prefix + parts.get(i) : parts.get(i);
      if (i > 0 && i <= breakLines.size()) {
        physical = breakLines.get(i - 1);
      }
      lines.add(new Line(part, physical, i == parts.size() - 1, code));
    }
    breakLines.clear();
  }

  void indent() {
    depth++;
  }

  void dedent() {
    depth--;
  }

  int depth() {
    return depth;
  }

  void setDepth(int depth) {
    this.depth = depth;
  }

  /** A position that {@link #truncate} can roll back to. */
  int mark() {
    return lines.size();
  }

  void truncate(int mark) {
    lines.subList(mark, lines.size()).clear();
    breakLines.clear();
  }

  /** True if any statement (not just comments) was emitted since {@code mark}. */
  boolean hasCodeSince(int mark) {
    for (int i = mark; i < lines.size(); i++) {
      if (lines.get(i).code()) {
        return true;
      }
    }
    return false;
  }

  ImmutableList<Line> lines() {
    return ImmutableList.copyOf(lines);
  }
}
