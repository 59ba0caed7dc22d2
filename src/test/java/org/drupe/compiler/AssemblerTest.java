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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AssemblerTest {

  private static final String COMPAT_FUTURES =
      "from __future__ import absolute_import, division, print_function, unicode_literals";

  private static CompileResult compile(String source, TargetProfile profile) {
    return Compiler.compile(source, CompileOptions.forProfile(profile));
  }

  private static String hashLine(CompileResult result) {
    return "# __drupe_hash__ = 0x" + result.fingerprint().substring(0, 16);
  }

  private static String lines(List<String> lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void minimalHeader() {
    CompileResult result = compile("x = 1\n", TargetProfile.PY3);
    assertThat(result.valid()).isTrue();
    assertThat(result.usedShimNames()).isEmpty();
    assertThat(result.outputText())
        .isEqualTo(
            lines(
                ImmutableList.of(
                    "#!/usr/bin/env python3",
                    "# -*- coding: utf-8 -*-",
                    hashLine(result),
                    "# Compiled with Drupe 1.0.0 for target '3'",
                    "",
                    "# Compiled Drupe:",
                    "",
                    "x = 1")));
  }

  @Test
  public void python2ProfilesGetCompatibilityFutures() {
    for (TargetProfile profile : ImmutableList.of(TargetProfile.PY2, TargetProfile.UNIVERSAL)) {
      CompileResult result = compile("print(1)\n", profile);
      assertThat(result.outputText())
          .isEqualTo(
              lines(
                  ImmutableList.of(
                      "#!/usr/bin/env python",
                      "# -*- coding: utf-8 -*-",
                      hashLine(result),
                      "# Compiled with Drupe 1.0.0 for target '" + profile.id + "'",
                      COMPAT_FUTURES,
                      "",
                      "# Compiled Drupe:",
                      "",
                      "print(1)")));
    }
  }

  @Test
  public void userFutureImportsMoveToTheHeader() {
    CompileResult result =
        compile("from __future__ import annotations\nx = 1\n", TargetProfile.PY39);
    assertThat(result.valid()).isTrue();
    assertThat(result.outputText()).contains("\nfrom __future__ import annotations\n");
    assertThat(result.outputText()).endsWith("# Compiled Drupe:\n\nx = 1\n");
    assertThat(result.warnings())
        .containsExactly(Diagnostic.warning("__future__ imports are moved to the header", 1, 0));

    result = compile("from __future__ import generators\n", TargetProfile.PY2);
    assertThat(result.outputText()).contains("\n" + COMPAT_FUTURES + ", generators\n");
  }

  @Test
  public void shimsPrecedeTheBody() {
    CompileResult result = compile("y = x |> f\n", TargetProfile.PY36);
    List<String> expected = new ArrayList<>();
    expected.add("#!/usr/bin/env python3");
    expected.add("# -*- coding: utf-8 -*-");
    expected.add(hashLine(result));
    expected.add("# Compiled with Drupe 1.0.0 for target '3.6'");
    expected.add("");
    expected.add("# Drupe header:");
    expected.addAll(Shims.get(Shims.PIPE).lines(false));
    expected.add("");
    expected.add("# Compiled Drupe:");
    expected.add("");
    expected.add("y = _drupe_pipe(x, f)");
    assertThat(result.outputText()).isEqualTo(lines(expected));
    assertThat(result.usedShimNames()).containsExactly(Shims.PIPE);
  }

  @Test
  public void minifiedHeader() {
    CompileResult result =
        Compiler.compile(
            "y = x |> f\n",
            CompileOptions.builder().profile(TargetProfile.PY3).minifyHeader(true).build());
    assertThat(result.outputText())
        .isEqualTo(
            lines(
                ImmutableList.of(
                    "#!/usr/bin/env python3",
                    "# -*- coding: utf-8 -*-",
                    hashLine(result),
                    "def _drupe_pipe(value, func):",
                    " return func(value)",
                    "y = _drupe_pipe(x, f)")));
  }

  @Test
  public void shimsIncludeDependenciesInRegistryOrder() {
    CompileResult result = compile("f = g ..> h\n", TargetProfile.PY3);
    assertThat(result.usedShimNames())
        .containsExactly(Shims.COMPOSE, Shims.FORWARD_COMPOSE)
        .inOrder();
    String text = result.outputText();
    assertThat(text.indexOf("def _drupe_compose(")).isLessThan(text.indexOf("def _drupe_forward"));
  }

  @Test
  public void nativeMatchNeedsNoShims() {
    String source = "match x:\n    case [a]:\n        pass\n    case _:\n        pass\n";
    assertThat(compile(source, TargetProfile.PY310).usedShimNames()).isEmpty();
    assertThat(compile(source, TargetProfile.PY39).usedShimNames())
        .containsExactly(Shims.SEQUENCE, Shims.STR_TYPES, Shims.IS_SEQ, Shims.MATCH_ERROR)
        .inOrder();
  }

  @Test
  public void failedStatementsDropTheirShims() {
    CompileResult result = compile("g = (x -> x |> h)$(?, *args)\ny = 1\n", TargetProfile.PY3);
    assertThat(result.valid()).isFalse();
    assertThat(result.usedShimNames()).isEmpty();
    assertThat(result.outputText())
        .endsWith(
            "# LoweringError: argument unpacking is not allowed in a partial application\n"
                + "y = 1\n");
  }

  @Test
  public void lineNumbering() {
    CompileResult result =
        Compiler.compile(
            "x = 1\n\ny = 2\nnames: list\n",
            CompileOptions.builder().profile(TargetProfile.PY3).lineNumbering(true).build());
    assertThat(result.outputText())
        .endsWith(
            "# Compiled Drupe:\n\n"
                + "x = 1  # line 1\n"
                + "y = 2  # line 3\n"
                + "# names: list\n"
                + "# drupe-line-map: 8=1,9=3,10=4\n");
    assertThat(result.positionMap()).containsExactly(0, 0, 0, 0, 0, 0, 0, 1, 3, 4, 0).inOrder();
    assertThat(result.sourceLine(8)).isEqualTo(1);
    assertThat(result.sourceLine(9)).isEqualTo(3);
    assertThat(result.sourceLine(1)).isEqualTo(0);
    assertThat(result.sourceLine(0)).isEqualTo(0);
    assertThat(result.sourceLine(100)).isEqualTo(0);
  }

  @Test
  public void lineNumberGoesOnTheLastPhysicalLine() {
    CompileResult result =
        Compiler.compile(
            "doc = \"\"\"a\nb\"\"\"\n",
            CompileOptions.builder().profile(TargetProfile.PY3).lineNumbering(true).build());
    assertThat(result.outputText()).contains("\ndoc = \"\"\"a\nb\"\"\"  # line 2\n");
    assertThat(result.outputText()).endsWith("# drupe-line-map: 8=1,9=2\n");
    assertThat(result.sourceLine(8)).isEqualTo(1);
    assertThat(result.sourceLine(9)).isEqualTo(2);
  }

  @Test
  public void stringContinuationLinesKeepTheirSourceLines() {
    CompileResult result =
        compile("x = f(\n    1,\n    \"\"\"a\nb\n\"\"\")\ny = 2\n", TargetProfile.PY3);
    assertThat(result.outputText()).endsWith("x = f(1, \"\"\"a\nb\n\"\"\")\ny = 2\n");
    assertThat(result.positionMap()).containsExactly(0, 0, 0, 0, 0, 0, 0, 1, 4, 5, 6).inOrder();
  }

  @Test
  public void positionMapWithoutLineNumbering() {
    CompileResult result = compile("if x:\n    y = 1\n", TargetProfile.PY3);
    assertThat(result.outputText()).endsWith("if x:\n    y = 1\n");
    assertThat(result.positionMap()).containsExactly(0, 0, 0, 0, 0, 0, 0, 1, 2).inOrder();
  }
}
