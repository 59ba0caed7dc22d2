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

import java.util.concurrent.atomic.AtomicReference;
import org.drupe.syntax.Normalizer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DiagnosticsTest {

  private static final String SEMICOLONS = "x = 1; y = 2\n";

  @Test
  public void warningsLeaveTheOutputValid() {
    CompileResult result = Compiler.compile(SEMICOLONS, CompileOptions.DEFAULT);
    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings())
        .containsExactly(Diagnostic.warning("semicolon statement separator", 1, 5));
    assertThat(result.outputText()).endsWith("\nx = 1\ny = 2\n");
  }

  @Test
  public void strictPromotesWarningsAndDiscardsTheOutput() {
    CompileResult result =
        Compiler.compile(SEMICOLONS, CompileOptions.builder().strict(true).build());
    assertThat(result.valid()).isFalse();
    assertThat(result.outputText()).isEmpty();
    assertThat(result.usedShimNames()).isEmpty();
    assertThat(result.positionMap()).isEmpty();
    assertThat(result.diagnostics())
        .containsExactly(Diagnostic.error("semicolon statement separator", 1, 5));
  }

  @Test
  public void strictWithoutWarningsCompiles() {
    CompileResult result =
        Compiler.compile("x = 1\n", CompileOptions.builder().strict(true).build());
    assertThat(result.valid()).isTrue();
    assertThat(result.outputText()).endsWith("\nx = 1\n");
  }

  @Test
  public void backslashContinuationWarns() {
    CompileResult result = Compiler.compile("x = 1 + \\\n    2\n", CompileOptions.DEFAULT);
    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).line()).isEqualTo(1);
    assertThat(result.outputText()).endsWith("\nx = 1 + 2\n");
  }

  @Test
  public void loweringErrorsKeepBestEffortOutput() {
    CompileResult result =
        Compiler.compile("nonlocal x\ny = 1\n", CompileOptions.forProfile(TargetProfile.PY2));
    assertThat(result.valid()).isFalse();
    assertThat(result.errors())
        .containsExactly(
            Diagnostic.error("LoweringError: 'nonlocal' is not available for target '2'", 1, 0));
    assertThat(result.outputText())
        .endsWith("# LoweringError: 'nonlocal' is not available for target '2'\ny = 1\n");
  }

  @Test
  public void parseErrorsProduceNoOutput() {
    CompileResult result = Compiler.compile("x = 1 +\ny = 2\n", CompileOptions.DEFAULT);
    assertThat(result.valid()).isFalse();
    assertThat(result.outputText()).isEmpty();
    assertThat(result.positionMap()).isEmpty();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).message()).startsWith("ParseError: ");
    assertThat(result.errors().get(0).line()).isEqualTo(1);
    assertThat(result.fingerprint()).matches("[0-9a-f]{64}");
  }

  @Test
  public void parseErrorInsideArrowParametersIsReportedWhereItOccurs() {
    CompileResult result = Compiler.compile("x = (a, b=2 +) -> a\n", CompileOptions.DEFAULT);
    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).hasSize(1);
    Diagnostic error = result.errors().get(0);
    assertThat(error.message()).startsWith("ParseError: ");
    assertThat(error.message()).contains("(found ')')");
    assertThat(error.line()).isEqualTo(1);
    assertThat(error.column()).isEqualTo(13);
  }

  private static String nested(int depth) {
    return "x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "\n";
  }

  @Test
  public void deepNestingWithinTheLimitCompiles() {
    CompileResult result = Compiler.compile(nested(100), CompileOptions.DEFAULT);
    assertThat(result.valid()).isTrue();
  }

  @Test
  public void nestingBeyondTheLimitIsALexError() {
    CompileResult result =
        Compiler.compile(nested(Normalizer.MAX_NESTING + 1), CompileOptions.DEFAULT);
    assertThat(result.valid()).isFalse();
    assertThat(result.errors())
        .containsExactly(Diagnostic.error("LexError: too many nested parentheses", 1, 204));
  }

  @Test
  public void stackExhaustionBecomesADiagnostic() throws InterruptedException {
    // Loads and initializes every class the deep compile needs, on a normal stack.
    assertThat(Compiler.compile(nested(3), CompileOptions.DEFAULT).valid()).isTrue();
    AtomicReference<Object> outcome = new AtomicReference<>();
    Runnable compile =
        () -> {
          try {
            outcome.set(Compiler.compile(nested(150), CompileOptions.DEFAULT));
          } catch (Throwable t) {
            outcome.set(t);
          }
        };
    Thread thread = new Thread(null, compile, "small-stack", 256 * 1024);
    thread.start();
    thread.join();
    assertThat(outcome.get()).isInstanceOf(CompileResult.class);
    CompileResult result = (CompileResult) outcome.get();
    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).message()).endsWith(": expression too deeply nested");
    assertThat(result.errors().get(0).line()).isEqualTo(1);
  }

  @Test
  public void lexErrorsProduceNoOutput() {
    CompileResult result = Compiler.compile("x = 'abc\n", CompileOptions.DEFAULT);
    assertThat(result.valid()).isFalse();
    assertThat(result.outputText()).isEmpty();
    assertThat(result.errors().get(0).message()).startsWith("LexError: ");
  }

  @Test
  public void diagnosticsAreOrderedByPosition() {
    CompileResult result =
        Compiler.compile(
            "nonlocal a\nx = 1; y = 2\nnonlocal b\n",
            CompileOptions.forProfile(TargetProfile.PY2));
    assertThat(result.diagnostics()).hasSize(3);
    assertThat(result.diagnostics().get(0).line()).isEqualTo(1);
    assertThat(result.diagnostics().get(1))
        .isEqualTo(Diagnostic.warning("semicolon statement separator", 2, 5));
    assertThat(result.diagnostics().get(2).line()).isEqualTo(3);
  }

  @Test
  public void diagnosticToString() {
    assertThat(Diagnostic.warning("careful", 3, 4).toString()).isEqualTo("WARNING: careful (3:4)");
  }
}
