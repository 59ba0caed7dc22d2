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

package org.drupe.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.drupe.compiler.Diagnostic;
import org.drupe.compiler.LexError;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class NormalizerTest {

  /** Returns the tokens as a space-separated string, using {@link Token#toString}. */
  private static String tokens(String source) {
    return Normalizer.normalize(source).tokens.stream()
        .map(Token::toString)
        .collect(Collectors.joining(" "));
  }

  /** Returns just the token texts (omitting NEWLINE, INDENT, DEDENT and EOF). */
  private static ImmutableList<String> texts(String source) {
    return Normalizer.normalize(source).tokens.stream()
        .filter(t -> !t.text.isEmpty())
        .map(t -> t.text)
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<String> warnings(String source) {
    return Normalizer.normalize(source).warnings.stream()
        .map(d -> d.message() + "@" + d.line() + ":" + d.column())
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void simpleStatement() {
    assertThat(tokens("x = 1\n"))
        .isEqualTo("NAME(x)@1:0 OP(=)@1:2 NUMBER(1)@1:4 NEWLINE@1:5 EOF@2:0");
  }

  @Test
  public void missingFinalNewline() {
    assertThat(tokens("x")).isEqualTo("NAME(x)@1:0 NEWLINE@1:1 EOF@1:1");
  }

  @Test
  public void emptySource() {
    assertThat(tokens("")).isEqualTo("EOF@1:0");
  }

  @Test
  public void indentAndDedent() {
    assertThat(tokens("if x:\n  y\nz\n"))
        .isEqualTo(
            "NAME(if)@1:0 NAME(x)@1:3 OP(:)@1:4 NEWLINE@1:5 INDENT@2:2 NAME(y)@2:2 NEWLINE@2:3"
                + " DEDENT@3:0 NAME(z)@3:0 NEWLINE@3:1 EOF@4:0");
  }

  @Test
  public void dedentsAtEndOfInput() {
    assertThat(tokens("if x:\n  y"))
        .isEqualTo(
            "NAME(if)@1:0 NAME(x)@1:3 OP(:)@1:4 NEWLINE@1:5 INDENT@2:2 NAME(y)@2:2 NEWLINE@2:3"
                + " DEDENT@2:3 EOF@2:3");
  }

  @Test
  public void tabAdvancesToNextMultipleOfEight() {
    // One tab and eight spaces are the same indentation.
    assertThat(tokens("if x:\n\ty\n        z\n"))
        .isEqualTo(
            "NAME(if)@1:0 NAME(x)@1:3 OP(:)@1:4 NEWLINE@1:5 INDENT@2:1 NAME(y)@2:1 NEWLINE@2:2"
                + " NAME(z)@3:8 NEWLINE@3:9 DEDENT@4:0 EOF@4:0");
  }

  @Test
  public void blankLinesAndCommentsProduceNoTokens() {
    assertThat(tokens("x\n\n  # comment\ny  # trailing\n"))
        .isEqualTo("NAME(x)@1:0 NEWLINE@1:1 NAME(y)@4:0 NEWLINE@4:13 EOF@5:0");
  }

  @Test
  public void newlinesInsideBracketsAreJoined() {
    assertThat(tokens("f(1,\n      2)\n"))
        .isEqualTo(
            "NAME(f)@1:0 OP(()@1:1 NUMBER(1)@1:2 OP(,)@1:3 NUMBER(2)@2:6 OP())@2:7 NEWLINE@2:8"
                + " EOF@3:0");
  }

  @Test
  public void carriageReturns() {
    assertThat(tokens("x\r\ny\r\n"))
        .isEqualTo("NAME(x)@1:0 NEWLINE@1:1 NAME(y)@2:0 NEWLINE@2:1 EOF@3:0");
  }

  @Test
  public void backslashContinuation() {
    assertThat(texts("x = 1 + \\\n  2\n")).containsExactly("x", "=", "1", "+", "2").inOrder();
    assertThat(warnings("x = 1 + \\\n  2\n"))
        .containsExactly("backslash line continuation (use brackets instead)@1:8");
  }

  @Test
  public void tripleQuotedStringSpansLines() {
    assertThat(tokens("s = '''a\nb'''\nt\n"))
        .isEqualTo(
            "NAME(s)@1:0 OP(=)@1:2 STRING('''a\nb''')@1:4 NEWLINE@2:4 NAME(t)@3:0 NEWLINE@3:1"
                + " EOF@4:0");
  }

  private static Object[] operatorCases() {
    return new Object[] {
      new Object[] {"a |> f", ImmutableList.of("a", "|>", "f")},
      new Object[] {"a |*> f", ImmutableList.of("a", "|*>", "f")},
      new Object[] {"f <| a", ImmutableList.of("f", "<|", "a")},
      new Object[] {"f .. g ..> h", ImmutableList.of("f", "..", "g", "..>", "h")},
      new Object[] {"1..f", ImmutableList.of("1", "..", "f")},
      new Object[] {"a :: b", ImmutableList.of("a", "::", "b")},
      new Object[] {"a[::2]", ImmutableList.of("a", "[", ":", ":", "2", "]")},
      new Object[] {"(|1, 2|)", ImmutableList.of("(|", "1", ",", "2", "|)")},
      new Object[] {"(|>)", ImmutableList.of("(", "|>", ")")},
      new Object[] {"(|*>)", ImmutableList.of("(", "|*>", ")")},
      new Object[] {"(|)", ImmutableList.of("(", "|", ")")},
      new Object[] {"(a | b)", ImmutableList.of("(", "a", "|", "b", ")")},
      new Object[] {"f$(?, 1)", ImmutableList.of("f", "$", "(", "?", ",", "1", ")")},
      new Object[] {"x **= 2", ImmutableList.of("x", "**=", "2")},
      new Object[] {"1_000.5e-3j", ImmutableList.of("1_000.5e-3j")},
      new Object[] {"0x_ff + .5", ImmutableList.of("0x_ff", "+", ".5")},
      new Object[] {"rb'\\d' f\"{x}\"", ImmutableList.of("rb'\\d'", "f\"{x}\"")},
    };
  }

  @Test
  @Parameters(method = "operatorCases")
  public void tokenTexts(String source, ImmutableList<String> expected) {
    assertThat(texts(source)).containsExactlyElementsIn(expected).inOrder();
  }

  @Test
  public void fragmentPositions() {
    ImmutableList<Token> tokens = Normalizer.normalize("(a)", 3, 9).tokens;
    assertThat(tokens.get(0).toString()).isEqualTo("OP(()@3:9");
    assertThat(tokens.get(1).toString()).isEqualTo("NAME(a)@3:10");
  }

  @Test
  public void styleWarnings() {
    assertThat(warnings("x = 1 \n")).containsExactly("trailing whitespace@1:5");
    assertThat(warnings("if x:\n \ty\n"))
        .containsExactly("mixed tabs and spaces in indentation@2:0");
    assertThat(warnings("x = 1\ny = 2\n")).isEmpty();
    ImmutableList<Diagnostic> diagnostics = Normalizer.normalize("x = 1 \n").warnings;
    assertThat(diagnostics.get(0).isError()).isFalse();
  }

  private static Object[] errorCases() {
    return new Object[] {
      new Object[] {"  x\n", "unexpected indent", 1, 2},
      new Object[] {
        "if x:\n    y\n  z\n", "unindent does not match any outer indentation level (line 3)", 3, 2
      },
      new Object[] {"f(1,\n  2\n", "'(' was never closed", 1, 1},
      new Object[] {"x)\n", "unmatched ')'", 1, 1},
      new Object[] {"[1)\n", "closing ')' does not match '[' opened at line 1", 1, 2},
      new Object[] {"s = 'abc\n", "unterminated string literal", 1, 4},
      new Object[] {"s = '''abc\n", "unterminated string literal", 1, 4},
      new Object[] {"x = a ! b\n", "invalid character '!'", 1, 6},
      new Object[] {"x = 12abc\n", "invalid numeric literal", 1, 4},
      new Object[] {"x = 1 \\ 2\n", "unexpected character after line continuation character", 1, 6},
      new Object[] {"x = " + "[".repeat(201) + "\n", "too many nested parentheses", 1, 204},
    };
  }

  @Test
  @Parameters(method = "errorCases")
  public void lexErrors(String source, String message, int line, int column) {
    LexError e = assertThrows(LexError.class, () -> Normalizer.normalize(source));
    assertThat(e.msg).isEqualTo(message);
    assertThat(e.lineNum).isEqualTo(line);
    assertThat(e.charPositionInLine).isEqualTo(column);
  }

  @Test
  public void indentationErrorKind() {
    LexError e = assertThrows(LexError.class, () -> Normalizer.normalize("  x\n"));
    assertThat(e).isInstanceOf(LexError.IndentationError.class);
    assertThat(e.toDiagnostic().message()).isEqualTo("IndentationError: unexpected indent");
    LexError other = assertThrows(LexError.class, () -> Normalizer.normalize("x)\n"));
    assertThat(other.kind()).isEqualTo("LexError");
  }
}
