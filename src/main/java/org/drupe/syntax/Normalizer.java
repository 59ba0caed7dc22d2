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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.drupe.compiler.Diagnostic;
import org.drupe.compiler.LexError;

/**
 * Converts source text into a token stream in which indentation is represented by explicit INDENT
 * and DEDENT tokens, so that the grammar never has to look at whitespace.
 *
 * <ul>
 *   <li>A tab advances the indentation width to the next multiple of {@link #TAB_WIDTH}.
 *   <li>Newlines inside an unclosed bracket run, and a backslash followed by a newline, join
 *       physical lines into one logical line.
 *   <li>Blank lines and comments produce no tokens.
 * </ul>
 *
 * <p>A few tokens depend on the bracket context: {@code (|} opens a lazy sequence unless it is
 * followed by {@code >}, {@code *} or {@code )} (so that the operator functions {@code (|>)},
 * {@code (|*>)} and {@code (|)} still work), {@code |)} closes one only if the innermost open
 * bracket is {@code (|}, and {@code ::} inside square brackets is two colons so that slices like
 * {@code a[::2]} work.
 */
public final class Normalizer {

  public static final int TAB_WIDTH = 8;

  /** The most brackets that may be open at once, as in CPython's tokenizer. */
  public static final int MAX_NESTING = 200;

  /** The result of normalization: the tokens, plus any style warnings. */
  public static final class Result {
    public final ImmutableList<Token> tokens;
    public final ImmutableList<Diagnostic> warnings;

    Result(ImmutableList<Token> tokens, ImmutableList<Diagnostic> warnings) {
      this.tokens = tokens;
      this.warnings = warnings;
    }
  }

  /** Operators, longest first so that the first one that matches is the right one. */
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "...", "..>", "|*>", "**=", "//=", ">>=", "<<=", "|>", "<|", "..", "::", "->", "**", "//",
          "<<", ">>", "<=", ">=", "==", "!=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
          "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}",
          ",", ":", ".", ";", "=", "$", "?");

  private static final String LAZY_OPEN = "(|";
  private static final String LAZY_CLOSE = "|)";

  /** Normalizes a complete source file. */
  public static Result normalize(String source) {
    return new Normalizer(source, 1, 0).run();
  }

  /**
   * Normalizes a fragment of a larger source, e.g. an expression embedded in a format string.
   * Positions are reported as if the fragment started at the given line and column.
   */
  public static Result normalize(String source, int firstLine, int firstColumn) {
    return new Normalizer(source, firstLine, firstColumn).run();
  }

  private final String src;
  private final int firstLine;
  private final int firstColumn;

  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private final List<Diagnostic> warnings = new ArrayList<>();

  /** The open brackets, innermost first. */
  private final Deque<Token> brackets = new ArrayDeque<>();

  /** The indentation widths of the enclosing blocks, innermost first; always ends with 0. */
  private final Deque<Integer> indents = new ArrayDeque<>();

  /** Index of the next character to be scanned. */
  private int pos;

  /** 0-based index of the current physical line. */
  private int lineIndex;

  /** Index of the first character of the current physical line. */
  private int lineStart;

  /** The kind of the last token emitted, or null if there are none yet. */
  private TokenKind lastKind;

  private Normalizer(String src, int firstLine, int firstColumn) {
    this.src = src;
    this.firstLine = firstLine;
    this.firstColumn = firstColumn;
  }

  private int line() {
    return firstLine + lineIndex;
  }

  private int column(int index) {
    return (index - lineStart) + (lineIndex == 0 ? firstColumn : 0);
  }

  private void emit(TokenKind kind, String text, int start) {
    tokens.add(new Token(kind, text, line(), column(start)));
    lastKind = kind;
  }

  private void warn(String msg, int index) {
    warnings.add(Diagnostic.warning(msg, line(), column(index)));
  }

  private Result run() {
    indents.push(0);
    int n = src.length();
    boolean atLineStart = true;
    while (pos < n) {
      if (atLineStart && brackets.isEmpty()) {
        if (!scanIndentation()) {
          continue;
        }
        atLineStart = false;
      }
      char c = src.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
      } else if (c == '#') {
        skipComment();
      } else if (c == '\n' || c == '\r') {
        checkTrailingWhitespace(pos);
        if (brackets.isEmpty()) {
          emit(TokenKind.NEWLINE, "", pos);
          atLineStart = true;
        }
        consumeNewline();
      } else if (c == '\\') {
        scanContinuation();
      } else if (c == '"' || c == '\'') {
        scanString(pos);
      } else if (isDigit(c) || (c == '.' && pos + 1 < n && isDigit(src.charAt(pos + 1)))) {
        scanNumber();
      } else if (isNameStart(c)) {
        scanName();
      } else {
        scanOperator();
      }
    }
    if (!brackets.isEmpty()) {
      Token open = brackets.peek();
      throw LexError.at(open.line, open.column, "'%s' was never closed", open.text);
    }
    if (lastKind != null
        && lastKind != TokenKind.NEWLINE
        && lastKind != TokenKind.INDENT
        && lastKind != TokenKind.DEDENT) {
      emit(TokenKind.NEWLINE, "", pos);
    }
    while (indents.peek() > 0) {
      indents.pop();
      emit(TokenKind.DEDENT, "", pos);
    }
    emit(TokenKind.EOF, "", pos);
    return new Result(tokens.build(), ImmutableList.copyOf(warnings));
  }

  /**
   * Measures the indentation at the start of a line. Returns false (after skipping the line) if
   * the line is blank or only has a comment; otherwise emits any INDENT or DEDENT tokens and
   * returns true with {@link #pos} at the first non-whitespace character.
   */
  private boolean scanIndentation() {
    int n = src.length();
    int width = 0;
    boolean sawTab = false;
    boolean sawSpace = false;
    int p = pos;
    for (; p < n; p++) {
      char c = src.charAt(p);
      if (c == ' ') {
        width++;
        sawSpace = true;
      } else if (c == '\t') {
        width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
        sawTab = true;
      } else if (c == '\f') {
        width = 0;
      } else {
        break;
      }
    }
    if (p >= n) {
      if (p > pos) {
        warn("trailing whitespace", pos);
      }
      pos = p;
      return false;
    }
    char c = src.charAt(p);
    if (c == '\n' || c == '\r' || c == '#') {
      pos = p;
      if (c == '#') {
        skipComment();
      }
      if (pos < n) {
        checkTrailingWhitespace(pos);
        consumeNewline();
      }
      return false;
    }
    if (sawTab && sawSpace) {
      warn("mixed tabs and spaces in indentation", pos);
    }
    pos = p;
    int current = indents.peek();
    if (width > current) {
      if (lastKind == null) {
        throw new LexError.IndentationError("unexpected indent", line(), column(p));
      }
      indents.push(width);
      emit(TokenKind.INDENT, "", p);
    } else if (width < current) {
      while (indents.peek() > width) {
        indents.pop();
        emit(TokenKind.DEDENT, "", p);
      }
      if (indents.peek() != width) {
        throw new LexError.IndentationError(
            "unindent does not match any outer indentation level (line " + line() + ")",
            line(),
            column(p));
      }
    }
    return true;
  }

  private void skipComment() {
    int n = src.length();
    while (pos < n && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
      pos++;
    }
  }

  /** Given the index of a newline character, warns if it is preceded by spaces or tabs. */
  private void checkTrailingWhitespace(int newline) {
    if (newline > lineStart) {
      char prev = src.charAt(newline - 1);
      if (prev == ' ' || prev == '\t') {
        warn("trailing whitespace", newline - 1);
      }
    }
  }

  /** Consumes a "\n", "\r" or "\r\n" at {@link #pos} and starts a new physical line. */
  private void consumeNewline() {
    if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
      pos++;
    }
    pos++;
    lineIndex++;
    lineStart = pos;
  }

  private void scanContinuation() {
    int start = pos;
    pos++;
    if (pos >= src.length()) {
      throw LexError.at(line(), column(start), "unexpected end of input after line continuation");
    }
    char c = src.charAt(pos);
    if (c != '\n' && c != '\r') {
      throw LexError.at(
          line(), column(start), "unexpected character after line continuation character");
    }
    warn("backslash line continuation (use brackets instead)", start);
    consumeNewline();
  }

  private void scanString(int start) {
    int n = src.length();
    int startLine = line();
    int startColumn = column(start);
    int p = pos;
    char quote = src.charAt(p);
    boolean triple = p + 2 < n && src.charAt(p + 1) == quote && src.charAt(p + 2) == quote;
    p += triple ? 3 : 1;
    while (true) {
      if (p >= n) {
        throw LexError.at(startLine, startColumn, "unterminated string literal");
      }
      char c = src.charAt(p);
      if (c == '\\') {
        p++;
        if (p < n && (src.charAt(p) == '\n' || src.charAt(p) == '\r')) {
          pos = p;
          consumeNewline();
          p = pos;
        } else {
          p++;
        }
      } else if (c == quote
          && (!triple || (p + 2 < n && src.charAt(p + 1) == quote && src.charAt(p + 2) == quote))) {
        p += triple ? 3 : 1;
        break;
      } else if (c == '\n' || c == '\r') {
        if (!triple) {
          throw LexError.at(startLine, startColumn, "unterminated string literal");
        }
        pos = p;
        consumeNewline();
        p = pos;
      } else {
        p++;
      }
    }
    tokens.add(new Token(TokenKind.STRING, src.substring(start, p), startLine, startColumn));
    lastKind = TokenKind.STRING;
    pos = p;
  }

  private void scanNumber() {
    int n = src.length();
    int start = pos;
    int p = pos;
    if (src.charAt(p) == '0'
        && p + 1 < n
        && "xXoObB".indexOf(src.charAt(p + 1)) >= 0) {
      p += 2;
      while (p < n && (Character.isLetterOrDigit(src.charAt(p)) || src.charAt(p) == '_')) {
        p++;
      }
    } else {
      p = skipDigits(p);
      // "1..f" is not a float; leave the dots for the composition operator.
      if (p < n && src.charAt(p) == '.' && !(p + 1 < n && src.charAt(p + 1) == '.')) {
        p = skipDigits(p + 1);
      }
      if (p < n && (src.charAt(p) == 'e' || src.charAt(p) == 'E')) {
        int q = p + 1;
        if (q < n && (src.charAt(q) == '+' || src.charAt(q) == '-')) {
          q++;
        }
        if (q < n && isDigit(src.charAt(q))) {
          p = skipDigits(q);
        }
      }
      if (p < n && (src.charAt(p) == 'j' || src.charAt(p) == 'J')) {
        p++;
      }
    }
    if (p < n && isNameStart(src.charAt(p))) {
      throw LexError.at(line(), column(start), "invalid numeric literal");
    }
    pos = p;
    emit(TokenKind.NUMBER, src.substring(start, p), start);
  }

  private int skipDigits(int p) {
    while (p < src.length() && (isDigit(src.charAt(p)) || src.charAt(p) == '_')) {
      p++;
    }
    return p;
  }

  private void scanName() {
    int n = src.length();
    int start = pos;
    int p = pos + 1;
    while (p < n && isNamePart(src.charAt(p))) {
      p++;
    }
    if (p < n && (src.charAt(p) == '"' || src.charAt(p) == '\'') && isStringPrefix(start, p)) {
      pos = p;
      scanString(start);
      return;
    }
    pos = p;
    emit(TokenKind.NAME, src.substring(start, p), start);
  }

  private boolean isStringPrefix(int start, int end) {
    String prefix = src.substring(start, end).toLowerCase();
    switch (prefix) {
      case "r":
      case "b":
      case "u":
      case "f":
      case "rb":
      case "br":
      case "fr":
      case "rf":
        return true;
      default:
        return false;
    }
  }

  private void scanOperator() {
    int start = pos;
    Token open = brackets.peek();
    if (src.startsWith(LAZY_OPEN, pos) && !followedByOneOf(pos + 2, ">*)")) {
      pos += 2;
      openBracket(LAZY_OPEN, start);
      return;
    }
    if (src.startsWith(LAZY_CLOSE, pos) && open != null && open.text.equals(LAZY_OPEN)) {
      pos += 2;
      brackets.pop();
      emit(TokenKind.OP, LAZY_CLOSE, start);
      return;
    }
    if (src.startsWith("::", pos) && open != null && open.text.equals("[")) {
      pos++;
      emit(TokenKind.OP, ":", start);
      return;
    }
    for (String op : OPERATORS) {
      if (src.startsWith(op, pos)) {
        pos += op.length();
        switch (op) {
          case "(":
          case "[":
          case "{":
            openBracket(op, start);
            return;
          case ")":
          case "]":
          case "}":
            closeBracket(op, start);
            return;
          default:
            emit(TokenKind.OP, op, start);
            return;
        }
      }
    }
    throw LexError.at(line(), column(start), "invalid character '%s'", src.charAt(start));
  }

  private boolean followedByOneOf(int p, String chars) {
    return p < src.length() && chars.indexOf(src.charAt(p)) >= 0;
  }

  private void openBracket(String text, int start) {
    if (brackets.size() >= MAX_NESTING) {
      throw LexError.at(line(), column(start), "too many nested parentheses");
    }
    emit(TokenKind.OP, text, start);
    brackets.push(new Token(TokenKind.OP, text, line(), column(start)));
  }

  private void closeBracket(String text, int start) {
    Token open = brackets.poll();
    if (open == null) {
      throw LexError.at(line(), column(start), "unmatched '%s'", text);
    }
    String expected = closerFor(open.text);
    if (!expected.equals(text)) {
      throw LexError.at(
          line(),
          column(start),
          "closing '%s' does not match '%s' opened at line %s",
          text,
          open.text,
          open.line);
    }
    emit(TokenKind.OP, text, start);
  }

  private static String closerFor(String open) {
    switch (open) {
      case "(":
        return ")";
      case "[":
        return "]";
      case "{":
        return "}";
      default:
        return LAZY_CLOSE;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isNameStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  private static boolean isNamePart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }
}
