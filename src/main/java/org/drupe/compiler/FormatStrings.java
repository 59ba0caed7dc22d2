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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.drupe.syntax.Expr;
import org.drupe.syntax.Normalizer;
import org.drupe.syntax.SurfaceGrammar;
import org.drupe.syntax.Token;
import org.jspecify.annotations.Nullable;

/**
 * Lowers string literals. Format strings ({@code f"..."}) keep their native form on profiles that
 * have them and otherwise become {@code "...".format(...)} calls; the embedded expressions are
 * parsed and lowered like any other expression, so they may use surface extensions.
 *
 * <p>A LexError or ParseError in an embedded expression propagates to the caller and fails the
 * whole compile.
 */
final class FormatStrings {

  /**
   * A replacement field: {@code {expression!conversion:spec}}. The spec, like a whole format
   * string, is a list of literal text and nested Fields.
   */
  private record Field(
      Expr expression, @Nullable Character conversion, @Nullable List<Object> spec) {}

  /**
   * A parsed format string. Each chunk is either literal text (still escaped as in the source) or
   * a Field.
   */
  private record Parsed(String prefix, String quote, List<Object> chunks) {}

  private FormatStrings() {}

  static String lower(Expr.Str e, LoweringContext ctx, ExpressionLowerer lowerer) {
    boolean anyFormat = false;
    for (Token part : e.parts) {
      anyFormat |= isFormat(part);
    }
    List<String> rendered = new ArrayList<>();
    if (!anyFormat) {
      e.parts.forEach(part -> rendered.add(part.text));
      return Joiner.on(' ').join(rendered);
    }
    boolean concatenate = false;
    for (Token part : e.parts) {
      if (!isFormat(part)) {
        rendered.add(part.text);
        continue;
      }
      Parsed parsed = parse(part, ctx);
      String text = null;
      if (ctx.isNative(ConstructKind.FORMAT_STRINGS)) {
        text = nativeForm(parsed, lowerer);
      }
      if (text == null) {
        text = formatCall(parsed, part, ctx, lowerer);
        concatenate = true;
      }
      rendered.add(text);
    }
    // A .format() call can't take part in implicit concatenation.
    return concatenate
        ? "(" + Joiner.on(" + ").join(rendered) + ")"
        : Joiner.on(' ').join(rendered);
  }

  private static int prefixLength(String text) {
    int i = 0;
    while (i < text.length() && Character.isLetter(text.charAt(i))) {
      i++;
    }
    return i;
  }

  static boolean isFormat(Token token) {
    String prefix = token.text.substring(0, prefixLength(token.text));
    return prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0;
  }

  private static Parsed parse(Token token, LoweringContext ctx) {
    String text = token.text;
    int prefixEnd = prefixLength(text);
    String prefix = text.substring(0, prefixEnd).replace("f", "").replace("F", "");
    if (Ascii.toLowerCase(prefix).contains("b")) {
      throw error(token, 0, "a format string cannot be a bytes literal");
    }
    String triple = Strings.repeat(text.substring(prefixEnd, prefixEnd + 1), 3);
    String quote = text.startsWith(triple, prefixEnd) ? triple : triple.substring(0, 1);
    int start = prefixEnd + quote.length();
    int end = text.length() - quote.length();
    List<Object> chunks = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = start;
    while (i < end) {
      char c = text.charAt(i);
      if ((c == '{' || c == '}') && i + 1 < end && text.charAt(i + 1) == c) {
        literal.append(c).append(c);
        i += 2;
      } else if (c == '}') {
        throw error(token, i, "single '}' is not allowed in a format string");
      } else if (c == '{') {
        if (literal.length() > 0) {
          chunks.add(literal.toString());
          literal.setLength(0);
        }
        i = parseField(token, i, end, chunks, ctx, false);
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) {
      chunks.add(literal.toString());
    }
    return new Parsed(prefix, quote, chunks);
  }

  /**
   * Parses the field starting at {@code open} and returns the index just past its '}'. A field in
   * a format spec is {@code nested}, and cannot have fields in its own spec.
   */
  private static int parseField(
      Token token, int open, int end, List<Object> chunks, LoweringContext ctx, boolean nested) {
    String text = token.text;
    int depth = 0;
    int exprEnd = -1;
    int conversionAt = -1;
    int specAt = -1;
    char inString = 0;
    int i = open + 1;
    for (; i < end; i++) {
      char c = text.charAt(i);
      if (inString != 0) {
        if (c == inString) {
          inString = 0;
        }
        continue;
      }
      if (c == '\\') {
        throw error(token, i, "a format string expression cannot contain a backslash");
      } else if (c == '\'' || c == '"') {
        inString = c;
      } else if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (depth > 0 && (c == ')' || c == ']' || c == '}')) {
        depth--;
      } else if (depth == 0 && c == '}') {
        break;
      } else if (depth == 0 && c == '!' && conversionAt < 0 && !nextIs(text, i, '=')) {
        exprEnd = i;
        conversionAt = i + 1;
      } else if (depth == 0 && c == ':') {
        exprEnd = exprEnd < 0 ? i : exprEnd;
        specAt = i + 1;
        break;
      } else if (depth == 0 && c == '=' && conversionAt < 0 && selfDocumenting(text, i)) {
        throw error(token, i, "self-documenting '=' fields are not supported");
      }
    }
    if (i >= end) {
      throw error(token, open, "unterminated replacement field in format string");
    }
    if (exprEnd < 0) {
      exprEnd = i;
    }
    List<Object> spec = null;
    if (specAt >= 0) {
      spec = new ArrayList<>();
      i = parseSpec(token, specAt, end, spec, ctx, nested);
    }
    Character conversion = null;
    if (conversionAt >= 0) {
      int conversionEnd = specAt >= 0 ? specAt - 1 : i;
      String c = text.substring(conversionAt, conversionEnd);
      if (c.length() != 1 || "rsa".indexOf(c.charAt(0)) < 0) {
        throw error(token, conversionAt, "bad conversion '!%s' in format string", c);
      }
      if (c.equals("a") && ctx.profile.supportsPython2()) {
        throw error(token, conversionAt, "'!a' is not available for target '%s'", ctx.profile);
      }
      conversion = c.charAt(0);
    }
    String source = text.substring(open + 1, exprEnd);
    if (source.trim().isEmpty()) {
      throw error(token, open, "empty expression in format string");
    }
    int[] position = position(token, open + 1);
    Normalizer.Result lexed =
        Normalizer.normalize("(" + source + ")", position[0], position[1] - 1);
    Expr expression = SurfaceGrammar.parseExpression(lexed.tokens);
    chunks.add(new Field(expression, conversion, spec));
    return i + 1;
  }

  /** Parses a format spec starting at {@code start} and returns the index of its closing '}'. */
  private static int parseSpec(
      Token token, int start, int end, List<Object> spec, LoweringContext ctx, boolean nested) {
    String text = token.text;
    StringBuilder literal = new StringBuilder();
    int i = start;
    while (i < end && text.charAt(i) != '}') {
      char c = text.charAt(i);
      if (c == '{') {
        if (nested) {
          throw error(token, i, "expressions nested too deeply in format string");
        }
        if (literal.length() > 0) {
          spec.add(literal.toString());
          literal.setLength(0);
        }
        i = parseField(token, i, end, spec, ctx, true);
      } else {
        literal.append(c);
        i++;
      }
    }
    if (i >= end) {
      throw error(token, start - 1, "unterminated replacement field in format string");
    }
    if (literal.length() > 0) {
      spec.add(literal.toString());
    }
    return i;
  }

  private static boolean nextIs(String text, int i, char c) {
    return i + 1 < text.length() && text.charAt(i + 1) == c;
  }

  /** An '=' that ends the expression, as in {@code {x=}} or {@code {x=!r}}. */
  private static boolean selfDocumenting(String text, int i) {
    char before = text.charAt(i - 1);
    if ("=!<>".indexOf(before) >= 0 || nextIs(text, i, '=')) {
      return false;
    }
    int j = i + 1;
    while (j < text.length() && text.charAt(j) == ' ') {
      j++;
    }
    return j < text.length() && "}!:".indexOf(text.charAt(j)) >= 0;
  }

  /** The line and column of the character at {@code index} within the token's text. */
  private static int[] position(Token token, int index) {
    int line = token.line;
    int column = token.column;
    for (int i = 0; i < index; i++) {
      if (token.text.charAt(i) == '\n') {
        line++;
        column = 0;
      } else {
        column++;
      }
    }
    return new int[] {line, column};
  }

  @FormatMethod
  private static LoweringError error(Token token, int index, String fmt, Object... args) {
    int[] position = position(token, index);
    return new LoweringError(String.format(fmt, args), position[0], position[1]);
  }

  /**
   * Renders a native format string, or returns null if a lowered expression can't be embedded in
   * one (it contains the quote character or a backslash).
   */
  private static @Nullable String nativeForm(Parsed parsed, ExpressionLowerer lowerer) {
    StringBuilder sb = new StringBuilder("f").append(parsed.prefix()).append(parsed.quote());
    if (!appendNative(sb, parsed.chunks(), parsed.quote().charAt(0), lowerer)) {
      return null;
    }
    return sb.append(parsed.quote()).toString();
  }

  private static boolean appendNative(
      StringBuilder sb, List<Object> chunks, char quote, ExpressionLowerer lowerer) {
    for (Object chunk : chunks) {
      if (!(chunk instanceof Field field)) {
        sb.append((String) chunk);
        continue;
      }
      Expr expression = field.expression();
      if (expression instanceof Expr.Paren paren && !(paren.inner instanceof Expr.Lambda)) {
        expression = paren.inner;
      }
      String text = lowerer.lower(expression);
      if (text.indexOf(quote) >= 0 || text.indexOf('\\') >= 0) {
        return false;
      }
      sb.append('{').append(text.startsWith("{") ? " " : "").append(text);
      appendConversion(sb, field);
      if (field.spec() != null) {
        sb.append(':');
        if (!appendNative(sb, field.spec(), quote, lowerer)) {
          return false;
        }
      }
      sb.append('}');
    }
    return true;
  }

  private static String formatCall(
      Parsed parsed, Token token, LoweringContext ctx, ExpressionLowerer lowerer) {
    StringBuilder sb = new StringBuilder(parsed.prefix()).append(parsed.quote());
    List<String> args = new ArrayList<>();
    appendPositional(sb, parsed.chunks(), args, lowerer);
    sb.append(parsed.quote()).append(".format(").append(Joiner.on(", ").join(args));
    return sb.append(")").toString();
  }

  /** Appends fields as positional references, numbered in the order Python evaluates them. */
  private static void appendPositional(
      StringBuilder sb, List<Object> chunks, List<String> args, ExpressionLowerer lowerer) {
    for (Object chunk : chunks) {
      if (!(chunk instanceof Field field)) {
        sb.append((String) chunk);
        continue;
      }
      Expr expression = field.expression();
      if (expression instanceof Expr.Paren paren) {
        expression = paren.inner;
      }
      sb.append('{').append(args.size());
      args.add(lowerer.lowerOperand(expression));
      appendConversion(sb, field);
      if (field.spec() != null) {
        sb.append(':');
        appendPositional(sb, field.spec(), args, lowerer);
      }
      sb.append('}');
    }
  }

  private static void appendConversion(StringBuilder sb, Field field) {
    if (field.conversion() != null) {
      sb.append('!').append(field.conversion().charValue());
    }
  }
}
