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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.drupe.syntax.Expr;
import org.drupe.syntax.Node;
import org.drupe.syntax.Pattern;
import org.drupe.syntax.Token;

/**
 * Compiles a pattern into the conditions that test a subject and the bindings to make once they
 * all hold. Conditions are listed in depth-first order, so a structural check (e.g. the length of
 * a sequence) always precedes the checks that index into it.
 */
final class PatternLowerer {

  /** A name bound by a pattern and the expression that computes its value. */
  record Binding(String name, String value, Node node) {}

  /** The result of lowering one pattern. */
  static final class Lowered {
    final List<String> conditions = new ArrayList<>();
    final List<Binding> bindings = new ArrayList<>();

    /** The conjunction of the conditions, or "True" if there are none. */
    String test() {
      return conditions.isEmpty() ? "True" : Joiner.on(" and ").join(conditions);
    }
  }

  /** Builtin classes whose single positional sub-pattern matches the subject itself. */
  private static final ImmutableSet<String> SELF_MATCHING =
      ImmutableSet.of(
          "bool", "bytearray", "bytes", "dict", "float", "frozenset", "int", "list", "set", "str",
          "tuple");

  private final LoweringContext ctx;
  private final ExpressionLowerer lowerer;

  PatternLowerer(LoweringContext ctx, ExpressionLowerer lowerer) {
    this.ctx = ctx;
    this.lowerer = lowerer;
  }

  /** Lowers {@code pattern} against {@code subject}, an expression that is cheap to re-evaluate. */
  Lowered lower(Pattern pattern, String subject) {
    Lowered result = new Lowered();
    walk(pattern, subject, result, false);
    checkUnique(result.bindings);
    return result;
  }

  /**
   * Lowers the parameter patterns of a pattern-matching function against its argument tuple
   * {@code args}.
   */
  Lowered lowerArguments(List<Pattern> patterns, String args) {
    Lowered result = new Lowered();
    result.conditions.add("len(" + args + ") == " + patterns.size());
    for (int i = 0; i < patterns.size(); i++) {
      walk(patterns.get(i), args + "[" + i + "]", result, false);
    }
    checkUnique(result.bindings);
    return result;
  }

  /** Throws a LoweringError if any name is bound twice. */
  static void checkUnique(List<Binding> bindings) {
    Set<String> seen = new HashSet<>();
    for (Binding b : bindings) {
      if (!seen.add(b.name())) {
        throw LoweringError.at(b.node(), "multiple assignments to name '%s' in pattern", b.name());
      }
    }
  }

  private void bind(Node node, String name, String value, Lowered out, boolean inOr) {
    if (inOr) {
      throw LoweringError.at(node, "alternatives of an or-pattern cannot bind names");
    }
    ctx.checkIdentifier(node, name);
    out.bindings.add(new Binding(name, value, node));
  }

  private void walk(Pattern p, String v, Lowered out, boolean inOr) {
    if (p instanceof Pattern.Wildcard) {
      return;
    } else if (p instanceof Pattern.Capture capture) {
      bind(p, capture.name, v, out, inOr);
    } else if (p instanceof Pattern.Literal literal) {
      String value = literalValue(literal.value);
      out.conditions.add(v + (literal.comparedByIdentity() ? " is " : " == ") + value);
    } else if (p instanceof Pattern.Value value) {
      out.conditions.add(v + " == " + lowerer.lower(value.value));
    } else if (p instanceof Pattern.TypeTest test) {
      out.conditions.add("isinstance(" + v + ", " + lowerer.lowerOperand(test.type) + ")");
      if (test.name != null) {
        bind(p, test.name, v, out, inOr);
      }
    } else if (p instanceof Pattern.ClassPattern cls) {
      walkClass(cls, v, out, inOr);
    } else if (p instanceof Pattern.Sequence sequence) {
      walkSequence(sequence, v, out, inOr);
    } else if (p instanceof Pattern.Mapping mapping) {
      walkMapping(mapping, v, out, inOr);
    } else if (p instanceof Pattern.Or or) {
      walkOr(or, v, out);
    } else if (p instanceof Pattern.As as) {
      walk(as.pattern, v, out, inOr);
      bind(p, as.name, v, out, inOr);
    } else if (p instanceof Pattern.Star) {
      throw LoweringError.at(p, "starred pattern outside a sequence pattern");
    } else {
      throw new AssertionError(p);
    }
  }

  private String literalValue(Expr value) {
    if (value instanceof Expr.Str str) {
      for (Token part : str.parts) {
        if (FormatStrings.isFormat(part)) {
          throw LoweringError.at(value, "format strings are not allowed in patterns");
        }
      }
    }
    return lowerer.lower(value);
  }

  private void walkClass(Pattern.ClassPattern p, String v, Lowered out, boolean inOr) {
    String cls = lowerer.lower(p.cls);
    out.conditions.add("isinstance(" + v + ", " + cls + ")");
    if (p.positional.size() == 1
        && p.cls instanceof Expr.Name name
        && SELF_MATCHING.contains(name.id)) {
      walk(p.positional.get(0), v, out, inOr);
    } else {
      for (int i = 0; i < p.positional.size(); i++) {
        String attribute = "getattr(" + v + ", " + cls + ".__match_args__[" + i + "])";
        walk(p.positional.get(i), attribute, out, inOr);
      }
    }
    for (Pattern.KeywordPattern k : p.keywords) {
      out.conditions.add("hasattr(" + v + ", \"" + k.name + "\")");
      walk(k.pattern, v + "." + k.name, out, inOr);
    }
  }

  private void walkSequence(Pattern.Sequence p, String v, Lowered out, boolean inOr) {
    int n = p.elements.size();
    int star = -1;
    for (int i = 0; i < n; i++) {
      if (p.elements.get(i) instanceof Pattern.Star) {
        if (star >= 0) {
          throw LoweringError.at(p.elements.get(i), "multiple starred names in sequence pattern");
        }
        star = i;
      }
    }
    out.conditions.add(ctx.shim(Shims.IS_SEQ) + "(" + v + ")");
    out.conditions.add(star < 0 ? "len(" + v + ") == " + n : "len(" + v + ") >= " + (n - 1));
    for (int i = 0; i < n; i++) {
      Pattern element = p.elements.get(i);
      if (star >= 0 && i > star) {
        walk(element, v + "[-" + (n - i) + "]", out, inOr);
      } else if (i == star) {
        Pattern.Star s = (Pattern.Star) element;
        if (s.name != null) {
          int after = n - 1 - star;
          String slice = v + "[" + star + ":" + (after == 0 ? "" : "-" + after) + "]";
          bind(s, s.name, "list(" + slice + ")", out, inOr);
        }
      } else {
        walk(element, v + "[" + i + "]", out, inOr);
      }
    }
  }

  private void walkMapping(Pattern.Mapping p, String v, Lowered out, boolean inOr) {
    out.conditions.add("isinstance(" + v + ", " + ctx.shim(Shims.MAPPING) + ")");
    List<String> keys = new ArrayList<>();
    for (int i = 0; i < p.keys.size(); i++) {
      String key = literalValue(p.keys.get(i));
      keys.add(key);
      out.conditions.add(key + " in " + v);
      walk(p.values.get(i), v + "[" + key + "]", out, inOr);
    }
    if (p.rest != null) {
      String k = ctx.freshName("key");
      String excluded = "(" + Joiner.on(", ").join(keys) + (keys.size() == 1 ? ",)" : ")");
      String rest =
          String.format("{%s: %s[%s] for %s in %s if %s not in %s}", k, v, k, k, v, k, excluded);
      bind(p, p.rest, rest, out, inOr);
    }
  }

  private void walkOr(Pattern.Or p, String v, Lowered out) {
    List<String> alternatives = new ArrayList<>();
    for (Pattern alternative : p.alternatives) {
      Lowered lowered = new Lowered();
      walk(alternative, v, lowered, true);
      if (lowered.conditions.isEmpty()) {
        // This alternative always matches, so the whole or-pattern does.
        return;
      }
      alternatives.add(
          lowered.conditions.size() == 1 ? lowered.test() : "(" + lowered.test() + ")");
    }
    out.conditions.add("(" + Joiner.on(" or ").join(alternatives) + ")");
  }

  /** True if the pattern matches every subject. */
  static boolean irrefutable(Pattern p) {
    if (p instanceof Pattern.Wildcard || p instanceof Pattern.Capture) {
      return true;
    } else if (p instanceof Pattern.As as) {
      return irrefutable(as.pattern);
    } else if (p instanceof Pattern.Or or) {
      return or.alternatives.stream().anyMatch(PatternLowerer::irrefutable);
    }
    return false;
  }

  /**
   * True if the pattern can be written as a native {@code case} pattern. Class patterns are always
   * lowered, as is a type test whose type isn't a dotted name.
   */
  static boolean nativeExpressible(Pattern p) {
    if (p instanceof Pattern.ClassPattern) {
      return false;
    } else if (p instanceof Pattern.TypeTest test) {
      return isDotted(test.type);
    } else if (p instanceof Pattern.Sequence sequence) {
      return sequence.elements.stream().allMatch(PatternLowerer::nativeExpressible);
    } else if (p instanceof Pattern.Mapping mapping) {
      return mapping.values.stream().allMatch(PatternLowerer::nativeExpressible);
    } else if (p instanceof Pattern.Or or) {
      return or.alternatives.stream().allMatch(PatternLowerer::nativeExpressible);
    } else if (p instanceof Pattern.As as) {
      return nativeExpressible(as.pattern);
    }
    return true;
  }

  private static boolean isDotted(Expr e) {
    return e instanceof Expr.Name
        || (e instanceof Expr.Attribute attribute && isDotted(attribute.value));
  }

  /**
   * Renders a pattern for a native {@code case} clause. The pattern must already have been
   * validated by {@link #lower}.
   */
  String renderNative(Pattern p) {
    if (p instanceof Pattern.Wildcard) {
      return "_";
    } else if (p instanceof Pattern.Capture capture) {
      return capture.name;
    } else if (p instanceof Pattern.Literal literal) {
      return lowerer.lower(literal.value);
    } else if (p instanceof Pattern.Value value) {
      return lowerer.lower(value.value);
    } else if (p instanceof Pattern.TypeTest test) {
      String cls = lowerer.lower(test.type) + "()";
      return test.name == null ? cls : cls + " as " + test.name;
    } else if (p instanceof Pattern.Star star) {
      return "*" + (star.name == null ? "_" : star.name);
    } else if (p instanceof Pattern.Sequence sequence) {
      return "[" + joinNative(sequence.elements) + "]";
    } else if (p instanceof Pattern.Mapping mapping) {
      List<String> items = new ArrayList<>();
      for (int i = 0; i < mapping.keys.size(); i++) {
        items.add(lowerer.lower(mapping.keys.get(i)) + ": " + renderNative(mapping.values.get(i)));
      }
      if (mapping.rest != null) {
        items.add("**" + mapping.rest);
      }
      return "{" + Joiner.on(", ").join(items) + "}";
    } else if (p instanceof Pattern.Or or) {
      List<String> alternatives = new ArrayList<>();
      for (Pattern alternative : or.alternatives) {
        alternatives.add(renderNative(alternative));
      }
      return Joiner.on(" | ").join(alternatives);
    } else if (p instanceof Pattern.As as) {
      String inner = renderNative(as.pattern);
      if (as.pattern instanceof Pattern.Or || as.pattern instanceof Pattern.As) {
        inner = "(" + inner + ")";
      }
      return inner + " as " + as.name;
    }
    throw new AssertionError(p);
  }

  private String joinNative(ImmutableList<Pattern> patterns) {
    List<String> parts = new ArrayList<>();
    for (Pattern p : patterns) {
      parts.add(renderNative(p));
    }
    return Joiner.on(", ").join(parts);
  }
}
