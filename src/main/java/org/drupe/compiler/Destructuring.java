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
import java.util.List;
import org.drupe.syntax.Expr;

/**
 * Assignment targets. A list or tuple target is assigned natively when the profile supports it,
 * and otherwise through {@code _drupe_unpack}, which checks the arity and returns the items (with
 * the starred part collected into a list) so that each sub-target can be assigned in turn.
 */
final class Destructuring {

  private Destructuring() {}

  private static Expr unwrap(Expr target) {
    while (target instanceof Expr.Paren) {
      target = ((Expr.Paren) target).inner;
    }
    return target;
  }

  /** True for a list or tuple target, possibly parenthesized. */
  static boolean isSequence(Expr target) {
    Expr t = unwrap(target);
    return t instanceof Expr.TupleExpr || t instanceof Expr.ListExpr;
  }

  private static ImmutableList<Expr> elements(Expr target) {
    Expr t = unwrap(target);
    return (t instanceof Expr.TupleExpr)
        ? ((Expr.TupleExpr) t).elements
        : ((Expr.ListExpr) t).elements;
  }

  private static boolean hasStar(Expr target) {
    if (!isSequence(target)) {
      return false;
    }
    for (Expr e : elements(target)) {
      if (e instanceof Expr.Starred || hasStar(e)) {
        return true;
      }
    }
    return false;
  }

  /** Throws a LoweringError unless {@code target} can be assigned to. */
  static void validate(Expr target) {
    Expr t = unwrap(target);
    if (t instanceof Expr.Starred) {
      throw LoweringError.at(t, "starred assignment target must be in a list or tuple");
    }
    validateElement(t);
  }

  private static void validateElement(Expr target) {
    Expr t = unwrap(target);
    if (t instanceof Expr.Name || t instanceof Expr.Attribute || t instanceof Expr.Subscript) {
      return;
    }
    if (isSequence(t)) {
      boolean starred = false;
      for (Expr e : elements(t)) {
        if (e instanceof Expr.Starred) {
          if (starred) {
            throw LoweringError.at(e, "multiple starred expressions in assignment");
          }
          starred = true;
          validate(((Expr.Starred) e).value);
        } else {
          validateElement(e);
        }
      }
      return;
    }
    throw LoweringError.at(t, "cannot assign to %s", describe(t));
  }

  private static String describe(Expr e) {
    if (e instanceof Expr.Call) {
      return "function call";
    } else if (e instanceof Expr.Number || e instanceof Expr.Str || e instanceof Expr.Constant) {
      return "literal";
    } else if (e instanceof Expr.Lambda) {
      return "lambda";
    } else if (e instanceof Expr.Comprehension) {
      return "comprehension";
    }
    return "expression";
  }

  /** True if assigning to {@code target} needs {@code _drupe_unpack} on this profile. */
  static boolean needsLowering(Expr target, LoweringContext ctx) {
    if (!isSequence(target)) {
      return false;
    }
    if (hasStar(target) && !ctx.isNative(ConstructKind.STARRED_DESTRUCTURING)) {
      return true;
    }
    return !ctx.isNative(ConstructKind.DESTRUCTURING);
  }

  /** Renders a validated target as written. */
  static String render(Expr target, LoweringContext ctx, ExpressionLowerer lowerer) {
    if (target instanceof Expr.Paren) {
      return "(" + render(((Expr.Paren) target).inner, ctx, lowerer) + ")";
    } else if (target instanceof Expr.Starred) {
      return "*" + render(((Expr.Starred) target).value, ctx, lowerer);
    } else if (isSequence(target)) {
      List<String> parts = new ArrayList<>();
      for (Expr e : elements(target)) {
        parts.add(render(e, ctx, lowerer));
      }
      String items = Joiner.on(", ").join(parts);
      if (target instanceof Expr.ListExpr) {
        return "[" + items + "]";
      }
      Expr.TupleExpr tuple = (Expr.TupleExpr) target;
      items += (parts.size() == 1) ? "," : "";
      return tuple.parenthesized ? "(" + items + ")" : items;
    }
    return lowerer.lower(target);
  }

  /**
   * Renders the target of a comprehension's {@code for} clause. Comprehensions can't hold the
   * statements that lowering needs, so only targets the profile supports natively are allowed.
   */
  static String comprehensionTarget(Expr target, LoweringContext ctx, ExpressionLowerer lowerer) {
    validate(target);
    if (hasStar(target) && !ctx.isNative(ConstructKind.STARRED_DESTRUCTURING)) {
      throw LoweringError.at(
          target, "a starred comprehension target is not available for target '%s'", ctx.profile);
    }
    return render(target, ctx, lowerer);
  }

  /**
   * Emits the statements that assign {@code value} (already rendered, and evaluated exactly once)
   * to a validated target.
   */
  static void assign(
      Expr target, String value, int line, LoweringContext ctx, ExpressionLowerer lowerer) {
    if (!needsLowering(target, ctx)) {
      ctx.out.line(line, render(target, ctx, lowerer) + " = " + value);
      return;
    }
    ImmutableList<Expr> elements = elements(target);
    int star = -1;
    for (int i = 0; i < elements.size(); i++) {
      if (elements.get(i) instanceof Expr.Starred) {
        star = i;
      }
    }
    String items = ctx.freshName("ref");
    ctx.out.line(
        line,
        String.format(
            "%s = %s(%s, %d, %d)", items, ctx.shim(Shims.UNPACK), value, elements.size(), star));
    for (int i = 0; i < elements.size(); i++) {
      Expr element = elements.get(i);
      if (element instanceof Expr.Starred) {
        element = ((Expr.Starred) element).value;
      }
      assign(element, items + "[" + i + "]", line, ctx, lowerer);
    }
  }
}
