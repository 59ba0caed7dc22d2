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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.drupe.syntax.Arg;
import org.drupe.syntax.Expr;
import org.drupe.syntax.Param;
import org.drupe.syntax.Token;

/**
 * Renders an expression as Python source text for the context's target profile. Surface
 * extensions (pipes, composition, partial application, operator functions, lazy sequences) become
 * calls to header shims; everything else keeps its shape.
 */
final class ExpressionLowerer implements Expr.Visitor<String> {
  private static final Joiner COMMA = Joiner.on(", ");

  /** Operator functions that exist in the {@code operator} module, by symbol. */
  private static final ImmutableMap<String, String> OPERATOR_MODULE =
      ImmutableMap.<String, String>builder()
          .put("+", "add")
          .put("-", "sub")
          .put("*", "mul")
          .put("/", "truediv")
          .put("//", "floordiv")
          .put("%", "mod")
          .put("**", "pow")
          .put("@", "matmul")
          .put("<<", "lshift")
          .put(">>", "rshift")
          .put("&", "and_")
          .put("|", "or_")
          .put("^", "xor")
          .put("~", "inv")
          .put("<", "lt")
          .put(">", "gt")
          .put("<=", "le")
          .put(">=", "ge")
          .put("==", "eq")
          .put("!=", "ne")
          .put("is", "is_")
          .put("is not", "is_not")
          .put("not", "not_")
          .buildOrThrow();

  /** Operator functions with no {@code operator} module equivalent. */
  private static final ImmutableMap<String, String> OPERATOR_LAMBDAS =
      ImmutableMap.of(
          "in", "(lambda a, b: a in b)",
          "not in", "(lambda a, b: a not in b)",
          "and", "(lambda a, b: a and b)",
          "or", "(lambda a, b: a or b)");

  private final LoweringContext ctx;

  ExpressionLowerer(LoweringContext ctx) {
    this.ctx = ctx;
  }

  String lower(Expr e) {
    return e.accept(this);
  }

  /**
   * Renders an expression that will be embedded as an operand or argument; unparenthesized
   * tuples and yields get parentheses.
   */
  String lowerOperand(Expr e) {
    String result = lower(e);
    if ((e instanceof Expr.TupleExpr && !((Expr.TupleExpr) e).parenthesized)
        || e instanceof Expr.Yield) {
      return "(" + result + ")";
    }
    return result;
  }

  private String join(List<Expr> exprs) {
    List<String> parts = new ArrayList<>();
    for (Expr e : exprs) {
      parts.add(lower(e));
    }
    return COMMA.join(parts);
  }

  /** {@code lambda: e}, the delayed form of an expression. */
  private String thunk(Expr e) {
    return "lambda: " + lowerOperand(e);
  }

  @Override
  public String visitName(Expr.Name e) {
    ctx.checkIdentifier(e, e.id);
    return e.id;
  }

  @Override
  public String visitNumber(Expr.Number e) {
    if (e.text.indexOf('_') >= 0 && !ctx.isNative(ConstructKind.NUMERIC_UNDERSCORES)) {
      return e.text.replace("_", "");
    }
    return e.text;
  }

  @Override
  public String visitConstant(Expr.Constant e) {
    return e.text;
  }

  @Override
  public String visitStr(Expr.Str e) {
    String lowered = FormatStrings.lower(e, ctx, this);
    for (Token part : e.parts) {
      int breaks = CharMatcher.is('\n').countIn(part.text);
      for (int i = 1; i <= breaks; i++) {
        ctx.out.lineBreak(part.line + i);
      }
    }
    return lowered;
  }

  @Override
  public String visitParen(Expr.Paren e) {
    String inner = lower(e.inner);
    // Arrow lambdas are already parenthesized.
    boolean wrapped = e.inner instanceof Expr.Lambda && ((Expr.Lambda) e.inner).arrow;
    return wrapped ? inner : "(" + inner + ")";
  }

  @Override
  public String visitTuple(Expr.TupleExpr e) {
    if (hasStar(e.elements)) {
      return "tuple" + starredDisplay(e.elements);
    }
    String items = join(e.elements) + (e.elements.size() == 1 ? "," : "");
    return e.parenthesized ? "(" + items + ")" : items;
  }

  @Override
  public String visitList(Expr.ListExpr e) {
    return hasStar(e.elements) ? starredDisplay(e.elements) : "[" + join(e.elements) + "]";
  }

  @Override
  public String visitSet(Expr.SetExpr e) {
    return hasStar(e.elements) ? "set" + starredDisplay(e.elements) : "{" + join(e.elements) + "}";
  }

  private static boolean hasStar(List<Expr> elements) {
    return elements.stream().anyMatch(x -> x instanceof Expr.Starred);
  }

  /** Renders a display containing {@code *x} items as a parenthesized list concatenation. */
  private String starredDisplay(List<Expr> elements) {
    List<String> parts = new ArrayList<>();
    List<Expr> run = new ArrayList<>();
    for (Expr element : elements) {
      if (element instanceof Expr.Starred) {
        if (!run.isEmpty()) {
          parts.add("[" + join(run) + "]");
          run.clear();
        }
        parts.add("list(" + lowerOperand(((Expr.Starred) element).value) + ")");
      } else {
        run.add(element);
      }
    }
    if (!run.isEmpty()) {
      parts.add("[" + join(run) + "]");
    }
    return "(" + Joiner.on(" + ").join(parts) + ")";
  }

  @Override
  public String visitDict(Expr.DictExpr e) {
    List<String> items = new ArrayList<>();
    for (int i = 0; i < e.keys.size(); i++) {
      items.add(lower(e.keys.get(i)) + ": " + lower(e.values.get(i)));
    }
    return "{" + COMMA.join(items) + "}";
  }

  @Override
  public String visitComprehension(Expr.Comprehension e) {
    String body = lower(e.element);
    if (e.value != null) {
      body += ": " + lower(e.value);
    }
    body += clauses(e.clauses);
    switch (e.kind) {
      case LIST:
        return "[" + body + "]";
      case SET:
      case DICT:
        return "{" + body + "}";
      case GENERATOR:
        return "(" + body + ")";
    }
    throw new AssertionError(e.kind);
  }

  private String clauses(List<Expr.CompClause> clauses) {
    StringBuilder sb = new StringBuilder();
    for (Expr.CompClause c : clauses) {
      if (c.target != null) {
        sb.append(" for ")
            .append(Destructuring.comprehensionTarget(c.target, ctx, this))
            .append(" in ")
            .append(lower(c.expr));
      } else {
        sb.append(" if ").append(lower(c.expr));
      }
    }
    return sb.toString();
  }

  @Override
  public String visitUnary(Expr.Unary e) {
    return e.op + lower(e.operand);
  }

  @Override
  public String visitNot(Expr.Not e) {
    return "not " + lower(e.operand);
  }

  @Override
  public String visitBinary(Expr.Binary e) {
    return lower(e.left) + " " + e.op + " " + lower(e.right);
  }

  @Override
  public String visitBoolOp(Expr.BoolOp e) {
    List<String> parts = new ArrayList<>();
    for (Expr operand : e.operands) {
      parts.add(lower(operand));
    }
    return Joiner.on(" " + e.op + " ").join(parts);
  }

  @Override
  public String visitCompare(Expr.Compare e) {
    StringBuilder sb = new StringBuilder(lower(e.operands.get(0)));
    for (int i = 0; i < e.ops.size(); i++) {
      sb.append(' ').append(e.ops.get(i)).append(' ').append(lower(e.operands.get(i + 1)));
    }
    return sb.toString();
  }

  @Override
  public String visitTernary(Expr.Ternary e) {
    return lower(e.body) + " if " + lower(e.condition) + " else " + lower(e.orElse);
  }

  @Override
  public String visitLambda(Expr.Lambda e) {
    String params = params(e.params, false);
    String result = "lambda" + (params.isEmpty() ? "" : " " + params) + ": " + lower(e.body);
    return e.arrow ? "(" + result + ")" : result;
  }

  /**
   * Renders a parameter list. Annotations are included only if {@code annotate} is true and the
   * profile supports them.
   */
  String params(ImmutableList<Param> params, boolean annotate) {
    List<String> parts = new ArrayList<>();
    boolean keywordOnly = false;
    for (Param p : params) {
      ctx.checkIdentifier(p, p.name);
      switch (p.kind) {
        case BARE_STAR:
          keywordOnly = true;
          parts.add("*");
          continue;
        case STAR:
          keywordOnly = true;
          parts.add("*" + p.name + annotation(p, annotate));
          continue;
        case DOUBLE_STAR:
          parts.add("**" + p.name + annotation(p, annotate));
          continue;
        case PLAIN:
          if (keywordOnly) {
            ctx.requireAvailable(
                ConstructKind.KEYWORD_ONLY_PARAMETERS, p, "a keyword-only parameter");
          }
          String text = p.name + annotation(p, annotate);
          if (p.defaultValue != null) {
            String sep = text.equals(p.name) ? "=" : " = ";
            text += sep + lower(p.defaultValue);
          }
          parts.add(text);
          continue;
      }
    }
    if (!parts.isEmpty() && parts.get(parts.size() - 1).equals("*")) {
      throw LoweringError.at(params.get(params.size() - 1), "named arguments must follow bare *");
    }
    return COMMA.join(parts);
  }

  private String annotation(Param p, boolean annotate) {
    return (annotate && p.annotation != null) ? ": " + lower(p.annotation) : "";
  }

  @Override
  public String visitCall(Expr.Call e) {
    return lower(e.func) + "(" + args(e.args) + ")";
  }

  /** Renders call arguments; holes are rejected. */
  String args(List<Arg> args) {
    List<String> parts = new ArrayList<>();
    for (Arg a : args) {
      switch (a.kind) {
        case POSITIONAL:
          parts.add(lower(a.value));
          break;
        case KEYWORD:
          parts.add(a.name + "=" + lower(a.value));
          break;
        case STAR:
          parts.add("*" + lower(a.value));
          break;
        case DOUBLE_STAR:
          parts.add("**" + lower(a.value));
          break;
        case HOLE:
          throw LoweringError.at(a, "'?' is only allowed in a partial application");
      }
    }
    return COMMA.join(parts);
  }

  @Override
  public String visitAttribute(Expr.Attribute e) {
    String value = lower(e.value);
    return (e.value instanceof Expr.Number ? value + " " : value) + "." + e.name;
  }

  @Override
  public String visitSubscript(Expr.Subscript e) {
    String indices = join(e.indices) + (e.tuple && e.indices.size() == 1 ? "," : "");
    return lower(e.value) + "[" + indices + "]";
  }

  @Override
  public String visitSlice(Expr.Slice e) {
    StringBuilder sb = new StringBuilder();
    if (e.lower != null) {
      sb.append(lower(e.lower));
    }
    sb.append(':');
    if (e.upper != null) {
      sb.append(lower(e.upper));
    }
    if (e.hasStep) {
      sb.append(':');
      if (e.step != null) {
        sb.append(lower(e.step));
      }
    }
    return sb.toString();
  }

  @Override
  public String visitStarred(Expr.Starred e) {
    return "*" + lowerOperand(e.value);
  }

  @Override
  public String visitYield(Expr.Yield e) {
    if (e.from) {
      ctx.requireAvailable(ConstructKind.YIELD_FROM, e, "'yield from'");
      return "yield from " + lower(e.value);
    }
    return e.value == null ? "yield" : "yield " + lower(e.value);
  }

  @Override
  public String visitPipe(Expr.Pipe e) {
    String shim;
    switch (e.op) {
      case "|>":
        shim = Shims.PIPE;
        break;
      case "|*>":
        shim = Shims.STAR_PIPE;
        break;
      case "<|":
        shim = Shims.BACK_PIPE;
        break;
      default:
        throw new AssertionError(e.op);
    }
    return ctx.shim(shim) + "(" + lowerOperand(e.left) + ", " + lowerOperand(e.right) + ")";
  }

  @Override
  public String visitCompose(Expr.Compose e) {
    String shim = ctx.shim(e.forward ? Shims.FORWARD_COMPOSE : Shims.COMPOSE);
    return shim + "(" + join(e.functions) + ")";
  }

  @Override
  public String visitChain(Expr.Chain e) {
    List<String> thunks = new ArrayList<>();
    for (Expr iterable : e.iterables) {
      thunks.add(thunk(iterable));
    }
    return ctx.shim(Shims.CHAIN) + "(" + COMMA.join(thunks) + ")";
  }

  @Override
  public String visitPartial(Expr.Partial e) {
    String func = lowerOperand(e.func);
    List<String> positional = new ArrayList<>();
    List<String> keywords = new ArrayList<>();
    for (Arg a : e.args) {
      switch (a.kind) {
        case POSITIONAL:
        case HOLE:
          if (!keywords.isEmpty()) {
            throw LoweringError.at(a, "positional argument follows keyword argument");
          }
          positional.add(a.kind == Arg.Kind.HOLE ? ctx.shim(Shims.HOLE) : lower(a.value));
          break;
        case KEYWORD:
          keywords.add("\"" + a.name + "\": " + lower(a.value));
          break;
        case STAR:
        case DOUBLE_STAR:
          throw LoweringError.at(a, "argument unpacking is not allowed in a partial application");
      }
    }
    return partial(func, positional, keywords);
  }

  private String partial(String func, List<String> positional, List<String> keywords) {
    return ctx.shim(Shims.PARTIAL)
        + "("
        + func
        + ", "
        + tuple(positional)
        + ", {"
        + COMMA.join(keywords)
        + "})";
  }

  private static String tuple(List<String> items) {
    return "(" + COMMA.join(items) + (items.size() == 1 ? ",)" : ")");
  }

  @Override
  public String visitOperatorFunction(Expr.OperatorFunction e) {
    return operatorFunction(e.op);
  }

  /** The function value for an operator, e.g. {@code _drupe_operator.add} for {@code +}. */
  private String operatorFunction(String op) {
    String name = OPERATOR_MODULE.get(op);
    if (name != null) {
      return ctx.shim(Shims.OPERATOR) + "." + name;
    }
    String lambda = OPERATOR_LAMBDAS.get(op);
    if (lambda != null) {
      return lambda;
    }
    switch (op) {
      case "|>":
        return ctx.shim(Shims.PIPE);
      case "|*>":
        return ctx.shim(Shims.STAR_PIPE);
      case "<|":
        return ctx.shim(Shims.BACK_PIPE);
      case "..":
        return ctx.shim(Shims.COMPOSE);
      case "..>":
        return ctx.shim(Shims.FORWARD_COMPOSE);
      case "::":
        return "(lambda a, b: " + ctx.shim(Shims.CHAIN) + "(lambda: a, lambda: b))";
      default:
        throw new AssertionError(op);
    }
  }

  @Override
  public String visitSection(Expr.Section e) {
    String func = operatorFunction(e.op);
    String hole = ctx.shim(Shims.HOLE);
    List<String> positional =
        (e.left != null)
            ? ImmutableList.of(lowerOperand(e.left), hole)
            : ImmutableList.of(hole, lowerOperand(e.right));
    return partial(func, positional, ImmutableList.of());
  }

  @Override
  public String visitImplicitPartial(Expr.ImplicitPartial e) {
    String operator = ctx.shim(Shims.OPERATOR);
    switch (e.kind) {
      case ATTRIBUTE:
        return operator + ".attrgetter(\"" + e.name + "\")";
      case METHOD:
        String args = args(e.args);
        return operator
            + ".methodcaller(\""
            + e.name
            + "\""
            + (args.isEmpty() ? "" : ", " + args)
            + ")";
      case ITEM:
        return operator + ".itemgetter(" + lowerOperand(e.index) + ")";
    }
    throw new AssertionError(e.kind);
  }

  @Override
  public String visitLazySequence(Expr.LazySequence e) {
    switch (e.kind) {
      case FINITE:
        List<String> thunks = new ArrayList<>();
        for (Expr element : e.elements) {
          if (element instanceof Expr.Starred) {
            throw LoweringError.at(element, "unpacking is not allowed in a lazy sequence");
          }
          thunks.add(thunk(element));
        }
        return ctx.shim(Shims.LAZY_LIST) + "(" + COMMA.join(thunks) + ")";
      case SINGLE_PASS:
      case MEMOIZING:
        String generator = "(" + lower(e.elements.get(0)) + clauses(e.clauses) + ")";
        String shim =
            e.kind == Expr.LazySequence.Kind.SINGLE_PASS ? Shims.LAZY_ITER : Shims.LAZY_MEMO;
        return ctx.shim(shim) + "(lambda: " + generator + ")";
    }
    throw new AssertionError(e.kind);
  }
}
