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
import org.drupe.syntax.Arg;
import org.drupe.syntax.Expr;
import org.drupe.syntax.Param;
import org.drupe.syntax.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * Lowers statements into the context's emitter. A statement that raises a LoweringError is
 * replaced by a comment and the error is recorded, so one bad statement doesn't prevent the rest
 * of the program from being lowered.
 */
final class StatementLowerer implements Stmt.Visitor<Void> {
  private static final Joiner COMMA = Joiner.on(", ");

  private final LoweringContext ctx;
  private final Emitter out;
  private final ExpressionLowerer expressions;
  private final PatternLowerer patterns;

  StatementLowerer(LoweringContext ctx) {
    this.ctx = ctx;
    this.out = ctx.out;
    this.expressions = new ExpressionLowerer(ctx);
    this.patterns = new PatternLowerer(ctx, expressions);
  }

  void lowerModule(List<Stmt> module) {
    statements(module);
  }

  private void statements(List<Stmt> block) {
    for (Stmt s : block) {
      int mark = out.mark();
      int depth = out.depth();
      int frames = ctx.frameDepth();
      int shims = ctx.shimMark();
      try {
        s.accept(this);
      } catch (LoweringError | StackOverflowError e) {
        LoweringError error =
            (e instanceof LoweringError)
                ? (LoweringError) e
                : LoweringError.at(s, "expression too deeply nested");
        out.truncate(mark);
        out.setDepth(depth);
        ctx.popTo(frames);
        ctx.forgetShimsSince(shims);
        ctx.report(error);
        out.comment(s.line, error.kind() + ": " + error.msg);
      }
    }
  }

  /** Emits an indented block, adding {@code pass} if it produced no statements. */
  private void block(List<Stmt> body, int line) {
    out.indent();
    int mark = out.mark();
    statements(body);
    passIfEmpty(mark, line);
    out.dedent();
  }

  private void passIfEmpty(int mark, int line) {
    if (!out.hasCodeSince(mark)) {
      out.line(line, "pass");
    }
  }

  private String x(Expr e) {
    return expressions.lower(e);
  }

  private String operand(Expr e) {
    return expressions.lowerOperand(e);
  }

  private String target(Expr e) {
    return Destructuring.render(e, ctx, expressions);
  }

  @Override
  public Void visitExprStmt(Stmt.ExprStmt s) {
    out.line(s.line, x(s.expr));
    return null;
  }

  @Override
  public Void visitAssign(Stmt.Assign s) {
    boolean lowered = false;
    for (Expr t : s.targets) {
      Destructuring.validate(t);
      lowered |= Destructuring.needsLowering(t, ctx);
    }
    if (!lowered) {
      List<String> parts = new ArrayList<>();
      for (Expr t : s.targets) {
        parts.add(target(t));
      }
      parts.add(x(s.value));
      out.line(s.line, Joiner.on(" = ").join(parts));
    } else if (s.targets.size() == 1) {
      Destructuring.assign(s.targets.get(0), operand(s.value), s.line, ctx, expressions);
    } else {
      String value = ctx.freshName("ref");
      out.line(s.line, value + " = " + x(s.value));
      for (Expr t : s.targets) {
        Destructuring.assign(t, value, s.line, ctx, expressions);
      }
    }
    return null;
  }

  private static boolean isSimpleTarget(Expr e) {
    return e instanceof Expr.Name || e instanceof Expr.Attribute || e instanceof Expr.Subscript;
  }

  @Override
  public Void visitAugAssign(Stmt.AugAssign s) {
    if (!isSimpleTarget(s.target)) {
      throw LoweringError.at(s.target, "illegal expression for augmented assignment");
    }
    out.line(s.line, x(s.target) + " " + s.op + " " + x(s.value));
    return null;
  }

  @Override
  public Void visitAnnAssign(Stmt.AnnAssign s) {
    if (!isSimpleTarget(s.target)) {
      throw LoweringError.at(s.target, "only single targets can be annotated");
    }
    String target = x(s.target);
    String annotation = x(s.annotation);
    if (ctx.isNative(ConstructKind.VARIABLE_ANNOTATIONS)) {
      out.line(
          s.line,
          target + ": " + annotation + (s.value == null ? "" : " = " + x(s.value)));
    } else if (s.value != null) {
      out.line(s.line, target + " = " + x(s.value) + "  # type: " + annotation);
    } else {
      out.comment(s.line, target + ": " + annotation);
    }
    return null;
  }

  @Override
  public Void visitKeyword(Stmt.Keyword s) {
    out.line(s.line, s.word);
    return null;
  }

  @Override
  public Void visitReturn(Stmt.Return s) {
    Stmt.FunctionDef function = ctx.tailCallFunction();
    TailCalls.Call call = (function == null) ? null : TailCalls.match(s.value, function);
    if (call != null) {
      tailCall(function, call, s.line);
    } else {
      out.line(s.line, s.value == null ? "return" : "return " + x(s.value));
    }
    return null;
  }

  /** Rebinds the parameters to the call's arguments and restarts the function's loop. */
  private void tailCall(Stmt.FunctionDef function, TailCalls.Call call, int line) {
    List<String> params = new ArrayList<>();
    for (Param p : function.params) {
      params.add(p.name);
    }
    if (!params.isEmpty()) {
      String[] values = new String[params.size()];
      for (int i = 0; i < call.arguments().size(); i++) {
        String value = operand(call.arguments().get(i));
        if (!call.inOrder()) {
          // Evaluate in source order before reordering.
          String temp = ctx.freshName("arg");
          out.line(line, temp + " = " + value);
          value = temp;
        }
        values[call.parameters().get(i)] = value;
      }
      out.line(line, COMMA.join(params) + " = " + COMMA.join(values));
    }
    out.line(line, "continue");
  }

  @Override
  public Void visitRaise(Stmt.Raise s) {
    if (s.exception == null) {
      out.line(s.line, "raise");
    } else if (s.cause == null) {
      out.line(s.line, "raise " + x(s.exception));
    } else if (ctx.isNative(ConstructKind.RAISE_FROM)) {
      out.line(s.line, "raise " + x(s.exception) + " from " + x(s.cause));
    } else {
      String error = ctx.freshName("err");
      out.line(s.line, error + " = " + x(s.exception));
      out.line(s.line, "if isinstance(" + error + ", type):");
      out.indent();
      out.line(s.line, error + " = " + error + "()");
      out.dedent();
      out.line(s.line, error + ".__cause__ = " + x(s.cause));
      out.line(s.line, error + ".__suppress_context__ = True");
      out.line(s.line, "raise " + error);
    }
    return null;
  }

  @Override
  public Void visitScope(Stmt.Scope s) {
    if (s.keyword.equals("nonlocal")) {
      ctx.requireAvailable(ConstructKind.NONLOCAL, s, "'nonlocal'");
    }
    for (String name : s.names) {
      ctx.checkIdentifier(s, name);
    }
    out.line(s.line, s.keyword + " " + COMMA.join(s.names));
    return null;
  }

  private void checkAliases(Stmt s, List<Stmt.Alias> aliases) {
    for (Stmt.Alias a : aliases) {
      ctx.checkIdentifier(s, a.asName != null ? a.asName : a.name.split("\\.", -1)[0]);
    }
  }

  @Override
  public Void visitImport(Stmt.Import s) {
    checkAliases(s, s.names);
    out.line(s.line, "import " + COMMA.join(s.names));
    return null;
  }

  @Override
  public Void visitFromImport(Stmt.FromImport s) {
    if (s.isFuture()) {
      for (Stmt.Alias a : s.names) {
        ctx.addFutureFeature(a.name);
      }
      ctx.warn(s, "__future__ imports are moved to the header");
      return null;
    }
    checkAliases(s, s.names);
    String names = s.isStar() ? "*" : COMMA.join(s.names);
    out.line(s.line, "from " + s.module + " import " + names);
    return null;
  }

  @Override
  public Void visitAssert(Stmt.Assert s) {
    String message = (s.message == null) ? "" : ", " + x(s.message);
    out.line(s.line, "assert " + x(s.test) + message);
    return null;
  }

  @Override
  public Void visitDel(Stmt.Del s) {
    List<String> targets = new ArrayList<>();
    for (Expr t : s.targets) {
      Destructuring.validate(t);
      targets.add(target(t));
    }
    out.line(s.line, "del " + COMMA.join(targets));
    return null;
  }

  @Override
  public Void visitIf(Stmt.If s) {
    for (int i = 0; i < s.conditions.size(); i++) {
      Expr condition = s.conditions.get(i);
      out.line(condition.line, (i == 0 ? "if " : "elif ") + x(condition) + ":");
      block(s.bodies.get(i), condition.line);
    }
    orElse(s.orElse, s.line);
    return null;
  }

  private void orElse(@Nullable List<Stmt> orElse, int line) {
    if (orElse != null) {
      out.line(line, "else:");
      block(orElse, line);
    }
  }

  @Override
  public Void visitWhile(Stmt.While s) {
    ctx.push(LoweringContext.Enclosing.LOOP);
    out.line(s.line, "while " + x(s.condition) + ":");
    block(s.body, s.line);
    orElse(s.orElse, s.line);
    ctx.pop();
    return null;
  }

  @Override
  public Void visitFor(Stmt.For s) {
    Destructuring.validate(s.target);
    ctx.push(LoweringContext.Enclosing.LOOP);
    String iterable = x(s.iterable);
    if (Destructuring.needsLowering(s.target, ctx)) {
      String item = ctx.freshName("item");
      out.line(s.line, "for " + item + " in " + iterable + ":");
      out.indent();
      Destructuring.assign(s.target, item, s.line, ctx, expressions);
      statements(s.body);
      out.dedent();
    } else {
      out.line(s.line, "for " + target(s.target) + " in " + iterable + ":");
      block(s.body, s.line);
    }
    orElse(s.orElse, s.line);
    ctx.pop();
    return null;
  }

  @Override
  public Void visitTry(Stmt.Try s) {
    ctx.push(LoweringContext.Enclosing.TRY);
    out.line(s.line, "try:");
    block(s.body, s.line);
    for (Stmt.Handler h : s.handlers) {
      StringBuilder header = new StringBuilder("except");
      if (h.type != null) {
        header.append(' ').append(x(h.type));
      }
      if (h.name != null) {
        ctx.checkIdentifier(h, h.name);
        header.append(" as ").append(h.name);
      }
      out.line(h.line, header.append(':').toString());
      block(h.body, h.line);
    }
    orElse(s.orElse, s.line);
    if (s.finalBody != null) {
      out.line(s.line, "finally:");
      block(s.finalBody, s.line);
    }
    ctx.pop();
    return null;
  }

  @Override
  public Void visitWith(Stmt.With s) {
    ctx.push(LoweringContext.Enclosing.WITH);
    List<String> items = new ArrayList<>();
    List<Expr> lowered = new ArrayList<>();
    List<String> loweredValues = new ArrayList<>();
    for (Stmt.WithItem item : s.items) {
      String context = x(item.context);
      if (item.target == null) {
        items.add(context);
        continue;
      }
      Destructuring.validate(item.target);
      if (Destructuring.needsLowering(item.target, ctx)) {
        String value = ctx.freshName("item");
        items.add(context + " as " + value);
        lowered.add(item.target);
        loweredValues.add(value);
      } else {
        items.add(context + " as " + target(item.target));
      }
    }
    out.line(s.line, "with " + COMMA.join(items) + ":");
    out.indent();
    int mark = out.mark();
    for (int i = 0; i < lowered.size(); i++) {
      Destructuring.assign(lowered.get(i), loweredValues.get(i), s.line, ctx, expressions);
    }
    statements(s.body);
    passIfEmpty(mark, s.line);
    out.dedent();
    ctx.pop();
    return null;
  }

  /**
   * Emits decorator lines. Profiles without arbitrary decorator expressions get a temporary for
   * each decorator that isn't a dotted name or a call of one.
   */
  private void decorators(List<Expr> decorators, int line) {
    List<String> lines = new ArrayList<>();
    for (Expr d : decorators) {
      if (ctx.isNative(ConstructKind.DECORATORS) || isDottedCall(d)) {
        lines.add("@" + x(d));
      } else {
        String temp = ctx.freshName("decorator");
        out.line(d.line, temp + " = " + x(d));
        lines.add("@" + temp);
      }
    }
    for (int i = 0; i < lines.size(); i++) {
      out.line(decorators.get(i).line, lines.get(i));
    }
  }

  private static boolean isDotted(Expr e) {
    return e instanceof Expr.Name
        || (e instanceof Expr.Attribute attribute && isDotted(attribute.value));
  }

  private static boolean isDottedCall(Expr e) {
    return isDotted(e) || (e instanceof Expr.Call call && isDotted(call.func));
  }

  @Override
  public Void visitFunctionDef(Stmt.FunctionDef s) {
    ctx.checkIdentifier(s, s.name);
    boolean isMethod = ctx.inClassBody();
    decorators(s.decorators, s.line);
    boolean annotate = ctx.isNative(ConstructKind.ANNOTATIONS);
    String params = expressions.params(s.params, annotate);
    String returns = (annotate && s.returns != null) ? " -> " + x(s.returns) : "";
    out.line(s.line, "def " + s.name + "(" + params + ")" + returns + ":");
    out.indent();
    int mark = out.mark();
    if (!annotate && hasAnnotations(s)) {
      out.comment(s.line, "type: " + typeComment(s));
    }
    boolean rewrite = TailCalls.applies(s, isMethod);
    ctx.pushFunction(s, rewrite);
    if (rewrite) {
      List<Stmt> body = s.body;
      if (isDocstring(body.get(0))) {
        statements(body.subList(0, 1));
        body = body.subList(1, body.size());
      }
      out.line(s.line, "while True:");
      out.indent();
      int loopMark = out.mark();
      statements(body);
      if (body.isEmpty() || !(body.get(body.size() - 1) instanceof Stmt.Return)) {
        out.line(s.line, "return None");
      }
      passIfEmpty(loopMark, s.line);
      out.dedent();
    } else {
      statements(s.body);
    }
    ctx.pop();
    passIfEmpty(mark, s.line);
    out.dedent();
    return null;
  }

  private static boolean isDocstring(Stmt s) {
    return s instanceof Stmt.ExprStmt e
        && e.expr instanceof Expr.Str str
        && !FormatStrings.isFormat(str.parts.get(0));
  }

  private static boolean hasAnnotations(Stmt.FunctionDef s) {
    return s.returns != null || s.params.stream().anyMatch(p -> p.annotation != null);
  }

  /** A function type comment, e.g. {@code (int, str) -> bool}. */
  private String typeComment(Stmt.FunctionDef s) {
    List<String> types = new ArrayList<>();
    for (Param p : s.params) {
      if (p.kind == Param.Kind.BARE_STAR) {
        continue;
      }
      String type = (p.annotation == null) ? "Any" : x(p.annotation);
      String prefix =
          p.kind == Param.Kind.STAR ? "*" : (p.kind == Param.Kind.DOUBLE_STAR ? "**" : "");
      types.add(prefix + type);
    }
    String returns = (s.returns == null) ? "Any" : x(s.returns);
    return "(" + COMMA.join(types) + ") -> " + returns;
  }

  @Override
  public Void visitMatchFunctionDef(Stmt.MatchFunctionDef s) {
    ctx.checkIdentifier(s, s.name);
    String name = s.addPattern ? ctx.freshName("pattern") : s.name;
    decorators(s.decorators, s.line);
    String args = ctx.freshName("match_args");
    PatternLowerer.Lowered lowered = patterns.lowerArguments(s.patterns, args);
    out.line(s.line, "def " + name + "(*" + args + "):");
    out.indent();
    ctx.push(LoweringContext.Enclosing.FUNCTION);
    out.line(s.line, "if not (" + lowered.test() + "):");
    out.indent();
    out.line(s.line, "raise " + matchError("def " + s.name, args));
    out.dedent();
    bindings(lowered, s.line);
    statements(s.body);
    ctx.pop();
    out.dedent();
    if (s.addPattern) {
      out.line(
          s.line, s.name + " = " + ctx.shim(Shims.ADDPATTERN) + "(" + s.name + ", " + name + ")");
    }
    return null;
  }

  private String matchError(String description, String subject) {
    return ctx.shim(Shims.MATCH_ERROR) + "(\"" + description + "\", " + subject + ")";
  }

  private void bindings(PatternLowerer.Lowered lowered, int line) {
    for (PatternLowerer.Binding b : lowered.bindings) {
      out.line(line, b.name() + " = " + b.value());
    }
  }

  @Override
  public Void visitClassDef(Stmt.ClassDef s) {
    ctx.checkIdentifier(s, s.name);
    decorators(s.decorators, s.line);
    String bases;
    if (s.bases == null || s.bases.isEmpty()) {
      if (ctx.isNative(ConstructKind.CLASS_BASES)) {
        bases = (s.bases == null) ? "" : "()";
      } else {
        bases = "(object)";
      }
    } else {
      for (Arg a : s.bases) {
        if (a.kind == Arg.Kind.KEYWORD && !ctx.isNative(ConstructKind.CLASS_BASES)) {
          throw LoweringError.at(
              a, "class keyword arguments are not available for target '%s'", ctx.profile);
        }
      }
      bases = "(" + expressions.args(s.bases) + ")";
    }
    out.line(s.line, "class " + s.name + bases + ":");
    ctx.push(LoweringContext.Enclosing.CLASS);
    block(s.body, s.line);
    ctx.pop();
    return null;
  }

  @Override
  public Void visitDataDef(Stmt.DataDef s) {
    ctx.checkIdentifier(s, s.name);
    List<String> names = new ArrayList<>();
    List<String> quoted = new ArrayList<>();
    boolean defaults = false;
    for (Param field : s.fields) {
      ctx.checkIdentifier(field, field.name);
      names.add(field.name);
      quoted.add("\"" + field.name + "\"");
      defaults |= field.defaultValue != null;
    }
    decorators(s.decorators, s.line);
    String base =
        ctx.shim(Shims.NAMEDTUPLE) + "(\"" + s.name + "\", \"" + Joiner.on(' ').join(names) + "\")";
    out.line(s.line, "class " + s.name + "(" + base + "):");
    out.indent();
    out.line(s.line, "__slots__ = ()");
    out.line(s.line, "__match_args__ = (" + COMMA.join(quoted) + (names.size() == 1 ? ",)" : ")"));
    if (defaults) {
      String cls = ctx.freshName("cls");
      String params = expressions.params(ImmutableList.copyOf(s.fields), false);
      out.line(s.line, "def __new__(" + cls + ", " + params + "):");
      out.indent();
      String values = COMMA.join(names) + (names.size() == 1 ? "," : "");
      out.line(s.line, "return tuple.__new__(" + cls + ", (" + values + "))");
      out.dedent();
    }
    ctx.push(LoweringContext.Enclosing.CLASS);
    statements(s.body);
    ctx.pop();
    out.dedent();
    return null;
  }

  @Override
  public Void visitMatch(Stmt.Match s) {
    String subject = ctx.freshName("match");
    out.line(s.line, subject + " = " + x(s.subject));
    boolean nativeForm = ctx.isNative(ConstructKind.MATCH_STATEMENT);
    for (int i = 0; i < s.cases.size(); i++) {
      Stmt.Case c = s.cases.get(i);
      nativeForm &= PatternLowerer.nativeExpressible(c.pattern);
      // A native match rejects an irrefutable case that isn't last.
      if (i < s.cases.size() - 1 && c.guard == null && PatternLowerer.irrefutable(c.pattern)) {
        nativeForm = false;
      }
    }
    // Lowering also validates the patterns, so it happens even if the native form is used.
    int shims = ctx.shimMark();
    List<PatternLowerer.Lowered> lowered = new ArrayList<>();
    for (Stmt.Case c : s.cases) {
      lowered.add(patterns.lower(c.pattern, subject));
    }
    ctx.push(LoweringContext.Enclosing.MATCH);
    if (nativeForm) {
      ctx.forgetShimsSince(shims);
      nativeMatch(s, subject);
    } else if (!s.hasGuards()) {
      for (int i = 0; i < s.cases.size(); i++) {
        Stmt.Case c = s.cases.get(i);
        out.line(c.line, (i == 0 ? "if " : "elif ") + lowered.get(i).test() + ":");
        caseBody(c, lowered.get(i), null);
      }
      out.line(s.line, "else:");
      noMatch(s, subject);
    } else {
      String matched = ctx.freshName("matched");
      out.line(s.line, matched + " = False");
      for (int i = 0; i < s.cases.size(); i++) {
        Stmt.Case c = s.cases.get(i);
        PatternLowerer.Lowered l = lowered.get(i);
        String test;
        if (i == 0) {
          test = l.test();
        } else {
          test = "not " + matched + (l.conditions.isEmpty() ? "" : " and " + l.test());
        }
        out.line(c.line, "if " + test + ":");
        caseBody(c, l, matched);
      }
      out.line(s.line, "if not " + matched + ":");
      noMatch(s, subject);
    }
    ctx.pop();
    return null;
  }

  /**
   * Emits a case's bindings and body. With a flag, the flag is set (after the guard, if any)
   * before the body runs.
   */
  private void caseBody(Stmt.Case c, PatternLowerer.Lowered lowered, @Nullable String matched) {
    out.indent();
    bindings(lowered, c.line);
    if (matched == null) {
      int mark = out.mark();
      statements(c.body);
      passIfEmpty(mark, c.line);
    } else if (c.guard != null) {
      out.line(c.guard.line, "if " + x(c.guard) + ":");
      out.indent();
      out.line(c.line, matched + " = True");
      statements(c.body);
      out.dedent();
    } else {
      out.line(c.line, matched + " = True");
      statements(c.body);
    }
    out.dedent();
  }

  /** Emits the block that runs when no case matched: the else block, or a MatchError. */
  private void noMatch(Stmt.Match s, String subject) {
    if (s.orElse != null) {
      block(s.orElse, s.line);
    } else {
      out.indent();
      out.line(s.line, "raise " + matchError("match at line " + s.line, subject));
      out.dedent();
    }
  }

  private void nativeMatch(Stmt.Match s, String subject) {
    out.line(s.line, "match " + subject + ":");
    out.indent();
    for (Stmt.Case c : s.cases) {
      String guard = (c.guard == null) ? "" : " if " + x(c.guard);
      out.line(c.line, "case " + patterns.renderNative(c.pattern) + guard + ":");
      block(c.body, c.line);
    }
    Stmt.Case last = s.cases.get(s.cases.size() - 1);
    if (last.guard != null || !PatternLowerer.irrefutable(last.pattern)) {
      out.line(s.line, "case _:");
      noMatch(s, subject);
    }
    out.dedent();
  }
}
