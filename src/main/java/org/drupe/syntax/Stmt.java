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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Statement nodes. A block is an {@code ImmutableList<Stmt>}; compound statements own their
 * blocks.
 */
public abstract class Stmt extends Node {

  Stmt(Token start) {
    super(start);
  }

  Stmt(Node start) {
    super(start.line, start.column);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** The expressions directly owned by this statement (not those in nested blocks). */
  public abstract ImmutableList<Expr> expressions();

  /** The nested blocks of this statement, in source order. */
  public ImmutableList<ImmutableList<Stmt>> blocks() {
    return ImmutableList.of();
  }

  public interface Visitor<R> {
    R visitExprStmt(ExprStmt s);

    R visitAssign(Assign s);

    R visitAugAssign(AugAssign s);

    R visitAnnAssign(AnnAssign s);

    R visitKeyword(Keyword s);

    R visitReturn(Return s);

    R visitRaise(Raise s);

    R visitScope(Scope s);

    R visitImport(Import s);

    R visitFromImport(FromImport s);

    R visitAssert(Assert s);

    R visitDel(Del s);

    R visitIf(If s);

    R visitWhile(While s);

    R visitFor(For s);

    R visitTry(Try s);

    R visitWith(With s);

    R visitFunctionDef(FunctionDef s);

    R visitMatchFunctionDef(MatchFunctionDef s);

    R visitClassDef(ClassDef s);

    R visitDataDef(DataDef s);

    R visitMatch(Match s);
  }

  private static ImmutableList<Expr> exprs(Object... parts) {
    List<Expr> result = new ArrayList<>();
    for (Object part : parts) {
      if (part instanceof Expr) {
        result.add((Expr) part);
      } else if (part instanceof List<?>) {
        for (Object o : (List<?>) part) {
          if (o instanceof Expr) {
            result.add((Expr) o);
          }
        }
      }
    }
    return ImmutableList.copyOf(result);
  }

  private static ImmutableList<ImmutableList<Stmt>> blocksOf(List<ImmutableList<Stmt>> blocks) {
    ImmutableList.Builder<ImmutableList<Stmt>> result = ImmutableList.builder();
    for (ImmutableList<Stmt> b : blocks) {
      if (b != null) {
        result.add(b);
      }
    }
    return result.build();
  }

  public static final class ExprStmt extends Stmt {
    public final Expr expr;

    public ExprStmt(Expr expr) {
      super(expr);
      this.expr = expr;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExprStmt(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(expr);
    }
  }

  /** {@code t1 = t2 = value}. */
  public static final class Assign extends Stmt {
    public final ImmutableList<Expr> targets;
    public final Expr value;

    public Assign(ImmutableList<Expr> targets, Expr value) {
      super(targets.get(0));
      this.targets = targets;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(targets, value);
    }
  }

  public static final class AugAssign extends Stmt {
    public final Expr target;

    /** The operator including its trailing {@code =}, e.g. {@code "+="}. */
    public final String op;

    public final Expr value;

    public AugAssign(Expr target, String op, Expr value) {
      super(target);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAugAssign(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(target, value);
    }
  }

  /** {@code target: annotation [= value]}. */
  public static final class AnnAssign extends Stmt {
    public final Expr target;
    public final Expr annotation;
    public final @Nullable Expr value;

    public AnnAssign(Expr target, Expr annotation, @Nullable Expr value) {
      super(target);
      this.target = target;
      this.annotation = annotation;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAnnAssign(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(target, annotation, value);
    }
  }

  /** {@code pass}, {@code break} or {@code continue}. */
  public static final class Keyword extends Stmt {
    public final String word;

    public Keyword(Token token) {
      super(token);
      this.word = token.text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitKeyword(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }
  }

  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    public Return(Token start, @Nullable Expr value) {
      super(start);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(value);
    }
  }

  /** {@code raise [exception [from cause]]}. */
  public static final class Raise extends Stmt {
    public final @Nullable Expr exception;
    public final @Nullable Expr cause;

    public Raise(Token start, @Nullable Expr exception, @Nullable Expr cause) {
      super(start);
      this.exception = exception;
      this.cause = cause;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRaise(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(exception, cause);
    }
  }

  /** {@code global} or {@code nonlocal}. */
  public static final class Scope extends Stmt {
    public final String keyword;
    public final ImmutableList<String> names;

    public Scope(Token start, ImmutableList<String> names) {
      super(start);
      this.keyword = start.text;
      this.names = names;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitScope(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }
  }

  /** One {@code name [as alias]} of an import statement; name may be dotted. */
  public static final class Alias {
    public final String name;
    public final @Nullable String asName;

    public Alias(String name, @Nullable String asName) {
      this.name = name;
      this.asName = asName;
    }

    @Override
    public String toString() {
      return (asName == null) ? name : name + " as " + asName;
    }
  }

  public static final class Import extends Stmt {
    public final ImmutableList<Alias> names;

    public Import(Token start, ImmutableList<Alias> names) {
      super(start);
      this.names = names;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImport(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }
  }

  /** {@code from module import names}; names is empty for {@code import *}. */
  public static final class FromImport extends Stmt {
    /** The module, including any leading dots. */
    public final String module;

    public final ImmutableList<Alias> names;

    public FromImport(Token start, String module, ImmutableList<Alias> names) {
      super(start);
      this.module = module;
      this.names = names;
    }

    public boolean isStar() {
      return names.isEmpty();
    }

    public boolean isFuture() {
      return module.equals("__future__");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFromImport(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of();
    }
  }

  public static final class Assert extends Stmt {
    public final Expr test;
    public final @Nullable Expr message;

    public Assert(Token start, Expr test, @Nullable Expr message) {
      super(start);
      this.test = test;
      this.message = message;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssert(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(test, message);
    }
  }

  public static final class Del extends Stmt {
    public final ImmutableList<Expr> targets;

    public Del(Token start, ImmutableList<Expr> targets) {
      super(start);
      this.targets = targets;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDel(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return targets;
    }
  }

  /** {@code if}, with any number of {@code elif}s folded into parallel lists. */
  public static final class If extends Stmt {
    public final ImmutableList<Expr> conditions;
    public final ImmutableList<ImmutableList<Stmt>> bodies;
    public final @Nullable ImmutableList<Stmt> orElse;

    public If(
        Token start,
        ImmutableList<Expr> conditions,
        ImmutableList<ImmutableList<Stmt>> bodies,
        @Nullable ImmutableList<Stmt> orElse) {
      super(start);
      this.conditions = conditions;
      this.bodies = bodies;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return conditions;
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      List<ImmutableList<Stmt>> result = new ArrayList<>(bodies);
      result.add(orElse);
      return blocksOf(result);
    }
  }

  public static final class While extends Stmt {
    public final Expr condition;
    public final ImmutableList<Stmt> body;
    public final @Nullable ImmutableList<Stmt> orElse;

    public While(
        Token start,
        Expr condition,
        ImmutableList<Stmt> body,
        @Nullable ImmutableList<Stmt> orElse) {
      super(start);
      this.condition = condition;
      this.body = body;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(condition);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      List<ImmutableList<Stmt>> result = new ArrayList<>();
      result.add(body);
      result.add(orElse);
      return blocksOf(result);
    }
  }

  public static final class For extends Stmt {
    public final Expr target;
    public final Expr iterable;
    public final ImmutableList<Stmt> body;
    public final @Nullable ImmutableList<Stmt> orElse;

    public For(
        Token start,
        Expr target,
        Expr iterable,
        ImmutableList<Stmt> body,
        @Nullable ImmutableList<Stmt> orElse) {
      super(start);
      this.target = target;
      this.iterable = iterable;
      this.body = body;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return ImmutableList.of(target, iterable);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      List<ImmutableList<Stmt>> result = new ArrayList<>();
      result.add(body);
      result.add(orElse);
      return blocksOf(result);
    }
  }

  /** One {@code except [type [as name]]:} clause. */
  public static final class Handler extends Node {
    public final @Nullable Expr type;
    public final @Nullable String name;
    public final ImmutableList<Stmt> body;

    public Handler(
        Token start, @Nullable Expr type, @Nullable String name, ImmutableList<Stmt> body) {
      super(start);
      this.type = type;
      this.name = name;
      this.body = body;
    }
  }

  public static final class Try extends Stmt {
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Handler> handlers;
    public final @Nullable ImmutableList<Stmt> orElse;
    public final @Nullable ImmutableList<Stmt> finalBody;

    public Try(
        Token start,
        ImmutableList<Stmt> body,
        ImmutableList<Handler> handlers,
        @Nullable ImmutableList<Stmt> orElse,
        @Nullable ImmutableList<Stmt> finalBody) {
      super(start);
      this.body = body;
      this.handlers = handlers;
      this.orElse = orElse;
      this.finalBody = finalBody;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTry(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      List<Expr> result = new ArrayList<>();
      for (Handler h : handlers) {
        if (h.type != null) {
          result.add(h.type);
        }
      }
      return ImmutableList.copyOf(result);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      List<ImmutableList<Stmt>> result = new ArrayList<>();
      result.add(body);
      for (Handler h : handlers) {
        result.add(h.body);
      }
      result.add(orElse);
      result.add(finalBody);
      return blocksOf(result);
    }
  }

  /** One {@code expr [as target]} of a with statement. */
  public static final class WithItem {
    public final Expr context;
    public final @Nullable Expr target;

    public WithItem(Expr context, @Nullable Expr target) {
      this.context = context;
      this.target = target;
    }
  }

  public static final class With extends Stmt {
    public final ImmutableList<WithItem> items;
    public final ImmutableList<Stmt> body;

    public With(Token start, ImmutableList<WithItem> items, ImmutableList<Stmt> body) {
      super(start);
      this.items = items;
      this.body = body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWith(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      List<Expr> result = new ArrayList<>();
      for (WithItem item : items) {
        result.add(item.context);
        if (item.target != null) {
          result.add(item.target);
        }
      }
      return ImmutableList.copyOf(result);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      return ImmutableList.of(body);
    }
  }

  /**
   * A function definition. The assignment form {@code def f(x) = e} is represented with a body
   * consisting of a single {@code return e}.
   */
  public static final class FunctionDef extends Stmt {
    public final ImmutableList<Expr> decorators;
    public final String name;
    public final ImmutableList<Param> params;
    public final @Nullable Expr returns;
    public final ImmutableList<Stmt> body;
    public final boolean assignmentForm;

    public FunctionDef(
        Token start,
        ImmutableList<Expr> decorators,
        String name,
        ImmutableList<Param> params,
        @Nullable Expr returns,
        ImmutableList<Stmt> body,
        boolean assignmentForm) {
      super(start);
      this.decorators = decorators;
      this.name = name;
      this.params = params;
      this.returns = returns;
      this.body = body;
      this.assignmentForm = assignmentForm;
    }

    public FunctionDef withDecorators(ImmutableList<Expr> decorators, Token start) {
      return new FunctionDef(start, decorators, name, params, returns, body, assignmentForm);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunctionDef(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(decorators, Param.expressions(params), returns);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      return ImmutableList.of(body);
    }
  }

  /** {@code match def f(patterns)} or {@code addpattern def f(patterns)}. */
  public static final class MatchFunctionDef extends Stmt {
    public final ImmutableList<Expr> decorators;
    public final String name;
    public final ImmutableList<Pattern> patterns;
    public final ImmutableList<Stmt> body;
    public final boolean addPattern;

    public MatchFunctionDef(
        Token start,
        ImmutableList<Expr> decorators,
        String name,
        ImmutableList<Pattern> patterns,
        ImmutableList<Stmt> body,
        boolean addPattern) {
      super(start);
      this.decorators = decorators;
      this.name = name;
      this.patterns = patterns;
      this.body = body;
      this.addPattern = addPattern;
    }

    public MatchFunctionDef withDecorators(ImmutableList<Expr> decorators, Token start) {
      return new MatchFunctionDef(start, decorators, name, patterns, body, addPattern);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMatchFunctionDef(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return decorators;
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      return ImmutableList.of(body);
    }
  }

  public static final class ClassDef extends Stmt {
    public final ImmutableList<Expr> decorators;
    public final String name;

    /** The base class list, or null if the class had no parentheses. */
    public final @Nullable ImmutableList<Arg> bases;

    public final ImmutableList<Stmt> body;

    public ClassDef(
        Token start,
        ImmutableList<Expr> decorators,
        String name,
        @Nullable ImmutableList<Arg> bases,
        ImmutableList<Stmt> body) {
      super(start);
      this.decorators = decorators;
      this.name = name;
      this.bases = bases;
      this.body = body;
    }

    public ClassDef withDecorators(ImmutableList<Expr> decorators, Token start) {
      return new ClassDef(start, decorators, name, bases, body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitClassDef(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(decorators, (bases == null) ? null : Arg.values(bases));
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      return ImmutableList.of(body);
    }
  }

  /** {@code data Name(fields)[: body]}; fields are PLAIN params, possibly with defaults. */
  public static final class DataDef extends Stmt {
    public final ImmutableList<Expr> decorators;
    public final String name;
    public final ImmutableList<Param> fields;
    public final ImmutableList<Stmt> body;

    public DataDef(
        Token start,
        ImmutableList<Expr> decorators,
        String name,
        ImmutableList<Param> fields,
        ImmutableList<Stmt> body) {
      super(start);
      this.decorators = decorators;
      this.name = name;
      this.fields = fields;
      this.body = body;
    }

    public DataDef withDecorators(ImmutableList<Expr> decorators, Token start) {
      return new DataDef(start, decorators, name, fields, body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDataDef(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      return exprs(decorators, Param.expressions(fields));
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      return ImmutableList.of(body);
    }
  }

  /** One {@code case pattern [if guard]:} clause. */
  public static final class Case extends Node {
    public final Pattern pattern;
    public final @Nullable Expr guard;
    public final ImmutableList<Stmt> body;

    public Case(Token start, Pattern pattern, @Nullable Expr guard, ImmutableList<Stmt> body) {
      super(start);
      this.pattern = pattern;
      this.guard = guard;
      this.body = body;
    }
  }

  /** {@code match subject:} with its cases and an optional {@code else:}. */
  public static final class Match extends Stmt {
    public final Expr subject;
    public final ImmutableList<Case> cases;
    public final @Nullable ImmutableList<Stmt> orElse;

    public Match(
        Token start,
        Expr subject,
        ImmutableList<Case> cases,
        @Nullable ImmutableList<Stmt> orElse) {
      super(start);
      this.subject = subject;
      this.cases = cases;
      this.orElse = orElse;
    }

    public boolean hasGuards() {
      return cases.stream().anyMatch(c -> c.guard != null);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMatch(this);
    }

    @Override
    public ImmutableList<Expr> expressions() {
      List<Expr> result = new ArrayList<>();
      result.add(subject);
      for (Case c : cases) {
        if (c.guard != null) {
          result.add(c.guard);
        }
      }
      return ImmutableList.copyOf(result);
    }

    @Override
    public ImmutableList<ImmutableList<Stmt>> blocks() {
      List<ImmutableList<Stmt>> result = new ArrayList<>();
      for (Case c : cases) {
        result.add(c.body);
      }
      result.add(orElse);
      return blocksOf(result);
    }
  }
}
