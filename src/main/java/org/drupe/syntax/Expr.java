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
 * Expression nodes. Each node is immutable and exclusively owned by its parent.
 *
 * <p>The first group of subclasses are ordinary host-language expressions; the rest ({@link Pipe}
 * onwards) are the functional extensions that must be lowered.
 */
public abstract class Expr extends Node {

  Expr(Token start) {
    super(start);
  }

  Expr(Node start) {
    super(start.line, start.column);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** The direct subexpressions of this node, in source order. */
  public abstract ImmutableList<Expr> children();

  /** Implemented by each of the lowering passes that render expressions. */
  public interface Visitor<R> {
    R visitName(Name e);

    R visitNumber(Number e);

    R visitConstant(Constant e);

    R visitStr(Str e);

    R visitParen(Paren e);

    R visitTuple(TupleExpr e);

    R visitList(ListExpr e);

    R visitSet(SetExpr e);

    R visitDict(DictExpr e);

    R visitComprehension(Comprehension e);

    R visitUnary(Unary e);

    R visitNot(Not e);

    R visitBinary(Binary e);

    R visitBoolOp(BoolOp e);

    R visitCompare(Compare e);

    R visitTernary(Ternary e);

    R visitLambda(Lambda e);

    R visitCall(Call e);

    R visitAttribute(Attribute e);

    R visitSubscript(Subscript e);

    R visitSlice(Slice e);

    R visitStarred(Starred e);

    R visitYield(Yield e);

    R visitPipe(Pipe e);

    R visitCompose(Compose e);

    R visitChain(Chain e);

    R visitPartial(Partial e);

    R visitOperatorFunction(OperatorFunction e);

    R visitSection(Section e);

    R visitImplicitPartial(ImplicitPartial e);

    R visitLazySequence(LazySequence e);
  }

  private static ImmutableList<Expr> listOf(Object... parts) {
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

  public static final class Name extends Expr {
    public final String id;

    public Name(Token token) {
      super(token);
      this.id = token.text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitName(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** A numeric literal, kept as written (underscores included). */
  public static final class Number extends Expr {
    public final String text;

    public Number(Token token) {
      super(token);
      this.text = token.text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumber(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** {@code None}, {@code True}, {@code False} or {@code ...}. */
  public static final class Constant extends Expr {
    public final String text;

    public Constant(Token token) {
      super(token);
      this.text = token.text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConstant(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }
  }

  /** One or more adjacent string literal tokens, which are implicitly concatenated. */
  public static final class Str extends Expr {
    public final ImmutableList<Token> parts;

    public Str(ImmutableList<Token> parts) {
      super(parts.get(0));
      this.parts = parts;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStr(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }
  }

  public static final class Paren extends Expr {
    public final Expr inner;

    public Paren(Token open, Expr inner) {
      super(open);
      this.inner = inner;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitParen(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(inner);
    }
  }

  public static final class TupleExpr extends Expr {
    public final ImmutableList<Expr> elements;
    public final boolean parenthesized;

    public TupleExpr(Token start, ImmutableList<Expr> elements, boolean parenthesized) {
      super(start);
      this.elements = elements;
      this.parenthesized = parenthesized;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return elements;
    }
  }

  public static final class ListExpr extends Expr {
    public final ImmutableList<Expr> elements;

    public ListExpr(Token start, ImmutableList<Expr> elements) {
      super(start);
      this.elements = elements;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitList(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return elements;
    }
  }

  public static final class SetExpr extends Expr {
    public final ImmutableList<Expr> elements;

    public SetExpr(Token start, ImmutableList<Expr> elements) {
      super(start);
      this.elements = elements;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSet(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return elements;
    }
  }

  public static final class DictExpr extends Expr {
    public final ImmutableList<Expr> keys;
    public final ImmutableList<Expr> values;

    public DictExpr(Token start, ImmutableList<Expr> keys, ImmutableList<Expr> values) {
      super(start);
      this.keys = keys;
      this.values = values;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDict(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      ImmutableList.Builder<Expr> result = ImmutableList.builder();
      for (int i = 0; i < keys.size(); i++) {
        result.add(keys.get(i), values.get(i));
      }
      return result.build();
    }
  }

  /** One {@code for} or {@code if} clause of a comprehension. */
  public static final class CompClause {
    /** The loop target, or null for an {@code if} clause. */
    public final @Nullable Expr target;

    /** The iterable for a {@code for} clause, or the condition for an {@code if} clause. */
    public final Expr expr;

    public CompClause(@Nullable Expr target, Expr expr) {
      this.target = target;
      this.expr = expr;
    }

    public boolean isFor() {
      return target != null;
    }
  }

  public static final class Comprehension extends Expr {
    public enum Kind {
      LIST,
      SET,
      DICT,
      GENERATOR
    }

    public final Kind kind;

    /** The element, or the key for a dict comprehension. */
    public final Expr element;

    /** The value for a dict comprehension, otherwise null. */
    public final @Nullable Expr value;

    public final ImmutableList<CompClause> clauses;

    public Comprehension(
        Token start,
        Kind kind,
        Expr element,
        @Nullable Expr value,
        ImmutableList<CompClause> clauses) {
      super(start);
      this.kind = kind;
      this.element = element;
      this.value = value;
      this.clauses = clauses;
    }

    private Comprehension(
        Node start,
        Kind kind,
        Expr element,
        @Nullable Expr value,
        ImmutableList<CompClause> clauses) {
      super(start);
      this.kind = kind;
      this.element = element;
      this.value = value;
      this.clauses = clauses;
    }

    /** A generator expression written as the sole argument of a call: {@code sum(x for x in y)}. */
    public static Comprehension bareGenerator(Expr element, ImmutableList<CompClause> clauses) {
      return new Comprehension(element, Kind.GENERATOR, element, null, clauses);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitComprehension(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      List<Object> parts = new ArrayList<>();
      parts.add(element);
      if (value != null) {
        parts.add(value);
      }
      for (CompClause c : clauses) {
        if (c.target != null) {
          parts.add(c.target);
        }
        parts.add(c.expr);
      }
      return listOf(parts.toArray());
    }
  }

  /** Unary {@code -}, {@code +} or {@code ~}. */
  public static final class Unary extends Expr {
    public final String op;
    public final Expr operand;

    public Unary(Token op, Expr operand) {
      super(op);
      this.op = op.text;
      this.operand = operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(operand);
    }
  }

  public static final class Not extends Expr {
    public final Expr operand;

    public Not(Token start, Expr operand) {
      super(start);
      this.operand = operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(operand);
    }
  }

  /** An arithmetic, bitwise, shift or power operation. */
  public static final class Binary extends Expr {
    public final Expr left;
    public final String op;
    public final Expr right;

    public Binary(Expr left, String op, Expr right) {
      super(left);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(left, right);
    }
  }

  /** {@code and} or {@code or}. */
  public static final class BoolOp extends Expr {
    public final String op;
    public final ImmutableList<Expr> operands;

    public BoolOp(String op, ImmutableList<Expr> operands) {
      super(operands.get(0));
      this.op = op;
      this.operands = operands;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoolOp(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return operands;
    }
  }

  /** A (possibly chained) comparison; {@code ops.get(i)} is between operands i and i+1. */
  public static final class Compare extends Expr {
    public final ImmutableList<Expr> operands;
    public final ImmutableList<String> ops;

    public Compare(ImmutableList<Expr> operands, ImmutableList<String> ops) {
      super(operands.get(0));
      this.operands = operands;
      this.ops = ops;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompare(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return operands;
    }
  }

  /** {@code body if condition else orElse}. */
  public static final class Ternary extends Expr {
    public final Expr body;
    public final Expr condition;
    public final Expr orElse;

    public Ternary(Expr body, Expr condition, Expr orElse) {
      super(body);
      this.body = body;
      this.condition = condition;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTernary(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(body, condition, orElse);
    }
  }

  /** {@code lambda x: e} or the arrow form {@code x -> e}. */
  public static final class Lambda extends Expr {
    public final ImmutableList<Param> params;
    public final Expr body;

    /** True for the {@code x -> body} form. */
    public final boolean arrow;

    public Lambda(Token start, ImmutableList<Param> params, Expr body, boolean arrow) {
      super(start);
      this.params = params;
      this.body = body;
      this.arrow = arrow;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLambda(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(Param.defaults(params), body);
    }
  }

  public static final class Call extends Expr {
    public final Expr func;
    public final ImmutableList<Arg> args;

    public Call(Expr func, ImmutableList<Arg> args) {
      super(func);
      this.func = func;
      this.args = args;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(func, Arg.values(args));
    }
  }

  public static final class Attribute extends Expr {
    public final Expr value;
    public final String name;

    public Attribute(Expr value, String name) {
      super(value);
      this.value = value;
      this.name = name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAttribute(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(value);
    }
  }

  /** {@code value[i]}; a subscript with several comma-separated items is a tuple index. */
  public static final class Subscript extends Expr {
    public final Expr value;
    public final ImmutableList<Expr> indices;
    public final boolean tuple;

    public Subscript(Expr value, ImmutableList<Expr> indices, boolean tuple) {
      super(value);
      this.value = value;
      this.indices = indices;
      this.tuple = tuple;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSubscript(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(value, indices);
    }
  }

  /** A slice inside a subscript; any part may be omitted. */
  public static final class Slice extends Expr {
    public final @Nullable Expr lower;
    public final @Nullable Expr upper;
    public final @Nullable Expr step;

    /** True if the slice had a second colon (even with no step after it). */
    public final boolean hasStep;

    public Slice(
        Token start,
        @Nullable Expr lower,
        @Nullable Expr upper,
        @Nullable Expr step,
        boolean hasStep) {
      super(start);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
      this.hasStep = hasStep;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSlice(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(lower, upper, step);
    }
  }

  /** {@code *value}, only valid as an assignment target or loop target. */
  public static final class Starred extends Expr {
    public final Expr value;

    public Starred(Token start, Expr value) {
      super(start);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStarred(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(value);
    }
  }

  /** {@code yield}, {@code yield x} or {@code yield from x}. */
  public static final class Yield extends Expr {
    public final @Nullable Expr value;
    public final boolean from;

    public Yield(Token start, @Nullable Expr value, boolean from) {
      super(start);
      this.value = value;
      this.from = from;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitYield(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(value);
    }
  }

  /** {@code x |> f}, {@code xs |*> f} or {@code f <| x}. */
  public static final class Pipe extends Expr {
    public final Expr left;
    public final String op;
    public final Expr right;

    public Pipe(Expr left, String op, Expr right) {
      super(left);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPipe(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(left, right);
    }
  }

  /**
   * {@code f .. g .. h} (apply h first) or, if {@code forward}, {@code f ..> g ..> h} (apply f
   * first). Functions are kept in source order.
   */
  public static final class Compose extends Expr {
    public final ImmutableList<Expr> functions;
    public final boolean forward;

    public Compose(ImmutableList<Expr> functions, boolean forward) {
      super(functions.get(0));
      this.functions = functions;
      this.forward = forward;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompose(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return functions;
    }
  }

  /** {@code a :: b :: c}, lazily chaining iterables. */
  public static final class Chain extends Expr {
    public final ImmutableList<Expr> iterables;

    public Chain(ImmutableList<Expr> iterables) {
      super(iterables.get(0));
      this.iterables = iterables;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitChain(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return iterables;
    }
  }

  /** {@code f$(a, ?, k=v)}. */
  public static final class Partial extends Expr {
    public final Expr func;

    /** Positional and keyword args; a positional arg with a null value is a {@code ?} hole. */
    public final ImmutableList<Arg> args;

    public Partial(Expr func, ImmutableList<Arg> args) {
      super(func);
      this.func = func;
      this.args = args;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPartial(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(func, Arg.values(args));
    }
  }

  /** An operator in parentheses, used as a function: {@code (+)}, {@code (|>)}, etc. */
  public static final class OperatorFunction extends Expr {
    public final String op;

    public OperatorFunction(Token start, String op) {
      super(start);
      this.op = op;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOperatorFunction(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }
  }

  /**
   * An operator section: {@code (x op)} supplies the left operand ({@code right} is null) and
   * {@code (op x)} the right one ({@code left} is null).
   */
  public static final class Section extends Expr {
    public final String op;
    public final @Nullable Expr left;
    public final @Nullable Expr right;

    public Section(Token start, String op, @Nullable Expr left, @Nullable Expr right) {
      super(start);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSection(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(left, right);
    }
  }

  /** {@code .name}, {@code .name(args)} or {@code .[index]}. */
  public static final class ImplicitPartial extends Expr {
    public enum Kind {
      ATTRIBUTE,
      METHOD,
      ITEM
    }

    public final Kind kind;
    public final @Nullable String name;
    public final ImmutableList<Arg> args;
    public final @Nullable Expr index;

    public ImplicitPartial(
        Token start,
        Kind kind,
        @Nullable String name,
        ImmutableList<Arg> args,
        @Nullable Expr index) {
      super(start);
      this.kind = kind;
      this.name = name;
      this.args = args;
      this.index = index;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImplicitPartial(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      return listOf(Arg.values(args), index);
    }
  }

  /**
   * A lazy sequence literal. A FINITE literal lists its elements; the other kinds have a single
   * element expression and comprehension clauses.
   */
  public static final class LazySequence extends Expr {
    public enum Kind {
      /** {@code (| a, b |)}: restartable, each element evaluated at most once. */
      FINITE,
      /** {@code (| e for x in xs |)}: single-pass. */
      SINGLE_PASS,
      /** {@code (| memo e for x in xs |)}: restartable, memoizing. */
      MEMOIZING
    }

    public final Kind kind;
    public final ImmutableList<Expr> elements;
    public final ImmutableList<CompClause> clauses;

    public LazySequence(
        Token start, Kind kind, ImmutableList<Expr> elements, ImmutableList<CompClause> clauses) {
      super(start);
      this.kind = kind;
      this.elements = elements;
      this.clauses = clauses;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLazySequence(this);
    }

    @Override
    public ImmutableList<Expr> children() {
      List<Object> parts = new ArrayList<>(elements);
      for (CompClause c : clauses) {
        if (c.target != null) {
          parts.add(c.target);
        }
        parts.add(c.expr);
      }
      return listOf(parts.toArray());
    }
  }
}
