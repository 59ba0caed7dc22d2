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
import org.jspecify.annotations.Nullable;

/**
 * The patterns of {@code case} clauses and pattern-matching function parameters.
 *
 * <p>Value-like parts of a pattern (literals, dotted names, class references and mapping keys) are
 * kept as {@link Expr}s so that they can be rendered like any other expression.
 */
public abstract class Pattern extends Node {

  Pattern(Token start) {
    super(start);
  }

  Pattern(Node start) {
    super(start.line, start.column);
  }

  /** {@code _}, which matches anything and binds nothing. */
  public static final class Wildcard extends Pattern {
    public Wildcard(Token start) {
      super(start);
    }
  }

  /** A bare name, which matches anything and binds it. */
  public static final class Capture extends Pattern {
    public final String name;

    public Capture(Token token) {
      super(token);
      this.name = token.text;
    }
  }

  /**
   * A number, string, negative number, {@code None}, {@code True} or {@code False}. The last three
   * are compared by identity, the rest by equality.
   */
  public static final class Literal extends Pattern {
    public final Expr value;

    public Literal(Expr value) {
      super(value);
      this.value = value;
    }

    public boolean comparedByIdentity() {
      return value instanceof Expr.Constant;
    }
  }

  /** A dotted name such as {@code Color.RED}, compared by equality. */
  public static final class Value extends Pattern {
    public final Expr value;

    public Value(Expr value) {
      super(value);
      this.value = value;
    }
  }

  /** {@code name is Type}: an isinstance test that binds the subject (unless name is null). */
  public static final class TypeTest extends Pattern {
    public final @Nullable String name;
    public final Expr type;

    public TypeTest(Token start, @Nullable String name, Expr type) {
      super(start);
      this.name = name;
      this.type = type;
    }
  }

  /** A keyword sub-pattern of a class pattern. */
  public static final class KeywordPattern {
    public final String name;
    public final Pattern pattern;

    public KeywordPattern(String name, Pattern pattern) {
      this.name = name;
      this.pattern = pattern;
    }
  }

  /** {@code Cls(p1, p2, attr=p3)}. */
  public static final class ClassPattern extends Pattern {
    public final Expr cls;
    public final ImmutableList<Pattern> positional;
    public final ImmutableList<KeywordPattern> keywords;

    public ClassPattern(
        Expr cls, ImmutableList<Pattern> positional, ImmutableList<KeywordPattern> keywords) {
      super(cls);
      this.cls = cls;
      this.positional = positional;
      this.keywords = keywords;
    }
  }

  /** {@code *name} or {@code *_} inside a sequence pattern. */
  public static final class Star extends Pattern {
    /** Null for {@code *_}. */
    public final @Nullable String name;

    public Star(Token start, @Nullable String name) {
      super(start);
      this.name = name;
    }
  }

  /** {@code [p, q, *rest]}, {@code (p, q)} or an unparenthesized {@code p, q}. */
  public static final class Sequence extends Pattern {
    public final ImmutableList<Pattern> elements;

    public Sequence(Token start, ImmutableList<Pattern> elements) {
      super(start);
      this.elements = elements;
    }

    /** The index of the star element, or -1 if there is none. */
    public int starIndex() {
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i) instanceof Star) {
          return i;
        }
      }
      return -1;
    }
  }

  /** {@code {k1: p1, k2: p2, **rest}}. */
  public static final class Mapping extends Pattern {
    public final ImmutableList<Expr> keys;
    public final ImmutableList<Pattern> values;
    public final @Nullable String rest;

    public Mapping(
        Token start,
        ImmutableList<Expr> keys,
        ImmutableList<Pattern> values,
        @Nullable String rest) {
      super(start);
      this.keys = keys;
      this.values = values;
      this.rest = rest;
    }
  }

  /** {@code p1 | p2 | p3}. */
  public static final class Or extends Pattern {
    public final ImmutableList<Pattern> alternatives;

    public Or(ImmutableList<Pattern> alternatives) {
      super(alternatives.get(0));
      this.alternatives = alternatives;
    }
  }

  /** {@code p as name}. */
  public static final class As extends Pattern {
    public final Pattern pattern;
    public final String name;

    public As(Pattern pattern, String name) {
      super(pattern);
      this.pattern = pattern;
      this.name = name;
    }
  }
}
