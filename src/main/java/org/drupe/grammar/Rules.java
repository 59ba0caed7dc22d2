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

package org.drupe.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import org.drupe.syntax.Token;
import org.drupe.syntax.TokenKind;
import org.jspecify.annotations.Nullable;

/**
 * Static factories for {@link Rule}s: terminals, sequences, ordered choice, repetition, lookahead
 * and forward references.
 *
 * <p>Choice is ordered and first-match-wins: {@link #choice} returns the result of the first
 * alternative that matches, even if a later alternative would have matched more (or fewer)
 * tokens. Grammars rely on this to resolve ambiguities, so it must not be "improved" to longest
 * match.
 */
public final class Rules {

  // Statics only
  private Rules() {}

  /** A three-argument semantic action. */
  @FunctionalInterface
  public interface Fn3<A, B, C, R> {
    R apply(A a, B b, C c);
  }

  /** A four-argument semantic action. */
  @FunctionalInterface
  public interface Fn4<A, B, C, D, R> {
    R apply(A a, B b, C c, D d);
  }

  /** A five-argument semantic action. */
  @FunctionalInterface
  public interface Fn5<A, B, C, D, E, R> {
    R apply(A a, B b, C c, D d, E e);
  }

  /** Matches any single token satisfying {@code test}; {@code description} is used in errors. */
  public static Rule<Token> tokenIf(Predicate<Token> test, String description) {
    return new Rule<Token>() {
      @Override
      @Nullable Match<Token> apply(ParseState state, int pos) {
        if (pos < state.size()) {
          Token t = state.tokens.get(pos);
          if (test.test(t)) {
            return new Match<>(t, pos + 1);
          }
        }
        state.fail(pos, description);
        return null;
      }

      @Override
      public String toString() {
        return description;
      }
    };
  }

  /** Matches a single token of the given kind. */
  public static Rule<Token> token(TokenKind kind, String description) {
    return tokenIf(t -> t.kind == kind, description);
  }

  /** Matches the operator or punctuation token with the given text. */
  public static Rule<Token> op(String text) {
    return tokenIf(t -> t.is(TokenKind.OP, text), "'" + text + "'");
  }

  /** Matches a NAME token with exactly the given text. */
  public static Rule<Token> keyword(String text) {
    return tokenIf(t -> t.is(TokenKind.NAME, text), "'" + text + "'");
  }

  /** Matches a NAME token that is not one of the given reserved words. */
  public static Rule<Token> nameExcept(ImmutableSet<String> reserved) {
    return tokenIf(t -> t.kind == TokenKind.NAME && !reserved.contains(t.text), "name");
  }

  /** Matches without consuming anything, returning the given value. */
  public static <T> Rule<T> success(T value) {
    return new Rule<T>() {
      @Override
      Match<T> apply(ParseState state, int pos) {
        return new Match<>(value, pos);
      }
    };
  }

  public static <A, B, R> Rule<R> seq(
      Rule<A> ra, Rule<B> rb, BiFunction<? super A, ? super B, ? extends R> action) {
    return new Rule<R>() {
      @Override
      @Nullable Match<R> apply(ParseState state, int pos) {
        Match<A> a = ra.apply(state, pos);
        if (a == null) {
          return null;
        }
        Match<B> b = rb.apply(state, a.end);
        if (b == null) {
          return null;
        }
        return new Match<>(action.apply(a.value, b.value), b.end);
      }
    };
  }

  public static <A, B, C, R> Rule<R> seq(
      Rule<A> ra,
      Rule<B> rb,
      Rule<C> rc,
      Fn3<? super A, ? super B, ? super C, ? extends R> action) {
    return new Rule<R>() {
      @Override
      @Nullable Match<R> apply(ParseState state, int pos) {
        Match<A> a = ra.apply(state, pos);
        if (a == null) {
          return null;
        }
        Match<B> b = rb.apply(state, a.end);
        if (b == null) {
          return null;
        }
        Match<C> c = rc.apply(state, b.end);
        if (c == null) {
          return null;
        }
        return new Match<>(action.apply(a.value, b.value, c.value), c.end);
      }
    };
  }

  public static <A, B, C, D, R> Rule<R> seq(
      Rule<A> ra,
      Rule<B> rb,
      Rule<C> rc,
      Rule<D> rd,
      Fn4<? super A, ? super B, ? super C, ? super D, ? extends R> action) {
    return new Rule<R>() {
      @Override
      @Nullable Match<R> apply(ParseState state, int pos) {
        Match<A> a = ra.apply(state, pos);
        if (a == null) {
          return null;
        }
        Match<B> b = rb.apply(state, a.end);
        if (b == null) {
          return null;
        }
        Match<C> c = rc.apply(state, b.end);
        if (c == null) {
          return null;
        }
        Match<D> d = rd.apply(state, c.end);
        if (d == null) {
          return null;
        }
        return new Match<>(action.apply(a.value, b.value, c.value, d.value), d.end);
      }
    };
  }

  public static <A, B, C, D, E, R> Rule<R> seq(
      Rule<A> ra,
      Rule<B> rb,
      Rule<C> rc,
      Rule<D> rd,
      Rule<E> re,
      Fn5<? super A, ? super B, ? super C, ? super D, ? super E, ? extends R> action) {
    return new Rule<R>() {
      @Override
      @Nullable Match<R> apply(ParseState state, int pos) {
        Match<A> a = ra.apply(state, pos);
        if (a == null) {
          return null;
        }
        Match<B> b = rb.apply(state, a.end);
        if (b == null) {
          return null;
        }
        Match<C> c = rc.apply(state, b.end);
        if (c == null) {
          return null;
        }
        Match<D> d = rd.apply(state, c.end);
        if (d == null) {
          return null;
        }
        Match<E> e = re.apply(state, d.end);
        if (e == null) {
          return null;
        }
        return new Match<>(action.apply(a.value, b.value, c.value, d.value, e.value), e.end);
      }
    };
  }

  /** Ordered choice: tries each alternative in turn and returns the first match. */
  @SafeVarargs
  public static <T> Rule<T> choice(Rule<? extends T>... alternatives) {
    ImmutableList<Rule<? extends T>> alts = ImmutableList.copyOf(alternatives);
    return new Rule<T>() {
      @Override
      @Nullable Match<T> apply(ParseState state, int pos) {
        for (Rule<? extends T> alt : alts) {
          Match<? extends T> m = alt.apply(state, pos);
          if (m != null) {
            return new Match<>(m.value, m.end);
          }
        }
        return null;
      }
    };
  }

  /** Zero or more repetitions; stops early if an iteration matches without consuming anything. */
  public static <T> Rule<ImmutableList<T>> many(Rule<T> item) {
    return new Rule<ImmutableList<T>>() {
      @Override
      Match<ImmutableList<T>> apply(ParseState state, int pos) {
        ImmutableList.Builder<T> items = ImmutableList.builder();
        while (true) {
          Match<T> m = item.apply(state, pos);
          if (m == null || m.end == pos) {
            break;
          }
          items.add(m.value);
          pos = m.end;
        }
        return new Match<>(items.build(), pos);
      }
    };
  }

  /** One or more repetitions. */
  public static <T> Rule<ImmutableList<T>> many1(Rule<T> item) {
    Rule<ImmutableList<T>> many = many(item);
    return new Rule<ImmutableList<T>>() {
      @Override
      @Nullable Match<ImmutableList<T>> apply(ParseState state, int pos) {
        Match<ImmutableList<T>> m = many.apply(state, pos);
        if (m.value.isEmpty()) {
          // Run the item once more so that its failure is recorded in the expectations.
          item.apply(state, pos);
          return null;
        }
        return m;
      }
    };
  }

  /** Matches {@code item} if possible, or nothing. */
  public static <T> Rule<Optional<T>> optional(Rule<T> item) {
    return new Rule<Optional<T>>() {
      @Override
      Match<Optional<T>> apply(ParseState state, int pos) {
        Match<T> m = item.apply(state, pos);
        return (m == null)
            ? new Match<>(Optional.empty(), pos)
            : new Match<>(Optional.of(m.value), m.end);
      }
    };
  }

  /** True if {@code item} matches at this position, false (without failing) otherwise. */
  public static <T> Rule<Boolean> present(Rule<T> item) {
    return optional(item).map(Optional::isPresent);
  }

  /**
   * One or more {@code item}s separated by {@code separator}, optionally followed by a trailing
   * separator if {@code allowTrailing}.
   */
  public static <T, S> Rule<Separated<T>> sepBy1(
      Rule<T> item, Rule<S> separator, boolean allowTrailing) {
    return new Rule<Separated<T>>() {
      @Override
      @Nullable Match<Separated<T>> apply(ParseState state, int pos) {
        Match<T> first = item.apply(state, pos);
        if (first == null) {
          return null;
        }
        ImmutableList.Builder<T> items = ImmutableList.builder();
        items.add(first.value);
        pos = first.end;
        boolean trailing = false;
        while (true) {
          Match<S> sep = separator.apply(state, pos);
          if (sep == null) {
            break;
          }
          Match<T> next = item.apply(state, sep.end);
          if (next == null) {
            if (allowTrailing) {
              trailing = true;
              pos = sep.end;
            }
            break;
          }
          items.add(next.value);
          pos = next.end;
        }
        return new Match<>(new Separated<>(items.build(), trailing), pos);
      }
    };
  }

  /** Negative lookahead: matches (consuming nothing) only if {@code item} does not match. */
  public static <T> Rule<Boolean> not(Rule<T> item) {
    return new Rule<Boolean>() {
      @Override
      @Nullable Match<Boolean> apply(ParseState state, int pos) {
        state.enterQuiet();
        Match<T> m;
        try {
          m = item.apply(state, pos);
        } finally {
          state.exitQuiet();
        }
        return (m == null) ? new Match<>(true, pos) : null;
      }
    };
  }

  /**
   * Positive lookahead: matches (consuming nothing) only if {@code item} matches. A failure at the
   * starting position is not reported, but one past it counts toward the deepest failure.
   */
  public static <T> Rule<T> lookahead(Rule<T> item) {
    return new Rule<T>() {
      @Override
      @Nullable Match<T> apply(ParseState state, int pos) {
        int saved = state.enterLookahead(pos);
        Match<T> m;
        try {
          m = item.apply(state, pos);
        } finally {
          state.exitLookahead(saved);
        }
        return (m == null) ? null : new Match<>(m.value, pos);
      }
    };
  }

  /**
   * Left-associative operator chain: {@code operand (op operand)*}, combining from the left. An
   * operator that is not followed by an operand is not consumed.
   */
  public static <T, O> Rule<T> chainLeft(
      Rule<T> operand,
      Rule<O> operator,
      Fn3<? super T, ? super O, ? super T, ? extends T> combine) {
    return new Rule<T>() {
      @Override
      @Nullable Match<T> apply(ParseState state, int pos) {
        Match<T> first = operand.apply(state, pos);
        if (first == null) {
          return null;
        }
        T result = first.value;
        pos = first.end;
        while (true) {
          Match<O> op = operator.apply(state, pos);
          if (op == null) {
            break;
          }
          Match<T> right = operand.apply(state, op.end);
          if (right == null) {
            break;
          }
          result = combine.apply(result, op.value, right.value);
          pos = right.end;
        }
        return new Match<>(result, pos);
      }
    };
  }

  /** Returns a new forward reference, which must be {@link Ref#set} before it is applied. */
  public static <T> Ref<T> ref(String name) {
    return new Ref<>(name);
  }

  /** A placeholder for a rule that is defined later, used to build recursive grammars. */
  public static final class Ref<T> extends Rule<T> {
    private final String name;
    private Rule<T> target;

    private Ref(String name) {
      this.name = name;
    }

    /** Defines this reference; may only be called once. */
    public void set(Rule<T> target) {
      Preconditions.checkState(this.target == null, "%s is already defined", name);
      this.target = target;
    }

    @Override
    @Nullable Match<T> apply(ParseState state, int pos) {
      return target.apply(state, pos);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
