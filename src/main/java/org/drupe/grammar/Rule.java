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

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import org.drupe.syntax.Token;
import org.jspecify.annotations.Nullable;

/**
 * A composable matcher over a token stream. Applying a rule at a position either fails (returning
 * null, and consuming nothing) or returns a {@link Match} with the value built by its semantic
 * actions and the position after the matched tokens.
 *
 * <p>Rules are immutable once constructed and their application must be a pure function of the
 * position and token stream; that is what makes it safe for {@link #memo} to cache results in the
 * {@link ParseState}. Semantic actions passed to {@link #map} must not have side effects.
 *
 * <p>Most rules are built with the static methods in {@link Rules}; the instance methods here are
 * conveniences for the common postfix forms.
 */
public abstract class Rule<T> {

  private static final AtomicInteger nextId = new AtomicInteger();

  /** Returns the result of applying this rule at {@code pos}, or null if it doesn't match. */
  abstract @Nullable Match<T> apply(ParseState state, int pos);

  /** Applies this rule at {@code pos}; exposed for tests and for embedding rules in other rules. */
  public final @Nullable Match<T> parse(ParseState state, int pos) {
    return apply(state, pos);
  }

  /** Returns a rule that transforms this rule's value with the given semantic action. */
  public final <U> Rule<U> map(Function<? super T, ? extends U> action) {
    Rule<T> self = this;
    return new Rule<U>() {
      @Override
      @Nullable Match<U> apply(ParseState state, int pos) {
        Match<T> m = self.apply(state, pos);
        return (m == null) ? null : new Match<>(action.apply(m.value), m.end);
      }
    };
  }

  /**
   * Returns a rule that transforms this rule's value with the given semantic action, which also
   * receives the first token of the match (typically to record a source position).
   */
  public final <U> Rule<U> mapWithStart(BiFunction<? super T, Token, ? extends U> action) {
    Rule<T> self = this;
    return new Rule<U>() {
      @Override
      @Nullable Match<U> apply(ParseState state, int pos) {
        Match<T> m = self.apply(state, pos);
        return (m == null) ? null : new Match<>(action.apply(m.value, state.token(pos)), m.end);
      }
    };
  }

  /**
   * Returns a rule that matches only where this rule matches with a value satisfying {@code test}.
   * A rejected value is not recorded as a failure.
   */
  public final Rule<T> filter(Predicate<? super T> test) {
    Rule<T> self = this;
    return new Rule<T>() {
      @Override
      @Nullable Match<T> apply(ParseState state, int pos) {
        Match<T> m = self.apply(state, pos);
        return (m == null || !test.test(m.value)) ? null : m;
      }
    };
  }

  /** Matches this rule followed by {@code next}, keeping only the value of {@code next}. */
  public final <U> Rule<U> then(Rule<U> next) {
    return Rules.seq(this, next, (a, b) -> b);
  }

  /** Matches this rule followed by {@code next}, keeping only the value of this rule. */
  public final <U> Rule<T> skip(Rule<U> next) {
    return Rules.seq(this, next, (a, b) -> a);
  }

  /** Zero or more repetitions of this rule. */
  public final Rule<ImmutableList<T>> many() {
    return Rules.many(this);
  }

  /** One or more repetitions of this rule. */
  public final Rule<ImmutableList<T>> many1() {
    return Rules.many1(this);
  }

  /** This rule or nothing. */
  public final Rule<Optional<T>> optional() {
    return Rules.optional(this);
  }

  /**
   * Returns an equivalent rule whose results are memoized per position in the ParseState. The
   * name is only used by {@link #toString}.
   */
  public final Rule<T> memo(String name) {
    Rule<T> self = this;
    int id = nextId.getAndIncrement();
    return new Rule<T>() {
      @Override
      @Nullable Match<T> apply(ParseState state, int pos) {
        return state.memoized(id, pos, self);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
