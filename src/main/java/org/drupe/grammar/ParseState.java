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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.drupe.compiler.ParseError;
import org.drupe.syntax.Token;
import org.drupe.syntax.TokenKind;
import org.jspecify.annotations.Nullable;

/**
 * The mutable state of one parse: the token list, the packrat table mapping (rule, position) to
 * the rule's result at that position, and the deepest failure seen so far.
 *
 * <p>Rules themselves are immutable and may be shared by any number of threads; a ParseState
 * belongs to a single parse and is discarded when it completes.
 */
public final class ParseState {

  /** The most expectations listed in a ParseError message. */
  private static final int MAX_EXPECTED = 6;

  /** Stored in the packrat table to record that a rule failed at a position. */
  private static final Object NO_MATCH = new Object();

  final ImmutableList<Token> tokens;

  private final Map<Long, Object> memo = new HashMap<>();

  /** The position of the deepest failure so far, or -1 if nothing has failed. */
  private int farthest = -1;

  /** Descriptions of the tokens that would have allowed progress at {@link #farthest}. */
  private final Set<String> expected = new LinkedHashSet<>();

  /** Greater than zero while evaluating a negative lookahead; failures there are not reported. */
  private int quiet;

  /**
   * The start of the innermost positive lookahead, or -1 outside one. Failures at or before it are
   * not reported; deeper failures are, since they may be the real error.
   */
  private int lookaheadStart = -1;

  /** The furthest position at which a memoized rule has been applied. */
  private int reached;

  private int memoHits;
  private int memoMisses;

  public ParseState(ImmutableList<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).kind == TokenKind.EOF,
        "token stream must end with EOF");
    this.tokens = tokens;
  }

  /**
   * Parses the complete token list with the given rule, which is expected to consume the EOF
   * token. Throws a ParseError at the deepest failure if it doesn't match.
   */
  public static <T> T parseAll(Rule<T> rule, ImmutableList<Token> tokens) {
    return new ParseState(tokens).parseAll(rule);
  }

  /** As {@link #parseAll(Rule, ImmutableList)}, using this state. */
  public <T> T parseAll(Rule<T> rule) {
    Match<T> match = rule.apply(this, 0);
    if (match == null || match.end != tokens.size()) {
      throw error();
    }
    return match.value;
  }

  /** Returns the token at the given position; positions past the end return the EOF token. */
  public Token token(int pos) {
    return tokens.get(Math.min(pos, tokens.size() - 1));
  }

  public int size() {
    return tokens.size();
  }

  /** Records that a terminal expecting {@code description} failed at {@code pos}. */
  void fail(int pos, String description) {
    if (quiet > 0 || pos <= lookaheadStart) {
      return;
    }
    if (pos > farthest) {
      farthest = pos;
      expected.clear();
    }
    if (pos == farthest) {
      expected.add(description);
    }
  }

  void enterQuiet() {
    quiet++;
  }

  void exitQuiet() {
    quiet--;
  }

  /** Starts a positive lookahead at {@code pos}; returns the value to pass to exitLookahead. */
  int enterLookahead(int pos) {
    int prev = lookaheadStart;
    lookaheadStart = Math.max(prev, pos);
    return prev;
  }

  void exitLookahead(int prev) {
    lookaheadStart = prev;
  }

  /** Returns the memoized result of {@code rule} at {@code pos}, computing it if necessary. */
  @SuppressWarnings("unchecked")
  <T> @Nullable Match<T> memoized(int ruleId, int pos, Rule<T> rule) {
    long key = ((long) ruleId << 32) | pos;
    Object prev = memo.get(key);
    if (prev != null) {
      memoHits++;
      return (prev == NO_MATCH) ? null : (Match<T>) prev;
    }
    memoMisses++;
    reached = Math.max(reached, pos);
    Match<T> result = rule.apply(this, pos);
    memo.put(key, (result == null) ? NO_MATCH : result);
    return result;
  }

  /** The number of memoized rule applications answered from the packrat table. */
  public int memoHits() {
    return memoHits;
  }

  /** The number of memoized rule applications that had to be computed. */
  public int memoMisses() {
    return memoMisses;
  }

  /** The position of the deepest failure, or -1 if no terminal has failed. */
  public int farthestFailure() {
    return farthest;
  }

  /**
   * Returns a ParseError for a parse abandoned because its rules recursed too deeply, positioned
   * at the furthest token a rule was applied to.
   */
  public ParseError nestingError() {
    Token at = token(reached);
    return new ParseError("expression too deeply nested", at.line, at.column);
  }

  /** Returns a ParseError describing the deepest failure. */
  public ParseError error() {
    int pos = Math.max(farthest, 0);
    Token found = token(pos);
    String msg = "invalid syntax";
    if (!expected.isEmpty()) {
      String list =
          expected.stream().limit(MAX_EXPECTED).collect(Collectors.joining(", "))
              + (expected.size() > MAX_EXPECTED ? ", ..." : "");
      msg += String.format(": expected %s%s", expected.size() == 1 ? "" : "one of ", list);
    }
    msg += " (found " + found.describe() + ")";
    return new ParseError(msg, found.line, found.column);
  }
}
