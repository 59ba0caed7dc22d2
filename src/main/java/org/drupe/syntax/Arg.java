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

/** One argument of a call, partial application or implicit method partial. */
public final class Arg extends Node {

  public enum Kind {
    POSITIONAL,
    KEYWORD,
    /** {@code *iterable}. */
    STAR,
    /** {@code **mapping}. */
    DOUBLE_STAR,
    /** {@code ?}, only allowed in a partial application. */
    HOLE
  }

  public final Kind kind;

  /** The keyword, for KEYWORD arguments. */
  public final @Nullable String name;

  /** Null only for HOLE. */
  public final @Nullable Expr value;

  public Arg(Token start, Kind kind, @Nullable String name, @Nullable Expr value) {
    super(start);
    this.kind = kind;
    this.name = name;
    this.value = value;
  }

  public static Arg positional(Expr value) {
    return new Arg(value, Kind.POSITIONAL, null, value);
  }

  private Arg(Node start, Kind kind, @Nullable String name, @Nullable Expr value) {
    super(start.line, start.column);
    this.kind = kind;
    this.name = name;
    this.value = value;
  }

  /** The non-null values of the given args, in order. */
  public static ImmutableList<Expr> values(ImmutableList<Arg> args) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    for (Arg a : args) {
      if (a.value != null) {
        result.add(a.value);
      }
    }
    return result.build();
  }
}
