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

/** One parameter of a def or lambda. */
public final class Param extends Node {

  public enum Kind {
    /** {@code x}, {@code x=default} or {@code x: T = default}. */
    PLAIN,
    /** {@code *args}. */
    STAR,
    /** A bare {@code *}, which makes the following parameters keyword-only. */
    BARE_STAR,
    /** {@code **kwargs}. */
    DOUBLE_STAR
  }

  public final Kind kind;

  /** Null only for BARE_STAR. */
  public final @Nullable String name;

  public final @Nullable Expr annotation;
  public final @Nullable Expr defaultValue;

  public Param(
      Token start,
      Kind kind,
      @Nullable String name,
      @Nullable Expr annotation,
      @Nullable Expr defaultValue) {
    super(start);
    this.kind = kind;
    this.name = name;
    this.annotation = annotation;
    this.defaultValue = defaultValue;
  }

  /** The default value expressions of the given parameters, in order. */
  public static ImmutableList<Expr> defaults(ImmutableList<Param> params) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    for (Param p : params) {
      if (p.defaultValue != null) {
        result.add(p.defaultValue);
      }
    }
    return result.build();
  }

  /** The annotations and default values of the given parameters, in order. */
  public static ImmutableList<Expr> expressions(ImmutableList<Param> params) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    for (Param p : params) {
      if (p.annotation != null) {
        result.add(p.annotation);
      }
      if (p.defaultValue != null) {
        result.add(p.defaultValue);
      }
    }
    return result.build();
  }
}
