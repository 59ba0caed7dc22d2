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

import org.jspecify.annotations.Nullable;

/**
 * The constructs whose rendering depends on the target profile. Each kind records the oldest
 * profile that supports it natively (null if no profile does) and what happens on older ones.
 */
public enum ConstructKind {
  DESTRUCTURING(TargetProfile.PY2, LoweringStrategy.LOWERED),
  STARRED_DESTRUCTURING(TargetProfile.PY3, LoweringStrategy.LOWERED),
  MATCH_STATEMENT(TargetProfile.PY310, LoweringStrategy.LOWERED),
  ANNOTATIONS(TargetProfile.PY3, LoweringStrategy.LOWERED),
  VARIABLE_ANNOTATIONS(TargetProfile.PY36, LoweringStrategy.LOWERED),
  FORMAT_STRINGS(TargetProfile.PY36, LoweringStrategy.LOWERED),
  NUMERIC_UNDERSCORES(TargetProfile.PY36, LoweringStrategy.LOWERED),
  CLASS_BASES(TargetProfile.PY3, LoweringStrategy.LOWERED),
  DECORATORS(TargetProfile.PY39, LoweringStrategy.LOWERED),
  RAISE_FROM(TargetProfile.PY3, LoweringStrategy.LOWERED),
  FUTURE_IMPORTS(TargetProfile.PY3, LoweringStrategy.LOWERED),
  NONLOCAL(TargetProfile.PY3, LoweringStrategy.UNAVAILABLE),
  KEYWORD_ONLY_PARAMETERS(TargetProfile.PY3, LoweringStrategy.UNAVAILABLE),
  YIELD_FROM(TargetProfile.PY3, LoweringStrategy.UNAVAILABLE),
  PIPELINE(null, LoweringStrategy.LOWERED),
  COMPOSITION(null, LoweringStrategy.LOWERED),
  PARTIAL_APPLICATION(null, LoweringStrategy.LOWERED),
  OPERATOR_FUNCTION(null, LoweringStrategy.LOWERED),
  LAZY_SEQUENCE(null, LoweringStrategy.LOWERED),
  DATA_CLASS(null, LoweringStrategy.LOWERED),
  MATCH_FUNCTION(null, LoweringStrategy.LOWERED),
  TAIL_CALL(null, LoweringStrategy.LOWERED);

  /** The oldest profile with a native equivalent, or null if the construct is always lowered. */
  final @Nullable TargetProfile nativeSince;

  /** The strategy used by profiles older than {@link #nativeSince}. */
  final LoweringStrategy fallback;

  ConstructKind(@Nullable TargetProfile nativeSince, LoweringStrategy fallback) {
    this.nativeSince = nativeSince;
    this.fallback = fallback;
  }
}
