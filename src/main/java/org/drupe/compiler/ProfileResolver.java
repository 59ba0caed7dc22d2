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

import com.google.common.collect.ImmutableTable;

/**
 * Decides, for each (construct, profile) pair, whether the construct is passed through natively,
 * lowered, or unavailable. The decisions are computed once into a table; the resolver has no
 * other state.
 */
public final class ProfileResolver {

  private static final ImmutableTable<ConstructKind, TargetProfile, LoweringStrategy> TABLE =
      buildTable();

  // Statics only
  private ProfileResolver() {}

  private static ImmutableTable<ConstructKind, TargetProfile, LoweringStrategy> buildTable() {
    ImmutableTable.Builder<ConstructKind, TargetProfile, LoweringStrategy> builder =
        ImmutableTable.builder();
    for (ConstructKind kind : ConstructKind.values()) {
      for (TargetProfile profile : TargetProfile.values()) {
        boolean isNative = kind.nativeSince != null && profile.atLeast(kind.nativeSince);
        builder.put(kind, profile, isNative ? LoweringStrategy.NATIVE : kind.fallback);
      }
    }
    return builder.buildOrThrow();
  }

  public static LoweringStrategy resolve(ConstructKind kind, TargetProfile profile) {
    return TABLE.get(kind, profile);
  }

  /** True if {@code kind} is passed through natively for {@code profile}. */
  public static boolean isNative(ConstructKind kind, TargetProfile profile) {
    return resolve(kind, profile) == LoweringStrategy.NATIVE;
  }
}
