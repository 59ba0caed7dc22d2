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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * The dialects of the host language that generated code can target. A profile is fixed for the
 * duration of a compile.
 *
 * <p>Profiles other than {@link #UNIVERSAL} are ordered: each one supports everything the profiles
 * before it support. UNIVERSAL is treated as supporting nothing natively, so that its output runs
 * on every other profile.
 */
public enum TargetProfile {
  UNIVERSAL("universal", "2.7", "3.13"),
  PY2("2", "2.7", "2.7"),
  PY3("3", "3.4", "3.5"),
  PY36("3.6", "3.6", "3.8"),
  PY39("3.9", "3.9", "3.9"),
  PY310("3.10", "3.10", "3.13");

  /** The stable identifier used in options, banners and fingerprints. */
  public final String id;

  /** The oldest host version this profile's output runs on. */
  public final String lowestVersion;

  /** The newest host version before the next profile takes over. */
  public final String highestVersion;

  TargetProfile(String id, String lowestVersion, String highestVersion) {
    this.id = id;
    this.lowestVersion = lowestVersion;
    this.highestVersion = highestVersion;
  }

  /**
   * True if this profile natively supports everything {@code other} does. UNIVERSAL is only
   * comparable with itself.
   */
  public boolean atLeast(TargetProfile other) {
    if (this == UNIVERSAL || other == UNIVERSAL) {
      return this == other;
    }
    return ordinal() >= other.ordinal();
  }

  /** True for the profiles whose output must also run on a Python 2 interpreter. */
  public boolean supportsPython2() {
    return this == UNIVERSAL || this == PY2;
  }

  /** Returns the profile with the given id, or null if there is none. */
  public static @Nullable TargetProfile forId(String id) {
    for (TargetProfile p : values()) {
      if (p.id.equals(id)) {
        return p;
      }
    }
    return null;
  }

  /** Returns the profile with the given id; throws IllegalArgumentException if there is none. */
  public static TargetProfile parse(String id) {
    TargetProfile result = forId(id);
    Preconditions.checkArgument(result != null, "Unknown target profile '%s'", id);
    return result;
  }

  @Override
  public String toString() {
    return id;
  }
}
