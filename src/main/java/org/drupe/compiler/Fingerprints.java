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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Derives the cache key of a compile. Two compiles have the same fingerprint exactly when they
 * have the same compiler version, options and source text, so a cached output can be reused
 * without recompiling.
 */
public final class Fingerprints {
  private static final HashFunction HASH = Hashing.sha256();

  /** The number of hex digits of the fingerprint written to the output's hash line. */
  public static final int PREFIX_LENGTH = 16;

  private Fingerprints() {}

  public static String fingerprint(String source, CompileOptions options) {
    Hasher hasher = HASH.newHasher();
    // Each field is length-prefixed so that adjacent fields can't run together.
    putString(hasher, Compiler.VERSION);
    putString(hasher, options.profile.id);
    hasher.putBoolean(options.strict);
    hasher.putBoolean(options.lineNumbering);
    hasher.putBoolean(options.minifyHeader);
    putString(hasher, source);
    return hasher.hash().toString();
  }

  private static void putString(Hasher hasher, String s) {
    byte[] bytes = s.getBytes(UTF_8);
    hasher.putInt(bytes.length).putBytes(bytes);
  }
}
