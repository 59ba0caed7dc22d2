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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Properties;

/** The settings for one call to {@link Compiler#compile}. Immutable. */
public final class CompileOptions {
  public static final String TARGET_PROPERTY = "drupe.target";
  public static final String STRICT_PROPERTY = "drupe.strict";
  public static final String LINE_NUMBERS_PROPERTY = "drupe.lineNumbers";
  public static final String MINIFY_PROPERTY = "drupe.minify";

  /** Target UNIVERSAL with every flag off. */
  public static final CompileOptions DEFAULT = builder().build();

  public final TargetProfile profile;

  /** If true, any warning fails the compile. */
  public final boolean strict;

  /** If true, body lines get {@code # line N} comments and the output gets a line-map footer. */
  public final boolean lineNumbering;

  /** If true, the header is emitted without banner, comments or blank lines. */
  public final boolean minifyHeader;

  private CompileOptions(Builder builder) {
    this.profile = builder.profile;
    this.strict = builder.strict;
    this.lineNumbering = builder.lineNumbering;
    this.minifyHeader = builder.minifyHeader;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static CompileOptions forProfile(TargetProfile profile) {
    return builder().profile(profile).build();
  }

  /**
   * Reads options from {@code drupe.*} properties (e.g. {@code System.getProperties()}); missing
   * properties keep their defaults.
   *
   * @throws IllegalArgumentException if {@code drupe.target} names no profile
   */
  public static CompileOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String target = properties.getProperty(TARGET_PROPERTY);
    if (target != null) {
      builder.profile(TargetProfile.parse(target.trim()));
    }
    return builder
        .strict(Boolean.parseBoolean(properties.getProperty(STRICT_PROPERTY, "false")))
        .lineNumbering(Boolean.parseBoolean(properties.getProperty(LINE_NUMBERS_PROPERTY, "false")))
        .minifyHeader(Boolean.parseBoolean(properties.getProperty(MINIFY_PROPERTY, "false")))
        .build();
  }

  public Builder toBuilder() {
    return builder()
        .profile(profile)
        .strict(strict)
        .lineNumbering(lineNumbering)
        .minifyHeader(minifyHeader);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CompileOptions o
        && profile == o.profile
        && strict == o.strict
        && lineNumbering == o.lineNumbering
        && minifyHeader == o.minifyHeader;
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  /** The canonical form of these options, as used in log messages. */
  @Override
  public String toString() {
    return String.format(
        "target=%s;strict=%s;lineNumbers=%s;minify=%s",
        profile.id, strict, lineNumbering, minifyHeader);
  }

  public static final class Builder {
    private TargetProfile profile = TargetProfile.UNIVERSAL;
    private boolean strict;
    private boolean lineNumbering;
    private boolean minifyHeader;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder profile(TargetProfile profile) {
      this.profile = profile;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lineNumbering(boolean lineNumbering) {
      this.lineNumbering = lineNumbering;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder minifyHeader(boolean minifyHeader) {
      this.minifyHeader = minifyHeader;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
