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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ProfileResolverTest {

  @Test
  public void universalIsNeverNative(@TestParameter ConstructKind kind) {
    assertThat(ProfileResolver.isNative(kind, TargetProfile.UNIVERSAL)).isFalse();
    assertThat(ProfileResolver.resolve(kind, TargetProfile.UNIVERSAL)).isEqualTo(kind.fallback);
  }

  @Test
  public void nativeSupportIsMonotonic(
      @TestParameter ConstructKind kind,
      @TestParameter TargetProfile older,
      @TestParameter TargetProfile newer) {
    if (newer.atLeast(older) && ProfileResolver.isNative(kind, older)) {
      assertWithMessage("%s native on %s but not on %s", kind, older, newer)
          .that(ProfileResolver.isNative(kind, newer))
          .isTrue();
    }
  }

  @Test
  public void alwaysLoweredConstructs(@TestParameter TargetProfile profile) {
    for (ConstructKind kind :
        new ConstructKind[] {
          ConstructKind.PIPELINE,
          ConstructKind.COMPOSITION,
          ConstructKind.PARTIAL_APPLICATION,
          ConstructKind.OPERATOR_FUNCTION,
          ConstructKind.LAZY_SEQUENCE,
          ConstructKind.DATA_CLASS,
          ConstructKind.MATCH_FUNCTION,
          ConstructKind.TAIL_CALL
        }) {
      assertThat(ProfileResolver.resolve(kind, profile)).isEqualTo(LoweringStrategy.LOWERED);
    }
  }

  @Test
  public void specificDecisions() {
    assertThat(ProfileResolver.resolve(ConstructKind.MATCH_STATEMENT, TargetProfile.PY39))
        .isEqualTo(LoweringStrategy.LOWERED);
    assertThat(ProfileResolver.resolve(ConstructKind.MATCH_STATEMENT, TargetProfile.PY310))
        .isEqualTo(LoweringStrategy.NATIVE);
    assertThat(ProfileResolver.resolve(ConstructKind.FORMAT_STRINGS, TargetProfile.PY3))
        .isEqualTo(LoweringStrategy.LOWERED);
    assertThat(ProfileResolver.resolve(ConstructKind.FORMAT_STRINGS, TargetProfile.PY36))
        .isEqualTo(LoweringStrategy.NATIVE);
    assertThat(ProfileResolver.resolve(ConstructKind.DESTRUCTURING, TargetProfile.PY2))
        .isEqualTo(LoweringStrategy.NATIVE);
    assertThat(ProfileResolver.resolve(ConstructKind.STARRED_DESTRUCTURING, TargetProfile.PY2))
        .isEqualTo(LoweringStrategy.LOWERED);
    assertThat(ProfileResolver.resolve(ConstructKind.NONLOCAL, TargetProfile.PY2))
        .isEqualTo(LoweringStrategy.UNAVAILABLE);
    assertThat(ProfileResolver.resolve(ConstructKind.NONLOCAL, TargetProfile.PY3))
        .isEqualTo(LoweringStrategy.NATIVE);
    assertThat(ProfileResolver.resolve(ConstructKind.DECORATORS, TargetProfile.PY36))
        .isEqualTo(LoweringStrategy.LOWERED);
    assertThat(ProfileResolver.resolve(ConstructKind.DECORATORS, TargetProfile.PY39))
        .isEqualTo(LoweringStrategy.NATIVE);
  }

  @Test
  public void profileOrdering() {
    assertThat(TargetProfile.PY310.atLeast(TargetProfile.PY2)).isTrue();
    assertThat(TargetProfile.PY2.atLeast(TargetProfile.PY3)).isFalse();
    assertThat(TargetProfile.UNIVERSAL.atLeast(TargetProfile.PY2)).isFalse();
    assertThat(TargetProfile.PY310.atLeast(TargetProfile.UNIVERSAL)).isFalse();
    assertThat(TargetProfile.UNIVERSAL.atLeast(TargetProfile.UNIVERSAL)).isTrue();
  }

  @Test
  public void profileIds(@TestParameter TargetProfile profile) {
    assertThat(TargetProfile.forId(profile.id)).isSameInstanceAs(profile);
    assertThat(TargetProfile.parse(profile.toString())).isSameInstanceAs(profile);
  }

  @Test
  public void unknownProfileId() {
    assertThat(TargetProfile.forId("3.7")).isNull();
  }
}
