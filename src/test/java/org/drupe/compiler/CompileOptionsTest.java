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
import static org.junit.Assert.assertThrows;

import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompileOptionsTest {

  @Test
  public void defaults() {
    CompileOptions options = CompileOptions.DEFAULT;
    assertThat(options.profile).isEqualTo(TargetProfile.UNIVERSAL);
    assertThat(options.strict).isFalse();
    assertThat(options.lineNumbering).isFalse();
    assertThat(options.minifyHeader).isFalse();
    assertThat(options.toString())
        .isEqualTo("target=universal;strict=false;lineNumbers=false;minify=false");
  }

  @Test
  public void fromProperties() {
    Properties properties = new Properties();
    properties.setProperty(CompileOptions.TARGET_PROPERTY, " 3.10 ");
    properties.setProperty(CompileOptions.LINE_NUMBERS_PROPERTY, "true");
    properties.setProperty("unrelated", "x");
    CompileOptions options = CompileOptions.fromProperties(properties);
    assertThat(options)
        .isEqualTo(
            CompileOptions.builder().profile(TargetProfile.PY310).lineNumbering(true).build());
  }

  @Test
  public void fromEmptyProperties() {
    assertThat(CompileOptions.fromProperties(new Properties())).isEqualTo(CompileOptions.DEFAULT);
  }

  @Test
  public void unknownTarget() {
    Properties properties = new Properties();
    properties.setProperty(CompileOptions.TARGET_PROPERTY, "4");
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> CompileOptions.fromProperties(properties));
    assertThat(e).hasMessageThat().isEqualTo("Unknown target profile '4'");
  }

  @Test
  public void toBuilderRoundTrips() {
    CompileOptions options =
        CompileOptions.builder()
            .profile(TargetProfile.PY2)
            .strict(true)
            .lineNumbering(true)
            .minifyHeader(true)
            .build();
    assertThat(options.toBuilder().build()).isEqualTo(options);
    assertThat(options.toBuilder().build().hashCode()).isEqualTo(options.hashCode());
    assertThat(options.toBuilder().strict(false).build()).isNotEqualTo(options);
  }
}
