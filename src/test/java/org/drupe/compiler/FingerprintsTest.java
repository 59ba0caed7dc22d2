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

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class FingerprintsTest {

  private static final String SOURCE = "x = 1\n";

  @Test
  public void fingerprintIsLowercaseSha256Hex() {
    String fp = Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT);
    assertThat(fp).matches("[0-9a-f]{64}");
    assertThat(Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT)).isEqualTo(fp);
  }

  private static Object[] changedOptions() {
    return new Object[] {
      CompileOptions.forProfile(TargetProfile.PY3),
      CompileOptions.builder().strict(true).build(),
      CompileOptions.builder().lineNumbering(true).build(),
      CompileOptions.builder().minifyHeader(true).build(),
    };
  }

  @Test
  @Parameters(method = "changedOptions")
  public void everyOptionChangesTheFingerprint(CompileOptions options) {
    assertThat(Fingerprints.fingerprint(SOURCE, options))
        .isNotEqualTo(Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT));
  }

  @Test
  public void sourceChangesTheFingerprint() {
    assertThat(Fingerprints.fingerprint("x = 2\n", CompileOptions.DEFAULT))
        .isNotEqualTo(Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT));
    assertThat(Fingerprints.fingerprint("x = 1", CompileOptions.DEFAULT))
        .isNotEqualTo(Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT));
  }

  @Test
  public void equalOptionsShareFingerprints() {
    CompileOptions a = CompileOptions.builder().profile(TargetProfile.PY39).strict(true).build();
    CompileOptions b =
        CompileOptions.forProfile(TargetProfile.PY39).toBuilder().strict(true).build();
    assertThat(Fingerprints.fingerprint(SOURCE, a))
        .isEqualTo(Fingerprints.fingerprint(SOURCE, b));
  }

  @Test
  public void compileResultCarriesFingerprint() {
    CompileResult result = Compiler.compile(SOURCE, CompileOptions.DEFAULT);
    assertThat(result.fingerprint())
        .isEqualTo(Fingerprints.fingerprint(SOURCE, CompileOptions.DEFAULT));
    assertThat(result.outputText())
        .contains(
            "# __drupe_hash__ = 0x"
                + result.fingerprint().substring(0, Fingerprints.PREFIX_LENGTH)
                + "\n");
  }

  @Test
  public void failedCompileStillHasFingerprint() {
    CompileResult result = Compiler.compile("x = (\n", CompileOptions.DEFAULT);
    assertThat(result.valid()).isFalse();
    assertThat(result.fingerprint())
        .isEqualTo(Fingerprints.fingerprint("x = (\n", CompileOptions.DEFAULT));
  }
}
