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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NameAllocatorTest {

  @Test
  public void namesAreNumberedInOrder() {
    NameAllocator names = new NameAllocator();
    assertThat(names.freshName("ref")).isEqualTo("_drupe_ref_0");
    assertThat(names.freshName("match")).isEqualTo("_drupe_match_1");
    assertThat(names.freshName("ref")).isEqualTo("_drupe_ref_2");
    assertThat(names.allocated()).isEqualTo(3);
  }

  @Test
  public void eachAllocatorStartsAtZero() {
    new NameAllocator().freshName("a");
    assertThat(new NameAllocator().freshName("a")).isEqualTo("_drupe_a_0");
  }

  @Test
  public void hintsAreRestricted() {
    NameAllocator names = new NameAllocator();
    assertThrows(IllegalArgumentException.class, () -> names.freshName(""));
    assertThrows(IllegalArgumentException.class, () -> names.freshName("Ref"));
    assertThrows(IllegalArgumentException.class, () -> names.freshName("a-b"));
    assertThat(names.allocated()).isEqualTo(0);
  }

  @Test
  public void reservedPrefix() {
    assertThat(NameAllocator.isReserved("_drupe_x")).isTrue();
    assertThat(NameAllocator.isReserved("_drupeish")).isTrue();
    assertThat(NameAllocator.isReserved("drupe")).isFalse();
    assertThat(NameAllocator.isReserved("_drup")).isFalse();
  }
}
