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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameter.TestParameterValuesProvider;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ShimsTest {

  /** Provides the name of every shim. */
  public static class AllShims implements TestParameterValuesProvider {
    @Override
    public List<String> provideValues() {
      return Shims.names();
    }
  }

  @Test
  public void shimDefinesItsName(@TestParameter(valuesProvider = AllShims.class) String name) {
    Shim shim = Shims.get(name);
    assertThat(name).startsWith(NameAllocator.RESERVED_PREFIX + "_");
    assertWithMessage("%s does not define its name", name)
        .that(shim.toString())
        .containsMatch("(def|class) " + name + "\\b|\\b" + name + " =|as " + name + "\\b");
  }

  @Test
  public void dependenciesPrecede(@TestParameter(valuesProvider = AllShims.class) String name) {
    ImmutableList<Shim> closure = Shims.closure(ImmutableSet.of(name));
    assertThat(closure.get(closure.size() - 1).name).isEqualTo(name);
    Set<String> seen = new HashSet<>();
    for (Shim shim : closure) {
      assertThat(seen).containsAtLeastElementsIn(shim.dependencies);
      seen.add(shim.name);
    }
  }

  @Test
  public void shimSourceIsTidy(@TestParameter(valuesProvider = AllShims.class) String name) {
    for (String line : Shims.get(name).lines(false)) {
      assertThat(line).doesNotContain("\t");
      assertThat(line).isEqualTo(line.stripTrailing());
      assertThat(line.length()).isAtMost(100);
    }
  }

  @Test
  public void closureIncludesTransitiveDependencies() {
    ImmutableList<String> names =
        Shims.closure(ImmutableSet.of(Shims.IS_SEQ, Shims.FORWARD_COMPOSE)).stream()
            .map(s -> s.name)
            .collect(ImmutableList.toImmutableList());
    assertThat(names)
        .containsExactly(
            Shims.SEQUENCE,
            Shims.STR_TYPES,
            Shims.IS_SEQ,
            Shims.COMPOSE,
            Shims.FORWARD_COMPOSE)
        .inOrder();
  }

  @Test
  public void closureOrderIgnoresUseOrder() {
    assertThat(Shims.closure(ImmutableList.of(Shims.PARTIAL, Shims.PIPE, Shims.MATCH_ERROR)))
        .isEqualTo(Shims.closure(ImmutableList.of(Shims.MATCH_ERROR, Shims.PIPE, Shims.PARTIAL)));
  }

  @Test
  public void closureOfNothing() {
    assertThat(Shims.closure(ImmutableSet.of())).isEmpty();
  }

  @Test
  public void minifiedIndentation() {
    ImmutableList<String> lines = Shims.get(Shims.PIPE).lines(true);
    assertThat(lines).containsExactly("def _drupe_pipe(value, func):", " return func(value)")
        .inOrder();
    assertThat(Shims.get(Shims.PIPE).lines(false))
        .containsExactly("def _drupe_pipe(value, func):", "    return func(value)")
        .inOrder();
  }

  @Test
  public void unknownShim() {
    assertThrows(IllegalArgumentException.class, () -> Shims.get("_drupe_nothing"));
    assertThat(Shims.isShimName(Shims.CHAIN)).isTrue();
    assertThat(Shims.isShimName("chain")).isFalse();
  }
}
