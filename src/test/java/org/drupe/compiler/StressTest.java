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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs many compiles at once and checks that each result matches a sequential compile. */
@RunWith(JUnit4.class)
public class StressTest {

  /** A program that uses shims, fresh names, pattern lowering and tail calls. */
  private static final String CODE =
      "data Node(value, next=None)\n"
          + "def total(node, acc):\n"
          + "    if node is None:\n"
          + "        return acc\n"
          + "    return total(node.next, acc + node.value)\n"
          + "match total(xs, 0) |> str:\n"
          + "    case [a, *rest] if a:\n"
          + "        show(f\"{a}: {rest}\")\n"
          + "    case _:\n"
          + "        pass\n"
          + "a, *b = (|1, 2|) :: others\n";

  /** The sequential result for each profile. */
  private final Map<TargetProfile, CompileResult> expected = new EnumMap<>(TargetProfile.class);

  @Before
  public void setup() {
    for (TargetProfile profile : TargetProfile.values()) {
      CompileResult result = Compiler.compile(CODE, CompileOptions.forProfile(profile));
      assertThat(result.errors()).isEmpty();
      expected.put(profile, result);
    }
  }

  private void runMany(
      AtomicInteger nextTrial, int numTrials, ConcurrentLinkedQueue<String> mismatches) {
    TargetProfile[] profiles = TargetProfile.values();
    for (; ; ) {
      int index = nextTrial.getAndIncrement();
      if (index >= numTrials) {
        break;
      }
      TargetProfile profile = profiles[index % profiles.length];
      CompileResult result = Compiler.compile(CODE, CompileOptions.forProfile(profile));
      if (!result.equals(expected.get(profile))) {
        mismatches.add(profile + " (trial " + index + ")");
      }
    }
  }

  @Test
  public void concurrentCompilesAreDeterministic() throws InterruptedException {
    int numTrials = 3000;
    int numThreads = 8;
    AtomicInteger nextTrial = new AtomicInteger();
    ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();
    Thread[] threads = new Thread[numThreads];
    for (int i = 0; i < numThreads; i++) {
      Thread t = new Thread(() -> runMany(nextTrial, numTrials, mismatches));
      t.start();
      threads[i] = t;
    }
    for (Thread t : threads) {
      t.join();
    }
    assertThat(mismatches).isEmpty();
  }
}
