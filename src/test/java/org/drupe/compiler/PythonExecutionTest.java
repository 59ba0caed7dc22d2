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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.junit.Assume;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles small programs for each target profile and runs the output with the {@code python3}
 * found on the PATH. Skipped if there is none, and for profiles the interpreter is too old for.
 */
@RunWith(TestParameterInjector.class)
public class PythonExecutionTest {

  private static final String PYTHON = "python3";

  /** The interpreter's major and minor version, or null if it couldn't be run. */
  private static int @Nullable [] interpreterVersion;

  enum Program {
    EXPRESSIONS(
        """
        def add(a, b):
            return a + b
        inc = add$(1)
        print([1, 2, 3] |> map$(inc) |> list)
        print((str .. abs)(-3))
        print((abs ..> str)(-4))
        print(list(map((* 2), [1, 2])))
        print(list(map((10 -), [1, 2])))
        print(list(map(.upper(), ["a", "b"])))
        print(list(map(.[0], [[5], [6]])))
        print((|1, 2|) :: [3] |> list)
        print([1, 2] |*> add)
        print(str <| 5)
        print(divmod$(?, 3)(10))
        """,
        """
        [2, 3, 4]
        3
        4
        [2, 4]
        [9, 8]
        ['A', 'B']
        [5, 6]
        [1, 2, 3]
        3
        5
        (3, 1)
        """),
    PATTERNS(
        """
        def describe(value):
            match value:
                case []:
                    return "empty"
                case [x]:
                    return "one " + str(x)
                case [x, *rest] if x > 10:
                    return "big " + str(len(rest))
                case {"k": v}:
                    return "map " + str(v)
                case str() as s:
                    return "str " + s
                case n is int:
                    return "int " + str(n)
                case _:
                    return "other"
        for item in [[], [1], [20, 1, 2], [3, 4], {"k": 9}, "hi", 7, 2.5]:
            print(describe(item))
        """,
        """
        empty
        one 1
        big 2
        other
        map 9
        str hi
        int 7
        other
        """),
    NATIVE_PATTERNS(
        """
        def classify(point):
            match point:
                case (0, 0):
                    return "origin"
                case (0, y):
                    return "y-axis " + str(y)
                case [x, _] if x < 0:
                    return "left"
                case _:
                    return "elsewhere"
        print(classify((0, 0)))
        print(classify([0, 5]))
        print(classify((-1, 3)))
        print(classify((4, 4)))
        match def fact(0) = 1
        addpattern def fact(n) = n * fact(n - 1)
        print(fact(5))
        """,
        """
        origin
        y-axis 5
        left
        elsewhere
        120
        """),
    STATEMENTS(
        """
        data Point(x, y=0)
        p = Point(3)
        print(p)
        print(p.x + p.y)
        first, *rest = [1, 2, 3]
        print(first, rest)
        (a, [b, c]) = (1, (2, 3))
        print(a + b + c)
        def loop(n, acc):
            if n == 0:
                return acc
            return loop(n - 1, acc + n)
        print(loop(10000, 0))
        name = "drupe"
        print(f"{name!r:>8}|{len(name) |> str}")
        print(f"{{braces}} {1_000}")
        """,
        """
        Point(x=3, y=0)
        3
        1 [2, 3]
        6
        50005000
         'drupe'|5
        {braces} 1000
        """),
    LAZINESS(
        """
        def numbers():
            print("start")
            yield 1
            yield 2
        memo = (|memo n * 10 for n in numbers()|)
        print("before")
        print(list(memo))
        print(list(memo))
        class AppError(Exception):
            pass
        try:
            try:
                {}["missing"]
            except KeyError as e:
                raise AppError("wrapped") from e
        except AppError as err:
            print(type(err.__cause__).__name__, err.__suppress_context__)
        """,
        """
        before
        start
        [10, 20]
        [10, 20]
        KeyError True
        """),
    FAILURES(
        """
        def add_pair(values):
            a, b = values
            return a + b
        for values in [[1, 2], [1, 2, 3], [1]]:
            try:
                print(add_pair(values))
            except ValueError:
                print("arity", len(values))
        def naturals():
            n = 0
            while True:
                yield n
                n += 1
        try:
            x, y = naturals()
        except ValueError:
            print("endless")
        def name(n):
            match n:
                case 0:
                    return "zero"
                case 1:
                    return "one"
        for n in [0, 1, 2]:
            try:
                print(name(n))
            except Exception as e:
                print(type(e).__name__, e.value)
        once = (|n + 1 for n in [1, 2]|)
        print(list(once))
        try:
            print(list(once))
        except ValueError:
            print("already iterated")
        width = 4
        print(f"[{7:{width}}|{2.5:>{width + 2}.{width - 2}f}]")
        """,
        """
        3
        arity 3
        arity 1
        endless
        zero
        one
        _drupe_MatchError 2
        [2, 3]
        already iterated
        [   7|  2.50]
        """);

    final String code;
    final String expected;

    Program(String code, String expected) {
      this.code = code;
      this.expected = expected;
    }
  }

  @BeforeClass
  public static void findInterpreter() throws InterruptedException {
    try {
      String version = run("import sys\nprint('%d.%d' % sys.version_info[:2])\n").trim();
      interpreterVersion = parseVersion(version);
    } catch (IOException e) {
      interpreterVersion = null;
    }
  }

  private static int[] parseVersion(String version) {
    List<String> parts = Splitter.on('.').splitToList(version);
    return new int[] {Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1))};
  }

  /** True if the interpreter can run code compiled for {@code profile}. */
  private static boolean canRun(TargetProfile profile) {
    if (profile == TargetProfile.UNIVERSAL) {
      return true;
    }
    int[] lowest = parseVersion(profile.lowestVersion);
    int[] actual = interpreterVersion;
    return actual[0] == lowest[0] && actual[1] >= lowest[1];
  }

  /** Runs a Python program from stdin and returns what it wrote to stdout and stderr. */
  private static String run(String code) throws IOException, InterruptedException {
    Process process = new ProcessBuilder(PYTHON, "-").redirectErrorStream(true).start();
    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write(code.getBytes(UTF_8));
    }
    String output = new String(process.getInputStream().readAllBytes(), UTF_8);
    assertWithMessage("python timed out").that(process.waitFor(60, TimeUnit.SECONDS)).isTrue();
    assertWithMessage("python failed:\n%s", output).that(process.exitValue()).isEqualTo(0);
    return output;
  }

  @Test
  public void runCompiledProgram(
      @TestParameter Program program, @TestParameter TargetProfile profile) throws Exception {
    Assume.assumeTrue("no " + PYTHON + " on the PATH", interpreterVersion != null);
    Assume.assumeTrue(canRun(profile));
    CompileResult result = Compiler.compile(program.code, CompileOptions.forProfile(profile));
    assertThat(result.errors()).isEmpty();
    assertWithMessage("output of\n%s", result.outputText())
        .that(run(result.outputText()))
        .isEqualTo(program.expected);
  }
}
