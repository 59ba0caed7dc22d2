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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.drupe.testing.TestdataScanner;
import org.drupe.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles Drupe source code from each of the .drp files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/drupe/compiler/testdata");

  /**
   * Each .drp file is expected to have source code followed by a comment block that begins "{@code
   * # COMPILE (target)}" and ends with a "{@code # END}" line. The parentheses enclose the id of
   * the target profile to compile for.
   *
   * <p>There are three variants for the COMPILE comment:
   *
   * <ul>
   *   <li>With no additional information: the test passes if the program compiles without errors.
   *   <li>With an error message (e.g. "{@code # COMPILE (3): LoweringError: 'nonlocal'}"): the
   *       test passes if the compile reports an error whose message starts with the given text.
   *   <li>With expected output ("{@code # COMPILE (3):}" followed by comment lines up to the
   *       {@code # END}): the test passes if the body of the generated program (everything after
   *       the header) matches, after removing the leading "{@code # }" from each expected line.
   * </ul>
   *
   * <p>A single file may contain multiple programs, each followed by a COMPILE comment; each is
   * compiled independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n# COMPILE (.*?)\n# END\n*", Pattern.DOTALL);

  /** Parses the first line of a COMPILE comment (beginning immediately after "# COMPILE "). */
  private static final Pattern FIRST_LINE_PATTERN =
      Pattern.compile("\\(([a-z0-9.]+)\\) *(:.*\n?)?");

  private static final String BODY_START = "# Compiled Drupe:\n\n";

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No COMPILE comment found");
    Matcher partsMatcher = FIRST_LINE_PATTERN.matcher(testProgram.comment());
    assertWithMessage("Bad COMPILE comment").that(partsMatcher.lookingAt()).isTrue();
    TargetProfile profile = TargetProfile.parse(partsMatcher.group(1));
    String errMsg = partsMatcher.group(2);
    String expected = null;
    if (errMsg != null) {
      errMsg = errMsg.trim();
      if (errMsg.length() == 1) {
        errMsg = null;
        expected = testProgram.comment().substring(partsMatcher.end());
      } else {
        // Drop the colon
        errMsg = errMsg.substring(1).trim();
        assertWithMessage("Noise after error message in COMPILE comment")
            .that(partsMatcher.end())
            .isEqualTo(testProgram.comment().length());
      }
    }
    CompileResult result =
        Compiler.compile(testProgram.code(), CompileOptions.forProfile(profile));
    System.out.format("** %s:\n%s\n", testProgram.name(), result.outputText());
    if (errMsg != null) {
      assertWithMessage("Expected error, compiled OK").that(result.valid()).isFalse();
      List<String> messages = new ArrayList<>();
      result.errors().forEach(d -> messages.add(d.message()));
      String expectedPrefix = errMsg;
      assertWithMessage("Errors %s", messages)
          .that(messages.stream().anyMatch(m -> m.startsWith(expectedPrefix)))
          .isTrue();
    } else if (expected != null) {
      assertWithMessage("Compilation results don't match")
          .that(body(result.outputText()))
          .isEqualTo(expectedLines(expected));
    } else {
      assertWithMessage("Unexpected errors").that(result.errors()).isEmpty();
    }
  }

  /**
   * Returns a TestProgram for each code chunk from a ".drp" file in our testdata directory.
   */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".drp", COMMENT_PATTERN);
    }
  }

  /** The lines of the output that follow the header, without trailing blank lines. */
  private static ImmutableList<String> body(String output) {
    int start = output.indexOf(BODY_START);
    assertWithMessage("No body in output").that(start).isAtLeast(0);
    return trimmed(Splitter.on('\n').split(output.substring(start + BODY_START.length())));
  }

  private static ImmutableList<String> expectedLines(String comment) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(comment)) {
      if (line.equals("#")) {
        lines.add("");
      } else {
        assertWithMessage("Bad expected line").that(line).startsWith("# ");
        lines.add(line.substring(2));
      }
    }
    return trimmed(lines);
  }

  private static ImmutableList<String> trimmed(Iterable<String> lines) {
    List<String> result = new ArrayList<>();
    lines.forEach(result::add);
    while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
      result.remove(result.size() - 1);
    }
    return ImmutableList.copyOf(result);
  }
}
