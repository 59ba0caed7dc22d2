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

package org.drupe.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the programs in a testdata directory as test parameters. Each file is split into
 * chunks, each ending with a comment matching the given pattern; the pattern's first group is the
 * comment's body.
 */
public class TestdataScanner implements TestParameterValuesProvider {

  /**
   * One program from a testdata file.
   *
   * @param name the file name and the line on which the program starts
   * @param code the program text
   * @param comment the body of the comment that follows the program, or null if the file ended
   *     without one
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path directory;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path directory, String extension, Pattern commentPattern) {
    this.directory = directory;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(directory)) {
      files
          .filter(f -> f.getFileName().toString().endsWith(extension))
          .sorted()
          .forEach(f -> scan(f, result));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> result) {
    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    String fileName = file.getFileName().toString();
    Matcher matcher = commentPattern.matcher(content);
    int start = 0;
    while (matcher.find()) {
      result.add(program(fileName, content, start, matcher.start(), matcher.group(1)));
      start = matcher.end();
    }
    if (!content.substring(start).isBlank()) {
      result.add(program(fileName, content, start, content.length(), null));
    }
  }

  private static TestProgram program(
      String fileName, String content, int start, int end, @Nullable String comment) {
    // Skip leading blank lines so that the name reports the program's first line.
    while (start < end && content.charAt(start) == '\n') {
      start++;
    }
    int line = 1 + (int) content.substring(0, start).chars().filter(c -> c == '\n').count();
    return new TestProgram(fileName + ":" + line, content.substring(start, end) + "\n", comment);
  }
}
