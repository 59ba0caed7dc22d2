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

package org.drupe.syntax;

/** The kinds of token produced by the {@link Normalizer}. */
public enum TokenKind {
  NAME,
  NUMBER,
  STRING,
  /** Operators and punctuation, including brackets. */
  OP,
  /** End of a logical line. */
  NEWLINE,
  /** Synthetic "block open" marker: the following line is indented further than the last. */
  INDENT,
  /** Synthetic "block close" marker, one for each indentation level that ends. */
  DEDENT,
  EOF
}
