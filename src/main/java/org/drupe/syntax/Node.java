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

/** Base class for all syntax tree nodes; records where the node started in the source. */
public abstract class Node {
  /** 1-based line of the node's first token. */
  public final int line;

  /** 0-based column of the node's first token. */
  public final int column;

  protected Node(Token start) {
    this(start.line, start.column);
  }

  protected Node(int line, int column) {
    this.line = line;
    this.column = column;
  }
}
