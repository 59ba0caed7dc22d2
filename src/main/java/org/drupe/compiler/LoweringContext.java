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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.drupe.syntax.Node;
import org.drupe.syntax.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * The mutable state of one compile's lowering phase. Each compile creates its own context, so
 * concurrent compiles share nothing.
 */
final class LoweringContext {

  /** The kinds of construct that can enclose the statement being lowered. */
  enum Enclosing {
    FUNCTION,
    /** A function whose self tail calls are being rewritten into a loop. */
    TAIL_CALL_FUNCTION,
    CLASS,
    LOOP,
    TRY,
    WITH,
    MATCH
  }

  record Frame(Enclosing kind, Stmt.@Nullable FunctionDef function) {}

  final TargetProfile profile;
  final Emitter out = new Emitter();

  private final NameAllocator names = new NameAllocator();
  private final Set<String> usedShims = new LinkedHashSet<>();
  private final Set<String> futureFeatures = new LinkedHashSet<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final Deque<Frame> frames = new ArrayDeque<>();

  LoweringContext(TargetProfile profile) {
    this.profile = profile;
  }

  /** Records that the output refers to the given shim, and returns its name. */
  String shim(String name) {
    Shims.get(name);
    usedShims.add(name);
    return name;
  }

  ImmutableSet<String> usedShims() {
    return ImmutableSet.copyOf(usedShims);
  }

  /** The number of distinct shims used so far, for {@link #forgetShimsSince}. */
  int shimMark() {
    return usedShims.size();
  }

  /** Forgets the shims first used after {@code mark}, once the code using them is discarded. */
  void forgetShimsSince(int mark) {
    Iterator<String> it = usedShims.iterator();
    for (int i = 0; i < mark; i++) {
      it.next();
    }
    while (it.hasNext()) {
      it.next();
      it.remove();
    }
  }

  String freshName(String hint) {
    return names.freshName(hint);
  }

  LoweringStrategy strategy(ConstructKind kind) {
    return ProfileResolver.resolve(kind, profile);
  }

  boolean isNative(ConstructKind kind) {
    return ProfileResolver.isNative(kind, profile);
  }

  /** Throws a LoweringError if the target profile cannot express {@code kind} at all. */
  void requireAvailable(ConstructKind kind, Node node, String what) {
    if (strategy(kind) == LoweringStrategy.UNAVAILABLE) {
      throw LoweringError.at(node, "%s is not available for target '%s'", what, profile);
    }
  }

  /** Rejects user identifiers that use the prefix reserved for generated names. */
  void checkIdentifier(Node node, @Nullable String identifier) {
    if (identifier != null && NameAllocator.isReserved(identifier)) {
      throw LoweringError.at(
          node,
          "identifier '%s' uses the reserved prefix '%s'",
          identifier,
          NameAllocator.RESERVED_PREFIX);
    }
  }

  void push(Enclosing kind) {
    frames.push(new Frame(kind, null));
  }

  void pushFunction(Stmt.FunctionDef function, boolean rewriteTailCalls) {
    frames.push(
        new Frame(rewriteTailCalls ? Enclosing.TAIL_CALL_FUNCTION : Enclosing.FUNCTION, function));
  }

  void pop() {
    frames.pop();
  }

  int frameDepth() {
    return frames.size();
  }

  /** Discards frames pushed since the depth was {@code depth}, after a failed statement. */
  void popTo(int depth) {
    while (frames.size() > depth) {
      frames.pop();
    }
  }

  /** True if the innermost enclosing construct is a class body. */
  boolean inClassBody() {
    Frame top = frames.peek();
    return top != null && top.kind() == Enclosing.CLASS;
  }

  /**
   * If a {@code return} at the current position is in tail position of a function whose tail
   * calls are being rewritten, returns that function; otherwise returns null.
   */
  Stmt.@Nullable FunctionDef tailCallFunction() {
    for (Frame frame : frames) {
      switch (frame.kind()) {
        case MATCH:
          continue;
        case TAIL_CALL_FUNCTION:
          return frame.function();
        default:
          return null;
      }
    }
    return null;
  }

  void addFutureFeature(String feature) {
    futureFeatures.add(feature);
  }

  ImmutableList<String> futureFeatures() {
    return ImmutableList.copyOf(futureFeatures);
  }

  void report(CompileError error) {
    diagnostics.add(error.toDiagnostic());
  }

  void warn(Node node, String message) {
    diagnostics.add(Diagnostic.warning(message, node.line, node.column));
  }

  ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}
