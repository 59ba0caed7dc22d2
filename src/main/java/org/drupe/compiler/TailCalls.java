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
import java.util.ArrayList;
import java.util.List;
import org.drupe.syntax.Arg;
import org.drupe.syntax.Expr;
import org.drupe.syntax.Param;
import org.drupe.syntax.Pattern;
import org.drupe.syntax.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * Decides which functions have their self tail calls turned into a loop, and matches each {@code
 * return f(...)} against the function's parameters.
 *
 * <p>A function qualifies if it is an undecorated top-level or nested function (not a method),
 * takes only plain parameters, never yields, never rebinds its own name, creates no closures that
 * could observe its parameters being reassigned, and contains at least one self tail call.
 */
final class TailCalls {

  /**
   * A self tail call: the argument expressions in source order, and for each the index of the
   * parameter it supplies.
   */
  record Call(ImmutableList<Expr> arguments, ImmutableList<Integer> parameters) {

    /** True if the arguments supply the parameters in declaration order. */
    boolean inOrder() {
      for (int i = 0; i < parameters.size(); i++) {
        if (parameters.get(i) != i) {
          return false;
        }
      }
      return true;
    }
  }

  private TailCalls() {}

  static boolean applies(Stmt.FunctionDef def, boolean isMethod) {
    if (isMethod || !def.decorators.isEmpty()) {
      return false;
    }
    for (Param p : def.params) {
      if (p.kind != Param.Kind.PLAIN) {
        return false;
      }
    }
    return isSimpleBody(def.body, def.name) && hasTailCall(def.body, def);
  }

  /**
   * If {@code value} (the operand of a {@code return} in tail position) is a self call of {@code
   * def} that supplies every parameter exactly once, returns it; otherwise returns null.
   */
  static @Nullable Call match(@Nullable Expr value, Stmt.FunctionDef def) {
    if (!(value instanceof Expr.Call call)
        || !(call.func instanceof Expr.Name name)
        || !name.id.equals(def.name)) {
      return null;
    }
    int n = def.params.size();
    boolean[] supplied = new boolean[n];
    ImmutableList.Builder<Expr> arguments = ImmutableList.builder();
    ImmutableList.Builder<Integer> parameters = ImmutableList.builder();
    int position = 0;
    for (Arg a : call.args) {
      int index;
      if (a.kind == Arg.Kind.POSITIONAL) {
        index = position++;
        if (index >= n) {
          return null;
        }
      } else if (a.kind == Arg.Kind.KEYWORD) {
        index = indexOf(def.params, a.name);
        if (index < 0) {
          return null;
        }
      } else {
        return null;
      }
      if (supplied[index]) {
        return null;
      }
      supplied[index] = true;
      arguments.add(a.value);
      parameters.add(index);
    }
    for (boolean s : supplied) {
      if (!s) {
        return null;
      }
    }
    return new Call(arguments.build(), parameters.build());
  }

  private static int indexOf(List<Param> params, @Nullable String name) {
    for (int i = 0; i < params.size(); i++) {
      if (params.get(i).name.equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /** True if some {@code return} in tail position is a self tail call. */
  private static boolean hasTailCall(List<Stmt> block, Stmt.FunctionDef def) {
    for (Stmt s : block) {
      if (s instanceof Stmt.Return ret) {
        if (match(ret.value, def) != null) {
          return true;
        }
      } else if (s instanceof Stmt.If || s instanceof Stmt.Match) {
        for (ImmutableList<Stmt> nested : s.blocks()) {
          if (hasTailCall(nested, def)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * True if nothing in the block yields, defines a nested function or class, creates a closure,
   * or rebinds {@code name}.
   */
  private static boolean isSimpleBody(List<Stmt> block, String name) {
    for (Stmt s : block) {
      if (s instanceof Stmt.FunctionDef
          || s instanceof Stmt.MatchFunctionDef
          || s instanceof Stmt.ClassDef
          || s instanceof Stmt.DataDef
          || rebinds(s, name)) {
        return false;
      }
      for (Expr e : s.expressions()) {
        if (!isSimpleExpr(e)) {
          return false;
        }
      }
      for (ImmutableList<Stmt> nested : s.blocks()) {
        if (!isSimpleBody(nested, name)) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean isSimpleExpr(Expr e) {
    if (e instanceof Expr.Yield
        || e instanceof Expr.Lambda
        || e instanceof Expr.LazySequence
        || e instanceof Expr.Chain
        || (e instanceof Expr.Comprehension c && c.kind == Expr.Comprehension.Kind.GENERATOR)) {
      return false;
    }
    for (Expr child : e.children()) {
      if (!isSimpleExpr(child)) {
        return false;
      }
    }
    return true;
  }

  private static boolean rebinds(Stmt s, String name) {
    List<Expr> targets = new ArrayList<>();
    if (s instanceof Stmt.Assign assign) {
      targets.addAll(assign.targets);
    } else if (s instanceof Stmt.AugAssign aug) {
      targets.add(aug.target);
    } else if (s instanceof Stmt.AnnAssign ann) {
      targets.add(ann.target);
    } else if (s instanceof Stmt.For loop) {
      targets.add(loop.target);
    } else if (s instanceof Stmt.Del del) {
      targets.addAll(del.targets);
    } else if (s instanceof Stmt.With with) {
      for (Stmt.WithItem item : with.items) {
        if (item.target != null) {
          targets.add(item.target);
        }
      }
    } else if (s instanceof Stmt.Scope scope) {
      return scope.names.contains(name);
    } else if (s instanceof Stmt.Import imp) {
      return binds(imp.names, name);
    } else if (s instanceof Stmt.FromImport imp) {
      return imp.isStar() || binds(imp.names, name);
    } else if (s instanceof Stmt.Try t) {
      return t.handlers.stream().anyMatch(h -> name.equals(h.name));
    } else if (s instanceof Stmt.Match match) {
      return match.cases.stream().anyMatch(c -> patternBinds(c.pattern, name));
    }
    return targets.stream().anyMatch(t -> mentions(t, name));
  }

  private static boolean binds(List<Stmt.Alias> aliases, String name) {
    for (Stmt.Alias a : aliases) {
      String bound = a.asName != null ? a.asName : a.name.split("\\.", -1)[0];
      if (bound.equals(name)) {
        return true;
      }
    }
    return false;
  }

  private static boolean mentions(Expr e, String name) {
    if (e instanceof Expr.Name n) {
      return n.id.equals(name);
    }
    return e.children().stream().anyMatch(c -> mentions(c, name));
  }

  private static boolean patternBinds(Pattern p, String name) {
    if (p instanceof Pattern.Capture c) {
      return c.name.equals(name);
    } else if (p instanceof Pattern.As as) {
      return as.name.equals(name) || patternBinds(as.pattern, name);
    } else if (p instanceof Pattern.TypeTest t) {
      return name.equals(t.name);
    } else if (p instanceof Pattern.Star star) {
      return name.equals(star.name);
    } else if (p instanceof Pattern.Sequence seq) {
      return seq.elements.stream().anyMatch(e -> patternBinds(e, name));
    } else if (p instanceof Pattern.Mapping m) {
      return name.equals(m.rest) || m.values.stream().anyMatch(v -> patternBinds(v, name));
    } else if (p instanceof Pattern.ClassPattern cls) {
      return cls.positional.stream().anyMatch(v -> patternBinds(v, name))
          || cls.keywords.stream().anyMatch(k -> patternBinds(k.pattern, name));
    }
    return false;
  }
}
