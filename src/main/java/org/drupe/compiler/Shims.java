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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The registry of header fragments. Every shim runs unchanged on every target profile, Python 2.7
 * included. Shim names are part of the output format and must never change.
 */
public final class Shims {

  public static final String OPERATOR = "_drupe_operator";
  public static final String SEQUENCE = "_drupe_Sequence";
  public static final String MAPPING = "_drupe_Mapping";
  public static final String STR_TYPES = "_drupe_str_types";
  public static final String IS_SEQ = "_drupe_is_seq";
  public static final String MATCH_ERROR = "_drupe_MatchError";
  public static final String UNPACK = "_drupe_unpack";
  public static final String PIPE = "_drupe_pipe";
  public static final String STAR_PIPE = "_drupe_star_pipe";
  public static final String BACK_PIPE = "_drupe_back_pipe";
  public static final String COMPOSE = "_drupe_compose";
  public static final String FORWARD_COMPOSE = "_drupe_forward_compose";
  public static final String HOLE = "_drupe_hole";
  public static final String PARTIAL = "_drupe_partial";
  public static final String LAZY_LIST = "_drupe_lazy_list";
  public static final String LAZY_ITER = "_drupe_lazy_iter";
  public static final String LAZY_MEMO = "_drupe_lazy_memo";
  public static final String CHAIN = "_drupe_chain";
  public static final String NAMEDTUPLE = "_drupe_namedtuple";
  public static final String ADDPATTERN = "_drupe_addpattern";

  /** All shims, in an order where each follows its dependencies. */
  private static final ImmutableMap<String, Shim> ALL = buildRegistry();

  // Statics only
  private Shims() {}

  /** Returns the shim with the given name. */
  public static Shim get(String name) {
    Shim result = ALL.get(name);
    Preconditions.checkArgument(result != null, "No shim named %s", name);
    return result;
  }

  public static boolean isShimName(String name) {
    return ALL.containsKey(name);
  }

  /** The names of all shims, in registry order. */
  public static ImmutableList<String> names() {
    return ALL.keySet().asList();
  }

  /**
   * Returns the given shims plus everything they depend on, ordered so that each shim follows its
   * dependencies. The order depends only on the set of names, not the order they were used in.
   */
  public static ImmutableList<Shim> closure(Collection<String> used) {
    Set<String> visited = new LinkedHashSet<>();
    for (String name : ALL.keySet()) {
      if (used.contains(name)) {
        visit(get(name), visited);
      }
    }
    return visited.stream().map(Shims::get).collect(ImmutableList.toImmutableList());
  }

  private static void visit(Shim shim, Set<String> visited) {
    if (visited.contains(shim.name)) {
      return;
    }
    for (String dep : shim.dependencies) {
      visit(get(dep), visited);
    }
    visited.add(shim.name);
  }

  private static ImmutableMap<String, Shim> buildRegistry() {
    ImmutableMap.Builder<String, Shim> builder = ImmutableMap.builder();
    for (Shim shim : definitions()) {
      builder.put(shim.name, shim);
    }
    return builder.buildOrThrow();
  }

  private static Shim shim(String name, ImmutableList<String> dependencies, String source) {
    return new Shim(name, dependencies, source);
  }

  private static ImmutableList<Shim> definitions() {
    return ImmutableList.of(
        shim(OPERATOR, ImmutableList.of(), "import operator as _drupe_operator"),
        shim(
            SEQUENCE,
            ImmutableList.of(),
            """
            try:
                from collections.abc import Sequence as _drupe_Sequence
            except ImportError:
                from collections import Sequence as _drupe_Sequence
            """),
        shim(
            MAPPING,
            ImmutableList.of(),
            """
            try:
                from collections.abc import Mapping as _drupe_Mapping
            except ImportError:
                from collections import Mapping as _drupe_Mapping
            """),
        shim(
            STR_TYPES,
            ImmutableList.of(),
            """
            try:
                _drupe_str_types = (str, unicode, bytes, bytearray)
            except NameError:
                _drupe_str_types = (str, bytes, bytearray)
            """),
        shim(
            IS_SEQ,
            ImmutableList.of(SEQUENCE, STR_TYPES),
            """
            def _drupe_is_seq(value):
                return (isinstance(value, _drupe_Sequence)
                        and not isinstance(value, _drupe_str_types))
            """),
        shim(
            MATCH_ERROR,
            ImmutableList.of(),
            """
            class _drupe_MatchError(Exception):
                def __init__(self, pattern, value):
                    message = "pattern-matching failed for %s in %r" % (pattern, value)
                    Exception.__init__(self, message)
                    self.pattern = pattern
                    self.value = value
            """),
        shim(
            UNPACK,
            ImmutableList.of(),
            """
            def _drupe_unpack(value, count, star):
                if star < 0:
                    from itertools import islice
                    items = list(islice(value, count + 1))
                    if len(items) > count:
                        raise ValueError("too many values to unpack (expected %d)" % count)
                    if len(items) < count:
                        raise ValueError(
                            "not enough values to unpack (expected %d, got %d)"
                            % (count, len(items)))
                    return items
                items = list(value)
                if len(items) < count - 1:
                    raise ValueError(
                        "not enough values to unpack (expected at least %d, got %d)"
                        % (count - 1, len(items)))
                after = count - 1 - star
                return items[:star] + [items[star:len(items) - after]] + items[len(items) - after:]
            """),
        shim(
            PIPE,
            ImmutableList.of(),
            """
            def _drupe_pipe(value, func):
                return func(value)
            """),
        shim(
            STAR_PIPE,
            ImmutableList.of(),
            """
            def _drupe_star_pipe(values, func):
                return func(*values)
            """),
        shim(
            BACK_PIPE,
            ImmutableList.of(),
            """
            def _drupe_back_pipe(func, value):
                return func(value)
            """),
        shim(
            COMPOSE,
            ImmutableList.of(),
            """
            class _drupe_compose(object):
                __slots__ = ("funcs",)
                def __init__(self, *funcs):
                    self.funcs = funcs
                def __call__(self, *args, **kwargs):
                    result = self.funcs[-1](*args, **kwargs)
                    for func in reversed(self.funcs[:-1]):
                        result = func(result)
                    return result
                def __repr__(self):
                    return " .. ".join(repr(func) for func in self.funcs)
            """),
        shim(
            FORWARD_COMPOSE,
            ImmutableList.of(COMPOSE),
            """
            def _drupe_forward_compose(*funcs):
                return _drupe_compose(*reversed(funcs))
            """),
        shim(
            HOLE,
            ImmutableList.of(),
            """
            class _drupe_hole(object):
                __slots__ = ()
            """),
        shim(
            PARTIAL,
            ImmutableList.of(HOLE),
            """
            class _drupe_partial(object):
                __slots__ = ("func", "args", "holes", "kwargs")
                def __init__(self, func, args, kwargs):
                    self.func = func
                    self.args = args
                    self.holes = sum(1 for arg in args if arg is _drupe_hole)
                    self.kwargs = kwargs
                def __call__(self, *args, **kwargs):
                    if len(args) < self.holes:
                        raise TypeError(
                            "expected at least %d arguments, got %d" % (self.holes, len(args)))
                    filled = []
                    i = 0
                    for arg in self.args:
                        if arg is _drupe_hole:
                            filled.append(args[i])
                            i += 1
                        else:
                            filled.append(arg)
                    filled.extend(args[i:])
                    merged = dict(self.kwargs)
                    merged.update(kwargs)
                    return self.func(*filled, **merged)
            """),
        shim(
            LAZY_LIST,
            ImmutableList.of(),
            """
            class _drupe_lazy_list(object):
                __slots__ = ("thunks", "values")
                def __init__(self, *thunks):
                    self.thunks = thunks
                    self.values = {}
                def _force(self, i):
                    if i not in self.values:
                        self.values[i] = self.thunks[i]()
                    return self.values[i]
                def __iter__(self):
                    for i in range(len(self.thunks)):
                        yield self._force(i)
                def __len__(self):
                    return len(self.thunks)
                def __getitem__(self, index):
                    if isinstance(index, slice):
                        return [self._force(i) for i in range(*index.indices(len(self.thunks)))]
                    if index < 0:
                        index += len(self.thunks)
                    if not 0 <= index < len(self.thunks):
                        raise IndexError("lazy list index out of range")
                    return self._force(index)
                def __repr__(self):
                    return "(|" + ", ".join(repr(value) for value in self) + "|)"
            """),
        shim(
            LAZY_ITER,
            ImmutableList.of(),
            """
            class _drupe_lazy_iter(object):
                __slots__ = ("thunk", "used")
                def __init__(self, thunk):
                    self.thunk = thunk
                    self.used = False
                def __iter__(self):
                    if self.used:
                        raise ValueError("single-pass lazy sequence was already iterated")
                    self.used = True
                    return iter(self.thunk())
            """),
        shim(
            LAZY_MEMO,
            ImmutableList.of(),
            """
            class _drupe_lazy_memo(object):
                __slots__ = ("thunk", "source", "cache")
                def __init__(self, thunk):
                    self.thunk = thunk
                    self.source = None
                    self.cache = []
                def __iter__(self):
                    i = 0
                    while True:
                        if i >= len(self.cache):
                            if self.source is None:
                                self.source = iter(self.thunk())
                            try:
                                self.cache.append(next(self.source))
                            except StopIteration:
                                return
                        yield self.cache[i]
                        i += 1
            """),
        shim(
            CHAIN,
            ImmutableList.of(),
            """
            class _drupe_chain(object):
                __slots__ = ("thunks", "iterables")
                def __init__(self, *thunks):
                    self.thunks = thunks
                    self.iterables = [None] * len(thunks)
                def __iter__(self):
                    for i in range(len(self.thunks)):
                        if self.iterables[i] is None:
                            self.iterables[i] = self.thunks[i]()
                        for item in self.iterables[i]:
                            yield item
            """),
        shim(
            NAMEDTUPLE,
            ImmutableList.of(),
            "from collections import namedtuple as _drupe_namedtuple"),
        shim(
            ADDPATTERN,
            ImmutableList.of(MATCH_ERROR),
            """
            def _drupe_addpattern(base, new):
                def _drupe_patterns(*args, **kwargs):
                    try:
                        return base(*args, **kwargs)
                    except _drupe_MatchError:
                        return new(*args, **kwargs)
                _drupe_patterns.__name__ = getattr(base, "__name__", "_drupe_patterns")
                return _drupe_patterns
            """));
  }
}
