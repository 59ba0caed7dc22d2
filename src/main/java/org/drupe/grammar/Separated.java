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

package org.drupe.grammar;

import com.google.common.collect.ImmutableList;

/**
 * The result of a separated list rule: the items, and whether the list ended with a separator
 * (which distinguishes e.g. the tuple {@code (x,)} from the parenthesized {@code (x)}).
 */
public final class Separated<T> {
  public final ImmutableList<T> items;
  public final boolean trailingSeparator;

  Separated(ImmutableList<T> items, boolean trailingSeparator) {
    this.items = items;
    this.trailingSeparator = trailingSeparator;
  }

  /** True if there was more than one item or a trailing separator. */
  public boolean isList() {
    return items.size() > 1 || trailingSeparator;
  }
}
