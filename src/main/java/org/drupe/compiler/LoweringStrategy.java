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

/** How a construct is rendered for a given target profile. */
public enum LoweringStrategy {
  /** The profile has an equivalent construct; pass it through with minor syntax adjustment. */
  NATIVE,
  /** Rewrite the construct into older syntax, using shims from the header where needed. */
  LOWERED,
  /** There is no correct lowering; using the construct is a LoweringError. */
  UNAVAILABLE
}
