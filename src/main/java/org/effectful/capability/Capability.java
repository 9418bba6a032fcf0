/*
 * Copyright 2025 The Effectful Authors
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

package org.effectful.capability;

/**
 * The capabilities the rewriter needs from the host. Each is identified by the operations that
 * generated code calls on an instance.
 */
public enum Capability {
  /**
   * An effect (monad): {@code pure(a)}, {@code bind(ma, f)}, {@code map(ma, f)}, and (for
   * containers that are themselves effects) {@code join(mma)}.
   */
  EFFECT,

  /**
   * A container that can be traversed with an effectful function: {@code traverse(effect, c, f)}
   * and {@code filterM(effect, c, p)}.
   */
  CONTAINER
}
