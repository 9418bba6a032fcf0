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

import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;
import org.jspecify.annotations.Nullable;

/**
 * The host's answer to "find an instance of capability C for type T". Lookups are keyed by
 * TypeConstructor identity; searching supertypes is the caller's job (see {@code
 * CapabilityResolver}).
 *
 * <p>{@link CapabilityRegistry} is a complete implementation that hosts can populate explicitly.
 */
public interface InstanceRegistry {

  /**
   * Returns an expression that evaluates to the instance of {@code capability} registered for
   * exactly {@code constructor}, or null if there is none. Each call returns a new, unshared tree.
   */
  @Nullable SyntaxNode find(Capability capability, TypeConstructor constructor);

  /**
   * Returns the Decomposition to use for {@code type} when resolving indirectly, or null if the
   * type cannot be viewed as an effect applied to a carried value.
   */
  @Nullable Decomposition decompose(Type.Applied type);
}
