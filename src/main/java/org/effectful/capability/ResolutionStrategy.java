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

/** How a concrete type is mapped to the type constructor whose instances are searched. */
public enum ResolutionStrategy {
  /**
   * The type's own constructor and then each constructor in its linearization, considering only
   * those with exactly one type parameter.
   */
  DIRECT,

  /**
   * First asks the {@link InstanceRegistry} to decompose the type into an effect constructor with
   * some arguments fixed and a carried value type, then searches as {@link #DIRECT} does for the
   * decomposed constructor. This finds instances for effects such as {@code Either[E, A]} whose
   * constructor has more than one parameter.
   */
  INDIRECT
}
