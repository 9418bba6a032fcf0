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

package org.effectful;

/**
 * The adapter through which an effectful value of type {@code M[A]} can be unwrapped with a
 * postfix operator, {@code e.unwrap} or {@code e.!}. Like {@link Markers}, these are only
 * recognized by the rewriter and must never run.
 */
public final class Unwrappable<A> {

  private Unwrappable() {}

  public A unwrap() {
    throw Markers.notRewritten("unwrap");
  }

  /** The {@code !} operator. */
  public A bang() {
    throw Markers.notRewritten("!");
  }
}
