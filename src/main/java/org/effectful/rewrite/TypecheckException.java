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

package org.effectful.rewrite;

import org.effectful.tree.Position;

/** Thrown by a {@link TypeOracle} that cannot assign a type to an expression. */
public class TypecheckException extends Exception {
  public final Position pos;

  public TypecheckException(String msg, Position pos) {
    super(msg);
    this.pos = pos;
  }
}
