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

import org.effectful.tree.SyntaxNode;

/**
 * The host's type checker. The rewriter performs no inference of its own; it asks the oracle to
 * type the input (if the host has not already done so) and to confirm that the generated code is
 * well typed.
 */
public interface TypeOracle {

  /**
   * Type checks {@code expr} in the scope of the expression being rewritten and returns an
   * equivalent tree in which every node has a type.
   *
   * @throws TypecheckException if the expression is not well typed; the exception's message is
   *     the diagnostic that will be shown to the user
   */
  SyntaxNode typecheck(SyntaxNode expr) throws TypecheckException;
}
