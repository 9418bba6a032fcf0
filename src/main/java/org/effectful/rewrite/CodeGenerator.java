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

import static org.effectful.tree.SyntaxNode.callMethod;
import static org.effectful.tree.SyntaxNode.ident;
import static org.effectful.tree.SyntaxNode.lambda;

import com.google.common.base.Preconditions;
import org.effectful.rewrite.BindGroup.Binding;
import org.effectful.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * Turns a {@link BindGroup} into explicit effect code. A group with bindings {@code (x1, e1) ...
 * (xn, en)} and residual {@code r} becomes
 *
 * <pre>{@code
 * E.bind(e1, x1 => E.bind(e2, x2 => ... E.bind(en, xn => E.pure(r))))
 * }</pre>
 *
 * so the effects run left to right, each continuation nested inside the previous one. {@code E}
 * is a reference to the effect instance, which the driver binds to {@link #effectName} around the
 * generated code.
 */
final class CodeGenerator {

  /** The name the effect instance is bound to in the generated code. */
  final String effectName;

  CodeGenerator(String effectName) {
    this.effectName = effectName;
  }

  /** Returns a new reference to the effect instance. */
  SyntaxNode effect() {
    return ident(effectName);
  }

  /**
   * Returns the effect code for {@code group}. If there are no bindings the result is the
   * residual itself, lifted with {@code pure} when {@code isPure} is true; an absent residual
   * stays absent.
   */
  @Nullable SyntaxNode generate(BindGroup group, boolean isPure) {
    if (group.bindings.isEmpty()) {
      if (isPure && group.residual != null) {
        return pure(group.residual);
      }
      return group.residual;
    }
    Binding first = group.bindings.get(0);
    SyntaxNode inner = generate(group.rest(), isPure);
    Preconditions.checkState(inner != null, "Bindings with no residual");
    return bind(first.source, first.name, inner);
  }

  /** {@code E.pure(value)} */
  SyntaxNode pure(SyntaxNode value) {
    return callMethod(effect(), "pure", value);
  }

  /** {@code E.bind(source, name => body)} */
  SyntaxNode bind(SyntaxNode source, String name, SyntaxNode body) {
    return callMethod(effect(), "bind", source, lambda(name, body));
  }

  /** {@code E.map(source, fn)} */
  SyntaxNode map(SyntaxNode source, SyntaxNode fn) {
    return callMethod(effect(), "map", source, fn);
  }
}
