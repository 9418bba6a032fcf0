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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.effectful.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * A BindGroup is an ordered list of effectful bindings together with the residual expression in
 * which they are to be bound. If the bindings are {@code (x1, e1) ... (xn, en)} the group stands
 * for
 *
 * <pre>{@code
 * x1 <- e1; ...; xn <- en; residual
 * }</pre>
 *
 * where each {@code ei} may refer to {@code x1 ... x(i-1)} and the residual may refer to all of
 * them. The residual is null only for an absent case guard.
 */
final class BindGroup {

  /** A fresh name bound to the result of an effectful expression. */
  static final class Binding {
    final String name;
    final SyntaxNode source;

    Binding(String name, SyntaxNode source) {
      this.name = Preconditions.checkNotNull(name);
      this.source = Preconditions.checkNotNull(source);
    }

    @Override
    public String toString() {
      return name + " <- " + source;
    }
  }

  final ImmutableList<Binding> bindings;
  final @Nullable SyntaxNode residual;

  BindGroup(ImmutableList<Binding> bindings, @Nullable SyntaxNode residual) {
    this.bindings = bindings;
    this.residual = residual;
  }

  /** Returns a group with no bindings. */
  static BindGroup of(@Nullable SyntaxNode residual) {
    return new BindGroup(ImmutableList.of(), residual);
  }

  /** Returns a group with the same bindings and a new residual. */
  BindGroup withResidual(@Nullable SyntaxNode newResidual) {
    return new BindGroup(bindings, newResidual);
  }

  /** Returns a group with the bindings following the first one. */
  BindGroup rest() {
    return new BindGroup(bindings.subList(1, bindings.size()), residual);
  }

  @Override
  public String toString() {
    return bindings.stream().map(b -> b + "; ").collect(Collectors.joining()) + residual;
  }
}
