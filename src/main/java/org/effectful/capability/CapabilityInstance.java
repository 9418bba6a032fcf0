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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;

/**
 * A CapabilityInstance identifies the host object that implements a {@link Capability} for one
 * effect or container type. The rewriter never looks inside the object; it only splices {@link
 * #reference} into the code it generates.
 */
public final class CapabilityInstance {
  public final Capability capability;

  /**
   * The constructor the instance was registered for. This may be a supertype of the constructor of
   * the type that was resolved, e.g. {@code Option} when resolving {@code Some[Int]}.
   */
  public final TypeConstructor registeredFor;

  /** The fixed arguments of the resolved effect; empty unless it was resolved indirectly. */
  public final ImmutableList<Type> fixedArgs;

  private final SyntaxNode reference;

  public CapabilityInstance(
      Capability capability,
      TypeConstructor registeredFor,
      ImmutableList<Type> fixedArgs,
      SyntaxNode reference) {
    this.capability = Preconditions.checkNotNull(capability);
    this.registeredFor = Preconditions.checkNotNull(registeredFor);
    this.fixedArgs = fixedArgs;
    this.reference = Preconditions.checkNotNull(reference);
  }

  /** Returns a new copy of the expression that evaluates to this instance. */
  public SyntaxNode reference() {
    return reference.copy();
  }

  /**
   * Returns true if {@code other} provides the same capability for the same effect, i.e. if code
   * using one could use the other.
   */
  public boolean sameEffect(CapabilityInstance other) {
    return capability == other.capability
        && registeredFor == other.registeredFor
        && fixedArgs.equals(other.fixedArgs);
  }

  @Override
  public String toString() {
    String effect =
        fixedArgs.isEmpty() ? registeredFor.name : registeredFor.name + fixedArgs + "[_]";
    return capability + "[" + effect + "] = " + reference;
  }
}
