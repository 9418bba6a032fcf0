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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;
import org.jspecify.annotations.Nullable;

/**
 * An explicit, immutable {@link InstanceRegistry}. All instances, decomposition rules, and
 * derivations are supplied to a {@link Builder} when the registry is composed; nothing is looked
 * up from ambient state at rewrite time, so the same registry always gives the same answers.
 *
 * <p>Three kinds of entry are supported:
 *
 * <ul>
 *   <li>an <i>instance</i>: the expression implementing a capability for one constructor;
 *   <li>a <i>decomposition rule</i>: which parameter of a multi-parameter constructor carries the
 *       value, for {@link ResolutionStrategy#INDIRECT} lookups; and
 *   <li>a <i>derivation</i>: a combinator that produces an instance of one capability from the
 *       instance of another capability for the same constructor, e.g. a container traversal built
 *       from the container's own effect instance.
 * </ul>
 *
 * Explicit instances take precedence over derived ones; derivations are tried in the order they
 * were added.
 */
public final class CapabilityRegistry implements InstanceRegistry {

  private final ImmutableMap<Key, SyntaxNode> instances;
  private final ImmutableMap<TypeConstructor, Integer> carriedIndices;
  private final ImmutableList<Derivation> derivations;

  private CapabilityRegistry(Builder builder) {
    this.instances = ImmutableMap.copyOf(builder.instances);
    this.carriedIndices = ImmutableMap.copyOf(builder.carriedIndices);
    this.derivations = ImmutableList.copyOf(builder.derivations);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public @Nullable SyntaxNode find(Capability capability, TypeConstructor constructor) {
    return find(capability, constructor, new ArrayList<>());
  }

  /**
   * {@code inProgress} holds the capabilities we are already trying to derive for {@code
   * constructor}, so that derivations that refer to each other don't recurse forever.
   */
  private @Nullable SyntaxNode find(
      Capability capability, TypeConstructor constructor, List<Capability> inProgress) {
    SyntaxNode instance = instances.get(new Key(capability, constructor));
    if (instance != null) {
      return instance.copy();
    }
    if (inProgress.contains(capability)) {
      return null;
    }
    inProgress.add(capability);
    try {
      for (Derivation derivation : derivations) {
        if (derivation.target == capability) {
          SyntaxNode source = find(derivation.source, constructor, inProgress);
          if (source != null) {
            return derivation.combinator.apply(source);
          }
        }
      }
      return null;
    } finally {
      inProgress.remove(capability);
    }
  }

  @Override
  public @Nullable Decomposition decompose(Type.Applied type) {
    for (TypeConstructor tc : type.constructor.linearization()) {
      Integer carried = carriedIndices.get(tc);
      if (carried != null && tc.arity == type.constructor.arity) {
        return Decomposition.carryingArg(type, carried);
      }
    }
    return Decomposition.ofSingleParameter(type);
  }

  private static final class Key {
    final Capability capability;
    final TypeConstructor constructor;

    Key(Capability capability, TypeConstructor constructor) {
      this.capability = capability;
      this.constructor = constructor;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Key
          && ((Key) obj).capability == capability
          && ((Key) obj).constructor == constructor;
    }

    @Override
    public int hashCode() {
      return Objects.hash(capability, System.identityHashCode(constructor));
    }
  }

  private static final class Derivation {
    final Capability target;
    final Capability source;
    final UnaryOperator<SyntaxNode> combinator;

    Derivation(Capability target, Capability source, UnaryOperator<SyntaxNode> combinator) {
      this.target = target;
      this.source = source;
      this.combinator = combinator;
    }
  }

  /** Accumulates the entries of a CapabilityRegistry. */
  public static final class Builder {
    private final Map<Key, SyntaxNode> instances = new LinkedHashMap<>();
    private final Map<TypeConstructor, Integer> carriedIndices = new LinkedHashMap<>();
    private final List<Derivation> derivations = new ArrayList<>();

    private Builder() {}

    /**
     * Registers {@code reference} as the implementation of {@code capability} for {@code
     * constructor}. The reference is copied each time it is returned, so the caller may reuse it.
     */
    @CanIgnoreReturnValue
    public Builder register(
        Capability capability, TypeConstructor constructor, SyntaxNode reference) {
      SyntaxNode prev = instances.putIfAbsent(new Key(capability, constructor), reference);
      Preconditions.checkArgument(
          prev == null, "Duplicate %s instance for %s", capability, constructor);
      return this;
    }

    /**
     * Declares that, when decomposing a type whose linearization includes {@code constructor}, the
     * parameter at {@code carriedIndex} is the carried value and the others are fixed.
     */
    @CanIgnoreReturnValue
    public Builder decomposeAt(TypeConstructor constructor, int carriedIndex) {
      Preconditions.checkElementIndex(carriedIndex, constructor.arity);
      carriedIndices.put(constructor, carriedIndex);
      return this;
    }

    /**
     * Adds a rule that, for any constructor with an instance of {@code source} but no explicit
     * instance of {@code target}, builds a {@code target} instance by applying {@code combinator}
     * to the {@code source} instance's reference.
     */
    @CanIgnoreReturnValue
    public Builder derive(
        Capability target, Capability source, UnaryOperator<SyntaxNode> combinator) {
      Preconditions.checkArgument(target != source);
      derivations.add(new Derivation(target, source, combinator));
      return this;
    }

    public CapabilityRegistry build() {
      return new CapabilityRegistry(this);
    }
  }
}
