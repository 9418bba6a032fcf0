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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.effectful.capability.Capability;
import org.effectful.capability.CapabilityInstance;
import org.effectful.capability.Decomposition;
import org.effectful.capability.InstanceRegistry;
import org.effectful.capability.ResolutionStrategy;
import org.effectful.rewrite.Diagnostic.Kind;
import org.effectful.tree.Position;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;
import org.jspecify.annotations.Nullable;

/**
 * Finds the capability instances that generated code needs: the effect instance of a rewrite
 * block, and the container and effect instances used by higher-order rewrites.
 *
 * <p>With {@link ResolutionStrategy#DIRECT} the type's constructor is looked up first, then each
 * constructor in its linearization; the first one with an instance wins. Only single-parameter
 * constructors are considered, and {@code Nothing} never resolves.
 *
 * <p>With {@link ResolutionStrategy#INDIRECT} the registry is first asked to {@link
 * InstanceRegistry#decompose decompose} the type into an effect constructor with fixed arguments
 * and a carried type; the same linearization walk is then made over constructors of the
 * decomposed constructor's arity. A type the registry can't decompose is resolved as with {@link
 * ResolutionStrategy#DIRECT}.
 */
final class CapabilityResolver {
  private final InstanceRegistry registry;
  private final MarkerSyntax syntax;
  private final TypeAttachment attachment;

  CapabilityResolver(InstanceRegistry registry, MarkerSyntax syntax, TypeAttachment attachment) {
    this.registry = registry;
    this.syntax = syntax;
    this.attachment = attachment;
  }

  /** Returns the instance of {@code capability} for {@code type}, or null if there is none. */
  @Nullable CapabilityInstance resolve(
      Capability capability, Type type, ResolutionStrategy strategy) {
    if (!(type instanceof Type.Applied) || type.isNothing()) {
      return null;
    }
    Type.Applied applied = (Type.Applied) type;
    Decomposition decomposition =
        (strategy == ResolutionStrategy.DIRECT) ? null : registry.decompose(applied);
    if (decomposition == null) {
      // Look for a single-parameter supertype, e.g. Opt for None.
      return search(capability, applied.constructor, 1, ImmutableList.of());
    }
    return search(
        capability,
        decomposition.constructor,
        decomposition.constructor.arity,
        decomposition.fixedArgs);
  }

  private @Nullable CapabilityInstance search(
      Capability capability,
      TypeConstructor constructor,
      int arity,
      ImmutableList<Type> fixedArgs) {
    for (TypeConstructor tc : constructor.linearization()) {
      if (tc.arity != arity || tc == TypeConstructor.NOTHING) {
        continue;
      }
      SyntaxNode reference = registry.find(capability, tc);
      if (reference != null) {
        return new CapabilityInstance(capability, tc, fixedArgs, reference);
      }
    }
    return null;
  }

  /**
   * Like {@link #resolve}, but throws a {@link Kind#CAPABILITY_NOT_FOUND} error at {@code pos} if
   * there is no instance.
   */
  CapabilityInstance resolveOrFail(
      Capability capability, Type type, ResolutionStrategy strategy, Position pos) {
    CapabilityInstance result = resolve(capability, type, strategy);
    if (result == null) {
      throw RewriteError.of(
          Kind.CAPABILITY_NOT_FOUND, pos, "no %s instance found for %s", capability, type);
    }
    return result;
  }

  /**
   * Returns the effect instance for the rewrite block {@code tree}, or null if it can't be
   * determined.
   *
   * <p>Every marker in the block, including markers nested in another marker's argument, must
   * unwrap a value of the same effect. If there are no markers, if a marker's effect has no
   * instance, or if the markers disagree, each problem is added to {@code diagnostics} and null is
   * returned. Otherwise, if {@code expectedType} (the type the caller expects the whole block to
   * have) has an instance it is used, and if not the instance is the one inferred from the
   * markers.
   *
   * @throws InferenceUnavailable if the type of a marker's argument is unknown
   */
  @Nullable CapabilityInstance inferEffect(
      SyntaxNode tree, @Nullable Type expectedType, List<Diagnostic> diagnostics) {
    ImmutableList<SyntaxNode> markers = syntax.collectMarkers(tree);
    if (markers.isEmpty()) {
      diagnostics.add(
          Diagnostic.of(
              Kind.NO_MARKER_FOUND,
              tree.pos,
              "could not infer the effect type because %s is never used",
              syntax.unwrapName));
      return null;
    }
    CapabilityInstance inferred = null;
    boolean failed = false;
    boolean ambiguous = false;
    for (SyntaxNode marker : markers) {
      SyntaxNode arg = syntax.markerArgument(marker);
      Type type = attachment.requireType(arg);
      CapabilityInstance instance = resolve(Capability.EFFECT, type, syntax.strategy);
      if (instance == null) {
        diagnostics.add(
            Diagnostic.of(
                Kind.CAPABILITY_NOT_FOUND,
                arg.pos,
                "no %s instance found for %s",
                Capability.EFFECT,
                type));
        failed = true;
      } else if (inferred == null) {
        inferred = instance;
      } else if (!ambiguous && !inferred.sameEffect(instance)) {
        diagnostics.add(
            Diagnostic.of(
                Kind.AMBIGUOUS_EFFECT_TYPE,
                tree.pos,
                "cannot unwrap more than one effect type in a given %s block",
                syntax.effectfullyName));
        ambiguous = true;
      }
    }
    if (failed || ambiguous) {
      return null;
    }
    if (expectedType != null) {
      CapabilityInstance expected = resolve(Capability.EFFECT, expectedType, syntax.strategy);
      if (expected != null) {
        return expected;
      }
    }
    return inferred;
  }
}
