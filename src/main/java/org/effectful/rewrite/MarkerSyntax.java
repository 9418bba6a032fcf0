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
import com.google.common.collect.ImmutableSet;
import org.effectful.capability.ResolutionStrategy;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.SyntaxNode.Identifier;
import org.effectful.tree.SyntaxNode.MemberAccess;
import org.effectful.tree.SyntaxNode.TypeInstantiation;
import org.jspecify.annotations.Nullable;

/**
 * The names that identify one variant of the rewrite: the entry point, the marker function, and
 * the adapter conversion that enables the postfix marker. Markers are recognized purely by name;
 * a marker belonging to the other variant is just an ordinary call.
 *
 * <p>A marker occurrence takes one of these shapes (the implicit-argument layer is optional):
 *
 * <ul>
 *   <li>{@code unwrap(e)} or {@code ?unwrap(e)(instance)}
 *   <li>{@code conv(e).unwrap}, {@code conv(e).!}, or the same with {@code ?conv(e)(instance)}
 * </ul>
 *
 * where {@code e} is the effectful value. Qualified references such as {@code Markers.unwrap} are
 * accepted too.
 */
public final class MarkerSyntax {

  /** The names of the postfix operators on the adapter type. */
  public static final ImmutableSet<String> POSTFIX_OPERATORS = ImmutableSet.of("unwrap", "!");

  /** The default variant, whose effect types are single-parameter constructors. */
  public static final MarkerSyntax DIRECT =
      new MarkerSyntax(
          "effectfully", "unwrap", "effectfulToUnwrappable", ResolutionStrategy.DIRECT);

  /** The variant for effect types that must be decomposed to find their effect constructor. */
  public static final MarkerSyntax INDIRECT =
      new MarkerSyntax(
          "effectfullyU", "unwrapU", "effectfulToUnwrappableU", ResolutionStrategy.INDIRECT);

  /** The qualifier accepted in front of marker and conversion names. */
  static final String QUALIFIER = "Markers";

  public final String effectfullyName;
  public final String unwrapName;
  public final String conversionName;
  public final ResolutionStrategy strategy;

  public MarkerSyntax(
      String effectfullyName,
      String unwrapName,
      String conversionName,
      ResolutionStrategy strategy) {
    this.effectfullyName = effectfullyName;
    this.unwrapName = unwrapName;
    this.conversionName = conversionName;
    this.strategy = strategy;
  }

  /**
   * Returns the name that {@code node} refers to, looking through type instantiations and
   * (partial) applications: {@code f}, {@code f[T]}, {@code f(x)} and {@code M.f} all refer to
   * {@code f} (the last as {@code M.f}). Returns null if {@code node} isn't a reference to a name.
   */
  static @Nullable String symbolOf(SyntaxNode node) {
    switch (node.kind()) {
      case IDENTIFIER:
        return ((Identifier) node).name;
      case TYPE_INSTANTIATION:
        return symbolOf(((TypeInstantiation) node).function);
      case CALL:
        return symbolOf(((Call) node).function);
      case MEMBER_ACCESS:
        MemberAccess access = (MemberAccess) node;
        if (access.receiver instanceof Identifier) {
          return ((Identifier) access.receiver).name + "." + access.name;
        }
        return null;
      default:
        return null;
    }
  }

  private boolean refersTo(SyntaxNode node, String name) {
    String symbol = symbolOf(node);
    return symbol != null && (symbol.equals(name) || symbol.equals(QUALIFIER + "." + name));
  }

  /** Returns true if {@code node} refers to this variant's marker function. */
  public boolean isMarker(SyntaxNode node) {
    return refersTo(node, unwrapName);
  }

  /** Returns true if {@code node} refers to this variant's adapter conversion. */
  public boolean isConversion(SyntaxNode node) {
    return refersTo(node, conversionName);
  }

  /**
   * If {@code node} is a marker occurrence, returns the effectful expression it unwraps; otherwise
   * returns null.
   */
  public @Nullable SyntaxNode markerArgument(SyntaxNode node) {
    if (node instanceof Call) {
      return appliedArgument((Call) node, true);
    } else if (node instanceof MemberAccess) {
      MemberAccess access = (MemberAccess) node;
      if (POSTFIX_OPERATORS.contains(access.name) && access.receiver instanceof Call) {
        return appliedArgument((Call) access.receiver, false);
      }
    }
    return null;
  }

  /**
   * If {@code call} is {@code f(e)} or {@code ?f(e)(instance)} where {@code f} is the marker (if
   * {@code marker} is true) or the conversion (otherwise), returns {@code e}.
   */
  private @Nullable SyntaxNode appliedArgument(Call call, boolean marker) {
    if (call.callKind == Call.CallKind.IMPLICIT_ARGS && call.function instanceof Call) {
      call = (Call) call.function;
    }
    if (call.args.size() != 1 || call.function instanceof Call) {
      return null;
    }
    boolean matches = marker ? isMarker(call.function) : isConversion(call.function);
    return matches ? call.args.get(0) : null;
  }

  /** Returns true if {@code tree} contains a marker occurrence anywhere. */
  public boolean containsMarker(SyntaxNode tree) {
    if (markerArgument(tree) != null) {
      return true;
    }
    for (SyntaxNode child : tree.children()) {
      if (containsMarker(child)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns every marker occurrence in {@code tree}, in pre-order. Markers nested in the argument
   * of another marker are included, after the marker that contains them.
   */
  public ImmutableList<SyntaxNode> collectMarkers(SyntaxNode tree) {
    ImmutableList.Builder<SyntaxNode> builder = ImmutableList.builder();
    collectMarkers(tree, builder);
    return builder.build();
  }

  private void collectMarkers(SyntaxNode tree, ImmutableList.Builder<SyntaxNode> builder) {
    SyntaxNode arg = markerArgument(tree);
    if (arg != null) {
      builder.add(tree);
      collectMarkers(arg, builder);
      return;
    }
    for (SyntaxNode child : tree.children()) {
      collectMarkers(child, builder);
    }
  }

  @Override
  public String toString() {
    return effectfullyName;
  }
}
