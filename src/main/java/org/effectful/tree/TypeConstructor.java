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

package org.effectful.tree;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A TypeConstructor is a named type with a fixed number of type parameters (its arity) and an
 * ordered list of direct supertypes. TypeConstructors are compared by identity; the host creates
 * exactly one instance for each type it describes.
 *
 * <p>The linearization of a TypeConstructor lists it and all of its supertypes from most to least
 * specific. It is computed once, when the TypeConstructor is created: the constructor itself comes
 * first, followed by the linearization of each parent in declaration order, and when a supertype
 * is reachable along more than one path only its last occurrence is kept (so a common ancestor
 * such as {@link #ANY} ends up after everything that extends it).
 */
public final class TypeConstructor {

  /** The top type. */
  public static final TypeConstructor ANY = new TypeConstructor("Any", 0, ImmutableList.of());

  /**
   * The bottom type. Hosts use it for expressions whose type has not been inferred yet, and it
   * never has capability instances.
   */
  public static final TypeConstructor NOTHING =
      new TypeConstructor("Nothing", 0, ImmutableList.of());

  /** The type of the unit value. */
  public static final TypeConstructor UNIT = new TypeConstructor("Unit", 0, ImmutableList.of(ANY));

  /**
   * {@code FilteredView[E, C]} is the type of a lazy filter-like call (e.g. {@code
   * c.withFilter(p)}) over a container of type {@code C} with elements {@code E}. It has no
   * capabilities of its own; capability lookups use {@code C} instead.
   */
  public static final TypeConstructor FILTERED_VIEW =
      new TypeConstructor("FilteredView", 2, ImmutableList.of(ANY));

  public final String name;
  public final int arity;
  public final ImmutableList<TypeConstructor> parents;
  private final ImmutableList<TypeConstructor> linearization;

  private TypeConstructor(String name, int arity, ImmutableList<TypeConstructor> parents) {
    this.name = name;
    this.arity = arity;
    this.parents = parents;
    this.linearization = linearize(this, parents);
  }

  /** Returns a new TypeConstructor with the given parents. */
  public static TypeConstructor of(String name, int arity, TypeConstructor... parents) {
    Preconditions.checkArgument(arity >= 0, "Negative arity");
    return new TypeConstructor(name, arity, ImmutableList.copyOf(parents));
  }

  private static ImmutableList<TypeConstructor> linearize(
      TypeConstructor self, List<TypeConstructor> parents) {
    List<TypeConstructor> all = new ArrayList<>();
    all.add(self);
    for (TypeConstructor parent : parents) {
      all.addAll(parent.linearization);
    }
    // Keep the last occurrence of each element: walk backwards, then reverse.
    LinkedHashSet<TypeConstructor> seen = new LinkedHashSet<>();
    for (int i = all.size() - 1; i >= 0; i--) {
      seen.add(all.get(i));
    }
    return ImmutableList.copyOf(seen).reverse();
  }

  /** Returns this TypeConstructor followed by all of its supertypes, most specific first. */
  public ImmutableList<TypeConstructor> linearization() {
    return linearization;
  }

  /** Returns true if {@code other} appears in this TypeConstructor's linearization. */
  public boolean isSubtypeOf(TypeConstructor other) {
    return linearization.contains(other);
  }

  @Override
  public String toString() {
    return name;
  }
}
