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
import java.util.stream.Collectors;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;
import org.jspecify.annotations.Nullable;

/**
 * A Decomposition views a concrete type as "effect F applied to a carried value type A", where F
 * is {@code constructor} with all of its parameters except one fixed to {@code fixedArgs}. For
 * example {@code Either[String, Int]} decomposes to {@code F = Either[String, _]} and {@code A =
 * Int}; {@code Option[Int]} decomposes to {@code F = Option} and {@code A = Int}.
 *
 * <p>Two Decompositions describe the same effect if they have the same constructor and fixed
 * arguments; the carried type is ignored by {@link #sameEffect}.
 */
public final class Decomposition {
  public final TypeConstructor constructor;
  public final ImmutableList<Type> fixedArgs;

  /** The index of the carried parameter among the constructor's parameters. */
  public final int carriedIndex;

  public final Type carried;

  public Decomposition(
      TypeConstructor constructor, ImmutableList<Type> fixedArgs, int carriedIndex, Type carried) {
    Preconditions.checkArgument(fixedArgs.size() + 1 == constructor.arity);
    Preconditions.checkElementIndex(carriedIndex, constructor.arity);
    this.constructor = constructor;
    this.fixedArgs = fixedArgs;
    this.carriedIndex = carriedIndex;
    this.carried = carried;
  }

  /**
   * Decomposes a type whose constructor has a single parameter, or returns null if its constructor
   * has some other arity.
   */
  public static @Nullable Decomposition ofSingleParameter(Type.Applied type) {
    if (type.constructor.arity != 1) {
      return null;
    }
    return new Decomposition(type.constructor, ImmutableList.of(), 0, type.args.get(0));
  }

  /**
   * Decomposes {@code type} by treating the argument at {@code carriedIndex} as the carried type
   * and all others as fixed.
   */
  public static Decomposition carryingArg(Type.Applied type, int carriedIndex) {
    ImmutableList.Builder<Type> fixed = ImmutableList.builder();
    for (int i = 0; i < type.args.size(); i++) {
      if (i != carriedIndex) {
        fixed.add(type.args.get(i));
      }
    }
    return new Decomposition(
        type.constructor, fixed.build(), carriedIndex, type.args.get(carriedIndex));
  }

  /** Returns true if {@code other} describes the same effect as this. */
  public boolean sameEffect(Decomposition other) {
    return constructor == other.constructor && fixedArgs.equals(other.fixedArgs);
  }

  /** Renders the effect with {@code _} in place of the carried parameter. */
  public String effectName() {
    if (constructor.arity == 1) {
      return constructor.name;
    }
    ImmutableList.Builder<String> args = ImmutableList.builder();
    int fixed = 0;
    for (int i = 0; i < constructor.arity; i++) {
      args.add(i == carriedIndex ? "_" : fixedArgs.get(fixed++).toString());
    }
    return args.build().stream().collect(Collectors.joining(", ", constructor.name + "[", "]"));
  }

  @Override
  public String toString() {
    return effectName() + " carrying " + carried;
  }
}
