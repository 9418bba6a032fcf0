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
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A Type is the host's description of the resolved type of a node. There are two subclasses:
 *
 * <ul>
 *   <li>{@link Applied}: a {@link TypeConstructor} applied to type arguments, e.g. {@code
 *       Option[Int]} or (with no arguments) {@code Int}; and
 *   <li>{@link Method}: the signature of something that can be called, which records for each
 *       parameter whether it is evaluated lazily (by name).
 * </ul>
 *
 * Types are immutable and compared structurally.
 */
public abstract class Type {

  public static final Type NOTHING = new Applied(TypeConstructor.NOTHING, ImmutableList.of());
  public static final Type ANY = new Applied(TypeConstructor.ANY, ImmutableList.of());
  public static final Type UNIT = new Applied(TypeConstructor.UNIT, ImmutableList.of());

  private Type() {}

  /** Returns {@code constructor} applied to {@code args}. */
  public static Applied of(TypeConstructor constructor, Type... args) {
    return of(constructor, Arrays.asList(args));
  }

  /** Returns {@code constructor} applied to {@code args}. */
  public static Applied of(TypeConstructor constructor, Iterable<? extends Type> args) {
    ImmutableList<Type> argList = ImmutableList.copyOf(args);
    Preconditions.checkArgument(
        argList.size() == constructor.arity,
        "%s expects %s type arguments, got %s",
        constructor,
        constructor.arity,
        argList.size());
    return new Applied(constructor, argList);
  }

  /** Returns a Method type with strict parameters. */
  public static Method method(Type result, Type... params) {
    return new Method(
        Arrays.stream(params)
            .map(t -> new Param(t, false))
            .collect(ImmutableList.toImmutableList()),
        result);
  }

  /** Returns a Method type with the given parameters. */
  public static Method method(Type result, ImmutableList<Param> params) {
    return new Method(params, result);
  }

  /** Returns true if this is the bottom type. */
  public boolean isNothing() {
    return this instanceof Applied && ((Applied) this).constructor == TypeConstructor.NOTHING;
  }

  /**
   * Removes any number of {@code FilteredView} layers, returning the type of the underlying
   * container.
   */
  public Type withoutFilteredView() {
    Type result = this;
    while (result instanceof Applied
        && ((Applied) result).constructor == TypeConstructor.FILTERED_VIEW) {
      result = ((Applied) result).args.get(1);
    }
    return result;
  }

  /** A TypeConstructor applied to a list of type arguments. */
  public static final class Applied extends Type {
    public final TypeConstructor constructor;
    public final ImmutableList<Type> args;

    private Applied(TypeConstructor constructor, ImmutableList<Type> args) {
      this.constructor = constructor;
      this.args = args;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      return obj instanceof Applied
          && ((Applied) obj).constructor == constructor
          && ((Applied) obj).args.equals(args);
    }

    @Override
    public int hashCode() {
      return constructor.hashCode() * 31 + args.hashCode();
    }

    @Override
    public String toString() {
      if (args.isEmpty()) {
        return constructor.name;
      }
      return args.stream()
          .map(Object::toString)
          .collect(Collectors.joining(", ", constructor.name + "[", "]"));
    }
  }

  /** One parameter of a {@link Method}. */
  public static final class Param {
    public final Type type;

    /** True if the argument for this parameter is evaluated lazily by the callee. */
    public final boolean byName;

    public Param(Type type, boolean byName) {
      this.type = type;
      this.byName = byName;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Param
          && ((Param) obj).byName == byName
          && ((Param) obj).type.equals(type);
    }

    @Override
    public int hashCode() {
      return type.hashCode() * 2 + (byName ? 1 : 0);
    }

    @Override
    public String toString() {
      return byName ? "=> " + type : type.toString();
    }
  }

  /** The type of a method or function: its parameters and result. */
  public static final class Method extends Type {
    public final ImmutableList<Param> params;
    public final Type result;

    private Method(ImmutableList<Param> params, Type result) {
      this.params = params;
      this.result = result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      return obj instanceof Method
          && ((Method) obj).params.equals(params)
          && ((Method) obj).result.equals(result);
    }

    @Override
    public int hashCode() {
      return params.hashCode() * 31 + result.hashCode();
    }

    @Override
    public String toString() {
      return params.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"))
          + result;
    }
  }
}
