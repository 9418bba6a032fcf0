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

package org.effectful.testing;

import static org.effectful.tree.SyntaxNode.ident;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.effectful.Effectful;
import org.effectful.Markers;
import org.effectful.capability.Capability;
import org.effectful.capability.CapabilityRegistry;
import org.effectful.testing.Interpreter.Builtin;
import org.effectful.testing.TestTyper.ResultRule;
import org.effectful.tree.Type;
import org.effectful.tree.TypeConstructor;

/**
 * A small host language for tests: its types, the functions and objects in scope, a type checker
 * and interpreter that agree on them, and a registry of capability instances.
 *
 * <p>Functions in scope:
 *
 * <ul>
 *   <li>{@code some(x)}, {@code none()}: optional values ({@code Some[A]}, {@code None}, both
 *       subtypes of {@code Opt})
 *   <li>{@code seq(x, ...)}: a {@code Seq}
 *   <li>{@code right(x)}, {@code left(msg)}: {@code Either[String, A]}; {@code fail(code)} is an
 *       {@code Either[Int, Nothing]}
 *   <li>{@code add}, {@code mul}, {@code gt}: integer arithmetic and comparison
 *   <li>{@code double(x)} is {@code some(2 * x)}; {@code half(x)} is {@code some(x / 2)} if x is
 *       even, otherwise {@code none()}; {@code isEven(x)} is {@code some(x % 2 == 0)}
 *   <li>{@code tick(label, x)} records {@code label} in the interpreter's trace and returns x
 *   <li>{@code orElse(x, => y)}: x unless it is {@code none()}, in which case y; y is by-name
 *   <li>the markers and conversions of both variants
 * </ul>
 *
 * and the objects {@code OptMonad}, {@code SeqMonad}, {@code EitherMonad}, {@code SeqTraverse},
 * and {@code Markers}.
 */
public final class TestHost {

  private TestHost() {}

  public static final TypeConstructor INT = TypeConstructor.of("Int", 0, TypeConstructor.ANY);
  public static final TypeConstructor BOOLEAN =
      TypeConstructor.of("Boolean", 0, TypeConstructor.ANY);
  public static final TypeConstructor STRING =
      TypeConstructor.of("String", 0, TypeConstructor.ANY);

  public static final TypeConstructor OPT = TypeConstructor.of("Opt", 1, TypeConstructor.ANY);
  public static final TypeConstructor SOME = TypeConstructor.of("Some", 1, OPT);
  public static final TypeConstructor NONE = TypeConstructor.of("None", 0, OPT);
  public static final TypeConstructor SEQ = TypeConstructor.of("Seq", 1, TypeConstructor.ANY);
  public static final TypeConstructor EITHER =
      TypeConstructor.of("Either", 2, TypeConstructor.ANY);
  public static final TypeConstructor LEFT = TypeConstructor.of("Left", 2, EITHER);
  public static final TypeConstructor RIGHT = TypeConstructor.of("Right", 2, EITHER);
  public static final TypeConstructor UNWRAPPABLE =
      TypeConstructor.of("Unwrappable", 1, TypeConstructor.ANY);

  // The types of the host objects.
  public static final TypeConstructor OPT_MONAD =
      TypeConstructor.of("OptMonad", 0, TypeConstructor.ANY);
  public static final TypeConstructor SEQ_MONAD =
      TypeConstructor.of("SeqMonad", 0, TypeConstructor.ANY);
  public static final TypeConstructor EITHER_MONAD =
      TypeConstructor.of("EitherMonad", 0, TypeConstructor.ANY);
  public static final TypeConstructor SEQ_TRAVERSE =
      TypeConstructor.of("SeqTraverse", 0, TypeConstructor.ANY);
  public static final TypeConstructor MARKERS =
      TypeConstructor.of("Markers", 0, TypeConstructor.ANY);

  public static final Type INT_TYPE = Type.of(INT);
  public static final Type BOOLEAN_TYPE = Type.of(BOOLEAN);
  public static final Type STRING_TYPE = Type.of(STRING);

  public static Type opt(Type t) {
    return Type.of(OPT, t);
  }

  public static Type seq(Type t) {
    return Type.of(SEQ, t);
  }

  public static Type either(Type left, Type right) {
    return Type.of(EITHER, left, right);
  }

  /** Returns the last type argument of {@code type}, or Nothing if it has none. */
  public static Type carried(Type type) {
    if (type instanceof Type.Applied) {
      ImmutableList<Type> args = ((Type.Applied) type).args;
      if (!args.isEmpty()) {
        return args.get(args.size() - 1);
      }
    }
    return Type.NOTHING;
  }

  /** Returns {@code type} with its last type argument replaced by {@code carried}. */
  static Type replaceCarried(Type type, Type carried) {
    if (!(type instanceof Type.Applied) || ((Type.Applied) type).args.isEmpty()) {
      return Type.ANY;
    }
    Type.Applied applied = (Type.Applied) type;
    ImmutableList<Type> args =
        ImmutableList.<Type>builder()
            .addAll(applied.args.subList(0, applied.args.size() - 1))
            .add(carried)
            .build();
    return Type.of(applied.constructor, args);
  }

  /** Returns the result type of a function type, or Any. */
  static Type resultOf(Type fn) {
    return (fn instanceof Type.Method) ? ((Type.Method) fn).result : Type.ANY;
  }

  /** The standard registry: effect instances for Opt, Seq and Either, and Seq traversal. */
  public static CapabilityRegistry registry() {
    return registryBuilder().build();
  }

  public static CapabilityRegistry.Builder registryBuilder() {
    return CapabilityRegistry.builder()
        .register(Capability.EFFECT, OPT, ident("OptMonad"))
        .register(Capability.EFFECT, SEQ, ident("SeqMonad"))
        .register(Capability.EFFECT, EITHER, ident("EitherMonad"))
        .register(Capability.CONTAINER, SEQ, ident("SeqTraverse"))
        .decomposeAt(EITHER, 1);
  }

  /** Returns a Host with a new TestTyper and the standard registry. */
  public static Effectful.Host host() {
    return new Effectful.Host(typer(), registry());
  }

  private static Type.Method strict(Type result, int numParams) {
    Type[] params = new Type[numParams];
    Arrays.fill(params, Type.ANY);
    return Type.method(result, params);
  }

  private static ResultRule fixed(Type result) {
    return (receiver, args) -> result;
  }

  private static ResultRule fromArg(int index, UnaryOperator<Type> fn) {
    return (receiver, args) -> (index < args.size()) ? fn.apply(args.get(index)) : Type.ANY;
  }

  private static ResultRule fromReceiver(UnaryOperator<Type> fn) {
    return (receiver, args) -> fn.apply(receiver);
  }

  public static TestTyper typer() {
    TestTyper.Builder builder =
        TestTyper.builder()
            .function("some", strict(Type.ANY, 1), fromArg(0, t -> Type.of(SOME, t)))
            .function("none", strict(Type.of(NONE), 0), fixed(Type.of(NONE)))
            .function("seq", strict(Type.ANY, 0), fromArg(0, TestHost::seq))
            .function(
                "right", strict(Type.ANY, 1), fromArg(0, t -> Type.of(RIGHT, STRING_TYPE, t)))
            .function(
                "left", strict(Type.ANY, 1), fixed(Type.of(LEFT, STRING_TYPE, Type.NOTHING)))
            .function("fail", strict(Type.ANY, 1), fixed(Type.of(LEFT, INT_TYPE, Type.NOTHING)))
            .function("add", Type.method(INT_TYPE, INT_TYPE, INT_TYPE), fixed(INT_TYPE))
            .function("mul", Type.method(INT_TYPE, INT_TYPE, INT_TYPE), fixed(INT_TYPE))
            .function("gt", Type.method(BOOLEAN_TYPE, INT_TYPE, INT_TYPE), fixed(BOOLEAN_TYPE))
            .function("double", Type.method(opt(INT_TYPE), INT_TYPE), fixed(opt(INT_TYPE)))
            .function("half", Type.method(opt(INT_TYPE), INT_TYPE), fixed(opt(INT_TYPE)))
            .function(
                "isEven", Type.method(opt(BOOLEAN_TYPE), INT_TYPE), fixed(opt(BOOLEAN_TYPE)))
            .function("tick", strict(Type.ANY, 2), fromArg(1, t -> t))
            .function(
                "orElse",
                Type.method(
                    Type.ANY,
                    ImmutableList.of(
                        new Type.Param(Type.ANY, false), new Type.Param(Type.ANY, true))),
                fromArg(0, t -> t))
            .value("OptMonad", Type.of(OPT_MONAD))
            .value("SeqMonad", Type.of(SEQ_MONAD))
            .value("EitherMonad", Type.of(EITHER_MONAD))
            .value("SeqTraverse", Type.of(SEQ_TRAVERSE))
            .value("Markers", Type.of(MARKERS));
    for (String unwrap : ImmutableList.of("unwrap", "unwrapU")) {
      builder.function(unwrap, strict(Type.ANY, 1), fromArg(0, TestHost::carried));
      builder.member(MARKERS, unwrap, strict(Type.ANY, 1), fromArg(0, TestHost::carried));
    }
    for (String conv : ImmutableList.of("effectfulToUnwrappable", "effectfulToUnwrappableU")) {
      builder.function(conv, strict(Type.ANY, 1), fromArg(0, t -> Type.of(UNWRAPPABLE, t)));
      builder.member(MARKERS, conv, strict(Type.ANY, 1), fromArg(0, t -> Type.of(UNWRAPPABLE, t)));
    }
    for (String op : ImmutableList.of("unwrap", "!")) {
      builder.member(UNWRAPPABLE, op, strict(Type.ANY, 0), fromReceiver(r -> carried(carried(r))));
    }
    addMonadMembers(builder, OPT_MONAD, TestHost::opt);
    addMonadMembers(builder, SEQ_MONAD, TestHost::seq);
    addMonadMembers(builder, EITHER_MONAD, t -> either(Type.ANY, t));
    builder
        .member(
            SEQ_TRAVERSE,
            "traverse",
            strict(Type.ANY, 3),
            (receiver, args) -> {
              Type effect = resultOf(args.get(2));
              return replaceCarried(effect, seq(carried(effect)));
            })
        .member(
            SEQ_TRAVERSE,
            "filterM",
            strict(Type.ANY, 3),
            (receiver, args) ->
                replaceCarried(resultOf(args.get(2)), args.get(1).withoutFilteredView()));
    for (TypeConstructor container : ImmutableList.of(SEQ, TypeConstructor.FILTERED_VIEW)) {
      builder
          .member(container, "map", strict(Type.ANY, 1), fromArg(0, t -> seq(resultOf(t))))
          .member(container, "flatMap", strict(Type.ANY, 1), fromArg(0, TestHost::resultOf))
          .member(container, "foreach", strict(Type.UNIT, 1), fixed(Type.UNIT));
    }
    builder
        .member(SEQ, "filter", strict(Type.ANY, 1), fromReceiver(r -> r))
        .member(
            SEQ,
            "withFilter",
            strict(Type.ANY, 1),
            fromReceiver(r -> Type.of(TypeConstructor.FILTERED_VIEW, carried(r), r)));
    return builder.build();
  }

  private static void addMonadMembers(
      TestTyper.Builder builder, TypeConstructor monad, UnaryOperator<Type> wrap) {
    builder
        .member(monad, "pure", strict(Type.ANY, 1), fromArg(0, wrap))
        .member(monad, "bind", strict(Type.ANY, 2), fromArg(1, TestHost::resultOf))
        .member(monad, "map", strict(Type.ANY, 2), fromArg(1, t -> wrap.apply(resultOf(t))))
        .member(monad, "join", strict(Type.ANY, 1), fromArg(0, TestHost::carried));
  }

  /** Returns an interpreter for the functions and objects described above. */
  @SuppressWarnings("unchecked")
  public static Interpreter interpreter() {
    Interpreter interpreter = new Interpreter();
    interpreter
        .define("some", Builtin.strict(args -> Opt.some(args.get(0))))
        .define("none", Builtin.strict(args -> Opt.none()))
        .define("seq", Builtin.strict(args -> Seq.copyOf(args)))
        .define("right", Builtin.strict(args -> Either.right(args.get(0))))
        .define("left", Builtin.strict(args -> Either.left(args.get(0))))
        .define("fail", Builtin.strict(args -> Either.left(args.get(0))))
        .define("add", Builtin.strict(args -> (Integer) args.get(0) + (Integer) args.get(1)))
        .define("mul", Builtin.strict(args -> (Integer) args.get(0) * (Integer) args.get(1)))
        .define("gt", Builtin.strict(args -> (Integer) args.get(0) > (Integer) args.get(1)))
        .define("double", Builtin.strict(args -> Opt.some(2 * (Integer) args.get(0))))
        .define(
            "half",
            Builtin.strict(
                args -> {
                  int x = (Integer) args.get(0);
                  return (x % 2 == 0) ? Opt.some(x / 2) : Opt.none();
                }))
        .define("isEven", Builtin.strict(args -> Opt.some((Integer) args.get(0) % 2 == 0)))
        .define(
            "tick",
            Builtin.strict(
                args -> {
                  interpreter.trace.add((String) args.get(0));
                  return args.get(1);
                }))
        .define(
            "orElse",
            Builtin.withByName(
                ImmutableSet.of(1),
                args -> {
                  Opt first = (Opt) args.get(0);
                  return first.isPresent() ? first : ((Supplier<Object>) args.get(1)).get();
                }))
        .define("unwrap", Builtin.strict(args -> Markers.unwrap(args.get(0))))
        .define("unwrapU", Builtin.strict(args -> Markers.unwrapU(args.get(0))))
        .define(
            "effectfulToUnwrappable",
            Builtin.strict(args -> Markers.effectfulToUnwrappable(args.get(0))))
        .define(
            "effectfulToUnwrappableU",
            Builtin.strict(args -> Markers.effectfulToUnwrappableU(args.get(0))))
        .define("OptMonad", new Instances.OptMonad())
        .define("SeqMonad", new Instances.SeqMonad())
        .define("EitherMonad", new Instances.EitherMonad())
        .define("SeqTraverse", new Instances.SeqTraverse())
        .define("Markers", Markers.class);
    return interpreter;
  }
}
