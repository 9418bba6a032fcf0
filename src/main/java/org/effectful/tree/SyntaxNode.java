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
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A SyntaxNode is one node of the expression tree handed to the rewriter by the host. The set of
 * node shapes is closed; each has a nested final subclass and a corresponding {@link Kind}:
 *
 * <ul>
 *   <li>{@link Literal}: a constant
 *   <li>{@link Identifier}: a reference to a name
 *   <li>{@link Call}: a function or method applied to arguments
 *   <li>{@link TypeInstantiation}: a polymorphic function applied to explicit type arguments
 *   <li>{@link MemberAccess}: a member selected from a receiver
 *   <li>{@link LocalBinding}: a local value definition, used as a statement
 *   <li>{@link Block}: a list of statements followed by a result expression
 *   <li>{@link Conditional}: if/then/else
 *   <li>{@link PatternMatch}: a scrutinee matched against a list of cases
 *   <li>{@link TypeAscription}: an expression with an explicitly stated type
 *   <li>{@link Annotated}: an expression carrying an annotation
 *   <li>{@link FunctionLiteral}: an anonymous function
 * </ul>
 *
 * <p>SyntaxNodes are immutable. Each node owns its children; a tree never shares a node between
 * two parents (use {@link #copy} when a subtree must appear twice). Every node records its source
 * {@link Position} and, if the host's type checker has visited it, its resolved {@link Type}.
 */
public abstract class SyntaxNode {

  /** Identifies the concrete subclass of a SyntaxNode. */
  public enum Kind {
    LITERAL,
    IDENTIFIER,
    CALL,
    TYPE_INSTANTIATION,
    MEMBER_ACCESS,
    LOCAL_BINDING,
    BLOCK,
    CONDITIONAL,
    PATTERN_MATCH,
    TYPE_ASCRIPTION,
    ANNOTATED,
    FUNCTION_LITERAL
  }

  public final Position pos;

  /** The type assigned by the host's type checker, or null if this node has not been typed. */
  public final @Nullable Type type;

  private SyntaxNode(Position pos, @Nullable Type type) {
    this.pos = Preconditions.checkNotNull(pos);
    this.type = type;
  }

  public abstract Kind kind();

  /**
   * Returns this node's evaluated subexpressions, in the order a direct reading of the code would
   * evaluate them. Patterns are not included.
   */
  public abstract ImmutableList<SyntaxNode> children();

  /** Returns a node identical to this one except for its type. Children are shared, not copied. */
  public abstract SyntaxNode withType(@Nullable Type type);

  /** Returns a deep copy of this tree. */
  public abstract SyntaxNode copy();

  /** Calls {@code visitor} with this node and then (recursively) each of its descendants. */
  public final void forEachNode(Consumer<SyntaxNode> visitor) {
    visitor.accept(this);
    for (SyntaxNode child : children()) {
      child.forEachNode(visitor);
    }
  }

  /** Returns true if this node and each of its descendants has a type. */
  public final boolean isFullyTyped() {
    if (type == null) {
      return false;
    }
    for (SyntaxNode child : children()) {
      if (!child.isFullyTyped()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final String toString() {
    return TreePrinter.print(this);
  }

  private static @Nullable SyntaxNode copyOrNull(@Nullable SyntaxNode node) {
    return (node == null) ? null : node.copy();
  }

  private static ImmutableList<SyntaxNode> copyAll(ImmutableList<SyntaxNode> nodes) {
    return nodes.stream().map(SyntaxNode::copy).collect(ImmutableList.toImmutableList());
  }

  // Convenience constructors for synthetic nodes, which have no source position.

  public static Literal literal(@Nullable Object value) {
    return new Literal(Position.NONE, null, value);
  }

  public static Literal unit() {
    return new Literal(Position.NONE, null, Literal.UNIT);
  }

  public static Identifier ident(String name) {
    return new Identifier(Position.NONE, null, name);
  }

  public static Call call(SyntaxNode function, SyntaxNode... args) {
    return new Call(
        Position.NONE, null, function, ImmutableList.copyOf(args), Call.CallKind.REGULAR);
  }

  public static MemberAccess select(SyntaxNode receiver, String name) {
    return new MemberAccess(Position.NONE, null, receiver, name);
  }

  /** Returns {@code receiver.method(args)}. */
  public static Call callMethod(SyntaxNode receiver, String method, SyntaxNode... args) {
    return call(select(receiver, method), args);
  }

  public static FunctionLiteral lambda(String param, SyntaxNode body) {
    return new FunctionLiteral(
        Position.NONE, null, ImmutableList.of(new FunctionLiteral.Parameter(param, null)), body);
  }

  public static Block block(ImmutableList<SyntaxNode> statements, SyntaxNode result) {
    return new Block(Position.NONE, null, statements, result);
  }

  public static LocalBinding local(String name, SyntaxNode initializer) {
    return new LocalBinding(Position.NONE, null, name, null, initializer);
  }

  /** A constant value. */
  public static final class Literal extends SyntaxNode {
    /** The value of the unit literal, {@code ()}. */
    public static final Object UNIT =
        new Object() {
          @Override
          public String toString() {
            return "()";
          }
        };

    public final @Nullable Object value;

    public Literal(Position pos, @Nullable Type type, @Nullable Object value) {
      super(pos, type);
      this.value = value;
    }

    public boolean isUnit() {
      return value == UNIT;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    public Literal withType(@Nullable Type type) {
      return new Literal(pos, type, value);
    }

    @Override
    public Literal copy() {
      return withType(type);
    }
  }

  /** A reference to a local, parameter, or host-defined name. */
  public static final class Identifier extends SyntaxNode {
    public final String name;

    public Identifier(Position pos, @Nullable Type type, String name) {
      super(pos, type);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.IDENTIFIER;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of();
    }

    @Override
    public Identifier withType(@Nullable Type type) {
      return new Identifier(pos, type, name);
    }

    @Override
    public Identifier copy() {
      return withType(type);
    }
  }

  /** A function or method applied to a list of arguments. */
  public static final class Call extends SyntaxNode {

    /**
     * Distinguishes calls written by the user from those inserted by the host's type resolution.
     */
    public enum CallKind {
      /** A call that appears in the source. */
      REGULAR,
      /** The host filled in defaulted or implicit arguments; {@code function} is the real call. */
      IMPLICIT_ARGS,
      /** The host inserted a single-argument coercion around {@code args.get(0)}. */
      IMPLICIT_CONVERSION
    }

    public final SyntaxNode function;
    public final ImmutableList<SyntaxNode> args;
    public final CallKind callKind;

    public Call(
        Position pos,
        @Nullable Type type,
        SyntaxNode function,
        ImmutableList<SyntaxNode> args,
        CallKind callKind) {
      super(pos, type);
      this.function = Preconditions.checkNotNull(function);
      this.args = args;
      this.callKind = callKind;
      Preconditions.checkArgument(
          callKind != CallKind.IMPLICIT_CONVERSION || args.size() == 1,
          "An implicit conversion takes exactly one argument");
    }

    /** Returns a Call with the same position, type, and kind but a new function and arguments. */
    public Call with(SyntaxNode function, ImmutableList<SyntaxNode> args) {
      return new Call(pos, type, function, args, callKind);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>builder().add(function).addAll(args).build();
    }

    @Override
    public Call withType(@Nullable Type type) {
      return new Call(pos, type, function, args, callKind);
    }

    @Override
    public Call copy() {
      return new Call(pos, type, function.copy(), copyAll(args), callKind);
    }
  }

  /** A polymorphic function with explicit type arguments, e.g. {@code identity[Int]}. */
  public static final class TypeInstantiation extends SyntaxNode {
    public final SyntaxNode function;
    public final ImmutableList<Type> typeArgs;

    public TypeInstantiation(
        Position pos, @Nullable Type type, SyntaxNode function, ImmutableList<Type> typeArgs) {
      super(pos, type);
      this.function = Preconditions.checkNotNull(function);
      this.typeArgs = typeArgs;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_INSTANTIATION;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(function);
    }

    @Override
    public TypeInstantiation withType(@Nullable Type type) {
      return new TypeInstantiation(pos, type, function, typeArgs);
    }

    @Override
    public TypeInstantiation copy() {
      return new TypeInstantiation(pos, type, function.copy(), typeArgs);
    }
  }

  /** {@code receiver.name} */
  public static final class MemberAccess extends SyntaxNode {
    public final SyntaxNode receiver;
    public final String name;

    public MemberAccess(Position pos, @Nullable Type type, SyntaxNode receiver, String name) {
      super(pos, type);
      this.receiver = Preconditions.checkNotNull(receiver);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.MEMBER_ACCESS;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(receiver);
    }

    @Override
    public MemberAccess withType(@Nullable Type type) {
      return new MemberAccess(pos, type, receiver, name);
    }

    @Override
    public MemberAccess copy() {
      return new MemberAccess(pos, type, receiver.copy(), name);
    }
  }

  /** {@code val name: declaredType = initializer}, valid only as a statement in a Block. */
  public static final class LocalBinding extends SyntaxNode {
    public final String name;
    public final @Nullable Type declaredType;
    public final SyntaxNode initializer;

    public LocalBinding(
        Position pos,
        @Nullable Type type,
        String name,
        @Nullable Type declaredType,
        SyntaxNode initializer) {
      super(pos, type);
      this.name = Preconditions.checkNotNull(name);
      this.declaredType = declaredType;
      this.initializer = Preconditions.checkNotNull(initializer);
    }

    @Override
    public Kind kind() {
      return Kind.LOCAL_BINDING;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(initializer);
    }

    @Override
    public LocalBinding withType(@Nullable Type type) {
      return new LocalBinding(pos, type, name, declaredType, initializer);
    }

    @Override
    public LocalBinding copy() {
      return new LocalBinding(pos, type, name, declaredType, initializer.copy());
    }
  }

  /** {@code { statements; result }} */
  public static final class Block extends SyntaxNode {
    public final ImmutableList<SyntaxNode> statements;
    public final SyntaxNode result;

    public Block(
        Position pos,
        @Nullable Type type,
        ImmutableList<SyntaxNode> statements,
        SyntaxNode result) {
      super(pos, type);
      this.statements = statements;
      this.result = Preconditions.checkNotNull(result);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.<SyntaxNode>builder().addAll(statements).add(result).build();
    }

    @Override
    public Block withType(@Nullable Type type) {
      return new Block(pos, type, statements, result);
    }

    @Override
    public Block copy() {
      return new Block(pos, type, copyAll(statements), result.copy());
    }
  }

  /** {@code if (condition) thenBranch else elseBranch} */
  public static final class Conditional extends SyntaxNode {
    public final SyntaxNode condition;
    public final SyntaxNode thenBranch;

    /** A conditional written without an else branch has the unit literal here. */
    public final SyntaxNode elseBranch;

    public Conditional(
        Position pos,
        @Nullable Type type,
        SyntaxNode condition,
        SyntaxNode thenBranch,
        @Nullable SyntaxNode elseBranch) {
      super(pos, type);
      this.condition = Preconditions.checkNotNull(condition);
      this.thenBranch = Preconditions.checkNotNull(thenBranch);
      this.elseBranch =
          (elseBranch != null) ? elseBranch : new Literal(pos, Type.UNIT, Literal.UNIT);
    }

    @Override
    public Kind kind() {
      return Kind.CONDITIONAL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(condition, thenBranch, elseBranch);
    }

    @Override
    public Conditional withType(@Nullable Type type) {
      return new Conditional(pos, type, condition, thenBranch, elseBranch);
    }

    @Override
    public Conditional copy() {
      return new Conditional(pos, type, condition.copy(), thenBranch.copy(), elseBranch.copy());
    }
  }

  /** One case of a {@link PatternMatch}: {@code case pattern if guard => body}. */
  public static final class Case {
    public final Position pos;

    /**
     * The pattern is opaque to the rewriter; it is usually an Identifier (binding the scrutinee),
     * a Literal, or a Call describing an extractor.
     */
    public final SyntaxNode pattern;

    public final @Nullable SyntaxNode guard;
    public final SyntaxNode body;

    public Case(Position pos, SyntaxNode pattern, @Nullable SyntaxNode guard, SyntaxNode body) {
      this.pos = Preconditions.checkNotNull(pos);
      this.pattern = Preconditions.checkNotNull(pattern);
      this.guard = guard;
      this.body = Preconditions.checkNotNull(body);
    }

    /** Returns a Case with the same position and pattern but a new guard and body. */
    public Case with(@Nullable SyntaxNode guard, SyntaxNode body) {
      return new Case(pos, pattern, guard, body);
    }

    Case copy() {
      return new Case(pos, pattern.copy(), copyOrNull(guard), body.copy());
    }
  }

  /** {@code scrutinee match { cases }} */
  public static final class PatternMatch extends SyntaxNode {
    public final SyntaxNode scrutinee;
    public final ImmutableList<Case> cases;

    public PatternMatch(
        Position pos, @Nullable Type type, SyntaxNode scrutinee, ImmutableList<Case> cases) {
      super(pos, type);
      this.scrutinee = Preconditions.checkNotNull(scrutinee);
      this.cases = cases;
    }

    @Override
    public Kind kind() {
      return Kind.PATTERN_MATCH;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      ImmutableList.Builder<SyntaxNode> builder = ImmutableList.builder();
      builder.add(scrutinee);
      for (Case c : cases) {
        if (c.guard != null) {
          builder.add(c.guard);
        }
        builder.add(c.body);
      }
      return builder.build();
    }

    @Override
    public PatternMatch withType(@Nullable Type type) {
      return new PatternMatch(pos, type, scrutinee, cases);
    }

    @Override
    public PatternMatch copy() {
      return new PatternMatch(
          pos,
          type,
          scrutinee.copy(),
          cases.stream().map(Case::copy).collect(ImmutableList.toImmutableList()));
    }
  }

  /** {@code (inner: ascribed)} */
  public static final class TypeAscription extends SyntaxNode {
    public final SyntaxNode inner;
    public final Type ascribed;

    public TypeAscription(Position pos, @Nullable Type type, SyntaxNode inner, Type ascribed) {
      super(pos, type);
      this.inner = Preconditions.checkNotNull(inner);
      this.ascribed = Preconditions.checkNotNull(ascribed);
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_ASCRIPTION;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(inner);
    }

    @Override
    public TypeAscription withType(@Nullable Type type) {
      return new TypeAscription(pos, type, inner, ascribed);
    }

    @Override
    public TypeAscription copy() {
      return new TypeAscription(pos, type, inner.copy(), ascribed);
    }
  }

  /** {@code (inner: @annotation)} */
  public static final class Annotated extends SyntaxNode {
    public final SyntaxNode inner;
    public final String annotation;

    public Annotated(Position pos, @Nullable Type type, SyntaxNode inner, String annotation) {
      super(pos, type);
      this.inner = Preconditions.checkNotNull(inner);
      this.annotation = Preconditions.checkNotNull(annotation);
    }

    @Override
    public Kind kind() {
      return Kind.ANNOTATED;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(inner);
    }

    @Override
    public Annotated withType(@Nullable Type type) {
      return new Annotated(pos, type, inner, annotation);
    }

    @Override
    public Annotated copy() {
      return new Annotated(pos, type, inner.copy(), annotation);
    }
  }

  /** {@code (params) => body} */
  public static final class FunctionLiteral extends SyntaxNode {

    /** A parameter of a FunctionLiteral; the declared type may be omitted. */
    public static final class Parameter {
      public final String name;
      public final @Nullable Type declaredType;

      public Parameter(String name, @Nullable Type declaredType) {
        this.name = Preconditions.checkNotNull(name);
        this.declaredType = declaredType;
      }

      @Override
      public String toString() {
        return (declaredType == null) ? name : name + ": " + declaredType;
      }
    }

    public final ImmutableList<Parameter> params;
    public final SyntaxNode body;

    public FunctionLiteral(
        Position pos, @Nullable Type type, ImmutableList<Parameter> params, SyntaxNode body) {
      super(pos, type);
      this.params = params;
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_LITERAL;
    }

    @Override
    public ImmutableList<SyntaxNode> children() {
      return ImmutableList.of(body);
    }

    @Override
    public FunctionLiteral withType(@Nullable Type type) {
      return new FunctionLiteral(pos, type, params, body);
    }

    @Override
    public FunctionLiteral copy() {
      return new FunctionLiteral(pos, type, params, body.copy());
    }
  }
}
