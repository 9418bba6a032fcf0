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

import static org.effectful.tree.SyntaxNode.callMethod;
import static org.effectful.tree.SyntaxNode.ident;
import static org.effectful.tree.SyntaxNode.lambda;
import static org.effectful.tree.SyntaxNode.unit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.effectful.capability.Capability;
import org.effectful.capability.CapabilityInstance;
import org.effectful.capability.ResolutionStrategy;
import org.effectful.tree.Position;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.SyntaxNode.FunctionLiteral;
import org.effectful.tree.SyntaxNode.MemberAccess;
import org.effectful.tree.SyntaxNode.TypeInstantiation;
import org.effectful.tree.Type;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites calls of higher-order container methods whose function argument unwraps effects. The
 * effect must be sequenced once per element, which a single {@code bind} can't do, so the call is
 * replaced by a traversal of the container:
 *
 * <pre>{@code
 * c.map(x => body)         T.traverse(E, c, x => body')
 * c.flatMap(x => body)     E.map(T.traverse(E, c, x => body'), v => C.join(v))
 * c.foreach(x => body)     E.map(T.traverse(E, c, x => body'), v => ())
 * c.filter(x => body)      T.filterM(E, c, x => body')
 * }</pre>
 *
 * where {@code body'} is the effect code for {@code body}, {@code E} is the block's effect
 * instance, {@code T} is the container instance for {@code c}'s type, and {@code C} is the effect
 * instance of the container itself. {@code withFilter} is treated like {@code filter}.
 *
 * <p>The result is an effectful value, so it is bound to a fresh name just as if it had been
 * unwrapped, after any bindings extracted from the receiver.
 */
final class HigherOrderRewriter {

  /** The methods this class knows how to rewrite. */
  static final ImmutableSet<String> METHODS =
      ImmutableSet.of("map", "flatMap", "foreach", "filter", "withFilter");

  private final BindingExtractor extractor;
  private final CapabilityResolver resolver;
  private final TypeAttachment attachment;
  private final CodeGenerator codegen;
  private final NameAllocator names;
  private final MarkerSyntax syntax;

  HigherOrderRewriter(
      BindingExtractor extractor,
      CapabilityResolver resolver,
      TypeAttachment attachment,
      CodeGenerator codegen,
      NameAllocator names,
      MarkerSyntax syntax) {
    this.extractor = extractor;
    this.resolver = resolver;
    this.attachment = attachment;
    this.codegen = codegen;
    this.names = names;
    this.syntax = syntax;
  }

  /** The parts of {@code receiver.method(param => body)}. */
  static final class HofCall {
    final Call call;
    final SyntaxNode receiver;
    final String method;
    final FunctionLiteral function;

    HofCall(Call call, SyntaxNode receiver, String method, FunctionLiteral function) {
      this.call = call;
      this.receiver = receiver;
      this.method = method;
      this.function = function;
    }
  }

  /**
   * If {@code node} is a call of a method with a single one-parameter function literal as its
   * argument, returns its parts; otherwise returns null. Type instantiations around the call or
   * its method are ignored.
   */
  static @Nullable HofCall match(SyntaxNode node) {
    if (node instanceof TypeInstantiation) {
      return match(((TypeInstantiation) node).function);
    } else if (!(node instanceof Call)) {
      return null;
    }
    Call call = (Call) node;
    if (call.args.size() != 1 || !(call.args.get(0) instanceof FunctionLiteral)) {
      return null;
    }
    FunctionLiteral function = (FunctionLiteral) call.args.get(0);
    if (function.params.size() != 1) {
      return null;
    }
    SyntaxNode selector = call.function;
    while (selector instanceof TypeInstantiation) {
      selector = ((TypeInstantiation) selector).function;
    }
    if (!(selector instanceof MemberAccess)) {
      return null;
    }
    MemberAccess access = (MemberAccess) selector;
    return new HofCall(call, access.receiver, access.name, function);
  }

  /**
   * If {@code node} is a call this class can rewrite and its function body contains a marker,
   * returns the bindings and residual that replace it; otherwise returns null.
   */
  @Nullable BindGroup rewrite(SyntaxNode node) {
    HofCall hof = match(node);
    if (hof == null
        || !METHODS.contains(hof.method)
        || !syntax.containsMarker(hof.function.body)) {
      return null;
    }
    BindGroup receiverGroup = extractor.extract(hof.receiver);
    SyntaxNode receiver = withFilterToFilter(receiverGroup.residual);
    FunctionLiteral function =
        new FunctionLiteral(
            hof.function.pos,
            null,
            hof.function.params,
            extractor.toEffect(hof.function.body));

    Type containerType = attachment.requireType(receiver).withoutFilteredView();
    Position pos = attachment.sourcePos(receiver);
    CapabilityInstance container =
        resolver.resolveOrFail(
            Capability.CONTAINER, containerType, ResolutionStrategy.DIRECT, pos);
    SyntaxNode rewritten;
    switch (hof.method) {
      case "map":
        rewritten = traverse(container, receiver, function);
        break;
      case "flatMap":
        CapabilityInstance flatten =
            resolver.resolveOrFail(
                Capability.EFFECT, containerType, ResolutionStrategy.DIRECT, pos);
        String nested = names.fresh();
        rewritten =
            codegen.map(
                traverse(container, receiver, function),
                lambda(nested, callMethod(flatten.reference(), "join", ident(nested))));
        break;
      case "foreach":
        rewritten =
            codegen.map(traverse(container, receiver, function), lambda(names.fresh(), unit()));
        break;
      default:
        rewritten =
            callMethod(container.reference(), "filterM", codegen.effect(), receiver, function);
        break;
    }
    return extractor.bindNew(receiverGroup.bindings, rewritten, node);
  }

  private SyntaxNode traverse(
      CapabilityInstance container, SyntaxNode receiver, FunctionLiteral function) {
    return callMethod(container.reference(), "traverse", codegen.effect(), receiver, function);
  }

  /**
   * If {@code receiver} is a call of {@code withFilter}, returns the equivalent call of {@code
   * filter}, which produces a container rather than a filtered view; otherwise returns {@code
   * receiver}.
   */
  private SyntaxNode withFilterToFilter(SyntaxNode receiver) {
    HofCall hof = match(receiver);
    if (hof == null || !hof.method.equals("withFilter")) {
      return receiver;
    }
    MemberAccess filter = new MemberAccess(hof.call.pos, null, hof.receiver, "filter");
    Call result =
        new Call(
            hof.call.pos, null, filter, ImmutableList.of(hof.function), Call.CallKind.REGULAR);
    return attachment.copy(receiver, result);
  }
}
