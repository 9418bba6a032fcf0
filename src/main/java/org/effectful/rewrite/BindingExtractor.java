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
import org.effectful.rewrite.BindGroup.Binding;
import org.effectful.rewrite.Diagnostic.Kind;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Annotated;
import org.effectful.tree.SyntaxNode.Block;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.SyntaxNode.Case;
import org.effectful.tree.SyntaxNode.Conditional;
import org.effectful.tree.SyntaxNode.Identifier;
import org.effectful.tree.SyntaxNode.LocalBinding;
import org.effectful.tree.SyntaxNode.MemberAccess;
import org.effectful.tree.SyntaxNode.PatternMatch;
import org.effectful.tree.SyntaxNode.TypeAscription;
import org.effectful.tree.SyntaxNode.TypeInstantiation;
import org.effectful.tree.Type;
import org.jspecify.annotations.Nullable;

/**
 * Hoists the effectful subexpressions of a tree into an ordered list of bindings.
 *
 * <p>{@link #extract} takes a node of some value type {@code A} and returns a {@link BindGroup}
 * whose residual also has type {@code A}, with each marker occurrence replaced by a reference to
 * the fresh name its argument is bound to. Bindings appear in the order a direct reading of the
 * code would evaluate them: a function before its arguments, arguments left to right, a receiver
 * before the member selected from it, a condition before its branches.
 *
 * <p>Code whose evaluation is conditional or deferred is never hoisted out:
 *
 * <ul>
 *   <li>the arguments of by-name parameters are left as they are;
 *   <li>the branches of a conditional and the guards and bodies of cases are each turned into a
 *       complete effectful expression, and the resulting conditional or match is bound as a whole;
 *       and
 *   <li>a marker anywhere else that effects can't be sequenced (e.g. inside a function literal that
 *       isn't handled by {@link HigherOrderRewriter}) is reported as an error and left in place.
 * </ul>
 *
 * <p>Subtrees that contain no marker are returned unchanged with no bindings.
 */
final class BindingExtractor {
  private final MarkerSyntax syntax;
  private final TypeAttachment attachment;
  private final CodeGenerator codegen;
  private final NameAllocator names;
  private final HigherOrderRewriter hofRewriter;

  /** Errors found so far; each one only stops the extraction of the node it was found in. */
  private final List<Diagnostic> diagnostics;

  BindingExtractor(
      MarkerSyntax syntax,
      TypeAttachment attachment,
      CapabilityResolver resolver,
      CodeGenerator codegen,
      NameAllocator names,
      List<Diagnostic> diagnostics) {
    this.syntax = syntax;
    this.attachment = attachment;
    this.codegen = codegen;
    this.names = names;
    this.diagnostics = diagnostics;
    this.hofRewriter =
        new HigherOrderRewriter(this, resolver, attachment, codegen, names, syntax);
  }

  /**
   * Returns an expression of type {@code M[A]} that evaluates {@code node} (of type {@code A}),
   * performing the effects of its markers.
   */
  SyntaxNode toEffect(SyntaxNode node) {
    return codegen.generate(extract(node), true);
  }

  /**
   * Returns the bindings and residual for {@code node}. An error in some part of {@code node} is
   * added to the diagnostics, and that part is returned unchanged.
   */
  BindGroup extract(SyntaxNode node) {
    if (!syntax.containsMarker(node)) {
      return BindGroup.of(node);
    }
    BindGroup result;
    try {
      result = extractUnwrap(node);
      if (result == null) {
        result = hofRewriter.rewrite(node);
        if (result == null) {
          result = extractOther(node);
        }
      }
    } catch (RewriteError e) {
      // The node is left as it is and extraction continues with its siblings.
      diagnostics.add(e.diagnostic);
      return BindGroup.of(node);
    }
    attachment.copy(node, result.residual);
    return result;
  }

  /**
   * Returns a group with {@code bindings} followed by a binding of {@code source} to a fresh name,
   * and a reference to that name as its residual. The reference stands for {@code replaced}.
   */
  BindGroup bindNew(ImmutableList<Binding> bindings, SyntaxNode source, SyntaxNode replaced) {
    String name = names.fresh();
    Identifier ref = new Identifier(replaced.pos, null, name);
    attachment.copy(replaced, ref);
    ImmutableList<Binding> newBindings =
        ImmutableList.<Binding>builder().addAll(bindings).add(new Binding(name, source)).build();
    return new BindGroup(newBindings, ref);
  }

  private BindGroup bindNew(BindGroup group, SyntaxNode replaced) {
    return bindNew(group.bindings, group.residual, replaced);
  }

  /** If {@code node} is a marker occurrence, returns its bindings; otherwise returns null. */
  private @Nullable BindGroup extractUnwrap(SyntaxNode node) {
    SyntaxNode arg = syntax.markerArgument(node);
    if (arg == null) {
      return null;
    }
    return bindNew(extract(arg), node);
  }

  private BindGroup extractOther(SyntaxNode node) {
    switch (node.kind()) {
      case CALL:
        return extractCall((Call) node);
      case TYPE_INSTANTIATION:
        {
          TypeInstantiation ti = (TypeInstantiation) node;
          BindGroup fn = extract(ti.function);
          return fn.withResidual(new TypeInstantiation(ti.pos, null, fn.residual, ti.typeArgs));
        }
      case MEMBER_ACCESS:
        {
          MemberAccess access = (MemberAccess) node;
          BindGroup receiver = extract(access.receiver);
          return receiver.withResidual(
              new MemberAccess(access.pos, null, receiver.residual, access.name));
        }
      case LOCAL_BINDING:
        {
          LocalBinding local = (LocalBinding) node;
          BindGroup init = extract(local.initializer);
          return init.withResidual(
              new LocalBinding(local.pos, null, local.name, local.declaredType, init.residual));
        }
      case BLOCK:
        {
          Block block = (Block) node;
          return bindNew(extractStatements(block.statements, block), node);
        }
      case CONDITIONAL:
        {
          Conditional cond = (Conditional) node;
          BindGroup condition = extract(cond.condition);
          Conditional newCond =
              new Conditional(
                  cond.pos,
                  null,
                  condition.residual,
                  toEffect(cond.thenBranch),
                  toEffect(cond.elseBranch));
          return bindNew(condition.bindings, newCond, node);
        }
      case PATTERN_MATCH:
        {
          PatternMatch match = (PatternMatch) node;
          BindGroup scrutinee = extract(match.scrutinee);
          ImmutableList<Case> cases =
              match.cases.stream()
                  .map(c -> c.with((c.guard == null) ? null : toEffect(c.guard), toEffect(c.body)))
                  .collect(ImmutableList.toImmutableList());
          PatternMatch newMatch = new PatternMatch(match.pos, null, scrutinee.residual, cases);
          return bindNew(scrutinee.bindings, newMatch, node);
        }
      case TYPE_ASCRIPTION:
        // The ascribed type is the type of the unrewritten expression, so it is dropped.
        return extract(((TypeAscription) node).inner);
      case ANNOTATED:
        {
          Annotated annotated = (Annotated) node;
          BindGroup inner = extract(annotated.inner);
          return inner.withResidual(
              new Annotated(annotated.pos, null, inner.residual, annotated.annotation));
        }
      default:
        for (SyntaxNode marker : syntax.collectMarkers(node)) {
          diagnostics.add(
              Diagnostic.of(
                  Kind.UNSUPPORTED_POSITION,
                  marker.pos,
                  "%s is not supported here",
                  syntax.unwrapName));
        }
        return BindGroup.of(node);
    }
  }

  private BindGroup extractCall(Call call) {
    ImmutableList<Boolean> byName = byNameParams(call);
    BindGroup fn = extract(call.function);
    ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
    bindings.addAll(fn.bindings);
    ImmutableList.Builder<SyntaxNode> args = ImmutableList.builder();
    for (int i = 0; i < call.args.size(); i++) {
      SyntaxNode arg = call.args.get(i);
      if (i < byName.size() && byName.get(i)) {
        args.add(arg);
      } else {
        BindGroup argGroup = extract(arg);
        bindings.addAll(argGroup.bindings);
        args.add(argGroup.residual);
      }
    }
    Call result = new Call(call.pos, null, fn.residual, args.build(), call.callKind);
    return new BindGroup(bindings.build(), result);
  }

  /**
   * Returns, for each declared parameter of the function called by {@code call}, whether it is
   * by-name. Any further arguments (varargs) are strict.
   */
  private ImmutableList<Boolean> byNameParams(Call call) {
    Type fnType = attachment.requireType(call.function);
    if (!(fnType instanceof Type.Method)) {
      return ImmutableList.of();
    }
    return ((Type.Method) fnType)
        .params.stream().map(p -> p.byName).collect(ImmutableList.toImmutableList());
  }

  /**
   * Extracts a block's statements in order, followed by its result. The residual of the returned
   * group is a Block whose result is an effectful expression.
   *
   * <p>Statements that extract to a bare identifier are dropped, since they do nothing. If a later
   * statement has bindings of its own, the rest of the block is nested in a {@code bind} chain
   * after the current statement rather than appended to it.
   */
  private BindGroup extractStatements(List<SyntaxNode> statements, Block block) {
    if (statements.isEmpty()) {
      return BindGroup.of(new Block(block.pos, null, ImmutableList.of(), toEffect(block.result)));
    }
    BindGroup first = extract(statements.get(0));
    ImmutableList<SyntaxNode> kept =
        (first.residual instanceof Identifier)
            ? ImmutableList.of()
            : ImmutableList.of(first.residual);
    BindGroup rest = extractStatements(statements.subList(1, statements.size()), block);
    Block restBlock = (Block) rest.residual;
    Block newBlock;
    if (rest.bindings.isEmpty()) {
      ImmutableList<SyntaxNode> all =
          ImmutableList.<SyntaxNode>builder().addAll(kept).addAll(restBlock.statements).build();
      newBlock = new Block(block.pos, null, all, restBlock.result);
    } else {
      newBlock = new Block(block.pos, null, kept, codegen.generate(rest, false));
    }
    return first.withResidual(newBlock);
  }
}
