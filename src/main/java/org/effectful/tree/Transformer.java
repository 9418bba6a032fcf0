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

import com.google.common.collect.ImmutableList;
import org.effectful.tree.SyntaxNode.Annotated;
import org.effectful.tree.SyntaxNode.Block;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.SyntaxNode.Case;
import org.effectful.tree.SyntaxNode.Conditional;
import org.effectful.tree.SyntaxNode.FunctionLiteral;
import org.effectful.tree.SyntaxNode.LocalBinding;
import org.effectful.tree.SyntaxNode.MemberAccess;
import org.effectful.tree.SyntaxNode.PatternMatch;
import org.effectful.tree.SyntaxNode.TypeAscription;
import org.effectful.tree.SyntaxNode.TypeInstantiation;
import org.jspecify.annotations.Nullable;

/**
 * A base class for bottom-up tree rewrites. The default {@link #transform} rebuilds each node from
 * the transformed versions of its children, keeping the node's position and type; subclasses
 * override it to replace the nodes they care about and call {@code super.transform()} for the
 * rest.
 *
 * <p>A node whose children are all returned unchanged is itself returned unchanged (not copied),
 * so a Transformer that finds nothing to do returns the tree it was given.
 */
public class Transformer {

  public SyntaxNode transform(SyntaxNode node) {
    switch (node.kind()) {
      case LITERAL:
      case IDENTIFIER:
        return node;
      case CALL:
        {
          Call call = (Call) node;
          SyntaxNode fn = transform(call.function);
          ImmutableList<SyntaxNode> args = transformAll(call.args);
          return (fn == call.function && args == call.args) ? call : call.with(fn, args);
        }
      case TYPE_INSTANTIATION:
        {
          TypeInstantiation ti = (TypeInstantiation) node;
          SyntaxNode fn = transform(ti.function);
          return (fn == ti.function)
              ? ti
              : new TypeInstantiation(ti.pos, ti.type, fn, ti.typeArgs);
        }
      case MEMBER_ACCESS:
        {
          MemberAccess access = (MemberAccess) node;
          SyntaxNode receiver = transform(access.receiver);
          return (receiver == access.receiver)
              ? access
              : new MemberAccess(access.pos, access.type, receiver, access.name);
        }
      case LOCAL_BINDING:
        {
          LocalBinding binding = (LocalBinding) node;
          SyntaxNode init = transform(binding.initializer);
          return (init == binding.initializer)
              ? binding
              : new LocalBinding(
                  binding.pos, binding.type, binding.name, binding.declaredType, init);
        }
      case BLOCK:
        {
          Block block = (Block) node;
          ImmutableList<SyntaxNode> stmts = transformAll(block.statements);
          SyntaxNode result = transform(block.result);
          return (stmts == block.statements && result == block.result)
              ? block
              : new Block(block.pos, block.type, stmts, result);
        }
      case CONDITIONAL:
        {
          Conditional cond = (Conditional) node;
          SyntaxNode c = transform(cond.condition);
          SyntaxNode t = transform(cond.thenBranch);
          SyntaxNode e = transform(cond.elseBranch);
          return (c == cond.condition && t == cond.thenBranch && e == cond.elseBranch)
              ? cond
              : new Conditional(cond.pos, cond.type, c, t, e);
        }
      case PATTERN_MATCH:
        {
          PatternMatch match = (PatternMatch) node;
          SyntaxNode scrutinee = transform(match.scrutinee);
          boolean changed = (scrutinee != match.scrutinee);
          ImmutableList.Builder<Case> cases = ImmutableList.builder();
          for (Case c : match.cases) {
            SyntaxNode guard = transformOrNull(c.guard);
            SyntaxNode body = transform(c.body);
            if (guard != c.guard || body != c.body) {
              changed = true;
              cases.add(c.with(guard, body));
            } else {
              cases.add(c);
            }
          }
          return changed
              ? new PatternMatch(match.pos, match.type, scrutinee, cases.build())
              : match;
        }
      case TYPE_ASCRIPTION:
        {
          TypeAscription ascription = (TypeAscription) node;
          SyntaxNode inner = transform(ascription.inner);
          return (inner == ascription.inner)
              ? ascription
              : new TypeAscription(ascription.pos, ascription.type, inner, ascription.ascribed);
        }
      case ANNOTATED:
        {
          Annotated annotated = (Annotated) node;
          SyntaxNode inner = transform(annotated.inner);
          return (inner == annotated.inner)
              ? annotated
              : new Annotated(annotated.pos, annotated.type, inner, annotated.annotation);
        }
      case FUNCTION_LITERAL:
        {
          FunctionLiteral fn = (FunctionLiteral) node;
          SyntaxNode body = transform(fn.body);
          return (body == fn.body) ? fn : new FunctionLiteral(fn.pos, fn.type, fn.params, body);
        }
    }
    throw new AssertionError(node.kind());
  }

  /**
   * Transforms each element of {@code nodes}; returns {@code nodes} itself if none of them
   * changed.
   */
  protected final ImmutableList<SyntaxNode> transformAll(ImmutableList<SyntaxNode> nodes) {
    ImmutableList.Builder<SyntaxNode> builder = null;
    for (int i = 0; i < nodes.size(); i++) {
      SyntaxNode node = nodes.get(i);
      SyntaxNode transformed = transform(node);
      if (builder == null && transformed != node) {
        builder = ImmutableList.builderWithExpectedSize(nodes.size());
        builder.addAll(nodes.subList(0, i));
      }
      if (builder != null) {
        builder.add(transformed);
      }
    }
    return (builder == null) ? nodes : builder.build();
  }

  private @Nullable SyntaxNode transformOrNull(@Nullable SyntaxNode node) {
    return (node == null) ? null : transform(node);
  }
}
