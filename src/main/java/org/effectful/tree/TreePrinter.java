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

import org.effectful.tree.SyntaxNode.Annotated;
import org.effectful.tree.SyntaxNode.Block;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.SyntaxNode.Case;
import org.effectful.tree.SyntaxNode.Conditional;
import org.effectful.tree.SyntaxNode.FunctionLiteral;
import org.effectful.tree.SyntaxNode.Identifier;
import org.effectful.tree.SyntaxNode.Literal;
import org.effectful.tree.SyntaxNode.LocalBinding;
import org.effectful.tree.SyntaxNode.MemberAccess;
import org.effectful.tree.SyntaxNode.PatternMatch;
import org.effectful.tree.SyntaxNode.TypeAscription;
import org.effectful.tree.SyntaxNode.TypeInstantiation;

/**
 * Renders a SyntaxNode as compact single-line pseudo-source, e.g.
 *
 * <pre>{@code
 * {val $eff$3 = Some; $eff$3.bind(f(1), $eff$1 => $eff$3.pure(plus($eff$1, 2)))}
 * }</pre>
 *
 * <p>The output is intended for diagnostics and tests; it is not guaranteed to be parseable.
 * Synthetic calls inserted by the host (implicit arguments and conversions) are rendered with a
 * {@code ?} prefix so that they are visible in test expectations.
 */
final class TreePrinter {

  // Static methods only
  private TreePrinter() {}

  static String print(SyntaxNode node) {
    StringBuilder sb = new StringBuilder();
    print(node, sb);
    return sb.toString();
  }

  private static void print(SyntaxNode node, StringBuilder sb) {
    switch (node.kind()) {
      case LITERAL:
        Object value = ((Literal) node).value;
        if (value instanceof String) {
          sb.append('"').append(value).append('"');
        } else {
          sb.append(value);
        }
        break;
      case IDENTIFIER:
        sb.append(((Identifier) node).name);
        break;
      case CALL:
        Call call = (Call) node;
        if (call.callKind != Call.CallKind.REGULAR) {
          sb.append('?');
        }
        print(call.function, sb);
        sb.append('(');
        printList(call.args, sb);
        sb.append(')');
        break;
      case TYPE_INSTANTIATION:
        TypeInstantiation ti = (TypeInstantiation) node;
        print(ti.function, sb);
        sb.append('[');
        for (int i = 0; i < ti.typeArgs.size(); i++) {
          if (i != 0) {
            sb.append(", ");
          }
          sb.append(ti.typeArgs.get(i));
        }
        sb.append(']');
        break;
      case MEMBER_ACCESS:
        MemberAccess access = (MemberAccess) node;
        print(access.receiver, sb);
        sb.append('.').append(access.name);
        break;
      case LOCAL_BINDING:
        LocalBinding binding = (LocalBinding) node;
        sb.append("val ").append(binding.name);
        if (binding.declaredType != null) {
          sb.append(": ").append(binding.declaredType);
        }
        sb.append(" = ");
        print(binding.initializer, sb);
        break;
      case BLOCK:
        Block block = (Block) node;
        sb.append('{');
        for (SyntaxNode stmt : block.statements) {
          print(stmt, sb);
          sb.append("; ");
        }
        print(block.result, sb);
        sb.append('}');
        break;
      case CONDITIONAL:
        Conditional cond = (Conditional) node;
        sb.append("if (");
        print(cond.condition, sb);
        sb.append(") ");
        print(cond.thenBranch, sb);
        sb.append(" else ");
        print(cond.elseBranch, sb);
        break;
      case PATTERN_MATCH:
        PatternMatch match = (PatternMatch) node;
        print(match.scrutinee, sb);
        sb.append(" match {");
        for (Case c : match.cases) {
          sb.append(" case ");
          print(c.pattern, sb);
          if (c.guard != null) {
            sb.append(" if ");
            print(c.guard, sb);
          }
          sb.append(" => ");
          print(c.body, sb);
          sb.append(';');
        }
        sb.append(" }");
        break;
      case TYPE_ASCRIPTION:
        TypeAscription ascription = (TypeAscription) node;
        sb.append('(');
        print(ascription.inner, sb);
        sb.append(": ").append(ascription.ascribed).append(')');
        break;
      case ANNOTATED:
        Annotated annotated = (Annotated) node;
        sb.append('(');
        print(annotated.inner, sb);
        sb.append(": @").append(annotated.annotation).append(')');
        break;
      case FUNCTION_LITERAL:
        FunctionLiteral fn = (FunctionLiteral) node;
        if (fn.params.size() == 1 && fn.params.get(0).declaredType == null) {
          sb.append(fn.params.get(0).name);
        } else {
          sb.append('(');
          for (int i = 0; i < fn.params.size(); i++) {
            if (i != 0) {
              sb.append(", ");
            }
            sb.append(fn.params.get(i));
          }
          sb.append(')');
        }
        sb.append(" => ");
        print(fn.body, sb);
        break;
    }
  }

  private static void printList(Iterable<SyntaxNode> nodes, StringBuilder sb) {
    boolean first = true;
    for (SyntaxNode node : nodes) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      print(node, sb);
    }
  }
}
