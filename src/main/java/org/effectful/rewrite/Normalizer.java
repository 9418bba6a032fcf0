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

import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Call;
import org.effectful.tree.Transformer;

/**
 * Strips the calls that the host's type resolution inserted (implicit arguments and implicit
 * conversions), which would otherwise hide the shapes the rewriter looks for, such as {@code
 * xs.map(x => ...)} being really {@code ?xs.map(x => ...)(canBuildFrom)}.
 *
 * <p>The layers belonging to markers are kept, since they are part of what identifies a marker
 * occurrence:
 *
 * <ul>
 *   <li>an implicit-argument call is replaced by its function, unless that function is the marker
 *       or the adapter conversion; and
 *   <li>an implicit conversion is replaced by its argument, unless it is the adapter conversion.
 * </ul>
 */
final class Normalizer extends Transformer {
  private final MarkerSyntax syntax;

  Normalizer(MarkerSyntax syntax) {
    this.syntax = syntax;
  }

  /** Returns {@code tree} without synthetic calls; returns {@code tree} itself if it had none. */
  SyntaxNode normalize(SyntaxNode tree) {
    return transform(tree);
  }

  @Override
  public SyntaxNode transform(SyntaxNode node) {
    if (node instanceof Call) {
      Call call = (Call) node;
      if (call.callKind == Call.CallKind.IMPLICIT_ARGS
          && !syntax.isMarker(call.function)
          && !syntax.isConversion(call.function)) {
        return transform(call.function);
      } else if (call.callKind == Call.CallKind.IMPLICIT_CONVERSION
          && !syntax.isConversion(call.function)) {
        return transform(call.args.get(0));
      }
    }
    return super.transform(node);
  }
}
