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

import java.util.HashSet;
import java.util.Set;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.FunctionLiteral;
import org.effectful.tree.SyntaxNode.Identifier;
import org.effectful.tree.SyntaxNode.LocalBinding;

/**
 * Allocates the synthetic identifiers used for extracted bindings, lambda parameters, and the
 * capability instance. Names are {@link #PREFIX} followed by a counter that only increases, so
 * names are never reused within a run.
 *
 * <p>Before each pass the driver calls {@link #reserveNamesIn} with the input tree; any name
 * already used there is skipped, so a synthetic name can never capture or shadow a user's name.
 *
 * <p>Not thread-safe.
 */
public final class NameAllocator {

  /** Every allocated name starts with this prefix. */
  public static final String PREFIX = "$eff$";

  private int counter;
  private final Set<String> reserved = new HashSet<>();

  /** Prevents any name bound or referenced in {@code tree} from being allocated. */
  public void reserveNamesIn(SyntaxNode tree) {
    tree.forEachNode(
        node -> {
          if (node instanceof Identifier) {
            reserved.add(((Identifier) node).name);
          } else if (node instanceof LocalBinding) {
            reserved.add(((LocalBinding) node).name);
          } else if (node instanceof FunctionLiteral) {
            ((FunctionLiteral) node).params.forEach(p -> reserved.add(p.name));
          }
        });
  }

  /** Returns a name that has not been returned before and is not reserved. */
  public String fresh() {
    String name;
    do {
      name = PREFIX + ++counter;
    } while (reserved.contains(name));
    return name;
  }
}
