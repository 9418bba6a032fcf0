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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.IdentityHashMap;
import java.util.Map;
import org.effectful.tree.Position;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.jspecify.annotations.Nullable;

/**
 * Remembers, for the duration of one pass, the pre-rewrite node and resolved type that each node
 * of the tree came from. Entries are keyed by node identity.
 *
 * <p>The table is populated from the typed input tree by {@link #of}. As the rewriter replaces a
 * node it calls {@link #copy} so that the replacement can still answer type queries about the
 * code it stands for; nodes that the rewriter creates from scratch (calls to {@code bind}, fresh
 * identifiers, ...) have no entry.
 */
final class TypeAttachment {

  /** What is known about one node. */
  static final class Entry {
    final SyntaxNode original;
    final @Nullable Type type;

    Entry(SyntaxNode original, @Nullable Type type) {
      this.original = original;
      this.type = type;
    }
  }

  private final Map<SyntaxNode, Entry> entries = new IdentityHashMap<>();

  private TypeAttachment() {}

  /** Returns a TypeAttachment with an entry for every node of {@code tree}. */
  static TypeAttachment of(SyntaxNode tree) {
    TypeAttachment result = new TypeAttachment();
    tree.forEachNode(node -> result.entries.put(node, new Entry(node, node.type)));
    return result;
  }

  /** Gives {@code replacement} the same entry as {@code original}, and returns it. */
  @CanIgnoreReturnValue
  <T extends SyntaxNode> T copy(SyntaxNode original, T replacement) {
    Entry entry = entries.get(original);
    if (entry != null && replacement != original) {
      entries.put(replacement, entry);
    }
    return replacement;
  }

  /** Returns the pre-rewrite node that {@code node} stands for, or null if it is synthetic. */
  @Nullable SyntaxNode originalOf(SyntaxNode node) {
    Entry entry = entries.get(node);
    return (entry == null) ? null : entry.original;
  }

  /** Returns the source position of the pre-rewrite code that {@code node} stands for. */
  Position sourcePos(SyntaxNode node) {
    SyntaxNode original = originalOf(node);
    return (original == null) ? node.pos : original.pos;
  }

  /** Returns the resolved type of the code {@code node} stands for, or null if unknown. */
  @Nullable Type typeOf(SyntaxNode node) {
    Entry entry = entries.get(node);
    return (entry == null) ? null : entry.type;
  }

  /**
   * Returns the resolved type of the code {@code node} stands for.
   *
   * @throws InferenceUnavailable if no type is known
   */
  Type requireType(SyntaxNode node) {
    Type type = typeOf(node);
    if (type == null) {
      throw new InferenceUnavailable("No type information for " + node);
    }
    return type;
  }
}
