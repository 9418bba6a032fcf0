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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.effectful.tree.SyntaxNode;

/**
 * The outcome of one rewrite pass. There are three possibilities:
 *
 * <ul>
 *   <li>{@link Rewritten}: the rewritten, type-checked tree.
 *   <li>{@link Fallback}: type information needed for the rewrite was not yet available; the
 *       unmodified input is returned and the caller may retry later.
 *   <li>{@link Failed}: the block is in error; the diagnostics should be reported to the user.
 * </ul>
 */
public abstract class RewriteResult {

  private RewriteResult() {}

  /** Returns the tree to use in place of the input: the rewritten tree, or the input itself. */
  public abstract SyntaxNode tree();

  /** Returns the diagnostics of a failed rewrite, or an empty list. */
  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.of();
  }

  public final boolean isRewritten() {
    return this instanceof Rewritten;
  }

  /** A successful rewrite. */
  public static final class Rewritten extends RewriteResult {
    public final SyntaxNode tree;

    public Rewritten(SyntaxNode tree) {
      this.tree = Preconditions.checkNotNull(tree);
    }

    @Override
    public SyntaxNode tree() {
      return tree;
    }

    @Override
    public String toString() {
      return "Rewritten(" + tree + ")";
    }
  }

  /** A rewrite that was abandoned without error; {@link #original} is the unmodified input. */
  public static final class Fallback extends RewriteResult {
    public final SyntaxNode original;

    /** Why the rewrite was abandoned, for logging only. */
    public final String reason;

    public Fallback(SyntaxNode original, String reason) {
      this.original = Preconditions.checkNotNull(original);
      this.reason = reason;
    }

    @Override
    public SyntaxNode tree() {
      return original;
    }

    @Override
    public String toString() {
      return "Fallback(" + reason + ")";
    }
  }

  /** A rewrite that found one or more errors. */
  public static final class Failed extends RewriteResult {
    public final SyntaxNode original;
    public final ImmutableList<Diagnostic> diagnostics;

    public Failed(SyntaxNode original, ImmutableList<Diagnostic> diagnostics) {
      Preconditions.checkArgument(!diagnostics.isEmpty());
      this.original = original;
      this.diagnostics = diagnostics;
    }

    @Override
    public SyntaxNode tree() {
      return original;
    }

    @Override
    public ImmutableList<Diagnostic> diagnostics() {
      return diagnostics;
    }

    @Override
    public String toString() {
      return "Failed" + diagnostics;
    }
  }
}
