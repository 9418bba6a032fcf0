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

import com.google.errorprone.annotations.FormatMethod;
import org.effectful.tree.Position;

/**
 * Thrown when rewriting cannot continue, e.g. because no capability instance could be found. The
 * {@link RewriteDriver} catches it and reports its Diagnostic along with any others collected
 * during the pass.
 */
public class RewriteError extends RuntimeException {
  public final Diagnostic diagnostic;

  public RewriteError(Diagnostic diagnostic) {
    super(diagnostic.msg);
    this.diagnostic = diagnostic;
  }

  /** Returns a new RewriteError referring to the given position. */
  @FormatMethod
  static RewriteError of(Diagnostic.Kind kind, Position pos, String fmt, Object... fmtArgs) {
    return new RewriteError(Diagnostic.of(kind, pos, fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return diagnostic.toString();
  }
}
