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
import com.google.errorprone.annotations.FormatMethod;
import org.effectful.tree.Position;

/** A user-facing error found while rewriting, with the source position it refers to. */
public final class Diagnostic {

  /** The kinds of error a rewrite can report. */
  public enum Kind {
    /** The block contains no marker, so there is no effect to infer. */
    NO_MARKER_FOUND,
    /** The block's markers unwrap values of more than one effect type. */
    AMBIGUOUS_EFFECT_TYPE,
    /** A marker appears somewhere its effect cannot be sequenced, e.g. inside a lambda. */
    UNSUPPORTED_POSITION,
    /** No instance of a required capability could be found for a type. */
    CAPABILITY_NOT_FOUND,
    /** The host rejected the generated code. */
    REGENERATED_CODE_ILL_TYPED
  }

  public final Kind kind;
  public final String msg;
  public final Position pos;

  public Diagnostic(Kind kind, String msg, Position pos) {
    this.kind = Preconditions.checkNotNull(kind);
    this.msg = Preconditions.checkNotNull(msg);
    this.pos = Preconditions.checkNotNull(pos);
  }

  @FormatMethod
  static Diagnostic of(Kind kind, Position pos, String fmt, Object... fmtArgs) {
    return new Diagnostic(kind, String.format(fmt, fmtArgs), pos);
  }

  @Override
  public String toString() {
    return String.format("%s (%s:%s)", msg, pos.lineNum, pos.charPositionInLine);
  }
}
