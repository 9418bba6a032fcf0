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

package org.effectful;

import org.effectful.rewrite.MarkerSyntax;

/**
 * The marker functions, as seen by code that runs. A rewrite block's markers are all replaced
 * before the code runs, so if one of these is ever called the block was not rewritten (or the
 * marker was used outside of any block) and an IllegalStateException is thrown.
 */
public final class Markers {

  private Markers() {}

  /** Marks {@code effect} as a value to be unwrapped in an {@code effectfully} block. */
  public static <A> A unwrap(Object effect) {
    throw notRewritten(MarkerSyntax.DIRECT.unwrapName);
  }

  /** Marks {@code effect} as a value to be unwrapped in an {@code effectfullyU} block. */
  public static <A> A unwrapU(Object effect) {
    throw notRewritten(MarkerSyntax.INDIRECT.unwrapName);
  }

  /** Adapts {@code effect} so that it can be unwrapped with a postfix operator. */
  public static <A> Unwrappable<A> effectfulToUnwrappable(Object effect) {
    throw notRewritten(MarkerSyntax.DIRECT.conversionName);
  }

  public static <A> Unwrappable<A> effectfulToUnwrappableU(Object effect) {
    throw notRewritten(MarkerSyntax.INDIRECT.conversionName);
  }

  static IllegalStateException notRewritten(String name) {
    return new IllegalStateException(
        name + " was not rewritten: used outside of a rewrite block");
  }
}
