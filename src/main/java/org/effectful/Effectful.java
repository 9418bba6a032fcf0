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

import org.effectful.capability.InstanceRegistry;
import org.effectful.rewrite.MarkerSyntax;
import org.effectful.rewrite.NameAllocator;
import org.effectful.rewrite.RewriteDriver;
import org.effectful.rewrite.RewriteResult;
import org.effectful.rewrite.TypeOracle;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.Type;
import org.jspecify.annotations.Nullable;

/**
 * The entry points a host calls when it finds a rewrite block. {@code effectfully(body)} in the
 * host's source is expanded by passing {@code body} (and, if known, the type expected of the whole
 * call) to {@link #effectfully}; {@code effectfullyU(body)} likewise to {@link #effectfullyU}.
 *
 * <p>For example, given a registry with an effect instance for {@code Option},
 *
 * <pre>{@code
 * effectfully { unwrap(Some(1)) + unwrap(Some(2)) }
 * }</pre>
 *
 * is expanded to (roughly)
 *
 * <pre>{@code
 * { val $eff$1 = OptionEffect; $eff$1.bind(Some(1), $eff$2 => $eff$1.bind(Some(2), $eff$3 =>
 *     $eff$1.pure($eff$2 + $eff$3))) }
 * }</pre>
 */
public final class Effectful {

  private Effectful() {}

  /**
   * The services of one host compilation: its type checker and capability instances. All
   * expansions made with the same Host draw synthetic names from one {@link NameAllocator}.
   */
  public static final class Host {
    final RewriteDriver direct;
    final RewriteDriver indirect;

    public Host(TypeOracle oracle, InstanceRegistry registry) {
      NameAllocator names = new NameAllocator();
      this.direct = new RewriteDriver(MarkerSyntax.DIRECT, oracle, registry, names);
      this.indirect = new RewriteDriver(MarkerSyntax.INDIRECT, oracle, registry, names);
    }
  }

  /** Expands a rewrite block whose effect is a single-parameter type constructor. */
  public static RewriteResult effectfully(
      SyntaxNode body, @Nullable Type expectedType, Host host) {
    return host.direct.rewrite(body, expectedType);
  }

  public static RewriteResult effectfully(SyntaxNode body, Host host) {
    return effectfully(body, null, host);
  }

  /**
   * Expands a rewrite block whose effect must be found by decomposing the unwrapped types, e.g.
   * {@code Either[String, _]}.
   */
  public static RewriteResult effectfullyU(
      SyntaxNode body, @Nullable Type expectedType, Host host) {
    return host.indirect.rewrite(body, expectedType);
  }

  public static RewriteResult effectfullyU(SyntaxNode body, Host host) {
    return effectfullyU(body, null, host);
  }
}
