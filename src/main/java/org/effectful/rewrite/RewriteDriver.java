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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.effectful.capability.CapabilityInstance;
import org.effectful.capability.InstanceRegistry;
import org.effectful.rewrite.Diagnostic.Kind;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Block;
import org.effectful.tree.SyntaxNode.LocalBinding;
import org.effectful.tree.Type;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the body of a rewrite block (e.g. the argument of {@code effectfully}) into explicit
 * effect code. Each call to {@link #rewrite} is one pass:
 *
 * <ol>
 *   <li>if the input has not been typed, have the oracle type it;
 *   <li>strip implicit calls ({@link Normalizer});
 *   <li>record the type of every node ({@link TypeAttachment});
 *   <li>extract bindings from the whole tree and generate the effect code ({@link
 *       BindingExtractor}, {@link CodeGenerator});
 *   <li>find the block's effect instance ({@link CapabilityResolver});
 *   <li>bind the instance to a fresh name around the generated code; and
 *   <li>have the oracle type check the result.
 * </ol>
 *
 * If type information is missing at any step before the last, the pass is abandoned and the input
 * returned unchanged (a {@link RewriteResult.Fallback}). Errors found along the way are collected,
 * so that one pass reports every failing marker occurrence, and returned as a {@link
 * RewriteResult.Failed}.
 *
 * <p>RewriteDrivers are not thread-safe; all passes of one driver share its {@link NameAllocator}.
 */
public final class RewriteDriver {
  private static final Logger logger = Logger.getLogger(RewriteDriver.class.getName());

  private final MarkerSyntax syntax;
  private final TypeOracle oracle;
  private final InstanceRegistry registry;
  private final NameAllocator names;

  public RewriteDriver(
      MarkerSyntax syntax, TypeOracle oracle, InstanceRegistry registry, NameAllocator names) {
    this.syntax = Preconditions.checkNotNull(syntax);
    this.oracle = Preconditions.checkNotNull(oracle);
    this.registry = Preconditions.checkNotNull(registry);
    this.names = Preconditions.checkNotNull(names);
  }

  public RewriteDriver(MarkerSyntax syntax, TypeOracle oracle, InstanceRegistry registry) {
    this(syntax, oracle, registry, new NameAllocator());
  }

  /**
   * Rewrites {@code expr}, the body of a rewrite block.
   *
   * @param expectedType the type the caller expects the rewritten block to have, if known; if it
   *     has an effect instance that instance is used
   */
  public RewriteResult rewrite(SyntaxNode expr, @Nullable Type expectedType) {
    logger.fine("Rewriting " + syntax + " block at " + expr.pos);
    List<Diagnostic> diagnostics = new ArrayList<>();
    SyntaxNode generated;
    try {
      generated = generate(expr, expectedType, diagnostics);
    } catch (InferenceUnavailable e) {
      logger.log(Level.FINE, "Falling back to the original tree", e);
      return new RewriteResult.Fallback(expr, e.getMessage());
    }
    if (!diagnostics.isEmpty()) {
      logger.fine("Rewrite failed: " + diagnostics);
      return new RewriteResult.Failed(expr, ImmutableList.copyOf(diagnostics));
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("Generated " + generated);
    }
    try {
      return new RewriteResult.Rewritten(oracle.typecheck(generated));
    } catch (TypecheckException e) {
      Diagnostic diagnostic =
          new Diagnostic(Kind.REGENERATED_CODE_ILL_TYPED, e.getMessage(), expr.pos);
      logger.fine("Generated code was rejected: " + diagnostic);
      return new RewriteResult.Failed(expr, ImmutableList.of(diagnostic));
    }
  }

  /**
   * Returns the generated code for {@code expr}, not yet type checked. If any errors are found
   * they are added to {@code diagnostics} and null is returned.
   *
   * @throws InferenceUnavailable if type information needed for the rewrite is missing
   */
  private @Nullable SyntaxNode generate(
      SyntaxNode expr, @Nullable Type expectedType, List<Diagnostic> diagnostics) {
    SyntaxNode typed = expr;
    if (expr.type == null) {
      try {
        typed = oracle.typecheck(expr);
      } catch (TypecheckException e) {
        throw new InferenceUnavailable("Input could not be typed: " + e.getMessage(), e);
      }
    }
    SyntaxNode normalized = new Normalizer(syntax).normalize(typed);
    names.reserveNamesIn(normalized);
    TypeAttachment attachment = TypeAttachment.of(normalized);
    CodeGenerator codegen = new CodeGenerator(names.fresh());
    CapabilityResolver resolver = new CapabilityResolver(registry, syntax, attachment);
    BindingExtractor extractor =
        new BindingExtractor(syntax, attachment, resolver, codegen, names, diagnostics);

    SyntaxNode body = extractor.toEffect(normalized);
    CapabilityInstance effect = resolver.inferEffect(normalized, expectedType, diagnostics);
    if (effect == null || !diagnostics.isEmpty()) {
      return null;
    }
    LocalBinding instance =
        new LocalBinding(expr.pos, null, codegen.effectName, null, effect.reference());
    return new Block(expr.pos, null, ImmutableList.of(instance), body);
  }
}
