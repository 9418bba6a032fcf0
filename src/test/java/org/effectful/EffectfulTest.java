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

import static com.google.common.truth.Truth.assertThat;
import static org.effectful.testing.Trees.call;
import static org.effectful.testing.Trees.id;
import static org.effectful.testing.Trees.implicitConversion;
import static org.effectful.testing.Trees.num;
import static org.effectful.testing.Trees.postfix;
import static org.effectful.testing.Trees.select;
import static org.effectful.testing.Trees.unwrap;
import static org.effectful.testing.Trees.unwrapU;

import org.effectful.rewrite.Diagnostic;
import org.effectful.rewrite.RewriteResult;
import org.effectful.testing.Either;
import org.effectful.testing.Interpreter;
import org.effectful.testing.Opt;
import org.effectful.testing.TestHost;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Block;
import org.effectful.tree.SyntaxNode.LocalBinding;
import org.effectful.tree.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EffectfulTest {

  private final Effectful.Host host = TestHost.host();
  private final Interpreter interpreter = TestHost.interpreter();

  private Object eval(RewriteResult result) {
    assertThat(result.isRewritten()).isTrue();
    return interpreter.eval(result.tree());
  }

  private static String effectName(RewriteResult result) {
    return ((LocalBinding) ((Block) result.tree()).statements.get(0)).name;
  }

  @Test
  public void effectfully() {
    SyntaxNode body = call("add", unwrap(call("some", num(1))), num(2));
    assertThat(eval(Effectful.effectfully(body, host))).isEqualTo(Opt.some(3));
  }

  @Test
  public void effectfullyU() {
    SyntaxNode body = call("add", unwrapU(call("right", num(1))), num(2));
    assertThat(eval(Effectful.effectfullyU(body, host))).isEqualTo(Either.right(3));
    Type expected = TestHost.either(TestHost.STRING_TYPE, TestHost.INT_TYPE);
    assertThat(eval(Effectful.effectfullyU(body, expected, host))).isEqualTo(Either.right(3));
  }

  @Test
  public void postfixMarkers() {
    SyntaxNode body =
        call("add", postfix(call("some", num(1)), "!"), postfix(call("some", num(2)), "unwrap"));
    assertThat(eval(Effectful.effectfully(body, host))).isEqualTo(Opt.some(3));
  }

  @Test
  public void insertedConversion() {
    SyntaxNode body =
        call(
            "add",
            select(implicitConversion("effectfulToUnwrappable", call("double", num(1))), "!"),
            num(1));
    assertThat(eval(Effectful.effectfully(body, host))).isEqualTo(Opt.some(3));
  }

  @Test
  public void qualifiedMarker() {
    SyntaxNode body = call(select(id("Markers"), "unwrap"), call("double", num(4)));
    assertThat(eval(Effectful.effectfully(body, host))).isEqualTo(Opt.some(8));
  }

  @Test
  public void eachVariantOnlySeesItsOwnMarkers() {
    SyntaxNode body = unwrapU(call("some", num(1)));
    RewriteResult result = Effectful.effectfully(body, host);
    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).kind).isEqualTo(Diagnostic.Kind.NO_MARKER_FOUND);
    assertThat(result.diagnostics().get(0).msg)
        .isEqualTo("could not infer the effect type because unwrap is never used");
    assertThat(Effectful.effectfully(unwrap(call("right", num(1))), host).diagnostics())
        .hasSize(1);
  }

  @Test
  public void blocksGetDistinctNames() {
    RewriteResult first = Effectful.effectfully(unwrap(call("some", num(1))), host);
    RewriteResult second = Effectful.effectfullyU(unwrapU(call("some", num(2))), host);
    assertThat(effectName(first)).isNotEqualTo(effectName(second));
    // One block's expansion can be nested inside another's
    SyntaxNode nested = call("add", unwrap(first.tree()), num(1));
    assertThat(eval(Effectful.effectfully(nested, host))).isEqualTo(Opt.some(2));
  }
}
