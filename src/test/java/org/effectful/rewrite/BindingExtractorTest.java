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

import static com.google.common.truth.Truth.assertThat;
import static org.effectful.testing.Trees.annotate;
import static org.effectful.testing.Trees.ascribe;
import static org.effectful.testing.Trees.block;
import static org.effectful.testing.Trees.bool;
import static org.effectful.testing.Trees.call;
import static org.effectful.testing.Trees.caseOf;
import static org.effectful.testing.Trees.id;
import static org.effectful.testing.Trees.ifElse;
import static org.effectful.testing.Trees.lambda;
import static org.effectful.testing.Trees.match;
import static org.effectful.testing.Trees.num;
import static org.effectful.testing.Trees.postfix;
import static org.effectful.testing.Trees.select;
import static org.effectful.testing.Trees.str;
import static org.effectful.testing.Trees.typeArgs;
import static org.effectful.testing.Trees.unwrap;
import static org.effectful.testing.Trees.unwrapAt;
import static org.effectful.testing.Trees.val;
import static org.junit.Assert.assertThrows;

import org.effectful.testing.TestHost;
import org.effectful.tree.Position;
import org.effectful.tree.SyntaxNode;
import org.effectful.tree.SyntaxNode.Call;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BindingExtractorTest {

  private static String effectCode(SyntaxNode tree) throws Exception {
    RewriteFixture fixture = RewriteFixture.of(tree);
    String result = fixture.effectCode();
    assertThat(fixture.diagnostics).isEmpty();
    return result;
  }

  @Test
  public void singleMarker() throws Exception {
    assertThat(effectCode(call("add", unwrap(call("double", num(3))), num(1))))
        .isEqualTo("E.bind(double(3), $eff$1 => E.pure(add($eff$1, 1)))");
  }

  @Test
  public void markersAreBoundLeftToRight() throws Exception {
    assertThat(effectCode(call("add", unwrap(call("some", num(1))), unwrap(call("some", num(2))))))
        .isEqualTo(
            "E.bind(some(1), $eff$1 => E.bind(some(2), $eff$2 => E.pure(add($eff$1, $eff$2))))");
  }

  @Test
  public void nestedMarkers() throws Exception {
    assertThat(effectCode(unwrap(call("some", unwrap(call("double", num(1)))))))
        .isEqualTo("E.bind(double(1), $eff$1 => E.bind(some($eff$1), $eff$2 => E.pure($eff$2)))");
  }

  @Test
  public void postfixMarker() throws Exception {
    assertThat(effectCode(call("add", postfix(call("some", num(1)), "!"), num(2))))
        .isEqualTo("E.bind(some(1), $eff$1 => E.pure(add($eff$1, 2)))");
  }

  @Test
  public void conditional() throws Exception {
    assertThat(
            effectCode(
                ifElse(unwrap(call("isEven", num(2))), unwrap(call("some", num(1))), num(0))))
        .isEqualTo(
            "E.bind(isEven(2), $eff$1 => "
                + "E.bind(if ($eff$1) E.bind(some(1), $eff$2 => E.pure($eff$2)) else E.pure(0), "
                + "$eff$3 => E.pure($eff$3)))");
  }

  @Test
  public void blockStatements() throws Exception {
    SyntaxNode tree =
        block(
            val("x", unwrap(call("some", num(1)))),
            val("y", unwrap(call("double", id("x")))),
            call("add", id("x"), id("y")));
    assertThat(effectCode(tree))
        .isEqualTo(
            "E.bind(some(1), $eff$1 => "
                + "E.bind({val x = $eff$1; "
                + "E.bind(double(x), $eff$2 => {val y = $eff$2; E.pure(add(x, y))})}, "
                + "$eff$3 => E.pure($eff$3)))");
  }

  @Test
  public void markerStatementIsDropped() throws Exception {
    SyntaxNode tree = block(unwrap(call("tick", str("a"), call("some", num(1)))), num(5));
    assertThat(effectCode(tree))
        .isEqualTo(
            "E.bind(tick(\"a\", some(1)), $eff$1 => "
                + "E.bind({E.pure(5)}, $eff$2 => E.pure($eff$2)))");
  }

  @Test
  public void subtreesWithoutMarkersAreUntouched() throws Exception {
    RewriteFixture fixture =
        RewriteFixture.of(
            call("add", unwrap(call("some", num(1))), block(val("y", num(2)), id("y"))));
    SyntaxNode pure = ((Call) fixture.tree).args.get(1);
    BindGroup group = fixture.extractor.extract(fixture.tree);
    assertThat(((Call) group.residual).args.get(1)).isSameInstanceAs(pure);
    assertThat(fixture.codegen.generate(group, true).toString())
        .isEqualTo("E.bind(some(1), $eff$1 => E.pure(add($eff$1, {val y = 2; y})))");
  }

  @Test
  public void residualsKeepTheOriginalTypes() throws Exception {
    RewriteFixture fixture =
        RewriteFixture.of(call("add", unwrap(call("double", num(3))), num(1)));
    BindGroup group = fixture.extractor.extract(fixture.tree);
    assertThat(fixture.attachment.typeOf(group.residual)).isEqualTo(TestHost.INT_TYPE);
    SyntaxNode ref = ((Call) group.residual).args.get(0);
    assertThat(ref.toString()).isEqualTo("$eff$1");
    assertThat(fixture.attachment.typeOf(ref)).isEqualTo(TestHost.INT_TYPE);
    assertThat(fixture.attachment.originalOf(ref))
        .isSameInstanceAs(((Call) fixture.tree).args.get(0));
  }

  @Test
  public void patternMatch() throws Exception {
    SyntaxNode tree =
        match(
            unwrap(call("some", num(2))),
            caseOf(num(1), str("one")),
            caseOf(id("n"), unwrap(call("double", id("n")))));
    assertThat(effectCode(tree))
        .isEqualTo(
            "E.bind(some(2), $eff$1 => E.bind($eff$1 match {"
                + " case 1 => E.pure(\"one\");"
                + " case n => E.bind(double(n), $eff$2 => E.pure($eff$2)); }, "
                + "$eff$3 => E.pure($eff$3)))");
  }

  @Test
  public void guardsAreEffects() throws Exception {
    SyntaxNode tree =
        match(
            num(3),
            caseOf(id("n"), unwrap(call("isEven", id("n"))), str("even")),
            caseOf(id("_"), str("odd")));
    assertThat(effectCode(tree))
        .isEqualTo(
            "E.bind(3 match {"
                + " case n if E.bind(isEven(n), $eff$1 => E.pure($eff$1)) => E.pure(\"even\");"
                + " case _ => E.pure(\"odd\"); }, "
                + "$eff$2 => E.pure($eff$2))");
  }

  @Test
  public void ascriptionIsDropped() throws Exception {
    assertThat(effectCode(ascribe(unwrap(call("some", num(1))), TestHost.INT_TYPE)))
        .isEqualTo("E.bind(some(1), $eff$1 => E.pure($eff$1))");
  }

  @Test
  public void annotationIsKept() throws Exception {
    assertThat(effectCode(annotate(unwrap(call("some", num(1))), "unchecked")))
        .isEqualTo("E.bind(some(1), $eff$1 => E.pure(($eff$1: @unchecked)))");
  }

  @Test
  public void markerInReceiver() throws Exception {
    SyntaxNode tree =
        call(
            typeArgs(
                select(unwrap(call("some", call("seq", num(1)))), "filter"), TestHost.INT_TYPE),
            lambda("x", bool(true)));
    assertThat(effectCode(tree))
        .isEqualTo("E.bind(some(seq(1)), $eff$1 => E.pure($eff$1.filter[Int](x => true)))");
  }

  @Test
  public void byNameArgumentsAreLeftAlone() throws Exception {
    SyntaxNode tree =
        call(
            "orElse",
            unwrap(call("some", call("none"))),
            unwrap(call("some", call("some", num(2)))));
    assertThat(effectCode(tree))
        .isEqualTo(
            "E.bind(some(none()), $eff$1 => E.pure(orElse($eff$1, unwrap(some(some(2))))))");
  }

  @Test
  public void markersInsideFunctionLiterals() throws Exception {
    Position p1 = Position.of(3, 14);
    Position p2 = Position.of(3, 31);
    SyntaxNode tree =
        call(
            "tick",
            str("f"),
            lambda(
                "x",
                call(
                    "add",
                    unwrapAt(p1, call("double", id("x"))),
                    unwrapAt(p2, call("half", id("x"))))));
    RewriteFixture fixture = RewriteFixture.of(tree);
    fixture.extractor.toEffect(fixture.tree);
    assertThat(fixture.diagnostics).hasSize(2);
    for (Diagnostic diagnostic : fixture.diagnostics) {
      assertThat(diagnostic.kind).isEqualTo(Diagnostic.Kind.UNSUPPORTED_POSITION);
      assertThat(diagnostic.msg).isEqualTo("unwrap is not supported here");
    }
    assertThat(fixture.diagnostics.get(0).pos).isEqualTo(p1);
    assertThat(fixture.diagnostics.get(1).pos).isEqualTo(p2);
  }

  @Test
  public void missingTypes() {
    RewriteFixture fixture =
        RewriteFixture.withoutTypecheck(call("add", unwrap(call("some", num(1))), num(2)));
    assertThrows(InferenceUnavailable.class, () -> fixture.extractor.toEffect(fixture.tree));
  }
}
