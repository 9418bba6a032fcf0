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
import static org.effectful.testing.Trees.call;
import static org.effectful.testing.Trees.id;
import static org.effectful.testing.Trees.lambda;
import static org.effectful.testing.Trees.num;

import com.google.common.collect.ImmutableList;
import org.effectful.rewrite.BindGroup.Binding;
import org.effectful.tree.SyntaxNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CodeGeneratorTest {

  private final CodeGenerator codegen = new CodeGenerator("M");

  @Test
  public void noBindings() {
    BindGroup group = BindGroup.of(call("f", num(1)));
    assertThat(codegen.generate(group, true).toString()).isEqualTo("M.pure(f(1))");
    assertThat(codegen.generate(group, false)).isSameInstanceAs(group.residual);
    assertThat(codegen.generate(BindGroup.of(null), true)).isNull();
  }

  @Test
  public void bindingsNestLeftToRight() {
    BindGroup group =
        new BindGroup(
            ImmutableList.of(new Binding("a", call("f", num(1))), new Binding("b", id("g"))),
            call("add", id("a"), id("b")));
    assertThat(codegen.generate(group, true).toString())
        .isEqualTo("M.bind(f(1), a => M.bind(g, b => M.pure(add(a, b))))");
    // An effectful residual is not lifted.
    assertThat(codegen.generate(group, false).toString())
        .isEqualTo("M.bind(f(1), a => M.bind(g, b => add(a, b)))");
  }

  @Test
  public void map() {
    assertThat(codegen.map(id("xs"), lambda("x", num(0))).toString())
        .isEqualTo("M.map(xs, x => 0)");
  }

  @Test
  public void eachReferenceIsANewNode() {
    SyntaxNode first = codegen.effect();
    assertThat(first.toString()).isEqualTo("M");
    assertThat(codegen.effect()).isNotSameInstanceAs(first);
  }
}
