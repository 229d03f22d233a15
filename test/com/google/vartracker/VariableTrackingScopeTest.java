/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.vartracker;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableTrackingScope} and its subclasses. */
@RunWith(JUnit4.class)
public final class VariableTrackingScopeTest {

  @Test
  public void testRecordDefinitionReplaces() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    scope.recordDefinitionById("x", 2);

    assertThat(scope.getDefinition("x")).containsExactly(2);
    assertThat(scope.getDefinition("y")).isEmpty();
    assertThat(scope.getOwnDefinitions()).containsExactly("x", ImmutableSet.of(2));
  }

  @Test
  public void testBranchScopeReadsThroughToParent() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    VariableTrackingBranchScope branch = scope.createBranchScope();

    assertThat(branch.getParentScope()).isSameInstanceAs(scope);
    assertThat(branch.getDefinition("x")).containsExactly(1);

    branch.recordDefinitionById("x", 2);
    assertThat(branch.getDefinition("x")).containsExactly(2);
    assertThat(scope.getDefinition("x")).containsExactly(1);
    assertThat(branch.getOwnDefinitions()).containsExactly("x", ImmutableSet.of(2));
  }

  @Test
  public void testBranchesDoNotSeeEachOther() {
    VariableTrackingScope scope = new VariableTrackingScope();
    VariableTrackingBranchScope first = scope.createBranchScope();
    VariableTrackingBranchScope second = scope.createBranchScope();
    first.recordDefinitionById("x", 1);

    assertThat(second.getDefinition("x")).isEmpty();
  }

  @Test
  public void testMergeWithElse() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    scope.recordDefinitionById("y", 2);
    VariableTrackingBranchScope thenScope = scope.createBranchScope();
    thenScope.recordDefinitionById("x", 3);
    VariableTrackingBranchScope elseScope = scope.createBranchScope();
    elseScope.recordDefinitionById("x", 4);
    elseScope.recordDefinitionById("y", 5);

    scope.mergeBranchDefinitions(
        ImmutableList.of(thenScope.getOwnDefinitions(), elseScope.getOwnDefinitions()), false);

    assertThat(scope.getDefinition("x")).containsExactly(3, 4);
    // The then branch left y alone.
    assertThat(scope.getDefinition("y")).containsExactly(2, 5);
  }

  @Test
  public void testMergeWithoutElseKeepsOwnDefinitions() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    VariableTrackingBranchScope thenScope = scope.createBranchScope();
    thenScope.recordDefinitionById("x", 2);
    thenScope.recordDefinitionById("z", 3);

    scope.mergeBranchDefinitions(ImmutableList.of(thenScope.getOwnDefinitions()), true);

    assertThat(scope.getDefinition("x")).containsExactly(1, 2);
    assertThat(scope.getDefinition("z")).containsExactly(3);
  }

  @Test
  public void testMergeOfNothingChangesNothing() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);

    scope.mergeBranchDefinitions(ImmutableList.of(), true);
    scope.mergeBranchDefinitions(ImmutableList.of(ImmutableMap.of()), false);

    assertThat(scope.getDefinition("x")).containsExactly(1);
  }

  @Test
  public void testMergeUses() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordUsageById("x", 1);
    VariableTrackingBranchScope branch = scope.createBranchScope();
    branch.recordUsageById("x", 2);
    branch.recordUsageById("y", 3);

    assertThat(scope.getUses("x")).containsExactly(1);
    scope.mergeUses(branch);
    assertThat(scope.getUses("x")).containsExactly(1, 2).inOrder();
    assertThat(scope.getUses("y")).containsExactly(3);
  }

  @Test
  public void testDefinitionUpToScope() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    VariableTrackingLoopScope loop = scope.createLoopScope();
    VariableTrackingBranchScope inner = loop.createBranchScope();

    assertThat(inner.getDefinitionUpToScope("x", loop)).isNull();
    assertThat(inner.getDefinitionUpToScope("x", inner)).isNull();

    loop.recordDefinitionById("x", 2);
    assertThat(inner.getDefinitionUpToScope("x", loop)).containsExactly(2);
    assertThat(inner.getDefinitionUpToScope("x", inner)).isNull();
  }

  @Test
  public void testDefinitionUpToScopeRejectsNonAncestor() {
    VariableTrackingScope scope = new VariableTrackingScope();
    VariableTrackingBranchScope branch = scope.createBranchScope();
    VariableTrackingBranchScope unrelated = new VariableTrackingScope().createBranchScope();

    assertThrows(
        IllegalArgumentException.class, () -> branch.getDefinitionUpToScope("x", unrelated));
  }

  @Test
  public void testDefinitionsUpToScopeInnerWins() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("outside", 1);
    VariableTrackingLoopScope loop = scope.createLoopScope();
    loop.recordDefinitionById("x", 2);
    loop.recordDefinitionById("y", 3);
    VariableTrackingBranchScope inner = loop.createBranchScope();
    inner.recordDefinitionById("x", 4);

    ImmutableMap<String, ImmutableSet<Integer>> definitions = inner.getDefinitionsUpToScope(loop);

    assertThat(definitions)
        .containsExactly("x", ImmutableSet.of(4), "y", ImmutableSet.of(3));
  }

  @Test
  public void testLoopScopeCollectsExitsAndExposedUses() {
    VariableTrackingLoopScope loop = new VariableTrackingScope().createLoopScope();
    loop.recordExposedUse("x", 5);
    loop.recordExposedUse("x", 6);
    loop.recordContinue(ImmutableMap.of("x", ImmutableSet.of(7)));
    loop.recordBreak(ImmutableMap.of("y", ImmutableSet.of(8)));

    assertThat(loop.getExposedUses().get("x")).containsExactly(5, 6).inOrder();
    assertThat(loop.getContinueDefinitions())
        .containsExactly(ImmutableMap.of("x", ImmutableSet.of(7)));
    assertThat(loop.getBreakDefinitions())
        .containsExactly(ImmutableMap.of("y", ImmutableSet.of(8)));
  }

  @Test
  public void testLoopScopeReplaceDefinitions() {
    VariableTrackingScope scope = new VariableTrackingScope();
    scope.recordDefinitionById("x", 1);
    VariableTrackingLoopScope loop = scope.createLoopScope();
    loop.recordDefinitionById("x", 2);
    loop.recordDefinitionById("y", 3);

    loop.replaceDefinitions(ImmutableMap.of("y", ImmutableSet.of(4)));

    assertThat(loop.getDefinition("x")).containsExactly(1);
    assertThat(loop.getDefinition("y")).containsExactly(4);
  }
}
