// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.smallcov.test.CProgramBuilder.LOC;
import static org.smallcov.test.CProgramBuilder.definitionOf;
import static org.smallcov.test.CProgramBuilder.enumType;
import static org.smallcov.test.CProgramBuilder.forwardDeclarationOf;
import static org.smallcov.test.CProgramBuilder.function;
import static org.smallcov.test.CProgramBuilder.member;
import static org.smallcov.test.CProgramBuilder.prototype;
import static org.smallcov.test.CProgramBuilder.struct;
import static org.smallcov.test.CProgramBuilder.typedef;
import static org.smallcov.test.CProgramBuilder.variable;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobalText;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CStorageClass;

public class InstantiationTableTest {

  private static final CCompositeType S = struct("s", member(CNumericTypes.INT, "x"));

  private static final DependencyTag TAG_S_DECL = DependencyTag.declaration(Namespace.TAG, "s");
  private static final DependencyTag TAG_S_DEF = DependencyTag.definition(Namespace.TAG, "s");
  private static final DependencyTag VAR_X_DECL =
      DependencyTag.declaration(Namespace.VARIABLE, "x");
  private static final DependencyTag VAR_X_DEF = DependencyTag.definition(Namespace.VARIABLE, "x");

  @Test
  public void testStructDefinitionGetsForwardDeclaration() throws MissingDefinitionException {
    CComplexTypeDeclaration definition = definitionOf(S);
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(definition));

    assertThat(table.size()).isEqualTo(2);
    assertThat(table.get(TAG_S_DEF)).isSameInstanceAs(definition);
    assertThat(table.resolve(TAG_S_DECL).toASTString()).isEqualTo("struct s;");
  }

  @Test
  public void testExistingDeclarationIsKept() {
    CComplexTypeDeclaration forward = forwardDeclarationOf(S);
    InstantiationTable table =
        InstantiationTable.create(ImmutableList.of(forward, definitionOf(S)));

    assertThat(table.get(TAG_S_DECL)).isSameInstanceAs(forward);
  }

  @Test
  public void testVariableDefinitionGetsExternDeclaration() throws MissingDefinitionException {
    InstantiationTable table =
        InstantiationTable.create(ImmutableList.of(variable("x", CNumericTypes.INT)));

    assertThat(table.resolve(VAR_X_DECL).toASTString()).isEqualTo("extern int x;");
  }

  @Test
  public void testStaticVariableStaysStatic() throws MissingDefinitionException {
    CVariableDeclaration staticVar =
        new CVariableDeclaration(LOC, true, CStorageClass.STATIC, CNumericTypes.INT, "x", null);
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(staticVar));

    assertThat(table.resolve(VAR_X_DECL).toASTString()).isEqualTo("static int x;");
  }

  @Test
  public void testFunctionDefinitionGetsItsPrototype() throws MissingDefinitionException {
    CFunctionDefinition f = function(prototype("f", CNumericTypes.INT));
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(f));

    assertThat(table.resolve(DependencyTag.declaration(Namespace.VARIABLE, "f")))
        .isSameInstanceAs(f.getDeclaration());
  }

  @Test
  public void testTypedefSatisfiesBothStrengths() {
    CTypeDefDeclaration t = typedef("t", CNumericTypes.INT);
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(t));

    assertThat(table.get(DependencyTag.declaration(Namespace.TYPEDEF, "t"))).isSameInstanceAs(t);
    assertThat(table.get(DependencyTag.definition(Namespace.TYPEDEF, "t"))).isSameInstanceAs(t);
  }

  @Test
  public void testLaterDefinitionWins() {
    CVariableDeclaration first = variable("x", CNumericTypes.INT);
    CVariableDeclaration second = variable("x", CNumericTypes.LONG_INT);
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(first, second));

    assertThat(table.get(VAR_X_DEF)).isSameInstanceAs(second);
  }

  @Test
  public void testUntaggedGlobalsAreIgnored() {
    InstantiationTable table =
        InstantiationTable.create(ImmutableList.of(new CGlobalText(LOC, "#pragma once")));

    assertThat(table.size()).isEqualTo(0);
  }

  @Test
  public void testAnonymousDefinitionsAreIgnored() {
    InstantiationTable table =
        InstantiationTable.create(
            ImmutableList.of(
                definitionOf(enumType("", "X")),
                definitionOf(struct("", member(CNumericTypes.INT, "y")))));

    assertThat(table.size()).isEqualTo(0);
  }

  @Test
  public void testMissingName() {
    InstantiationTable table = InstantiationTable.create(ImmutableList.of());

    MissingDefinitionException e =
        assertThrows(MissingDefinitionException.class, () -> table.resolveTag(VAR_X_DECL));
    assertThat(e.getTag()).isEqualTo(VAR_X_DECL);
  }

  @Test
  public void testDeclarationDoesNotSatisfyDefinition() {
    InstantiationTable table = InstantiationTable.create(ImmutableList.of(forwardDeclarationOf(S)));

    assertThat(table.contains(TAG_S_DECL)).isTrue();
    assertThrows(MissingDefinitionException.class, () -> table.resolveTag(TAG_S_DEF));
  }
}
