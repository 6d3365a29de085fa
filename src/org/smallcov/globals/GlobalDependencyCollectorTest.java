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
import static org.smallcov.test.CProgramBuilder.array;
import static org.smallcov.test.CProgramBuilder.arrow;
import static org.smallcov.test.CProgramBuilder.definitionOf;
import static org.smallcov.test.CProgramBuilder.enumType;
import static org.smallcov.test.CProgramBuilder.function;
import static org.smallcov.test.CProgramBuilder.id;
import static org.smallcov.test.CProgramBuilder.incompleteStruct;
import static org.smallcov.test.CProgramBuilder.local;
import static org.smallcov.test.CProgramBuilder.member;
import static org.smallcov.test.CProgramBuilder.parameter;
import static org.smallcov.test.CProgramBuilder.pointer;
import static org.smallcov.test.CProgramBuilder.prototype;
import static org.smallcov.test.CProgramBuilder.ref;
import static org.smallcov.test.CProgramBuilder.returnStatement;
import static org.smallcov.test.CProgramBuilder.sizeof;
import static org.smallcov.test.CProgramBuilder.statement;
import static org.smallcov.test.CProgramBuilder.struct;
import static org.smallcov.test.CProgramBuilder.typedef;
import static org.smallcov.test.CProgramBuilder.variable;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.smallcov.ast.c.CCompoundStatement;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CParameterDeclaration;
import org.smallcov.ast.c.CStatement;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.globals.GlobalDependencyCollector.Dependencies;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CEnumType;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CStorageClass;
import org.smallcov.types.c.CTypedefType;
import org.smallcov.types.c.CVoidType;

public class GlobalDependencyCollectorTest {

  private static final CCompositeType B = struct("b", member(CNumericTypes.INT, "x"));

  private static final DependencyTag B_DECL = DependencyTag.declaration(Namespace.TAG, "b");
  private static final DependencyTag B_DEF = DependencyTag.definition(Namespace.TAG, "b");

  private static Dependencies collect(CGlobal pGlobal, CGlobal... pOthers)
      throws MissingDefinitionException {
    ImmutableList<CGlobal> program =
        ImmutableList.<CGlobal>builder().add(pOthers).add(pGlobal).build();
    GlobalDependencyCollector collector =
        new GlobalDependencyCollector(InstantiationTable.create(program));
    DependencyTag tag = GlobalDependencies.getDependencyTag(pGlobal).orElseThrow();
    return collector.collectDependencies(pGlobal, tag);
  }

  @Test
  public void testPointerNeedsDeclaration() throws MissingDefinitionException {
    CCompositeType a = struct("a", member(pointer(ref(B)), "p"));
    Dependencies deps = collect(definitionOf(a), definitionOf(B));

    assertThat(deps.getDependencies()).containsExactly(B_DECL);
    assertThat(deps.containsArrayType()).isFalse();
  }

  @Test
  public void testDirectMemberNeedsDefinition() throws MissingDefinitionException {
    CCompositeType a = struct("a", member(ref(B), "inner"));

    assertThat(collect(definitionOf(a), definitionOf(B)).getDependencies())
        .containsExactly(B_DEF);
  }

  @Test
  public void testArrayNeedsDefinition() throws MissingDefinitionException {
    CCompositeType a =
        struct("a", member(array(pointer(ref(B)), 3), "ptrs"), member(array(ref(B), 3), "arr"));
    Dependencies deps = collect(definitionOf(a), definitionOf(B));

    // an array of pointers still needs only the declaration
    assertThat(deps.getDependencies()).containsExactly(B_DECL, B_DEF).inOrder();
    assertThat(deps.containsArrayType()).isTrue();
  }

  @Test
  public void testTypedefUsesRequestedStrength() throws MissingDefinitionException {
    CTypeDefDeclaration bt = typedef("b_t", ref(B));
    Dependencies deps = collect(bt, definitionOf(B));

    assertThat(deps.getDependencies()).containsExactly(B_DECL);
    assertThat(deps.containsArrayType()).isFalse();
  }

  @Test
  public void testTypedefOfArray() throws MissingDefinitionException {
    CTypeDefDeclaration arr = typedef("arr_t", array(ref(B), 3));
    Dependencies deps = collect(arr, definitionOf(B));

    assertThat(deps.getDependencies()).containsExactly(B_DEF);
    assertThat(deps.containsArrayType()).isTrue();
  }

  @Test
  public void testSizeofNeedsDefinition() throws MissingDefinitionException {
    CVariableDeclaration n = variable("n", CNumericTypes.SIZE_T, sizeof(pointer(ref(B))));
    assertThat(collect(n, definitionOf(B)).getDependencies()).containsExactly(B_DECL);

    CVariableDeclaration m = variable("m", CNumericTypes.SIZE_T, sizeof(ref(B)));
    assertThat(collect(m, definitionOf(B)).getDependencies()).containsExactly(B_DEF);
  }

  @Test
  public void testReferencedGlobalNeedsDeclaration() throws MissingDefinitionException {
    CVariableDeclaration g = variable("g", CNumericTypes.INT);
    CFunctionDefinition f =
        function(prototype("f", CNumericTypes.INT), statement(id(g)), returnStatement(id(g)));

    assertThat(collect(f, g).getDependencies())
        .containsExactly(DependencyTag.declaration(Namespace.VARIABLE, "g"));
  }

  @Test
  public void testFieldAccessThroughPointer() throws MissingDefinitionException {
    CParameterDeclaration p = parameter(pointer(ref(B)), "p");
    CFunctionDefinition f =
        function(
            prototype("f", CNumericTypes.INT, p),
            returnStatement(arrow(id(p), "x", CNumericTypes.INT)));

    assertThat(collect(f, definitionOf(B)).getDependencies())
        .containsExactly(B_DECL, B_DEF)
        .inOrder();
  }

  @Test
  public void testSelfReferenceIsDropped() throws MissingDefinitionException {
    CCompositeType node = incompleteStruct("node");
    node.setMembers(ImmutableList.of(member(pointer(ref(node)), "next")));

    assertThat(collect(definitionOf(node)).getDependencies()).isEmpty();
  }

  @Test
  public void testUndeclaredGlobal() {
    // g is referenced by f, but not part of the program
    CVariableDeclaration g = variable("g", CNumericTypes.INT);
    CFunctionDefinition f = function(prototype("f", CNumericTypes.INT), returnStatement(id(g)));

    MissingDefinitionException e =
        assertThrows(MissingDefinitionException.class, () -> collect(f));
    assertThat(e.getTag()).isEqualTo(DependencyTag.declaration(Namespace.VARIABLE, "g"));
  }

  @Test
  public void testEnumeratorNeedsDefinitionOfEnum() throws MissingDefinitionException {
    CEnumType color = enumType("color", "RED");
    CVariableDeclaration g = variable("g", CNumericTypes.INT, id(color.getEnumerators().get(0)));

    assertThat(collect(g, definitionOf(color)).getDependencies())
        .containsExactly(DependencyTag.definition(Namespace.TAG, "color"));
  }

  @Test
  public void testBlockScopeTypedefEndsWithItsBlock() throws MissingDefinitionException {
    CTypeDefDeclaration globalT = typedef("T", CNumericTypes.LONG_INT);
    CTypedefType t = new CTypedefType(false, false, "T", CNumericTypes.INT);
    CStatement inner =
        new CCompoundStatement(
            LOC,
            ImmutableList.of(
                local(new CTypeDefDeclaration(LOC, false, CNumericTypes.INT, "T")),
                local(new CVariableDeclaration(LOC, false, CStorageClass.AUTO, t, "x", null))));
    CFunctionDefinition f =
        function(
            prototype("f", CVoidType.VOID),
            inner,
            local(new CVariableDeclaration(LOC, false, CStorageClass.AUTO, t, "y", null)));

    // only y, declared after the block, refers to the global typedef
    assertThat(collect(f, globalT).getDependencies())
        .containsExactly(DependencyTag.definition(Namespace.TYPEDEF, "T"));
  }
}
