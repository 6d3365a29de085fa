// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.smallcov.test.CProgramBuilder.LOC;
import static org.smallcov.test.CProgramBuilder.array;
import static org.smallcov.test.CProgramBuilder.arrow;
import static org.smallcov.test.CProgramBuilder.definitionOf;
import static org.smallcov.test.CProgramBuilder.enumType;
import static org.smallcov.test.CProgramBuilder.forwardDeclarationOf;
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
import static org.smallcov.test.CProgramBuilder.struct;
import static org.smallcov.test.CProgramBuilder.structRef;
import static org.smallcov.test.CProgramBuilder.typedef;
import static org.smallcov.test.CProgramBuilder.variable;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CGlobalText;
import org.smallcov.ast.c.CParameterDeclaration;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CEnumType;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CStorageClass;
import org.smallcov.types.c.CTypedefType;
import org.smallcov.types.c.CVoidType;

public class GlobalsSorterTest {

  private static final CCompositeType A = struct("A", member(CNumericTypes.INT, "x"));

  private static ImmutableList<String> print(List<CGlobal> pGlobals) {
    return pGlobals.stream().map(CGlobal::toASTString).collect(toImmutableList());
  }

  /** Check that everything a global needs is placed before it. */
  private static void assertDependenciesFirst(List<CGlobal> pSorted)
      throws MissingDefinitionException {
    InstantiationTable table = InstantiationTable.create(pSorted);
    GlobalDependencyCollector collector = new GlobalDependencyCollector(table);
    for (int i = 0; i < pSorted.size(); i++) {
      CGlobal global = pSorted.get(i);
      DependencyTag tag = GlobalDependencies.getDependencyTag(global).orElseThrow();
      for (DependencyTag dep : collector.collectDependencies(global, tag).getDependencies()) {
        int depIndex = pSorted.indexOf(table.resolve(dep));
        if (depIndex < 0) {
          // declaration made up by the table, the definition has to come first then
          depIndex = pSorted.indexOf(table.get(dep.withDefinition(true)));
        }
        assertThat(depIndex).isAtLeast(0);
        assertThat(depIndex).isLessThan(i);
      }
    }
  }

  private static CFunctionDefinition usesStructByPointer() {
    CParameterDeclaration p = parameter(pointer(structRef("A")), "p");
    return function(prototype("f", CVoidType.VOID, p));
  }

  private static CFunctionDefinition readsFieldOfStruct() {
    CParameterDeclaration p = parameter(pointer(structRef("A")), "p");
    return function(
        prototype("f", CNumericTypes.INT, p),
        returnStatement(arrow(id(p), "x", CNumericTypes.INT)));
  }

  @Test
  public void testPointerUseNeedsOnlyForwardDeclaration() throws MissingDefinitionException {
    CComplexTypeDeclaration forward = forwardDeclarationOf(A);
    CFunctionDefinition f = usesStructByPointer();

    assertThat(GlobalsSorter.sort(ImmutableList.of(f), ImmutableList.of(forward, f)))
        .containsExactly(forward, f)
        .inOrder();
  }

  @Test
  public void testFieldAccessWithoutDefinitionFails() {
    CFunctionDefinition f = readsFieldOfStruct();

    MissingDefinitionException e =
        assertThrows(
            MissingDefinitionException.class,
            () ->
                GlobalsSorter.sort(
                    ImmutableList.of(f), ImmutableList.of(forwardDeclarationOf(A), f)));
    assertThat(e.getTag()).isEqualTo(DependencyTag.definition(Namespace.TAG, "A"));
  }

  @Test
  public void testFieldAccessPullsInDefinition() throws MissingDefinitionException {
    CComplexTypeDeclaration forward = forwardDeclarationOf(A);
    CComplexTypeDeclaration definition = definitionOf(A);
    CFunctionDefinition f = readsFieldOfStruct();

    List<CGlobal> sorted =
        GlobalsSorter.sort(ImmutableList.of(f), ImmutableList.of(forward, f, definition));

    assertThat(sorted).containsExactly(forward, definition, f).inOrder();
    assertDependenciesFirst(sorted);
  }

  @Test
  public void testOnlyNeededGlobalsAreExtracted() throws MissingDefinitionException {
    CVariableDeclaration unused = variable("unused", CNumericTypes.INT);
    CFunctionDefinition f = usesStructByPointer();

    assertThat(
            GlobalsSorter.sort(
                ImmutableList.of(f), ImmutableList.of(unused, definitionOf(A), f)))
        .doesNotContain(unused);
  }

  @Test
  public void testUseBeforeDefinition() throws MissingDefinitionException {
    CVariableDeclaration g = variable("g", CNumericTypes.INT);
    CFunctionDefinition f = function(prototype("f", CNumericTypes.INT), returnStatement(id(g)));

    List<CGlobal> sorted = GlobalsSorter.sort(ImmutableList.of(), ImmutableList.of(f, g));

    assertThat(print(sorted))
        .containsExactly("extern int g;", f.toASTString(), "int g;")
        .inOrder();
    assertDependenciesFirst(sorted);
  }

  @Test
  public void testPointerCycle() throws MissingDefinitionException {
    CCompositeType a = struct("A", member(pointer(structRef("B")), "b"));
    CCompositeType b = struct("B", member(pointer(structRef("A")), "a"));

    List<CGlobal> sorted =
        GlobalsSorter.sort(ImmutableList.of(), ImmutableList.of(definitionOf(a), definitionOf(b)));

    assertThat(print(sorted))
        .containsExactly(
            "struct B;", "struct A {\n  struct B *b;\n};", "struct B {\n  struct A *a;\n};")
        .inOrder();
    assertDependenciesFirst(sorted);
  }

  @Test
  public void testSelfReferencingTypedef() throws MissingDefinitionException {
    CTypeDefDeclaration nodeT = typedef("node_t", structRef("node"));
    CCompositeType node = incompleteStruct("node");
    node.setMembers(
        ImmutableList.of(
            member(pointer(new CTypedefType(false, false, "node_t", ref(node))), "next")));

    List<CGlobal> sorted =
        GlobalsSorter.sort(ImmutableList.of(), ImmutableList.of(nodeT, definitionOf(node)));

    assertThat(print(sorted))
        .containsExactly(
            "struct node;", "typedef struct node node_t;", "struct node {\n  node_t *next;\n};")
        .inOrder();
  }

  @Test
  public void testTypedefOfArrayNeedsDefinition() throws MissingDefinitionException {
    CTypeDefDeclaration arrT = typedef("arr_t", array(ref(A), 2));
    CComplexTypeDeclaration definition = definitionOf(A);

    assertThat(
            GlobalsSorter.sort(ImmutableList.of(arrT), ImmutableList.of(arrT, definition)))
        .containsExactly(definition, arrT)
        .inOrder();

    assertThrows(
        MissingDefinitionException.class,
        () ->
            GlobalsSorter.sort(
                ImmutableList.of(arrT), ImmutableList.of(arrT, forwardDeclarationOf(A))));
  }

  @Test
  public void testNoDeclarationAfterDefinition() throws MissingDefinitionException {
    CComplexTypeDeclaration definition = definitionOf(A);

    assertThat(
            GlobalsSorter.sort(
                ImmutableList.of(), ImmutableList.of(definition, forwardDeclarationOf(A))))
        .containsExactly(definition);
  }

  @Test
  public void testSortedOrderIsFixedPoint() throws MissingDefinitionException {
    CCompositeType a = struct("A", member(pointer(structRef("B")), "b"));
    CCompositeType b = struct("B", member(pointer(structRef("A")), "a"));
    CVariableDeclaration g = variable("g", ref(a));
    CFunctionDefinition f = function(prototype("f", CNumericTypes.INT), returnStatement(id(g)));

    ImmutableList<CGlobal> once =
        GlobalsSorter.sort(
            ImmutableList.of(), ImmutableList.of(f, g, definitionOf(b), definitionOf(a)));
    ImmutableList<CGlobal> twice = GlobalsSorter.sort(ImmutableList.of(), once);

    assertThat(print(twice)).containsExactlyElementsIn(print(once)).inOrder();
    assertDependenciesFirst(once);
  }

  @Test
  public void testUntaggedGlobalsKeepTheirPlace() throws MissingDefinitionException {
    CGlobalText pragma = new CGlobalText(LOC, "#pragma once");
    CGlobalText trailer = new CGlobalText(LOC, "/* end */");
    CVariableDeclaration g = variable("g", CNumericTypes.INT);
    CFunctionDefinition f = function(prototype("f", CNumericTypes.INT), returnStatement(id(g)));

    assertThat(GlobalsSorter.sortPreservingUntagged(ImmutableList.of(pragma, g, f, trailer)))
        .containsExactly(pragma, g, f, trailer)
        .inOrder();
  }

  @Test
  public void testEnumeratorPullsInItsEnum() throws MissingDefinitionException {
    CEnumType color = enumType("color", "RED", "GREEN");
    CComplexTypeDeclaration colorDefinition = definitionOf(color);
    CFunctionDefinition f =
        function(
            prototype("f", CNumericTypes.INT), returnStatement(id(color.getEnumerators().get(0))));

    List<CGlobal> sorted =
        GlobalsSorter.sort(ImmutableList.of(f), ImmutableList.of(f, colorDefinition));

    assertThat(sorted).containsExactly(colorDefinition, f).inOrder();
    assertDependenciesFirst(sorted);
  }

  @Test
  public void testAnonymousTypesKeepTheirPlace() throws MissingDefinitionException {
    CEnumType first = enumType("", "X");
    CComplexTypeDeclaration firstDefinition = definitionOf(first);
    CComplexTypeDeclaration secondDefinition = definitionOf(enumType("", "Y"));
    CVariableDeclaration g =
        variable("g", CNumericTypes.INT, id(first.getEnumerators().get(0)));

    assertThat(
            GlobalsSorter.sortPreservingUntagged(
                ImmutableList.of(firstDefinition, secondDefinition, g)))
        .containsExactly(firstDefinition, secondDefinition, g)
        .inOrder();
  }

  @Test
  public void testBlockScopeTypesNeedNoGlobals() throws MissingDefinitionException {
    CTypedefType localT = new CTypedefType(false, false, "T", CNumericTypes.INT);
    CCompositeType node = struct("node", member(pointer(structRef("node")), "next"));
    CFunctionDefinition f =
        function(
            prototype("f", CVoidType.VOID),
            local(new CTypeDefDeclaration(LOC, false, CNumericTypes.INT, "T")),
            local(new CVariableDeclaration(LOC, false, CStorageClass.AUTO, localT, "x", null)),
            local(new CComplexTypeDeclaration(LOC, false, node)),
            local(
                new CVariableDeclaration(
                    LOC, false, CStorageClass.AUTO, pointer(ref(node)), "head", null)));

    assertThat(GlobalsSorter.sortPreservingUntagged(ImmutableList.of(f))).containsExactly(f);
  }
}
