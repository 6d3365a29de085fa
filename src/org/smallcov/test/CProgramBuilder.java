// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.test;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CCompoundStatement;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CDeclarationStatement;
import org.smallcov.ast.c.CExpression;
import org.smallcov.ast.c.CExpressionStatement;
import org.smallcov.ast.c.CFieldReference;
import org.smallcov.ast.c.CFunctionCallExpression;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CIdExpression;
import org.smallcov.ast.c.CInitializerExpression;
import org.smallcov.ast.c.CIntegerLiteralExpression;
import org.smallcov.ast.c.CParameterDeclaration;
import org.smallcov.ast.c.CReturnStatement;
import org.smallcov.ast.c.CSimpleDeclaration;
import org.smallcov.ast.c.CStatement;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CTypeIdExpression;
import org.smallcov.ast.c.CTypeIdExpression.TypeIdOperator;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.ast.c.FileLocation;
import org.smallcov.types.c.CArrayType;
import org.smallcov.types.c.CComplexType;
import org.smallcov.types.c.CComplexType.ComplexTypeKind;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CCompositeType.CCompositeTypeMemberDeclaration;
import org.smallcov.types.c.CElaboratedType;
import org.smallcov.types.c.CEnumType;
import org.smallcov.types.c.CEnumType.CEnumerator;
import org.smallcov.types.c.CFunctionType;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CPointerType;
import org.smallcov.types.c.CStorageClass;
import org.smallcov.types.c.CType;

/**
 * Shorthands for building small C programs in unit tests, where no parser is available. All nodes
 * get the same dummy location.
 */
public final class CProgramBuilder {

  public static final FileLocation LOC = new FileLocation("test.c", 1);

  private CProgramBuilder() {}

  // types

  public static CCompositeTypeMemberDeclaration member(CType pType, String pName) {
    return new CCompositeTypeMemberDeclaration(pType, pName);
  }

  /** An enum whose constants have no explicit values. An empty name makes it anonymous. */
  public static CEnumType enumType(String pName, String... pEnumerators) {
    ImmutableList<CEnumerator> enumerators =
        Arrays.stream(pEnumerators)
            .map(name -> new CEnumerator(name, null))
            .collect(toImmutableList());
    return new CEnumType(false, false, enumerators, pName);
  }

  /** A named struct with the given members. */
  public static CCompositeType struct(String pName, CCompositeTypeMemberDeclaration... pMembers) {
    return new CCompositeType(
        false, false, ComplexTypeKind.STRUCT, ImmutableList.copyOf(pMembers), pName);
  }

  /** A named struct whose members are set later, for self-referencing types. */
  public static CCompositeType incompleteStruct(String pName) {
    return new CCompositeType(false, false, ComplexTypeKind.STRUCT, pName);
  }

  /** The type <code>struct name</code> as written in a declaration that uses the struct. */
  public static CElaboratedType structRef(String pName) {
    return new CElaboratedType(false, false, ComplexTypeKind.STRUCT, pName, null);
  }

  public static CElaboratedType ref(CComplexType pType) {
    return new CElaboratedType(false, false, pType.getKind(), pType.getName(), pType);
  }

  public static CPointerType pointer(CType pType) {
    return new CPointerType(false, false, pType);
  }

  public static CArrayType array(CType pType, int pLength) {
    return new CArrayType(
        false,
        false,
        pType,
        CIntegerLiteralExpression.createDummyLiteral(pLength, CNumericTypes.SIZE_T));
  }

  // globals

  public static CComplexTypeDeclaration definitionOf(CComplexType pType) {
    return new CComplexTypeDeclaration(LOC, true, pType);
  }

  public static CComplexTypeDeclaration forwardDeclarationOf(CComplexType pType) {
    return CComplexTypeDeclaration.forwardDeclarationOf(LOC, pType);
  }

  public static CTypeDefDeclaration typedef(String pName, CType pType) {
    return new CTypeDefDeclaration(LOC, true, pType, pName);
  }

  /** A global variable definition without initializer. */
  public static CVariableDeclaration variable(String pName, CType pType) {
    return new CVariableDeclaration(LOC, true, CStorageClass.AUTO, pType, pName, null);
  }

  public static CVariableDeclaration variable(String pName, CType pType, CExpression pInit) {
    return new CVariableDeclaration(
        LOC, true, CStorageClass.AUTO, pType, pName, new CInitializerExpression(LOC, pInit));
  }

  public static CVariableDeclaration externVariable(String pName, CType pType) {
    return new CVariableDeclaration(LOC, true, CStorageClass.EXTERN, pType, pName, null);
  }

  /** A declaration inside a function body. */
  public static CDeclarationStatement local(CDeclaration pDeclaration) {
    return new CDeclarationStatement(LOC, pDeclaration);
  }

  public static CParameterDeclaration parameter(CType pType, String pName) {
    return new CParameterDeclaration(pType, pName);
  }

  /** A prototype with named parameters. */
  public static CFunctionDeclaration prototype(
      String pName, CType pReturnType, CParameterDeclaration... pParameters) {
    ImmutableList<CParameterDeclaration> params = ImmutableList.copyOf(pParameters);
    CFunctionType type =
        new CFunctionType(
            pReturnType,
            params.stream().map(CParameterDeclaration::getType).collect(toImmutableList()),
            false);
    return new CFunctionDeclaration(LOC, type, pName, params, CStorageClass.AUTO);
  }

  /** A prototype the parser made up for a call of an undeclared function. */
  public static CFunctionDeclaration missingPrototype(String pName) {
    CFunctionType type = new CFunctionType(CNumericTypes.INT, ImmutableList.of(), false);
    return new CFunctionDeclaration(
        LOC, type, pName, ImmutableList.of(), CStorageClass.EXTERN, true);
  }

  public static CFunctionDefinition function(
      CFunctionDeclaration pDeclaration, CStatement... pBody) {
    return new CFunctionDefinition(
        LOC, pDeclaration, new CCompoundStatement(LOC, ImmutableList.copyOf(pBody)));
  }

  // expressions and statements

  public static CIdExpression id(CSimpleDeclaration pDeclaration) {
    return new CIdExpression(LOC, pDeclaration);
  }

  /** The member access <code>owner-&gt;name</code>. */
  public static CFieldReference arrow(CExpression pOwner, String pName, CType pType) {
    return new CFieldReference(LOC, pType, pName, pOwner, true);
  }

  public static CTypeIdExpression sizeof(CType pType) {
    return new CTypeIdExpression(LOC, CNumericTypes.SIZE_T, TypeIdOperator.SIZEOF, pType);
  }

  public static CFunctionCallExpression call(
      CFunctionDeclaration pFunction, CExpression... pArguments) {
    return new CFunctionCallExpression(
        LOC,
        pFunction.getType().getReturnType(),
        id(pFunction),
        ImmutableList.copyOf(pArguments),
        pFunction);
  }

  public static CExpressionStatement statement(CExpression pExpression) {
    return new CExpressionStatement(LOC, pExpression);
  }

  public static CReturnStatement returnStatement(CExpression pExpression) {
    return new CReturnStatement(LOC, pExpression);
  }
}
