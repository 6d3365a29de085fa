// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

public interface CTypeVisitor<R, X extends Exception> {

  R visit(CArrayType pArrayType) throws X;

  R visit(CCompositeType pCompositeType) throws X;

  R visit(CElaboratedType pElaboratedType) throws X;

  R visit(CEnumType pEnumType) throws X;

  R visit(CFunctionType pFunctionType) throws X;

  R visit(CPointerType pPointerType) throws X;

  R visit(CSimpleType pSimpleType) throws X;

  R visit(CTypedefType pTypedefType) throws X;

  R visit(CVoidType pVoidType) throws X;

  R visit(CBitFieldType pCBitFieldType) throws X;
}
