// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

/**
 * Visitor base class that delegates every case to {@link #visitDefault(CType)}. Subclasses
 * override only the cases they are interested in.
 */
public abstract class DefaultCTypeVisitor<R, X extends Exception> implements CTypeVisitor<R, X> {

  public abstract R visitDefault(CType pT) throws X;

  @Override
  public R visit(CArrayType pArrayType) throws X {
    return visitDefault(pArrayType);
  }

  @Override
  public R visit(CCompositeType pCompositeType) throws X {
    return visitDefault(pCompositeType);
  }

  @Override
  public R visit(CElaboratedType pElaboratedType) throws X {
    return visitDefault(pElaboratedType);
  }

  @Override
  public R visit(CEnumType pEnumType) throws X {
    return visitDefault(pEnumType);
  }

  @Override
  public R visit(CFunctionType pFunctionType) throws X {
    return visitDefault(pFunctionType);
  }

  @Override
  public R visit(CPointerType pPointerType) throws X {
    return visitDefault(pPointerType);
  }

  @Override
  public R visit(CSimpleType pSimpleType) throws X {
    return visitDefault(pSimpleType);
  }

  @Override
  public R visit(CTypedefType pTypedefType) throws X {
    return visitDefault(pTypedefType);
  }

  @Override
  public R visit(CVoidType pVoidType) throws X {
    return visitDefault(pVoidType);
  }

  @Override
  public R visit(CBitFieldType pCBitFieldType) throws X {
    return visitDefault(pCBitFieldType);
  }
}
