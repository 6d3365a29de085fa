// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.collect.ImmutableList.toImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Static helpers for working with {@link CType}s. */
public final class CTypes {

  private CTypes() {}

  /**
   * Check whether the given type is a pointer or an array, after resolving typedefs. Arrays count
   * because they decay to pointers in most expression contexts.
   */
  public static boolean isPointerOrArrayType(CType type) {
    CType canonical = resolveTypedefs(type);
    return canonical instanceof CPointerType || canonical instanceof CArrayType;
  }

  /**
   * Return the type a pointer or array points to, resolving typedefs on the way, or null if the
   * given type is neither.
   */
  public static @Nullable CType getPointeeType(CType type) {
    CType resolved = resolveTypedefs(type);
    if (resolved instanceof CPointerType) {
      return ((CPointerType) resolved).getType();
    } else if (resolved instanceof CArrayType) {
      return ((CArrayType) resolved).getType();
    }
    return null;
  }

  /** Strip typedefs from the top level of the given type, keeping everything below as written. */
  public static CType resolveTypedefs(CType type) {
    while (type instanceof CTypedefType) {
      type = ((CTypedefType) type).getRealType();
    }
    return type;
  }

  /**
   * Replace every typedef reachable from the given type through pointers, arrays, bit fields and
   * function signatures by its definition. The qualifiers written on a typedef name move to the
   * type it stands for. Tagged types are kept as written, so the result can be printed without
   * repeating member lists.
   */
  public static CType unrollTypedefs(CType type) {
    return type.accept(TypedefUnroller.INSTANCE);
  }

  private enum TypedefUnroller implements CTypeVisitor<CType, RuntimeException> {
    INSTANCE;

    @Override
    public CType visit(CTypedefType pTypedefType) {
      return unrollTypedefs(pTypedefType.getRealType())
          .withQualifiers(pTypedefType.isConst(), pTypedefType.isVolatile());
    }

    @Override
    public CType visit(CPointerType pPointerType) {
      CType target = unrollTypedefs(pPointerType.getType());
      return new CPointerType(pPointerType.isConst(), pPointerType.isVolatile(), target);
    }

    @Override
    public CType visit(CArrayType pArrayType) {
      return new CArrayType(
          pArrayType.isConst(),
          pArrayType.isVolatile(),
          unrollTypedefs(pArrayType.getType()),
          pArrayType.getLength());
    }

    @Override
    public CType visit(CFunctionType pFunctionType) {
      return new CFunctionType(
          unrollTypedefs(pFunctionType.getReturnType()),
          pFunctionType.getParameters().stream()
              .map(CTypes::unrollTypedefs)
              .collect(toImmutableList()),
          pFunctionType.takesVarArgs());
    }

    @Override
    public CType visit(CBitFieldType pBitFieldType) {
      return new CBitFieldType(
          unrollTypedefs(pBitFieldType.getType()), pBitFieldType.getBitFieldSize());
    }

    @Override
    public CType visit(CSimpleType pSimpleType) {
      return pSimpleType;
    }

    @Override
    public CType visit(CVoidType pVoidType) {
      return pVoidType;
    }

    @Override
    public CType visit(CCompositeType pCompositeType) {
      return pCompositeType;
    }

    @Override
    public CType visit(CElaboratedType pElaboratedType) {
      return pElaboratedType;
    }

    @Override
    public CType visit(CEnumType pEnumType) {
      return pEnumType;
    }
  }
}
