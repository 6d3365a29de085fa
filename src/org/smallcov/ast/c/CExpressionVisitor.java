// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

public interface CExpressionVisitor<R, X extends Exception> {

  R visit(CIdExpression e) throws X;

  R visit(CIntegerLiteralExpression e) throws X;

  R visit(CCharLiteralExpression e) throws X;

  R visit(CFloatLiteralExpression e) throws X;

  R visit(CStringLiteralExpression e) throws X;

  R visit(CUnaryExpression e) throws X;

  R visit(CTypeIdExpression e) throws X;

  R visit(CBinaryExpression e) throws X;

  R visit(CCastExpression e) throws X;

  R visit(CFieldReference e) throws X;

  R visit(CArraySubscriptExpression e) throws X;

  R visit(CPointerExpression e) throws X;

  R visit(CFunctionCallExpression e) throws X;
}
