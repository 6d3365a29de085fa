// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import org.smallcov.types.c.CType;

public interface CExpression extends CAstNode {

  /** Returns the type of the value this expression evaluates to. */
  CType getExpressionType();

  <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X;

  /** Returns the source text, in parentheses unless this is an atomic expression. */
  String toParenthesizedASTString();
}
