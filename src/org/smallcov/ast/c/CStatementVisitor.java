// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

public interface CStatementVisitor<R, X extends Exception> {

  R visit(CCompoundStatement pStatement) throws X;

  R visit(CExpressionStatement pStatement) throws X;

  R visit(CExpressionAssignmentStatement pStatement) throws X;

  R visit(CFunctionCallStatement pStatement) throws X;

  R visit(CDeclarationStatement pStatement) throws X;

  R visit(CIfStatement pStatement) throws X;

  R visit(CWhileStatement pStatement) throws X;

  R visit(CForStatement pStatement) throws X;

  R visit(CReturnStatement pStatement) throws X;

  R visit(CJumpStatement pStatement) throws X;

  R visit(CLabeledStatement pStatement) throws X;
}
