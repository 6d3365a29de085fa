// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

public interface CGlobalVisitor<R, X extends Exception> {

  R visit(CTypeDefDeclaration pDecl) throws X;

  R visit(CComplexTypeDeclaration pDecl) throws X;

  R visit(CVariableDeclaration pDecl) throws X;

  R visit(CFunctionDeclaration pDecl) throws X;

  R visit(CFunctionDefinition pDef) throws X;

  R visit(CGlobalText pText) throws X;
}
