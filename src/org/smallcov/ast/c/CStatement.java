// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

public interface CStatement extends CAstNode {

  <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X;
}
