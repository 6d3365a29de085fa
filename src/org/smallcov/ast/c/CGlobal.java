// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

/** An item at the top level of a translation unit. */
public interface CGlobal extends CAstNode {

  <R, X extends Exception> R accept(CGlobalVisitor<R, X> v) throws X;
}
