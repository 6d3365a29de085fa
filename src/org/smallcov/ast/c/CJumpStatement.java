// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** {@code break}, {@code continue}, or {@code goto label}. */
public final class CJumpStatement extends AbstractStatement {

  private static final long serialVersionUID = 5938318367187913431L;

  public enum Kind {
    BREAK,
    CONTINUE,
    GOTO
  }

  private final Kind kind;
  private final @Nullable String label;

  public CJumpStatement(FileLocation pFileLocation, Kind pKind, @Nullable String pLabel) {
    super(pFileLocation);
    kind = checkNotNull(pKind);
    checkArgument((kind == Kind.GOTO) == (pLabel != null), "only goto has a label");
    label = pLabel;
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable String getLabel() {
    return label;
  }

  @Override
  public String toASTString() {
    switch (kind) {
      case BREAK:
        return "break;";
      case CONTINUE:
        return "continue;";
      case GOTO:
        return "goto " + label + ";";
      default:
        throw new AssertionError("Unhandled jump kind " + kind);
    }
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, label);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CJumpStatement)) {
      return false;
    }
    CJumpStatement other = (CJumpStatement) obj;
    return kind == other.kind && Objects.equals(label, other.label);
  }
}
