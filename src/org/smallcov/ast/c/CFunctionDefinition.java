// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A function together with its body. */
public final class CFunctionDefinition implements CGlobal {

  private static final long serialVersionUID = -4206468318231878449L;

  private final FileLocation fileLocation;
  private final CFunctionDeclaration declaration;
  private final CCompoundStatement body;

  public CFunctionDefinition(
      FileLocation pFileLocation, CFunctionDeclaration pDeclaration, CCompoundStatement pBody) {
    fileLocation = checkNotNull(pFileLocation);
    declaration = checkNotNull(pDeclaration);
    body = checkNotNull(pBody);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  /** Returns the prototype of this function, with parameter names. */
  public CFunctionDeclaration getDeclaration() {
    return declaration;
  }

  public String getName() {
    return declaration.getName();
  }

  public CCompoundStatement getBody() {
    return body;
  }

  /** Return a copy of this definition whose body starts with the given statements. */
  public CFunctionDefinition withBodyPrepended(List<? extends CStatement> pStatements) {
    ImmutableList<CStatement> newBody =
        ImmutableList.<CStatement>builder()
            .addAll(pStatements)
            .addAll(body.getStatements())
            .build();
    return new CFunctionDefinition(
        fileLocation, declaration, new CCompoundStatement(body.getFileLocation(), newBody));
  }

  @Override
  public String toASTString() {
    return declaration.toPrototypeString() + "\n" + body.toASTString();
  }

  @Override
  public String toString() {
    return declaration.toPrototypeString();
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(declaration, body);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CFunctionDefinition)) {
      return false;
    }
    CFunctionDefinition other = (CFunctionDefinition) obj;
    return declaration.equals(other.declaration) && body.equals(other.body);
  }
}
