// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import java.util.Optional;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CGlobalText;
import org.smallcov.ast.c.CGlobalVisitor;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.exceptions.NoException;

/** Utilities for the identity of top-level declarations. */
public final class GlobalDependencies {

  private static final TagVisitor TAG_VISITOR = new TagVisitor();

  private GlobalDependencies() {}

  /**
   * Returns the tag of the given global, or an empty optional for items that have no identity:
   * pragmas and similar text, and top-level definitions of anonymous structs, unions and enums.
   */
  public static Optional<DependencyTag> getDependencyTag(CGlobal pGlobal) {
    return pGlobal.accept(TAG_VISITOR);
  }

  private static class TagVisitor implements CGlobalVisitor<Optional<DependencyTag>, NoException> {

    @Override
    public Optional<DependencyTag> visit(CTypeDefDeclaration pDecl) {
      return Optional.of(DependencyTag.declaration(Namespace.TYPEDEF, pDecl.getName()));
    }

    @Override
    public Optional<DependencyTag> visit(CComplexTypeDeclaration pDecl) {
      if (pDecl.getName().isEmpty()) {
        // nothing can refer to an anonymous type by name, so it stays where it is
        return Optional.empty();
      }
      return Optional.of(DependencyTag.of(Namespace.TAG, pDecl.isDefinition(), pDecl.getName()));
    }

    @Override
    public Optional<DependencyTag> visit(CVariableDeclaration pDecl) {
      return Optional.of(
          DependencyTag.of(Namespace.VARIABLE, pDecl.isDefinition(), pDecl.getName()));
    }

    @Override
    public Optional<DependencyTag> visit(CFunctionDeclaration pDecl) {
      return Optional.of(DependencyTag.declaration(Namespace.VARIABLE, pDecl.getName()));
    }

    @Override
    public Optional<DependencyTag> visit(CFunctionDefinition pDef) {
      return Optional.of(DependencyTag.definition(Namespace.VARIABLE, pDef.getName()));
    }

    @Override
    public Optional<DependencyTag> visit(CGlobalText pText) {
      return Optional.empty();
    }
  }
}
