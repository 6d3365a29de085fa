// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.types.c.CStorageClass;

/**
 * Maps every {@link DependencyTag} of a program to the global that satisfies it. Every definition
 * is accompanied by a declaration of the same name, which is synthesized if the program has none.
 */
public final class InstantiationTable {

  private final ImmutableMap<DependencyTag, CGlobal> instantiations;

  private InstantiationTable(Map<DependencyTag, CGlobal> pInstantiations) {
    instantiations = ImmutableMap.copyOf(pInstantiations);
  }

  /** Build the table for the given globals. Later globals replace earlier ones with equal tags. */
  public static InstantiationTable create(Iterable<? extends CGlobal> pGlobals) {
    Map<DependencyTag, CGlobal> table = new LinkedHashMap<>();
    for (CGlobal global : pGlobals) {
      Optional<DependencyTag> maybeTag = GlobalDependencies.getDependencyTag(global);
      if (!maybeTag.isPresent()) {
        continue;
      }
      DependencyTag tag = maybeTag.orElseThrow();

      if (tag.getNamespace() == Namespace.TYPEDEF) {
        // a typedef satisfies both strengths
        table.put(tag.withDefinition(false), global);
        table.put(tag.withDefinition(true), global);

      } else if (tag.isDefinition()) {
        DependencyTag declarationTag = tag.withDefinition(false);
        if (!table.containsKey(declarationTag)) {
          CGlobal declaration = synthesizeDeclaration(global);
          if (declaration != null) {
            table.put(declarationTag, declaration);
          }
        }
        table.put(tag, global);

      } else {
        table.put(tag, global);
      }
    }
    return new InstantiationTable(table);
  }

  /** Returns a declaration-only counterpart of the given definition. */
  private static @Nullable CGlobal synthesizeDeclaration(CGlobal pDefinition) {
    if (pDefinition instanceof CComplexTypeDeclaration) {
      CComplexTypeDeclaration def = (CComplexTypeDeclaration) pDefinition;
      return CComplexTypeDeclaration.forwardDeclarationOf(def.getFileLocation(), def.getType());

    } else if (pDefinition instanceof CVariableDeclaration) {
      CVariableDeclaration def = (CVariableDeclaration) pDefinition;
      CStorageClass storage =
          def.getCStorageClass() == CStorageClass.STATIC
              ? CStorageClass.STATIC
              : CStorageClass.EXTERN;
      return new CVariableDeclaration(
          def.getFileLocation(), true, storage, def.getType(), def.getName(), null);

    } else if (pDefinition instanceof CFunctionDefinition) {
      return ((CFunctionDefinition) pDefinition).getDeclaration();
    }
    return null;
  }

  public boolean contains(DependencyTag pTag) {
    return instantiations.containsKey(pTag);
  }

  public @Nullable CGlobal get(DependencyTag pTag) {
    return instantiations.get(pTag);
  }

  /**
   * Find the tag under which a requested tag is satisfied: the tag itself if present, otherwise
   * the definition of the same name.
   *
   * @throws MissingDefinitionException if neither is present
   */
  public DependencyTag resolveTag(DependencyTag pTag) throws MissingDefinitionException {
    if (instantiations.containsKey(pTag)) {
      return pTag;
    }
    DependencyTag definitionTag = pTag.withDefinition(true);
    if (instantiations.containsKey(definitionTag)) {
      return definitionTag;
    }
    throw new MissingDefinitionException(pTag);
  }

  /** Returns the global satisfying the given tag, see {@link #resolveTag(DependencyTag)}. */
  public CGlobal resolve(DependencyTag pTag) throws MissingDefinitionException {
    return instantiations.get(resolveTag(pTag));
  }

  public int size() {
    return instantiations.size();
  }

  @Override
  public String toString() {
    return instantiations.keySet().toString();
  }
}
