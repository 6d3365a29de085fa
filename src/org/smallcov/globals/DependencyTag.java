// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identity of a top-level declaration: its namespace, its name, and whether it is the definition
 * or only a declaration of that name.
 */
@Immutable
public final class DependencyTag {

  private final Namespace namespace;
  private final boolean isDefinition;
  private final String name;

  private DependencyTag(Namespace pNamespace, boolean pIsDefinition, String pName) {
    namespace = checkNotNull(pNamespace);
    isDefinition = pIsDefinition;
    name = checkNotNull(pName);
  }

  public static DependencyTag of(Namespace pNamespace, boolean pIsDefinition, String pName) {
    return new DependencyTag(pNamespace, pIsDefinition, pName);
  }

  public static DependencyTag declaration(Namespace pNamespace, String pName) {
    return new DependencyTag(pNamespace, false, pName);
  }

  public static DependencyTag definition(Namespace pNamespace, String pName) {
    return new DependencyTag(pNamespace, true, pName);
  }

  public Namespace getNamespace() {
    return namespace;
  }

  public boolean isDefinition() {
    return isDefinition;
  }

  public String getName() {
    return name;
  }

  /** Returns the tag with the same namespace and name and the given strength. */
  public DependencyTag withDefinition(boolean pIsDefinition) {
    if (pIsDefinition == isDefinition) {
      return this;
    }
    return new DependencyTag(namespace, pIsDefinition, name);
  }

  /** Whether both tags name the same entity, regardless of their strength. */
  public boolean sameEntity(DependencyTag pOther) {
    return namespace == pOther.namespace && name.equals(pOther.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, isDefinition, name);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DependencyTag)) {
      return false;
    }
    DependencyTag other = (DependencyTag) obj;
    return namespace == other.namespace
        && isDefinition == other.isDefinition
        && name.equals(other.name);
  }

  /** Returns a form like {@code "typedef n (def)"} or {@code "var n (decl)"}. */
  @Override
  public String toString() {
    return namespace.getShortName() + " " + name + (isDefinition ? " (def)" : " (decl)");
  }
}
