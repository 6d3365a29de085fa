// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CFunctionType;
import org.smallcov.types.c.CStorageClass;

/** A function prototype. */
public final class CFunctionDeclaration extends AbstractDeclaration {

  private static final long serialVersionUID = 5485363555708455537L;

  private final ImmutableList<CParameterDeclaration> parameters;
  private final CStorageClass storageClass;
  private final boolean missingPrototype;

  public CFunctionDeclaration(
      FileLocation pFileLocation,
      CFunctionType pType,
      String pName,
      List<CParameterDeclaration> pParameters,
      CStorageClass pStorageClass) {
    this(pFileLocation, pType, pName, pParameters, pStorageClass, false);
  }

  /**
   * @param pMissingPrototype whether the parser made up this declaration for a function that is
   *     called without being declared
   */
  public CFunctionDeclaration(
      FileLocation pFileLocation,
      CFunctionType pType,
      String pName,
      List<CParameterDeclaration> pParameters,
      CStorageClass pStorageClass,
      boolean pMissingPrototype) {
    super(pFileLocation, true, pType, pName);
    parameters = ImmutableList.copyOf(pParameters);
    checkArgument(
        parameters.size() == pType.getParameters().size(),
        "parameter declarations %s do not match function type %s",
        parameters,
        pType);
    storageClass = checkNotNull(pStorageClass);
    checkArgument(storageClass != CStorageClass.TYPEDEF);
    missingPrototype = pMissingPrototype;
  }

  /** Creates a prototype with unnamed parameters for the given type. */
  public static CFunctionDeclaration forType(
      FileLocation pFileLocation, CFunctionType pType, String pName, CStorageClass pStorage) {
    return new CFunctionDeclaration(
        pFileLocation,
        pType,
        pName,
        pType.getParameters().stream()
            .map(t -> new CParameterDeclaration(t, null))
            .collect(toImmutableList()),
        pStorage);
  }

  @Override
  public CFunctionType getType() {
    return (CFunctionType) super.getType();
  }

  public ImmutableList<CParameterDeclaration> getParameters() {
    return parameters;
  }

  public CStorageClass getCStorageClass() {
    return storageClass;
  }

  public boolean isMissingPrototype() {
    return missingPrototype;
  }

  /** The declarator including the return type, without the trailing semicolon. */
  public String toPrototypeString() {
    ImmutableList<String> params =
        parameters.stream().map(CParameterDeclaration::toASTString).collect(toImmutableList());
    return storageClass.toASTString() + getType().toASTString(getName(), params);
  }

  @Override
  public String toASTString() {
    return toPrototypeString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + parameters.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!super.equals(obj)) {
      return false;
    }
    CFunctionDeclaration other = (CFunctionDeclaration) obj;
    return parameters.equals(other.parameters)
        && storageClass == other.storageClass
        && missingPrototype == other.missingPrototype;
  }
}
