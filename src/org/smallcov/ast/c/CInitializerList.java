// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A brace-enclosed initializer list like <code>{ 1, 2, { 3 } }</code>. */
public final class CInitializerList implements CInitializer {

  private static final long serialVersionUID = 6601820489208683306L;

  private final FileLocation fileLocation;
  private final ImmutableList<CInitializer> initializerList;

  public CInitializerList(
      FileLocation pFileLocation, List<? extends CInitializer> pInitializerList) {
    fileLocation = checkNotNull(pFileLocation);
    initializerList = ImmutableList.copyOf(pInitializerList);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  public ImmutableList<CInitializer> getInitializers() {
    return initializerList;
  }

  @Override
  public String toASTString() {
    StringBuilder lASTString = new StringBuilder();

    lASTString.append("{ ");
    Joiner.on(", ")
        .appendTo(lASTString, Iterables.transform(initializerList, CInitializer::toASTString));
    lASTString.append(" }");

    return lASTString.toString();
  }

  @Override
  public String toString() {
    return toASTString();
  }

  @Override
  public int hashCode() {
    return initializerList.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CInitializerList
        && initializerList.equals(((CInitializerList) obj).initializerList);
  }
}
