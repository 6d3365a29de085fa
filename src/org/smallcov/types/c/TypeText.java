// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Collects the words of a type around a declarator, e.g. <code>const struct s *p</code>. */
final class TypeText {

  private static final Joiner SPACE = Joiner.on(' ');

  private final List<String> words = new ArrayList<>();

  private TypeText() {}

  /** Starts with the given word. */
  static TypeText of(String pFirst) {
    return new TypeText().add(pFirst);
  }

  /** Starts with the qualifiers of the given type. */
  static TypeText qualifiersOf(CType pType) {
    TypeText text = new TypeText();
    if (pType.isConst()) {
      text.words.add("const");
    }
    if (pType.isVolatile()) {
      text.words.add("volatile");
    }
    return text;
  }

  /** Appends a word, empty and null words are skipped. */
  TypeText add(@Nullable String pWord) {
    if (!Strings.isNullOrEmpty(pWord)) {
      words.add(pWord);
    }
    return this;
  }

  @Override
  public String toString() {
    return SPACE.join(words);
  }
}
