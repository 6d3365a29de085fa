// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.smallcov.ast.c.CTranslationUnit;
import org.sosy_lab.common.configuration.InvalidConfigurationException;

public class SourceFilesTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final List<Path> parsed = new ArrayList<>();
  private final CParser parser =
      file -> {
        parsed.add(file);
        return new CTranslationUnit(file.getFileName().toString(), ImmutableList.of());
      };

  private Path root;

  @Before
  public void setUp() {
    root = tmp.getRoot().toPath();
  }

  private Path write(String pName, String pContent) throws IOException {
    Path file = root.resolve(pName);
    MoreFiles.createParentDirectories(file);
    MoreFiles.asCharSink(file, StandardCharsets.UTF_8).write(pContent);
    return file;
  }

  @Test
  public void testSingleFile() throws Exception {
    ImmutableMap<String, CTranslationUnit> files =
        SourceFiles.load(write("main.c", "int x;"), parser);

    assertThat(files.keySet()).containsExactly("main.c");
    assertThat(parsed).containsExactly(root.resolve("main.c"));
  }

  @Test
  public void testPreprocessedFile() throws Exception {
    assertThat(SourceFiles.load(write("main.i", ""), parser).keySet()).containsExactly("main.i");
  }

  @Test
  public void testFileList() throws Exception {
    Path list = write("files.txt", "a.c\n\n  lib/b.c  \n");

    ImmutableMap<String, CTranslationUnit> files = SourceFiles.load(list, parser);

    assertThat(files.keySet()).containsExactly("a.c", "lib/b.c").inOrder();
    assertThat(parsed).containsExactly(root.resolve("a.c"), root.resolve("lib/b.c")).inOrder();
  }

  @Test
  public void testUnknownExtension() throws Exception {
    Path header = write("main.h", "");

    assertThrows(InvalidConfigurationException.class, () -> SourceFiles.load(header, parser));
    assertThat(parsed).isEmpty();
  }
}
