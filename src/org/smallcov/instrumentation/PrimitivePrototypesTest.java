// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.instrumentation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.exec.CompilerInvoker;
import org.smallcov.parser.CParser;
import org.smallcov.parser.CParserException;
import org.smallcov.test.SystemHeaderFixture;
import org.smallcov.types.c.CPointerType;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;

public class PrimitivePrototypesTest {

  private static final String COPY = "cp __SOURCE_NAME__ __OUT_NAME__";

  private final LogManager logger = LogManager.createTestLogManager();

  private PrimitivePrototypes primitives(String pPreprocessCommand, CParser pParser)
      throws InvalidConfigurationException {
    Configuration config =
        Configuration.builder().setOption("compiler.preprocessCommand", pPreprocessCommand).build();
    return new PrimitivePrototypes(logger, new CompilerInvoker(config, logger), pParser);
  }

  private static String print(ImmutableList<CGlobal> pGlobals) {
    return Joiner.on('\n').join(pGlobals.stream().map(CGlobal::toASTString).iterator());
  }

  @Test
  public void testPrototypesWithoutTypedefs() throws Exception {
    PrimitivePrototypes primitives = primitives(COPY, SystemHeaderFixture.parser());

    assertThat(primitives.getDeclaration(PrimitivePrototypes.FPRINTF).toASTString())
        .isEqualTo("extern int fprintf(struct _IO_FILE *, const char *, ...);");
    assertThat(primitives.getDeclaration(PrimitivePrototypes.MEMSET).toASTString())
        .isEqualTo("extern void *memset(void *, int, unsigned long int);");
    assertThat(primitives.getDeclaration(PrimitivePrototypes.COVERAGE_FOUT).toASTString())
        .isEqualTo("struct _IO_FILE *_coverage_fout;");
  }

  @Test
  public void testInjectableWithForwardDeclarations() throws Exception {
    PrimitivePrototypes primitives = primitives(COPY, SystemHeaderFixture.parser());

    assertThat(primitives.getInjectable().keySet())
        .containsExactlyElementsIn(PrimitivePrototypes.PRIMITIVES)
        .inOrder();
    assertThat(print(primitives.getInjectable().get(PrimitivePrototypes.FOPEN)))
        .isEqualTo(
            "struct _IO_FILE;\nextern struct _IO_FILE *fopen(const char *, const char *);");
    assertThat(print(primitives.getInjectable().get(PrimitivePrototypes.COVERAGE_FOUT)))
        .isEqualTo("struct _IO_FILE;\nstruct _IO_FILE *_coverage_fout;");
    assertThat(print(primitives.getInjectable().get(PrimitivePrototypes.MEMSET)))
        .isEqualTo("extern void *memset(void *, int, unsigned long int);");
  }

  @Test
  public void testParsesPreprocessedBootstrapProgram() throws Exception {
    CParser parser =
        file -> {
          assertThat(file.getFileName().toString()).endsWith(".i");
          assertThat(MoreFiles.asCharSource(file, StandardCharsets.UTF_8).read())
              .isEqualTo(PrimitivePrototypes.BOOTSTRAP_PROGRAM);
          return SystemHeaderFixture.headers(ImmutableList.of());
        };
    PrimitivePrototypes primitives = primitives(COPY, parser);

    assertThat(primitives.getDeclaration(PrimitivePrototypes.FFLUSH))
        .isInstanceOf(CFunctionDeclaration.class);
  }

  @Test
  public void testResolvedOnlyOnce() throws Exception {
    AtomicInteger parsed = new AtomicInteger();
    CParser parser =
        file -> {
          parsed.incrementAndGet();
          return SystemHeaderFixture.headers(ImmutableList.of());
        };
    PrimitivePrototypes primitives = primitives(COPY, parser);

    CDeclaration first = primitives.getDeclaration(PrimitivePrototypes.FOPEN);
    primitives.getInjectable();
    assertThat(primitives.getDeclaration(PrimitivePrototypes.FOPEN)).isSameInstanceAs(first);
    assertThat(parsed.get()).isEqualTo(1);
  }

  @Test
  public void testMissingFunctionGetsPlaceholder() throws Exception {
    PrimitivePrototypes primitives = primitives(COPY, SystemHeaderFixture.parser("fclose"));

    CDeclaration fclose = primitives.getDeclaration(PrimitivePrototypes.FCLOSE);
    assertThat(fclose).isInstanceOf(CVariableDeclaration.class);
    assertThat(fclose.getType()).isEqualTo(CPointerType.POINTER_TO_VOID);
    assertThat(fclose.toASTString()).isEqualTo("extern void *fclose;");
    assertThat(primitives.getInjectable()).doesNotContainKey(PrimitivePrototypes.FCLOSE);
    assertThat(primitives.getInjectable()).containsKey(PrimitivePrototypes.FFLUSH);
  }

  @Test
  public void testPreprocessorFailure() throws Exception {
    CParser parser =
        file -> {
          throw new AssertionError("nothing to parse after preprocessing failed");
        };
    PrimitivePrototypes primitives = primitives("false", parser);

    for (String name : PrimitivePrototypes.PRIMITIVES) {
      assertThat(primitives.getDeclaration(name).getType())
          .isEqualTo(CPointerType.POINTER_TO_VOID);
    }
    assertThat(primitives.getInjectable().keySet())
        .containsExactly(PrimitivePrototypes.COVERAGE_FOUT);
    assertThat(print(primitives.getInjectable().get(PrimitivePrototypes.COVERAGE_FOUT)))
        .isEqualTo("void *_coverage_fout;");
  }

  @Test
  public void testParserFailure() throws Exception {
    CParser parser =
        file -> {
          throw new CParserException("unexpected token");
        };
    PrimitivePrototypes primitives = primitives(COPY, parser);

    assertThat(primitives.getDeclaration(PrimitivePrototypes.FPRINTF).toASTString())
        .isEqualTo("extern void *fprintf;");
  }

  @Test
  public void testOnlyPrimitivesCanBeLookedUp() throws Exception {
    PrimitivePrototypes primitives = primitives(COPY, SystemHeaderFixture.parser());

    assertThrows(IllegalArgumentException.class, () -> primitives.getDeclaration("puts"));
  }
}
