// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.globals.GlobalDependencyCollector.Dependencies;

/**
 * Orders globals such that every global comes after the declarations and definitions it needs.
 *
 * <p>Each tag is inserted in post order: first everything it depends on, then the global itself.
 * A visited set keeps every entity from being emitted twice, and a definition also counts as its
 * declaration. Types that refer to each other through pointers only need declarations of each
 * other, which breaks cycles.
 *
 * <p>Instances are not thread-safe, each call of {@link #sort(List, List)} uses its own state.
 */
public final class GlobalsSorter {

  private final InstantiationTable table;
  private final GlobalDependencyCollector collector;
  private final Set<DependencyTag> visited = new HashSet<>();
  private final List<CGlobal> result = new ArrayList<>();

  private GlobalsSorter(List<? extends CGlobal> pAllGlobals) {
    table = InstantiationTable.create(pAllGlobals);
    collector = new GlobalDependencyCollector(table);
  }

  /**
   * Return the globals needed by the given roots, in an order in which each global comes after its
   * dependencies.
   *
   * @param pRoots the globals that have to be in the result; all globals if empty
   * @param pAllGlobals the program from which dependencies are taken
   * @throws MissingDefinitionException if some global needs a name not present in the program
   */
  public static ImmutableList<CGlobal> sort(
      List<? extends CGlobal> pRoots, List<? extends CGlobal> pAllGlobals)
      throws MissingDefinitionException {
    GlobalsSorter sorter = new GlobalsSorter(pAllGlobals);
    for (CGlobal root : pRoots.isEmpty() ? pAllGlobals : pRoots) {
      Optional<DependencyTag> tag = GlobalDependencies.getDependencyTag(root);
      if (tag.isPresent()) {
        sorter.insert(tag.orElseThrow());
      }
    }
    return ImmutableList.copyOf(sorter.result);
  }

  /**
   * Sort a whole file. Globals without a tag, like pragmas, are not moved: each is put back at
   * its original index in the sorted list.
   */
  public static ImmutableList<CGlobal> sortPreservingUntagged(List<? extends CGlobal> pGlobals)
      throws MissingDefinitionException {
    List<CGlobal> merged = new ArrayList<>(sort(pGlobals, pGlobals));
    for (int i = 0; i < pGlobals.size(); i++) {
      CGlobal global = pGlobals.get(i);
      if (!GlobalDependencies.getDependencyTag(global).isPresent()) {
        merged.add(Math.min(i, merged.size()), global);
      }
    }
    return ImmutableList.copyOf(merged);
  }

  private void insert(DependencyTag pTag) throws MissingDefinitionException {
    if (visited.contains(pTag)) {
      return;
    }
    CGlobal global = table.resolve(pTag);

    // A typedef of an array type needs the definition of the element type even if only the
    // typedef name was requested.
    boolean isDefinition = pTag.isDefinition();
    if (pTag.getNamespace() == Namespace.TYPEDEF && !isDefinition) {
      isDefinition = collector.collectDependencies(global, pTag).containsArrayType();
    }

    Dependencies dependencies = collector.collectDependencies(global, pTag);
    for (DependencyTag dependency : dependencies.getDependencies()) {
      insert(dependency);
    }

    DependencyTag effectiveTag = pTag.withDefinition(isDefinition);
    boolean alreadyEmitted =
        visited.contains(effectiveTag)
            || (pTag.getNamespace() == Namespace.TYPEDEF
                && visited.contains(effectiveTag.withDefinition(!isDefinition)));
    if (!alreadyEmitted) {
      result.add(global);
    }

    visited.add(effectiveTag);
    if (isDefinition) {
      visited.add(effectiveTag.withDefinition(false));
    }
  }
}
