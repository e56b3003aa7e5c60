/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.jspy.pycomp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.jspy.pyast.Alias;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.PyIR;
import com.google.jspy.pyast.PyStmt;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The imports of one output file, deduplicated by (module, imported name).
 *
 * <p>The whole module ({@code *}) and its default export ({@code default}) are imported with a
 * plain {@code import module as local}; any other name with {@code from module import name as
 * local}.
 */
final class ImportTable {

  /** One imported name. */
  record Entry(Identifier module, Alias alias, boolean wholeModule) {
    Identifier localName() {
      return alias.localName();
    }

    PyStmt toStatement() {
      return wholeModule
          ? PyIR.importNode(alias)
          : PyIR.importFrom(module, ImmutableList.of(alias));
    }
  }

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  static boolean isWholeModule(String name) {
    return name.equals("*") || name.equals("default");
  }

  private static String key(String module, String name) {
    return module + "::" + name;
  }

  @Nullable Entry get(String module, String name) {
    return entries.get(key(module, name));
  }

  /**
   * Adds an import of {@code name} from {@code module} bound to {@code localName}, unless one
   * exists already.
   *
   * @return the entry for the key, which is the existing one if there was one
   */
  Entry add(String module, String name, String localName) {
    return entries.computeIfAbsent(
        key(module, name),
        k -> {
          boolean wholeModule = isWholeModule(name);
          String imported = wholeModule ? module : name;
          return new Entry(
              new Identifier(module),
              PyIR.alias(imported, imported.equals(localName) ? null : localName),
              wholeModule);
        });
  }

  int size() {
    return entries.size();
  }

  /**
   * Returns the import statements for every entry: one {@code import} for all whole-module imports
   * followed by one {@code from ... import} per module, in first-use order.
   */
  ImmutableList<PyStmt> getAllImports() {
    List<Alias> wholeModules = new ArrayList<>();
    ListMultimap<String, Alias> members =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (Entry entry : entries.values()) {
      if (entry.wholeModule()) {
        wholeModules.add(entry.alias());
      } else {
        members.put(entry.module().name(), entry.alias());
      }
    }
    ImmutableList.Builder<PyStmt> imports = ImmutableList.builder();
    if (!wholeModules.isEmpty()) {
      imports.add(PyIR.importNode(wholeModules.toArray(new Alias[0])));
    }
    for (String module : members.keySet()) {
      imports.add(PyIR.importFrom(new Identifier(module), members.get(module)));
    }
    return imports.build();
  }
}
