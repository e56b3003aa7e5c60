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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.io.Files;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps import paths of the source program to target module names.
 *
 * <p>Paths into the runtime library ({@code .../fable-library.3.1.0/List.js}) map to a module of
 * the library namespace ({@code fable.list}). Every other path is stripped of slashes and lower
 * cased.
 */
final class ModuleNames {
  private static final Logger logger = Logger.getLogger(ModuleNames.class.getName());

  private final Pattern libraryPath;
  private final String namespace;

  ModuleNames(String libraryDirectoryName, String namespace) {
    this.libraryPath =
        Pattern.compile(
            ".*/" + Pattern.quote(libraryDirectoryName) + "[.0-9]*/(?<module>[^/]*)\\.js");
    this.namespace = namespace;
  }

  String resolve(String path) {
    Matcher m = libraryPath.matcher(path);
    String moduleName;
    if (m.matches()) {
      moduleName = namespace + "." + PythonNames.clean(Ascii.toLowerCase(m.group("module")));
    } else {
      moduleName = Ascii.toLowerCase(CharMatcher.is('/').removeFrom(path));
    }
    logger.fine("Module " + path + " resolved to " + moduleName);
    return moduleName;
  }

  /** The local name a whole-module import binds to: the file name without its extension. */
  static String defaultLocalName(String path) {
    return PythonNames.clean(Files.getNameWithoutExtension(path));
  }
}
