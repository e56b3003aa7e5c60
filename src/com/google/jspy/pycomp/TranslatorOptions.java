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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Translator options. A {@link PythonTranslator} takes a copy of these when it is created. */
public class TranslatorOptions implements Serializable {

  /** The directory name under which the runtime library modules are imported. */
  private String libraryDirectoryName = "fable-library";

  /** The package the runtime library modules are mapped to. */
  private String libraryNamespace = "fable";

  private String liftedFunctionPrefix = "lifted";

  /** Rewrite self-recursive tail calls into loops. */
  private boolean tailCallOptimization = true;

  /** Evaluate a non-trivial switch discriminant once into a temporary. */
  private boolean bindSwitchDiscriminant = true;

  private boolean warningsAsErrors = false;

  public TranslatorOptions() {}

  TranslatorOptions(TranslatorOptions other) {
    this.libraryDirectoryName = other.libraryDirectoryName;
    this.libraryNamespace = other.libraryNamespace;
    this.liftedFunctionPrefix = other.liftedFunctionPrefix;
    this.tailCallOptimization = other.tailCallOptimization;
    this.bindSwitchDiscriminant = other.bindSwitchDiscriminant;
    this.warningsAsErrors = other.warningsAsErrors;
  }

  public String getLibraryDirectoryName() {
    return libraryDirectoryName;
  }

  public void setLibraryDirectoryName(String libraryDirectoryName) {
    checkArgument(!libraryDirectoryName.isEmpty(), "empty library directory name");
    this.libraryDirectoryName = libraryDirectoryName;
  }

  public String getLibraryNamespace() {
    return libraryNamespace;
  }

  public void setLibraryNamespace(String libraryNamespace) {
    checkArgument(!libraryNamespace.isEmpty(), "empty library namespace");
    this.libraryNamespace = libraryNamespace;
  }

  public String getLiftedFunctionPrefix() {
    return liftedFunctionPrefix;
  }

  public void setLiftedFunctionPrefix(String liftedFunctionPrefix) {
    checkArgument(
        PythonNames.isValidIdentifier(liftedFunctionPrefix),
        "Invalid prefix for lifted functions: %s",
        liftedFunctionPrefix);
    this.liftedFunctionPrefix = liftedFunctionPrefix;
  }

  public boolean isTailCallOptimization() {
    return tailCallOptimization;
  }

  public void setTailCallOptimization(boolean enabled) {
    this.tailCallOptimization = enabled;
  }

  public boolean isBindSwitchDiscriminant() {
    return bindSwitchDiscriminant;
  }

  public void setBindSwitchDiscriminant(boolean enabled) {
    this.bindSwitchDiscriminant = enabled;
  }

  public boolean isWarningsAsErrors() {
    return warningsAsErrors;
  }

  /** Reports warnings at the ERROR level. They still do not stop the translation. */
  public void setWarningsAsErrors(boolean warningsAsErrors) {
    this.warningsAsErrors = warningsAsErrors;
  }
}
