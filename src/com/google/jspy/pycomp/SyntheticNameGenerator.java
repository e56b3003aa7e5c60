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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.jspy.pyast.Identifier;

/**
 * Generates the names of lifted functions and temporaries.
 *
 * <p>One supplier is owned by each translator, so names are unique within one output file and
 * deterministic across runs. The generated format is {@code prefix_counter}, counting per file.
 */
public final class SyntheticNameGenerator {
  private final Multiset<String> counter = HashMultiset.create();
  private final String sourceName;

  SyntheticNameGenerator(String sourceName) {
    this.sourceName = sourceName;
  }

  /**
   * Creates and returns a fresh identifier.
   *
   * @param prefix a valid target identifier the name starts with
   */
  public Identifier getUniqueName(String prefix) {
    int id = counter.add(sourceName, 1);
    return new Identifier(prefix + "_" + id);
  }
}
