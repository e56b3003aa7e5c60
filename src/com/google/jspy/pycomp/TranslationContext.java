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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * The state of the enclosing scopes, passed down through every translation call. Entering a new
 * scope derives a new context; a context is never changed in place.
 *
 * @param tailCallOpportunity the function whose tail calls may become loop iterations, or null
 * @param hoistVars whether a variable declared without an initializer must still be bound, because
 *     a nested closure captures it
 * @param scopedTypeParams the type parameters in scope
 */
public record TranslationContext(
    @Nullable TailCallOpportunity tailCallOpportunity,
    Predicate<String> hoistVars,
    ImmutableSet<String> scopedTypeParams) {

  private static final TranslationContext ROOT =
      new TranslationContext(null, name -> false, ImmutableSet.of());

  /** The context of the top level of a file. */
  public static TranslationContext root() {
    return ROOT;
  }

  public TranslationContext withTailCallOpportunity(@Nullable TailCallOpportunity opportunity) {
    return new TranslationContext(opportunity, hoistVars, scopedTypeParams);
  }

  public TranslationContext withHoistVars(Predicate<String> hoistVars) {
    return new TranslationContext(tailCallOpportunity, hoistVars, scopedTypeParams);
  }

  public TranslationContext withScopedTypeParams(Set<String> typeParams) {
    return new TranslationContext(
        tailCallOpportunity,
        hoistVars,
        ImmutableSet.<String>builder().addAll(scopedTypeParams).addAll(typeParams).build());
  }
}
