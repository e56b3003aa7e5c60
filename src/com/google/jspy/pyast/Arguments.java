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
package com.google.jspy.pyast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A formal parameter list.
 *
 * @param args Positional parameters
 * @param vararg The {@code *args} parameter, if any
 * @param defaults Default values of the last {@code defaults.size()} positional parameters
 */
public record Arguments(
    ImmutableList<Arg> args, @Nullable Arg vararg, ImmutableList<PyExpr> defaults) {
  public Arguments {
    checkArgument(defaults.size() <= args.size(), "more defaults than parameters");
  }

  public static Arguments empty() {
    return new Arguments(ImmutableList.of(), null, ImmutableList.of());
  }
}
