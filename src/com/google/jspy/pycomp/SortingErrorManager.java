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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * An error manager that sorts and de-duplicates all errors and warnings reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, TranslationError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<TranslationError> getErrors() {
    return withLevel(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<TranslationError> getWarnings() {
    return withLevel(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<TranslationError> withLevel(CheckLevel level) {
    ImmutableList.Builder<TranslationError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level (errors first), then by source name, line number, column and
   * description. Unknown locations sort before known ones.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<String> NULLS_FIRST =
        Comparator.nullsFirst(Comparator.<String>naturalOrder());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      int sourceCompare = NULLS_FIRST.compare(p1.error.sourceName(), p2.error.sourceName());
      if (sourceCompare != 0) {
        return sourceCompare;
      }
      if (p1.error.lineno() != p2.error.lineno()) {
        return Integer.compare(p1.error.lineno(), p2.error.lineno());
      }
      if (p1.error.charno() != p2.error.charno()) {
        return Integer.compare(p1.error.charno(), p2.error.charno());
      }
      int descriptionCompare = p1.error.description().compareTo(p2.error.description());
      if (descriptionCompare != 0) {
        return descriptionCompare;
      }
      return p1.error.type().compareTo(p2.error.type());
    }
  }

  static final class ErrorWithLevel {
    final TranslationError error;
    final CheckLevel level;

    ErrorWithLevel(TranslationError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
