package com.cardarchitect.formats.charx;

import java.util.List;

/**
 * Advisory problems found before a CHARX build. Never blocks the build itself.
 */
public record CharxBuildValidation(List<String> problems) {

    public CharxBuildValidation {
        problems = List.copyOf(problems);
    }

    public boolean isValid() {
        return problems.isEmpty();
    }
}
