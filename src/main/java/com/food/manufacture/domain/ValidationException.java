package com.food.manufacture.domain;

import java.util.List;

/**
 * Reference data or parameters are incomplete or inconsistent for the requested run.
 * Raised before any model is built.
 */
public class ValidationException extends IllegalArgumentException {

    private final List<String> problems;

    public ValidationException(String problem) {
        this(List.of(problem));
    }

    public ValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
