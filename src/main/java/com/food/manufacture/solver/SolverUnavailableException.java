package com.food.manufacture.solver;

/**
 * The solver backend could not be created or crashed. Not retriable: solving the
 * same model again gives the same failure.
 */
public class SolverUnavailableException extends RuntimeException {

    public SolverUnavailableException(String message) {
        super(message);
    }

    public SolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
