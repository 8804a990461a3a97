package io.tasklane.kubernetes.exceptions;

/**
 * The run's bindings do not satisfy the task declaration, e.g. a required param without default.
 */
public class TemplatingException extends Exception {
    private static final long serialVersionUID = 1L;

    public TemplatingException(String message) {
        super(message);
    }
}
