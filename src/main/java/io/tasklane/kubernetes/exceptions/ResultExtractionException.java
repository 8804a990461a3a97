package io.tasklane.kubernetes.exceptions;

public class ResultExtractionException extends Exception {
    private static final long serialVersionUID = 1L;

    public ResultExtractionException(String message) {
        super(message);
    }

    public ResultExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
