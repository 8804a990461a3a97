package io.tasklane.kubernetes.events;

public class EventDeliveryException extends Exception {
    private static final long serialVersionUID = 1L;

    public EventDeliveryException(String message) {
        super(message);
    }

    public EventDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
