package io.tasklane.kubernetes.events;

public interface EventSink {
    /**
     * Delivers the event synchronously, returning only once the target acknowledged it.
     */
    void send(String target, CloudEvent event) throws EventDeliveryException;
}
