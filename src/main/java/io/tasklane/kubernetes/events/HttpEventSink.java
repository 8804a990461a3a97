package io.tasklane.kubernetes.events;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

@Slf4j
public class HttpEventSink implements EventSink {
    private final HttpClient http;
    private final Duration timeout;

    public HttpEventSink(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public void send(String target, CloudEvent event) throws EventDeliveryException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder().uri(URI.create(target));
        } catch (IllegalArgumentException e) {
            throw new EventDeliveryException("Invalid target '" + target + "': " + e.getMessage(), e);
        }

        builder
            .timeout(timeout)
            .header("ce-specversion", CloudEvent.SPEC_VERSION)
            .header("ce-id", event.getId())
            .header("ce-source", event.getSource())
            .header("ce-type", event.getType())
            .header("Content-Type", event.getDataContentType())
            .POST(HttpRequest.BodyPublishers.ofByteArray(event.getData() == null ? new byte[0] : event.getData()));

        if (event.getTime() != null) {
            builder.header("ce-time", DateTimeFormatter.ISO_INSTANT.format(event.getTime()));
        }

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EventDeliveryException("Failed to send event to '" + target + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventDeliveryException("Interrupted while sending event to '" + target + "'", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new EventDeliveryException("Event rejected by '" + target + "' with HTTP " + response.statusCode());
        }

        log.debug("Event '{}' of type '{}' delivered to '{}'", event.getId(), event.getType(), target);
    }
}
