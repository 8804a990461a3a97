package io.tasklane.kubernetes.events;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * A CloudEvents 1.0 event, sent in binary mode: attributes as {@code ce-} headers, data as body.
 */
@Builder
@Getter
public class CloudEvent {
    public static final String SPEC_VERSION = "1.0";

    private final String id;
    private final String source;
    private final String type;
    private final Instant time;

    @Builder.Default
    private final String dataContentType = "application/json";

    private final byte[] data;
}
