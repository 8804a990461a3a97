package io.tasklane.kubernetes.config;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Builder
@Getter
@Jacksonized
public class NotificationConfig {
    /**
     * Number of delivery attempts before a record is marked {@code Failed}.
     */
    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(10);
}
