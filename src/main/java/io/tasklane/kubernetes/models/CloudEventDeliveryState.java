package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloudEventDeliveryState {
    private DeliveryStatus condition;
    private Instant sentAt;
    private String message;
    private int retryCount;
}
