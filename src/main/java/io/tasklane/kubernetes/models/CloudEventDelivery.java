package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Bookkeeping for one notification target: the delivery condition, the last error and the number
 * of attempts made so far.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloudEventDelivery {
    private String target;
    private CloudEventDeliveryState status;

    public static CloudEventDelivery pending(String target) {
        return CloudEventDelivery.builder()
            .target(target)
            .status(CloudEventDeliveryState.builder()
                .condition(DeliveryStatus.UNKNOWN)
                .message("")
                .retryCount(0)
                .build()
            )
            .build();
    }

    @JsonIgnore
    public boolean isPending() {
        return status == null || status.getCondition() == null || status.getCondition() == DeliveryStatus.UNKNOWN;
    }
}
