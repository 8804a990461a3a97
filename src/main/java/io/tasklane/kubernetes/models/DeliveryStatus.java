package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
    UNKNOWN("Unknown"),
    SENT("Sent"),
    FAILED("Failed");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DeliveryStatus from(String value) {
        for (DeliveryStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown delivery status '" + value + "'");
    }
}
