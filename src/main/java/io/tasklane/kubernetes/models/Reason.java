package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons reported on the {@code Succeeded} condition of a run.
 */
public enum Reason {
    PENDING("Pending"),
    RUNNING("Running"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    OOM_KILLED("OOMKilled"),
    FAILED_RESOLUTION("FailedResolution"),
    VALIDATION_FAILED("TaskRunValidationFailed"),
    EXCEEDED_RESOURCE_QUOTA("ExceededResourceQuota"),
    EXCEEDED_NODE_RESOURCES("ExceededNodeResources"),
    CREATE_CONTAINER_CONFIG_ERROR("CreateContainerConfigError"),
    COULDNT_GET_TASK("CouldntGetTask"),
    TIMEOUT("TaskRunTimeout"),
    CANCELLED("TaskRunCancelled");

    private final String value;

    Reason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Reason from(String value) {
        for (Reason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }

        throw new IllegalArgumentException("Unknown reason '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
