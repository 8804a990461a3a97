package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Condition {
    public static final String SUCCEEDED = "Succeeded";

    private String type;
    private ConditionStatus status;
    private Reason reason;
    private String message;
    private Instant lastTransitionTime;

    public static Condition succeeded(ConditionStatus status, Reason reason, String message, Instant now) {
        return Condition.builder()
            .type(SUCCEEDED)
            .status(status)
            .reason(reason)
            .message(message)
            .lastTransitionTime(now)
            .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == ConditionStatus.TRUE || status == ConditionStatus.FALSE;
    }
}
