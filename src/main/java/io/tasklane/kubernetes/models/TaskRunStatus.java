package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRunStatus {
    private List<Condition> conditions;
    private Instant startTime;
    private Instant completionTime;
    private String podName;
    private List<StepState> steps;
    private List<ResourceResult> resourcesResult;
    private List<CloudEventDelivery> cloudEvents;

    public Optional<Condition> succeededCondition() {
        if (conditions == null) {
            return Optional.empty();
        }

        return conditions.stream()
            .filter(condition -> Condition.SUCCEEDED.equals(condition.getType()))
            .findFirst();
    }

    /**
     * Replaces the {@code Succeeded} condition, keeping the previous transition time when neither
     * status nor reason changed.
     */
    @JsonIgnore
    public void setSucceededCondition(Condition condition) {
        List<Condition> updated = new ArrayList<>();
        Optional<Condition> previous = succeededCondition();

        if (conditions != null) {
            conditions.stream()
                .filter(current -> !Condition.SUCCEEDED.equals(current.getType()))
                .forEach(updated::add);
        }

        if (previous.isPresent() &&
            previous.get().getStatus() == condition.getStatus() &&
            previous.get().getReason() == condition.getReason()
        ) {
            condition = condition.toBuilder()
                .lastTransitionTime(previous.get().getLastTransitionTime())
                .build();
        }

        updated.add(condition);
        this.conditions = updated;
    }

    public List<CloudEventDelivery> cloudEventDeliveries() {
        if (cloudEvents == null) {
            cloudEvents = new ArrayList<>();
        }

        return cloudEvents;
    }
}
