package io.tasklane.kubernetes.models;

import io.fabric8.kubernetes.api.model.ContainerStateRunning;
import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStateWaiting;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepState {
    private String name;
    private String container;
    private String imageID;
    private ContainerStateWaiting waiting;
    private ContainerStateRunning running;
    private ContainerStateTerminated terminated;
}
