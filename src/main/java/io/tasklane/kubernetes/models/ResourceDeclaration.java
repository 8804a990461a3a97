package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A resource a task consumes or produces, bound by name from the run.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceDeclaration {
    private String name;
    private ResourceType type;
    private String targetPath;
}
