package io.tasklane.kubernetes.stores;

import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.models.PipelineResourceSpec;

public interface PipelineResourceResolver {
    PipelineResourceSpec resolve(String namespace, String name) throws ResolutionException;
}
