package com.hartwig.varpipe.workflow;

import java.nio.file.Path;
import java.util.Map;

import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.storage.ArtifactRef;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageContext {
    String runId();

    String stageName();

    PipelineParameters parameters();

    /**
     * Completed input artifacts by artifact name.
     */
    Map<String, ArtifactRef> inputs();

    /**
     * Empty directory owned by this stage execution only.
     */
    Path workDirectory();

    default Path input(String name) {
        var ref = inputs().get(name);
        if (ref == null) {
            throw new IllegalArgumentException(String.format("Stage '%s' has no input '%s', inputs are %s",
                    stageName(),
                    name,
                    inputs().keySet()));
        }
        return ref.path();
    }

    static ImmutableStageContext.Builder builder() {
        return ImmutableStageContext.builder();
    }
}
