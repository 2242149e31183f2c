package com.hartwig.varpipe.workflow;

import java.util.Map;

import com.hartwig.varpipe.storage.ArtifactRef;

import org.immutables.value.Value;

/**
 * A stage ready to run: all of its inputs are complete.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageExecution {
    Stage stage();

    String runId();

    Map<String, ArtifactRef> inputs();

    @Value.Auxiliary
    StageExecutor executor();

    /**
     * Digest of the stage definition, its configuration and the fingerprints of everything it consumes. Stored with the outputs.
     */
    @Value.Default
    default String fingerprint() {
        return "";
    }

    static ImmutableStageExecution.Builder builder() {
        return ImmutableStageExecution.builder();
    }
}
