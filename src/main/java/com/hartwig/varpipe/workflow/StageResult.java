package com.hartwig.varpipe.workflow;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import com.hartwig.varpipe.storage.ArtifactRef;

import org.immutables.value.Value;

/**
 * What a stage executor produced. A fallback is not a failure: it records that degenerate input made the stage take its documented
 * substitute path.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageResult {
    /**
     * Output name to file (or directory) in the work directory, still to be stored.
     */
    Map<String, Path> outputs();

    /**
     * Output name to an artifact that is already stored elsewhere, such as a shared reference build.
     */
    Map<String, ArtifactRef> storedOutputs();

    Optional<String> fallback();

    static StageResult of(String output, Path path) {
        return ImmutableStageResult.builder().putOutputs(output, path).build();
    }

    static StageResult fallbackTo(String output, Path path, String reason) {
        return ImmutableStageResult.builder().putOutputs(output, path).fallback(reason).build();
    }

    static ImmutableStageResult.Builder builder() {
        return ImmutableStageResult.builder();
    }
}
