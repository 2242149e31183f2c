package com.hartwig.varpipe.workflow;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Stage {
    /**
     * Stage name, unique within a graph.
     */
    String name();

    /**
     * Artifact names this stage reads. Each is produced by exactly one other stage or registered as an external input.
     */
    List<String> inputs();

    /**
     * Artifact names this stage produces.
     */
    List<String> outputs();

    static ImmutableStage.Builder builder() {
        return ImmutableStage.builder();
    }
}
