package com.hartwig.varpipe.storage;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * Identifies a unit of pipeline data by the stage that produced it, the declared output name and, for scattered work, the shard.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArtifactId {
    String stage();

    String output();

    Optional<String> shard();

    static ArtifactId of(String stage, String output) {
        return ImmutableArtifactId.builder().stage(stage).output(output).build();
    }

    static ArtifactId of(String stage, String output, String shard) {
        return ImmutableArtifactId.builder().stage(stage).output(output).shard(shard).build();
    }

    default String describe() {
        return stage() + "/" + output() + shard().map(shard -> "[" + shard + "]").orElse("");
    }
}
