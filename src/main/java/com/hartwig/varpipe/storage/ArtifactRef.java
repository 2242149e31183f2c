package com.hartwig.varpipe.storage;

import java.nio.file.Path;

import org.immutables.value.Value;

/**
 * Reference to a completed artifact. Only handed out once the artifact is fully written.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArtifactRef {
    String EXTERNAL_STAGE = "external";

    ArtifactId id();

    /**
     * Store namespace, e.g. "runs/my-run" or "references/hg38". External inputs use "external".
     */
    String namespace();

    Path path();

    static ArtifactRef external(String name, Path path) {
        return ImmutableArtifactRef.builder().id(ArtifactId.of(EXTERNAL_STAGE, name)).namespace(EXTERNAL_STAGE).path(path).build();
    }

    /**
     * Reference to an artifact in a shared namespace, identified by the namespace and its file name.
     */
    static ArtifactRef shared(String namespace, Path path) {
        return ImmutableArtifactRef.builder().id(ArtifactId.of(namespace, path.getFileName().toString())).namespace(namespace).path(path).build();
    }

    default boolean isExternal() {
        return EXTERNAL_STAGE.equals(namespace());
    }
}
