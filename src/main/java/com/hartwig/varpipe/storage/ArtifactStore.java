package com.hartwig.varpipe.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for pipeline artifacts. Per-run artifacts are namespaced by run id, shared artifacts (reference builds) by their own key.
 * All writes are atomic: an artifact is either absent or complete.
 */
public interface ArtifactStore {
    /**
     * Copies all outputs of one stage execution into the store in a single step, together with the fingerprint of the inputs and
     * configuration they were computed from. Whatever the stage stored before is replaced as a whole. If the store fails, nothing
     * of this execution is visible.
     *
     * @param outputs output name to the file or directory holding it
     * @return output name to the stored artifact
     */
    Map<String, ArtifactRef> putStage(String runId, String stage, Map<String, Path> outputs, String fingerprint) throws IOException;

    /**
     * Stores a single artifact, replacing an earlier copy with the same id. Shard artifacts live below their output. Does not
     * change the stored fingerprint of the stage.
     */
    ArtifactRef put(String runId, ArtifactId id, Path data) throws IOException;

    /**
     * @return path of the artifact content
     * @throws ArtifactNotFoundException if the artifact is not (or no longer) present
     */
    Path get(ArtifactRef ref);

    Optional<ArtifactRef> find(String runId, ArtifactId id);

    /**
     * @return fingerprint stored with the outputs of the stage, empty if the stage has no complete outputs in this run
     */
    Optional<String> findFingerprint(String runId, String stage);

    ArtifactRef putShared(String namespace, Path data) throws IOException;

    Optional<ArtifactRef> findShared(String namespace);

    /**
     * Copies the artifact into a user facing directory, replacing an earlier copy with the same name.
     *
     * @return path of the published copy
     */
    Path publish(ArtifactRef ref, Path destinationDirectory) throws IOException;

    /**
     * Creates a fresh, empty working directory for one stage (or shard) execution.
     */
    Path createWorkDirectory(String runId, String name) throws IOException;
}
