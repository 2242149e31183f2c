package com.hartwig.varpipe.reference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.hartwig.varpipe.config.ReferenceVersion;
import com.hartwig.varpipe.storage.ArtifactStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds each reference version at most once and shares the result between runs. Concurrent callers for the same version wait
 * for the single build in flight. A failed build is not retried for the callers that waited on it, but a later call starts over.
 */
public class ReferenceCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceCache.class);
    static final String NAMESPACE = "references";
    private static final String BUILD_DIRECTORY = "genome";

    private final ArtifactStore artifactStore;
    private final ReferenceBuilder builder;
    private final ConcurrentMap<ReferenceVersion, CompletableFuture<ReferenceBuild>> builds = new ConcurrentHashMap<>();

    public ReferenceCache(final ArtifactStore artifactStore, final ReferenceBuilder builder) {
        this.artifactStore = artifactStore;
        this.builder = builder;
    }

    public ReferenceBuild getOrBuild(ReferenceVersion version) {
        var created = new CompletableFuture<ReferenceBuild>();
        var future = builds.computeIfAbsent(version, v -> created);
        if (future == created) {
            try {
                created.complete(loadOrBuild(version));
            } catch (RuntimeException e) {
                builds.remove(version, created);
                created.completeExceptionally(e);
            }
        } else {
            LOGGER.debug("Reference {} already built or in progress, waiting for it", version);
        }
        return await(version, future);
    }

    public static String namespace(ReferenceVersion version) {
        return NAMESPACE + "/" + version.ucscName();
    }

    private ReferenceBuild loadOrBuild(ReferenceVersion version) {
        var cached = artifactStore.findShared(namespace(version));
        if (cached.isPresent()) {
            var build = ReferenceBuild.at(version, cached.get().path());
            if (!build.isComplete()) {
                throw new ReferenceBuildError(version, String.format("cached build at %s is incomplete", build.directory()), null);
            }
            LOGGER.info("Using cached reference {} at {}", version, build.directory());
            return build;
        }

        Path workDirectory = null;
        try {
            workDirectory = artifactStore.createWorkDirectory(NAMESPACE, version.ucscName());
            var buildDirectory = Files.createDirectories(workDirectory.resolve(BUILD_DIRECTORY));
            LOGGER.info("Building reference {} ({}) in {}", version, version.assembly(), buildDirectory);
            builder.build(version, buildDirectory);

            var candidate = ReferenceBuild.at(version, buildDirectory);
            if (!candidate.isComplete()) {
                throw new ReferenceBuildError(version,
                        String.format("builder did not produce %s, %s and %s",
                                ReferenceBuild.SEQUENCE_FILE,
                                ReferenceBuild.INDEX_FILE,
                                ReferenceBuild.DICTIONARY_FILE),
                        null);
            }
            var stored = artifactStore.putShared(namespace(version), buildDirectory);
            LOGGER.info("Reference {} built and stored at {}", version, stored.path());
            return ReferenceBuild.at(version, stored.path());
        } catch (ReferenceBuildError e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ReferenceBuildError(version, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        } finally {
            deleteQuietly(workDirectory);
        }
    }

    private static ReferenceBuild await(ReferenceVersion version, CompletableFuture<ReferenceBuild> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ReferenceBuildError) {
                throw (ReferenceBuildError) e.getCause();
            }
            throw new ReferenceBuildError(version, String.valueOf(e.getCause()), e.getCause());
        }
    }

    private static void deleteQuietly(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try {
            MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOGGER.warn("Could not remove reference work directory {}: {}", directory, e.getMessage());
        }
    }
}
