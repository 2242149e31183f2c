package com.hartwig.varpipe.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem artifact store. Layout:
 * <pre>
 *   root/runs/[runId]/[stage]/.fingerprint
 *   root/runs/[runId]/[stage]/[output]/[file]
 *   root/runs/[runId]/[stage]/[output]/[shard]/[file]
 *   root/[shared namespace]/[file]
 *   root/work/[runId]/[name]-[random]/
 * </pre>
 */
public class LocalArtifactStore implements ArtifactStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);
    private static final Pattern VALID_SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String RUNS = "runs";
    private static final String WORK = "work";
    private static final String FINGERPRINT_FILE = ".fingerprint";

    private final Path root;

    public LocalArtifactStore(final Path root) throws IOException {
        this.root = Files.createDirectories(root).toAbsolutePath();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Map<String, ArtifactRef> putStage(final String runId, final String stage, final Map<String, Path> outputs,
            final String fingerprint) throws IOException {
        var target = stageDirectory(runId, stage);
        var runDirectory = Files.createDirectories(target.getParent());
        var temporary = runDirectory.resolve("." + stage + ".tmp-" + UUID.randomUUID());
        var replaced = runDirectory.resolve("." + stage + ".old-" + UUID.randomUUID());
        var stored = new LinkedHashMap<String, ArtifactRef>();
        try {
            Files.createDirectories(temporary);
            for (var output : outputs.entrySet()) {
                var fileName = output.getValue().getFileName().toString();
                copyRecursively(output.getValue(), Files.createDirectories(temporary.resolve(checkSegment(output.getKey()))).resolve(fileName));
                stored.put(output.getKey(),
                        ImmutableArtifactRef.builder()
                                .id(ArtifactId.of(stage, output.getKey()))
                                .namespace(runNamespace(runId))
                                .path(target.resolve(output.getKey()).resolve(fileName))
                                .build());
            }
            Files.writeString(temporary.resolve(FINGERPRINT_FILE), fingerprint, StandardCharsets.UTF_8);
            if (replace(temporary, target, replaced)) {
                LOGGER.info("[{}] Replaced outputs of stage [{}] stored by an earlier run", runId, stage);
            }
        } finally {
            deleteIfExists(temporary);
            deleteIfExists(replaced);
        }
        LOGGER.debug("[{}] Stored outputs {} of stage [{}] at {}", runId, stored.keySet(), stage, target);
        return stored;
    }

    @Override
    public ArtifactRef put(final String runId, final ArtifactId id, final Path data) throws IOException {
        var target = artifactDirectory(runId, id);
        var fileName = data.getFileName().toString();
        Files.createDirectories(target.getParent());
        var temporary = target.resolveSibling("." + target.getFileName() + ".tmp-" + UUID.randomUUID());
        var replaced = target.resolveSibling("." + target.getFileName() + ".old-" + UUID.randomUUID());
        try {
            Files.createDirectories(temporary);
            copyRecursively(data, temporary.resolve(fileName));
            if (replace(temporary, target, replaced)) {
                LOGGER.info("[{}] Replaced earlier copy of artifact [{}]", runId, id.describe());
            }
        } finally {
            deleteIfExists(temporary);
            deleteIfExists(replaced);
        }
        LOGGER.debug("[{}] Stored artifact [{}] at {}", runId, id.describe(), target);
        return ImmutableArtifactRef.builder().id(id).namespace(runNamespace(runId)).path(target.resolve(fileName)).build();
    }

    @Override
    public Path get(final ArtifactRef ref) {
        if (!Files.exists(ref.path())) {
            throw new ArtifactNotFoundException(String.format("Artifact %s not found in namespace '%s' at %s",
                    ref.id().describe(),
                    ref.namespace(),
                    ref.path()));
        }
        return ref.path();
    }

    @Override
    public Optional<ArtifactRef> find(final String runId, final ArtifactId id) {
        return singleEntry(artifactDirectory(runId, id)).map(path -> ImmutableArtifactRef.builder()
                .id(id)
                .namespace(runNamespace(runId))
                .path(path)
                .build());
    }

    @Override
    public Optional<String> findFingerprint(final String runId, final String stage) {
        var fingerprintFile = stageDirectory(runId, stage).resolve(FINGERPRINT_FILE);
        if (!Files.isRegularFile(fingerprintFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(fingerprintFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactNotFoundException("Could not read fingerprint " + fingerprintFile + ": " + e.getMessage());
        }
    }

    @Override
    public ArtifactRef putShared(final String namespace, final Path data) throws IOException {
        var stored = moveIntoPlace(sharedDirectory(namespace), data);
        LOGGER.info("Stored shared artifact [{}] at {}", namespace, stored);
        return ArtifactRef.shared(namespace, stored);
    }

    @Override
    public Optional<ArtifactRef> findShared(final String namespace) {
        return singleEntry(sharedDirectory(namespace)).map(path -> ArtifactRef.shared(namespace, path));
    }

    @Override
    public Path publish(final ArtifactRef ref, final Path destinationDirectory) throws IOException {
        var source = get(ref);
        Files.createDirectories(destinationDirectory);
        var destination = destinationDirectory.resolve(source.getFileName().toString());
        var temporary = destinationDirectory.resolve("." + source.getFileName() + ".tmp-" + UUID.randomUUID());
        copyRecursively(source, temporary);
        if (Files.isDirectory(destination)) {
            MoreFiles.deleteRecursively(destination, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        Files.move(temporary, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOGGER.info("Published {} to {}", ref.id().describe(), destination);
        return destination;
    }

    @Override
    public Path createWorkDirectory(final String runId, final String name) throws IOException {
        checkSegment(runId);
        var parent = Files.createDirectories(root.resolve(WORK).resolve(runId));
        return Files.createTempDirectory(parent, name.replaceAll("[^A-Za-z0-9._-]", "_") + "-");
    }

    private Path stageDirectory(final String runId, final String stage) {
        return root.resolve(RUNS).resolve(checkSegment(runId)).resolve(checkSegment(stage));
    }

    private Path artifactDirectory(final String runId, final ArtifactId id) {
        var directory = stageDirectory(runId, id.stage()).resolve(checkSegment(id.output()));
        return id.shard().isPresent() ? directory.resolve(checkSegment(id.shard().get())) : directory;
    }

    private Path sharedDirectory(final String namespace) {
        var directory = root;
        for (String segment : namespace.split("/")) {
            directory = directory.resolve(checkSegment(segment));
        }
        Preconditions.checkArgument(!directory.startsWith(root.resolve(RUNS)) && !directory.startsWith(root.resolve(WORK)),
                "Shared namespace '%s' collides with run storage",
                namespace);
        return directory;
    }

    private static String runNamespace(final String runId) {
        return RUNS + "/" + runId;
    }

    /**
     * Copies data into a temporary sibling of target and renames it into place. A complete target is never replaced.
     */
    private static Path moveIntoPlace(final Path target, final Path data) throws IOException {
        var fileName = data.getFileName().toString();
        if (Files.isDirectory(target)) {
            var existing = target.resolve(fileName);
            if (Files.exists(existing)) {
                LOGGER.info("Artifact at {} already complete, keeping existing copy", existing);
                return existing;
            }
        }
        Files.createDirectories(target.getParent());
        var temporary = target.resolveSibling("." + target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Files.createDirectories(temporary);
            copyRecursively(data, temporary.resolve(fileName));
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileSystemException e) {
            if (!Files.isDirectory(target)) {
                throw e;
            }
            LOGGER.info("Artifact at {} was completed concurrently, keeping existing copy", target);
        } finally {
            deleteIfExists(temporary);
        }
        return singleEntry(target).orElseThrow(() -> new IOException("Artifact directory " + target + " is empty after store"));
    }

    /**
     * Moves a complete temporary directory to target. An existing target is first moved aside to replaced, so readers see either
     * the old or the new content.
     *
     * @return whether an existing target was replaced
     */
    private static boolean replace(final Path temporary, final Path target, final Path replaced) throws IOException {
        var existed = Files.exists(target);
        if (existed) {
            Files.move(target, replaced, StandardCopyOption.ATOMIC_MOVE);
        }
        Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE);
        return existed;
    }

    private static void deleteIfExists(final Path path) throws IOException {
        if (Files.exists(path)) {
            MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }

    private static Optional<Path> singleEntry(final Path directory) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> visible = entries.filter(path -> !path.getFileName().toString().startsWith(".")).collect(Collectors.toList());
            return visible.size() == 1 ? Optional.of(visible.get(0)) : Optional.empty();
        } catch (IOException e) {
            throw new ArtifactNotFoundException("Could not list artifact directory " + directory + ": " + e.getMessage());
        }
    }

    static void copyRecursively(final Path source, final Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path path : paths.collect(Collectors.toList())) {
                var destination = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    private static String checkSegment(final String segment) {
        Preconditions.checkArgument(VALID_SEGMENT.matcher(segment).matches() && !segment.equals(".") && !segment.equals(".."),
                "Invalid store path segment '%s'",
                segment);
        return segment;
    }
}
