package com.hartwig.varpipe.workflow;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.hash.Hasher;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;

/**
 * Digests that decide whether stored stage outputs may be reused. A stage's fingerprint covers its definition, its configuration,
 * the graph settings and the fingerprints of its inputs, so a change anywhere upstream changes every fingerprint below it.
 */
final class StageFingerprints {
    private static final HashFunction HASH = Hashing.sha256();

    private StageFingerprints() {
    }

    /**
     * Content digest of an external input file, or of every file below an external input directory.
     */
    static String ofInput(Path path) throws IOException {
        if (!Files.exists(path)) {
            return "missing:" + path.toAbsolutePath();
        }
        if (!Files.isDirectory(path)) {
            return MoreFiles.asByteSource(path).hash(HASH).toString();
        }
        var hasher = HASH.newHasher();
        List<Path> files;
        try (Stream<Path> paths = Files.walk(path)) {
            files = paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            putField(hasher, path.relativize(file).toString());
            putField(hasher, MoreFiles.asByteSource(file).hash(HASH).toString());
        }
        return hasher.hash().toString();
    }

    static String ofStage(Stage stage, String configuration, Map<String, String> settings, Map<String, String> inputFingerprints) {
        var hasher = HASH.newHasher();
        putField(hasher, stage.name());
        for (String output : stage.outputs()) {
            putField(hasher, "output:" + output);
        }
        for (String input : stage.inputs()) {
            putField(hasher, "input:" + input);
            putField(hasher, inputFingerprints.get(input));
        }
        new TreeMap<>(settings).forEach((name, value) -> {
            putField(hasher, "setting:" + name);
            putField(hasher, value);
        });
        putField(hasher, configuration);
        return hasher.hash().toString();
    }

    private static void putField(Hasher hasher, String value) {
        hasher.putInt(value.length()).putString(value, StandardCharsets.UTF_8);
    }
}
