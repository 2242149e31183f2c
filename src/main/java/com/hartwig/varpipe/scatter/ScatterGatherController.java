package com.hartwig.varpipe.scatter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a VCF into one shard per chromosome, runs work on every shard in parallel and merges the results back in chromosome order.
 */
public class ScatterGatherController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScatterGatherController.class);
    public static final String SHARD_VCF = "vcf";

    private final ExecutorService shardExecutor;

    public ScatterGatherController(final ExecutorService shardExecutor) {
        this.shardExecutor = shardExecutor;
    }

    /**
     * Writes one file per partition key found in the VCF, each with the full header followed by that key's records in input order.
     * Compressed input gives compressed shards. All returned shards are complete, with their file under {@link #SHARD_VCF}.
     */
    public ShardSet scatter(Path vcf, PartitionKeyExtractor keyExtractor, Path shardDirectory) throws IOException {
        Files.createDirectories(shardDirectory);
        var extension = VcfFiles.isCompressed(vcf) ? ".vcf.gz" : ".vcf";
        var header = new ArrayList<String>();
        var writersByKey = new LinkedHashMap<String, BufferedWriter>();
        var pathsByKey = new LinkedHashMap<String, Path>();
        try (var reader = VcfFiles.openReader(vcf)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                if (VcfFiles.isHeader(line)) {
                    header.add(line);
                    continue;
                }
                var key = keyExtractor.keyOf(line);
                if (key.isEmpty()) {
                    LOGGER.warn("Skipping record without partition key: {}", line);
                    continue;
                }
                var writer = writersByKey.get(key.get());
                if (writer == null) {
                    var path = shardDirectory.resolve(key.get().replaceAll("[^A-Za-z0-9._-]", "_") + extension);
                    writer = VcfFiles.openWriter(path);
                    for (String headerLine : header) {
                        writer.write(headerLine);
                        writer.newLine();
                    }
                    writersByKey.put(key.get(), writer);
                    pathsByKey.put(key.get(), path);
                }
                writer.write(line);
                writer.newLine();
            }
        } finally {
            closeAll(writersByKey.values());
        }

        var shardSet = ShardSet.pending(pathsByKey.keySet());
        pathsByKey.forEach((key, path) -> shardSet.complete(key, Map.of(SHARD_VCF, path)));
        LOGGER.info("Scattered {} into {} shards: {}", vcf.getFileName(), shardSet.size(), shardSet.keys());
        return shardSet;
    }

    /**
     * Runs the task for every completed shard of the input in parallel and waits for all of them. A failing shard is recorded as
     * failed in the result, it does not stop the other shards.
     */
    public ShardSet map(ShardSet input, ShardTask task) {
        var keys = input.keys();
        var output = ShardSet.pending(keys);
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (String key : keys) {
            futures.add(CompletableFuture.runAsync(() -> runShard(input, output, key, task), shardExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        LOGGER.info("Finished shard work: {}", output);
        return output;
    }

    private static void runShard(ShardSet input, ShardSet output, String key, ShardTask task) {
        if (input.status(key) != ShardSet.ShardStatus.COMPLETED) {
            output.fail(key, "input shard did not complete");
            return;
        }
        try {
            output.complete(key, task.run(key, input.files(key)));
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Shard [{}] failed", key, e);
            output.fail(key, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Merges the named file of every shard into target, in chromosome order.
     *
     * @throws ShardFailure naming the first shard that did not complete; nothing is merged in that case
     */
    public Path gather(ShardSet shards, String fileName, MergeStrategy strategy, Path target) throws IOException {
        checkComplete(shards);
        List<Path> files = shards.orderedFiles(fileName);
        strategy.merge(files, target);
        LOGGER.info("Gathered {} shards into {}", files.size(), target.getFileName());
        return target;
    }

    /**
     * Gathers shards that hold a single file each.
     */
    public Path gather(ShardSet shards, MergeStrategy strategy, Path target) throws IOException {
        checkComplete(shards);
        var names = shards.keys().stream().flatMap(key -> shards.files(key).keySet().stream()).distinct().collect(Collectors.toList());
        if (names.size() != 1) {
            throw new IllegalArgumentException(String.format("Cannot pick the file to gather from shards holding %s", names));
        }
        return gather(shards, names.get(0), strategy, target);
    }

    private static void checkComplete(ShardSet shards) {
        var incomplete = shards.incomplete();
        if (!incomplete.isEmpty()) {
            var key = incomplete.get(0);
            throw new ShardFailure(key, shards.failure(key).orElse("still " + shards.status(key).name().toLowerCase()));
        }
    }

    private static void closeAll(Iterable<BufferedWriter> writers) throws IOException {
        IOException failure = null;
        for (BufferedWriter writer : writers) {
            try {
                writer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
