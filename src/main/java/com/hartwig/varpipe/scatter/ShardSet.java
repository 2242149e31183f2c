package com.hartwig.varpipe.scatter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The shards of one scatter and their completion status, iterated in chromosome order.
 */
public class ShardSet {
    public enum ShardStatus {
        PENDING,
        COMPLETED,
        FAILED
    }

    private static class Shard {
        private ShardStatus status = ShardStatus.PENDING;
        private Map<String, Path> files = Map.of();
        private String failure;
    }

    private final TreeMap<String, Shard> shardsByKey = new TreeMap<>(ChromosomeOrder.INSTANCE);

    public static ShardSet pending(Iterable<String> keys) {
        var shardSet = new ShardSet();
        for (String key : keys) {
            shardSet.shardsByKey.put(key, new Shard());
        }
        return shardSet;
    }

    public synchronized List<String> keys() {
        return new ArrayList<>(shardsByKey.keySet());
    }

    public synchronized int size() {
        return shardsByKey.size();
    }

    public synchronized void complete(String key, Map<String, Path> files) {
        var shard = shard(key);
        shard.status = ShardStatus.COMPLETED;
        shard.files = Map.copyOf(files);
    }

    public synchronized void fail(String key, String reason) {
        var shard = shard(key);
        shard.status = ShardStatus.FAILED;
        shard.failure = reason;
    }

    public synchronized ShardStatus status(String key) {
        return shard(key).status;
    }

    public synchronized Map<String, Path> files(String key) {
        return shard(key).files;
    }

    public synchronized Optional<String> failure(String key) {
        return Optional.ofNullable(shard(key).failure);
    }

    public synchronized boolean isComplete() {
        return shardsByKey.values().stream().allMatch(shard -> shard.status == ShardStatus.COMPLETED);
    }

    /**
     * @return keys of shards that are pending or failed, in chromosome order
     */
    public synchronized List<String> incomplete() {
        return shardsByKey.entrySet()
                .stream()
                .filter(entry -> entry.getValue().status != ShardStatus.COMPLETED)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * @return the named file of every shard in chromosome order
     * @throws ShardFailure if a shard is not complete or lacks the file
     */
    public synchronized List<Path> orderedFiles(String name) {
        var files = new ArrayList<Path>();
        for (var entry : shardsByKey.entrySet()) {
            var shard = entry.getValue();
            if (shard.status != ShardStatus.COMPLETED) {
                throw new ShardFailure(entry.getKey(), shard.status == ShardStatus.FAILED ? shard.failure : "still pending");
            }
            var file = shard.files.get(name);
            if (file == null) {
                throw new ShardFailure(entry.getKey(), String.format("no output '%s'", name));
            }
            files.add(file);
        }
        return files;
    }

    private Shard shard(String key) {
        var shard = shardsByKey.get(key);
        if (shard == null) {
            throw new IllegalArgumentException(String.format("Unknown shard '%s', shards are %s", key, shardsByKey.keySet()));
        }
        return shard;
    }

    @Override
    public synchronized String toString() {
        return shardsByKey.entrySet()
                .stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue().status)
                .collect(Collectors.joining(", ", "ShardSet{", "}"));
    }
}
