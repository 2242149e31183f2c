package com.hartwig.varpipe.scatter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Combines per-shard files, given in shard order, into one file.
 */
public interface MergeStrategy {
    void merge(List<Path> shardFiles, Path target) throws IOException;

    /**
     * Text tables (optionally gzipped) whose header occurs once in the result.
     */
    static MergeStrategy headerOnce() {
        return new HeaderOnceMergeStrategy();
    }

    /**
     * Gzipped tables: the first shard is copied as is, later shards are appended as new gzip members without their header.
     */
    static MergeStrategy compressed() {
        return new CompressedMergeStrategy();
    }
}
