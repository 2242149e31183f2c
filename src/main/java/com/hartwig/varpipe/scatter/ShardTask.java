package com.hartwig.varpipe.scatter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Work applied to one shard independently of all others.
 */
@FunctionalInterface
public interface ShardTask {
    /**
     * @param shardKey chromosome of the shard
     * @param files    files of the input shard by name
     * @return produced files by name
     */
    Map<String, Path> run(String shardKey, Map<String, Path> files) throws IOException;
}
