package com.hartwig.varpipe.scatter;

import com.hartwig.varpipe.PipelineException;

/**
 * A shard of a scatter did not complete, so the gather cannot merge.
 */
public class ShardFailure extends PipelineException {
    private final String shardKey;

    public ShardFailure(final String shardKey, final String reason) {
        super(String.format("Shard '%s' did not complete: %s", shardKey, reason));
        this.shardKey = shardKey;
    }

    public String getShardKey() {
        return shardKey;
    }
}
