package com.hartwig.varpipe.scatter;

import java.util.Optional;

/**
 * Maps a VCF record line to the shard it belongs to. Records without a key are dropped from the scatter.
 */
@FunctionalInterface
public interface PartitionKeyExtractor {
    Optional<String> keyOf(String record);

    static PartitionKeyExtractor byChromosome() {
        return record -> Optional.of(VcfFiles.chromosome(record)).filter(chromosome -> !chromosome.isEmpty());
    }
}
