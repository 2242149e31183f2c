package com.hartwig.varpipe.reference;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import com.hartwig.varpipe.config.ReferenceVersion;

import org.immutables.value.Value;

/**
 * Reference genome sequence with its index and sequence dictionary, shared by all runs on the same reference version.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ReferenceBuild {
    String SEQUENCE_FILE = "genome.fa";
    String INDEX_FILE = "genome.fa.fai";
    String DICTIONARY_FILE = "genome.dict";

    ReferenceVersion version();

    Path directory();

    default Path sequence() {
        return directory().resolve(SEQUENCE_FILE);
    }

    default Path index() {
        return directory().resolve(INDEX_FILE);
    }

    default Path dictionary() {
        return directory().resolve(DICTIONARY_FILE);
    }

    default boolean isComplete() {
        return Stream.of(sequence(), index(), dictionary()).allMatch(Files::isRegularFile);
    }

    static ReferenceBuild at(ReferenceVersion version, Path directory) {
        return ImmutableReferenceBuild.builder().version(version).directory(directory).build();
    }
}
