package com.hartwig.varpipe.reference;

import java.io.IOException;
import java.nio.file.Path;

import com.hartwig.varpipe.config.ReferenceVersion;

/**
 * Produces the sequence, index and dictionary files of a {@link ReferenceBuild} in the given, empty directory.
 */
@FunctionalInterface
public interface ReferenceBuilder {
    void build(ReferenceVersion version, Path targetDirectory) throws IOException;
}
