package com.hartwig.varpipe.config;

import java.util.Arrays;
import java.util.Optional;

public enum ReferenceVersion {
    HG19("hg19", "GRCh37"),
    HG38("hg38", "GRCh38");

    private final String ucscName;
    private final String assembly;

    ReferenceVersion(final String ucscName, final String assembly) {
        this.ucscName = ucscName;
        this.assembly = assembly;
    }

    public String ucscName() {
        return ucscName;
    }

    public String assembly() {
        return assembly;
    }

    /**
     * Exact, case sensitive match on the UCSC name.
     */
    public static Optional<ReferenceVersion> fromName(String name) {
        return Arrays.stream(values()).filter(version -> version.ucscName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return ucscName;
    }
}
