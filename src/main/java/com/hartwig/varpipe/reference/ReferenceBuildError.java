package com.hartwig.varpipe.reference;

import com.hartwig.varpipe.PipelineException;
import com.hartwig.varpipe.config.ReferenceVersion;

public class ReferenceBuildError extends PipelineException {
    private final ReferenceVersion version;

    public ReferenceBuildError(final ReferenceVersion version, final String reason, final Throwable cause) {
        super(String.format("Could not build reference %s: %s", version, reason), cause);
        this.version = version;
    }

    public ReferenceVersion getVersion() {
        return version;
    }
}
