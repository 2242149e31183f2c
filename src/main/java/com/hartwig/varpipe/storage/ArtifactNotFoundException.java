package com.hartwig.varpipe.storage;

import com.hartwig.varpipe.PipelineException;

public class ArtifactNotFoundException extends PipelineException {
    public ArtifactNotFoundException(final String message) {
        super(message);
    }
}
