package com.hartwig.varpipe;

/**
 * Base of all fatal pipeline errors. Subclasses name the part of the pipeline that failed.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(final String message) {
        super(message);
    }

    public PipelineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
