package com.hartwig.varpipe.workflow;

import com.hartwig.varpipe.PipelineException;

/**
 * The stage graph is malformed: duplicate names or producers, missing producers, or dependency cycles.
 */
public class StageGraphException extends PipelineException {
    public StageGraphException(final String message) {
        super(message);
    }
}
