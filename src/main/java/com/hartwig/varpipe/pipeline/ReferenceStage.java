package com.hartwig.varpipe.pipeline;

import com.hartwig.varpipe.reference.ReferenceCache;
import com.hartwig.varpipe.storage.ArtifactRef;
import com.hartwig.varpipe.workflow.StageContext;
import com.hartwig.varpipe.workflow.StageExecutor;
import com.hartwig.varpipe.workflow.StageResult;

/**
 * Resolves the reference build of the run's version through the shared cache. The build directory is the output artifact.
 */
public class ReferenceStage implements StageExecutor {
    private final ReferenceCache referenceCache;
    private final String output;

    public ReferenceStage(final ReferenceCache referenceCache, final String output) {
        this.referenceCache = referenceCache;
        this.output = output;
    }

    @Override
    public StageResult execute(StageContext context) {
        var version = context.parameters().referenceVersion();
        var build = referenceCache.getOrBuild(version);
        return StageResult.builder().putStoredOutputs(output, ArtifactRef.shared(ReferenceCache.namespace(version), build.directory())).build();
    }
}
