package com.hartwig.varpipe.pipeline;

import java.io.IOException;
import java.nio.file.Files;

import com.hartwig.varpipe.scatter.VcfFiles;
import com.hartwig.varpipe.workflow.StageContext;
import com.hartwig.varpipe.workflow.StageExecutor;
import com.hartwig.varpipe.workflow.StageResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joint genotyping of a gVCF. Input without the gVCF reference-block marker is already genotyped and passes through unchanged.
 */
public class GenotypeCallStage implements StageExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenotypeCallStage.class);
    static final String GVCF_MARKER = "<NON_REF>";

    private final PipelineTools tools;
    private final String toolName;
    private final String input;
    private final String output;

    public GenotypeCallStage(final PipelineTools tools, final String toolName, final String input, final String output) {
        tools.requireOutputs(toolName, 1);
        this.tools = tools;
        this.toolName = toolName;
        this.input = input;
        this.output = output;
    }

    @Override
    public String configuration() {
        return tools.configuration(toolName);
    }

    @Override
    public StageResult execute(StageContext context) throws IOException {
        var vcf = context.input(input);
        if (!VcfFiles.containsMarker(vcf, GVCF_MARKER)) {
            var passThrough = context.workDirectory().resolve(vcf.getFileName().toString());
            Files.copy(vcf, passThrough);
            var reason = String.format("no %s marker in %s, input is not a gVCF and is used as is", GVCF_MARKER, vcf.getFileName());
            LOGGER.warn("[{}] {}", context.runId(), reason);
            return StageResult.fallbackTo(output, passThrough, reason);
        }
        var result = tools.run(toolName, PipelineTools.values(context), context.workDirectory());
        return StageResult.of(output, tools.output(toolName, result, 0));
    }
}
