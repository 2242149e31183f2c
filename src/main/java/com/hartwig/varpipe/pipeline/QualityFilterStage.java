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
 * Runs the quality filter tool. When no record passes the filter, the unfiltered input is used instead so downstream scoring
 * still has variants to rank.
 */
public class QualityFilterStage implements StageExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(QualityFilterStage.class);

    private final PipelineTools tools;
    private final String toolName;
    private final String input;
    private final String output;

    public QualityFilterStage(final PipelineTools tools, final String toolName, final String input, final String output) {
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
        var result = tools.run(toolName, PipelineTools.values(context), context.workDirectory());
        var filtered = tools.output(toolName, result, 0);
        var records = VcfFiles.countRecords(filtered);
        if (records > 0) {
            LOGGER.info("[{}] {} records passed the quality filter", context.runId(), records);
            return StageResult.of(output, filtered);
        }

        var unfiltered = context.input(input);
        var fallbackDirectory = Files.createDirectories(context.workDirectory().resolve("unfiltered"));
        var copy = fallbackDirectory.resolve(unfiltered.getFileName().toString());
        Files.copy(unfiltered, copy);
        var reason = "no records passed the quality filter, continuing with the unfiltered input";
        LOGGER.warn("[{}] {}", context.runId(), reason);
        return StageResult.fallbackTo(output, copy, reason);
    }
}
