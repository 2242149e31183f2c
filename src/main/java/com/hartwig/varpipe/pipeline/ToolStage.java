package com.hartwig.varpipe.pipeline;

import java.util.List;

import com.hartwig.varpipe.workflow.StageContext;
import com.hartwig.varpipe.workflow.StageExecutor;
import com.hartwig.varpipe.workflow.StageResult;

/**
 * Stage that is a single tool run. The i-th declared output file of the tool becomes the i-th output artifact of the stage.
 */
public class ToolStage implements StageExecutor {
    private final PipelineTools tools;
    private final String toolName;
    private final List<String> outputs;

    public ToolStage(final PipelineTools tools, final String toolName, final List<String> outputs) {
        tools.requireOutputs(toolName, outputs.size());
        this.tools = tools;
        this.toolName = toolName;
        this.outputs = List.copyOf(outputs);
    }

    @Override
    public String configuration() {
        return tools.configuration(toolName);
    }

    @Override
    public StageResult execute(StageContext context) {
        var result = tools.run(toolName, PipelineTools.values(context), context.workDirectory());
        var stageResult = StageResult.builder();
        for (int i = 0; i < outputs.size(); i++) {
            stageResult.putOutputs(outputs.get(i), tools.output(toolName, result, i));
        }
        return stageResult.build();
    }
}
