package com.hartwig.varpipe.pipeline;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.varpipe.config.ToolDefinition;
import com.hartwig.varpipe.config.ToolsDefinition;
import com.hartwig.varpipe.tool.CommandTemplate;
import com.hartwig.varpipe.tool.ExternalToolAdapter;
import com.hartwig.varpipe.tool.ToolInvocation;
import com.hartwig.varpipe.tool.ToolResult;
import com.hartwig.varpipe.workflow.StageContext;

/**
 * The configured external tools of the pipeline, invoked by name.
 */
public class PipelineTools {
    private final ToolsDefinition definitions;
    private final ExternalToolAdapter adapter;

    public PipelineTools(final ToolsDefinition definitions, final ExternalToolAdapter adapter) {
        this.definitions = definitions;
        this.adapter = adapter;
    }

    public ToolDefinition definition(String toolName) {
        return definitions.tool(toolName);
    }

    /**
     * Fails fast when a tool is missing or declares a different number of outputs than the stage maps.
     */
    public void requireOutputs(String toolName, int count) {
        var outputs = definition(toolName).outputs();
        if (outputs.size() != count) {
            throw new IllegalArgumentException(String.format("Tool '%s' must declare %d output(s), found %s", toolName, count, outputs));
        }
    }

    public ToolResult run(String toolName, Map<String, String> values, Path workDirectory) {
        var tool = definition(toolName);
        return adapter.invoke(ToolInvocation.builder()
                .toolName(toolName)
                .command(CommandTemplate.of(tool.command()))
                .values(values)
                .declaredOutputs(tool.outputs())
                .stdoutOutput(tool.stdout())
                .workDirectory(workDirectory)
                .timeout(tool.timeout())
                .build());
    }

    /**
     * The parts of the tool definitions that determine what the tools write, for stage fingerprints.
     */
    public String configuration(String... toolNames) {
        return Arrays.stream(toolNames).map(toolName -> {
            var tool = definition(toolName);
            return String.format("%s command=%s outputs=%s stdout=%s", toolName, tool.command(), tool.outputs(), tool.stdout().orElse(""));
        }).collect(Collectors.joining("\n"));
    }

    /**
     * @return the i-th declared output file of the tool run
     */
    public Path output(String toolName, ToolResult result, int index) {
        return result.output(definition(toolName).outputs().get(index));
    }

    /**
     * Placeholder values for a stage: run parameters, the stage work directory and every input artifact path by artifact name.
     */
    public static Map<String, String> values(StageContext context) {
        var values = new LinkedHashMap<>(context.parameters().templateValues());
        values.put("work_directory", context.workDirectory().toAbsolutePath().toString());
        context.inputs().forEach((name, ref) -> values.put(name, ref.path().toAbsolutePath().toString()));
        return values;
    }
}
