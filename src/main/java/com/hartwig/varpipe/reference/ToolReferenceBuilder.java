package com.hartwig.varpipe.reference;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.varpipe.config.ReferenceVersion;
import com.hartwig.varpipe.config.ToolDefinition;
import com.hartwig.varpipe.config.ToolsDefinition;
import com.hartwig.varpipe.scatter.ChromosomeOrder;
import com.hartwig.varpipe.tool.CommandTemplate;
import com.hartwig.varpipe.tool.ExternalToolAdapter;
import com.hartwig.varpipe.tool.ToolInvocation;

/**
 * Builds a reference with three external tools: fetch and restrict the sequence, index it, create the sequence dictionary.
 */
public class ToolReferenceBuilder implements ReferenceBuilder {
    public static final String FETCH_TOOL = "reference_fetch";
    public static final String INDEX_TOOL = "reference_index";
    public static final String DICTIONARY_TOOL = "reference_dictionary";

    private final ToolsDefinition tools;
    private final ExternalToolAdapter toolAdapter;

    public ToolReferenceBuilder(final ToolsDefinition tools, final ExternalToolAdapter toolAdapter) {
        this.tools = tools;
        this.toolAdapter = toolAdapter;
    }

    @Override
    public void build(ReferenceVersion version, Path targetDirectory) {
        var values = new HashMap<String, String>();
        values.put("reference_version", version.ucscName());
        values.put("assembly", version.assembly());
        values.put("chromosomes",
                ChromosomeOrder.CANONICAL.stream().map(chromosome -> "chr" + chromosome).collect(Collectors.joining(" ")));
        values.put("sequence", targetDirectory.resolve(ReferenceBuild.SEQUENCE_FILE).toString());
        values.put("dictionary", targetDirectory.resolve(ReferenceBuild.DICTIONARY_FILE).toString());

        for (String toolName : new String[] { FETCH_TOOL, INDEX_TOOL, DICTIONARY_TOOL }) {
            run(toolName, tools.tool(toolName), values, targetDirectory);
        }
    }

    private void run(String toolName, ToolDefinition tool, Map<String, String> values, Path workDirectory) {
        toolAdapter.invoke(ToolInvocation.builder()
                .toolName(toolName)
                .command(CommandTemplate.of(tool.command()))
                .values(values)
                .declaredOutputs(tool.outputs())
                .stdoutOutput(tool.stdout())
                .workDirectory(workDirectory)
                .timeout(tool.timeout())
                .build());
    }
}
