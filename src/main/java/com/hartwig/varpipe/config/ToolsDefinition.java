package com.hartwig.varpipe.config;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * External tool commands by tool name.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableToolsDefinition.class)
@JsonSerialize(as = ImmutableToolsDefinition.class)
public interface ToolsDefinition {
    Map<String, ToolDefinition> tools();

    default ToolDefinition tool(String name) {
        var tool = tools().get(name);
        if (tool == null) {
            throw new IllegalArgumentException(String.format("No definition for tool '%s', known tools are %s", name, tools().keySet()));
        }
        return tool;
    }

    /**
     * @return these definitions with the tools in overrides replacing those of the same name
     */
    default ToolsDefinition withOverrides(ToolsDefinition overrides) {
        var merged = new LinkedHashMap<>(tools());
        merged.putAll(overrides.tools());
        return builder().tools(merged).build();
    }

    static ImmutableToolsDefinition.Builder builder() {
        return ImmutableToolsDefinition.builder();
    }
}
