package com.hartwig.varpipe.tool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ToolResult {
    String toolName();

    /**
     * Declared output name to produced file.
     */
    Map<String, Path> outputs();

    List<String> diagnostics();

    default Path output(String name) {
        var path = outputs().get(name);
        if (path == null) {
            throw new IllegalArgumentException(String.format("Tool '%s' declared no output '%s'", toolName(), name));
        }
        return path;
    }
}
