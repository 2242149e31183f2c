package com.hartwig.varpipe.tool;

import java.util.List;

import com.hartwig.varpipe.PipelineException;

/**
 * An external tool exited non-zero, timed out, could not be started or did not produce a declared output.
 */
public class ToolFailure extends PipelineException {
    public static final int NOT_STARTED = -1;

    private final String toolName;
    private final int exitCode;
    private final List<String> diagnostics;

    public ToolFailure(final String toolName, final int exitCode, final String reason, final List<String> diagnostics) {
        super(String.format("Tool '%s' failed (exit code %d): %s%s",
                toolName,
                exitCode,
                reason,
                diagnostics.isEmpty() ? "" : System.lineSeparator() + String.join(System.lineSeparator(), diagnostics)));
        this.toolName = toolName;
        this.exitCode = exitCode;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getToolName() {
        return toolName;
    }

    public int getExitCode() {
        return exitCode;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
