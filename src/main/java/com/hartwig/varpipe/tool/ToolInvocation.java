package com.hartwig.varpipe.tool;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ToolInvocation {
    /**
     * Name used in logs and failures.
     */
    String toolName();

    CommandTemplate command();

    /**
     * Placeholder values, artifact paths and run parameters alike.
     */
    Map<String, String> values();

    /**
     * File names expected in the working directory after a zero exit code.
     */
    List<String> declaredOutputs();

    /**
     * Declared output that receives the process stdout. When absent stdout is captured with stderr as diagnostics.
     */
    Optional<String> stdoutOutput();

    Path workDirectory();

    /**
     * The process is killed when it runs longer than this.
     */
    Optional<Duration> timeout();

    static ImmutableToolInvocation.Builder builder() {
        return ImmutableToolInvocation.builder();
    }
}
