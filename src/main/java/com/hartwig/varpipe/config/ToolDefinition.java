package com.hartwig.varpipe.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableToolDefinition.class)
@JsonSerialize(as = ImmutableToolDefinition.class)
public interface ToolDefinition {
    /**
     * Program and arguments. Arguments may contain ${name} placeholders for input artifacts and run parameters.
     */
    List<String> command();

    /**
     * File names the tool writes into its working directory.
     */
    List<String> outputs();

    /**
     * Output file that receives stdout, for tools that stream their result. Must also be listed in outputs.
     */
    Optional<String> stdout();

    Optional<Integer> timeoutMinutes();

    default Optional<Duration> timeout() {
        return timeoutMinutes().map(Duration::ofMinutes);
    }

    @Value.Check
    default void check() {
        if (command().isEmpty()) {
            throw new IllegalStateException("Tool command may not be empty");
        }
        stdout().ifPresent(stdout -> {
            if (!outputs().contains(stdout)) {
                throw new IllegalStateException(String.format("stdout target '%s' is not a declared output %s", stdout, outputs()));
            }
        });
    }

    static ImmutableToolDefinition.Builder builder() {
        return ImmutableToolDefinition.builder();
    }
}
