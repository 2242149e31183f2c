package com.hartwig.varpipe.config;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ParameterViolation {
    @Value.Parameter
    String parameter();

    @Value.Parameter
    String reason();

    static ParameterViolation of(String parameter, String reason) {
        return ImmutableParameterViolation.of(parameter, reason);
    }
}
