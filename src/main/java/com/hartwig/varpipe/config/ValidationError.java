package com.hartwig.varpipe.config;

import java.util.List;
import java.util.stream.Collectors;

import com.hartwig.varpipe.PipelineException;

/**
 * One or more run parameters are missing or invalid. Raised before any stage is started.
 */
public class ValidationError extends PipelineException {
    private final List<ParameterViolation> violations;

    public ValidationError(final List<ParameterViolation> violations) {
        super(violations.stream()
                .map(violation -> String.format("Invalid parameter '%s': %s", violation.parameter(), violation.reason()))
                .collect(Collectors.joining("; ")));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("Validation error needs at least one violation");
        }
        this.violations = List.copyOf(violations);
    }

    /**
     * @return name of the first offending parameter
     */
    public String getParameter() {
        return violations.get(0).parameter();
    }

    public List<ParameterViolation> getViolations() {
        return violations;
    }
}
