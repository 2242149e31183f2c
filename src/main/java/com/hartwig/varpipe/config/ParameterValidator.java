package com.hartwig.varpipe.config;

import static com.hartwig.varpipe.config.PipelineParameters.CHROMOSOME_MAP;
import static com.hartwig.varpipe.config.PipelineParameters.INPUT_HPO;
import static com.hartwig.varpipe.config.PipelineParameters.INPUT_VCF;
import static com.hartwig.varpipe.config.PipelineParameters.OUTPUT_DIRECTORY;
import static com.hartwig.varpipe.config.PipelineParameters.REFERENCE_DIRECTORY;
import static com.hartwig.varpipe.config.PipelineParameters.REFERENCE_VERSION;
import static com.hartwig.varpipe.config.PipelineParameters.RUN_ID;
import static com.hartwig.varpipe.config.PipelineParameters.STORE_DIRECTORY;
import static com.hartwig.varpipe.config.PipelineParameters.THREADS;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw parameter map into {@link PipelineParameters}. Every parameter is checked so the error lists all problems at once.
 */
public class ParameterValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParameterValidator.class);

    private static final List<String> VCF_EXTENSIONS = List.of(".vcf", ".vcf.gz");
    private static final List<String> HPO_EXTENSIONS = List.of(".hpo", ".txt");
    private static final Pattern RUN_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String DEFAULT_OUTPUT_DIRECTORY = "out";
    private static final String DEFAULT_STORE_SUBDIRECTORY = ".store";

    public PipelineParameters validate(Map<String, String> parameters) {
        var violations = new ArrayList<ParameterViolation>();

        var inputVcf = requiredFile(parameters, INPUT_VCF, VCF_EXTENSIONS, violations);
        var inputHpo = requiredFile(parameters, INPUT_HPO, HPO_EXTENSIONS, violations);
        var referenceDirectory = requiredDirectory(parameters, violations);
        var referenceVersion = requiredReferenceVersion(parameters, violations);
        var chromosomeMap = optionalFile(parameters, CHROMOSOME_MAP, violations);
        var threads = optionalThreads(parameters, violations);
        var runId = runId(parameters, inputVcf, violations);

        if (!violations.isEmpty()) {
            var error = new ValidationError(violations);
            LOGGER.error("Parameter validation failed: {}", error.getMessage());
            throw error;
        }

        var outputDirectory = Path.of(valueOf(parameters, OUTPUT_DIRECTORY).orElse(DEFAULT_OUTPUT_DIRECTORY));
        var storeDirectory =
                valueOf(parameters, STORE_DIRECTORY).map(Path::of).orElse(outputDirectory.resolve(DEFAULT_STORE_SUBDIRECTORY));
        var builder = PipelineParameters.builder()
                .runId(runId.orElseThrow())
                .inputVcf(inputVcf.orElseThrow())
                .inputHpo(inputHpo.orElseThrow())
                .referenceDirectory(referenceDirectory.orElseThrow())
                .referenceVersion(referenceVersion.orElseThrow())
                .outputDirectory(outputDirectory)
                .storeDirectory(storeDirectory)
                .chromosomeMap(chromosomeMap);
        threads.ifPresent(builder::threads);
        return builder.build();
    }

    private static Optional<Path> requiredFile(Map<String, String> parameters, String name, List<String> extensions,
            List<ParameterViolation> violations) {
        var value = valueOf(parameters, name);
        if (value.isEmpty()) {
            violations.add(ParameterViolation.of(name, "is required"));
            return Optional.empty();
        }
        var path = Path.of(value.get());
        if (extensions.stream().noneMatch(extension -> value.get().endsWith(extension))) {
            violations.add(ParameterViolation.of(name, String.format("'%s' must end with one of %s", path, extensions)));
            return Optional.empty();
        }
        if (!Files.isRegularFile(path)) {
            violations.add(ParameterViolation.of(name, String.format("file '%s' does not exist", path)));
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static Optional<Path> requiredDirectory(Map<String, String> parameters, List<ParameterViolation> violations) {
        var value = valueOf(parameters, REFERENCE_DIRECTORY);
        if (value.isEmpty()) {
            violations.add(ParameterViolation.of(REFERENCE_DIRECTORY, "is required"));
            return Optional.empty();
        }
        var path = Path.of(value.get());
        if (!Files.exists(path)) {
            violations.add(ParameterViolation.of(REFERENCE_DIRECTORY, String.format("directory '%s' does not exist", path)));
            return Optional.empty();
        }
        if (!Files.isDirectory(path)) {
            violations.add(ParameterViolation.of(REFERENCE_DIRECTORY, String.format("'%s' is a file, not a directory", path)));
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static Optional<ReferenceVersion> requiredReferenceVersion(Map<String, String> parameters,
            List<ParameterViolation> violations) {
        var value = valueOf(parameters, REFERENCE_VERSION);
        if (value.isEmpty()) {
            violations.add(ParameterViolation.of(REFERENCE_VERSION, "is required"));
            return Optional.empty();
        }
        var version = ReferenceVersion.fromName(value.get());
        if (version.isEmpty()) {
            var allowed = Arrays.stream(ReferenceVersion.values()).map(ReferenceVersion::ucscName).collect(Collectors.toList());
            violations.add(ParameterViolation.of(REFERENCE_VERSION, String.format("'%s' is not one of %s", value.get(), allowed)));
        }
        return version;
    }

    private static Optional<Path> optionalFile(Map<String, String> parameters, String name, List<ParameterViolation> violations) {
        var value = valueOf(parameters, name);
        if (value.isPresent() && !Files.isRegularFile(Path.of(value.get()))) {
            violations.add(ParameterViolation.of(name, String.format("file '%s' does not exist", value.get())));
            return Optional.empty();
        }
        return value.map(Path::of);
    }

    private static Optional<Integer> optionalThreads(Map<String, String> parameters, List<ParameterViolation> violations) {
        var value = valueOf(parameters, THREADS);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            var threads = Integer.parseInt(value.get());
            if (threads < 1) {
                violations.add(ParameterViolation.of(THREADS, "must be at least 1"));
                return Optional.empty();
            }
            return Optional.of(threads);
        } catch (NumberFormatException e) {
            violations.add(ParameterViolation.of(THREADS, String.format("'%s' is not a number", value.get())));
            return Optional.empty();
        }
    }

    private static Optional<String> runId(Map<String, String> parameters, Optional<Path> inputVcf, List<ParameterViolation> violations) {
        var explicit = valueOf(parameters, RUN_ID);
        if (explicit.isPresent()) {
            if (!RUN_ID_PATTERN.matcher(explicit.get()).matches()) {
                violations.add(ParameterViolation.of(RUN_ID, String.format("'%s' may only contain letters, digits, '.', '_' and '-'",
                        explicit.get())));
                return Optional.empty();
            }
            return explicit;
        }
        return inputVcf.map(ParameterValidator::runIdFromVcf);
    }

    static String runIdFromVcf(Path vcf) {
        var name = vcf.getFileName().toString();
        var stripped = StringUtils.removeEnd(StringUtils.removeEnd(name, ".gz"), ".vcf");
        var sanitized = stripped.replaceAll("[^A-Za-z0-9._-]", "_");
        return sanitized.isEmpty() ? "run" : sanitized;
    }

    private static Optional<String> valueOf(Map<String, String> parameters, String name) {
        return Optional.ofNullable(parameters.get(name)).filter(StringUtils::isNotBlank).map(String::trim);
    }
}
