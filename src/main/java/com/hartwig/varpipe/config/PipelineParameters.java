package com.hartwig.varpipe.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

/**
 * Validated run configuration handed to every stage. Created by {@link ParameterValidator}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface PipelineParameters {
    String INPUT_VCF = "input_vcf";
    String INPUT_HPO = "input_hpo";
    String REFERENCE_DIRECTORY = "reference_directory";
    String REFERENCE_VERSION = "reference_version";
    String RUN_ID = "run_id";
    String OUTPUT_DIRECTORY = "output_directory";
    String STORE_DIRECTORY = "store_directory";
    String CHROMOSOME_MAP = "chromosome_map";
    String THREADS = "threads";

    String runId();

    Path inputVcf();

    Path inputHpo();

    Path referenceDirectory();

    ReferenceVersion referenceVersion();

    Path outputDirectory();

    Path storeDirectory();

    /**
     * Two column table, old contig name then new contig name.
     */
    Optional<Path> chromosomeMap();

    @Value.Default
    default int threads() {
        return 4;
    }

    /**
     * Values available to tool command templates besides the artifact paths.
     */
    default Map<String, String> templateValues() {
        var values = new LinkedHashMap<String, String>();
        values.put(RUN_ID, runId());
        values.put(REFERENCE_DIRECTORY, referenceDirectory().toAbsolutePath().toString());
        values.put(REFERENCE_VERSION, referenceVersion().ucscName());
        values.put("assembly", referenceVersion().assembly());
        values.put(OUTPUT_DIRECTORY, outputDirectory().toAbsolutePath().toString());
        values.put(THREADS, String.valueOf(threads()));
        chromosomeMap().ifPresent(map -> values.put(CHROMOSOME_MAP, map.toAbsolutePath().toString()));
        return values;
    }

    static ImmutablePipelineParameters.Builder builder() {
        return ImmutablePipelineParameters.builder();
    }
}
