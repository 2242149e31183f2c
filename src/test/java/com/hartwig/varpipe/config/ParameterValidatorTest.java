package com.hartwig.varpipe.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParameterValidatorTest {
    @TempDir
    Path temporaryDirectory;

    private final ParameterValidator validator = new ParameterValidator();
    private Map<String, String> parameters;

    @BeforeEach
    void setUp() throws IOException {
        var vcf = Files.writeString(temporaryDirectory.resolve("patient-1.vcf.gz"), "");
        var hpo = Files.writeString(temporaryDirectory.resolve("patient-1.hpo"), "HP:0001250\n");
        var referenceDirectory = Files.createDirectories(temporaryDirectory.resolve("reference"));
        parameters = new HashMap<>();
        parameters.put(PipelineParameters.INPUT_VCF, vcf.toString());
        parameters.put(PipelineParameters.INPUT_HPO, hpo.toString());
        parameters.put(PipelineParameters.REFERENCE_DIRECTORY, referenceDirectory.toString());
        parameters.put(PipelineParameters.REFERENCE_VERSION, "hg38");
    }

    @Test
    void validParametersAreAccepted() {
        var validated = validator.validate(parameters);

        assertThat(validated.inputVcf()).hasFileName("patient-1.vcf.gz");
        assertThat(validated.referenceVersion()).isEqualTo(ReferenceVersion.HG38);
        assertThat(validated.runId()).isEqualTo("patient-1");
        assertThat(validated.outputDirectory()).isEqualTo(Path.of("out"));
        assertThat(validated.storeDirectory()).isEqualTo(Path.of("out", ".store"));
        assertThat(validated.threads()).isEqualTo(4);
        assertThat(validated.chromosomeMap()).isEmpty();
    }

    @Test
    void optionalParametersOverrideDefaults() throws IOException {
        var map = Files.writeString(temporaryDirectory.resolve("rename.tsv"), "chr1\t1\n");
        parameters.put(PipelineParameters.RUN_ID, "rerun_2");
        parameters.put(PipelineParameters.OUTPUT_DIRECTORY, temporaryDirectory.resolve("results").toString());
        parameters.put(PipelineParameters.CHROMOSOME_MAP, map.toString());
        parameters.put(PipelineParameters.THREADS, "12");

        var validated = validator.validate(parameters);

        assertThat(validated.runId()).isEqualTo("rerun_2");
        assertThat(validated.storeDirectory()).isEqualTo(temporaryDirectory.resolve("results").resolve(".store"));
        assertThat(validated.chromosomeMap()).contains(map);
        assertThat(validated.threads()).isEqualTo(12);
        assertThat(validated.templateValues()).containsEntry("run_id", "rerun_2")
                .containsEntry("reference_version", "hg38")
                .containsEntry("assembly", "GRCh38")
                .containsEntry("threads", "12")
                .containsKey("chromosome_map");
    }

    @Test
    void missingVcfIsRejected() {
        parameters.remove(PipelineParameters.INPUT_VCF);
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getParameter()).isEqualTo("input_vcf");
        assertThat(e.getMessage()).isEqualTo("Invalid parameter 'input_vcf': is required");
    }

    @Test
    void vcfWithWrongExtensionIsRejected() throws IOException {
        parameters.put(PipelineParameters.INPUT_VCF, Files.writeString(temporaryDirectory.resolve("patient-1.bam"), "").toString());
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getParameter()).isEqualTo("input_vcf");
        assertThat(e.getMessage()).contains("must end with one of [.vcf, .vcf.gz]");
    }

    @Test
    void nonExistingHpoIsRejected() {
        parameters.put(PipelineParameters.INPUT_HPO, temporaryDirectory.resolve("absent.txt").toString());
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getParameter()).isEqualTo("input_hpo");
        assertThat(e.getMessage()).contains("does not exist");
    }

    @Test
    void referenceDirectoryThatIsAFileIsRejected() throws IOException {
        parameters.put(PipelineParameters.REFERENCE_DIRECTORY, Files.writeString(temporaryDirectory.resolve("ref.txt"), "").toString());
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getParameter()).isEqualTo("reference_directory");
        assertThat(e.getMessage()).contains("is a file, not a directory");
    }

    @Test
    void unknownReferenceVersionIsRejected() {
        parameters.put(PipelineParameters.REFERENCE_VERSION, "hg37");
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getParameter()).isEqualTo("reference_version");
        assertThat(e.getMessage()).isEqualTo("Invalid parameter 'reference_version': 'hg37' is not one of [hg19, hg38]");
    }

    @Test
    void blankValueCountsAsMissing() {
        parameters.put(PipelineParameters.REFERENCE_VERSION, "  ");
        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));
        assertThat(e.getMessage()).isEqualTo("Invalid parameter 'reference_version': is required");
    }

    @Test
    void allViolationsAreReported() {
        parameters.remove(PipelineParameters.INPUT_HPO);
        parameters.put(PipelineParameters.THREADS, "zero");
        parameters.put(PipelineParameters.RUN_ID, "bad/run");

        var e = assertThrows(ValidationError.class, () -> validator.validate(parameters));

        assertThat(e.getViolations()).extracting(ParameterViolation::parameter).containsExactly("input_hpo", "threads", "run_id");
        assertThat(e.getParameter()).isEqualTo("input_hpo");
    }

    @Test
    void runIdIsDerivedFromTheVcfName() {
        assertThat(ParameterValidator.runIdFromVcf(Path.of("/data/NA12878 exome.vcf.gz"))).isEqualTo("NA12878_exome");
        assertThat(ParameterValidator.runIdFromVcf(Path.of("sample.vcf"))).isEqualTo("sample");
        assertThat(ParameterValidator.runIdFromVcf(Path.of(".vcf"))).isEqualTo("run");
    }
}
