package com.hartwig.varpipe.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.reference.ReferenceCache;
import com.hartwig.varpipe.scatter.ScatterGatherController;
import com.hartwig.varpipe.workflow.StageGraph;

/**
 * The stages of the variant annotation and scoring pipeline, wired by artifact name.
 */
public final class AnnotationPipeline {
    public static final String BUILD_REFERENCE = "build_reference";
    public static final String NORMALIZE_VCF = "normalize_vcf";
    public static final String CALL_GENOTYPES = "call_genotypes";
    public static final String RESTRICT_CHROMOSOMES = "restrict_chromosomes";
    public static final String ANNOTATE_IDS = "annotate_ids";
    public static final String QUALITY_FILTER = "quality_filter";
    public static final String PHENOTYPE_SIMILARITY = "phenotype_similarity";
    public static final String PHRANK = "phrank";
    public static final String FREQUENCY_EXCLUSION = "frequency_exclusion";
    public static final String ANNOTATE_BY_CHROMOSOME = "annotate_by_chromosome";
    public static final String PREDICT = "predict";

    public static final String INPUT_VCF = PipelineParameters.INPUT_VCF;
    public static final String INPUT_HPO = PipelineParameters.INPUT_HPO;
    public static final String CHROMOSOME_MAP = PipelineParameters.CHROMOSOME_MAP;
    public static final String REFERENCE_BUILD = "reference_build";
    public static final String NORMALIZED_VCF = "normalized_vcf";
    public static final String GENOTYPED_VCF = "genotyped_vcf";
    public static final String RESTRICTED_VCF = "restricted_vcf";
    public static final String ID_ANNOTATED_VCF = "id_annotated_vcf";
    public static final String FILTERED_VCF = "filtered_vcf";
    public static final String HPO_SIMILARITY = "hpo_similarity";
    public static final String PHRANK_SCORES = "phrank_scores";
    public static final String RARE_VCF = "rare_vcf";
    public static final String FEATURE_MATRIX = "feature_matrix";
    public static final String VARIANT_ANNOTATIONS = "variant_annotations";
    public static final String PREDICTION_MATRIX = "prediction_matrix";
    public static final String CONFIDENCE_SCORES = "confidence_scores";

    // tools of the per-chromosome stage, the other tools are named after their stage
    public static final String GENOTYPE_TOOL = "genotype";
    public static final String ANNOTATE_TOOL = "annotate";
    public static final String FEATURE_SCORING_TOOL = "feature_scoring";

    /**
     * Published artifacts by output subdirectory.
     */
    public static final Map<String, List<String>> PUBLICATION = publication();

    private AnnotationPipeline() {
    }

    public static void register(StageGraph graph, PipelineParameters parameters, PipelineTools tools, ReferenceCache referenceCache,
            ScatterGatherController scatterGather) {
        graph.registerInput(INPUT_VCF, parameters.inputVcf().toAbsolutePath());
        graph.registerInput(INPUT_HPO, parameters.inputHpo().toAbsolutePath());
        parameters.chromosomeMap().ifPresent(map -> graph.registerInput(CHROMOSOME_MAP, map.toAbsolutePath()));
        graph.registerSetting(PipelineParameters.REFERENCE_VERSION, parameters.referenceVersion().ucscName());
        graph.registerSetting(PipelineParameters.REFERENCE_DIRECTORY, parameters.referenceDirectory().toAbsolutePath().toString());

        graph.registerStage(BUILD_REFERENCE, List.of(), List.of(REFERENCE_BUILD), new ReferenceStage(referenceCache, REFERENCE_BUILD));
        graph.registerStage(NORMALIZE_VCF,
                List.of(INPUT_VCF, REFERENCE_BUILD),
                List.of(NORMALIZED_VCF),
                new ToolStage(tools, NORMALIZE_VCF, List.of(NORMALIZED_VCF)));
        graph.registerStage(CALL_GENOTYPES,
                List.of(NORMALIZED_VCF, REFERENCE_BUILD),
                List.of(GENOTYPED_VCF),
                new GenotypeCallStage(tools, GENOTYPE_TOOL, NORMALIZED_VCF, GENOTYPED_VCF));
        graph.registerStage(RESTRICT_CHROMOSOMES,
                parameters.chromosomeMap().isPresent() ? List.of(GENOTYPED_VCF, CHROMOSOME_MAP) : List.of(GENOTYPED_VCF),
                List.of(RESTRICTED_VCF),
                new ChromosomeRestrictStage(GENOTYPED_VCF, RESTRICTED_VCF));
        graph.registerStage(ANNOTATE_IDS,
                List.of(RESTRICTED_VCF),
                List.of(ID_ANNOTATED_VCF),
                new ToolStage(tools, ANNOTATE_IDS, List.of(ID_ANNOTATED_VCF)));
        graph.registerStage(QUALITY_FILTER,
                List.of(ID_ANNOTATED_VCF),
                List.of(FILTERED_VCF),
                new QualityFilterStage(tools, QUALITY_FILTER, ID_ANNOTATED_VCF, FILTERED_VCF));
        graph.registerStage(PHENOTYPE_SIMILARITY,
                List.of(INPUT_HPO),
                List.of(HPO_SIMILARITY),
                new ToolStage(tools, PHENOTYPE_SIMILARITY, List.of(HPO_SIMILARITY)));
        graph.registerStage(PHRANK,
                List.of(FILTERED_VCF, INPUT_HPO),
                List.of(PHRANK_SCORES),
                new ToolStage(tools, PHRANK, List.of(PHRANK_SCORES)));
        graph.registerStage(FREQUENCY_EXCLUSION,
                List.of(FILTERED_VCF),
                List.of(RARE_VCF),
                new ToolStage(tools, FREQUENCY_EXCLUSION, List.of(RARE_VCF)));
        graph.registerStage(ANNOTATE_BY_CHROMOSOME,
                List.of(RARE_VCF, REFERENCE_BUILD, PHRANK_SCORES, HPO_SIMILARITY),
                List.of(FEATURE_MATRIX, VARIANT_ANNOTATIONS),
                new ChromosomeAnnotationStage(tools,
                        scatterGather,
                        ANNOTATE_TOOL,
                        FEATURE_SCORING_TOOL,
                        RARE_VCF,
                        FEATURE_MATRIX,
                        VARIANT_ANNOTATIONS));
        graph.registerStage(PREDICT,
                List.of(FEATURE_MATRIX),
                List.of(PREDICTION_MATRIX, CONFIDENCE_SCORES),
                new ToolStage(tools, PREDICT, List.of(PREDICTION_MATRIX, CONFIDENCE_SCORES)));
    }

    private static Map<String, List<String>> publication() {
        var publication = new LinkedHashMap<String, List<String>>();
        publication.put("vcf", List.of(FILTERED_VCF));
        publication.put("scoring", List.of(HPO_SIMILARITY, PHRANK_SCORES, VARIANT_ANNOTATIONS, FEATURE_MATRIX));
        publication.put("prediction", List.of(PREDICTION_MATRIX, CONFIDENCE_SCORES));
        return Collections.unmodifiableMap(publication);
    }
}
