package com.hartwig.varpipe.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.hartwig.varpipe.PipelineException;
import com.hartwig.varpipe.scatter.MergeStrategy;
import com.hartwig.varpipe.scatter.PartitionKeyExtractor;
import com.hartwig.varpipe.scatter.ScatterGatherController;
import com.hartwig.varpipe.scatter.ShardSet;
import com.hartwig.varpipe.scatter.VcfFiles;
import com.hartwig.varpipe.workflow.StageContext;
import com.hartwig.varpipe.workflow.StageExecutor;
import com.hartwig.varpipe.workflow.StageResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates and scores variants one chromosome at a time. The input VCF is scattered by chromosome, every shard runs the
 * annotation tool and then the feature scoring tool, and the per-chromosome results are gathered in chromosome order.
 */
public class ChromosomeAnnotationStage implements StageExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChromosomeAnnotationStage.class);
    static final String ANNOTATIONS = "annotations";
    static final String FEATURES = "features";

    private final PipelineTools tools;
    private final ScatterGatherController scatterGather;
    private final String annotateTool;
    private final String scoringTool;
    private final String input;
    private final String featureOutput;
    private final String annotationOutput;

    public ChromosomeAnnotationStage(final PipelineTools tools, final ScatterGatherController scatterGather, final String annotateTool,
            final String scoringTool, final String input, final String featureOutput, final String annotationOutput) {
        tools.requireOutputs(annotateTool, 1);
        tools.requireOutputs(scoringTool, 1);
        this.tools = tools;
        this.scatterGather = scatterGather;
        this.annotateTool = annotateTool;
        this.scoringTool = scoringTool;
        this.input = input;
        this.featureOutput = featureOutput;
        this.annotationOutput = annotationOutput;
    }

    @Override
    public String configuration() {
        return tools.configuration(annotateTool, scoringTool);
    }

    @Override
    public StageResult execute(StageContext context) throws IOException {
        var runId = context.runId();
        var workDirectory = context.workDirectory();
        var shards = scatterGather.scatter(context.input(input), PartitionKeyExtractor.byChromosome(), workDirectory.resolve("scatter"));
        if (shards.size() == 0) {
            throw new PipelineException(String.format("No variants left in %s to annotate", input));
        }

        var stageValues = PipelineTools.values(context);
        var results = scatterGather.map(shards, (chromosome, files) -> {
            var shardDirectory = Files.createDirectories(workDirectory.resolve("shards").resolve(shardDirectoryName(chromosome)));
            var values = new LinkedHashMap<>(stageValues);
            values.put("chromosome", chromosome);
            values.put("shard_vcf", files.get(ScatterGatherController.SHARD_VCF).toAbsolutePath().toString());

            LOGGER.info("[{}] Annotating chromosome [{}]", runId, chromosome);
            var annotations = tools.output(annotateTool, tools.run(annotateTool, values, shardDirectory), 0);
            values.put(ANNOTATIONS, annotations.toAbsolutePath().toString());
            var features = tools.output(scoringTool, tools.run(scoringTool, values, shardDirectory), 0);
            return Map.of(ANNOTATIONS, annotations, FEATURES, features);
        });

        var featureMatrix = gather(results, FEATURES, scoringTool, workDirectory);
        var variantAnnotations = gather(results, ANNOTATIONS, annotateTool, workDirectory);
        return StageResult.builder().putOutputs(featureOutput, featureMatrix).putOutputs(annotationOutput, variantAnnotations).build();
    }

    private Path gather(ShardSet results, String file, String toolName, Path workDirectory)
            throws IOException {
        var fileName = tools.definition(toolName).outputs().get(0);
        var strategy = VcfFiles.isCompressed(Path.of(fileName)) ? MergeStrategy.compressed() : MergeStrategy.headerOnce();
        var target = Files.createDirectories(workDirectory.resolve("gathered")).resolve(fileName);
        return scatterGather.gather(results, file, strategy, target);
    }

    private static String shardDirectoryName(String chromosome) {
        return chromosome.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
