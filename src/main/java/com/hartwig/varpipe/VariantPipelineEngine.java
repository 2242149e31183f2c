package com.hartwig.varpipe;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import com.hartwig.varpipe.config.ParameterValidator;
import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.config.ToolsDefinition;
import com.hartwig.varpipe.pipeline.AnnotationPipeline;
import com.hartwig.varpipe.pipeline.PipelineTools;
import com.hartwig.varpipe.reference.ReferenceBuilder;
import com.hartwig.varpipe.reference.ReferenceCache;
import com.hartwig.varpipe.reference.ToolReferenceBuilder;
import com.hartwig.varpipe.scatter.ScatterGatherController;
import com.hartwig.varpipe.storage.ArtifactStore;
import com.hartwig.varpipe.storage.LocalArtifactStore;
import com.hartwig.varpipe.tool.ExternalToolAdapter;
import com.hartwig.varpipe.workflow.LocalStageScheduler;
import com.hartwig.varpipe.workflow.RunReport;
import com.hartwig.varpipe.workflow.StageGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates run parameters, runs the annotation pipeline against a local artifact store and publishes the results.
 */
public class VariantPipelineEngine implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(VariantPipelineEngine.class);
    private static final int MAX_CONCURRENT_RUNS = 8;

    private final PipelineTools tools;
    private final ReferenceBuilder referenceBuilder;
    private final ParameterValidator parameterValidator = new ParameterValidator();
    private final ExecutorService executorService;
    private final ConcurrentMap<Path, ReferenceCache> referenceCachesByStore = new ConcurrentHashMap<>();

    public VariantPipelineEngine(final ToolsDefinition tools) {
        this(tools, new ExternalToolAdapter());
    }

    private VariantPipelineEngine(final ToolsDefinition tools, final ExternalToolAdapter toolAdapter) {
        this(tools, toolAdapter, new ToolReferenceBuilder(tools, toolAdapter));
    }

    public VariantPipelineEngine(final ToolsDefinition tools, final ExternalToolAdapter toolAdapter, final ReferenceBuilder referenceBuilder) {
        this(tools, toolAdapter, referenceBuilder, MAX_CONCURRENT_RUNS);
    }

    /**
     * At most maxConcurrentRuns runs execute at the same time, further calls to {@link #run} wait for a free slot.
     */
    VariantPipelineEngine(final ToolsDefinition tools, final ExternalToolAdapter toolAdapter, final ReferenceBuilder referenceBuilder,
            final int maxConcurrentRuns) {
        this.tools = new PipelineTools(tools, toolAdapter);
        this.referenceBuilder = referenceBuilder;
        this.executorService = ExecutorUtil.createQueueingExecutorService(maxConcurrentRuns, "pipeline-run-thread-%d");
    }

    /**
     * Runs the pipeline to completion. Completed artifacts are published even if the run failed.
     *
     * @throws com.hartwig.varpipe.config.ValidationError before anything runs if the parameters are invalid
     */
    public RunReport run(Map<String, String> rawParameters) throws IOException, InterruptedException {
        var parameters = parameterValidator.validate(rawParameters);
        var runId = parameters.runId();
        LOGGER.info("[{}] Starting run on {} with reference {}", runId, parameters.inputVcf(), parameters.referenceVersion());

        var store = new LocalArtifactStore(parameters.storeDirectory());
        var referenceCache = referenceCachesByStore.computeIfAbsent(store.getRoot(), root -> new ReferenceCache(store, referenceBuilder));
        var stagePool = ExecutorUtil.createQueueingExecutorService(parameters.threads(), runId + "-stage-%d");
        var shardPool = ExecutorUtil.createQueueingExecutorService(parameters.threads(), runId + "-shard-%d");
        try {
            var graph = new StageGraph(executorService);
            AnnotationPipeline.register(graph, parameters, tools, referenceCache, new ScatterGatherController(shardPool));

            var run = graph.getOrCreateRun(runId, new LocalStageScheduler(store, parameters, stagePool), store);
            run.subscribe(states -> LOGGER.debug("[{}] Stage graph updated: {}", runId, run.toDotFormat()));
            var report = run.findOrStart().get();
            graph.delete(runId);

            publish(report, store, parameters);
            if (report.success()) {
                LOGGER.info("[{}] Run succeeded, results in {}", runId, parameters.outputDirectory());
            } else {
                LOGGER.warn("[{}] Run finished with failed stages {}", runId, report.failures().keySet());
            }
            return report;
        } catch (ExecutionException e) {
            throw new PipelineException(String.format("Run '%s' ended unexpectedly", runId), e.getCause());
        } finally {
            stagePool.shutdownNow();
            shardPool.shutdownNow();
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static void publish(RunReport report, ArtifactStore store, PipelineParameters parameters) throws IOException {
        for (var category : AnnotationPipeline.PUBLICATION.entrySet()) {
            var directory = parameters.outputDirectory().resolve(category.getKey());
            for (String artifact : category.getValue()) {
                var ref = report.artifacts().get(artifact);
                if (ref == null) {
                    LOGGER.warn("[{}] Not publishing '{}' since it was not produced", report.runId(), artifact);
                    continue;
                }
                store.publish(ref, directory);
            }
        }
    }
}
