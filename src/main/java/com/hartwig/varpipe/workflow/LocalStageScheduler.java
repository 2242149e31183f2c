package com.hartwig.varpipe.workflow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.storage.ArtifactRef;
import com.hartwig.varpipe.storage.ArtifactStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs stage executors on a local worker pool. Outputs only become visible in the store after the executor returned normally;
 * any exception turns into a failed outcome.
 */
public class LocalStageScheduler implements StageScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStageScheduler.class);

    private final ArtifactStore artifactStore;
    private final PipelineParameters parameters;
    private final ExecutorService executor;

    public LocalStageScheduler(final ArtifactStore artifactStore, final PipelineParameters parameters, final ExecutorService executor) {
        this.artifactStore = artifactStore;
        this.parameters = parameters;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<StageOutcome> schedule(StageExecution stageExecution) {
        return CompletableFuture.supplyAsync(() -> run(stageExecution), executor);
    }

    private StageOutcome run(StageExecution stageExecution) {
        var stage = stageExecution.stage();
        var runId = stageExecution.runId();
        Path workDirectory = null;
        try {
            workDirectory = artifactStore.createWorkDirectory(runId, stage.name());
            var context = StageContext.builder()
                    .runId(runId)
                    .stageName(stage.name())
                    .parameters(parameters)
                    .inputs(stageExecution.inputs())
                    .workDirectory(workDirectory)
                    .build();
            var result = stageExecution.executor().execute(context);

            var undeclared = result.outputs()
                    .keySet()
                    .stream()
                    .filter(output -> !stage.outputs().contains(output))
                    .collect(Collectors.toList());
            if (!undeclared.isEmpty()) {
                return StageOutcome.failed(String.format("stage produced undeclared outputs %s", undeclared));
            }

            var artifacts = new LinkedHashMap<String, ArtifactRef>(result.storedOutputs());
            if (!result.outputs().isEmpty()) {
                artifacts.putAll(artifactStore.putStage(runId, stage.name(), result.outputs(), stageExecution.fingerprint()));
            }
            LOGGER.info("[{}] Stage [{}] completed with outputs {}", runId, stage.name(), artifacts.keySet());
            return StageOutcome.succeeded(artifacts, result.fallback());
        } catch (IOException | RuntimeException e) {
            LOGGER.error("[{}] Stage [{}] failed with", runId, stage.name(), e);
            return StageOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            deleteWorkDirectory(runId, workDirectory);
        }
    }

    private static void deleteWorkDirectory(String runId, Path workDirectory) {
        if (workDirectory == null) {
            return;
        }
        try {
            MoreFiles.deleteRecursively(workDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOGGER.warn("[{}] Could not delete work directory {}: {}", runId, workDirectory, e.getMessage());
        }
    }
}
