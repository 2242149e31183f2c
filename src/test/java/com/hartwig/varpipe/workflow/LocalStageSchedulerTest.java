package com.hartwig.varpipe.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.hartwig.varpipe.config.PipelineParameters;
import com.hartwig.varpipe.config.ReferenceVersion;
import com.hartwig.varpipe.storage.ArtifactId;
import com.hartwig.varpipe.storage.LocalArtifactStore;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(5)
class LocalStageSchedulerTest {
    @TempDir
    Path temporaryDirectory;

    private ExecutorService executor;
    private LocalArtifactStore store;
    private LocalStageScheduler scheduler;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newSingleThreadExecutor();
        store = new LocalArtifactStore(temporaryDirectory.resolve("store"));
        var parameters = PipelineParameters.builder()
                .runId("run-1")
                .inputVcf(temporaryDirectory.resolve("sample.vcf"))
                .inputHpo(temporaryDirectory.resolve("sample.hpo"))
                .referenceDirectory(temporaryDirectory)
                .referenceVersion(ReferenceVersion.HG38)
                .outputDirectory(temporaryDirectory.resolve("out"))
                .storeDirectory(temporaryDirectory.resolve("store"))
                .build();
        scheduler = new LocalStageScheduler(store, parameters, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void outputsAreStoredAndWorkDirectoryRemoved() throws Exception {
        var workDirectories = new Path[1];
        StageExecutor stageExecutor = context -> {
            workDirectories[0] = context.workDirectory();
            assertThat(context.parameters().runId()).isEqualTo("run-1");
            return StageResult.of("result", Files.writeString(context.workDirectory().resolve("result.tsv"), "a\tb"));
        };

        var outcome = scheduler.schedule(execution(stageExecutor, List.of("result"))).get();

        assertThat(outcome.success()).isTrue();
        var stored = outcome.artifacts().get("result");
        assertThat(stored.path()).hasFileName("result.tsv").hasContent("a\tb");
        assertThat(store.find("run-1", ArtifactId.of("stage-a", "result"))).contains(stored);
        assertThat(store.findFingerprint("run-1", "stage-a")).contains("fingerprint-1");
        assertThat(workDirectories[0]).doesNotExist();
    }

    @Test
    void exceptionBecomesFailedOutcomeAndStoresNothing() throws Exception {
        var workDirectories = new Path[1];
        StageExecutor stageExecutor = context -> {
            workDirectories[0] = context.workDirectory();
            Files.writeString(context.workDirectory().resolve("result.tsv"), "partial");
            throw new IOException("disk full");
        };

        var outcome = scheduler.schedule(execution(stageExecutor, List.of("result"))).get();

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failure()).contains("disk full");
        assertThat(store.find("run-1", ArtifactId.of("stage-a", "result"))).isEmpty();
        assertThat(workDirectories[0]).doesNotExist();
    }

    @Test
    void outputThatCannotBeStoredHidesTheOtherOutputs() throws Exception {
        StageExecutor stageExecutor = context -> StageResult.builder()
                .putOutputs("first", Files.writeString(context.workDirectory().resolve("first.tsv"), "a"))
                .putOutputs("second", context.workDirectory().resolve("vanished.tsv"))
                .build();

        var outcome = scheduler.schedule(execution(stageExecutor, List.of("first", "second"))).get();

        assertThat(outcome.success()).isFalse();
        assertThat(store.find("run-1", ArtifactId.of("stage-a", "first"))).isEmpty();
        assertThat(store.findFingerprint("run-1", "stage-a")).isEmpty();
    }

    @Test
    void rerunReplacesOutputsOfEarlierExecution() throws Exception {
        StageExecutor both = context -> StageResult.builder()
                .putOutputs("first", Files.writeString(context.workDirectory().resolve("first.tsv"), "old"))
                .putOutputs("second", Files.writeString(context.workDirectory().resolve("second.tsv"), "old"))
                .build();
        StageExecutor firstOnly =
                context -> StageResult.of("first", Files.writeString(context.workDirectory().resolve("first.tsv"), "new"));
        scheduler.schedule(execution(both, List.of("first", "second"))).get();

        var outcome = scheduler.schedule(execution(firstOnly, List.of("first", "second"))).get();

        assertThat(outcome.artifacts().get("first").path()).hasContent("new");
        assertThat(store.find("run-1", ArtifactId.of("stage-a", "second"))).isEmpty();
    }

    @Test
    void undeclaredOutputFailsTheStage() throws Exception {
        StageExecutor stageExecutor =
                context -> StageResult.of("surprise", Files.writeString(context.workDirectory().resolve("surprise.txt"), "!"));

        var outcome = scheduler.schedule(execution(stageExecutor, List.of("result"))).get();

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failure()).contains("stage produced undeclared outputs [surprise]");
    }

    @Test
    void fallbackIsPassedOn() throws Exception {
        StageExecutor stageExecutor = context -> StageResult.fallbackTo("result",
                Files.writeString(context.workDirectory().resolve("result.vcf"), "#CHROM\n"),
                "nothing passed");

        var outcome = scheduler.schedule(execution(stageExecutor, List.of("result"))).get();

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.fallback()).contains("nothing passed");
    }

    private static StageExecution execution(StageExecutor stageExecutor, List<String> outputs) {
        return StageExecution.builder()
                .stage(Stage.builder().name("stage-a").inputs(List.of()).outputs(outputs).build())
                .runId("run-1")
                .inputs(Map.of())
                .executor(stageExecutor)
                .fingerprint("fingerprint-1")
                .build();
    }
}
