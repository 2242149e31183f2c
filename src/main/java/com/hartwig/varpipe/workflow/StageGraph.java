package com.hartwig.varpipe.workflow;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.hartwig.varpipe.storage.ArtifactId;
import com.hartwig.varpipe.storage.ArtifactRef;
import com.hartwig.varpipe.storage.ArtifactStore;

import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DirectedMultigraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.DepthFirstIterator;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directed acyclic graph of stages. Edges are not declared: they follow from the artifact names stages consume and produce.
 */
public class StageGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageGraph.class);

    private final ExecutorService executorService;
    private final Map<String, Stage> stagesByName = new LinkedHashMap<>();
    private final Map<String, StageExecutor> executorsByStageName = new HashMap<>();
    private final Map<String, Stage> producersByArtifact = new HashMap<>();
    private final Map<String, Path> externalInputs = new LinkedHashMap<>();
    private final Map<String, String> settings = new LinkedHashMap<>();
    private final ConcurrentMap<String, StageGraphExecution> runsById = new ConcurrentHashMap<>();

    public StageGraph(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Registers an artifact that comes from outside the graph, such as a user supplied file.
     */
    public synchronized void registerInput(String name, Path path) {
        if (externalInputs.containsKey(name)) {
            throw new StageGraphException(String.format("External input '%s' is already registered", name));
        }
        if (producersByArtifact.containsKey(name)) {
            throw new StageGraphException(String.format("External input '%s' is already produced by stage '%s'",
                    name,
                    producersByArtifact.get(name).name()));
        }
        externalInputs.put(name, path);
    }

    /**
     * Registers a run-wide value that determines the outputs of every stage, such as the reference version. Stored outputs are
     * only reused by runs with the same settings.
     */
    public synchronized void registerSetting(String name, String value) {
        settings.put(name, value);
    }

    public synchronized Stage registerStage(String name, List<String> inputs, List<String> outputs, StageExecutor executor) {
        var stage = Stage.builder().name(name).inputs(inputs).outputs(outputs).build();
        if (stagesByName.containsKey(name)) {
            throw new StageGraphException(String.format("Stage '%s' is already registered", name));
        }
        if (outputs.isEmpty()) {
            throw new StageGraphException(String.format("Stage '%s' declares no outputs", name));
        }
        for (String output : outputs) {
            if (producersByArtifact.containsKey(output)) {
                throw new StageGraphException(String.format("Output '%s' of stage '%s' is already produced by stage '%s'",
                        output,
                        name,
                        producersByArtifact.get(output).name()));
            }
            if (externalInputs.containsKey(output)) {
                throw new StageGraphException(String.format("Output '%s' of stage '%s' is registered as an external input", output, name));
            }
        }
        for (String input : inputs) {
            if (outputs.contains(input)) {
                throw new StageGraphException(String.format("Stage '%s' depends on its own output '%s'", name, input));
            }
        }

        var candidateStages = new ArrayList<>(stagesByName.values());
        candidateStages.add(stage);
        var candidate = createGraph(candidateStages);
        var cycleDetector = new CycleDetector<>(candidate);
        if (cycleDetector.detectCyclesContainingVertex(stage)) {
            var cycle = cycleDetector.findCyclesContainingVertex(stage).stream().map(Stage::name).sorted().collect(Collectors.toList());
            throw new StageGraphException(String.format("Registering stage '%s' would create a dependency cycle through %s", name, cycle));
        }

        stagesByName.put(name, stage);
        executorsByStageName.put(name, executor);
        for (String output : outputs) {
            producersByArtifact.put(output, stage);
        }
        return stage;
    }

    /**
     * Checks that every input has exactly one producer and that the graph is acyclic.
     */
    public synchronized void validate() {
        var missing = new ArrayList<String>();
        for (Stage stage : stagesByName.values()) {
            for (String input : stage.inputs()) {
                if (!producersByArtifact.containsKey(input) && !externalInputs.containsKey(input)) {
                    missing.add(String.format("input '%s' of stage '%s' has no producer", input, stage.name()));
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new StageGraphException("Invalid stage graph: " + String.join(", ", missing));
        }
        if (new CycleDetector<>(createGraph(stagesByName.values())).detectCycles()) {
            throw new StageGraphException("Invalid stage graph: dependency cycle detected");
        }
    }

    public synchronized Collection<Stage> getStages() {
        return List.copyOf(stagesByName.values());
    }

    /**
     * Validates the graph and returns the execution for the run id, creating it if it does not exist yet.
     */
    public StageGraphExecution getOrCreateRun(String runId, StageScheduler stageScheduler, ArtifactStore artifactStore) {
        validate();
        return runsById.computeIfAbsent(runId, id -> new StageGraphExecution(id, stageScheduler, artifactStore));
    }

    /**
     * Forgets the execution once it is done, so a later call to getOrCreateRun starts fresh.
     */
    public void delete(String runId) {
        var run = runsById.get(runId);
        if (run == null) {
            throw new IllegalArgumentException(String.format("Could not find execution with run id '%s' to delete.", runId));
        }
        if (run.doneFuture == null) {
            runsById.remove(runId);
            return;
        }
        run.doneFuture.whenComplete((r, e) -> runsById.remove(runId));
    }

    private synchronized DirectedMultigraph<Stage, NamedEdge> createGraph(Collection<Stage> stages) {
        var g = new DirectedMultigraph<Stage, NamedEdge>(NamedEdge.class);
        var producers = new HashMap<String, Stage>();
        for (final Stage stage : stages) {
            g.addVertex(stage);
            for (String output : stage.outputs()) {
                producers.put(output, stage);
            }
        }
        for (final Stage stage : stages) {
            for (String input : stage.inputs()) {
                var producer = producers.get(input);
                if (producer != null) {
                    g.addEdge(producer, stage, new NamedEdge(input));
                }
            }
        }
        return g;
    }

    public enum StageRunningState {
        WAITING("black"),
        RUNNING("orange"),
        SUCCESS("green"),
        CACHED("blue"),
        FAILED("red"),
        IGNORED("grey");

        final String color;

        StageRunningState(final String color) {
            this.color = color;
        }

        public boolean isComplete() {
            return this == SUCCESS || this == CACHED;
        }
    }

    public class StageGraphExecution {
        private final String runId;
        private final Map<String, StageRunningState> stageNameToRunningState = new HashMap<>();
        private final Map<String, String> failures = new LinkedHashMap<>();
        private final Map<String, String> fallbacks = new LinkedHashMap<>();
        private final Map<String, ArtifactRef> artifacts = new LinkedHashMap<>();
        private final BlockingQueue<Pair<Stage, StageOutcome>> stageDoneQueue = new LinkedBlockingQueue<>();
        private final DirectedMultigraph<Stage, NamedEdge> fullGraph;
        private final DirectedMultigraph<Stage, NamedEdge> runGraph;
        private final Map<String, StageExecutor> executors;
        private final StageScheduler stageScheduler;
        private final ArtifactStore artifactStore;
        private final Map<String, String> fingerprints;
        private CompletableFuture<RunReport> doneFuture;

        // copy on write map, for viewing the stage state from another thread.
        private volatile Map<String, StageRunningState> stageStateView;
        private final List<Consumer<Map<String, StageRunningState>>> stageStateSubscribers =
                Collections.synchronizedList(new ArrayList<>());
        private Future<?> cancellableFuture;

        private StageGraphExecution(final String runId, final StageScheduler stageScheduler, final ArtifactStore artifactStore) {
            this.runId = runId;
            this.stageScheduler = stageScheduler;
            this.artifactStore = artifactStore;
            Map<String, String> graphSettings;
            Map<String, Path> inputs;
            synchronized (StageGraph.this) {
                fullGraph = createGraph(stagesByName.values());
                runGraph = createGraph(stagesByName.values());
                executors = Map.copyOf(executorsByStageName);
                graphSettings = Map.copyOf(settings);
                inputs = new LinkedHashMap<>(externalInputs);
            }
            inputs.forEach((name, path) -> artifacts.put(name, ArtifactRef.external(name, path)));
            fingerprints = fingerprints(inputs, graphSettings);
            for (final Stage stage : fullGraph.vertexSet()) {
                stageNameToRunningState.put(stage.name(), StageRunningState.WAITING);
            }
            stageStateView = Map.copyOf(stageNameToRunningState);
        }

        private Map<String, String> fingerprints(Map<String, Path> inputs, Map<String, String> graphSettings) {
            var artifactFingerprints = new HashMap<String, String>();
            for (var input : inputs.entrySet()) {
                try {
                    artifactFingerprints.put(input.getKey(), StageFingerprints.ofInput(input.getValue()));
                } catch (IOException e) {
                    throw new StageGraphException(String.format("Could not read external input '%s' at %s: %s",
                            input.getKey(),
                            input.getValue(),
                            e.getMessage()));
                }
            }
            var stageFingerprints = new HashMap<String, String>();
            var iterator = new TopologicalOrderIterator<>(fullGraph);
            while (iterator.hasNext()) {
                var stage = iterator.next();
                var fingerprint = StageFingerprints.ofStage(stage,
                        executors.get(stage.name()).configuration(),
                        graphSettings,
                        artifactFingerprints);
                stageFingerprints.put(stage.name(), fingerprint);
                for (String output : stage.outputs()) {
                    artifactFingerprints.put(output, fingerprint);
                }
            }
            return Map.copyOf(stageFingerprints);
        }

        /**
         * Marks every stage whose outputs were stored by an earlier run with the same fingerprint as cached.
         */
        private void skipStoredStages() {
            for (final Stage stage : fullGraph.vertexSet()) {
                var fingerprint = fingerprints.get(stage.name());
                var cached = stage.outputs()
                        .stream()
                        .map(output -> artifactStore.find(runId, ArtifactId.of(stage.name(), output)))
                        .collect(Collectors.toList());
                if (!cached.stream().allMatch(Optional::isPresent)) {
                    continue;
                }
                if (!artifactStore.findFingerprint(runId, stage.name()).map(fingerprint::equals).orElse(false)) {
                    LOGGER.info("[{}] Not reusing stored outputs of stage [{}] since its inputs or configuration changed.", runId, stage.name());
                    continue;
                }
                LOGGER.info("[{}] Skipping stage [{}] since its outputs were stored by a previous run.", runId, stage.name());
                runGraph.removeVertex(stage);
                stageNameToRunningState.put(stage.name(), StageRunningState.CACHED);
                for (int i = 0; i < stage.outputs().size(); i++) {
                    artifacts.put(stage.outputs().get(i), cached.get(i).orElseThrow());
                }
            }
        }

        /**
         * @return the fingerprint stored with the outputs of the stage when it runs
         */
        public String getFingerprint(String stageName) {
            var fingerprint = fingerprints.get(stageName);
            if (fingerprint == null) {
                throw new IllegalArgumentException(String.format("Unknown stage '%s'", stageName));
            }
            return fingerprint;
        }

        public String getRunId() {
            return runId;
        }

        /**
         * Starts the worker thread for this graph execution.
         *
         * @return Future with the report of the run; the report is successful only if every stage completed.
         */
        public synchronized CompletableFuture<RunReport> findOrStart() {
            if (doneFuture != null) {
                return doneFuture;
            }
            /*
             cancelling a CompletableFuture does nothing, so the cancellable "raw" future from the executor service is kept as well.
            */
            doneFuture = new CompletableFuture<>();
            skipStoredStages();
            cancellableFuture = executorService.submit(() -> {
                try {
                    updateStageStateView();
                    while (!runGraph.vertexSet().isEmpty()) {
                        runRound();
                        var done = stageDoneQueue.take();
                        onStageDone(done.getLeft(), done.getRight());
                    }
                } catch (InterruptedException e) {
                    LOGGER.warn("[{}] Run execution interrupted. Not starting any further stages.", runId);
                    ignoreRemaining();
                } catch (RuntimeException e) {
                    LOGGER.error("[{}] Run execution failed unexpectedly", runId, e);
                    ignoreRemaining();
                }
                doneFuture.complete(report());
            });
            return doneFuture;
        }

        public synchronized void cancel() {
            if (cancellableFuture == null) {
                throw new IllegalStateException("Cannot cancel run that was not started yet.");
            }
            cancellableFuture.cancel(true);
        }

        private void runRound() {
            var readyStages = runGraph.vertexSet()
                    .stream()
                    .filter(stage -> runGraph.inDegreeOf(stage) == 0)
                    .filter(stage -> stageNameToRunningState.get(stage.name()) == StageRunningState.WAITING)
                    .collect(Collectors.toList());
            for (Stage stage : readyStages) {
                LOGGER.info("[{}] Starting stage [{}]", runId, stage.name());
                stageNameToRunningState.put(stage.name(), StageRunningState.RUNNING);
                var inputs = new LinkedHashMap<String, ArtifactRef>();
                for (String input : stage.inputs()) {
                    inputs.put(input, artifacts.get(input));
                }
                var execution = StageExecution.builder()
                        .stage(stage)
                        .runId(runId)
                        .inputs(inputs)
                        .executor(executors.get(stage.name()))
                        .fingerprint(fingerprints.get(stage.name()))
                        .build();
                try {
                    stageScheduler.schedule(execution).whenComplete((outcome, error) -> {
                        var result = outcome != null ? outcome : StageOutcome.failed(describe(error));
                        stageDoneQueue.add(Pair.of(stage, result));
                    });
                } catch (RuntimeException e) {
                    stageDoneQueue.add(Pair.of(stage, StageOutcome.failed(describe(e))));
                }
            }
            if (!readyStages.isEmpty()) {
                updateStageStateView();
            }
        }

        private void onStageDone(Stage stage, StageOutcome outcome) {
            var failure = outcome.failure();
            if (outcome.success()) {
                var missing = stage.outputs()
                        .stream()
                        .filter(output -> !outcome.artifacts().containsKey(output))
                        .collect(Collectors.toList());
                if (!missing.isEmpty()) {
                    failure = Optional.of(String.format("stage did not produce declared outputs %s", missing));
                }
            }

            if (failure.isPresent() || !outcome.success()) {
                var reason = failure.orElse("unknown failure");
                var iterator = new DepthFirstIterator<>(runGraph, stage);
                var ignoredStages = new ArrayList<Stage>();
                while (iterator.hasNext()) {
                    ignoredStages.add(iterator.next());
                }
                runGraph.removeAllVertices(ignoredStages);
                for (Stage ignored : ignoredStages) {
                    stageNameToRunningState.put(ignored.name(), StageRunningState.IGNORED);
                }
                stageNameToRunningState.put(stage.name(), StageRunningState.FAILED);
                failures.put(stage.name(), reason);
                LOGGER.error("[{}] Stage [{}] failed: {}", runId, stage.name(), reason);
                if (ignoredStages.size() > 1) {
                    LOGGER.warn("[{}] Not running stages {} since they depend on [{}]",
                            runId,
                            ignoredStages.stream().skip(1).map(Stage::name).collect(Collectors.toList()),
                            stage.name());
                }
            } else {
                runGraph.removeVertex(stage);
                stageNameToRunningState.put(stage.name(), StageRunningState.SUCCESS);
                artifacts.putAll(outcome.artifacts());
                outcome.fallback().ifPresent(reason -> {
                    fallbacks.put(stage.name(), reason);
                    LOGGER.warn("[{}] Stage [{}] used its fallback: {}", runId, stage.name(), reason);
                });
                LOGGER.info("[{}] Finished stage [{}]", runId, stage.name());
            }
            updateStageStateView();
        }

        private void ignoreRemaining() {
            for (var entry : stageNameToRunningState.entrySet()) {
                if (!entry.getValue().isComplete() && entry.getValue() != StageRunningState.FAILED) {
                    entry.setValue(StageRunningState.IGNORED);
                }
            }
            updateStageStateView();
        }

        private RunReport report() {
            var success = stageNameToRunningState.values().stream().allMatch(StageRunningState::isComplete);
            return RunReport.builder()
                    .runId(runId)
                    .success(success)
                    .stageStates(stageNameToRunningState)
                    .failures(failures)
                    .fallbacks(fallbacks)
                    .artifacts(artifacts)
                    .build();
        }

        private void updateStageStateView() {
            stageStateView = Map.copyOf(stageNameToRunningState);
            synchronized (stageStateSubscribers) {
                stageStateSubscribers.forEach(subscriber -> subscriber.accept(stageStateView));
            }
        }

        public Map<String, StageRunningState> getStageStateView() {
            return stageStateView;
        }

        public String toDotFormat() {
            var view = stageStateView;
            var exporter = new DOTExporter<Stage, NamedEdge>();
            exporter.setVertexAttributeProvider((v) -> {
                Map<String, Attribute> map = new LinkedHashMap<>();
                var name = v.name();
                map.put("label", DefaultAttribute.createAttribute(name));
                map.put("color", DefaultAttribute.createAttribute(view.get(name).color));
                return map;
            });
            exporter.setEdgeAttributeProvider((e) -> {
                Map<String, Attribute> map = new LinkedHashMap<>();
                map.put("label", DefaultAttribute.createAttribute(e.name()));
                return map;
            });
            var writer = new StringWriter();
            exporter.exportGraph(fullGraph, writer);
            return writer.toString();
        }

        public void subscribe(Consumer<Map<String, StageRunningState>> subscriber) {
            this.stageStateSubscribers.add(subscriber);
        }
    }

    private static String describe(Throwable throwable) {
        var cause = throwable;
        while (cause.getCause() != null && (cause instanceof CompletionException || cause instanceof ExecutionException)) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
