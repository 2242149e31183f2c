package com.hartwig.varpipe.workflow;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.hartwig.varpipe.storage.ArtifactRef;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface RunReport {
    String runId();

    /**
     * True only if every stage completed, either in this run or in an earlier one.
     */
    boolean success();

    Map<String, StageGraph.StageRunningState> stageStates();

    /**
     * Failure reason by stage name, for stages that failed themselves (not those skipped because of them).
     */
    Map<String, String> failures();

    /**
     * Fallback reason by stage name.
     */
    Map<String, String> fallbacks();

    /**
     * All completed artifacts by artifact name, external inputs included.
     */
    Map<String, ArtifactRef> artifacts();

    /**
     * @return one line naming the first failed stage and its cause, or the stages that never ran
     */
    default Optional<String> failureSummary() {
        if (success()) {
            return Optional.empty();
        }
        var firstFailure = failures().entrySet().stream().findFirst();
        if (firstFailure.isPresent()) {
            return Optional.of(String.format("Stage '%s' failed: %s", firstFailure.get().getKey(), firstFailure.get().getValue()));
        }
        var incomplete = stageStates().entrySet()
                .stream()
                .filter(entry -> !entry.getValue().isComplete())
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
        return Optional.of(String.format("Stages %s did not run", incomplete));
    }

    static ImmutableRunReport.Builder builder() {
        return ImmutableRunReport.builder();
    }
}
