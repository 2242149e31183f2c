package com.hartwig.varpipe.workflow;

import java.util.Map;
import java.util.Optional;

import com.hartwig.varpipe.storage.ArtifactRef;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StageOutcome {
    boolean success();

    Map<String, ArtifactRef> artifacts();

    Optional<String> failure();

    Optional<String> fallback();

    static StageOutcome succeeded(Map<String, ArtifactRef> artifacts, Optional<String> fallback) {
        return ImmutableStageOutcome.builder().success(true).artifacts(artifacts).fallback(fallback).build();
    }

    static StageOutcome failed(String reason) {
        return ImmutableStageOutcome.builder().success(false).failure(reason).build();
    }
}
