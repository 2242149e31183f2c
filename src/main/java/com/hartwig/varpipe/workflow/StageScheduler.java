package com.hartwig.varpipe.workflow;

import java.util.concurrent.CompletableFuture;

public interface StageScheduler {
    CompletableFuture<StageOutcome> schedule(StageExecution stageExecution);
}
