package com.hartwig.varpipe.workflow;

import java.io.IOException;

/**
 * The work of one stage. Implementations write their outputs into the context work directory and return them; the scheduler moves
 * them into the artifact store only after this method returns normally.
 */
@FunctionalInterface
public interface StageExecutor {
    StageResult execute(StageContext context) throws IOException;

    /**
     * Everything besides the stage inputs that determines the outputs, such as the tool definitions it runs. Stored outputs are
     * reused only while this is unchanged.
     */
    default String configuration() {
        return "";
    }
}
