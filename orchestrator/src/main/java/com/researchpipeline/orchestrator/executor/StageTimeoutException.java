package com.researchpipeline.orchestrator.executor;

import java.time.Duration;

/** An attempt that did not return within its stage's timeout. */
class StageTimeoutException extends RuntimeException {

    StageTimeoutException(String stage, Duration timeout) {
        super("Stage '" + stage + "' timed out after " + timeout);
    }
}
