package org.iceforge.pivot.error;

import java.time.Duration;

public class ExecutionTimeoutException extends CubeEngineException {

    public ExecutionTimeoutException(Duration timeout, Throwable cause) {
        super("Query exceeded the " + timeout.toMillis() + " ms execution timeout and was cancelled", cause);
    }

    @Override
    public String getErrorCode() {
        return "EXECUTION_TIMEOUT";
    }
}
