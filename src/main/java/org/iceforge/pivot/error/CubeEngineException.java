package org.iceforge.pivot.error;

/**
 * Root of every failure the engine reports to callers. Each subtype carries a stable
 * error code that the HTTP layer renders verbatim.
 */
public abstract class CubeEngineException extends RuntimeException {

    protected CubeEngineException(String message) {
        super(message);
    }

    protected CubeEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();

    /**
     * Finer-grained reason (compile reason, violated safety rule), or null.
     */
    public String getReason() {
        return null;
    }
}
