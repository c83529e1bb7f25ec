package org.iceforge.pivot.error;

public class LlmException extends CubeEngineException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "LLM_ERROR";
    }
}
