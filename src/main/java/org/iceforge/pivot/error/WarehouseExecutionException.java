package org.iceforge.pivot.error;

/**
 * The warehouse rejected or failed a statement that had already passed validation.
 */
public class WarehouseExecutionException extends CubeEngineException {

    public WarehouseExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "EXECUTION_ERROR";
    }
}
