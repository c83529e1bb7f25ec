package org.iceforge.pivot.error;

public class SchemaException extends CubeEngineException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "SCHEMA_ERROR";
    }
}
