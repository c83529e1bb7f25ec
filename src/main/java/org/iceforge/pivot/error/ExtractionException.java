package org.iceforge.pivot.error;

/**
 * The completion text did not contain a usable SQL statement or schema document.
 */
public class ExtractionException extends CubeEngineException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "EXTRACTION_ERROR";
    }
}
