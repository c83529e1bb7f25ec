package org.iceforge.pivot.error;

public class CubeNotFoundException extends CubeEngineException {

    private final String cubeName;

    public CubeNotFoundException(String cubeName) {
        super("Cube '" + cubeName + "' not found");
        this.cubeName = cubeName;
    }

    public String getCubeName() {
        return cubeName;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
