package org.iceforge.pivot.error;

public class DrillStateNotFoundException extends CubeEngineException {

    public DrillStateNotFoundException(String drillStateId) {
        super("Drill state '" + drillStateId + "' not found");
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
