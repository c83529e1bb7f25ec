package org.iceforge.pivot.error;

import java.util.Objects;

/**
 * A pivot configuration could not be compiled. Always a caller input problem.
 */
public class CompileException extends CubeEngineException {

    public enum Reason {
        UNKNOWN_FIELD,
        EMPTY_FILTER,
        UNSUPPORTED_OPERATOR,
        INVALID_FILTER,
        EMPTY_SELECTION
    }

    private final Reason reason;

    public CompileException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason getCompileReason() {
        return reason;
    }

    @Override
    public String getReason() {
        return reason.name();
    }

    @Override
    public String getErrorCode() {
        return "COMPILE_ERROR";
    }
}
