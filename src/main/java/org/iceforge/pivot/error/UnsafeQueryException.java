package org.iceforge.pivot.error;

import org.iceforge.pivot.sql.SafetyRule;

import java.util.Objects;

/**
 * The safety gate rejected a statement. Carries the rule that fired and the offending SQL.
 */
public class UnsafeQueryException extends CubeEngineException {

    private final SafetyRule rule;
    private final String sql;

    public UnsafeQueryException(SafetyRule rule, String detail, String sql) {
        super("Query rejected for safety reasons (" + rule + "): " + detail);
        this.rule = Objects.requireNonNull(rule);
        this.sql = sql;
    }

    public SafetyRule getRule() {
        return rule;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public String getReason() {
        return rule.name();
    }

    @Override
    public String getErrorCode() {
        return "UNSAFE_QUERY";
    }
}
