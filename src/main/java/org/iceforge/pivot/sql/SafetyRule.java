package org.iceforge.pivot.sql;

/**
 * Rules enforced by {@link SqlSafetyValidator}. The rule that fired is reported to the user.
 */
public enum SafetyRule {
    EMPTY_STATEMENT,
    MUTATING_KEYWORD,
    COMMENT,
    MULTIPLE_STATEMENTS,
    UNPARSEABLE,
    NOT_A_QUERY,
    UNKNOWN_TABLE,
    UNKNOWN_COLUMN,
    UNKNOWN_FUNCTION
}
