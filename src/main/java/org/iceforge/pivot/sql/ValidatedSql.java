package org.iceforge.pivot.sql;

/**
 * A statement that passed the safety gate. {@code sql} always ends in a top-level row limit
 * no larger than {@code limit}.
 *
 * @param originalLimit the limit the statement carried before validation, or null
 */
public record ValidatedSql(String sql, int limit, Integer originalLimit, boolean limitInjected, boolean limitClamped) {
}
