package org.iceforge.pivot.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String reason;
    private final String detail;
    private final String sql;

    public ErrorResponse(String error, String detail) {
        this(error, null, detail, null);
    }

    public ErrorResponse(String error, String reason, String detail, String sql) {
        this.error = error;
        this.reason = reason;
        this.detail = detail;
        this.sql = sql;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    /**
     * Finer cause within {@link #getError()}: the compile reason or the violated safety rule.
     */
    public String getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * The rejected statement, for safety-gate failures only.
     */
    public String getSql() {
        return sql;
    }
}
