package org.iceforge.pivot.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.pivot.nl2sql.Nl2SqlContext;
import org.iceforge.pivot.sql.ValidatedSql;
import org.iceforge.pivot.warehouse.QueryResult;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Nl2SqlResponse(String question,
                             String cubeName,
                             String generatedSql,
                             String sql,
                             boolean limitInjected,
                             boolean limitClamped,
                             List<String> columns,
                             List<Map<String, Object>> rows,
                             Integer rowCount,
                             Long executionTimeMs) {

    static Nl2SqlResponse of(Nl2SqlContext ctx) {
        ValidatedSql v = ctx.getValidated();
        QueryResult r = ctx.getResult();
        return new Nl2SqlResponse(
                ctx.getQuestion(),
                ctx.getCubeName(),
                ctx.getGeneratedSql(),
                v.sql(),
                v.limitInjected(),
                v.limitClamped(),
                r == null ? null : r.columns(),
                r == null ? null : r.rows(),
                r == null ? null : r.rowCount(),
                r == null ? null : r.executionTimeMs());
    }
}
