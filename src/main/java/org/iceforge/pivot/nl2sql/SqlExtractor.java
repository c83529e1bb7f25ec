package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.error.ExtractionException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the statement out of a completion. Mutating statements are extracted like any other;
 * rejecting them is the validator's job.
 */
@Component
public class SqlExtractor implements Nl2SqlStage {

    private static final Pattern STATEMENT_START = Pattern.compile(
            "\\b(SELECT|WITH|INSERT|UPDATE|DELETE|MERGE|DROP|ALTER|CREATE|TRUNCATE|GRANT|REVOKE)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        return Mono.fromCallable(() -> {
            context.setGeneratedSql(extract(context.getCompletion()));
            return context;
        });
    }

    public String extract(String completion) {
        if (completion == null || completion.isBlank()) {
            throw new ExtractionException("Completion was empty");
        }
        String candidate = CodeFences.firstBlock(completion, "sql");
        if (candidate == null) {
            candidate = fromStatementStart(CodeFences.strip(completion));
        }
        String sql = stripTerminators(candidate == null ? "" : candidate);
        if (sql.isEmpty() || !STATEMENT_START.matcher(sql).lookingAt()) {
            throw new ExtractionException("Completion contained no SQL statement");
        }
        return sql;
    }

    private static String fromStatementStart(String text) {
        Matcher m = STATEMENT_START.matcher(text);
        return m.find() ? text.substring(m.start()) : null;
    }

    private static String stripTerminators(String sql) {
        String s = sql.trim();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
