package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.config.PivotProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Component
public class PromptAssembler implements Nl2SqlStage {

    private final PivotProperties props;

    public PromptAssembler(PivotProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        return Mono.fromCallable(() -> {
            context.setPrompt(assemble(context.getSchemaSummary(), context.getQuestion()));
            return context;
        });
    }

    String assemble(String schemaSummary, String question) {
        String dialect = props.getSqlDialect();
        return "You are an expert SQL analyst. Write a single " + dialect
                + " SELECT query that answers the question using the schema below.\n"
                + "\n"
                + "RULES:\n"
                + "1. Only SELECT queries. Never modify data or schema.\n"
                + "2. Use only the tables and columns listed in the schema.\n"
                + "3. Always end the query with LIMIT " + props.getResultLimit() + ".\n"
                + "4. Join dimension tables with the keys listed under Joins.\n"
                + "5. With aggregates, GROUP BY every non-aggregated column.\n"
                + "6. Do not use comments or :: casts; use CAST(x AS type).\n"
                + "7. Return only the SQL, no explanation.\n"
                + "\n"
                + "SCHEMA:\n"
                + schemaSummary + "\n"
                + "\n"
                + "Question: " + question + "\n"
                + "\n"
                + "SQL:";
    }
}
