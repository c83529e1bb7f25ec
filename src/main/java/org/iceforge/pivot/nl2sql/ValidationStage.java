package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.sql.SqlSafetyValidator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Runs the generated statement through the safety gate against the cubes chosen for the
 * request. Nothing after this stage sees unvalidated SQL.
 */
@Component
public class ValidationStage implements Nl2SqlStage {

    private final SqlSafetyValidator validator;

    public ValidationStage(SqlSafetyValidator validator) {
        this.validator = Objects.requireNonNull(validator);
    }

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        return Mono.fromCallable(() -> {
            context.setValidated(validator.validate(context.getGeneratedSql(), context.getCubes()));
            return context;
        });
    }
}
