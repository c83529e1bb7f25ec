package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.warehouse.WarehouseExecutor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Component
public class ExecutionStage implements Nl2SqlStage {

    private final WarehouseExecutor executor;
    private final PivotProperties props;

    public ExecutionStage(WarehouseExecutor executor, PivotProperties props) {
        this.executor = Objects.requireNonNull(executor);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Mono<Nl2SqlContext> apply(Nl2SqlContext context) {
        if (context.getValidated() == null) {
            return Mono.error(new IllegalStateException("Refusing to execute a statement that was not validated"));
        }
        return executor.execute(context.getValidated().sql(), props.getQueryTimeout())
                .map(result -> {
                    context.setResult(result);
                    return context;
                });
    }
}
