package com.comanda.orderengine.projection;

import com.comanda.eventmodel.DomainEvent;
import com.comanda.observability.MetricFactory;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects events on the thread that appended them. A failing projector does not fail the
 * append: the failure is logged and counted and the row is marked stale.
 */
public class SynchronousProjectionDispatcher implements ProjectionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SynchronousProjectionDispatcher.class);

    static final String FAILURES = "order_engine.projection.failures";

    private final List<Projector<?>> projectors;
    private final MetricFactory metrics;

    public SynchronousProjectionDispatcher(List<Projector<?>> projectors, MetricFactory metrics) {
        this.projectors = List.copyOf(projectors);
        this.metrics = metrics;
    }

    @Override
    public void onAppended(List<DomainEvent> events) {
        for (DomainEvent event : events) {
            for (Projector<?> projector : projectors) {
                if (projector.handles(event.aggregateType())) {
                    project(projector, event);
                }
            }
        }
    }

    private void project(Projector<?> projector, DomainEvent event) {
        try {
            projector.project(event);
        } catch (RuntimeException e) {
            log.error(
                    "Projection of {} v{} for {} failed; row marked stale",
                    event.eventType().value(),
                    event.version(),
                    event.aggregateId(),
                    e);
            metrics.counter(
                            FAILURES,
                            "Events that failed to project",
                            "aggregate_type",
                            event.aggregateType().value())
                    .increment();
            projector.markStale(event.aggregateId());
        }
    }

    @Override
    public long backlog() {
        return 0;
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        return true;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
