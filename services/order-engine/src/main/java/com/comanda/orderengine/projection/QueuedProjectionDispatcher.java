package com.comanda.orderengine.projection;

import com.comanda.eventmodel.DomainEvent;
import com.comanda.observability.CorrelationContext;
import com.comanda.observability.CorrelationContextHolder;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects events on a single background thread, in the order they were handed over. The writer
 * returns as soon as the events are queued; reads may lag by {@link #backlog()} events.
 */
public class QueuedProjectionDispatcher implements ProjectionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(QueuedProjectionDispatcher.class);

    private final SynchronousProjectionDispatcher delegate;
    private final ExecutorService executor;
    private final AtomicLong backlog = new AtomicLong();

    public QueuedProjectionDispatcher(SynchronousProjectionDispatcher delegate) {
        this.delegate = delegate;
        this.executor =
                Executors.newSingleThreadExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "projection-dispatcher");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @Override
    public void onAppended(List<DomainEvent> events) {
        backlog.addAndGet(events.size());
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        executor.execute(
                () -> {
                    try {
                        if (context != null) {
                            CorrelationContextHolder.runWithContext(context, () -> delegate.onAppended(events));
                        } else {
                            delegate.onAppended(events);
                        }
                    } finally {
                        backlog.addAndGet(-events.size());
                    }
                });
    }

    @Override
    public long backlog() {
        return backlog.get();
    }

    @Override
    public boolean awaitIdle(Duration timeout) {
        try {
            executor.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("projection queue failed", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Projection queue did not drain within 5s; {} event(s) dropped", backlog.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
