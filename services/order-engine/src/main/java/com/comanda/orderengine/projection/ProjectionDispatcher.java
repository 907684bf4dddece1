package com.comanda.orderengine.projection;

import com.comanda.eventstore.EventStreamListener;
import java.time.Duration;

/** Delivers committed events to the projectors. */
public interface ProjectionDispatcher extends EventStreamListener, AutoCloseable {

    /** Events accepted but not yet projected. */
    long backlog();

    /**
     * Waits until every event accepted so far has been projected.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitIdle(Duration timeout);

    @Override
    void close();
}
