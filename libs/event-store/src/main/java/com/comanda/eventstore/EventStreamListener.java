package com.comanda.eventstore;

import com.comanda.eventmodel.DomainEvent;
import java.util.List;

/**
 * Callback invoked after a batch of events has been committed to one stream. Events arrive in
 * version order within the batch; batches of different writers may interleave.
 */
@FunctionalInterface
public interface EventStreamListener {

    void onAppended(List<DomainEvent> committed);
}
