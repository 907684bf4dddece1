package com.comanda.orderengine.application;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.aggregate.AggregateRepository;
import com.comanda.eventstore.aggregate.MetadataProvider;
import com.comanda.eventstore.snapshot.SnapshotStore;
import com.comanda.orderengine.domain.exception.SessionNotFoundException;
import com.comanda.orderengine.domain.session.OrderSession;
import com.comanda.orderengine.domain.session.SessionEvolver;
import com.comanda.orderengine.domain.session.SessionState;
import java.time.Clock;
import java.util.UUID;

public class SessionRepository extends AggregateRepository<SessionState, OrderSession> {

    public SessionRepository(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            MetadataProvider metadata,
            int snapshotInterval,
            Clock clock) {
        super(
                eventStore,
                snapshotStore,
                AggregateType.ORDER_SESSION,
                SessionState.class,
                SessionEvolver.INSTANCE,
                OrderSession::new,
                metadata,
                snapshotInterval,
                clock);
    }

    public OrderSession require(UUID sessionId) {
        return load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
