package com.comanda.orderengine.application;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.aggregate.AggregateRepository;
import com.comanda.eventstore.aggregate.MetadataProvider;
import com.comanda.eventstore.snapshot.SnapshotStore;
import com.comanda.orderengine.domain.exception.OrderNotFoundException;
import com.comanda.orderengine.domain.order.OrderAggregate;
import com.comanda.orderengine.domain.order.OrderEvolver;
import com.comanda.orderengine.domain.order.OrderState;
import java.time.Clock;
import java.util.UUID;

public class OrderRepository extends AggregateRepository<OrderState, OrderAggregate> {

    public OrderRepository(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            MetadataProvider metadata,
            int snapshotInterval,
            Clock clock) {
        super(
                eventStore,
                snapshotStore,
                AggregateType.ORDER,
                OrderState.class,
                OrderEvolver.INSTANCE,
                OrderAggregate::new,
                metadata,
                snapshotInterval,
                clock);
    }

    /** Loads the order or throws {@link OrderNotFoundException}. */
    public OrderAggregate require(UUID orderId) {
        return load(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
