package com.comanda.eventstore.aggregate;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventmodel.EventData;
import com.comanda.eventmodel.EventType;
import com.comanda.eventmodel.order.OrderEvents;
import java.util.UUID;

/** Minimal aggregate used to exercise the repository: sums tips. */
class TipJar extends AggregateRoot<TipJar.State> {

    record State(UUID id, long version, long total) {}

    static final StateEvolver<State> EVOLVER =
            new StateEvolver<>() {
                @Override
                public State initial(UUID aggregateId) {
                    return new State(aggregateId, 0, 0);
                }

                @Override
                public State apply(State state, EventData event) {
                    long amount = event.payloadAs(OrderEvents.TipAdded.class).amount();
                    return new State(state.id(), state.version() + 1, state.total() + amount);
                }
            };

    TipJar(UUID id, State state, long version, MetadataProvider metadata) {
        super(id, EVOLVER, metadata, state, version);
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.ORDER;
    }

    void addTip(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("tip must be positive");
        }
        recordThat(EventType.TIP_ADDED, new OrderEvents.TipAdded(amount, null));
    }
}
