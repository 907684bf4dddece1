package com.comanda.orderengine.projection;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

/** In-memory rows of one read model. Updates to a row are atomic. */
public class ProjectionStore<S> {

    private final ConcurrentMap<UUID, ProjectedRow<S>> rows = new ConcurrentHashMap<>();

    public Optional<ProjectedRow<S>> find(UUID aggregateId) {
        return Optional.ofNullable(rows.get(aggregateId));
    }

    /** Replaces the row with the result of {@code update}; a null result removes it. */
    public ProjectedRow<S> update(UUID aggregateId, BiFunction<UUID, ProjectedRow<S>, ProjectedRow<S>> update) {
        return rows.compute(aggregateId, update);
    }

    public void put(ProjectedRow<S> row) {
        rows.put(row.aggregateId(), row);
    }

    public void remove(UUID aggregateId) {
        rows.remove(aggregateId);
    }

    public Collection<ProjectedRow<S>> all() {
        return List.copyOf(rows.values());
    }

    public int size() {
        return rows.size();
    }

    public long staleCount() {
        return rows.values().stream().filter(ProjectedRow::stale).count();
    }

    public void clear() {
        rows.clear();
    }
}
