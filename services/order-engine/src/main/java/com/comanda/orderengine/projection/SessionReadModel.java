package com.comanda.orderengine.projection;

import com.comanda.orderengine.domain.session.SessionState;
import com.comanda.orderengine.domain.session.SessionStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class SessionReadModel {

    private final ProjectionStore<SessionState> rows;

    public SessionReadModel(ProjectionStore<SessionState> rows) {
        this.rows = rows;
    }

    public Optional<SessionState> findSession(UUID sessionId) {
        return rows.find(sessionId).filter(ProjectedRow::hasEvents).map(ProjectedRow::state);
    }

    public List<SessionState> findSessionsByStatus(SessionStatus status) {
        return rows.all().stream()
                .filter(ProjectedRow::hasEvents)
                .map(ProjectedRow::state)
                .filter(s -> s.status() == status)
                .toList();
    }
}
