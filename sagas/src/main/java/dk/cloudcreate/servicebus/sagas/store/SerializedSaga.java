package dk.cloudcreate.servicebus.sagas.store;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The stored representation of a {@link dk.cloudcreate.servicebus.sagas.Saga}
 */
public final class SerializedSaga {
    public final String         id;
    /**
     * Fully Qualified Class Name of the {@link dk.cloudcreate.servicebus.sagas.SagaId}
     */
    public final String         idClass;
    /**
     * Fully Qualified Class Name of the {@link dk.cloudcreate.servicebus.sagas.Saga}
     */
    public final String         sagaClass;
    public final String         payload;
    /**
     * The name of the {@link dk.cloudcreate.servicebus.sagas.SagaStatus}
     */
    public final String         stateId;
    public final OffsetDateTime createdAt;
    /**
     * May be null
     */
    public final OffsetDateTime closedAt;

    public SerializedSaga(String id,
                          String idClass,
                          String sagaClass,
                          String payload,
                          String stateId,
                          OffsetDateTime createdAt,
                          OffsetDateTime closedAt) {
        this.id = requireNonNull(id, "No id provided");
        this.idClass = requireNonNull(idClass, "No idClass provided");
        this.sagaClass = requireNonNull(sagaClass, "No sagaClass provided");
        this.payload = requireNonNull(payload, "No payload provided");
        this.stateId = requireNonNull(stateId, "No stateId provided");
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        this.closedAt = closedAt;
    }

    public Optional<OffsetDateTime> closedAt() {
        return Optional.ofNullable(closedAt);
    }

    @Override
    public String toString() {
        return "SerializedSaga{" +
                "id='" + id + '\'' +
                ", idClass='" + idClass + '\'' +
                ", sagaClass='" + sagaClass + '\'' +
                ", stateId='" + stateId + '\'' +
                ", createdAt=" + createdAt +
                ", closedAt=" + closedAt +
                '}';
    }
}
