package dk.cloudcreate.servicebus.sagas.contract;

import dk.cloudcreate.servicebus.common.messages.Event;
import dk.cloudcreate.servicebus.sagas.*;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Raised when a {@link Saga} is closed, i.e. changes to {@link SagaStatus#COMPLETED} or {@link SagaStatus#FAILED}
 */
public final class SagaStatusChanged implements Event {
    public final String         id;
    public final String         idClass;
    public final String         sagaClass;
    public final SagaStatus     previousStatus;
    public final SagaStatus     newStatus;
    /**
     * May be null
     */
    public final String         withReason;
    public final OffsetDateTime datetime;

    public SagaStatusChanged(SagaId sagaId,
                             SagaStatus previousStatus,
                             SagaStatus newStatus,
                             String withReason,
                             OffsetDateTime datetime) {
        requireNonNull(sagaId, "No sagaId provided");
        this.id = sagaId.id();
        this.idClass = sagaId.getClass().getName();
        this.sagaClass = sagaId.sagaClass().getName();
        this.previousStatus = requireNonNull(previousStatus, "No previousStatus provided");
        this.newStatus = requireNonNull(newStatus, "No newStatus provided");
        this.withReason = withReason;
        this.datetime = requireNonNull(datetime, "No datetime provided");
    }

    public Optional<String> withReason() {
        return Optional.ofNullable(withReason);
    }

    @Override
    public String toString() {
        return "SagaStatusChanged{" +
                "id='" + id + '\'' +
                ", sagaClass='" + sagaClass + '\'' +
                ", previousStatus=" + previousStatus +
                ", newStatus=" + newStatus +
                ", withReason='" + withReason + '\'' +
                ", datetime=" + datetime +
                '}';
    }
}
