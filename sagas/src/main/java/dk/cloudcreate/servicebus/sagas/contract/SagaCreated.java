package dk.cloudcreate.servicebus.sagas.contract;

import dk.cloudcreate.servicebus.common.messages.Event;
import dk.cloudcreate.servicebus.sagas.SagaId;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The first event raised by every {@link dk.cloudcreate.servicebus.sagas.Saga}
 */
public final class SagaCreated implements Event {
    public final String         id;
    public final String         idClass;
    public final String         sagaClass;
    public final OffsetDateTime datetime;

    public SagaCreated(SagaId sagaId, OffsetDateTime datetime) {
        requireNonNull(sagaId, "No sagaId provided");
        this.id = sagaId.id();
        this.idClass = sagaId.getClass().getName();
        this.sagaClass = sagaId.sagaClass().getName();
        this.datetime = requireNonNull(datetime, "No datetime provided");
    }

    @Override
    public String toString() {
        return "SagaCreated{" +
                "id='" + id + '\'' +
                ", sagaClass='" + sagaClass + '\'' +
                ", datetime=" + datetime +
                '}';
    }
}
