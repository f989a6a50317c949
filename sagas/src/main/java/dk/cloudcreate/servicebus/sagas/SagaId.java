package dk.cloudcreate.servicebus.sagas;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Identifies a single {@link Saga} instance: the id value together with the concrete {@link Saga} type it belongs to.<br>
 * Two {@link SagaId}'s are equal if they are of the same type, have the same id value and belong to the same {@link Saga} type.
 */
public class SagaId {
    // Not final, since identifiers restored from storage are created using Objenesis
    private String                id;
    private Class<? extends Saga> sagaClass;

    public SagaId(CharSequence id, Class<? extends Saga> sagaClass) {
        requireNonNull(id, "No id provided");
        this.sagaClass = requireNonNull(sagaClass, "No sagaClass provided");
        this.id = id.toString();
    }

    /**
     * Create a {@link SagaId} with a random id value
     */
    public static SagaId random(Class<? extends Saga> sagaClass) {
        return new SagaId(UUID.randomUUID().toString(), sagaClass);
    }

    public String id() {
        return id;
    }

    public Class<? extends Saga> sagaClass() {
        return sagaClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var sagaId = (SagaId) o;
        return id.equals(sagaId.id) && sagaClass.equals(sagaId.sagaClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sagaClass);
    }

    @Override
    public String toString() {
        return id;
    }
}
