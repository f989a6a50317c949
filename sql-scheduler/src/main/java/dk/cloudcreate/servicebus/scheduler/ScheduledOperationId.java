package dk.cloudcreate.servicebus.scheduler;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * The unique identifier of a {@link ScheduledOperation}
 */
public class ScheduledOperationId extends CharSequenceType<ScheduledOperationId> {
    public ScheduledOperationId(CharSequence value) {
        super(value);
    }

    public static ScheduledOperationId random() {
        return new ScheduledOperationId(UUID.randomUUID().toString());
    }

    public static ScheduledOperationId of(CharSequence id) {
        return new ScheduledOperationId(id);
    }
}
