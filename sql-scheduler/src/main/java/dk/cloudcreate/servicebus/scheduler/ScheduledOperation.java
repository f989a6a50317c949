package dk.cloudcreate.servicebus.scheduler;

import dk.cloudcreate.servicebus.common.messages.Command;

import java.time.*;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link Command} that must be dispatched at a given date
 */
public class ScheduledOperation {
    public final ScheduledOperationId id;
    /**
     * The date (UTC) when the command must be dispatched
     */
    public final OffsetDateTime       date;
    public final Command              command;
    /**
     * Has the operation been announced as the next due operation
     */
    public final boolean              isSent;

    public ScheduledOperation(ScheduledOperationId id,
                              OffsetDateTime date,
                              Command command,
                              boolean isSent) {
        this.id = requireNonNull(id, "No id provided");
        this.date = requireNonNull(date, "No date provided").withOffsetSameInstant(ZoneOffset.UTC);
        this.command = requireNonNull(command, "No command provided");
        this.isSent = isSent;
    }

    /**
     * Create a new operation, which hasn't been sent yet
     */
    public static ScheduledOperation create(ScheduledOperationId id, Command command, OffsetDateTime date) {
        return new ScheduledOperation(id, date, command, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledOperation)) return false;
        ScheduledOperation that = (ScheduledOperation) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledOperation{" +
                "id=" + id +
                ", date=" + date +
                ", command-type=" + command.getClass().getName() +
                ", isSent=" + isSent +
                '}';
    }
}
