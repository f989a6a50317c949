package dk.cloudcreate.servicebus.scheduler;

import java.time.*;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The operation that is due next, i.e. the id and date to set the next timer for
 */
public class NextScheduledOperation {
    public final ScheduledOperationId id;
    public final OffsetDateTime       date;

    public NextScheduledOperation(ScheduledOperationId id, OffsetDateTime date) {
        this.id = requireNonNull(id, "No id provided");
        this.date = requireNonNull(date, "No date provided").withOffsetSameInstant(ZoneOffset.UTC);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NextScheduledOperation)) return false;
        NextScheduledOperation that = (NextScheduledOperation) o;
        return id.equals(that.id) && date.isEqual(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, date.toInstant());
    }

    @Override
    public String toString() {
        return "NextScheduledOperation{" +
                "id=" + id +
                ", date=" + date +
                '}';
    }
}
