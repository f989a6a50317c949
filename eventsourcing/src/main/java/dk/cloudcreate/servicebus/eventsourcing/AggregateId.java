package dk.cloudcreate.servicebus.eventsourcing;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Identifies a single {@link Aggregate} instance. Besides the id value, an {@link AggregateId} knows
 * which concrete {@link Aggregate} type it belongs to.<br>
 * Example:
 * <pre>{@code
 * public class OrderId extends AggregateId {
 *     public OrderId(CharSequence value) {
 *         super(value, Order.class);
 *     }
 * }
 * }</pre>
 * Two {@link AggregateId}'s are equal if they are of the same concrete type and have the same value.
 */
public abstract class AggregateId {
    // Not final, since identifiers restored from storage are created using Objenesis
    private String                             value;
    private Class<? extends Aggregate<?>> aggregateClass;

    protected AggregateId(CharSequence value, Class<? extends Aggregate<?>> aggregateClass) {
        requireNonNull(value, "No value provided");
        this.aggregateClass = requireNonNull(aggregateClass, "No aggregateClass provided");
        this.value = value.toString();
    }

    /**
     * Restore an {@link AggregateId} from its stored representation without calling the constructor of the concrete identifier type
     *
     * @param idClass        the concrete {@link AggregateId} type
     * @param value          the id value
     * @param aggregateClass the {@link Aggregate} type the id belongs to
     * @return the restored identifier
     */
    public static AggregateId restore(Class<? extends AggregateId> idClass, String value, Class<? extends Aggregate<?>> aggregateClass) {
        requireNonNull(idClass, "No idClass provided");
        requireNonNull(value, "No value provided");
        requireNonNull(aggregateClass, "No aggregateClass provided");
        var id = AggregateInstanceFactory.objenesisInstanceFactory().create(idClass);
        id.value = value;
        id.aggregateClass = aggregateClass;
        return id;
    }

    /**
     * Variant of {@link #restore(Class, String, Class)} that resolves the types from their Fully Qualified Class Names
     */
    @SuppressWarnings("unchecked")
    public static AggregateId restore(String idClassName, String value, String aggregateClassName) {
        try {
            Class<?> idClass        = Class.forName(idClassName).asSubclass(AggregateId.class);
            Class<?> aggregateClass = Class.forName(aggregateClassName).asSubclass(Aggregate.class);
            return restore((Class<? extends AggregateId>) idClass,
                           value,
                           (Class<? extends Aggregate<?>>) aggregateClass);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new InvalidAggregateIdentifierException(msg("Failed to restore '{}' with value '{}' for aggregate '{}'",
                                                              idClassName,
                                                              value,
                                                              aggregateClassName), e);
        }
    }

    public String value() {
        return value;
    }

    public Class<? extends Aggregate<?>> aggregateClass() {
        return aggregateClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((AggregateId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value;
    }
}
