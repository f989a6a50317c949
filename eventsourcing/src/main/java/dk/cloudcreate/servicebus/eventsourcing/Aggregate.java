package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import dk.cloudcreate.essentials.shared.types.GenericType;
import dk.cloudcreate.servicebus.common.messages.Event;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for event sourced aggregates. The state of an {@link Aggregate} is derived solely from its events:
 * new events are raised using {@link #raise(Event)} and applied to the aggregate state through (private) methods
 * annotated with {@link EventHandler}, the same methods are called when the persisted events are rehydrated.
 * <p>
 * Every event raised gets the next playhead, i.e. {@link #version()} grows by exactly one per applied event, starting from
 * {@link #START_PLAYHEAD_INDEX}. The constructor raises {@link AggregateCreated}, which is what makes
 * the {@link EventSourcingProvider} create (instead of append to) the event stream.
 * <p>
 * <b>Please note:</b> Aggregates loaded from their event stream are created using Objenesis, which doesn't initialize fields
 * nor call any constructor. Initialize the state in an {@link EventHandler} for {@link AggregateCreated} instead of
 * using field initializers:
 * <pre>{@code
 * public class Order extends Aggregate<OrderId> {
 *     private Map<String, Integer> productQuantities;
 *
 *     public Order(OrderId orderId, String customerId) {
 *         super(orderId);
 *         raise(new OrderPlaced(orderId.value(), customerId));
 *     }
 *
 *     @EventHandler
 *     private void on(AggregateCreated e) {
 *         productQuantities = new HashMap<>();
 *     }
 * }
 * }</pre>
 *
 * @param <ID> the aggregate id type
 */
public abstract class Aggregate<ID extends AggregateId> {
    public static final long START_PLAYHEAD_INDEX = 0L;

    private           ID                                  id;
    private           long                                version;
    private transient PatternMatchingMethodInvoker<Event> invoker;
    private transient List<AggregateEvent>                uncommittedEvents;

    protected Aggregate(ID id) {
        requireNonNull(id, "No aggregate id provided");
        if (!id.aggregateClass().equals(getClass())) {
            throw new InvalidAggregateIdentifierException(msg("The aggregate class in the identifier ('{}') differs from the aggregate it was given to ('{}')",
                                                              id.aggregateClass().getName(),
                                                              getClass().getName()));
        }
        this.id = id;
        this.version = START_PLAYHEAD_INDEX;
        raise(new AggregateCreated(id, getClass(), OffsetDateTime.now(ZoneOffset.UTC)));
    }

    /**
     * Initialize the {@link PatternMatchingMethodInvoker} that routes events to the {@link EventHandler} methods
     */
    private void initialize() {
        invoker = new PatternMatchingMethodInvoker<>(this,
                                                     new SingleArgumentAnnotatedMethodPatternMatcher<>(EventHandler.class,
                                                                                                       new GenericType<>() {
                                                                                                       }),
                                                     InvocationStrategy.InvokeMostSpecificTypeMatched);
    }

    public ID id() {
        return id;
    }

    /**
     * The playhead of the last event applied to this aggregate
     */
    public long version() {
        return version;
    }

    /**
     * Raise a new event: it's assigned the next playhead, applied to the aggregate state and buffered until the aggregate is saved
     *
     * @param event the event to raise
     */
    protected final void raise(Event event) {
        requireNonNull(event, "You must supply an event");
        var aggregateEvent = AggregateEvent.create(event, version + 1);
        applyEventToTheAggregate(event);
        version = aggregateEvent.playhead();
        _uncommittedEvents().add(aggregateEvent);
    }

    /**
     * Apply the persisted events onto this aggregate, advancing the {@link #version()} per event.<br>
     * This is the construction path used when an aggregate is loaded (onto a blank instance or onto the aggregate of a snapshot),
     * so none of the normal constructor checks are performed.
     *
     * @param persistedEvents the persisted events, whose playheads must continue from {@link #version()}
     * @throws AggregateStreamOutOfOrderException if an event doesn't have playhead {@link #version()} + 1
     */
    @SuppressWarnings("unchecked")
    public final void rehydrate(AggregateEventStream persistedEvents) {
        requireNonNull(persistedEvents, "You must provide a persistedEvents stream");
        if (id == null) {
            // Instance was created by Objenesis
            id = (ID) persistedEvents.aggregateId();
        } else if (!id.equals(persistedEvents.aggregateId())) {
            throw new InvalidAggregateIdentifierException(msg("Cannot rehydrate events for aggregate '{}' onto aggregate '{}'",
                                                              persistedEvents.aggregateId(),
                                                              id));
        }
        for (var aggregateEvent : persistedEvents.events()) {
            var expectedPlayhead = version + 1;
            if (aggregateEvent.playhead() != expectedPlayhead) {
                throw new AggregateStreamOutOfOrderException(msg("Expected event with playhead {} for aggregate '{}' with id '{}', but got playhead {}",
                                                                 expectedPlayhead,
                                                                 getClass().getName(),
                                                                 id,
                                                                 aggregateEvent.playhead()));
            }
            applyEventToTheAggregate(aggregateEvent.event());
            version = aggregateEvent.playhead();
        }
    }

    /**
     * The events raised since this aggregate was created or loaded, which haven't been saved yet
     */
    public AggregateEventStream makeStream() {
        return new AggregateEventStream(id, aggregateClass(), _uncommittedEvents());
    }

    public List<AggregateEvent> uncommittedEvents() {
        return Collections.unmodifiableList(_uncommittedEvents());
    }

    /**
     * Resets the {@link #uncommittedEvents()}, marking them as persisted
     */
    public void markChangesAsCommitted() {
        uncommittedEvents = new ArrayList<>();
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate<br>
     * The default implementation will automatically call any (private) methods annotated with
     * {@link EventHandler}. Events without a matching {@link EventHandler} are ignored.
     *
     * @param event the event to apply to the aggregate
     */
    protected void applyEventToTheAggregate(Event event) {
        if (invoker == null) {
            // Instance was created by Objenesis or deserialized
            initialize();
        }
        invoker.invoke(event, unmatchedEvent -> {
            // Ignore unmatched events as Aggregates don't necessarily need handle every event
        });
    }

    @SuppressWarnings("unchecked")
    private Class<? extends Aggregate<?>> aggregateClass() {
        return (Class<? extends Aggregate<?>>) (Class<?>) getClass();
    }

    private List<AggregateEvent> _uncommittedEvents() {
        if (uncommittedEvents == null) {
            uncommittedEvents = new ArrayList<>();
        }
        return uncommittedEvents;
    }
}
