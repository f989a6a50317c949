package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.servicebus.common.messages.Event;

import java.util.*;
import java.util.function.BiConsumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The mapping from event type to the handler that applies the event to a concrete {@link Saga} type.<br>
 * Each {@link Saga} type builds its mapping once and keeps it in a static field:
 * <pre>{@code
 * public class OrderSaga extends Saga {
 *     private static final SagaEventHandlers<OrderSaga> EVENT_HANDLERS =
 *             SagaEventHandlers.<OrderSaga>builder()
 *                              .on(SagaCreated.class, OrderSaga::onSagaCreated)
 *                              .on(PaymentReceived.class, OrderSaga::onPaymentReceived)
 *                              .build();
 *
 *     @Override
 *     protected SagaEventHandlers<OrderSaga> eventHandlers() {
 *         return EVENT_HANDLERS;
 *     }
 *     ...
 * }
 * }</pre>
 * Handlers are looked up using the exact class of the event. Events without a handler don't change the saga state.
 *
 * @param <S> the saga type
 */
public final class SagaEventHandlers<S extends Saga> {
    private final Map<Class<? extends Event>, BiConsumer<S, Event>> handlers;

    private SagaEventHandlers(Map<Class<? extends Event>, BiConsumer<S, Event>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static <S extends Saga> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * A mapping without any handlers
     */
    public static <S extends Saga> SagaEventHandlers<S> none() {
        return new SagaEventHandlers<>(Map.of());
    }

    /**
     * Apply the event to the saga using the handler registered for the event type
     *
     * @return true if a handler was registered for the event type
     */
    @SuppressWarnings("unchecked")
    boolean apply(Saga saga, Event event) {
        var handler = handlers.get(event.getClass());
        if (handler == null) {
            return false;
        }
        handler.accept((S) saga, event);
        return true;
    }

    public boolean hasHandlerFor(Class<? extends Event> eventType) {
        return handlers.containsKey(eventType);
    }

    public static final class Builder<S extends Saga> {
        private final Map<Class<? extends Event>, BiConsumer<S, Event>> handlers = new HashMap<>();

        private Builder() {
        }

        /**
         * Register the handler for the event type
         *
         * @param eventType the exact event type
         * @param handler   the handler, typically a method reference to a private method in the saga
         * @param <E>       the event type
         * @return this builder
         */
        public <E extends Event> Builder<S> on(Class<E> eventType, BiConsumer<S, E> handler) {
            requireNonNull(eventType, "No eventType provided");
            requireNonNull(handler, "No handler provided");
            if (handlers.containsKey(eventType)) {
                throw new IllegalArgumentException(msg("A handler for '{}' has already been registered", eventType.getName()));
            }
            handlers.put(eventType, (saga, event) -> handler.accept(saga, eventType.cast(event)));
            return this;
        }

        public SagaEventHandlers<S> build() {
            return new SagaEventHandlers<>(handlers);
        }
    }
}
