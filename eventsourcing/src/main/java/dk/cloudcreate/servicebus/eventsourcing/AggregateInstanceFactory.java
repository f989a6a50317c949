package dk.cloudcreate.servicebus.eventsourcing;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Factory that helps the {@link EventSourcingProvider} to create a blank instance of a given {@link Aggregate} type, onto
 * which the persisted events are rehydrated.
 *
 * @see #objenesisInstanceFactory()
 * @see ObjenesisAggregateInstanceFactory
 */
public interface AggregateInstanceFactory {
    /**
     * An {@link AggregateInstanceFactory} that uses {@link Objenesis} to create a new instance<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so your {@link Aggregate} design needs to take
     * this into consideration.<br>
     * The {@link Aggregate} base class has been prepared to be initialized by {@link Objenesis}
     */
    AggregateInstanceFactory OBJENESIS_INSTANCE_FACTORY = new ObjenesisAggregateInstanceFactory();

    <T> T create(Class<T> type);

    /**
     * Returns an {@link AggregateInstanceFactory} that uses {@link Objenesis} to create new instances
     *
     * @return #OBJENESIS_INSTANCE_FACTORY
     */
    static AggregateInstanceFactory objenesisInstanceFactory() {
        return OBJENESIS_INSTANCE_FACTORY;
    }

    /**
     * {@link AggregateInstanceFactory} that uses {@link Objenesis} to create new instances without calling any constructor
     */
    class ObjenesisAggregateInstanceFactory implements AggregateInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <T> T create(Class<T> type) {
            requireNonNull(type, "You must provide a type");
            return (T) instantiatorMap.computeIfAbsent(type,
                                                       objenesis::getInstantiatorOf)
                                      .newInstance();
        }
    }
}
