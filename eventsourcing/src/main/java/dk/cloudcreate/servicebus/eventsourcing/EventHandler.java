package dk.cloudcreate.servicebus.eventsourcing;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is being raised on, or rehydrated onto, an {@link Aggregate} instance
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
