package dk.cloudcreate.servicebus.common.context;

import dk.cloudcreate.servicebus.common.messages.Message;

import java.util.List;

/**
 * The channel used to publish domain messages once the storage operation that produced them has been committed.<br>
 * The transport behind the context (message bus, broker, in-memory dispatcher) isn't part of this library.
 */
public interface MessageDeliveryContext {
    /**
     * Deliver the messages in the order given
     *
     * @param messages the messages to deliver
     */
    void delivery(List<? extends Message> messages);

    default void delivery(Message... messages) {
        delivery(List.of(messages));
    }
}
