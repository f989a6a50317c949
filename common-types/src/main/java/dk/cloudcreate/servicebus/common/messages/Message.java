package dk.cloudcreate.servicebus.common.messages;

/**
 * Marker for all domain messages (commands and events) that can be delivered through a {@link dk.cloudcreate.servicebus.common.context.MessageDeliveryContext}
 */
public interface Message {
}
