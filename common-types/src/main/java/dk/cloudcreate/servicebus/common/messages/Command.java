package dk.cloudcreate.servicebus.common.messages;

/**
 * A request to perform an action
 */
public interface Command extends Message {
}
