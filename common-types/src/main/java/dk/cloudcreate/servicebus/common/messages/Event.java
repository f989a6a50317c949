package dk.cloudcreate.servicebus.common.messages;

/**
 * Something that has happened
 */
public interface Event extends Message {
}
