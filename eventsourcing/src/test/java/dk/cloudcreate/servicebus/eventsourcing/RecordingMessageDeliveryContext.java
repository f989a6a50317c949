package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.common.context.MessageDeliveryContext;
import dk.cloudcreate.servicebus.common.messages.Message;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingMessageDeliveryContext implements MessageDeliveryContext {
    public final List<Message> deliveredMessages = new CopyOnWriteArrayList<>();

    @Override
    public void delivery(List<? extends Message> messages) {
        deliveredMessages.addAll(messages);
    }
}
