package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.Precondition;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link CommandEventPublisher} that buffers the published events in publishing order
 */
public class CapturingCommandEventPublisher<INSTANCE> implements CommandEventPublisher<INSTANCE> {
    private final List<CapturedEvent> capturedEvents = new ArrayList<>();

    @Override
    public void publish(Object event, Map<String, Object> metadata, List<Precondition> preconditions) {
        requireNonNull(event, "You must supply an event");
        capturedEvents.add(new CapturedEvent(event, metadata, preconditions));
    }

    public List<CapturedEvent> getCapturedEvents() {
        return Collections.unmodifiableList(capturedEvents);
    }
}
