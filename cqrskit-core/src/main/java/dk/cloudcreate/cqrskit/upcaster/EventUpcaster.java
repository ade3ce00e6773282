package dk.cloudcreate.cqrskit.upcaster;

import dk.cloudcreate.cqrskit.types.RawEvent;

import java.util.List;

/**
 * Transforms a stored event representation into zero, one or more new representations before the event is deserialized.<br>
 * Typical usages are renaming an event type, migrating the data of an old event version or splitting one event into several.
 */
public interface EventUpcaster {
    /**
     * @return true if this upcaster wants to transform the event
     */
    boolean canUpcast(RawEvent event);

    /**
     * Only called if {@link #canUpcast(RawEvent)} returned true
     *
     * @return the new type/data pairs. An empty list drops the event
     */
    List<UpcasterResult> upcast(RawEvent event);
}
