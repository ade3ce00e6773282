package dk.cloudcreate.cqrskit.eventhandler.partitioning;

import dk.cloudcreate.cqrskit.types.RawEvent;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Resolves the sequence id of an event. Events with the same sequence id are always assigned to the same partition and are
 * therefore handled sequentially.<br>
 * The {@link dk.cloudcreate.cqrskit.eventhandler.EventHandlingProcessor} resolves the sequence id twice: first for the raw event
 * (where the converted event isn't available yet) and afterwards for each converted event.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class EventSequenceResolver {
    public enum Kind {
        FOR_RAW_EVENT,
        FOR_OBJECT_AND_METADATA_AND_RAW_EVENT
    }

    @FunctionalInterface
    public interface ForObjectAndMetadataAndRawEvent {
        /**
         * @param event    the converted event, empty when resolving the sequence id of the raw event before it has been converted
         * @param metadata the event metadata
         * @param rawEvent the raw event
         */
        String resolve(Optional<Object> event, Map<String, Object> metadata, RawEvent rawEvent);
    }

    public final  Kind                            kind;
    private final Function<RawEvent, String>      rawEventResolver;
    private final ForObjectAndMetadataAndRawEvent objectResolver;

    private EventSequenceResolver(Kind kind, Function<RawEvent, String> rawEventResolver, ForObjectAndMetadataAndRawEvent objectResolver) {
        this.kind = kind;
        this.rawEventResolver = rawEventResolver;
        this.objectResolver = objectResolver;
    }

    public static EventSequenceResolver forRawEvent(Function<RawEvent, String> resolver) {
        return new EventSequenceResolver(Kind.FOR_RAW_EVENT, requireNonNull(resolver, "No resolver provided"), null);
    }

    public static EventSequenceResolver forObjectAndMetadataAndRawEvent(ForObjectAndMetadataAndRawEvent resolver) {
        return new EventSequenceResolver(Kind.FOR_OBJECT_AND_METADATA_AND_RAW_EVENT, null, requireNonNull(resolver, "No resolver provided"));
    }

    /**
     * Events for the same subject share a sequence
     */
    public static EventSequenceResolver perSubject() {
        return forRawEvent(rawEvent -> rawEvent.subject.toString());
    }

    /**
     * Events that share the first <code>level</code> subject segments share a sequence, e.g. with level 2 the subjects
     * <code>/order/123/item/1</code> and <code>/order/123/item/2</code> both resolve to <code>/order/123</code>
     */
    public static EventSequenceResolver perConfigurableLevelSubject(int level) {
        requireTrue(level >= 1, "level must be 1 or larger");
        return forRawEvent(rawEvent -> rawEvent.subject.truncate(level).toString());
    }

    public String resolve(Optional<Object> event, Map<String, Object> metadata, RawEvent rawEvent) {
        requireNonNull(rawEvent, "No rawEvent provided");
        switch (kind) {
            case FOR_RAW_EVENT:
                return rawEventResolver.apply(rawEvent);
            case FOR_OBJECT_AND_METADATA_AND_RAW_EVENT:
                return objectResolver.resolve(event, metadata, rawEvent);
            default:
                throw new IllegalStateException("Unsupported event sequence resolver kind " + kind);
        }
    }
}
