package dk.cloudcreate.cqrskit.command;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Controls which part of the metadata a command was sent with is copied into the data of the events the command handler publishes
 */
public final class MetadataPropagation {
    public enum Mode {
        /**
         * Only the metadata given when publishing the event
         */
        NONE,
        /**
         * The metadata given when publishing the event plus the selected keys from the command metadata
         */
        SHALLOW,
        /**
         * The command metadata overlaid with the metadata given when publishing the event
         */
        DEEP
    }

    public final Mode        mode;
    public final Set<String> keys;

    private MetadataPropagation(Mode mode, Set<String> keys) {
        this.mode = requireNonNull(mode, "No mode provided");
        this.keys = Set.copyOf(requireNonNull(keys, "No keys provided"));
    }

    public static MetadataPropagation none() {
        return new MetadataPropagation(Mode.NONE, Set.of());
    }

    public static MetadataPropagation shallow(String... keys) {
        return new MetadataPropagation(Mode.SHALLOW, Set.of(keys));
    }

    public static MetadataPropagation deep() {
        return new MetadataPropagation(Mode.DEEP, Set.of());
    }

    /**
     * @param commandMetadata the metadata the command was sent with
     * @param eventMetadata   the metadata the event was published with
     * @return the metadata to store in the event data
     */
    public Map<String, Object> propagate(Map<String, Object> commandMetadata, Map<String, Object> eventMetadata) {
        requireNonNull(commandMetadata, "No commandMetadata provided");
        requireNonNull(eventMetadata, "No eventMetadata provided");
        switch (mode) {
            case SHALLOW: {
                var result = new LinkedHashMap<>(eventMetadata);
                commandMetadata.forEach((key, value) -> {
                    if (keys.contains(key)) {
                        result.put(key, value);
                    }
                });
                return result;
            }
            case DEEP: {
                var result = new LinkedHashMap<>(commandMetadata);
                result.putAll(eventMetadata);
                return result;
            }
            default:
                return new LinkedHashMap<>(eventMetadata);
        }
    }

    @Override
    public String toString() {
        return "MetadataPropagation{" +
                "mode=" + mode +
                ", keys=" + keys +
                '}';
    }
}
