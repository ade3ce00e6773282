package dk.cloudcreate.cqrskit.serialization;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventDataMarshaller} using Jackson.<br>
 * The metadata entries are stored at the top level of the data map and the payload is stored in the
 * {@value #PAYLOAD_KEY} entry:
 * <pre>{@code
 * {
 *     "correlationId": "abc",
 *     "payload": { "taskId": "42", "title": "Write docs" }
 * }
 * }</pre>
 * A metadata entry named {@value #PAYLOAD_KEY} would be lost, so {@link #serialize(EventData)} rejects it.
 */
public class JacksonEventDataMarshaller implements EventDataMarshaller {
    public static final String PAYLOAD_KEY = "payload";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonEventDataMarshaller() {
        this(createDefaultObjectMapper());
    }

    public JacksonEventDataMarshaller(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        return objectMapper;
    }

    @Override
    public Map<String, Object> serialize(EventData<?> eventData) {
        requireNonNull(eventData, "No eventData provided");
        if (eventData.metadata.containsKey(PAYLOAD_KEY)) {
            throw new EventDataMarshallingException(msg("Metadata key '{}' is reserved for the payload of '{}'",
                                                        PAYLOAD_KEY,
                                                        eventData.payload.getClass().getName()));
        }
        Map<String, Object> payload;
        try {
            payload = objectMapper.convertValue(eventData.payload, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new EventDataMarshallingException(msg("Failed to serialize payload of type '{}'", eventData.payload.getClass().getName()), e);
        }
        var data = new LinkedHashMap<String, Object>(eventData.metadata);
        data.put(PAYLOAD_KEY, payload);
        return data;
    }

    @Override
    public <T> EventData<T> deserialize(Map<String, Object> data, Class<T> payloadClass) {
        requireNonNull(data, "No data provided");
        requireNonNull(payloadClass, "No payloadClass provided");
        if (!data.containsKey(PAYLOAD_KEY) || data.get(PAYLOAD_KEY) == null) {
            throw new EventDataMarshallingException(msg("Event data doesn't contain a '{}' entry", PAYLOAD_KEY));
        }
        var metadata = new LinkedHashMap<>(data);
        var payload  = metadata.remove(PAYLOAD_KEY);
        try {
            return new EventData<>(objectMapper.convertValue(payload, payloadClass), metadata);
        } catch (IllegalArgumentException e) {
            throw new EventDataMarshallingException(msg("Failed to deserialize payload into '{}'", payloadClass.getName()), e);
        }
    }
}
