package dk.cloudcreate.cqrskit.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.cqrskit.persistence.EventStoreException;
import dk.cloudcreate.cqrskit.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maps a row in the events table to a {@link RawEvent}
 */
class RawEventRowMapper implements RowMapper<RawEvent> {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    RawEventRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    @Override
    public RawEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new RawEvent(EventId.of(rs.getString("id")),
                            rs.getString("type"),
                            rs.getString("source"),
                            Subject.of(rs.getString("subject")),
                            rs.getObject("time", OffsetDateTime.class),
                            fromJson(rs.getString("data")),
                            fromJson(rs.getString("metadata")));
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventStoreException(msg("Failed to deserialize JSON '{}'", json), e);
        }
    }
}
