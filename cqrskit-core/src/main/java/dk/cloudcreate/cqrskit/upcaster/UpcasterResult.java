package dk.cloudcreate.cqrskit.upcaster;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The new type and data of an upcasted event
 */
public final class UpcasterResult {
    public final String              type;
    public final Map<String, Object> data;

    public UpcasterResult(String type, Map<String, Object> data) {
        this.type = requireNonNull(type, "No type provided");
        this.data = requireNonNull(data, "No data provided");
    }

    public static UpcasterResult of(String type, Map<String, Object> data) {
        return new UpcasterResult(type, data);
    }

    @Override
    public String toString() {
        return "UpcasterResult{" +
                "type='" + type + '\'' +
                ", data=" + data +
                '}';
    }
}
