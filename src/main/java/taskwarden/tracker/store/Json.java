package taskwarden.tracker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * JSON codec for the opaque payload columns.
 * Payloads come back as plain maps, lists and scalars.
 */
final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {
    }

    static String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable: " + value.getClass().getName(), e);
        }
    }

    static Object readValue(String json) {
        return read(json, new TypeReference<Object>() {
        });
    }

    static Map<String, Object> readMap(String json) {
        Map<String, Object> map = read(json, new TypeReference<Map<String, Object>>() {
        });
        return map == null ? Map.of() : map;
    }

    static List<Object> readList(String json) {
        List<Object> list = read(json, new TypeReference<List<Object>>() {
        });
        return list == null ? List.of() : list;
    }

    private static <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON", e);
        }
    }
}
