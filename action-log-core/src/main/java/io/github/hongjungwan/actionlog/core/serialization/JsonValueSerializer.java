package io.github.hongjungwan.actionlog.core.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.actionlog.api.serialization.FieldSerializer;
import io.github.hongjungwan.actionlog.api.serialization.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts every field value into plain JSON data (maps, lists, strings, numbers,
 * booleans, null) so the logger never holds references to live application objects.
 */
public class JsonValueSerializer implements FieldSerializer {

    private final ObjectMapper mapper;

    public JsonValueSerializer() {
        this(new ObjectMapper());
    }

    public JsonValueSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Map<String, Object> serialize(Map<String, Object> fields) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            result.put(entry.getKey(), convert(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private Object convert(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        try {
            return mapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(key, "Field '" + key + "' is not JSON serializable: " + e.getMessage(), e);
        }
    }
}
