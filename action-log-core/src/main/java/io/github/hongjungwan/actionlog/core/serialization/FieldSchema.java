package io.github.hongjungwan.actionlog.core.serialization;

import io.github.hongjungwan.actionlog.api.serialization.FieldSerializer;
import io.github.hongjungwan.actionlog.api.serialization.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validating serializer: every declared field must be present and an instance of its
 * declared type. Undeclared fields pass through untouched.
 *
 * <pre>{@code
 * FieldSchema schema = FieldSchema.builder()
 *         .field("employee_id", String.class)
 *         .field("amount", Number.class)
 *         .build();
 * }</pre>
 */
public final class FieldSchema implements FieldSerializer {

    private final Map<String, Class<?>> fields;

    private FieldSchema(Map<String, Class<?>> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 실패 메시지 표준 스키마 (exception, reason) */
    public static FieldSchema failure() {
        return builder()
                .field("exception", String.class)
                .field("reason", String.class)
                .build();
    }

    public Map<String, Class<?>> getFields() {
        return fields;
    }

    @Override
    public Map<String, Object> serialize(Map<String, Object> message) {
        for (Map.Entry<String, Class<?>> entry : fields.entrySet()) {
            String key = entry.getKey();
            if (!message.containsKey(key)) {
                throw new ValidationException(key, "Missing required field '" + key + "'");
            }
            Object value = message.get(key);
            if (value == null || !entry.getValue().isInstance(value)) {
                throw new ValidationException(key, String.format("Field '%s' must be %s but was %s",
                        key, entry.getValue().getSimpleName(),
                        value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
        return message;
    }

    public static class Builder {
        private final Map<String, Class<?>> fields = new LinkedHashMap<>();

        public Builder field(String key, Class<?> type) {
            fields.put(key, type);
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(fields);
        }
    }
}
