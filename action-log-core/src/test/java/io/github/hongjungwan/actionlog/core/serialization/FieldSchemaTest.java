package io.github.hongjungwan.actionlog.core.serialization;

import io.github.hongjungwan.actionlog.api.serialization.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FieldSchema")
class FieldSchemaTest {

    private final FieldSchema schema = FieldSchema.builder()
            .field("employee_id", String.class)
            .field("amount", Number.class)
            .build();

    @Test
    @DisplayName("should accept declared fields of the right type and pass extras through")
    void acceptsValidFields() {
        Map<String, Object> fields = Map.of("employee_id", "E-1", "amount", 10L, "extra", true);

        assertThat(schema.serialize(fields)).isEqualTo(fields);
    }

    @Test
    @DisplayName("should reject a missing field")
    void rejectsMissingField() {
        assertThatThrownBy(() -> schema.serialize(Map.of("employee_id", "E-1")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("amount")
                .extracting("field").isEqualTo("amount");
    }

    @Test
    @DisplayName("should reject a field of the wrong type")
    void rejectsWrongType() {
        assertThatThrownBy(() -> schema.serialize(Map.of("employee_id", 7, "amount", 1)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Field 'employee_id' must be String but was Integer");
    }

    @Test
    @DisplayName("should reject a null value")
    void rejectsNull() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("employee_id", null);
        fields.put("amount", 1);

        assertThatThrownBy(() -> schema.serialize(fields)).isInstanceOf(ValidationException.class);
    }
}
