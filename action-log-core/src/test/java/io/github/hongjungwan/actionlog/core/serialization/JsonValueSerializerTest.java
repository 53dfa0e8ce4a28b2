package io.github.hongjungwan.actionlog.core.serialization;

import io.github.hongjungwan.actionlog.api.serialization.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonValueSerializer")
class JsonValueSerializerTest {

    private final JsonValueSerializer serializer = new JsonValueSerializer();

    @Test
    @DisplayName("should convert beans to plain maps")
    void convertsBeans() {
        Map<String, Object> result = serializer.serialize(Map.of("employee", new Employee("E-1", 3)));

        assertThat(result.get("employee")).isEqualTo(Map.of("id", "E-1", "grade", 3));
    }

    @Test
    @DisplayName("should keep scalars and lists as they are")
    void keepsScalars() {
        Map<String, Object> result = serializer.serialize(Map.of("s", "x", "n", 1, "b", true, "l", List.of(1, 2)));

        assertThat(result).containsEntry("s", "x").containsEntry("n", 1).containsEntry("b", true);
        assertThat(result.get("l")).isEqualTo(List.of(1, 2));
    }

    @Test
    @DisplayName("should reject values Jackson cannot serialize")
    void rejectsUnserializable() {
        assertThatThrownBy(() -> serializer.serialize(Map.of("opaque", new Object())))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("opaque");
    }

    static class Employee {
        private final String id;
        private final int grade;

        Employee(String id, int grade) {
            this.id = id;
            this.grade = grade;
        }

        public String getId() { return id; }
        public int getGrade() { return grade; }
    }
}
