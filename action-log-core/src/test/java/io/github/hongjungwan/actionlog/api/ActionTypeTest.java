package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.serialization.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ActionType")
class ActionTypeTest {

    private static final ActionType CHARGE = ActionType.builder("billing:charge")
            .startField("customer_id", String.class)
            .successField("receipt_id", String.class)
            .build();

    private RecordingLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RecordingLogger();
    }

    @Test
    @DisplayName("should start an action with validated fields")
    void shouldStartWithValidFields() {
        Action action = CHARGE.start(logger, Map.of("customer_id", "C-1"));
        action.addSuccessField("receipt_id", "R-9");
        action.finish();

        assertThat(action.getActionType()).isEqualTo("billing:charge");
        assertThat(logger.last()).containsEntry("receipt_id", "R-9");
    }

    @Test
    @DisplayName("should reject a start message missing a declared field")
    void shouldRejectMissingStartField() {
        assertThatThrownBy(() -> CHARGE.startTask(logger, Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("customer_id");
    }

    @Test
    @DisplayName("should reject a success message missing a declared field")
    void shouldRejectMissingSuccessField() {
        Action action = CHARGE.start(logger, Map.of("customer_id", "C-1"));

        assertThatThrownBy(action::finish)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("receipt_id");
    }

    @Test
    @DisplayName("failure messages should pass the standard failure schema")
    void failureMessagesPass() {
        Action action = CHARGE.start(logger, Map.of("customer_id", "C-1"));

        action.finish(new IllegalStateException("card declined"));

        assertThat(logger.last())
                .containsEntry("action_status", "failed")
                .containsEntry("reason", "card declined");
    }
}
