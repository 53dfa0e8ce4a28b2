package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.serialization.ActionSerializers;
import io.github.hongjungwan.actionlog.core.serialization.FieldSchema;

import java.util.Map;

/**
 * A named kind of action with validated start and success fields.
 *
 * <pre>{@code
 * static final ActionType CHARGE = ActionType.builder("billing:charge")
 *         .startField("customer_id", String.class)
 *         .successField("receipt_id", String.class)
 *         .build();
 *
 * Action action = CHARGE.start(logger, Map.of("customer_id", id));
 * }</pre>
 *
 * Failure messages are always checked against {@link FieldSchema#failure()}.
 */
public final class ActionType {

    private final String name;
    private final ActionSerializers serializers;

    private ActionType(String name, ActionSerializers serializers) {
        this.name = name;
        this.serializers = serializers;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public ActionSerializers getSerializers() {
        return serializers;
    }

    /** 현재 컨텍스트 기준으로 액션 시작 (startAction) */
    public Action start(ActionLogger logger, Map<String, ?> fields) {
        return Actions.startAction(logger, name, serializers, fields);
    }

    /** 새 태스크로 시작 (startTask) */
    public Action startTask(ActionLogger logger, Map<String, ?> fields) {
        return Actions.startTask(logger, name, serializers, fields);
    }

    public static class Builder {
        private final String name;
        private final FieldSchema.Builder startFields = FieldSchema.builder();
        private final FieldSchema.Builder successFields = FieldSchema.builder();

        Builder(String name) {
            this.name = name;
        }

        public Builder startField(String key, Class<?> type) {
            startFields.field(key, type);
            return this;
        }

        public Builder successField(String key, Class<?> type) {
            successFields.field(key, type);
            return this;
        }

        public ActionType build() {
            return new ActionType(name, ActionSerializers.of(
                    startFields.build(), successFields.build(), FieldSchema.failure()));
        }
    }
}
