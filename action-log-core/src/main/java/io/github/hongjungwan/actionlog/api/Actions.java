package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.context.ExecutionContext;
import io.github.hongjungwan.actionlog.api.serialization.ActionSerializers;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 액션 생성 진입점. startAction은 현재 ExecutionContext의 액션을 부모로, 없으면 새 태스크로 시작.
 */
public final class Actions {

    private Actions() {}

    public static Action startAction(ActionLogger logger, String actionType) {
        return startAction(logger, actionType, null, Map.of());
    }

    public static Action startAction(ActionLogger logger, String actionType, Map<String, ?> fields) {
        return startAction(logger, actionType, null, fields);
    }

    /**
     * Start a child of the current action, or a new task if this thread has no current action.
     *
     * <pre>{@code
     * Action action = Actions.startAction(logger, "app:subsystem:dosomething", Map.of("entry", x));
     * action.execute(() -> doSomething(x));
     * }</pre>
     *
     * @param serializers may be {@code null}
     * @param fields      extra fields for the start message
     */
    public static Action startAction(ActionLogger logger, String actionType,
                                     ActionSerializers serializers, Map<String, ?> fields) {
        Optional<Action> parent = ExecutionContext.current();
        if (parent.isEmpty()) {
            return startTask(logger, actionType, serializers, fields);
        }
        return startChild(parent.get(), logger, actionType, serializers, fields);
    }

    public static Action startTask(ActionLogger logger, String actionType) {
        return startTask(logger, actionType, null, Map.of());
    }

    public static Action startTask(ActionLogger logger, String actionType, Map<String, ?> fields) {
        return startTask(logger, actionType, null, fields);
    }

    /**
     * Start a new top-level action with a fresh task uuid and level {@code "/"}.
     */
    public static Action startTask(ActionLogger logger, String actionType,
                                   ActionSerializers serializers, Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        Action action = new Action(logger, UUID.randomUUID().toString(), TaskLevel.root(), actionType, serializers);
        action.start(fields);
        return action;
    }

    public static Action startChild(Action parent, ActionLogger logger, String actionType) {
        return startChild(parent, logger, actionType, null, Map.of());
    }

    /**
     * Start a child of an explicitly passed parent, bypassing the execution context.
     */
    public static Action startChild(Action parent, ActionLogger logger, String actionType,
                                    ActionSerializers serializers, Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        Action action = parent.child(logger, actionType, serializers);
        action.start(fields);
        return action;
    }
}
