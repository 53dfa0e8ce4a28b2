package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.context.ExecutionContext;
import io.github.hongjungwan.actionlog.api.domain.ActionStatus;
import io.github.hongjungwan.actionlog.api.domain.MessageFields;
import io.github.hongjungwan.actionlog.api.serialization.ActionSerializers;
import io.github.hongjungwan.actionlog.api.serialization.FieldSerializer;
import io.github.hongjungwan.actionlog.core.internal.ExceptionFormatter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * One unit of work inside a task's action tree.
 *
 * <p>An action logs a start message when it is created and exactly one finish
 * message, either succeeded (with any fields added through
 * {@link #addSuccessFields(Map)}) or failed (with the exception's type and reason).
 * Create actions with {@link Actions#startAction} or {@link Actions#startTask}.</p>
 *
 * <pre>{@code
 * Action action = Actions.startAction(logger, "payroll:calculate", Map.of("employee", id));
 * Salary salary = action.execute(() -> {
 *     Salary s = calculator.calculate(id);
 *     action.addSuccessField("amount", s.amount());
 *     return s;
 * });
 * }</pre>
 *
 * <p>An action must only be used from one thread at a time, normally the thread
 * that created it. Its counters are not synchronized.</p>
 */
public class Action {

    private final ActionLogger logger;
    private final String taskUuid;
    private final TaskLevel taskLevel;
    private final String actionType;
    private final ActionSerializers serializers;
    private final Map<String, Object> identification;

    private final Map<String, Object> successFields = new LinkedHashMap<>();
    private int numberOfChildren;
    private long messageCounter;
    private boolean finished;
    private boolean finishAfterRegistered;

    Action(ActionLogger logger, String taskUuid, TaskLevel taskLevel, String actionType,
           ActionSerializers serializers) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.taskUuid = Objects.requireNonNull(taskUuid, "taskUuid");
        this.taskLevel = Objects.requireNonNull(taskLevel, "taskLevel");
        this.actionType = Objects.requireNonNull(actionType, "actionType");
        this.serializers = serializers;

        Map<String, Object> ids = new LinkedHashMap<>();
        ids.put(MessageFields.TASK_UUID, taskUuid);
        ids.put(MessageFields.TASK_LEVEL, taskLevel.toPath());
        ids.put(MessageFields.ACTION_TYPE, actionType);
        this.identification = Map.copyOf(ids);
    }

    /**
     * Log the start message. Called once by the factories in {@link Actions}.
     */
    void start(Map<String, ?> fields) {
        Map<String, Object> message = new LinkedHashMap<>(fields);
        message.put(MessageFields.ACTION_STATUS, ActionStatus.STARTED.getValue());
        message.putAll(identification);
        FieldSerializer serializer = serializers == null ? null : serializers.getStart();
        Message.create(message, serializer).write(logger, this);
    }

    /** 성공 finish 메시지 기록 */
    public void finish() {
        finish(null);
    }

    /**
     * Log the finish message. Only the first call has any effect.
     *
     * @param exception {@code null} for success, otherwise the failure to record
     * @throws io.github.hongjungwan.actionlog.api.serialization.ValidationException if the
     *         success or failure serializer rejects the message; the action stays finished
     */
    public void finish(Throwable exception) {
        if (finished) {
            return;
        }
        finished = true;

        Map<String, Object> message;
        FieldSerializer serializer = null;
        if (exception == null) {
            message = new LinkedHashMap<>(successFields);
            message.put(MessageFields.ACTION_STATUS, ActionStatus.SUCCEEDED.getValue());
            if (serializers != null) {
                serializer = serializers.getSuccess();
            }
        } else {
            message = new LinkedHashMap<>();
            message.put(MessageFields.EXCEPTION, ExceptionFormatter.typeName(exception));
            message.put(MessageFields.REASON, ExceptionFormatter.reason(exception));
            message.put(MessageFields.ACTION_STATUS, ActionStatus.FAILED.getValue());
            if (serializers != null) {
                serializer = serializers.getFailure();
            }
        }
        message.putAll(identification);
        Message.create(message, serializer).write(logger, this);
    }

    /**
     * Create an unstarted child action one level below this one.
     *
     * <p>Prefer {@link Actions#startAction}, which resolves the parent from the
     * execution context and logs the start message.</p>
     */
    public Action child(ActionLogger logger, String actionType, ActionSerializers serializers) {
        numberOfChildren++;
        return new Action(logger, taskUuid, taskLevel.child(numberOfChildren), actionType, serializers);
    }

    /**
     * Add fields to the successful finish message. Later values replace earlier ones
     * with the same key; calls after the action finished are ignored.
     */
    public void addSuccessFields(Map<String, ?> fields) {
        if (finished) {
            return;
        }
        successFields.putAll(fields);
    }

    public void addSuccessField(String key, Object value) {
        if (finished) {
            return;
        }
        successFields.put(key, value);
    }

    /**
     * Called for every message logged within this action.
     *
     * @return the counter value for the message (0 for the first)
     */
    public long incrementMessageCounter() {
        return messageCounter++;
    }

    /**
     * Run this action as the current context without finishing it.
     * Returns a Scope that restores the previous context when closed.
     */
    public ExecutionContext.Scope context() {
        return ExecutionContext.enter(this);
    }

    /**
     * Run the body with this action as the current context. The action is not finished.
     */
    public <T, E extends Throwable> T run(ActionBody<T, E> body) throws E {
        ExecutionContext.push(this);
        try {
            return body.call();
        } finally {
            ExecutionContext.pop();
        }
    }

    /**
     * Run the body with this action as the current context, then finish the action:
     * succeeded if the body returns, failed with whatever the body throws.
     * The thrown exception is rethrown unchanged.
     */
    public <T, E extends Throwable> T execute(ActionBody<T, E> body) throws E {
        T result;
        ExecutionContext.push(this);
        try {
            result = body.call();
        } catch (Throwable t) {
            ExecutionContext.pop();
            finish(t);
            throw t;
        }
        ExecutionContext.pop();
        finish(null);
        return result;
    }

    /**
     * Wrap a Runnable so it runs inside this action's context, e.g. on another thread.
     */
    public Runnable wrap(Runnable runnable) {
        return () -> {
            try (ExecutionContext.Scope ignored = context()) {
                runnable.run();
            }
        };
    }

    /**
     * Wrap a callback so it runs inside this action's context.
     *
     * <pre>{@code
     * future.thenApply(action.wrap(this::parse));
     * }</pre>
     */
    public <T, R> Function<T, R> wrap(Function<T, R> function) {
        return value -> {
            try (ExecutionContext.Scope ignored = context()) {
                return function.apply(value);
            }
        };
    }

    /**
     * Finish this action when the stage completes.
     *
     * <p>The returned stage completes with the original result or failure once the
     * finish message has been logged. If logging the finish message fails, the returned
     * stage completes with that failure instead. Other continuations on {@code stage}
     * see its original outcome.</p>
     *
     * @throws IllegalStateException if called more than once for this action
     */
    public <T> CompletionStage<T> finishAfter(CompletionStage<T> stage) {
        if (finishAfterRegistered) {
            throw new IllegalStateException("finishAfter() already registered for action " + this);
        }
        finishAfterRegistered = true;
        return stage.handle((result, failure) -> {
            finish(unwrap(failure));
            return stage;
        }).thenCompose(Function.identity());
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // Getters
    public ActionLogger getLogger() { return logger; }
    public String getTaskUuid() { return taskUuid; }
    public TaskLevel getTaskLevel() { return taskLevel; }
    public String getActionType() { return actionType; }
    public ActionSerializers getSerializers() { return serializers; }
    public int getNumberOfChildren() { return numberOfChildren; }
    public boolean isFinished() { return finished; }

    /** task_uuid, task_level, action_type (불변) */
    public Map<String, Object> identification() {
        return identification;
    }

    @Override
    public String toString() {
        return "Action{" + actionType + " " + taskUuid + taskLevel.toPath() + "}";
    }
}
