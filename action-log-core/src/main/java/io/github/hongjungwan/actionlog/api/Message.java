package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.context.ExecutionContext;
import io.github.hongjungwan.actionlog.api.domain.MessageFields;
import io.github.hongjungwan.actionlog.api.serialization.FieldSerializer;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single structured log message.
 *
 * <p>Writing a message ties it to an action: the action's task uuid and level are
 * added, together with the action's next message counter and a timestamp. A message
 * written with no action (and none current) gets a fresh task of its own.</p>
 *
 * <pre>{@code
 * Message.create(Map.of("message_type", "cache:miss", "key", key)).write(logger);
 * }</pre>
 */
public final class Message {

    private static volatile Clock clock = Clock.systemUTC();

    private final Map<String, Object> contents;
    private final FieldSerializer serializer;

    private Message(Map<String, Object> contents, FieldSerializer serializer) {
        this.contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
        this.serializer = serializer;
    }

    public static Message create(Map<String, ?> fields) {
        return new Message(new LinkedHashMap<>(fields), null);
    }

    public static Message create(Map<String, ?> fields, FieldSerializer serializer) {
        return new Message(new LinkedHashMap<>(fields), serializer);
    }

    /** 필드를 추가한 새 메시지 생성 (원본 불변) */
    public Message bind(Map<String, ?> fields) {
        Map<String, Object> merged = new LinkedHashMap<>(contents);
        merged.putAll(fields);
        return new Message(merged, serializer);
    }

    public Map<String, Object> contents() {
        return contents;
    }

    /**
     * Write within the current action of this thread, if any.
     */
    public void write(ActionLogger logger) {
        write(logger, ExecutionContext.current().orElse(null));
    }

    /**
     * Write within the given action.
     *
     * @param action owning action, or {@code null} to log outside any action
     * @throws io.github.hongjungwan.actionlog.api.serialization.ValidationException if the serializer rejects the fields
     */
    public void write(ActionLogger logger, Action action) {
        Map<String, Object> fields = freeze(action);
        if (serializer != null) {
            fields = serializer.serialize(fields);
        }
        logger.write(fields, action);
    }

    private Map<String, Object> freeze(Action action) {
        Map<String, Object> fields = new LinkedHashMap<>(contents);
        if (action == null) {
            fields.put(MessageFields.TASK_UUID, UUID.randomUUID().toString());
            fields.put(MessageFields.TASK_LEVEL, TaskLevel.root().toPath());
            fields.put(MessageFields.ACTION_COUNTER, 0L);
        } else {
            fields.put(MessageFields.TASK_UUID, action.getTaskUuid());
            fields.put(MessageFields.TASK_LEVEL, action.getTaskLevel().toPath());
            fields.put(MessageFields.ACTION_COUNTER, action.incrementMessageCounter());
        }
        fields.put(MessageFields.TIMESTAMP, clock.millis() / 1000.0);
        return fields;
    }

    /**
     * Replace the clock used for message timestamps. Intended for tests.
     */
    public static void setClock(Clock newClock) {
        clock = newClock == null ? Clock.systemUTC() : newClock;
    }
}
