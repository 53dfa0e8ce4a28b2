package io.github.hongjungwan.actionlog.api.serialization;

import lombok.Builder;
import lombok.Getter;

/**
 * Serializers applied to an action's start, success and failure messages.
 * Any component may be {@code null}, in which case that message is passed through.
 */
@Getter
@Builder
public class ActionSerializers {

    private final FieldSerializer start;

    private final FieldSerializer success;

    private final FieldSerializer failure;

    /** serializer 없음 (모든 메시지 그대로 전달) */
    public static ActionSerializers none() {
        return new ActionSerializers(null, null, null);
    }

    public static ActionSerializers of(FieldSerializer start, FieldSerializer success, FieldSerializer failure) {
        return new ActionSerializers(start, success, failure);
    }

    /** 모든 메시지에 같은 serializer 적용 */
    public static ActionSerializers all(FieldSerializer serializer) {
        return new ActionSerializers(serializer, serializer, serializer);
    }
}
