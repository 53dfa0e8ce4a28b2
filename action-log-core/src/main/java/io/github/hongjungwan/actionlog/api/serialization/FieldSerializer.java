package io.github.hongjungwan.actionlog.api.serialization;

import java.util.Map;

/**
 * Transforms and/or validates a message's fields before they reach the logger.
 *
 * <p>Implementations return the (possibly new) field mapping, or throw
 * {@link ValidationException} when the fields are not acceptable. The failure
 * propagates to whoever started or finished the action.</p>
 */
@FunctionalInterface
public interface FieldSerializer {

    Map<String, Object> serialize(Map<String, Object> fields);

    static FieldSerializer identity() {
        return fields -> fields;
    }

    /** 이 serializer 결과를 next에 전달하는 합성 serializer */
    default FieldSerializer andThen(FieldSerializer next) {
        return fields -> next.serialize(serialize(fields));
    }
}
