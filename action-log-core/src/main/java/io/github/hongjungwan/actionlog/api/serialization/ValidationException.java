package io.github.hongjungwan.actionlog.api.serialization;

/**
 * Raised by a {@link FieldSerializer} when a message's fields fail validation.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /** 검증에 실패한 필드 이름 */
    public String getField() {
        return field;
    }
}
