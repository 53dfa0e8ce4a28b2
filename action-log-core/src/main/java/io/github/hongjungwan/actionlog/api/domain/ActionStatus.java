package io.github.hongjungwan.actionlog.api.domain;

/**
 * 액션 상태. action_status 필드 값으로 기록됨.
 */
public enum ActionStatus {

    STARTED("started"),

    SUCCEEDED("succeeded"),

    FAILED("failed");

    private final String value;

    ActionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** 필드 값으로부터 상태 조회 */
    public static ActionStatus fromValue(String value) {
        for (ActionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown action status: " + value);
    }
}
