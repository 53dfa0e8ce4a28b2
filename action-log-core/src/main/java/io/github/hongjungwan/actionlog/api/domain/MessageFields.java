package io.github.hongjungwan.actionlog.api.domain;

/**
 * 메시지 필드 이름 상수. 모든 start/finish 메시지에 포함되는 식별 필드 정의.
 */
public final class MessageFields {

    public static final String TASK_UUID = "task_uuid";
    public static final String TASK_LEVEL = "task_level";
    public static final String ACTION_TYPE = "action_type";
    public static final String ACTION_STATUS = "action_status";

    /** 실패 시 예외 클래스의 FQCN */
    public static final String EXCEPTION = "exception";

    /** 실패 시 예외 메시지 */
    public static final String REASON = "reason";

    /** epoch seconds (소수점 이하 밀리초) */
    public static final String TIMESTAMP = "timestamp";

    /** 액션 내 메시지 순번 (0부터) */
    public static final String ACTION_COUNTER = "action_counter";

    private MessageFields() {}
}
