package io.github.hongjungwan.actionlog.api.config;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.event.Level;

/**
 * Configuration for the SLF4J-backed action logger
 */
@Getter
@Builder
public class ActionLogConfig {

    public static final String DEFAULT_LOGGER_NAME = "action-log";

    /**
     * SLF4J logger name messages are written to
     */
    @Builder.Default
    private final String loggerName = DEFAULT_LOGGER_NAME;

    /**
     * Put task_uuid, task_level and action_type into the MDC while a message is written
     */
    @Builder.Default
    private final boolean mdcEnabled = true;

    /**
     * Level for messages with action_status=failed. Everything else is logged at INFO.
     */
    @Builder.Default
    private final Level failureLevel = Level.WARN;

    public static ActionLogConfig defaultConfig() {
        return ActionLogConfig.builder().build();
    }
}
