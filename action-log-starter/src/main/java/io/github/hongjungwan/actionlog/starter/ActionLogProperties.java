package io.github.hongjungwan.actionlog.starter;

import io.github.hongjungwan.actionlog.api.config.ActionLogConfig;
import lombok.Data;
import org.slf4j.event.Level;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Action Log SDK 설정 Properties (prefix: action-log).
 */
@Data
@ConfigurationProperties(prefix = "action-log")
public class ActionLogProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** 메시지를 출력할 SLF4J 로거 이름 */
    private String loggerName = ActionLogConfig.DEFAULT_LOGGER_NAME;

    /** 메시지 기록 중 task_uuid/task_level/action_type MDC 설정 여부 */
    private boolean mdcEnabled = true;

    /** action_status=failed 메시지의 로그 레벨 */
    private Level failureLevel = Level.WARN;

    /** @LogAction AOP 설정 */
    private AspectProperties aspect = new AspectProperties();

    @Data
    public static class AspectProperties {
        /** @LogAction AOP 활성화 여부 */
        private boolean enabled = true;
    }
}
