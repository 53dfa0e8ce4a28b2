package io.github.hongjungwan.actionlog.starter;

import io.github.hongjungwan.actionlog.api.ActionLogger;
import io.github.hongjungwan.actionlog.api.config.ActionLogConfig;
import io.github.hongjungwan.actionlog.core.internal.Slf4jActionLogger;
import io.github.hongjungwan.actionlog.starter.aop.LogActionAspect;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Action Log SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(ActionLogProperties.class)
@ConditionalOnProperty(prefix = "action-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(ActionLogAutoConfiguration.LogActionConfiguration.class)
@Slf4j
public class ActionLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ActionLogConfig actionLogConfig(ActionLogProperties properties) {
        return ActionLogConfig.builder()
                .loggerName(properties.getLoggerName())
                .mdcEnabled(properties.isMdcEnabled())
                .failureLevel(properties.getFailureLevel())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionLogger actionLogger(ActionLogConfig config) {
        log.info("Action messages will be written to SLF4J logger '{}'", config.getLoggerName());
        return new Slf4jActionLogger(config);
    }

    /**
     * AOP 기반 {@code @LogAction} 지원 설정.
     * action-log.aspect.enabled=true 시 활성화 (기본값: true)
     */
    @Configuration
    @ConditionalOnClass(Aspect.class)
    @ConditionalOnProperty(prefix = "action-log.aspect", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class LogActionConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public LogActionAspect logActionAspect(ActionLogger actionLogger) {
            log.info("LogActionAspect enabled - @LogAction annotations will be processed");
            return new LogActionAspect(actionLogger);
        }
    }
}
