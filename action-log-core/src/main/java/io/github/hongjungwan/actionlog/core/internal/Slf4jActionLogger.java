package io.github.hongjungwan.actionlog.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.actionlog.api.Action;
import io.github.hongjungwan.actionlog.api.ActionLogger;
import io.github.hongjungwan.actionlog.api.config.ActionLogConfig;
import io.github.hongjungwan.actionlog.api.domain.ActionStatus;
import io.github.hongjungwan.actionlog.api.domain.MessageFields;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.HashMap;
import java.util.Map;

/**
 * SLF4J 기반 ActionLogger 구현. 메시지를 JSON 한 줄로 출력, 식별 필드는 MDC에 보존.
 */
@Slf4j
public class Slf4jActionLogger implements ActionLogger {

    private static final String[] MDC_KEYS = {
            MessageFields.TASK_UUID, MessageFields.TASK_LEVEL, MessageFields.ACTION_TYPE
    };
    private static final ObjectMapper MESSAGE_MAPPER = new ObjectMapper();

    private final Logger delegate;
    private final ActionLogConfig config;

    public Slf4jActionLogger(ActionLogConfig config) {
        this.config = config;
        this.delegate = LoggerFactory.getLogger(config.getLoggerName());
    }

    public Slf4jActionLogger(String name) {
        this(ActionLogConfig.builder().loggerName(name).build());
    }

    @Override
    public void write(Map<String, Object> message, Action action) {
        Level level = levelOf(message);
        if (!isEnabled(level)) {
            return;
        }

        Map<String, String> previous = config.isMdcEnabled() ? putMdc(message) : Map.of();
        try {
            log(level, render(message));
        } finally {
            previous.forEach(this::restoreMdc);
        }
    }

    public String getName() {
        return delegate.getName();
    }

    private Level levelOf(Map<String, Object> message) {
        Object status = message.get(MessageFields.ACTION_STATUS);
        if (ActionStatus.FAILED.getValue().equals(status)) {
            return config.getFailureLevel();
        }
        return Level.INFO;
    }

    /**
     * Returns the values the keys held before, null for keys that were not set.
     */
    private Map<String, String> putMdc(Map<String, Object> message) {
        Map<String, String> previous = new HashMap<>(MDC_KEYS.length);
        for (String key : MDC_KEYS) {
            Object value = message.get(key);
            if (value != null) {
                previous.put(key, MDC.get(key));
                MDC.put(key, value.toString());
            }
        }
        return previous;
    }

    private void restoreMdc(String key, String previousValue) {
        try {
            if (previousValue == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previousValue);
            }
        } catch (Exception e) {
            log.warn("Failed to restore MDC key '{}': {}", key, e.getMessage());
        }
    }

    private boolean isEnabled(Level level) {
        return switch (level) {
            case TRACE -> delegate.isTraceEnabled();
            case DEBUG -> delegate.isDebugEnabled();
            case INFO -> delegate.isInfoEnabled();
            case WARN -> delegate.isWarnEnabled();
            case ERROR -> delegate.isErrorEnabled();
        };
    }

    private void log(Level level, String line) {
        switch (level) {
            case TRACE -> delegate.trace(line);
            case DEBUG -> delegate.debug(line);
            case INFO -> delegate.info(line);
            case WARN -> delegate.warn(line);
            case ERROR -> delegate.error(line);
        }
    }

    private String render(Map<String, Object> message) {
        try {
            return MESSAGE_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("Failed to render action message as JSON, falling back to toString(): {}", e.getMessage());
            return message.toString();
        }
    }
}
