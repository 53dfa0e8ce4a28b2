package io.github.hongjungwan.actionlog.api;

import io.github.hongjungwan.actionlog.api.config.ActionLogConfig;
import io.github.hongjungwan.actionlog.core.internal.Slf4jActionLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ActionLogger 인스턴스 팩토리. 이름별 캐시 관리.
 */
public final class ActionLoggerFactory {

    private static final ConcurrentMap<String, ActionLogger> LOGGER_CACHE = new ConcurrentHashMap<>();

    private ActionLoggerFactory() {}

    /** 기본 이름("action-log")의 로거 */
    public static ActionLogger getLogger() {
        return getLogger(ActionLogConfig.DEFAULT_LOGGER_NAME);
    }

    /** 이름 기반 로거 획득 또는 생성 */
    public static ActionLogger getLogger(String name) {
        return LOGGER_CACHE.computeIfAbsent(name, Slf4jActionLogger::new);
    }

    /** 클래스 기반 로거 획득 또는 생성 */
    public static ActionLogger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /** 로거 캐시 초기화 */
    public static void reset() {
        LOGGER_CACHE.clear();
    }
}
