package io.github.hongjungwan.actionlog.starter.aop;

import io.github.hongjungwan.actionlog.api.Action;
import io.github.hongjungwan.actionlog.api.ActionLogger;
import io.github.hongjungwan.actionlog.api.Actions;
import io.github.hongjungwan.actionlog.api.annotation.LogAction;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * AOP 기반 액션 자동 기록 Aspect.
 *
 * {@code @LogAction} 어노테이션이 적용된 메서드 실행을 하나의 액션으로 기록.
 * 현재 스레드에 실행 중인 액션이 있으면 그 자식 액션이 되므로
 * 중첩된 @LogAction 메서드 호출이 그대로 액션 트리로 남음.
 *
 * 종료 시점:
 * - 일반 반환: succeeded (resultField 지정 시 반환값 포함)
 * - 예외 발생: failed 기록 후 예외 재전파
 * - CompletionStage 반환: stage 완료 시점에 종료
 */
@Aspect
@Slf4j
public class LogActionAspect {

    private final ActionLogger actionLogger;

    public LogActionAspect(ActionLogger actionLogger) {
        this.actionLogger = actionLogger;
    }

    /**
     * {@code @LogAction} 어노테이션이 적용된 메서드를 액션으로 감쌈.
     */
    @Around("@annotation(logAction)")
    public Object logAction(ProceedingJoinPoint joinPoint, LogAction logAction) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Map<String, Object> fields = logAction.includeArguments()
                ? extractArguments(signature, joinPoint.getArgs())
                : Map.of();

        Action action = Actions.startAction(actionLogger, resolveActionType(signature, logAction), null, fields);

        Object result;
        try {
            result = action.run(joinPoint::proceed);
        } catch (Throwable t) {
            action.finish(t);
            throw t;
        }

        if (result instanceof CompletionStage) {
            CompletionStage<?> bridged = finishAfter(action, (CompletionStage<?>) result, logAction.resultField());
            Class<?> returnType = signature.getReturnType();
            if (returnType != null && returnType.isInstance(bridged)) {
                return bridged;
            }
            log.debug("Returning original stage for {}: {} is not assignable to {}",
                    action.getActionType(), bridged.getClass().getName(), returnType);
            return result;
        }

        if (!logAction.resultField().isEmpty()) {
            action.addSuccessField(logAction.resultField(), result);
        }
        action.finish();
        return result;
    }

    // ========== Private Methods ==========

    private <T> CompletionStage<T> finishAfter(Action action, CompletionStage<T> stage, String resultField) {
        CompletionStage<T> source = stage;
        if (!resultField.isEmpty()) {
            source = stage.thenApply(value -> {
                action.addSuccessField(resultField, value);
                return value;
            });
        }
        return action.finishAfter(source);
    }

    /**
     * action_type 결정: 어노테이션 값 또는 "클래스명:메서드명".
     */
    private String resolveActionType(MethodSignature signature, LogAction logAction) {
        if (!logAction.value().isEmpty()) {
            return logAction.value();
        }
        return signature.getDeclaringType().getSimpleName() + ":" + signature.getName();
    }

    /**
     * 메서드 인자를 파라미터 이름 기준으로 수집. 이름을 알 수 없으면 arg0, arg1...
     */
    private Map<String, Object> extractArguments(MethodSignature signature, Object[] args) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (args == null) {
            return fields;
        }

        String[] paramNames = signature.getParameterNames();
        for (int i = 0; i < args.length; i++) {
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : "arg" + i;
            fields.put(name, args[i]);
        }
        return fields;
    }
}
