package io.github.hongjungwan.actionlog.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * AOP 기반 액션 자동 기록 어노테이션.
 *
 * 메서드 실행을 하나의 액션으로 감싸 start/finish 메시지를 기록.
 * 현재 액션이 있으면 그 자식으로, 없으면 새 태스크로 시작.
 *
 * <pre>
 * &#64;LogAction(value = "payroll:calculate", resultField = "amount")
 * public BigDecimal calculate(String employeeId) { ... }
 * </pre>
 *
 * CompletionStage를 반환하는 메서드는 stage가 완료될 때 액션이 종료됨.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LogAction {

    /**
     * 액션 타입 (action_type).
     * 미지정 시 "클래스명:메서드명" 사용.
     */
    String value() default "";

    /**
     * 메서드 인자를 파라미터 이름으로 start 메시지에 포함할지 여부.
     */
    boolean includeArguments() default true;

    /**
     * 반환값을 기록할 성공 필드 이름. 빈 문자열이면 기록하지 않음.
     */
    String resultField() default "";
}
