package org.policybot.annotation;

import java.lang.annotation.*;

@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LogAction {
    String value() default "";    // 模块名称，如 "同步"
    String action() default "";   // 动作类型，如 "MANUAL_SYNC"
    boolean logArgs() default true;
}
