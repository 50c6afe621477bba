package org.policybot.aspect;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.policybot.annotation.LogAction;
import org.policybot.utils.LogUtils;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

/**
 * 接口操作日志：入参、结果和耗时。没有上游 requestId 时在这里生成一个。
 */
@Aspect
@Component
public class LogAspect {

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    // 原始请求体（webhook 的 byte[]）和 servlet 对象不打印
    private static final Class<?>[] IGNORED_CLASSES = {
            ServletRequest.class, ServletResponse.class, byte[].class
    };

    @Around("@annotation(logAction)")
    public Object doAround(ProceedingJoinPoint joinPoint, LogAction logAction) throws Throwable {
        String module = logAction.value();
        String action = logAction.action();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attributes != null ? attributes.getRequest() : null;

        String clientIp = "0.0.0.0";
        String requestId = null;
        if (request != null) {
            clientIp = request.getRemoteAddr();
            requestId = request.getHeader(REQUEST_ID_HEADER);
        }
        boolean ownsRequestId = MDC.get(LogUtils.REQUEST_ID) == null;
        if (ownsRequestId) {
            LogUtils.setRequestContext(requestId != null ? requestId : UUID.randomUUID().toString(), null, null);
        }

        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor(module + "-" + action);

        if (logAction.logArgs()) {
            LogUtils.logBusiness(module, clientIp, "[%s] 请求开始, 参数: %s", action, describeArgs(joinPoint));
        }

        try {
            Object result = joinPoint.proceed();
            LogUtils.logOperation(clientIp, module, action, "SUCCESS");
            monitor.end("执行成功");
            return result;
        } catch (Throwable e) {
            LogUtils.logBusinessError(module, clientIp, action + " 执行异常", e);
            monitor.end("执行失败: " + e.getMessage());
            throw e;
        } finally {
            if (ownsRequestId) {
                LogUtils.clearRequestContext();
            }
        }
    }

    private String describeArgs(ProceedingJoinPoint joinPoint) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : joinPoint.getArgs()) {
            if (arg != null && !isIgnored(arg)) {
                sb.append(arg).append(" ");
            }
        }
        return sb.toString().trim();
    }

    private boolean isIgnored(Object arg) {
        for (Class<?> clazz : IGNORED_CLASSES) {
            if (clazz.isInstance(arg)) return true;
        }
        return false;
    }
}
