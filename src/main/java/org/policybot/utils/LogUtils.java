package org.policybot.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 日志工具类
 * 业务日志与性能日志使用独立的 logger，MDC 中携带请求、会话和同步任务标识
 */
public class LogUtils {

    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("org.policybot.business");

    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("org.policybot.performance");

    // MDC键名常量
    public static final String REQUEST_ID = "requestId";
    public static final String CHAT_ID = "chatId";
    public static final String JOB_ID = "jobId";
    public static final String OPERATION = "operation";

    private LogUtils() {
    }

    /**
     * 记录业务日志，subject 为会话 ID、任务 ID 或仓库标识
     */
    public static void logBusiness(String operation, String subject, String message, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[{}] [对象:{}] {}", operation, subject, formatMessage(message, args));
        } finally {
            MDC.remove(OPERATION);
        }
    }

    public static void logBusinessError(String operation, String subject, String message, Throwable throwable, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.error("[{}] [对象:{}] {}", operation, subject, formatMessage(message, args), throwable);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    public static void logPerformance(String operation, long duration, String details) {
        try {
            MDC.put(OPERATION, operation);
            PERFORMANCE_LOGGER.info("[性能] [{}] 耗时:{}ms {}", operation, duration, details);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录接口操作结果
     */
    public static void logOperation(String subject, String operation, String resource, String result) {
        try {
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[操作] [对象:{}] [操作:{}] [资源:{}] [结果:{}]", subject, operation, resource, result);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录同步任务进度
     */
    public static void logSync(String jobId, String stage, int processed, int total, String details) {
        try {
            MDC.put(JOB_ID, jobId);
            MDC.put(OPERATION, "SYNC_" + stage);
            BUSINESS_LOGGER.info("[同步] [任务:{}] [阶段:{}] [进度:{}/{}] {}", jobId, stage, processed, total, details);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录聊天日志
     */
    public static void logChat(String chatId, String messageType, int messageLength) {
        try {
            MDC.put(CHAT_ID, chatId);
            MDC.put(OPERATION, "CHAT");
            BUSINESS_LOGGER.info("[聊天] [会话:{}] [类型:{}] [长度:{}]", chatId, messageType, messageLength);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    public static void logSystemStart(String component, String status, String details) {
        BUSINESS_LOGGER.info("[系统启动] [组件:{}] [状态:{}] {}", component, status, details);
    }

    public static void logSystemError(String component, String error, Throwable throwable) {
        BUSINESS_LOGGER.error("[系统错误] [组件:{}] [错误:{}]", component, error, throwable);
    }

    /**
     * 设置请求上下文，空值不写入
     */
    public static void setRequestContext(String requestId, String chatId, String jobId) {
        if (requestId != null) {
            MDC.put(REQUEST_ID, requestId);
        }
        if (chatId != null) {
            MDC.put(CHAT_ID, chatId);
        }
        if (jobId != null) {
            MDC.put(JOB_ID, jobId);
        }
    }

    public static void clearRequestContext() {
        MDC.clear();
    }

    private static String formatMessage(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        try {
            return String.format(message, args);
        } catch (Exception e) {
            return message + " [格式化参数失败: " + e.getMessage() + "]";
        }
    }

    /**
     * 性能监控
     */
    public static class PerformanceMonitor {
        private final String operation;
        private final long startTime;

        public PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startTime = System.currentTimeMillis();
        }

        public long elapsed() {
            return System.currentTimeMillis() - startTime;
        }

        public void end() {
            end("");
        }

        public void end(String details) {
            logPerformance(operation, elapsed(), details);
        }
    }

    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }
}
