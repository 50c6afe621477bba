package org.policybot.exception;

/**
 * 错误分类。调用方按分类分支处理，而不是匹配异常信息字符串。
 */
public enum ErrorKind {
    /** 变更通知格式错误，直接拒绝 */
    CLASSIFICATION,
    /** webhook 签名校验失败 */
    SIGNATURE,
    /** 拉取文档内容失败（单文件范围） */
    FETCH,
    /** 向量生成失败（单文件范围） */
    EMBEDDING,
    /** 向量索引读写失败 */
    INDEX,
    /** 同步任务记录无法创建或更新，整次运行失败 */
    JOB_SETUP,
    /** 大模型调用失败 */
    MODEL,
    /** 会话锁获取失败 */
    SESSION,
    /** 请求参数不合法 */
    VALIDATION,
    /** 资源不存在 */
    NOT_FOUND
}
