package com.agentgate.api.security;

/**
 * 访问类型枚举
 * 定义了鉴权时请求的操作类型，如读、写、执行。
 *
 * @author AgentGate
 */
public enum AccessType {
    READ,
    WRITE,
    EXECUTE; // 工具调用、存储过程等非读写语句

    /**
     * 审计日志中使用的小写标识
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
