package com.agentgate.api.tool;

/**
 * 工具执行状态
 * <p>
 * PENDING -> RUNNING -> {SUCCESS | TIMEOUT | FAILED}，
 * RETRYING 只存在于两次尝试之间，不会作为终态返回。
 * </p>
 */
public enum ToolExecutionStatus {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCESS,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == TIMEOUT;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
