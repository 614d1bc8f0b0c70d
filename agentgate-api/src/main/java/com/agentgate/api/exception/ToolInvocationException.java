package com.agentgate.api.exception;

/**
 * 下游工具调用失败（可重试）
 */
public class ToolInvocationException extends AgentGateException {

    public ToolInvocationException(String message) {
        super(message);
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
