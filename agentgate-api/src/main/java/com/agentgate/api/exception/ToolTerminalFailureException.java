package com.agentgate.api.exception;

/**
 * 下游工具不可重试的失败
 * 派发器收到此异常后立即以 FAILED 结束该请求，不再消耗剩余重试次数。
 */
public class ToolTerminalFailureException extends ToolInvocationException {

    public ToolTerminalFailureException(String message) {
        super(message);
    }

    public ToolTerminalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
