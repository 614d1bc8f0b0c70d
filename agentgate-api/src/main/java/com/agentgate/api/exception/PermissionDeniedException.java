package com.agentgate.api.exception;

/**
 * 权限拒绝异常
 * 鉴权服务本身只返回判定结果；调用方需要异常风格时通过 AccessDecision#orThrow 获得。
 *
 * @author AgentGate
 */
public class PermissionDeniedException extends AgentGateException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
