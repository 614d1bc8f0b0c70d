package com.agentgate.api.exception;

/**
 * 策略配置非法（启动期）
 */
public class PolicyConfigurationException extends AgentGateException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
