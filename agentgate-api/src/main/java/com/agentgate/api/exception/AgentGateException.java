package com.agentgate.api.exception;

/**
 * AgentGate 基础异常
 *
 * @author AgentGate
 */
public class AgentGateException extends RuntimeException {

    public AgentGateException(String message) {
        super(message);
    }

    public AgentGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
