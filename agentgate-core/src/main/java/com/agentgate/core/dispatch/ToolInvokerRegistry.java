package com.agentgate.core.dispatch;

import com.agentgate.api.exception.ToolTerminalFailureException;
import com.agentgate.api.tool.ToolInvoker;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按目标标识路由的调用器注册表
 * 未注册的目标属于不可重试的失败。
 */
@Slf4j
public class ToolInvokerRegistry implements ToolInvoker {

    private final Map<String, ToolInvoker> invokers = new ConcurrentHashMap<>();

    public ToolInvokerRegistry register(String targetIdentifier, ToolInvoker invoker) {
        ToolInvoker previous = invokers.put(targetIdentifier, invoker);
        if (previous != null) {
            log.warn("Invoker for target [{}] replaced", targetIdentifier);
        }
        return this;
    }

    public void unregister(String targetIdentifier) {
        invokers.remove(targetIdentifier);
    }

    public Set<String> targets() {
        return Set.copyOf(invokers.keySet());
    }

    @Override
    public Map<String, Object> invoke(String targetIdentifier, Map<String, Object> inputData) throws Exception {
        ToolInvoker invoker = invokers.get(targetIdentifier);
        if (invoker == null) {
            throw new ToolTerminalFailureException("No invoker registered for target: " + targetIdentifier);
        }
        return invoker.invoke(targetIdentifier, inputData);
    }
}
