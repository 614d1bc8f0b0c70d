package com.agentgate.api.tool;

import java.util.Map;

/**
 * 下游工具调用契约
 * <p>
 * 对核心而言是不透明的：输入结构化参数，返回结构化结果或抛出异常。
 * 返回结果中带有 "error" 键视为应用层失败。
 * </p>
 */
@FunctionalInterface
public interface ToolInvoker {

    /**
     * 应用层错误键
     */
    String ERROR_KEY = "error";

    /**
     * 调用下游工具
     *
     * @param targetIdentifier 下游目标标识，例如函数名
     * @param inputData        输入参数
     * @return 下游返回的结构化结果
     * @throws Exception 任意失败；{@link com.agentgate.api.exception.ToolTerminalFailureException} 表示不可重试
     */
    Map<String, Object> invoke(String targetIdentifier, Map<String, Object> inputData) throws Exception;
}
