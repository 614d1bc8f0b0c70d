package com.agentgate.api.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 工具执行结果快照 (Immutable)
 *
 * @param toolName        工具名
 * @param status          终态
 * @param result          成功时的下游返回
 * @param error           失败时最后一次错误信息
 * @param executionTimeMs 自第一次尝试开始的实际耗时
 * @param attempts        实际消耗的尝试次数
 * @param metadata        请求携带的元数据
 */
public record ToolExecutionResult(
        String toolName,
        ToolExecutionStatus status,
        Map<String, Object> result,
        String error,
        long executionTimeMs,
        int attempts,
        Map<String, Object> metadata) {

    public ToolExecutionResult {
        // 下游结果可能含 null 值，不能用 Map.copyOf
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isSuccess() {
        return status == ToolExecutionStatus.SUCCESS;
    }
}
