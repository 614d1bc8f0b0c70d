package com.agentgate.api.tool;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * 工具执行请求 (Immutable)
 * <p>
 * timeout 与 maxRetries 为空时使用派发器默认值。
 * maxRetries 表示允许的最大尝试次数（包含第一次）。
 * </p>
 */
@Value
public class ToolExecutionRequest {

    String toolName;
    String targetIdentifier;
    Map<String, Object> inputData;
    Duration timeout;
    Integer maxRetries;
    Map<String, Object> metadata;

    @Builder
    private ToolExecutionRequest(@NonNull String toolName,
                                 String targetIdentifier,
                                 @Singular("input") Map<String, Object> inputData,
                                 Duration timeout,
                                 Integer maxRetries,
                                 @Singular("meta") Map<String, Object> metadata) {
        if (maxRetries != null && maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        this.toolName = toolName;
        // 未指定目标时沿用工具名
        this.targetIdentifier = targetIdentifier != null ? targetIdentifier : toolName;
        this.inputData = inputData;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.metadata = metadata;
    }
}
