package com.agentgate.api.audit;

import com.agentgate.api.security.Decision;
import com.agentgate.api.security.ResourceKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * 审计事件 (Immutable)
 * 字段与外部审计日志的结构化记录一一对应。
 */
@Value
@Builder
public class AuditEvent {
    Instant timestamp;
    String userId;
    ResourceKind resourceType;
    String resourceName;
    String action;
    Decision decision;
    String reason;
    String persona;
    @Builder.Default
    Set<String> groups = Set.of();
    String sessionId;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
