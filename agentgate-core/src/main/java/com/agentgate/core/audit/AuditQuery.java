package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.ResourceKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 审计检索条件，未设置的条件不参与过滤
 */
@Value
@Builder
public class AuditQuery {

    public static final int DEFAULT_LIMIT = 100;

    String userId;
    ResourceKind resourceType;
    Decision decision;
    Instant from;
    Instant to;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public static AuditQuery all() {
        return AuditQuery.builder().limit(Integer.MAX_VALUE).build();
    }

    boolean matches(AuditEvent event) {
        if (userId != null && !userId.equals(event.getUserId())) return false;
        if (resourceType != null && resourceType != event.getResourceType()) return false;
        if (decision != null && decision != event.getDecision()) return false;
        if (from != null && event.getTimestamp().isBefore(from)) return false;
        if (to != null && event.getTimestamp().isAfter(to)) return false;
        return true;
    }
}
