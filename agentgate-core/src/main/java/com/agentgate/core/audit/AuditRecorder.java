package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 审计写入守卫
 * <p>
 * 所有判定路径都经由此类写审计：下游 sink 抛出的异常只在本地记录，
 * 不会传播给调用方，也不会改变已经做出的判定。
 * </p>
 */
@Slf4j
public final class AuditRecorder {

    private final AuditSink sink;

    public AuditRecorder(AuditSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void record(AuditEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            log.error("[AUDIT] Failed to write audit event: resource={}/{}, decision={}, user={}",
                    event.getResourceType(), event.getResourceName(), event.getDecision(), event.getUserId(), e);
        }
    }

    public AuditSink sink() {
        return sink;
    }
}
