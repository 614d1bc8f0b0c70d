package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 组合审计输出，单个 sink 失败不影响其它 sink
 */
@Slf4j
public class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> delegates;

    public CompositeAuditSink(List<AuditSink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void record(AuditEvent event) {
        for (AuditSink delegate : delegates) {
            try {
                delegate.record(event);
            } catch (RuntimeException e) {
                log.error("[AUDIT] Sink {} failed: {}", delegate.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
