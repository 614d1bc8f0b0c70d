package com.agentgate.core.audit;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.security.Decision;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于日志的审计输出
 * 拒绝记为 WARN，其余记为 INFO，方便日志系统按级别采集。
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    @Override
    public void record(AuditEvent event) {
        if (event.getDecision() == Decision.DENY) {
            log.warn("[AUDIT] Access {}: user={}, resource={}/{}, action={}, reason={}, persona={}, session={}",
                    event.getDecision().wireName(), event.getUserId(), wireName(event), event.getResourceName(),
                    event.getAction(), event.getReason(), event.getPersona(), event.getSessionId());
        } else {
            log.info("[AUDIT] Access {}: user={}, resource={}/{}, action={}, reason={}, persona={}, session={}",
                    event.getDecision().wireName(), event.getUserId(), wireName(event), event.getResourceName(),
                    event.getAction(), event.getReason(), event.getPersona(), event.getSessionId());
        }
    }

    private static String wireName(AuditEvent event) {
        return event.getResourceType() == null ? "-" : event.getResourceType().wireName();
    }
}
