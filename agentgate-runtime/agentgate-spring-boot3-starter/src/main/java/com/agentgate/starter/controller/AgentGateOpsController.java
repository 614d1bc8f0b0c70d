package com.agentgate.starter.controller;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.security.AuthorizationService;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.api.tool.ToolExecutionResult;
import com.agentgate.core.audit.AuditQuery;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.dispatch.ExecutionStats;
import com.agentgate.core.dispatch.ToolDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AgentGate 内置运维控制台
 * 路径前缀: /agentgate/ops
 */
@Slf4j
@RestController
@RequestMapping("/agentgate/ops")
@RequiredArgsConstructor
public class AgentGateOpsController {

    private final AuthorizationService authorizationService;
    // 未配置下游调用器时为 null
    private final ToolDispatcher dispatcher;
    // 关闭内存审计时为 null
    private final InMemoryAuditSink auditLog;

    /**
     * 全局执行统计
     */
    @GetMapping("/stats")
    public ExecutionStats stats() {
        return requireDispatcher().stats();
    }

    @GetMapping("/stats/{tool}")
    public ExecutionStats toolStats(@PathVariable("tool") String tool) {
        return requireDispatcher().toolStats(tool);
    }

    /**
     * 最近的执行结果，按完成顺序
     */
    @GetMapping("/executions")
    public List<ToolExecutionResult> executions(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        if (limit < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must not be negative");
        }
        return requireDispatcher().recentExecutions(limit);
    }

    /**
     * 清空执行历史
     */
    @DeleteMapping("/executions")
    public Map<String, Object> clearExecutions() {
        ToolDispatcher d = requireDispatcher();
        int cleared = d.history().size();
        d.clearHistory();
        log.info("Execution history cleared via ops console ({} entries)", cleared);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cleared", cleared);
        return body;
    }

    /**
     * 审计检索
     */
    @GetMapping("/audit")
    public List<AuditEvent> audit(@RequestParam(value = "userId", required = false) String userId,
                                  @RequestParam(value = "resourceType", required = false) String resourceType,
                                  @RequestParam(value = "decision", required = false) String decision,
                                  @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (auditLog == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "In-memory audit log is disabled");
        }
        AuditQuery.AuditQueryBuilder query = AuditQuery.builder().userId(userId).limit(limit);
        if (resourceType != null) {
            query.resourceType(ResourceKind.parse(resourceType).orElseThrow(() ->
                    new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown resource type: " + resourceType)));
        }
        if (decision != null) {
            query.decision(Decision.parse(decision).orElseThrow(() ->
                    new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown decision: " + decision)));
        }
        return auditLog.query(query.build());
    }

    /**
     * 角色可见的表或工具
     */
    @GetMapping("/personas/{persona}/resources")
    public Set<String> personaResources(@PathVariable("persona") String persona,
                                        @RequestParam(value = "kind", defaultValue = "table") String kind) {
        ResourceKind resourceKind = ResourceKind.parse(kind).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown resource kind: " + kind));
        return authorizationService.accessibleResources(persona, resourceKind);
    }

    private ToolDispatcher requireDispatcher() {
        if (dispatcher == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No ToolDispatcher configured");
        }
        return dispatcher;
    }
}
