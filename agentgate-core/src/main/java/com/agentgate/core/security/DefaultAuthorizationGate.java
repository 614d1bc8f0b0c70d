package com.agentgate.core.security;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.context.UserContext;
import com.agentgate.api.security.AccessDecision;
import com.agentgate.api.security.AccessType;
import com.agentgate.api.security.AuthorizationService;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceDescriptor;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.core.audit.AuditRecorder;
import com.agentgate.core.policy.PolicyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 默认鉴权实现
 * 职责：按角色查策略表判定访问，每次判定写一条审计
 * <p>
 * 无状态（策略只读），可被多个请求并发调用；不缓存任何放行结果。
 * </p>
 */
@Slf4j
public class DefaultAuthorizationGate implements AuthorizationService {

    static final String REASON_NO_PERSONA = "no persona in user context";
    static final String REASON_INVALID_PERSONA = "invalid persona: ";
    static final String REASON_NO_RESOURCE = "missing resource name";
    static final String ACTION_PERSONA_ACCESS = "access";

    // 未携带上下文的调用方
    private static final UserContext ANONYMOUS = UserContext.builder().build();

    private final PolicyStore policyStore;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public DefaultAuthorizationGate(PolicyStore policyStore, AuditSink auditSink) {
        this(policyStore, auditSink, Clock.systemUTC());
    }

    public DefaultAuthorizationGate(PolicyStore policyStore, AuditSink auditSink, Clock clock) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.auditRecorder = new AuditRecorder(auditSink);
        this.clock = clock;
    }

    @Override
    public AccessDecision check(UserContext caller, ResourceDescriptor resource) {
        UserContext ctx = caller != null ? caller : ANONYMOUS;

        // 0. 缺失资源名：拒绝并审计
        if (resource == null || resource.name() == null || resource.name().isBlank()) {
            log.warn("DENY: user [{}] requested access without a resource name", ctx.effectiveUserId());
            return decide(ctx, resource, Decision.DENY, REASON_NO_RESOURCE);
        }

        // 1. 缺失角色：拒绝，但仍然审计
        if (!ctx.hasPersona()) {
            log.warn("DENY: user [{}] has no persona, resource {}/{}",
                    ctx.effectiveUserId(), resource.kind().wireName(), resource.name());
            return decide(ctx, resource, Decision.DENY, REASON_NO_PERSONA);
        }

        // 2. 边界解析：非法角色不抛异常，返回拒绝
        Optional<Persona> parsed = Persona.parse(ctx.getPersona());
        if (parsed.isEmpty()) {
            log.warn("DENY: user [{}] presented invalid persona [{}]", ctx.effectiveUserId(), ctx.getPersona());
            return decide(ctx, resource, Decision.DENY, REASON_INVALID_PERSONA + ctx.getPersona());
        }
        Persona persona = parsed.get();

        // 3. 查表鉴权
        boolean allowed = policyStore.isAllowed(persona, resource.kind(), resource.name());
        if (!allowed) {
            log.warn("DENY: persona [{}] tried to {} {} [{}] outside its allow list",
                    persona.id(), resource.action().wireName(), resource.kind().wireName(), resource.name());
            return decide(ctx, resource, Decision.DENY,
                    resource.kind().wireName() + " not in allowed list for " + persona.id());
        }
        return decide(ctx, resource, Decision.ALLOW, "persona " + persona.id() + " " + resource.kind().wireName() + " access");
    }

    @Override
    public Map<String, Boolean> authorizeBulk(UserContext ctx, ResourceKind kind, Collection<String> names, AccessType action) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (names == null) {
            return results;
        }
        for (String name : names) {
            ResourceDescriptor resource = kind == null || action == null ? null : new ResourceDescriptor(kind, name, action);
            results.put(name, check(ctx, resource).isAllowed());
        }
        return results;
    }

    @Override
    public boolean authorizePersona(UserContext caller, String persona) {
        UserContext ctx = caller != null ? caller : ANONYMOUS;
        ResourceDescriptor resource = new ResourceDescriptor(ResourceKind.PERSONA,
                persona == null ? "" : persona, AccessType.READ);
        Optional<Persona> parsed = Persona.parse(persona);
        if (parsed.isEmpty()) {
            record(ctx, resource, ACTION_PERSONA_ACCESS, Decision.DENY, REASON_INVALID_PERSONA + persona);
            return false;
        }
        String requiredGroup = policyStore.groupOf(parsed.get());
        boolean authorized = ctx.getGroups() != null && ctx.getGroups().contains(requiredGroup);
        record(ctx, resource, ACTION_PERSONA_ACCESS,
                authorized ? Decision.ALLOW : Decision.DENY,
                authorized ? "group membership: " + requiredGroup : "missing group: " + requiredGroup);
        return authorized;
    }

    @Override
    public Set<String> accessibleResources(String persona, ResourceKind kind) {
        return Persona.parse(persona)
                .map(p -> policyStore.allowedResources(p, kind))
                .orElse(Set.of());
    }

    private AccessDecision decide(UserContext ctx, ResourceDescriptor resource, Decision decision, String reason) {
        String action = resource == null ? null : resource.action().wireName();
        Instant now = record(ctx, resource, action, decision, reason);
        return AccessDecision.builder()
                .resource(resource)
                .decision(decision)
                .reason(reason)
                .timestamp(now)
                .persona(ctx.getPersona())
                .groups(ctx.getGroups() == null ? Set.of() : ctx.getGroups())
                .sessionId(ctx.getSessionId())
                .build();
    }

    private Instant record(UserContext ctx, ResourceDescriptor resource, String action, Decision decision, String reason) {
        Instant now = clock.instant();
        auditRecorder.record(AuditEvent.builder()
                .timestamp(now)
                .userId(ctx.effectiveUserId())
                .resourceType(resource == null ? null : resource.kind())
                .resourceName(resource == null ? null : resource.name())
                .action(action)
                .decision(decision)
                .reason(reason)
                .persona(ctx.getPersona())
                .groups(ctx.getGroups() == null ? Set.of() : ctx.getGroups())
                .sessionId(ctx.getSessionId())
                .build());
        return now;
    }
}
