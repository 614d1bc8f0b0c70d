package com.agentgate.core.rewrite;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.context.UserContext;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.api.security.RowFilterRewriter;
import com.agentgate.core.audit.AuditRecorder;
import com.agentgate.core.policy.PolicyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 词法级行级过滤改写器
 * <p>
 * 注入策略：
 * 1. 查询已有 WHERE：在第一个 WHERE 之后拼接 "(条件) AND"
 * 2. 没有 WHERE：在第一个引用该表的 FROM/JOIN 子句之后拼接 "WHERE (条件)"
 * 按表的出现顺序，在逐步改写后的文本上依次应用。
 * </p>
 * 已知限制：不解析别名、子查询、CTE，第一个 WHERE 可能属于子查询。
 */
@Slf4j
public class LexicalRowFilterRewriter implements RowFilterRewriter {

    static final String AUDIT_RESOURCE_NAME = "sql_query";
    static final String AUDIT_ACTION = "row_level_security";
    private static final int AUDIT_QUERY_PREVIEW = 100;

    private static final Pattern WHERE_TOKEN = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    private final PolicyStore policyStore;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public LexicalRowFilterRewriter(PolicyStore policyStore, AuditSink auditSink) {
        this(policyStore, auditSink, Clock.systemUTC());
    }

    public LexicalRowFilterRewriter(PolicyStore policyStore, AuditSink auditSink, Clock clock) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
        this.auditRecorder = new AuditRecorder(auditSink);
        this.clock = clock;
    }

    @Override
    public String rewrite(UserContext ctx, String query) {
        if (query == null || !ctx.hasPersona()) {
            return query;
        }
        Optional<Persona> persona = Persona.parse(ctx.getPersona());
        if (persona.isEmpty()) {
            return query;
        }
        Map<String, String> rules = policyStore.rowFilters(persona.get());
        if (rules.isEmpty()) {
            return query;
        }

        String rewritten = query;
        List<String> applied = new ArrayList<>();
        for (String table : SqlTableExtractor.extract(query)) {
            String template = rules.get(table);
            if (template == null) {
                continue;
            }
            String predicate = template.replace(PolicyStore.USER_ID_PLACEHOLDER, quoteLiteral(ctx.effectiveUserId()));
            String next = inject(rewritten, table, predicate);
            if (!next.equals(rewritten)) {
                applied.add(table);
                log.info("Injected row filter for table [{}]: {}", table, predicate);
            }
            rewritten = next;
        }

        if (!rewritten.equals(query)) {
            audit(ctx, persona.get(), query, applied);
        }
        return rewritten;
    }

    /**
     * 单表注入
     */
    static String inject(String sql, String table, String predicate) {
        Matcher where = WHERE_TOKEN.matcher(sql);
        if (where.find()) {
            return sql.substring(0, where.end()) + " (" + predicate + ") AND" + sql.substring(where.end());
        }
        Matcher clause = SqlTableExtractor.clauseNaming(table).matcher(sql);
        if (clause.find()) {
            return sql.substring(0, clause.end()) + " WHERE (" + predicate + ")" + sql.substring(clause.end());
        }
        return sql;
    }

    // 模板中 {user_id} 位于单引号字面量内，用户标识中的单引号需要转义
    private static String quoteLiteral(String value) {
        return value.replace("'", "''");
    }

    private void audit(UserContext ctx, Persona persona, String original, List<String> tables) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_query", original.length() > AUDIT_QUERY_PREVIEW
                ? original.substring(0, AUDIT_QUERY_PREVIEW) : original);
        metadata.put("modified", true);
        metadata.put("tables", List.copyOf(tables));

        auditRecorder.record(AuditEvent.builder()
                .timestamp(clock.instant())
                .userId(ctx.effectiveUserId())
                .resourceType(ResourceKind.QUERY)
                .resourceName(AUDIT_RESOURCE_NAME)
                .action(AUDIT_ACTION)
                .decision(Decision.APPLIED)
                .reason("row filters applied for persona " + persona.id())
                .persona(ctx.getPersona())
                .groups(ctx.getGroups() == null ? Set.of() : ctx.getGroups())
                .sessionId(ctx.getSessionId())
                .metadata(metadata)
                .build());
    }
}
