package com.agentgate.core.kernel;

import com.agentgate.api.security.AccessDecision;

import java.util.List;

/**
 * 受控查询的结果
 *
 * @param allowed      是否放行
 * @param statusCode   200 / 403
 * @param reason       拒绝原因，放行时为 null
 * @param query        放行时为改写后的查询，拒绝时为 null
 * @param deniedTables 被拒绝的表（按出现顺序）
 */
public record GuardedQuery(boolean allowed, int statusCode, String reason, String query, List<String> deniedTables) {

    public GuardedQuery {
        deniedTables = deniedTables == null ? List.of() : List.copyOf(deniedTables);
    }

    public static GuardedQuery allowed(String query) {
        return new GuardedQuery(true, AccessDecision.STATUS_OK, null, query, List.of());
    }

    public static GuardedQuery denied(String reason, List<String> deniedTables) {
        return new GuardedQuery(false, AccessDecision.STATUS_FORBIDDEN, reason, null, deniedTables);
    }
}
