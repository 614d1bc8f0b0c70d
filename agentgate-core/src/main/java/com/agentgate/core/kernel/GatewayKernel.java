package com.agentgate.core.kernel;

import com.agentgate.api.context.UserContext;
import com.agentgate.api.security.AccessType;
import com.agentgate.api.security.AuthorizationService;
import com.agentgate.api.security.ResourceDescriptor;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.api.security.RowFilterRewriter;
import com.agentgate.api.tool.ToolExecutionRequest;
import com.agentgate.api.tool.ToolExecutionResult;
import com.agentgate.api.tool.ToolExecutionStatus;
import com.agentgate.core.dispatch.ToolDispatcher;
import com.agentgate.core.rewrite.SqlTableExtractor;
import com.agentgate.core.sql.SqlStatementClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 网关内核：统一的请求管线
 * <p>
 * 查询：分类 -> 提取表 -> 逐表鉴权 -> 行级过滤改写
 * 工具：逐个鉴权 -> 放行的请求并发派发 -> 拒绝结果按原下标回填
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class GatewayKernel {

    static final String REASON_TABLE_DENIED = "Access denied to table: ";
    static final String REASON_TOOL_DENIED = "Access denied to tool: ";

    private final AuthorizationService authorizationService;
    private final RowFilterRewriter rowFilterRewriter;
    private final SqlStatementClassifier classifier;
    private final ToolDispatcher dispatcher;

    /**
     * 受控查询
     *
     * @return 放行时携带改写后的查询；第一个被拒绝的表决定拒绝原因
     */
    public GuardedQuery guardQuery(UserContext ctx, String sql) {
        Objects.requireNonNull(ctx, "ctx");
        AccessType action = classifier.classify(sql);
        List<String> tables = SqlTableExtractor.extract(sql);

        Map<String, Boolean> decisions = authorizationService.authorizeBulk(ctx, ResourceKind.TABLE, tables, action);
        List<String> denied = new ArrayList<>();
        decisions.forEach((table, allowed) -> {
            if (!allowed) {
                denied.add(table);
            }
        });
        if (!denied.isEmpty()) {
            log.warn("Query denied for user [{}]: tables {}", ctx.effectiveUserId(), denied);
            return GuardedQuery.denied(REASON_TABLE_DENIED + denied.get(0), denied);
        }

        String rewritten = rowFilterRewriter.rewrite(ctx, sql);
        if (log.isDebugEnabled()) {
            log.debug("Kernel ingress: [{}] {} tables={} rewritten={}", action, ctx.effectiveUserId(), tables,
                    !Objects.equals(rewritten, sql));
        }
        return GuardedQuery.allowed(rewritten);
    }

    public List<ToolExecutionResult> dispatchAuthorized(UserContext ctx, List<ToolExecutionRequest> requests) {
        return dispatchAuthorized(ctx, requests, null);
    }

    /**
     * 受控派发
     *
     * @return 与入参一一对应；被拒绝的请求为 FAILED、attempts=0，且不进入执行历史
     */
    public List<ToolExecutionResult> dispatchAuthorized(UserContext ctx,
                                                        List<ToolExecutionRequest> requests,
                                                        Duration overallTimeout) {
        Objects.requireNonNull(ctx, "ctx");
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        if (dispatcher == null) {
            throw new IllegalStateException("No ToolDispatcher configured");
        }

        ToolExecutionResult[] results = new ToolExecutionResult[requests.size()];
        List<Integer> allowedIndexes = new ArrayList<>();
        List<ToolExecutionRequest> allowedRequests = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            ToolExecutionRequest request = requests.get(i);
            boolean allowed = authorizationService
                    .check(ctx, ResourceDescriptor.tool(request.getToolName()))
                    .isAllowed();
            if (allowed) {
                allowedIndexes.add(i);
                allowedRequests.add(request);
            } else {
                results[i] = new ToolExecutionResult(request.getToolName(), ToolExecutionStatus.FAILED, null,
                        REASON_TOOL_DENIED + request.getToolName(), 0, 0, request.getMetadata());
            }
        }

        if (!allowedRequests.isEmpty()) {
            List<ToolExecutionResult> dispatched = dispatcher.dispatchMany(allowedRequests, overallTimeout);
            for (int j = 0; j < dispatched.size(); j++) {
                results[allowedIndexes.get(j)] = dispatched.get(j);
            }
        }
        log.info("Dispatched {} of {} tools for user [{}]", allowedRequests.size(), requests.size(), ctx.effectiveUserId());
        return List.of(results);
    }
}
