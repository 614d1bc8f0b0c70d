package com.agentgate.api.security;

import com.agentgate.api.context.UserContext;

/**
 * 行级过滤改写器
 * <p>
 * 将角色的行级过滤条件注入查询文本。接口保持窄小，
 * 以便日后替换为基于语法树的实现而不影响调用方。
 * </p>
 */
public interface RowFilterRewriter {

    /**
     * 改写查询文本。
     *
     * @param ctx   调用方上下文
     * @param query 原始查询
     * @return 注入过滤条件后的查询；没有适用规则时原样返回
     */
    String rewrite(UserContext ctx, String query);
}
