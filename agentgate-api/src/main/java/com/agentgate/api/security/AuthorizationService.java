package com.agentgate.api.security;

import com.agentgate.api.context.UserContext;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Core 提供 - 鉴权服务
 * 负责判断某个角色能否访问表或工具，并为每一次判定记录审计。
 * <p>
 * 所有方法都不抛出异常：缺失角色、非法角色、未授权都以拒绝结果返回。
 * </p>
 *
 * @author AgentGate
 */
public interface AuthorizationService {

    /**
     * 判定单个资源的访问，并写入一条审计事件。
     *
     * @param ctx      调用方上下文
     * @param resource 资源描述
     * @return 判定结果
     */
    AccessDecision check(UserContext ctx, ResourceDescriptor resource);

    /**
     * 判定单个资源的访问。资源类型或访问类型缺失时按未给出资源处理。
     *
     * @return 允许访问返回 true
     */
    default boolean authorize(UserContext ctx, ResourceKind kind, String name, AccessType action) {
        ResourceDescriptor resource = kind == null || action == null ? null : new ResourceDescriptor(kind, name, action);
        return check(ctx, resource).isAllowed();
    }

    /**
     * 批量判定，每个资源各产生一条审计事件。
     *
     * @return 资源名到是否允许的映射，保持入参顺序
     */
    Map<String, Boolean> authorizeBulk(UserContext ctx, ResourceKind kind, Collection<String> names, AccessType action);

    /**
     * 判断用户是否属于该角色对应的用户组。
     *
     * @param ctx     调用方上下文
     * @param persona 申请使用的角色标识
     * @return 属于该组返回 true
     */
    boolean authorizePersona(UserContext ctx, String persona);

    /**
     * 查询角色可见的资源列表；角色无法解析时返回空集合。
     */
    Set<String> accessibleResources(String persona, ResourceKind kind);
}
