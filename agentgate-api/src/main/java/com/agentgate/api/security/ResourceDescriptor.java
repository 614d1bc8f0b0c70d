package com.agentgate.api.security;

import java.util.Objects;

/**
 * 资源描述 (Immutable)
 *
 * @param kind   资源类型
 * @param name   资源名称，如表名或工具名；可能为空，由鉴权判定为拒绝
 * @param action 请求的访问类型
 */
public record ResourceDescriptor(ResourceKind kind, String name, AccessType action) {

    public ResourceDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(action, "action");
    }

    public static ResourceDescriptor table(String name, AccessType action) {
        return new ResourceDescriptor(ResourceKind.TABLE, name, action);
    }

    public static ResourceDescriptor tool(String name) {
        return new ResourceDescriptor(ResourceKind.OPERATION, name, AccessType.EXECUTE);
    }
}
