package com.agentgate.api.security;

import java.util.Optional;

/**
 * 资源类型
 * <p>
 * TABLE 与 OPERATION 是策略中允许集合的维度；PERSONA 与 QUERY 只出现在审计事件里。
 * </p>
 */
public enum ResourceKind {
    TABLE("table"),
    OPERATION("tool"),
    PERSONA("persona"),
    QUERY("query");

    private final String wireName;

    ResourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 按外部名称或枚举名解析，忽略大小写
     */
    public static Optional<ResourceKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (ResourceKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
