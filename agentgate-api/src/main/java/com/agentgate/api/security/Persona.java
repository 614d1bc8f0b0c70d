package com.agentgate.api.security;

import java.util.Optional;

/**
 * 角色（Persona）枚举
 * <p>
 * 调用方携带的角色字符串只在系统边界解析一次，之后始终以枚举形式流转。
 * 无法解析的值由 {@link #parse(String)} 返回空，由调用方给出明确的拒绝结果。
 * </p>
 *
 * @author AgentGate
 */
public enum Persona {

    WAREHOUSE_MANAGER("warehouse_manager", "warehouse_managers"),
    FIELD_ENGINEER("field_engineer", "field_engineers"),
    PROCUREMENT_SPECIALIST("procurement_specialist", "procurement_specialists");

    private final String id;
    private final String defaultGroup;

    Persona(String id, String defaultGroup) {
        this.id = id;
        this.defaultGroup = defaultGroup;
    }

    /**
     * 配置与审计中使用的标识，例如 warehouse_manager
     */
    public String id() {
        return id;
    }

    /**
     * 目录服务中对应的默认用户组
     */
    public String defaultGroup() {
        return defaultGroup;
    }

    /**
     * 解析角色标识，忽略大小写与首尾空白；从不抛出异常。
     *
     * @param value 原始角色字符串，可为 null
     * @return 解析成功返回对应枚举，否则为空
     */
    public static Optional<Persona> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (Persona persona : values()) {
            if (persona.id.equalsIgnoreCase(normalized) || persona.name().equalsIgnoreCase(normalized)) {
                return Optional.of(persona);
            }
        }
        return Optional.empty();
    }
}
