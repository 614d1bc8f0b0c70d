package com.agentgate.api.security;

import java.util.Optional;

/**
 * 鉴权/改写的判定结果
 */
public enum Decision {
    ALLOW,
    DENY,
    // 行级过滤已注入
    APPLIED;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<Decision> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Decision decision : values()) {
            if (decision.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }
}
