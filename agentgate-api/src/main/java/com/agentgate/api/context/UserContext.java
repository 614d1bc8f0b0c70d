package com.agentgate.api.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 调用方上下文 (Immutable)
 * <p>
 * 每个请求由认证层提供，核心逻辑只读不写。
 * persona 保留原始字符串，由鉴权层在边界处解析。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class UserContext {

    public static final String UNKNOWN_USER = "unknown";

    String userId;
    String persona;
    @Singular
    Set<String> groups;
    String sessionId;

    /**
     * 用于审计和过滤模板的用户标识，缺失时为 unknown
     */
    public String effectiveUserId() {
        return userId == null || userId.isBlank() ? UNKNOWN_USER : userId;
    }

    public boolean hasPersona() {
        return persona != null && !persona.isBlank();
    }
}
