package com.agentgate.api.security;

import com.agentgate.api.exception.PermissionDeniedException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * 单次鉴权的判定结果 (Immutable)
 * <p>
 * 每次调用 {@link AuthorizationService#check} 生成一个实例，同时写入审计。
 * 拒绝是返回值而不是异常，调用方无法因为异常路径而“默认放行”。
 * </p>
 */
@Value
@Builder
public class AccessDecision {

    public static final int STATUS_OK = 200;
    public static final int STATUS_FORBIDDEN = 403;

    // 调用方未给出资源时为 null
    ResourceDescriptor resource;
    @NonNull
    Decision decision;
    String reason;
    @NonNull
    Instant timestamp;
    // 原始角色字符串（可能无法解析）
    String persona;
    @Builder.Default
    Set<String> groups = Set.of();
    String sessionId;

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    /**
     * HTTP 语义的状态码：放行 200，拒绝 403
     */
    public int statusCode() {
        return isAllowed() ? STATUS_OK : STATUS_FORBIDDEN;
    }

    /**
     * 供偏好异常风格的调用方使用
     *
     * @throws PermissionDeniedException 判定为拒绝时
     */
    public AccessDecision orThrow() {
        if (!isAllowed()) {
            String target = resource == null ? "resource" : resource.kind().wireName() + " [" + resource.name() + "]";
            throw new PermissionDeniedException("Access denied to " + target + ": " + reason);
        }
        return this;
    }
}
