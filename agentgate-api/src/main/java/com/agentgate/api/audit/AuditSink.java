package com.agentgate.api.audit;

/**
 * 审计落地接口（只追加）
 * <p>
 * 调用即忘：实现可以抛出异常，但调用方必须吞掉并在本地记录，
 * 写入失败不能改变已经做出的判定。
 * </p>
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);
}
