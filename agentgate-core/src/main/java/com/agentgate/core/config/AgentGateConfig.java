package com.agentgate.core.config;

import com.agentgate.api.audit.AuditSink;
import com.agentgate.core.audit.AsyncAuditSink;
import com.agentgate.core.audit.CompositeAuditSink;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.audit.LoggingAuditSink;
import com.agentgate.core.dispatch.DispatcherConfig;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * AgentGate Core 配置对象
 * <p>
 * 职责：作为 Core 层的配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 * 包含：
 * 1. 策略文件位置
 * 2. 审计输出
 * 3. 派发器参数
 */
@Data
@Builder
@ToString
public class AgentGateConfig {

    /**
     * 策略文件位置，为空时读取 classpath 下的 agentgate-policy.yml
     */
    private String policyLocation;

    // ================= 审计 =================

    /**
     * 是否异步写审计（独立单线程 + 有界队列）
     */
    @Builder.Default
    private boolean auditAsync = false;

    /**
     * 异步审计队列容量，满时丢弃
     */
    @Builder.Default
    private int auditQueueCapacity = 1000;

    /**
     * 是否在内存中保留审计事件以供查询
     */
    @Builder.Default
    private boolean auditInMemory = true;

    /**
     * 内存审计日志容量，超出后淘汰最旧的事件
     */
    @Builder.Default
    private int auditInMemoryCapacity = InMemoryAuditSink.DEFAULT_CAPACITY;

    // ================= 派发器 =================

    @Builder.Default
    private DispatcherConfig dispatcher = DispatcherConfig.defaults();

    public static AgentGateConfig defaults() {
        return AgentGateConfig.builder().build();
    }

    /**
     * 按配置组装审计输出：日志 + 可选内存日志，可选异步包装
     *
     * @param inMemory 内存审计日志，为 null 时不组合
     */
    public AuditSink buildAuditSink(InMemoryAuditSink inMemory) {
        List<AuditSink> sinks = new ArrayList<>();
        sinks.add(new LoggingAuditSink());
        if (auditInMemory && inMemory != null) {
            sinks.add(inMemory);
        }
        AuditSink sink = sinks.size() == 1 ? sinks.get(0) : new CompositeAuditSink(sinks);
        return auditAsync ? new AsyncAuditSink(sink, auditQueueCapacity) : sink;
    }
}
