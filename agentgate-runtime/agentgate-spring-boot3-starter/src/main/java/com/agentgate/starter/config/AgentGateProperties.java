package com.agentgate.starter.config;

import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.config.AgentGateConfig;
import com.agentgate.core.dispatch.DispatcherConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Setter
@Getter
@ConfigurationProperties(prefix = "agentgate")
public class AgentGateProperties {

    private boolean enabled = true;

    /**
     * Spring 资源路径，例如 classpath:policy/agentgate.yml 或 file:/etc/agentgate/policy.yml
     * 为空时使用 core 自带的默认策略
     */
    private String policyLocation;

    private Dispatcher dispatcher = new Dispatcher();

    private Audit audit = new Audit();

    @Setter
    @Getter
    public static class Dispatcher {
        private int maxWorkers = 10;
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int defaultMaxRetries = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);
        // 派发事件在独立线程上投递
        private boolean asyncEvents = false;
        private int eventQueueCapacity = 1000;
    }

    @Setter
    @Getter
    public static class Audit {
        // 独立线程异步写审计
        private boolean async = false;
        private int queueCapacity = 1000;
        // 保留内存审计日志，供 /agentgate/ops/audit 查询
        private boolean inMemory = true;
        // 内存审计日志容量，超出后淘汰最旧的事件
        private int inMemoryCapacity = InMemoryAuditSink.DEFAULT_CAPACITY;
    }

    /**
     * 转换为 Core 层配置
     */
    public AgentGateConfig toCoreConfig() {
        return AgentGateConfig.builder()
                .policyLocation(policyLocation)
                .auditAsync(audit.isAsync())
                .auditQueueCapacity(audit.getQueueCapacity())
                .auditInMemory(audit.isInMemory())
                .auditInMemoryCapacity(audit.getInMemoryCapacity())
                .dispatcher(DispatcherConfig.builder()
                        .maxWorkers(dispatcher.getMaxWorkers())
                        .defaultTimeout(dispatcher.getDefaultTimeout())
                        .defaultMaxRetries(dispatcher.getDefaultMaxRetries())
                        .baseBackoff(dispatcher.getBaseBackoff())
                        .asyncEvents(dispatcher.isAsyncEvents())
                        .eventQueueCapacity(dispatcher.getEventQueueCapacity())
                        .build())
                .build();
    }
}
