package com.agentgate.core.config;

import com.agentgate.api.audit.AuditEvent;
import com.agentgate.api.audit.AuditSink;
import com.agentgate.api.security.Decision;
import com.agentgate.api.security.ResourceKind;
import com.agentgate.core.audit.AsyncAuditSink;
import com.agentgate.core.audit.CompositeAuditSink;
import com.agentgate.core.audit.InMemoryAuditSink;
import com.agentgate.core.audit.LoggingAuditSink;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AgentGateConfigTest {

    @Test
    void testDefaults() {
        AgentGateConfig config = AgentGateConfig.defaults();

        assertFalse(config.isAuditAsync());
        assertTrue(config.isAuditInMemory());
        assertEquals(1000, config.getAuditQueueCapacity());
        assertEquals(10, config.getDispatcher().getMaxWorkers());
        assertEquals(3, config.getDispatcher().getDefaultMaxRetries());
    }

    @Test
    void testSyncSinkWritesToMemory() {
        InMemoryAuditSink memory = new InMemoryAuditSink();
        AuditSink sink = AgentGateConfig.defaults().buildAuditSink(memory);

        assertInstanceOf(CompositeAuditSink.class, sink);
        sink.record(AuditEvent.builder()
                .timestamp(Instant.now())
                .userId("u")
                .resourceType(ResourceKind.TABLE)
                .resourceName("product")
                .action("read")
                .decision(Decision.ALLOW)
                .build());
        assertEquals(1, memory.size());
    }

    @Test
    void testLoggingOnlyWhenMemoryDisabled() {
        AgentGateConfig config = AgentGateConfig.builder().auditInMemory(false).build();

        assertInstanceOf(LoggingAuditSink.class, config.buildAuditSink(new InMemoryAuditSink()));
    }

    @Test
    void testAsyncWrapper() {
        AgentGateConfig config = AgentGateConfig.builder().auditAsync(true).auditQueueCapacity(8).build();

        AuditSink sink = config.buildAuditSink(null);

        assertInstanceOf(AsyncAuditSink.class, sink);
        ((AsyncAuditSink) sink).shutdown();
    }
}
